/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.diagram.convert;

import static com.google.common.base.Verify.verify;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.diagram.ast.Ast;
import net.hydromatic.diagram.hypergraph.Fragment;
import net.hydromatic.diagram.hypergraph.Hypergraph;
import net.hydromatic.diagram.hypergraph.HypergraphBuilder;
import net.hydromatic.diagram.hypergraph.HypergraphException;
import net.hydromatic.diagram.hypergraph.InPort;
import net.hydromatic.diagram.hypergraph.Operation;
import net.hydromatic.diagram.hypergraph.OutPort;
import net.hydromatic.diagram.hypergraph.Thunk;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts an expression into a hypergraph.
 *
 * <p>The conversion walks the tree once, top-down. Each scope (the top-level
 * expression, and the body of each thunk) has an {@link Environment} that
 * maps the names bound in the scope to the ports that define them, and keeps
 * a list of input ports waiting for a name to be defined. A use of a variable
 * is never linked immediately; it is resolved once all bindings of the scope
 * have been processed, which allows forward references and recursion. Uses
 * that the scope cannot resolve move to the enclosing scope.
 *
 * <p>Instances are immutable; the {@code with} methods create copies.
 */
public class Converter {
  private final Tracer tracer;
  private final ImmutableMap<Prop, Object> propMap;

  private Converter(Tracer tracer, Map<Prop, Object> propMap) {
    this.tracer = requireNonNull(tracer);
    this.propMap = ImmutableMap.copyOf(propMap);
  }

  /** Creates a converter with default properties and no tracing. */
  public static Converter create() {
    return new Converter(Tracers.empty(), ImmutableMap.of());
  }

  /** Returns a converter with a given tracer. */
  public Converter withTracer(Tracer tracer) {
    return new Converter(tracer, propMap);
  }

  /**
   * Returns a converter with a property set to a given value. The value may
   * be a string if the property's type is boolean or an enum.
   */
  public Converter withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.setLenient(map, value);
    return new Converter(tracer, map);
  }

  /** Converts an expression that has no inputs. */
  public <O, V> Hypergraph<O, Name<V>> convert(Ast.Expr<O, V> expr) {
    return convert(expr, ImmutableList.of());
  }

  /**
   * Converts an expression into a hypergraph whose inputs are the given
   * variables.
   *
   * @param expr Expression
   * @param inputs Variables provided by the caller; they become the graph's
   *     inputs, in this order
   * @throws ConvertException if the expression is not well-scoped
   * @throws HypergraphException if the resulting graph is not valid
   */
  public <O, V> Hypergraph<O, Name<V>> convert(
      Ast.Expr<O, V> expr, List<V> inputs) {
    try {
      return convert_(expr, inputs);
    } catch (RuntimeException e) {
      tracer.onException(e);
      throw e;
    }
  }

  private <O, V> Hypergraph<O, Name<V>> convert_(
      Ast.Expr<O, V> expr, List<V> inputs) {
    final FreeVars<O, V> freeVars = FreeVars.of(expr);
    final Set<V> free = freeVars.get(expr);
    tracer.onFreeVariables(free);

    final List<V> inputVars = new ArrayList<>(inputs);
    final List<V> undeclared = new ArrayList<>();
    for (V v : free) {
      if (!inputs.contains(v)) {
        undeclared.add(v);
      }
    }
    if (Prop.IMPLICIT_INPUTS.booleanValue(propMap)) {
      inputVars.addAll(
          sorted(
              undeclared,
              Prop.INPUT_ORDER.enumValue(propMap, Prop.InputOrder.class)));
    } else if (!undeclared.isEmpty()) {
      throw new ConvertException.UndefinedVariable(undeclared.get(0));
    }

    final HypergraphBuilder<O, Name<V>> builder =
        new HypergraphBuilder<>(
            Lists.transform(inputVars, Name::freeVar), expr.values.size());
    final Map<Thunk<O, Name<V>>, Ast.Thunk<O, V>> thunks = new HashMap<>();
    final Environment<O, V> env = new Environment<>(builder, 0, thunks);
    final List<OutPort<O, Name<V>>> graphInputs = builder.graphInputs();
    for (int i = 0; i < inputVars.size(); i++) {
      env.define(inputVars.get(i), graphInputs.get(i));
    }
    env.processExpr(expr);
    if (!env.inputs.isEmpty()) {
      throw new ConvertException.UndefinedVariable(env.inputs.get(0).var);
    }

    final Hypergraph<O, Name<V>> hypergraph = builder.build();
    for (Thunk<O, Name<V>> thunk : hypergraph.thunks()) {
      checkFreeInputs(thunk, freeVars.get(thunks.get(thunk)));
    }
    tracer.onHypergraph(hypergraph);
    return hypergraph;
  }

  private static <V> List<V> sorted(List<V> vars, Prop.InputOrder order) {
    switch (order) {
      case NAME:
        return Ordering.usingToString().immutableSortedCopy(vars);
      case OCCURRENCE:
      default:
        return vars;
    }
  }

  /**
   * Checks that the free inputs the builder derived for a thunk are the ports
   * of the free variables that the analyzer found.
   */
  private static <O, V> void checkFreeInputs(
      Thunk<O, Name<V>> thunk, Set<V> expected) {
    final ImmutableSet.Builder<V> b = ImmutableSet.builder();
    for (OutPort<O, Name<V>> outPort : thunk.freeInputs()) {
      final Name<V> name = requireNonNull(outPort.weight());
      b.add(requireNonNull(name.var()));
    }
    final ImmutableSet<V> actual = b.build();
    verify(
        actual.equals(expected),
        "free inputs %s of %s do not match free variables %s",
        actual,
        thunk,
        expected);
  }

  /** Input port waiting for a variable to be defined. */
  private static class Pending<O, V> {
    final InPort<O, Name<V>> inPort;
    final V var;

    Pending(InPort<O, Name<V>> inPort, V var) {
      this.inPort = requireNonNull(inPort);
      this.var = requireNonNull(var);
    }
  }

  /** Conversion state of one scope. */
  private class Environment<O, V> {
    final Fragment<O, Name<V>> fragment;
    final int depth;
    final Map<Thunk<O, Name<V>>, Ast.Thunk<O, V>> thunks;
    /** Uses of variables that have not been resolved yet. */
    final List<Pending<O, V>> inputs = new ArrayList<>();
    /** Variables bound in this scope, and the ports that define them. */
    final Map<V, OutPort<O, Name<V>>> outputs = new LinkedHashMap<>();

    Environment(
        Fragment<O, Name<V>> fragment,
        int depth,
        Map<Thunk<O, Name<V>>, Ast.Thunk<O, V>> thunks) {
      this.fragment = requireNonNull(fragment);
      this.depth = depth;
      this.thunks = requireNonNull(thunks);
    }

    /** Binds a variable in this scope. */
    void define(V var, OutPort<O, Name<V>> outPort) {
      final @Nullable OutPort<O, Name<V>> previous =
          outputs.putIfAbsent(var, outPort);
      if (previous != null) {
        throw new ConvertException.Shadowed(var);
      }
    }

    /**
     * Processes the values, then the bindings, of an expression, then links
     * every pending use that can now be resolved.
     */
    void processExpr(Ast.Expr<O, V> expr) {
      final List<InPort<O, Name<V>>> graphOutputs = fragment.graphOutputs();
      for (int i = 0; i < expr.values.size(); i++) {
        processValue(expr.values.get(i), graphOutputs.get(i));
      }
      for (Ast.Bind<O, V> bind : Lists.reverse(expr.binds)) {
        bindValue(bind.value, bind.def);
      }
      tracer.onScope(depth, outputs.keySet());

      // link up loops
      inputs.removeIf(
          pending -> {
            final OutPort<O, Name<V>> outPort = outputs.get(pending.var);
            if (outPort == null) {
              return false;
            }
            fragment.link(outPort, pending.inPort);
            return true;
          });
    }

    /** Processes a value whose result flows into {@code inPort}. */
    void processValue(Ast.Value<O, V> value, InPort<O, Name<V>> inPort) {
      switch (value.op) {
        case VARIABLE:
          final V name = ((Ast.Variable<O, V>) value).name;
          inputs.add(new Pending<>(inPort, name));
          break;
        case OPERATION:
          final OutPort<O, Name<V>> outPort =
              processOperation((Ast.Operation<O, V>) value, Name.op());
          fragment.link(outPort, inPort);
          break;
        default:
          throw new AssertionError("unexpected " + value.op);
      }
    }

    /** Processes a value whose result is bound to {@code def}. */
    void bindValue(Ast.Value<O, V> value, V def) {
      switch (value.op) {
        case VARIABLE:
          throw new ConvertException.Aliased(
              def, ((Ast.Variable<O, V>) value).name);
        case OPERATION:
          final OutPort<O, Name<V>> outPort =
              processOperation(
                  (Ast.Operation<O, V>) value, Name.boundVar(def));
          define(def, outPort);
          break;
        default:
          throw new AssertionError("unexpected " + value.op);
      }
    }

    /** Adds an operation node, processes its arguments, returns its output. */
    OutPort<O, Name<V>> processOperation(
        Ast.Operation<O, V> operation, Name<V> outputWeight) {
      final Operation<O, Name<V>> node =
          fragment.addOperation(
              operation.args.size(),
              ImmutableList.of(outputWeight),
              operation.label);
      final List<InPort<O, Name<V>>> ports = node.inputs();
      for (int i = 0; i < operation.args.size(); i++) {
        final Ast.Arg<O, V> arg = operation.args.get(i);
        if (arg instanceof Ast.Thunk) {
          processThunk((Ast.Thunk<O, V>) arg, ports.get(i));
        } else {
          processValue((Ast.Value<O, V>) arg, ports.get(i));
        }
      }
      final List<OutPort<O, Name<V>>> outputs = node.outputs();
      if (outputs.isEmpty()) {
        throw new ConvertException.NoOutputError(operation.label);
      }
      return outputs.get(0);
    }

    /**
     * Adds a thunk node, converts its body in a new scope, and links its
     * output to {@code inPort}. Uses that the body cannot resolve become
     * pending in this scope.
     */
    void processThunk(Ast.Thunk<O, V> thunk, InPort<O, Name<V>> inPort) {
      final int valueCount = thunk.body.values.size();
      if (valueCount != 1) {
        throw new ConvertException.ThunkOutputError(valueCount);
      }
      final Thunk<O, Name<V>> node =
          fragment.addThunk(
              Lists.transform(thunk.params, Name::boundVar),
              ImmutableList.of(Name.thunk()));
      thunks.put(node, thunk);

      final List<Pending<O, V>> pending =
          fragment.inThunk(
              node,
              interior -> {
                final Environment<O, V> env =
                    new Environment<>(interior, depth + 1, thunks);
                final List<OutPort<O, Name<V>>> params = node.boundInputs();
                for (int i = 0; i < thunk.params.size(); i++) {
                  env.define(thunk.params.get(i), params.get(i));
                }
                env.processExpr(thunk.body);
                return env.inputs;
              });
      inputs.addAll(pending);

      final List<OutPort<O, Name<V>>> outputs = node.outputs();
      if (outputs.isEmpty()) {
        throw new ConvertException.NoOutputError(Name.thunk());
      }
      fragment.link(outputs.get(0), inPort);
    }
  }
}

// End Converter.java
