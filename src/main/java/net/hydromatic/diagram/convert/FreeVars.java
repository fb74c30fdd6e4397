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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.diagram.ast.Ast;
import net.hydromatic.diagram.ast.AstNode;
import net.hydromatic.diagram.ast.Visitor;

/**
 * Finds free variables in an expression.
 *
 * <p>A variable is free in a node if the node mentions it but does not bind
 * it. The analysis runs once, bottom-up, over a whole tree, and remembers the
 * result for every expression, value and thunk in it, so that later lookups
 * are cheap.
 *
 * <p>The sets iterate in order of first occurrence (bindings before values,
 * left to right). Callers that need a different order must sort.
 *
 * @param <O> Operator label type
 * @param <V> Variable type
 */
public class FreeVars<O, V> extends Visitor<O, V> {
  private final Map<AstNode<O, V>, ImmutableSet<V>> map =
      new IdentityHashMap<>();

  private FreeVars() {}

  /** Analyzes an expression and all of its descendants. */
  public static <O, V> FreeVars<O, V> of(Ast.Expr<O, V> expr) {
    final FreeVars<O, V> freeVars = new FreeVars<>();
    expr.accept(freeVars);
    return freeVars;
  }

  /**
   * Returns the free variables of an expression, value or thunk that was
   * analyzed.
   *
   * @throws IllegalArgumentException if the node was not part of the analyzed
   *     tree, or is a binding
   */
  public Set<V> get(AstNode<O, V> node) {
    final ImmutableSet<V> set = map.get(node);
    checkArgument(set != null, "node was not analyzed: %s", node);
    return set;
  }

  @Override
  protected void visit(Ast.Variable<O, V> variable) {
    map.put(variable, ImmutableSet.of(variable.name));
  }

  @Override
  protected void visit(Ast.Operation<O, V> operation) {
    super.visit(operation);
    final ImmutableSet.Builder<V> b = ImmutableSet.builder();
    operation.args.forEach(arg -> b.addAll(get(arg)));
    map.put(operation, b.build());
  }

  @Override
  protected void visit(Ast.Thunk<O, V> thunk) {
    super.visit(thunk);
    map.put(thunk, minus(get(thunk.body), thunk.params));
  }

  @Override
  protected void visit(Ast.Expr<O, V> expr) {
    super.visit(expr);
    final ImmutableSet.Builder<V> b = ImmutableSet.builder();
    final ImmutableSet.Builder<V> defs = ImmutableSet.builder();
    for (Ast.Bind<O, V> bind : expr.binds) {
      b.addAll(get(bind.value));
      defs.add(bind.def);
    }
    expr.values.forEach(value -> b.addAll(get(value)));
    map.put(expr, minus(b.build(), defs.build()));
  }

  private static <V> ImmutableSet<V> minus(
      Set<V> set, Iterable<? extends V> bound) {
    final ImmutableSet<V> boundSet = ImmutableSet.copyOf(bound);
    final ImmutableSet.Builder<V> b = ImmutableSet.builder();
    for (V v : set) {
      if (!boundSet.contains(v)) {
        b.add(v);
      }
    }
    return b.build();
  }

  /** Returns the number of nodes analyzed. */
  int size() {
    return map.size();
  }
}

// End FreeVars.java
