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
package net.hydromatic.diagram.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>The tree is produced by a front end that has already resolved names; this
 * module never parses text. Every node class is generic over the operator
 * label type {@code O} and the variable type {@code V}, which the front end
 * supplies. Both must have value semantics ({@link Object#equals} and {@link
 * Object#hashCode}) and a useful {@link Object#toString}.
 */
public class Ast {
  private Ast() {}

  /**
   * Scope: bindings followed by the values the scope yields.
   *
   * <p>For example, "bind x = plus(a, b) in times(x, x)" has one binding and
   * one value. The bindings form a single recursive group: each of them, and
   * each value, may refer to any of them.
   */
  public static class Expr<O, V> extends AstNode<O, V> {
    public final List<Bind<O, V>> binds;
    public final List<Value<O, V>> values;

    Expr(List<Bind<O, V>> binds, List<Value<O, V>> values) {
      super(Op.EXPR);
      this.binds = ImmutableList.copyOf(binds);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      for (Bind<O, V> bind : binds) {
        bind.unparse(w).append(" in ");
      }
      return w.appendAll(values, ", ");
    }

    @Override
    public void accept(Visitor<O, V> visitor) {
      visitor.visit(this);
    }
  }

  /** Binding of a variable to a value, "bind x = value". */
  public static class Bind<O, V> extends AstNode<O, V> {
    public final V def;
    public final Value<O, V> value;

    Bind(V def, Value<O, V> value) {
      super(Op.BIND);
      this.def = requireNonNull(def);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return value.unparse(w.append("bind ").append(def).append(" = "));
    }

    @Override
    public void accept(Visitor<O, V> visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Argument of an operation; either a {@link Value} or a {@link Thunk}.
   */
  public abstract static class Arg<O, V> extends AstNode<O, V> {
    Arg(Op op) {
      super(op);
    }
  }

  /** Value; either a {@link Variable} or an {@link Operation}. */
  public abstract static class Value<O, V> extends Arg<O, V> {
    Value(Op op) {
      super(op);
    }
  }

  /** Reference to a variable. */
  public static class Variable<O, V> extends Value<O, V> {
    public final V name;

    Variable(V name) {
      super(Op.VARIABLE);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(name);
    }

    @Override
    public void accept(Visitor<O, V> visitor) {
      visitor.visit(this);
    }
  }

  /** Operator applied to zero or more arguments, "plus(a, b)". */
  public static class Operation<O, V> extends Value<O, V> {
    public final O label;
    public final List<Arg<O, V>> args;

    Operation(O label, List<Arg<O, V>> args) {
      super(Op.OPERATION);
      this.label = requireNonNull(label);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append(label);
      if (args.isEmpty()) {
        return w;
      }
      return w.append("(").appendAll(args, ", ").append(")");
    }

    @Override
    public void accept(Visitor<O, V> visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Nested region with formal parameters, "thunk(x, y) { body }".
   *
   * <p>The body is a scope of its own; its parameters are bound only inside
   * it. A well-formed thunk body yields exactly one value.
   */
  public static class Thunk<O, V> extends Arg<O, V> {
    public final List<V> params;
    public final Expr<O, V> body;

    Thunk(List<V> params, Expr<O, V> body) {
      super(Op.THUNK);
      this.params = ImmutableList.copyOf(params);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("thunk(");
      for (int i = 0; i < params.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.append(params.get(i));
      }
      return body.unparse(w.append(") { ")).append(" }");
    }

    @Override
    public void accept(Visitor<O, V> visitor) {
      visitor.visit(this);
    }
  }
}

// End Ast.java
