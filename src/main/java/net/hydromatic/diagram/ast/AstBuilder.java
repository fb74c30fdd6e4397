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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a scope. */
  public <O, V> Ast.Expr<O, V> expr(
      List<Ast.Bind<O, V>> binds, List<Ast.Value<O, V>> values) {
    return new Ast.Expr<>(binds, values);
  }

  /** Creates a scope with no bindings and one value. */
  public <O, V> Ast.Expr<O, V> expr(Ast.Value<O, V> value) {
    return new Ast.Expr<>(ImmutableList.of(), ImmutableList.of(value));
  }

  /** Creates a scope with bindings and one value. */
  @SafeVarargs
  public final <O, V> Ast.Expr<O, V> let(
      Ast.Value<O, V> value, Ast.Bind<O, V>... binds) {
    return new Ast.Expr<>(Arrays.asList(binds), ImmutableList.of(value));
  }

  /** Creates a binding, "bind def = value". */
  public <O, V> Ast.Bind<O, V> bind(V def, Ast.Value<O, V> value) {
    return new Ast.Bind<>(def, value);
  }

  /** Creates a reference to a variable. */
  public <O, V> Ast.Variable<O, V> var(V name) {
    return new Ast.Variable<>(name);
  }

  /** Creates an operation. */
  public <O, V> Ast.Operation<O, V> op(O label, List<Ast.Arg<O, V>> args) {
    return new Ast.Operation<>(label, args);
  }

  /** Creates an operation. */
  @SafeVarargs
  public final <O, V> Ast.Operation<O, V> op(
      O label, Ast.Arg<O, V>... args) {
    return new Ast.Operation<>(label, Arrays.asList(args));
  }

  /** Creates a thunk. */
  public <O, V> Ast.Thunk<O, V> thunk(List<V> params, Ast.Expr<O, V> body) {
    return new Ast.Thunk<>(params, body);
  }

  /** Creates a thunk whose body is a single value. */
  public <O, V> Ast.Thunk<O, V> thunk(List<V> params, Ast.Value<O, V> value) {
    return new Ast.Thunk<>(params, expr(value));
  }
}

// End AstBuilder.java
