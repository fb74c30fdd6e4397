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

/**
 * Visits syntax trees.
 *
 * <p>The default implementation of each method visits the node's children, in
 * order; sub-classes override the methods for the nodes they care about.
 *
 * @param <O> Operator label type
 * @param <V> Variable type
 */
public class Visitor<O, V> {

  /** For use as a method reference. */
  protected <E extends AstNode<O, V>> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Ast.Expr<O, V> expr) {
    expr.binds.forEach(this::accept);
    expr.values.forEach(this::accept);
  }

  protected void visit(Ast.Bind<O, V> bind) {
    bind.value.accept(this);
  }

  protected void visit(Ast.Variable<O, V> variable) {}

  protected void visit(Ast.Operation<O, V> operation) {
    operation.args.forEach(this::accept);
  }

  protected void visit(Ast.Thunk<O, V> thunk) {
    thunk.body.accept(this);
  }
}

// End Visitor.java
