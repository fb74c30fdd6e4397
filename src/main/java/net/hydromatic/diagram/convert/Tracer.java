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

import java.util.Set;
import net.hydromatic.diagram.hypergraph.Hypergraph;

/** Called on various events during conversion. */
public interface Tracer {
  /** Called with the free variables of the top-level expression. */
  void onFreeVariables(Set<?> variables);

  /**
   * Called when the bindings of a scope have been processed, with the names
   * visible in the scope without reference to an enclosing scope: the graph
   * inputs (at depth 0) or the thunk's parameters, followed by the names of
   * its bindings, last binding first. Depth 0 is the top-level scope, 1 is
   * the body of a thunk in it, and so forth.
   */
  void onScope(int depth, Set<?> names);

  /** Called with the hypergraph, once it has been built. */
  void onHypergraph(Hypergraph<?, ?> hypergraph);

  /**
   * Called with an exception thrown during conversion, just before it is
   * thrown to the caller.
   */
  void onException(RuntimeException e);
}

// End Tracer.java
