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
package net.hydromatic.diagram.hypergraph;

import java.util.List;
import java.util.function.Function;

/**
 * Construction API for one graph: the top-level graph of a {@link
 * HypergraphBuilder}, or the interior of a thunk.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public interface Fragment<V, E> {
  /**
   * Adds an operation node with {@code arity} unlinked input ports and one
   * output port per element of {@code outputWeights}.
   *
   * <p>Unlinked input ports are not an error until {@link
   * HypergraphBuilder#build()}.
   */
  Operation<V, E> addOperation(int arity, List<E> outputWeights, V weight);

  /**
   * Adds a thunk node with one bound input per element of {@code
   * boundWeights} and one output per element of {@code outputWeights}. Its
   * interior is empty; populate it using {@link #inThunk}.
   */
  Thunk<V, E> addThunk(List<E> boundWeights, List<E> outputWeights);

  /**
   * Calls a function with a fragment for the interior of a thunk, and returns
   * what the function returns.
   *
   * @throws IllegalArgumentException if the thunk was not added to this
   *     fragment
   */
  <R> R inThunk(Thunk<V, E> thunk, Function<Fragment<V, E>, R> function);

  /**
   * Links an output port to an input port.
   *
   * <p>Linking a pair that is already linked does nothing.
   *
   * @throws HypergraphException.LinkException if {@code inPort} is already
   *     linked to a different output port
   * @throws HypergraphException.ThunkLinkException if {@code outPort} is not
   *     defined in the graph of {@code inPort} or in one of its enclosing
   *     graphs
   */
  void link(OutPort<V, E> outPort, InPort<V, E> inPort);

  /** Returns the output ports of this fragment's graph, in order. */
  List<InPort<V, E>> graphOutputs();
}

// End Fragment.java
