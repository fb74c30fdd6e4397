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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.function.Function;

/** Implementation of {@link Fragment} for one graph of an {@link Arena}. */
final class GraphFragment<V, E> implements Fragment<V, E> {
  private final Arena<V, E> arena;
  private final int graph;

  GraphFragment(Arena<V, E> arena, int graph) {
    this.arena = requireNonNull(arena);
    this.graph = graph;
  }

  @Override
  public Operation<V, E> addOperation(
      int arity, List<E> outputWeights, V weight) {
    requireNonNull(weight, "weight");
    final int node = arena.addOperation(graph, arity, outputWeights, weight);
    return new Operation<>(arena, node);
  }

  @Override
  public Thunk<V, E> addThunk(List<E> boundWeights, List<E> outputWeights) {
    final int node = arena.addThunk(graph, boundWeights, outputWeights);
    return new Thunk<>(arena, node);
  }

  @Override
  public <R> R inThunk(
      Thunk<V, E> thunk, Function<Fragment<V, E>, R> function) {
    arena.checkMutable();
    checkArgument(
        thunk.arena == arena && thunk.entry().graph == graph,
        "thunk %s does not belong to this fragment",
        thunk);
    return function.apply(new GraphFragment<>(arena, thunk.interiorIndex()));
  }

  @Override
  public void link(OutPort<V, E> outPort, InPort<V, E> inPort) {
    checkArgument(outPort.arena == arena, "port from another hypergraph");
    checkArgument(inPort.arena == arena, "port from another hypergraph");
    arena.link(outPort.index, inPort.index);
  }

  @Override
  public List<InPort<V, E>> graphOutputs() {
    return Node.inPorts(arena, arena.graphs.get(graph).outputs);
  }
}

// End GraphFragment.java
