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

import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/**
 * Thunk node; a nested region such as a closure or loop body.
 *
 * <p>The interior of a thunk is a graph of its own. Its inputs are the
 * thunk's <em>bound</em> inputs (formal parameters); its outputs are linked
 * to the values the region yields. The thunk's own {@link #outputs()} live
 * in the enclosing graph.
 *
 * <p>Values the interior uses from enclosing graphs are the thunk's
 * <em>free</em> inputs. Nobody declares them; {@link HypergraphBuilder#build()}
 * derives them from the links that cross the boundary.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public final class Thunk<V, E> extends Node<V, E> {
  Thunk(Arena<V, E> arena, int index) {
    super(arena, index);
  }

  private Arena.GraphEntry interior() {
    return arena.graphs.get(entry().interior);
  }

  int interiorIndex() {
    return entry().interior;
  }

  @Override
  public boolean isThunk() {
    return true;
  }

  /** Returns the bound inputs (parameters) of this thunk, in order. */
  public List<OutPort<V, E>> boundInputs() {
    return outPorts(arena, interior().inputs);
  }

  /**
   * Returns the free inputs of this thunk: output ports defined outside the
   * thunk that its interior consumes, in order of first use.
   *
   * @throws IllegalStateException if the hypergraph is not built yet
   */
  public List<OutPort<V, E>> freeInputs() {
    final int[] freeInputs = entry().freeInputs;
    checkState(freeInputs != null, "free inputs not yet computed");
    return outPorts(arena, freeInputs);
  }

  /** Returns the output ports of the interior graph, in order. */
  public List<InPort<V, E>> graphOutputs() {
    return inPorts(arena, interior().outputs);
  }

  /**
   * Returns the nodes of the interior graph. Once the hypergraph is built,
   * they are in topological order; before that, in the order added.
   */
  public List<Node<V, E>> nodes() {
    return nodes(arena, interior().nodes);
  }

  @Override
  public String toString() {
    return "Thunk" + boundInputs();
  }
}

// End Thunk.java
