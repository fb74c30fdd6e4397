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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Node of a hypergraph; either an {@link Operation} or a {@link Thunk}.
 *
 * <p>A node is a handle: two instances are equal if they refer to the same
 * node of the same hypergraph.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public abstract class Node<V, E> {
  final Arena<V, E> arena;
  final int index;

  Node(Arena<V, E> arena, int index) {
    this.arena = requireNonNull(arena);
    this.index = index;
  }

  final Arena.NodeEntry<V> entry() {
    return arena.nodes.get(index);
  }

  /** Returns whether this node is a {@link Thunk}. */
  public abstract boolean isThunk();

  /** Returns the output ports of this node, in order. */
  public List<OutPort<V, E>> outputs() {
    return outPorts(arena, entry().outputs);
  }

  /**
   * Returns the nodes in the same graph as this node that consume one or more
   * of its outputs. A consumer inside a thunk is represented by that thunk.
   */
  public List<Node<V, E>> successors() {
    return nodes(arena, arena.successors(index));
  }

  /**
   * Returns the nodes in the same graph as this node that produce one or more
   * of its inputs. For a thunk, the inputs are its free inputs, so this method
   * is only valid once the hypergraph is built.
   */
  public List<Node<V, E>> predecessors() {
    return nodes(arena, arena.predecessors(index));
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Node
            && arena == ((Node<?, ?>) o).arena
            && index == ((Node<?, ?>) o).index;
  }

  static <V, E> List<OutPort<V, E>> outPorts(Arena<V, E> arena, int[] ports) {
    final ImmutableList.Builder<OutPort<V, E>> b = ImmutableList.builder();
    for (int port : ports) {
      b.add(new OutPort<>(arena, port));
    }
    return b.build();
  }

  static <V, E> List<InPort<V, E>> inPorts(Arena<V, E> arena, int[] ports) {
    final ImmutableList.Builder<InPort<V, E>> b = ImmutableList.builder();
    for (int port : ports) {
      b.add(new InPort<>(arena, port));
    }
    return b.build();
  }

  static <V, E> List<Node<V, E>> nodes(
      Arena<V, E> arena, Iterable<Integer> nodes) {
    final ImmutableList.Builder<Node<V, E>> b = ImmutableList.builder();
    for (int node : nodes) {
      b.add(arena.node(node));
    }
    return b.build();
  }
}

// End Node.java
