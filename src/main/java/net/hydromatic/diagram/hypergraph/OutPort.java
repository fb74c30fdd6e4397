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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Output port; the single production site of a value.
 *
 * <p>An output port is owned by an operation node, by a thunk node (its
 * result), or by no node at all: the inputs of the top-level graph and the
 * bound parameters of a thunk are interface ports.
 *
 * <p>A port is a handle: two instances are equal if they refer to the same
 * port of the same hypergraph.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public final class OutPort<V, E> {
  final Arena<V, E> arena;
  final int index;

  OutPort(Arena<V, E> arena, int index) {
    this.arena = requireNonNull(arena);
    this.index = index;
  }

  private Arena.OutPortEntry<E> entry() {
    return arena.outPorts.get(index);
  }

  /** Returns the weight of this port; may be null. */
  public @Nullable E weight() {
    return entry().weight;
  }

  /**
   * Returns the node that owns this port, or null if this is an interface
   * port.
   */
  public @Nullable Node<V, E> node() {
    final int node = entry().node;
    return node == Arena.NONE ? null : arena.node(node);
  }

  /** Returns the input ports linked to this port, in the order linked. */
  public List<InPort<V, E>> links() {
    final ImmutableList.Builder<InPort<V, E>> b = ImmutableList.builder();
    for (int inPort : entry().links) {
      b.add(new InPort<>(arena, inPort));
    }
    return b.build();
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof OutPort
            && arena == ((OutPort<?, ?>) o).arena
            && index == ((OutPort<?, ?>) o).index;
  }

  /** Returns the name of this port, "e" followed by its index. */
  @Override
  public String toString() {
    return "e" + index;
  }
}

// End OutPort.java
