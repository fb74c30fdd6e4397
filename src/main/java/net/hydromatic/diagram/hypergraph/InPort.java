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
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Input port; a consumption site, linked to at most one {@link OutPort}.
 *
 * <p>An input port is owned by an operation node, or by no node at all: the
 * outputs of the top-level graph and of a thunk's interior are interface
 * ports. Once the hypergraph is built, every input port is linked.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public final class InPort<V, E> {
  final Arena<V, E> arena;
  final int index;

  InPort(Arena<V, E> arena, int index) {
    this.arena = requireNonNull(arena);
    this.index = index;
  }

  private Arena.InPortEntry entry() {
    return arena.inPorts.get(index);
  }

  /**
   * Returns the node that owns this port, or null if this is an interface
   * port.
   */
  public @Nullable Node<V, E> node() {
    final int node = entry().node;
    return node == Arena.NONE ? null : arena.node(node);
  }

  /** Returns whether this port is linked to an output port. */
  public boolean isLinked() {
    return entry().link != Arena.NONE;
  }

  /**
   * Returns the output port this port is linked to.
   *
   * @throws IllegalStateException if this port is not linked
   */
  public OutPort<V, E> link() {
    final int link = entry().link;
    checkState(link != Arena.NONE, "port %s is not linked", this);
    return new OutPort<>(arena, link);
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof InPort
            && arena == ((InPort<?, ?>) o).arena
            && index == ((InPort<?, ?>) o).index;
  }

  /** Returns the name of this port, "i" followed by its index. */
  @Override
  public String toString() {
    return "i" + index;
  }
}

// End InPort.java
