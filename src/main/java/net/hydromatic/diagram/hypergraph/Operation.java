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

import java.util.List;

/**
 * Operation node; a leaf computation with ordered arguments and results.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public final class Operation<V, E> extends Node<V, E> {
  Operation(Arena<V, E> arena, int index) {
    super(arena, index);
  }

  @Override
  public boolean isThunk() {
    return false;
  }

  /** Returns the operator label. */
  public V weight() {
    return requireNonNull(entry().weight);
  }

  /** Returns the input ports (arguments) of this operation, in order. */
  public List<InPort<V, E>> inputs() {
    return inPorts(arena, entry().inputs);
  }

  @Override
  public String toString() {
    return "Operation(" + weight() + ")";
  }
}

// End Operation.java
