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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Hierarchical hypergraph ("string diagram").
 *
 * <p>Values flow along links from {@link OutPort output ports} to {@link
 * InPort input ports}. Nodes are {@link Operation operations} and {@link Thunk
 * thunks}; a thunk contains a graph of its own.
 *
 * <p>Created by {@link HypergraphBuilder#build()}; immutable, and therefore
 * safe to share between threads.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public final class Hypergraph<V, E> {
  private final Arena<V, E> arena;

  Hypergraph(Arena<V, E> arena) {
    this.arena = requireNonNull(arena);
  }

  /** Returns the top-level nodes, in topological order. */
  public List<Node<V, E>> nodes() {
    return Node.nodes(arena, arena.graphs.get(0).nodes);
  }

  /** Returns the inputs of the graph, in order. */
  public List<OutPort<V, E>> graphInputs() {
    return Node.outPorts(arena, arena.graphs.get(0).inputs);
  }

  /** Returns the outputs of the graph, in order. */
  public List<InPort<V, E>> graphOutputs() {
    return Node.inPorts(arena, arena.graphs.get(0).outputs);
  }

  /**
   * Returns every operation, including those inside thunks. Each node comes
   * before the interior of the thunks that follow it.
   */
  public List<Operation<V, E>> operations() {
    final ImmutableList.Builder<Operation<V, E>> b = ImmutableList.builder();
    forEachNode(
        nodes(),
        node -> {
          if (!node.isThunk()) {
            b.add((Operation<V, E>) node);
          }
        });
    return b.build();
  }

  /** Returns every thunk, outer thunks before the thunks they contain. */
  public List<Thunk<V, E>> thunks() {
    final ImmutableList.Builder<Thunk<V, E>> b = ImmutableList.builder();
    forEachNode(
        nodes(),
        node -> {
          if (node.isThunk()) {
            b.add((Thunk<V, E>) node);
          }
        });
    return b.build();
  }

  private static <V, E> void forEachNode(
      List<Node<V, E>> nodes, Consumer<Node<V, E>> consumer) {
    for (Node<V, E> node : nodes) {
      consumer.accept(node);
      if (node.isThunk()) {
        forEachNode(((Thunk<V, E>) node).nodes(), consumer);
      }
    }
  }

  /**
   * Returns a multi-line description of this hypergraph.
   *
   * <p>For example,
   *
   * <pre>{@code
   * graph(e0:a) {
   *   e1:x = plus(e0, e0)
   *   e3:thunk = thunk(e2:n) [e1] {
   *     e4:op = times(e2, e1)
   *     return e4
   *   }
   *   return e3
   * }
   * }</pre>
   *
   * <p>Output ports are named by their index, followed by their weight where
   * they are defined. The list in square brackets is a thunk's free inputs.
   */
  public String describe() {
    final StringBuilder b = new StringBuilder();
    b.append("graph(");
    definitions(b, graphInputs()).append(") {\n");
    describe(b, 1, nodes(), graphOutputs());
    return b.append("}\n").toString();
  }

  private static <V, E> void describe(
      StringBuilder b,
      int depth,
      List<Node<V, E>> nodes,
      List<InPort<V, E>> outputs) {
    final String indent = Strings.repeat("  ", depth);
    for (Node<V, E> node : nodes) {
      b.append(indent);
      definitions(b, node.outputs()).append(" = ");
      if (node.isThunk()) {
        final Thunk<V, E> thunk = (Thunk<V, E>) node;
        b.append("thunk(");
        definitions(b, thunk.boundInputs()).append(") ");
        b.append(thunk.freeInputs()).append(" {\n");
        describe(b, depth + 1, thunk.nodes(), thunk.graphOutputs());
        b.append(indent).append("}\n");
      } else {
        final Operation<V, E> operation = (Operation<V, E>) node;
        b.append(operation.weight()).append('(');
        references(b, operation.inputs()).append(")\n");
      }
    }
    b.append(indent).append("return ");
    references(b, outputs).append('\n');
  }

  private static StringBuilder definitions(
      StringBuilder b, List<? extends OutPort<?, ?>> ports) {
    for (int i = 0; i < ports.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      final OutPort<?, ?> port = ports.get(i);
      b.append(port);
      if (port.weight() != null) {
        b.append(':').append(port.weight());
      }
    }
    return b;
  }

  private static StringBuilder references(
      StringBuilder b, List<? extends InPort<?, ?>> ports) {
    for (int i = 0; i < ports.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(ports.get(i).link());
    }
    return b;
  }
}

// End Hypergraph.java
