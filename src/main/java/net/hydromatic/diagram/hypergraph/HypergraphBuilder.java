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

import com.google.common.primitives.Ints;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds a {@link Hypergraph}.
 *
 * <p>Add nodes and links using the {@link Fragment} methods, populating the
 * interior of each thunk inside {@link #inThunk}, then call {@link #build()}.
 * A builder can be built only once; after that, it rejects all calls.
 *
 * <p>Not thread-safe.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
public class HypergraphBuilder<V, E> implements Fragment<V, E> {
  private final Arena<V, E> arena;
  private final Fragment<V, E> fragment;

  /**
   * Creates a builder.
   *
   * @param inputWeights Weights of the graph inputs, one per input
   * @param outputCount Number of graph outputs
   */
  public HypergraphBuilder(List<E> inputWeights, int outputCount) {
    this.arena = new Arena<>(inputWeights, outputCount);
    this.fragment = new GraphFragment<>(arena, 0);
  }

  /** Returns the inputs of the graph, in order. */
  public List<OutPort<V, E>> graphInputs() {
    return Node.outPorts(arena, arena.graphs.get(0).inputs);
  }

  @Override
  public List<InPort<V, E>> graphOutputs() {
    return fragment.graphOutputs();
  }

  @Override
  public Operation<V, E> addOperation(
      int arity, List<E> outputWeights, V weight) {
    return fragment.addOperation(arity, outputWeights, weight);
  }

  @Override
  public Thunk<V, E> addThunk(List<E> boundWeights, List<E> outputWeights) {
    return fragment.addThunk(boundWeights, outputWeights);
  }

  @Override
  public <R> R inThunk(
      Thunk<V, E> thunk, Function<Fragment<V, E>, R> function) {
    return fragment.inThunk(thunk, function);
  }

  @Override
  public void link(OutPort<V, E> outPort, InPort<V, E> inPort) {
    fragment.link(outPort, inPort);
  }

  /**
   * Validates the graph, derives the free inputs of each thunk, sorts each
   * node list topologically, and returns the frozen hypergraph.
   *
   * @throws HypergraphException.UninitializedInPortException if an input port
   *     is not linked
   * @throws HypergraphException.UninitializedOutPortException if an output
   *     port claims a link that is not reciprocated
   * @throws IllegalStateException if this builder has already been built
   */
  public Hypergraph<V, E> build() {
    arena.checkMutable();
    checkInPorts(0);
    checkOutPorts(0);
    deriveFreeInputs(0);
    sort(0);
    arena.freeze();
    return new Hypergraph<>(arena);
  }

  private void checkInPorts(int graph) {
    final Arena.GraphEntry g = arena.graphs.get(graph);
    for (int inPort : g.outputs) {
      checkInPort(inPort);
    }
    for (int node : g.nodes) {
      final Arena.NodeEntry<V> entry = arena.nodes.get(node);
      if (entry.thunk) {
        checkInPorts(entry.interior);
      } else {
        for (int inPort : entry.inputs) {
          checkInPort(inPort);
        }
      }
    }
  }

  private void checkInPort(int inPort) {
    if (arena.inPorts.get(inPort).link == Arena.NONE) {
      throw new HypergraphException.UninitializedInPortException(
          new InPort<>(arena, inPort));
    }
  }

  private void checkOutPorts(int graph) {
    final Arena.GraphEntry g = arena.graphs.get(graph);
    for (int outPort : g.inputs) {
      checkOutPort(outPort);
    }
    for (int node : g.nodes) {
      final Arena.NodeEntry<V> entry = arena.nodes.get(node);
      for (int outPort : entry.outputs) {
        checkOutPort(outPort);
      }
      if (entry.thunk) {
        checkOutPorts(entry.interior);
      }
    }
  }

  private void checkOutPort(int outPort) {
    for (int inPort : arena.outPorts.get(outPort).links) {
      if (inPort < 0
          || inPort >= arena.inPorts.size()
          || arena.inPorts.get(inPort).link != outPort) {
        throw new HypergraphException.UninitializedOutPortException(
            new OutPort<>(arena, outPort));
      }
    }
  }

  /** Derives the free inputs of every thunk in a graph, innermost first. */
  private void deriveFreeInputs(int graph) {
    for (int node : arena.graphs.get(graph).nodes) {
      final Arena.NodeEntry<V> entry = arena.nodes.get(node);
      if (entry.thunk) {
        deriveFreeInputs(entry.interior);
        entry.freeInputs = freeInputs(entry);
      }
    }
  }

  /**
   * Computes the free inputs of a thunk: output ports consumed by its
   * interior (including, for nested thunks, their free inputs) that are
   * produced neither by a node of the interior nor by a bound input.
   */
  private int[] freeInputs(Arena.NodeEntry<V> thunk) {
    final Arena.GraphEntry interior = arena.graphs.get(thunk.interior);
    final Set<Integer> nodes = new HashSet<>(interior.nodes);
    final Set<Integer> bound = new HashSet<>(Ints.asList(interior.inputs));
    final Set<Integer> free = new LinkedHashSet<>();
    final Predicate<Integer> isFree =
        outPort -> {
          final Arena.OutPortEntry<E> out = arena.outPorts.get(outPort);
          return out.node == Arena.NONE
              ? !bound.contains(outPort)
              : !nodes.contains(out.node);
        };
    for (int node : interior.nodes) {
      for (int outPort : arena.inputEdges(node)) {
        if (isFree.test(outPort)) {
          free.add(outPort);
        }
      }
    }
    for (int inPort : interior.outputs) {
      final int outPort = arena.inPorts.get(inPort).link;
      if (isFree.test(outPort)) {
        free.add(outPort);
      }
    }
    return Ints.toArray(free);
  }

  /** Sorts the nodes of a graph, and of every thunk in it, topologically. */
  private void sort(int graph) {
    final Arena.GraphEntry g = arena.graphs.get(graph);
    final List<Integer> sorted =
        TopologicalSort.sort(g.nodes, arena::successors);
    g.nodes.clear();
    g.nodes.addAll(sorted);
    for (int node : sorted) {
      final Arena.NodeEntry<V> entry = arena.nodes.get(node);
      if (entry.thunk) {
        sort(entry.interior);
      }
    }
  }
}

// End HypergraphBuilder.java
