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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Storage for the ports, nodes and graphs of one hypergraph.
 *
 * <p>Every entity is allocated in a list and addressed by its index in that
 * list; a link is an index, and following it is a list lookup. Index -1 means
 * "none". The top-level graph has index 0.
 *
 * <p>An arena is mutable until {@link #freeze()} is called, and read-only
 * afterwards. It is not thread-safe while mutable.
 *
 * @param <V> Node weight type
 * @param <E> Edge (port) weight type
 */
final class Arena<V, E> {
  static final int NONE = -1;

  final List<OutPortEntry<E>> outPorts = new ArrayList<>();
  final List<InPortEntry> inPorts = new ArrayList<>();
  final List<NodeEntry<V>> nodes = new ArrayList<>();
  final List<GraphEntry> graphs = new ArrayList<>();

  private boolean frozen;

  Arena(List<E> inputWeights, int outputCount) {
    checkArgument(outputCount >= 0, "negative output count");
    final int graph = newGraph(NONE, NONE);
    graphs.get(graph).inputs = newOutPorts(inputWeights, NONE, graph);
    graphs.get(graph).outputs = newInPorts(outputCount, NONE, graph);
  }

  void freeze() {
    frozen = true;
  }

  void checkMutable() {
    checkState(!frozen, "hypergraph has already been built");
  }

  private int newGraph(int parent, int thunk) {
    graphs.add(new GraphEntry(parent, thunk));
    return graphs.size() - 1;
  }

  private int[] newOutPorts(List<E> weights, int node, int graph) {
    final int[] ports = new int[weights.size()];
    for (int i = 0; i < ports.length; i++) {
      outPorts.add(new OutPortEntry<>(weights.get(i), node, graph));
      ports[i] = outPorts.size() - 1;
    }
    return ports;
  }

  private int[] newInPorts(int count, int node, int graph) {
    final int[] ports = new int[count];
    for (int i = 0; i < count; i++) {
      inPorts.add(new InPortEntry(node, graph));
      ports[i] = inPorts.size() - 1;
    }
    return ports;
  }

  /** Allocates an operation node in a graph; returns its index. */
  int addOperation(int graph, int arity, List<E> outputWeights, V weight) {
    checkMutable();
    checkArgument(arity >= 0, "negative arity");
    final NodeEntry<V> entry = new NodeEntry<>(false, weight, graph);
    nodes.add(entry);
    final int node = nodes.size() - 1;
    entry.inputs = newInPorts(arity, node, graph);
    entry.outputs = newOutPorts(outputWeights, node, graph);
    graphs.get(graph).nodes.add(node);
    return node;
  }

  /**
   * Allocates a thunk node in a graph, together with its interior graph;
   * returns the index of the node.
   */
  int addThunk(int graph, List<E> boundWeights, List<E> outputWeights) {
    checkMutable();
    final NodeEntry<V> entry = new NodeEntry<>(true, null, graph);
    nodes.add(entry);
    final int node = nodes.size() - 1;
    final int interior = newGraph(graph, node);
    entry.interior = interior;
    entry.inputs = new int[0];
    graphs.get(interior).inputs = newOutPorts(boundWeights, NONE, interior);
    entry.outputs = newOutPorts(outputWeights, node, graph);
    graphs.get(interior).outputs =
        newInPorts(outputWeights.size(), NONE, interior);
    graphs.get(graph).nodes.add(node);
    return node;
  }

  /**
   * Links an output port to an input port.
   *
   * @throws HypergraphException.LinkException if the input port is already
   *     linked to a different output port
   * @throws HypergraphException.ThunkLinkException if the output port is not
   *     visible from the input port's graph
   */
  void link(int outPort, int inPort) {
    checkMutable();
    final OutPortEntry<E> out = outPorts.get(outPort);
    final InPortEntry in = inPorts.get(inPort);
    if (in.link == outPort) {
      return;
    }
    if (in.link != NONE) {
      throw new HypergraphException.LinkException(
          new OutPort<>(this, outPort),
          new InPort<>(this, inPort),
          new OutPort<>(this, in.link));
    }
    if (!isAncestorOrSelf(out.graph, in.graph)) {
      throw new HypergraphException.ThunkLinkException(
          new OutPort<>(this, outPort), new InPort<>(this, inPort));
    }
    in.link = outPort;
    out.links.add(inPort);
  }

  /** Returns whether graph {@code ancestor} is {@code graph} or encloses it. */
  boolean isAncestorOrSelf(int ancestor, int graph) {
    for (int g = graph; g != NONE; g = graphs.get(g).parent) {
      if (g == ancestor) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the node in {@code graph} that contains a port, given the port's
   * owning node and graph; or {@link #NONE} if the port belongs to
   * {@code graph} itself (an interface port) or lies outside it.
   */
  int nodeAtLevel(int node, int portGraph, int graph) {
    int n = node;
    for (int g = portGraph; g != graph; g = nodes.get(n).graph) {
      n = graphs.get(g).thunk;
      if (n == NONE) {
        return NONE;
      }
    }
    return n;
  }

  /** Returns the nodes at the same level that consume a node's outputs. */
  List<Integer> successors(int node) {
    final NodeEntry<V> entry = nodes.get(node);
    final ImmutableSet.Builder<Integer> b = ImmutableSet.builder();
    for (int outPort : entry.outputs) {
      for (int inPort : outPorts.get(outPort).links) {
        final InPortEntry in = inPorts.get(inPort);
        final int n = nodeAtLevel(in.node, in.graph, entry.graph);
        if (n != NONE) {
          b.add(n);
        }
      }
    }
    return b.build().asList();
  }

  /**
   * Returns the nodes at the same level that produce a node's inputs. For a
   * thunk, only valid after the free inputs have been computed.
   */
  List<Integer> predecessors(int node) {
    final NodeEntry<V> entry = nodes.get(node);
    final ImmutableSet.Builder<Integer> b = ImmutableSet.builder();
    for (int outPort : inputEdges(node)) {
      final OutPortEntry<E> out = outPorts.get(outPort);
      if (out.graph == entry.graph && out.node != NONE) {
        b.add(out.node);
      }
    }
    return b.build().asList();
  }

  /**
   * Returns the output ports that feed a node: for an operation, the ports
   * linked to its inputs; for a thunk, its free inputs.
   */
  List<Integer> inputEdges(int node) {
    final NodeEntry<V> entry = nodes.get(node);
    if (entry.thunk) {
      checkState(entry.freeInputs != null, "free inputs not yet computed");
      return Ints.asList(entry.freeInputs);
    }
    final List<Integer> list = new ArrayList<>();
    for (int inPort : entry.inputs) {
      final int link = inPorts.get(inPort).link;
      if (link != NONE) {
        list.add(link);
      }
    }
    return list;
  }

  /** Returns a handle to a node. */
  Node<V, E> node(int node) {
    return nodes.get(node).thunk
        ? new Thunk<>(this, node)
        : new Operation<>(this, node);
  }

  /** Output port. */
  static class OutPortEntry<E> {
    final @Nullable E weight;
    final int node;
    final int graph;
    final List<Integer> links = new ArrayList<>();

    OutPortEntry(@Nullable E weight, int node, int graph) {
      this.weight = weight;
      this.node = node;
      this.graph = graph;
    }
  }

  /** Input port. */
  static class InPortEntry {
    final int node;
    final int graph;
    int link = NONE;

    InPortEntry(int node, int graph) {
      this.node = node;
      this.graph = graph;
    }
  }

  /** Operation or thunk node. */
  static class NodeEntry<V> {
    final boolean thunk;
    final @Nullable V weight;
    final int graph;
    int[] inputs;
    int[] outputs;
    int interior = NONE;
    int @Nullable [] freeInputs;

    NodeEntry(boolean thunk, @Nullable V weight, int graph) {
      this.thunk = thunk;
      this.weight = weight;
      this.graph = graph;
    }
  }

  /** Top-level graph or thunk interior. */
  static class GraphEntry {
    final int parent;
    final int thunk;
    final List<Integer> nodes = new ArrayList<>();
    int[] inputs;
    int[] outputs;

    GraphEntry(int parent, int thunk) {
      this.parent = parent;
      this.thunk = thunk;
    }
  }
}

// End Arena.java
