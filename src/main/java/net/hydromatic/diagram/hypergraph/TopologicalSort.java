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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Orders the nodes of a graph so that producers come before consumers, using
 * Tarjan's strongly-connected-components algorithm.
 *
 * <p>Cycles are allowed. The members of a strongly-connected component are
 * emitted together, in their original order. Components are emitted in
 * reverse post-order. Roots and successors are visited in descending original
 * order, so that nodes that are not constrained relative to one another keep
 * their original order.
 *
 * <p>Successors that are not in the list being sorted are ignored.
 */
class TopologicalSort {
  private final Map<Integer, Integer> ordinals = new HashMap<>();
  private final Function<Integer, List<Integer>> successors;
  private final Map<Integer, Integer> indexes = new HashMap<>();
  private final Map<Integer, Integer> lowLinks = new HashMap<>();
  private final Deque<Integer> stack = new ArrayDeque<>();
  private final Set<Integer> onStack = new HashSet<>();
  private final List<List<Integer>> components = new ArrayList<>();

  private TopologicalSort(
      List<Integer> nodes, Function<Integer, List<Integer>> successors) {
    for (int node : nodes) {
      ordinals.put(node, ordinals.size());
    }
    this.successors = successors;
  }

  /** Sorts a list of nodes, given a function that returns successors. */
  static List<Integer> sort(
      List<Integer> nodes, Function<Integer, List<Integer>> successors) {
    final TopologicalSort sort = new TopologicalSort(nodes, successors);
    for (int node : Lists.reverse(nodes)) {
      if (!sort.indexes.containsKey(node)) {
        sort.strongConnect(node);
      }
    }
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    Lists.reverse(sort.components).forEach(b::addAll);
    return b.build();
  }

  /**
   * Visits every node reachable from {@code root}. Uses an explicit stack of
   * frames, so that long dependency chains do not exhaust the Java stack.
   */
  private void strongConnect(int root) {
    final Deque<Frame> frames = new ArrayDeque<>();
    frames.push(enter(root));
    while (!frames.isEmpty()) {
      final Frame frame = frames.peek();
      if (frame.successors.hasNext()) {
        final int successor = frame.successors.next();
        if (!indexes.containsKey(successor)) {
          frames.push(enter(successor));
        } else if (onStack.contains(successor)) {
          lowLinks.put(frame.node,
              Math.min(lowLinks.get(frame.node), indexes.get(successor)));
        }
        continue;
      }
      frames.pop();
      leave(frame.node);
      final Frame parent = frames.peek();
      if (parent != null) {
        lowLinks.put(parent.node,
            Math.min(lowLinks.get(parent.node), lowLinks.get(frame.node)));
      }
    }
  }

  /** Assigns an index to a node and creates a frame for its successors. */
  private Frame enter(int node) {
    final int index = indexes.size();
    indexes.put(node, index);
    lowLinks.put(node, index);
    stack.push(node);
    onStack.add(node);

    final List<Integer> list = new ArrayList<>();
    for (int successor : successors.apply(node)) {
      if (ordinals.containsKey(successor)) {
        list.add(successor);
      }
    }
    list.sort(Comparator.comparing(ordinals::get, Comparator.reverseOrder()));
    return new Frame(node, list.iterator());
  }

  /**
   * Called when all successors of a node have been visited; if the node is
   * the root of a component, pops the component.
   */
  private void leave(int node) {
    if (lowLinks.get(node).equals(indexes.get(node))) {
      final List<Integer> component = new ArrayList<>();
      int member;
      do {
        member = stack.pop();
        onStack.remove(member);
        component.add(member);
      } while (member != node);
      component.sort(Comparator.comparing(ordinals::get));
      components.add(component);
    }
  }

  /** A node whose successors are being visited. */
  private static class Frame {
    final int node;
    final Iterator<Integer> successors;

    Frame(int node, Iterator<Integer> successors) {
      this.node = node;
      this.successors = successors;
    }
  }
}

// End TopologicalSort.java
