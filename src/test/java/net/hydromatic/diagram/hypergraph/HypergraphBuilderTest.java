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

import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link HypergraphBuilder} and {@link Hypergraph}. */
public class HypergraphBuilderTest {
  private static HypergraphBuilder<String, String> builder(
      int inputCount, int outputCount) {
    final List<String> weights = new ArrayList<>();
    for (int i = 0; i < inputCount; i++) {
      weights.add("in" + i);
    }
    return new HypergraphBuilder<>(weights, outputCount);
  }

  private static String labels(List<? extends Node<String, String>> nodes) {
    final List<String> labels = new ArrayList<>();
    for (Node<String, String> node : nodes) {
      labels.add(
          node.isThunk()
              ? "thunk"
              : ((Operation<String, String>) node).weight());
    }
    return labels.toString();
  }

  @Test
  void testUninitializedInPort() {
    final HypergraphBuilder<String, String> b = builder(0, 1);
    final Operation<String, String> neg =
        b.addOperation(1, ImmutableList.of("x"), "neg");
    b.link(neg.outputs().get(0), b.graphOutputs().get(0));
    assertThat(neg.inputs().get(0).isLinked(), is(false));
    assertThat(neg.inputs().get(0).node(), is(neg));
    assertThat(b.graphOutputs().get(0).isLinked(), is(true));
    assertThat(b.graphOutputs().get(0).node(), nullValue());
    final HypergraphException.UninitializedInPortException e =
        assertThrows(
            HypergraphException.UninitializedInPortException.class, b::build);
    assertThat(e.inPort, is(neg.inputs().get(0)));
    assertThat(
        e.getMessage(),
        is("Building hypergraph failed: InPort has uninitialized OutPort: i1"));
  }

  @Test
  void testUninitializedGraphOutput() {
    final HypergraphBuilder<String, String> b = builder(1, 2);
    b.link(b.graphInputs().get(0), b.graphOutputs().get(0));
    final HypergraphException.UninitializedInPortException e =
        assertThrows(
            HypergraphException.UninitializedInPortException.class, b::build);
    assertThat(e.inPort, is(b.graphOutputs().get(1)));
  }

  @Test
  void testLinkTwice() {
    final HypergraphBuilder<String, String> b = builder(2, 1);
    final InPort<String, String> out = b.graphOutputs().get(0);
    final OutPort<String, String> in0 = b.graphInputs().get(0);
    b.link(in0, out);

    // linking the same pair again does nothing
    b.link(in0, out);
    assertThat(in0.links(), hasSize(1));

    final HypergraphException.LinkException e =
        assertThrows(
            HypergraphException.LinkException.class,
            () -> b.link(b.graphInputs().get(1), out));
    assertThat(e.existing, is(in0));
    assertThat(
        e.getMessage(), is("Cannot link e1 to i0: already linked to e0"));
    assertThat(out.link(), is(in0));
  }

  /** Tests that a port inside a thunk cannot feed a port outside it. */
  @Test
  void testThunkLink() {
    final HypergraphBuilder<String, String> b = builder(0, 1);
    final Thunk<String, String> thunk =
        b.addThunk(ImmutableList.of("p"), ImmutableList.of("t"));
    final OutPort<String, String> param = thunk.boundInputs().get(0);
    final HypergraphException.ThunkLinkException e =
        assertThrows(
            HypergraphException.ThunkLinkException.class,
            () -> b.link(param, b.graphOutputs().get(0)));
    assertThat(e.outPort, is(param));

    final OutPort<String, String> inner =
        b.inThunk(
            thunk,
            f -> {
              final Operation<String, String> c =
                  f.addOperation(0, ImmutableList.of("c"), "c");
              return c.outputs().get(0);
            });
    assertThrows(
        HypergraphException.ThunkLinkException.class,
        () -> b.link(inner, b.graphOutputs().get(0)));
  }

  /** Tests that A feeds B feeds C is sorted A, B, C whatever the order. */
  @Test
  void testTopologicalOrder() {
    final HypergraphBuilder<String, String> b = builder(0, 1);
    final Operation<String, String> c =
        b.addOperation(1, ImmutableList.of("c"), "C");
    final Operation<String, String> bb =
        b.addOperation(1, ImmutableList.of("b"), "B");
    final Operation<String, String> a =
        b.addOperation(0, ImmutableList.of("a"), "A");
    b.link(a.outputs().get(0), bb.inputs().get(0));
    b.link(bb.outputs().get(0), c.inputs().get(0));
    b.link(c.outputs().get(0), b.graphOutputs().get(0));
    final Hypergraph<String, String> h = b.build();
    assertThat(labels(h.nodes()), is("[A, B, C]"));
    assertThat(labels(h.nodes().get(1).predecessors()), is("[A]"));
    assertThat(labels(h.nodes().get(1).successors()), is("[C]"));
  }

  /**
   * Tests that a node that consumes another node's output several times is
   * one successor, and successors keep the order they were added.
   */
  @Test
  void testSuccessorsDistinct() {
    final HypergraphBuilder<String, String> b = builder(0, 2);
    final Operation<String, String> a =
        b.addOperation(0, ImmutableList.of("a"), "A");
    final Operation<String, String> c =
        b.addOperation(3, ImmutableList.of("c"), "C");
    final Operation<String, String> d =
        b.addOperation(1, ImmutableList.of("d"), "D");
    for (InPort<String, String> inPort : c.inputs()) {
      b.link(a.outputs().get(0), inPort);
    }
    b.link(a.outputs().get(0), d.inputs().get(0));
    b.link(c.outputs().get(0), b.graphOutputs().get(0));
    b.link(d.outputs().get(0), b.graphOutputs().get(1));
    final Hypergraph<String, String> h = b.build();
    assertThat(labels(h.nodes().get(0).successors()), is("[C, D]"));
    assertThat(labels(h.nodes().get(1).predecessors()), is("[A]"));
  }

  /** Tests that nodes that are not connected keep the order they were added. */
  @Test
  void testStableOrder() {
    final HypergraphBuilder<String, String> b = builder(0, 3);
    for (String label : ImmutableList.of("X", "Y", "Z")) {
      final Operation<String, String> op =
          b.addOperation(0, ImmutableList.of(label), label);
      b.link(
          op.outputs().get(0),
          b.graphOutputs().get(label.charAt(0) - 'X'));
    }
    assertThat(labels(b.build().nodes()), is("[X, Y, Z]"));
  }

  /**
   * Tests a thunk that captures a graph input and a node outside it; the
   * captured ports become its free inputs, and the thunk is sorted after
   * the node.
   */
  @Test
  void testThunkFreeInputs() {
    final HypergraphBuilder<String, String> b = builder(1, 1);
    final OutPort<String, String> a = b.graphInputs().get(0);
    final Thunk<String, String> thunk =
        b.addThunk(ImmutableList.of("n"), ImmutableList.of("t"));
    final Operation<String, String> x =
        b.addOperation(2, ImmutableList.of("x"), "plus");
    b.link(a, x.inputs().get(0));
    b.link(a, x.inputs().get(1));
    b.inThunk(
        thunk,
        f -> {
          final Operation<String, String> times =
              f.addOperation(2, ImmutableList.of("y"), "times");
          f.link(thunk.boundInputs().get(0), times.inputs().get(0));
          f.link(x.outputs().get(0), times.inputs().get(1));
          f.link(times.outputs().get(0), f.graphOutputs().get(0));
          return times;
        });
    b.link(thunk.outputs().get(0), b.graphOutputs().get(0));
    final Hypergraph<String, String> h = b.build();

    assertThat(labels(h.nodes()), is("[plus, thunk]"));
    assertThat(h.thunks(), hasSize(1));
    assertThat(h.thunks().get(0).freeInputs(), hasToString("[e3]"));
    assertThat(h.operations(), hasSize(2));
    final String expected =
        "graph(e0:in0) {\n"
            + "  e3:x = plus(e0, e0)\n"
            + "  e2:t = thunk(e1:n) [e3] {\n"
            + "    e4:y = times(e1, e3)\n"
            + "    return e4\n"
            + "  }\n"
            + "  return e2\n"
            + "}\n";
    assertThat(h.describe(), is(expected));
  }

  /** Tests a thunk with two results, one of which is its parameter. */
  @Test
  void testThunkSeveralResults() {
    final HypergraphBuilder<String, String> b = builder(0, 2);
    final Thunk<String, String> thunk =
        b.addThunk(ImmutableList.of("p"), ImmutableList.of("t", "u"));
    assertThat(thunk.outputs(), hasSize(2));
    assertThat(thunk.graphOutputs(), hasSize(2));
    b.inThunk(
        thunk,
        f -> {
          final OutPort<String, String> p = thunk.boundInputs().get(0);
          final Operation<String, String> neg =
              f.addOperation(1, ImmutableList.of("y"), "neg");
          f.link(p, neg.inputs().get(0));
          f.link(neg.outputs().get(0), f.graphOutputs().get(0));
          f.link(p, f.graphOutputs().get(1));
          return neg;
        });
    b.link(thunk.outputs().get(0), b.graphOutputs().get(0));
    b.link(thunk.outputs().get(1), b.graphOutputs().get(1));
    final Hypergraph<String, String> h = b.build();

    assertThat(h.thunks().get(0).freeInputs(), hasSize(0));
    final String expected =
        "graph() {\n"
            + "  e1:t, e2:u = thunk(e0:p) [] {\n"
            + "    e3:y = neg(e0)\n"
            + "    return e3, e0\n"
            + "  }\n"
            + "  return e1, e2\n"
            + "}\n";
    assertThat(h.describe(), is(expected));
  }

  /** Tests that thunks that capture each other's outputs can be built. */
  @Test
  void testCycleThroughThunks() {
    final HypergraphBuilder<String, String> b = builder(0, 2);
    final Thunk<String, String> f =
        b.addThunk(ImmutableList.of(), ImmutableList.of("f"));
    final Thunk<String, String> g =
        b.addThunk(ImmutableList.of(), ImmutableList.of("g"));
    b.inThunk(
        f,
        fragment -> {
          fragment.link(g.outputs().get(0), fragment.graphOutputs().get(0));
          return null;
        });
    b.inThunk(
        g,
        fragment -> {
          fragment.link(f.outputs().get(0), fragment.graphOutputs().get(0));
          return null;
        });
    b.link(f.outputs().get(0), b.graphOutputs().get(0));
    b.link(g.outputs().get(0), b.graphOutputs().get(1));
    final Hypergraph<String, String> h = b.build();
    assertThat(h.thunks().get(0).freeInputs(), is(g.outputs()));
    assertThat(h.thunks().get(1).freeInputs(), is(f.outputs()));
    assertThat(labels(h.nodes().get(0).successors()), is("[thunk]"));
  }

  @Test
  void testBuildTwice() {
    final HypergraphBuilder<String, String> b = builder(1, 1);
    b.link(b.graphInputs().get(0), b.graphOutputs().get(0));
    b.build();
    assertThrows(IllegalStateException.class, b::build);
    assertThrows(
        IllegalStateException.class,
        () -> b.addOperation(0, ImmutableList.of(), "late"));
  }

  @Test
  void testFreeInputsBeforeBuild() {
    final HypergraphBuilder<String, String> b = builder(0, 0);
    final Thunk<String, String> thunk =
        b.addThunk(ImmutableList.of(), ImmutableList.of("t"));
    assertThrows(IllegalStateException.class, thunk::freeInputs);
  }

  @Test
  void testForeignPorts() {
    final HypergraphBuilder<String, String> b1 = builder(1, 1);
    final HypergraphBuilder<String, String> b2 = builder(1, 1);
    assertThrows(
        IllegalArgumentException.class,
        () -> b1.link(b2.graphInputs().get(0), b1.graphOutputs().get(0)));

    final Thunk<String, String> outer =
        b1.addThunk(ImmutableList.of(), ImmutableList.of("t"));
    final Thunk<String, String> inner =
        b1.inThunk(
            outer, f -> f.addThunk(ImmutableList.of(), ImmutableList.of("u")));
    assertThrows(
        IllegalArgumentException.class,
        () -> b1.inThunk(inner, f -> f));
  }
}

// End HypergraphBuilderTest.java
