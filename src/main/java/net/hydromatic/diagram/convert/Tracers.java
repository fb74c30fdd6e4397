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
package net.hydromatic.diagram.convert;

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.diagram.hypergraph.Hypergraph;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that writes a line to a writer for each event, then calls
   * the underlying tracer.
   */
  public static Tracer printTracer(Tracer tracer, PrintWriter w) {
    return new PrintTracer(tracer, w);
  }

  /**
   * Returns a tracer that performs the given action on the free variables of
   * the top-level expression, then calls the underlying tracer.
   */
  public static Tracer withOnFreeVariables(
      Tracer tracer, Consumer<Set<?>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFreeVariables(Set<?> variables) {
        consumer.accept(variables);
        super.onFreeVariables(variables);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the hypergraph, then
   * calls the underlying tracer.
   */
  public static Tracer withOnHypergraph(
      Tracer tracer, Consumer<Hypergraph<?, ?>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onHypergraph(Hypergraph<?, ?> hypergraph) {
        consumer.accept(hypergraph);
        super.onHypergraph(hypergraph);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on an exception, then
   * calls the underlying tracer.
   */
  public static Tracer withOnException(
      Tracer tracer, Consumer<RuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(RuntimeException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onFreeVariables(Set<?> variables) {}

    @Override
    public void onScope(int depth, Set<?> names) {}

    @Override
    public void onHypergraph(Hypergraph<?, ?> hypergraph) {}

    @Override
    public void onException(RuntimeException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onFreeVariables(Set<?> variables) {
      tracer.onFreeVariables(variables);
    }

    @Override
    public void onScope(int depth, Set<?> names) {
      tracer.onScope(depth, names);
    }

    @Override
    public void onHypergraph(Hypergraph<?, ?> hypergraph) {
      tracer.onHypergraph(hypergraph);
    }

    @Override
    public void onException(RuntimeException e) {
      tracer.onException(e);
    }
  }

  /**
   * Implementation of {@link Tracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer extends DelegatingTracer {
    private final PrintWriter w;

    PrintTracer(Tracer tracer, PrintWriter w) {
      super(tracer);
      this.w = requireNonNull(w);
    }

    private void print(String s) {
      w.println(s);
      w.flush();
    }

    @Override
    public void onFreeVariables(Set<?> variables) {
      print("free variables: " + variables);
      super.onFreeVariables(variables);
    }

    @Override
    public void onScope(int depth, Set<?> names) {
      print("processed binds at depth " + depth + ": " + names);
      super.onScope(depth, names);
    }

    @Override
    public void onHypergraph(Hypergraph<?, ?> hypergraph) {
      w.print(hypergraph.describe());
      w.flush();
      super.onHypergraph(hypergraph);
    }

    @Override
    public void onException(RuntimeException e) {
      print("error: " + e.getMessage());
      super.onException(e);
    }
  }
}

// End Tracers.java
