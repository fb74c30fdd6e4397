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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Weight of a port in a hypergraph produced by {@link Converter}.
 *
 * @param <V> Variable type
 */
public final class Name<V> {
  @SuppressWarnings("rawtypes")
  private static final Name OP = new Name<>(Kind.OP, null);

  @SuppressWarnings("rawtypes")
  private static final Name THUNK = new Name<>(Kind.THUNK, null);

  public final Kind kind;
  private final @Nullable V var;

  private Name(Kind kind, @Nullable V var) {
    this.kind = requireNonNull(kind);
    this.var = var;
  }

  /** Returns the name of the anonymous output of an operation. */
  @SuppressWarnings("unchecked")
  public static <V> Name<V> op() {
    return (Name<V>) OP;
  }

  /** Returns the name of the output of a thunk. */
  @SuppressWarnings("unchecked")
  public static <V> Name<V> thunk() {
    return (Name<V>) THUNK;
  }

  /** Returns the name of a graph input that carries a free variable. */
  public static <V> Name<V> freeVar(V var) {
    return new Name<>(Kind.FREE_VAR, requireNonNull(var));
  }

  /** Returns the name of a port defined by a binding or a parameter. */
  public static <V> Name<V> boundVar(V var) {
    return new Name<>(Kind.BOUND_VAR, requireNonNull(var));
  }

  /** Returns the variable, or null if this name does not have one. */
  public @Nullable V var() {
    return var;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, var);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Name
            && kind == ((Name<?>) o).kind
            && Objects.equals(var, ((Name<?>) o).var);
  }

  @Override
  public String toString() {
    return var == null ? kind.label : var.toString();
  }

  /** Kind of name. */
  public enum Kind {
    OP("op"),
    THUNK("thunk"),
    FREE_VAR("free"),
    BOUND_VAR("bound");

    final String label;

    Kind(String label) {
      this.label = label;
    }
  }
}

// End Name.java
