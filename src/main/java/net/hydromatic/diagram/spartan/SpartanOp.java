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
package net.hydromatic.diagram.spartan;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Longs;
import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operator label of Spartan, a small functional language with references.
 *
 * <p>Each operator has a name, such as "plus", by which it is written and
 * searched for, and a symbol, such as "+", by which it is displayed. Literals
 * are operators too; their name and symbol are both the literal value.
 */
public final class SpartanOp {
  private static final ImmutableMap<String, SpartanOp> BY_NAME;

  static {
    final ImmutableMap.Builder<String, SpartanOp> b = ImmutableMap.builder();
    for (Kind kind : Kind.values()) {
      if (kind.symbol != null) {
        b.put(kind.lowerName(), new SpartanOp(kind, 0));
      }
    }
    b.put("true", new SpartanOp(Kind.BOOL, 1));
    b.put("false", new SpartanOp(Kind.BOOL, 0));
    BY_NAME = b.build();
  }

  public final Kind kind;
  /** Value of a literal; 1 or 0 for a boolean; 0 for other operators. */
  private final long value;

  private SpartanOp(Kind kind, long value) {
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  /** Returns the operator of a given kind, which must not be a literal. */
  public static SpartanOp of(Kind kind) {
    checkArgument(
        kind.symbol != null, "%s is a literal; use number or bool", kind);
    return requireNonNull(BY_NAME.get(kind.lowerName()));
  }

  /** Returns a natural-number literal. */
  public static SpartanOp number(long n) {
    checkArgument(n >= 0, "negative literal %s", n);
    return new SpartanOp(Kind.NUMBER, n);
  }

  /** Returns a boolean literal. */
  public static SpartanOp bool(boolean b) {
    return requireNonNull(BY_NAME.get(Boolean.toString(b)));
  }

  /**
   * Parses the name of an operator ("plus"), a boolean literal ("true") or a
   * natural-number literal ("42").
   *
   * @throws IllegalArgumentException if the string is none of those
   */
  public static SpartanOp of(String name) {
    final SpartanOp op = BY_NAME.get(name);
    if (op != null) {
      return op;
    }
    final @Nullable Long n = Longs.tryParse(name);
    if (n == null || n < 0 || name.startsWith("-")) {
      throw new IllegalArgumentException("unknown operator '" + name + "'");
    }
    return number(n);
  }

  /** Returns the name by which this operator is written, e.g. "plus". */
  public String name() {
    switch (kind) {
      case BOOL:
        return Boolean.toString(value != 0);
      case NUMBER:
        return Long.toString(value);
      default:
        return kind.lowerName();
    }
  }

  /** Returns the symbol by which this operator is displayed, e.g. "+". */
  public String symbol() {
    return kind.symbol != null ? kind.symbol : name();
  }

  /** Returns whether a search string matches this operator's name. */
  public boolean matches(String query) {
    return name().equals(query);
  }

  /** Returns the value of a boolean literal. */
  public boolean booleanValue() {
    checkArgument(kind == Kind.BOOL, "not a boolean literal: %s", this);
    return value != 0;
  }

  /** Returns the value of a number literal. */
  public long longValue() {
    checkArgument(kind == Kind.NUMBER, "not a number literal: %s", this);
    return value;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SpartanOp
            && kind == ((SpartanOp) o).kind
            && value == ((SpartanOp) o).value;
  }

  @Override
  public String toString() {
    return symbol();
  }

  /** Kind of operator. */
  public enum Kind {
    PLUS("+"),
    MINUS("-"),
    TIMES("×"),
    DIV("/"),
    REM("%"),
    AND("∧"),
    OR("∨"),
    NOT("¬"),
    IF("if"),
    EQ("="),
    NEQ("≠"),
    LT("<"),
    LEQ("≤"),
    GT(">"),
    GEQ("≥"),
    APP("@"),
    LAMBDA("λ"),
    ATOM("&"),
    DEREF("!"),
    ASSIGN(":="),
    TUPLE("()"),
    DETUPLE(")("),
    BOOL(null),
    NUMBER(null);

    /** Symbol, or null for a literal. */
    final @Nullable String symbol;

    Kind(@Nullable String symbol) {
      this.symbol = symbol;
    }

    String lowerName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}

// End SpartanOp.java
