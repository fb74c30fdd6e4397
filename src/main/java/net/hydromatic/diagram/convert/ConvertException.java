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

/**
 * An error occurred while converting an expression to a hypergraph.
 *
 * <p>The conversion is abandoned; no partial graph is returned. Errors in the
 * graph itself are reported as {@link
 * net.hydromatic.diagram.hypergraph.HypergraphException}.
 */
public class ConvertException extends RuntimeException {
  ConvertException(String message) {
    super(message);
  }

  /** A variable is bound twice in the same scope. */
  public static class Shadowed extends ConvertException {
    public final Object var;

    Shadowed(Object var) {
      super("Attempted to shadow `" + var + "`");
      this.var = requireNonNull(var);
    }
  }

  /** A variable is bound to a bare variable, "bind x = y". */
  public static class Aliased extends ConvertException {
    public final Object var;
    public final Object target;

    Aliased(Object var, Object target) {
      super("Attempted to alias `" + var + "` to `" + target + "`");
      this.var = requireNonNull(var);
      this.target = requireNonNull(target);
    }
  }

  /** A variable is used but is not bound anywhere. */
  public static class UndefinedVariable extends ConvertException {
    public final Object var;

    UndefinedVariable(Object var) {
      super("Couldn't find location of variable `" + var + "`");
      this.var = requireNonNull(var);
    }
  }

  /** The body of a thunk does not yield exactly one value. */
  public static class ThunkOutputError extends ConvertException {
    ThunkOutputError(int count) {
      super("Thunks must have exactly one output; got " + count);
    }
  }

  /** An operation node has no output port. */
  public static class NoOutputError extends ConvertException {
    NoOutputError(Object label) {
      super("Operation `" + label + "` did not have output");
    }
  }
}

// End ConvertException.java
