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

/**
 * An error occurred while constructing a hypergraph.
 *
 * <p>Errors are never recoverable: each indicates a defect in the caller or
 * in its input. {@link LinkException} and {@link ThunkLinkException} are
 * thrown by {@link Fragment#link}; {@link BuildException} and its
 * sub-classes by {@link HypergraphBuilder#build()}.
 */
public class HypergraphException extends RuntimeException {
  HypergraphException(String message) {
    super(message);
  }

  /** Attempt to link an input port that is already linked elsewhere. */
  public static class LinkException extends HypergraphException {
    public final OutPort<?, ?> outPort;
    public final InPort<?, ?> inPort;
    /** The output port that {@link #inPort} is already linked to. */
    public final OutPort<?, ?> existing;

    LinkException(
        OutPort<?, ?> outPort, InPort<?, ?> inPort, OutPort<?, ?> existing) {
      super(
          "Cannot link "
              + outPort
              + " to "
              + inPort
              + ": already linked to "
              + existing);
      this.outPort = requireNonNull(outPort);
      this.inPort = requireNonNull(inPort);
      this.existing = requireNonNull(existing);
    }
  }

  /**
   * Attempt to link an input port to an output port that is not visible from
   * the input port's graph.
   */
  public static class ThunkLinkException extends HypergraphException {
    public final OutPort<?, ?> outPort;
    public final InPort<?, ?> inPort;

    ThunkLinkException(OutPort<?, ?> outPort, InPort<?, ?> inPort) {
      super(
          "Tried to link "
              + outPort
              + " to "
              + inPort
              + " which does not live in the same thunk");
      this.outPort = requireNonNull(outPort);
      this.inPort = requireNonNull(inPort);
    }
  }

  /** Building hypergraph failed. */
  public abstract static class BuildException extends HypergraphException {
    BuildException(String message) {
      super("Building hypergraph failed: " + message);
    }
  }

  /** An input port is not linked to any output port. */
  public static class UninitializedInPortException extends BuildException {
    public final InPort<?, ?> inPort;

    UninitializedInPortException(InPort<?, ?> inPort) {
      super("InPort has uninitialized OutPort: " + inPort);
      this.inPort = requireNonNull(inPort);
    }
  }

  /**
   * An output port claims a link to an input port that is not live, or that
   * is linked to a different output port.
   */
  public static class UninitializedOutPortException extends BuildException {
    public final OutPort<?, ?> outPort;

    UninitializedOutPortException(OutPort<?, ?> outPort) {
      super("OutPort has uninitialized InPort: " + outPort);
      this.outPort = requireNonNull(outPort);
    }
  }
}

// End HypergraphException.java
