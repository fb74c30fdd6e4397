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

import static net.hydromatic.diagram.convert.Sd.bind;
import static net.hydromatic.diagram.convert.Sd.expr;
import static net.hydromatic.diagram.convert.Sd.let;
import static net.hydromatic.diagram.convert.Sd.op;
import static net.hydromatic.diagram.convert.Sd.thunk;
import static net.hydromatic.diagram.convert.Sd.var;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.diagram.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link FreeVars}. */
public class FreeVarsTest {
  /**
   * Tests that a thunk that references "x" and "y" and binds "z" has free
   * variables "x" and "y".
   */
  @Test
  void testThunk() {
    final Ast.Thunk<String, String> thunk =
        thunk(
            ImmutableList.of("p"),
            let(
                op("plus", var("z"), var("y"), var("p")),
                bind("z", op("times", var("x"), var("x")))));
    final Ast.Expr<String, String> e = expr(op("lambda", thunk));
    final FreeVars<String, String> freeVars = FreeVars.of(e);
    assertThat(freeVars.get(thunk), hasToString("[x, y]"));
    assertThat(freeVars.get(thunk.body), hasToString("[x, y, p]"));
    assertThat(freeVars.get(e), hasToString("[x, y]"));
  }

  /** Tests that the bindings of a scope form one recursive group. */
  @Test
  void testRecursiveGroup() {
    final Ast.Expr<String, String> e =
        let(
            op("app", var("f"), var("a")),
            bind("f", op("lambda", thunk(ImmutableList.of(), var("g")))),
            bind("g", op("lambda", thunk(ImmutableList.of(), var("f")))));
    final FreeVars<String, String> freeVars = FreeVars.of(e);
    assertThat(freeVars.get(e), hasToString("[a]"));
    assertThat(freeVars.get(e.binds.get(0).value), hasToString("[g]"));
  }

  @Test
  void testClosed() {
    final Ast.Expr<String, String> e =
        let(var("x"), bind("x", op("1")));
    assertThat(FreeVars.of(e).get(e), empty());
  }

  /** Tests that every value, thunk and scope is analyzed once. */
  @Test
  void testMemoized() {
    final Ast.Operation<String, String> plus =
        op("plus", var("a"), var("b"));
    final Ast.Expr<String, String> e =
        expr(op("lambda", thunk(ImmutableList.of("a"), plus)));
    final FreeVars<String, String> freeVars = FreeVars.of(e);
    // 2 variables, "plus", scope of the thunk, thunk, "lambda", scope
    assertThat(freeVars.size(), is(7));
    assertThat(freeVars.get(plus), hasToString("[a, b]"));
    assertThat(freeVars.get(e), hasToString("[b]"));
  }

  @Test
  void testNotAnalyzed() {
    final Ast.Expr<String, String> e = expr(var("a"));
    final FreeVars<String, String> freeVars = FreeVars.of(e);
    assertThrows(IllegalArgumentException.class, () -> freeVars.get(var("a")));
  }
}

// End FreeVarsTest.java
