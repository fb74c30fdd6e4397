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

import static net.hydromatic.diagram.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.diagram.ast.Ast;
import net.hydromatic.diagram.convert.Converter;
import net.hydromatic.diagram.convert.Name;
import net.hydromatic.diagram.hypergraph.Hypergraph;
import org.junit.jupiter.api.Test;

/** Tests for {@link SpartanOp}. */
public class SpartanOpTest {
  @Test
  void testOf() {
    assertThat(SpartanOp.of("plus"), is(SpartanOp.of(SpartanOp.Kind.PLUS)));
    assertThat(SpartanOp.of("plus"), hasToString("+"));
    assertThat(SpartanOp.of("times"), hasToString("×"));
    assertThat(SpartanOp.of("assign"), hasToString(":="));
    assertThat(SpartanOp.of("detuple").symbol(), is(")("));
    assertThat(SpartanOp.of("lambda").name(), is("lambda"));
    assertThat(SpartanOp.of("true"), is(SpartanOp.bool(true)));
    assertThat(SpartanOp.of("false").booleanValue(), is(false));
    assertThat(SpartanOp.of("42"), is(SpartanOp.number(42)));
    assertThat(SpartanOp.of("42"), hasToString("42"));
    assertThat(SpartanOp.of("42").longValue(), is(42L));
  }

  @Test
  void testOfInvalid() {
    assertThrows(IllegalArgumentException.class, () -> SpartanOp.of("Plus"));
    assertThrows(IllegalArgumentException.class, () -> SpartanOp.of("-1"));
    assertThrows(IllegalArgumentException.class, () -> SpartanOp.of(""));
    assertThrows(IllegalArgumentException.class, () -> SpartanOp.number(-1));
    assertThrows(
        IllegalArgumentException.class,
        () -> SpartanOp.of(SpartanOp.Kind.NUMBER));
    assertThrows(
        IllegalArgumentException.class, () -> SpartanOp.of("plus").longValue());
  }

  @Test
  void testMatches() {
    assertThat(SpartanOp.of("neq").matches("neq"), is(true));
    assertThat(SpartanOp.of("neq").matches("≠"), is(false));
    assertThat(SpartanOp.number(7).matches("7"), is(true));
    assertThat(SpartanOp.bool(true).matches("true"), is(true));
  }

  /** Converts "bind x = 1 + 2 in if(x = 3, true, false)". */
  @Test
  void testConvert() {
    final Ast.Operation<SpartanOp, String> plus =
        ast.op(
            SpartanOp.of("plus"),
            ImmutableList.<Ast.Arg<SpartanOp, String>>of(
                ast.op(SpartanOp.number(1), ImmutableList.of()),
                ast.op(SpartanOp.number(2), ImmutableList.of())));
    final Ast.Operation<SpartanOp, String> eq =
        ast.op(
            SpartanOp.of("eq"),
            ImmutableList.<Ast.Arg<SpartanOp, String>>of(
                ast.var("x"), ast.op(SpartanOp.number(3), ImmutableList.of())));
    final Ast.Operation<SpartanOp, String> ifOp =
        ast.op(
            SpartanOp.of("if"),
            ImmutableList.<Ast.Arg<SpartanOp, String>>of(
                eq,
                ast.op(SpartanOp.bool(true), ImmutableList.of()),
                ast.op(SpartanOp.bool(false), ImmutableList.of())));
    final Ast.Expr<SpartanOp, String> expr =
        ast.expr(
            ImmutableList.of(ast.bind("x", plus)),
            ImmutableList.<Ast.Value<SpartanOp, String>>of(ifOp));
    assertThat(
        expr, hasToString("bind x = +(1, 2) in if(=(x, 3), true, false)"));

    final Hypergraph<SpartanOp, Name<String>> hypergraph =
        Converter.create().convert(expr);
    assertThat(hypergraph.operations(), hasSize(8));
    // literal "3" does not depend on "x"; it comes first
    assertThat(hypergraph.nodes().get(0), hasToString("Operation(3)"));
    assertThat(hypergraph.nodes().get(5), hasToString("Operation(+)"));
    assertThat(hypergraph.nodes().get(7), hasToString("Operation(if)"));
  }
}

// End SpartanOpTest.java
