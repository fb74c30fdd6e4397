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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.IMPLICIT_INPUTS.booleanValue(map), is(false));
    assertThat(
        Prop.INPUT_ORDER.enumValue(map, Prop.InputOrder.class),
        is(Prop.InputOrder.OCCURRENCE));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("implicitInputs"), is(Prop.IMPLICIT_INPUTS));
    assertThat(Prop.lookup("INPUT_ORDER"), is(Prop.INPUT_ORDER));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.IMPLICIT_INPUTS));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Prop.lookup("x"));
    assertThat(e.getMessage(), is("property x not found"));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.INPUT_ORDER.setLenient(map, "name");
    assertThat(
        Prop.INPUT_ORDER.enumValue(map, Prop.InputOrder.class),
        is(Prop.InputOrder.NAME));
    Prop.IMPLICIT_INPUTS.setLenient(map, "true");
    assertThat(Prop.IMPLICIT_INPUTS.booleanValue(map), is(true));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.INPUT_ORDER.setLenient(map, "random"));
    assertThat(
        e.getMessage(), is("value must be one of: 'OCCURRENCE', 'NAME'"));
  }

  @Test
  void testSetInvalid() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.IMPLICIT_INPUTS.set(map, 1));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.IMPLICIT_INPUTS.set(map, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.IMPLICIT_INPUTS.enumValue(map, Prop.InputOrder.class));

    // a misspelled boolean is an error, not false
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.IMPLICIT_INPUTS.setLenient(map, "ture"));
    assertThat(e.getMessage(), is("value must be one of: 'true', 'false'"));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.IMPLICIT_INPUTS.setLenient(map, "yes"));
    assertThat(map.containsKey(Prop.IMPLICIT_INPUTS), is(false));
    Prop.IMPLICIT_INPUTS.setLenient(map, "FALSE");
    assertThat(map.get(Prop.IMPLICIT_INPUTS), is(false));
  }
}

// End PropTest.java
