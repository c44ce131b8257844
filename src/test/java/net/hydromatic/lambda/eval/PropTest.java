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
package net.hydromatic.lambda.eval;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.STRATEGY.enumValue(map, Strategy.class),
        is(Strategy.CALL_BY_VALUE));
    assertThat(Prop.SHOW_STEPS.booleanValue(map), is(true));
    assertThat(Prop.SHOW_ALIASES.booleanValue(map), is(true));
    assertThat(Prop.CHECK_TYPES.booleanValue(map), is(false));
    assertThat(Prop.REQUIRE_CLOSED.booleanValue(map), is(false));
    assertThat(Prop.STEP_LIMIT.intValue(map), is(0));
    assertThat(Prop.DIRECTORY.fileValue(map),
        is(new File(System.getProperty("defs.path", "."))));
  }

  @Test
  void testNames() {
    final List<String> names =
        Prop.BY_CAMEL_NAME.stream()
            .map(p -> p.camelName)
            .collect(Collectors.toList());
    assertThat(names.toString(),
        is("[checkTypes, directory, requireClosed, showAliases, showSteps,"
            + " stepLimit, strategy]"));
    assertThat(Prop.lookup("stepLimit"), is(Prop.STEP_LIMIT));
    assertThat(Prop.lookup("STEP_LIMIT"), is(Prop.STEP_LIMIT));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("noSuch"));
    assertThat(e.getMessage(), is("property noSuch not found"));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.SHOW_STEPS.setLenient(map, "off");
    assertThat(Prop.SHOW_STEPS.booleanValue(map), is(false));
    Prop.SHOW_STEPS.setLenient(map, "TRUE");
    assertThat(Prop.SHOW_STEPS.booleanValue(map), is(true));
    Prop.STEP_LIMIT.setLenient(map, "100");
    assertThat(Prop.STEP_LIMIT.intValue(map), is(100));
    Prop.STRATEGY.setLenient(map, "normal-order");
    assertThat(Prop.STRATEGY.enumValue(map, Strategy.class),
        is(Strategy.NORMAL_ORDER));
    Prop.DIRECTORY.setLenient(map, "/tmp/libs");
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("/tmp/libs")));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.SHOW_STEPS.setLenient(map, "maybe"));
    assertThat(e.getMessage(),
        is("value for property showSteps must be true or false"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STEP_LIMIT.setLenient(map, "1.5"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STRATEGY.setLenient(map, "eager"));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.CHECK_TYPES.set(map, true);
    assertThat(Prop.CHECK_TYPES.booleanValue(map), is(true));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.CHECK_TYPES.set(map, "yes"));
    assertThat(e.getMessage(),
        is("value for property checkTypes must have type Boolean"));

    // Setting null restores the default.
    Prop.CHECK_TYPES.set(map, null);
    assertThat(Prop.CHECK_TYPES.booleanValue(map), is(false));

    Prop.STEP_LIMIT.set(map, 5);
    assertThat(Prop.STEP_LIMIT.remove(map), is((Object) 5));
    assertThat(Prop.STEP_LIMIT.remove(map), nullValue());

    // Asking for a value of the wrong type is an error.
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STEP_LIMIT.booleanValue(map));
  }
}

// End PropTest.java
