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
package net.hydromatic.docprint.print;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("indentSpaces"), is(Prop.INDENT_SPACES));
    assertThat(Prop.lookup("INDENT_SPACES"), is(Prop.INDENT_SPACES));
    assertThat(Prop.lookup("unknownDoc"), is(Prop.UNKNOWN_DOC));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("lineWidth"));
    assertThat(e.getMessage(), is("property lineWidth not found"));
    assertThat(Prop.BY_CAMEL_NAME,
        is(ImmutableList.of(Prop.INDENT_SPACES, Prop.UNKNOWN_DOC)));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.INDENT_SPACES.intValue(map), is(4));
    assertThat(Prop.UNKNOWN_DOC.enumValue(map, Prop.UnknownDoc.class),
        is(Prop.UnknownDoc.FAIL));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT_SPACES.enumValue(map, Prop.UnknownDoc.class));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.INDENT_SPACES.set(map, 2);
    assertThat(Prop.INDENT_SPACES.intValue(map), is(2));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT_SPACES.set(map, "two"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT_SPACES.set(map, null));
    assertThat(Prop.INDENT_SPACES.get(map), is(2));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.UNKNOWN_DOC.setLenient(map, "Throw");
    assertThat(Prop.UNKNOWN_DOC.get(map), is(Prop.UnknownDoc.THROW));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.UNKNOWN_DOC.setLenient(map, "ignore"));
    assertThat(e.getMessage(), is("value must be one of: 'FAIL', 'THROW'"));

    Prop.INDENT_SPACES.setLenient(map, " 8 ");
    assertThat(Prop.INDENT_SPACES.intValue(map), is(8));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT_SPACES.setLenient(map, "eight"));
  }

  /** Properties can come from a {@link Properties}, for example a file. */
  @Test
  void testParseProperties() {
    final Properties properties = new Properties();
    properties.setProperty("indentSpaces", "2");
    properties.setProperty("unknownDoc", "fail");
    final Map<Prop, Object> map = Prop.parse(properties);
    assertThat(Prop.INDENT_SPACES.intValue(map), is(2));
    assertThat(Prop.UNKNOWN_DOC.enumValue(map, Prop.UnknownDoc.class),
        is(Prop.UnknownDoc.FAIL));
  }
}

// End PropTest.java
