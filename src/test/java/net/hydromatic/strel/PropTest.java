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
package net.hydromatic.strel;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("FILE"), sameInstance(Prop.FILE));
    assertThat(Prop.lookup("file"), sameInstance(Prop.FILE));
    assertThat(Prop.lookup("maxUnroll"), sameInstance(Prop.MAX_UNROLL));
    assertThat(Prop.lookup("MAX_UNROLL"), sameInstance(Prop.MAX_UNROLL));
    final RuntimeException e =
        assertThrows(RuntimeException.class, () -> Prop.lookup("maxunroll"));
    assertThat(e.getMessage(), is("property maxunroll not found"));

    assertThat(
        Prop.BY_CAMEL_NAME, is(ImmutableList.of(Prop.FILE, Prop.MAX_UNROLL)));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.FILE.stringValue(map), is(""));
    assertThat(Prop.MAX_UNROLL.intValueOrNull(map), nullValue());
    assertThat(Prop.MAX_UNROLL.get(map), nullValue());

    final RuntimeException e =
        assertThrows(
            RuntimeException.class, () -> Prop.MAX_UNROLL.intValue(map));
    assertThat(e.getMessage(), containsString("no value for property"));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.FILE.set(map, "a.strel");
    Prop.MAX_UNROLL.set(map, 10);
    assertThat(Prop.FILE.stringValue(map), is("a.strel"));
    assertThat(Prop.MAX_UNROLL.intValue(map), is(10));
    assertThat(Prop.MAX_UNROLL.intValueOrNull(map), is(10));

    // Setting an optional property to null removes it
    Prop.MAX_UNROLL.set(map, null);
    assertThat(map.containsKey(Prop.MAX_UNROLL), is(false));

    // A required property cannot be unset
    RuntimeException e =
        assertThrows(RuntimeException.class, () -> Prop.FILE.set(map, null));
    assertThat(e.getMessage(), is("property is required"));

    e =
        assertThrows(
            RuntimeException.class, () -> Prop.MAX_UNROLL.set(map, "ten"));
    assertThat(e.getMessage(), containsString("must have type"));
  }

  @Test
  void testWrongAccessor() {
    final Map<Prop, Object> map = new HashMap<>();
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> Prop.FILE.intValue(map));
    assertThat(
        e.getMessage(), containsString("invalid type class java.lang.String"));
    assertThrows(
        IllegalArgumentException.class, () -> Prop.MAX_UNROLL.stringValue(map));
  }
}

// End PropTest.java
