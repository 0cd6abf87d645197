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
package net.hydromatic.strel.ast;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link DistanceInterval}. */
public class DistanceIntervalTest {
  private static void assertInvalid(Double start, Double end, String message) {
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> DistanceInterval.of(start, end));
    assertThat(e.getMessage(), containsString(message));
  }

  @Test
  void testDefaults() {
    final DistanceInterval i = DistanceInterval.of(null, null);
    assertThat(i.start, is(0d));
    assertThat(i.end, is(Double.POSITIVE_INFINITY));
    assertThat(i.isUnbounded(), is(true));
    assertThat(i, is(DistanceInterval.ALL));

    final DistanceInterval i2 = DistanceInterval.of(null, 3d);
    assertThat(i2.start, is(0d));
    assertThat(i2.end, is(3d));
    assertThat(i2.isUnbounded(), is(false));

    final DistanceInterval i3 = DistanceInterval.of(1.5, null);
    assertThat(i3.start, is(1.5));
    assertThat(i3.isUnbounded(), is(true));
  }

  @Test
  void testInvalid() {
    assertInvalid(1d, 1d, "Distance interval cannot have `start` >= `end`");
    assertInvalid(2d, 1d, "Distance interval cannot have `start` >= `end`");
    assertInvalid(-1d, 2d, "Distance cannot be less than 0");
    assertInvalid(null, -2d, "Distance cannot be less than 0");
    assertInvalid(Double.NaN, 2d, "Distance cannot be NaN");
    // end defaults to infinity, so an infinite start can never be valid
    assertInvalid(
        Double.POSITIVE_INFINITY,
        null,
        "Distance interval cannot have `start` >= `end`");
  }

  @Test
  void testToString() {
    assertThat(DistanceInterval.ALL, hasToString("[, inf]"));
    assertThat(DistanceInterval.of(0d, 2.5), hasToString("[, 2.5]"));
    assertThat(DistanceInterval.of(1d, 2d), hasToString("[1.0, 2.0]"));
    assertThat(DistanceInterval.of(1d, null), hasToString("[1.0, inf]"));
  }

  @Test
  void testEquals() {
    assertThat(DistanceInterval.of(null, 2d), is(DistanceInterval.of(0d, 2d)));
    assertThat(
        DistanceInterval.of(null, 2d).hashCode(),
        is(DistanceInterval.of(0d, 2d).hashCode()));
    assertThat(DistanceInterval.of(1d, 2d), not(DistanceInterval.of(1d, 3d)));
  }

  @Test
  void testNegativeZero() {
    final DistanceInterval i = DistanceInterval.of(-0d, 1d);
    assertThat(i.start, is(0d));
    assertThat(i, is(DistanceInterval.of(0d, 1d)));
    assertThat(i, is(DistanceInterval.of(null, 1d)));
    assertThat(i.hashCode(), is(DistanceInterval.of(0d, 1d).hashCode()));
    assertThat(i, hasToString("[, 1.0]"));
  }
}

// End DistanceIntervalTest.java
