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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import java.util.Iterator;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Discrete time interval that bounds a temporal operator.
 *
 * <p>Either bound may be null, meaning unbounded on that side; a null {@link
 * #start} reads as 0. For example, {@code [2, 5]} in "{@code F[2,5] p}" and
 * {@code [3, ]} in "{@code G[3,] p}".
 *
 * <p>An interval is also the (possibly infinite) sequence of the instants it
 * covers. Iterating an unbounded interval does not terminate, so take a prefix,
 * e.g. {@code Iterables.limit(interval, 10)}.
 */
public final class TimeInterval implements Iterable<Integer> {
  public final @Nullable Integer start;
  public final @Nullable Integer end;

  private TimeInterval(@Nullable Integer start, @Nullable Integer end) {
    if (start != null && end != null) {
      checkArgument(
          !start.equals(end),
          "Time intervals cannot be point values [a,a]: [%s,%s]",
          start,
          end);
      checkArgument(
          start <= end,
          "Time interval [a,b] cannot have a > b: [%s,%s]",
          start,
          end);
    }
    checkArgument(
        (start == null || start >= 0) && (end == null || end >= 0),
        "Time interval cannot have negative bounds: [%s,%s]",
        start,
        end);
    this.start = start;
    this.end = end;
  }

  /** Creates a TimeInterval; throws if the bounds are invalid. */
  public static TimeInterval of(
      @Nullable Integer start, @Nullable Integer end) {
    return new TimeInterval(start, end);
  }

  /** Returns the start, reading a missing start as 0. */
  public int startOrZero() {
    return start == null ? 0 : start;
  }

  /** Returns whether this interval has no upper bound. */
  public boolean isUnbounded() {
    return end == null;
  }

  /** Returns whether this interval is equivalent to {@code [0, ∞)}. */
  public boolean isUntimed() {
    return startOrZero() == 0 && end == null;
  }

  /**
   * Returns the instants covered by this interval, in ascending order.
   *
   * <p>If the interval is unbounded, the iterator does not end (in practice, it
   * stops at {@link Integer#MAX_VALUE}).
   */
  @Override
  public Iterator<Integer> iterator() {
    final Range<Integer> range =
        end == null
            ? Range.atLeast(startOrZero())
            : Range.closed(startOrZero(), end);
    return ContiguousSet.create(range, DiscreteDomain.integers()).iterator();
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TimeInterval
            && Objects.equals(start, ((TimeInterval) o).start)
            && Objects.equals(end, ((TimeInterval) o).end);
  }

  /** Writes this interval, e.g. "[2, 5]"; a zero or missing bound is empty. */
  @Override
  public String toString() {
    return "[" + bound(start) + ", " + bound(end) + "]";
  }

  private static String bound(@Nullable Integer i) {
    return i == null || i == 0 ? "" : i.toString();
  }
}

// End TimeInterval.java
