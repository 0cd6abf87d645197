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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Range of distances that bounds a spatial operator.
 *
 * <p>For example, {@code [1.5, 4]} in "{@code somewhere[1.5,4] p}". A missing
 * start is 0, a missing end is infinity.
 */
public final class DistanceInterval {
  /** Interval {@code [0, ∞)}. */
  public static final DistanceInterval ALL = of(null, null);

  public final double start;
  public final double end;

  private DistanceInterval(double start, double end) {
    checkArgument(
        !Double.isNaN(start) && !Double.isNaN(end),
        "Distance cannot be NaN: [%s, %s]",
        start,
        end);
    checkArgument(
        start >= 0 && end >= 0,
        "Distance cannot be less than 0: [%s, %s]",
        start,
        end);
    checkArgument(
        start < end,
        "Distance interval cannot have `start` >= `end` (%s >= %s)",
        start,
        end);
    // Adding 0 turns -0.0 into 0.0
    this.start = start + 0d;
    this.end = end + 0d;
  }

  /** Creates a DistanceInterval; throws if the bounds are invalid. */
  public static DistanceInterval of(
      @Nullable Double start, @Nullable Double end) {
    return new DistanceInterval(
        start == null ? 0d : start,
        end == null ? Double.POSITIVE_INFINITY : end);
  }

  /** Returns whether this interval has no upper bound. */
  public boolean isUnbounded() {
    return Double.isInfinite(end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DistanceInterval
            && Double.compare(start, ((DistanceInterval) o).start) == 0
            && Double.compare(end, ((DistanceInterval) o).end) == 0;
  }

  /** Writes this interval, e.g. "[, 2.5]" or "[1.0, inf]". */
  @Override
  public String toString() {
    return "["
        + (start == 0d ? "" : Double.toString(start))
        + ", "
        + (Double.isInfinite(end) ? "inf" : Double.toString(end))
        + "]";
  }
}

// End DistanceInterval.java
