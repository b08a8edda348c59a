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
package net.hydromatic.tableau.model;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** Closed interval of real numbers, possibly unbounded at either end.
 *
 * <p>Used to compute the range of a linear expression from the bounds of
 * its variables, and from that the constants of a big-M formulation. */
public final class Interval {
  public static final Interval ALL =
      new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

  public final double lower;
  public final double upper;

  private Interval(double lower, double upper) {
    checkArgument(!Double.isNaN(lower) && !Double.isNaN(upper),
        "NaN bound");
    checkArgument(lower <= upper, "empty interval [%s, %s]", lower, upper);
    this.lower = lower;
    this.upper = upper;
  }

  public static Interval of(double lower, double upper) {
    return new Interval(lower, upper);
  }

  public static Interval point(double value) {
    return new Interval(value, value);
  }

  /** Whether both ends are finite. */
  public boolean isBounded() {
    return !Double.isInfinite(lower) && !Double.isInfinite(upper);
  }

  /** Whether this interval lies within [0, 1]. */
  public boolean isWithinUnit() {
    return lower >= 0D && upper <= 1D;
  }

  public Interval plus(Interval o) {
    return new Interval(lower + o.lower, upper + o.upper);
  }

  /** Multiplies by a constant. */
  public Interval times(double c) {
    if (c == 0D) {
      return point(0D);
    }
    return c > 0D
        ? new Interval(lower * c, upper * c)
        : new Interval(upper * c, lower * c);
  }

  /** Returns the smallest interval that contains both. */
  public Interval hull(Interval o) {
    return new Interval(Math.min(lower, o.lower), Math.max(upper, o.upper));
  }

  @Override public int hashCode() {
    return Objects.hash(lower, upper);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Interval
        && lower == ((Interval) o).lower
        && upper == ((Interval) o).upper;
  }

  @Override public String toString() {
    return "[" + lower + ", " + upper + "]";
  }
}

// End Interval.java
