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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Options of a variable declaration: its kind and optional bounds.
 *
 * <p>Recognized keys are "{@code kind}", "{@code min_bound}" and
 * "{@code max_bound}". A bound is a number or one of the infinity tokens
 * ("{@code inf}", "{@code infinity}", "{@code -inf}", ...).
 *
 * <p>Whether bounds are legal for the kind is checked when the variable is
 * declared, by {@link ModelAssembler}. */
public class VariableOptions {
  public static final String KIND = "kind";
  public static final String MIN_BOUND = "min_bound";
  public static final String MAX_BOUND = "max_bound";

  private static final ImmutableMap<String, Double> INFINITY_TOKENS =
      ImmutableMap.<String, Double>builder()
          .put("inf", Double.POSITIVE_INFINITY)
          .put("+inf", Double.POSITIVE_INFINITY)
          .put("infinity", Double.POSITIVE_INFINITY)
          .put("+infinity", Double.POSITIVE_INFINITY)
          .put("-inf", Double.NEGATIVE_INFINITY)
          .put("-infinity", Double.NEGATIVE_INFINITY)
          .put("neg_infinity", Double.NEGATIVE_INFINITY)
          .build();

  public final VariableKind kind;
  /** Explicit lower bound, or null if none was given. */
  public final @Nullable Double minBound;
  /** Explicit upper bound, or null if none was given. */
  public final @Nullable Double maxBound;

  private VariableOptions(VariableKind kind, @Nullable Double minBound,
      @Nullable Double maxBound) {
    this.kind = requireNonNull(kind);
    this.minBound = minBound;
    this.maxBound = maxBound;
  }

  /** Creates options of a given kind with no explicit bounds. */
  public static VariableOptions of(VariableKind kind) {
    return new VariableOptions(kind, null, null);
  }

  /** Parses options from a map.
   *
   * @throws IllegalArgumentException if a key, kind or bound is not
   * recognized */
  public static VariableOptions of(Map<String, ?> map) {
    VariableKind kind = VariableKind.CONTINUOUS;
    Double minBound = null;
    Double maxBound = null;
    for (Map.Entry<String, ?> e : map.entrySet()) {
      switch (e.getKey()) {
      case KIND:
        kind = e.getValue() instanceof VariableKind
            ? (VariableKind) e.getValue()
            : VariableKind.of(String.valueOf(e.getValue()));
        break;
      case MIN_BOUND:
        minBound = parseBound(e.getValue());
        break;
      case MAX_BOUND:
        maxBound = parseBound(e.getValue());
        break;
      default:
        throw new IllegalArgumentException("unknown variable option '"
            + e.getKey() + "'; expected one of " + KIND + ", " + MIN_BOUND
            + ", " + MAX_BOUND);
      }
    }
    return new VariableOptions(kind, minBound, maxBound);
  }

  /** Converts a number or infinity token to a bound. */
  public static double parseBound(@Nullable Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      final Double d = INFINITY_TOKENS.get(Ascii.toLowerCase((String) value));
      if (d != null) {
        return d;
      }
    }
    throw new IllegalArgumentException("invalid bound '" + value
        + "'; expected a number or one of " + INFINITY_TOKENS.keySet());
  }

  public VariableOptions withMinBound(double minBound) {
    return new VariableOptions(kind, minBound, maxBound);
  }

  public VariableOptions withMaxBound(double maxBound) {
    return new VariableOptions(kind, minBound, maxBound);
  }

  /** Returns the effective lower bound; 0 for binary variables,
   * negative infinity if none was given. */
  public double lower() {
    return kind == VariableKind.BINARY ? 0D
        : minBound != null ? minBound
        : Double.NEGATIVE_INFINITY;
  }

  /** Returns the effective upper bound; 1 for binary variables,
   * positive infinity if none was given. */
  public double upper() {
    return kind == VariableKind.BINARY ? 1D
        : maxBound != null ? maxBound
        : Double.POSITIVE_INFINITY;
  }

  @Override public int hashCode() {
    return Objects.hash(kind, minBound, maxBound);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof VariableOptions
        && kind == ((VariableOptions) o).kind
        && Objects.equals(minBound, ((VariableOptions) o).minBound)
        && Objects.equals(maxBound, ((VariableOptions) o).maxBound);
  }

  @Override public String toString() {
    return "{kind=" + kind.lowerName()
        + (minBound == null ? "" : ", min_bound=" + minBound)
        + (maxBound == null ? "" : ", max_bound=" + maxBound)
        + "}";
  }
}

// End VariableOptions.java
