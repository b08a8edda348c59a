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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Identity of an instance of a variable family: the family name and the
 * values of its indices.
 *
 * <p>Index values are normalized (see {@link #normalize(Object)}), so that
 * {@code x(1)} declared with an integer and referenced with "1.0" is the
 * same instance. */
public final class VarId implements Comparable<VarId> {
  public final String family;
  public final List<Object> indices;

  private VarId(String family, ImmutableList<Object> indices) {
    this.family = requireNonNull(family);
    this.indices = requireNonNull(indices);
  }

  public static VarId of(String family, List<?> indices) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    indices.forEach(index -> b.add(normalize(index)));
    return new VarId(family, b.build());
  }

  public static VarId of(String family, Object... indices) {
    return of(family, ImmutableList.copyOf(indices));
  }

  /** Normalizes an index value. An integral number becomes a {@link Long},
   * any other number a {@link Double}, and anything else its string
   * form. */
  public static Object normalize(Object value) {
    requireNonNull(value, "index value");
    if (value instanceof Long) {
      return value;
    }
    if (value instanceof Number) {
      final double d = ((Number) value).doubleValue();
      if (value instanceof BigDecimal) {
        final BigDecimal bd = (BigDecimal) value;
        if (bd.signum() == 0 || bd.stripTrailingZeros().scale() <= 0) {
          try {
            return bd.longValueExact();
          } catch (ArithmeticException e) {
            return d;
          }
        }
        return d;
      }
      if (!Double.isInfinite(d) && d == Math.rint(d)
          && Math.abs(d) < 0x1p63) {
        return (long) d;
      }
      return d;
    }
    return value.toString();
  }

  /** Returns the text of a normalized index value, as it appears in the
   * name of an instance. */
  public static String indexText(Object value) {
    final Object v = normalize(value);
    if (v instanceof Double) {
      return Names.formatNumber((Double) v);
    }
    return v.toString();
  }

  /** Returns the raw name, "{@code family(i1,i2)}", or "{@code family}" if
   * there are no indices. */
  public String name() {
    if (indices.isEmpty()) {
      return family;
    }
    return indices.stream()
        .map(VarId::indexText)
        .collect(Collectors.joining(",", family + "(", ")"));
  }

  /** Returns the name with each index sanitized for the LP format. */
  public String sanitizedName() {
    return Names.sanitizeVariable(this);
  }

  /** Returns whether this instance matches a pattern; a null element of the
   * pattern matches any index value. */
  public boolean matches(List<?> pattern) {
    if (pattern.size() != indices.size()) {
      return false;
    }
    for (int i = 0; i < pattern.size(); i++) {
      final Object p = pattern.get(i);
      if (p != null && !normalize(p).equals(indices.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override public int compareTo(VarId o) {
    return name().compareTo(o.name());
  }

  @Override public int hashCode() {
    return Objects.hash(family, indices);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof VarId
        && family.equals(((VarId) o).family)
        && indices.equals(((VarId) o).indices);
  }

  @Override public String toString() {
    return name();
  }
}

// End VarId.java
