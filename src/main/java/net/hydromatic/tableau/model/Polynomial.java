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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/** Linear combination of variable instances plus a constant.
 *
 * <p>Terms are kept in the order in which their variables were first
 * added; a term whose coefficient becomes exactly zero is dropped.
 * Instances are immutable. */
public final class Polynomial {
  public static final Polynomial ZERO = new Polynomial(ImmutableMap.of(), 0D);

  /** Coefficient of each variable; never zero. */
  public final ImmutableMap<VarId, Double> terms;
  public final double constant;

  private Polynomial(ImmutableMap<VarId, Double> terms, double constant) {
    this.terms = requireNonNull(terms);
    this.constant = constant;
  }

  public static Polynomial constant(double constant) {
    return constant == 0D ? ZERO : new Polynomial(ImmutableMap.of(), constant);
  }

  /** Returns the polynomial "{@code 1 * id}". */
  public static Polynomial variable(VarId id) {
    return new Polynomial(ImmutableMap.of(id, 1D), 0D);
  }

  public static Polynomial of(Map<VarId, Double> terms, double constant) {
    final Map<VarId, Double> map = new LinkedHashMap<>();
    terms.forEach((id, c) -> {
      if (c != 0D) {
        map.put(id, c);
      }
    });
    return new Polynomial(ImmutableMap.copyOf(map), constant);
  }

  /** Whether there are no variable terms. */
  public boolean isConstant() {
    return terms.isEmpty();
  }

  public Set<VarId> variables() {
    return terms.keySet();
  }

  /** Returns the coefficient of a variable, 0 if it does not occur. */
  public double coefficient(VarId id) {
    return terms.getOrDefault(id, 0D);
  }

  public Polynomial plus(Polynomial o) {
    if (o.terms.isEmpty() && o.constant == 0D) {
      return this;
    }
    final Map<VarId, Double> map = new LinkedHashMap<>(terms);
    o.terms.forEach((id, c) -> map.merge(id, c, Double::sum));
    return of(map, constant + o.constant);
  }

  public Polynomial plus(double c) {
    return c == 0D ? this : new Polynomial(terms, constant + c);
  }

  public Polynomial minus(Polynomial o) {
    return plus(o.negate());
  }

  public Polynomial negate() {
    return times(-1D);
  }

  /** Multiplies by a constant. */
  public Polynomial times(double c) {
    if (c == 1D) {
      return this;
    }
    if (c == 0D) {
      return ZERO;
    }
    final Map<VarId, Double> map = new LinkedHashMap<>();
    terms.forEach((id, coefficient) -> map.put(id, coefficient * c));
    return of(map, constant * c);
  }

  /** Divides by a non-zero constant. */
  public Polynomial divide(double c) {
    checkArgument(c != 0D, "division by zero");
    return times(1D / c);
  }

  /** Returns the polynomial with the constant term removed. */
  public Polynomial withoutConstant() {
    return constant == 0D ? this : new Polynomial(terms, 0D);
  }

  /** Returns the range of values this polynomial can take, given the
   * range of each variable. */
  public Interval range(Function<VarId, Interval> bounds) {
    Interval range = Interval.point(constant);
    for (Map.Entry<VarId, Double> e : terms.entrySet()) {
      range = range.plus(bounds.apply(e.getKey()).times(e.getValue()));
    }
    return range;
  }

  /** Evaluates this polynomial for given values of its variables. */
  public double evaluate(Function<VarId, ? extends Number> values) {
    double v = constant;
    for (Map.Entry<VarId, Double> e : terms.entrySet()) {
      v += e.getValue() * values.apply(e.getKey()).doubleValue();
    }
    return v;
  }

  /** Writes the variable terms, in LP format, with given variable names;
   * for example "{@code 2 x - y}". The constant is written only if
   * {@code withConstant}, or if there are no terms. */
  public String describe(Function<VarId, String> namer,
      boolean withConstant) {
    final StringBuilder b = new StringBuilder();
    terms.forEach((id, c) -> {
      if (b.length() == 0) {
        if (c < 0D) {
          b.append("- ");
        }
      } else {
        b.append(c < 0D ? " - " : " + ");
      }
      final double abs = Math.abs(c);
      if (abs != 1D) {
        b.append(Names.formatNumber(abs)).append(' ');
      }
      b.append(namer.apply(id));
    });
    if (b.length() == 0) {
      return Names.formatNumber(constant);
    }
    if (withConstant && constant != 0D) {
      b.append(constant < 0D ? " - " : " + ")
          .append(Names.formatNumber(Math.abs(constant)));
    }
    return b.toString();
  }

  @Override public int hashCode() {
    return Objects.hash(terms, constant);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Polynomial
        && terms.equals(((Polynomial) o).terms)
        && constant == ((Polynomial) o).constant;
  }

  @Override public String toString() {
    return describe(VarId::name, true);
  }
}

// End Polynomial.java
