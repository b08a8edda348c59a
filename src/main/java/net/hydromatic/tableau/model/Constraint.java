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

import java.util.function.Function;
import net.hydromatic.tableau.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A linear constraint, "{@code left op right}".
 *
 * <p>The sides are kept as declared, for diagnostics; the LP file contains
 * the {@link #lhs() normalized} form, with the variables on the left and
 * the constant on the right. */
public final class Constraint {
  public final String name;
  public final String sanitizedName;
  public final Polynomial left;
  public final Relation relation;
  public final Polynomial right;

  Constraint(String name, String sanitizedName, Polynomial left,
      Relation relation, Polynomial right) {
    this.name = requireNonNull(name);
    this.sanitizedName = requireNonNull(sanitizedName);
    this.left = requireNonNull(left);
    this.relation = requireNonNull(relation);
    this.right = requireNonNull(right);
  }

  /** Returns the variable terms of {@code left - right}. */
  public Polynomial lhs() {
    return left.minus(right).withoutConstant();
  }

  /** Returns the constant that the variable terms are compared with. */
  public double rhs() {
    return -left.minus(right).constant;
  }

  /** Returns whether the constraint holds for given values of its
   * variables, within a tolerance. */
  public boolean isSatisfied(Function<VarId, ? extends Number> values,
      double tolerance) {
    final double v = left.minus(right).evaluate(values);
    switch (relation) {
    case LE:
      return v <= tolerance;
    case GE:
      return v >= -tolerance;
    default:
      return Math.abs(v) <= tolerance;
    }
  }

  @Override public String toString() {
    return name + ": " + left + " " + relation.symbol + " " + right;
  }

  /** Relation between the two sides of a constraint. */
  public enum Relation {
    LE("<="),
    GE(">="),
    EQ("=");

    /** As written in the LP format. */
    public final String symbol;

    Relation(String symbol) {
      this.symbol = symbol;
    }

    /** Converts a comparison operator. Strict comparisons become
     * non-strict, because a solver cannot distinguish them; "{@code !=}"
     * has no counterpart and returns null. */
    public static @Nullable Relation of(Op op) {
      switch (op) {
      case LE:
      case LT:
        return LE;
      case GE:
      case GT:
        return GE;
      case EQ:
        return EQ;
      case NE:
        return null;
      default:
        throw new IllegalArgumentException("not a comparison: " + op);
      }
    }
  }
}

// End Constraint.java
