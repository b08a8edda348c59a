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
package net.hydromatic.tableau.ast;

import com.google.common.base.CaseFormat;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // leaves
  VARIABLE_REF(true),
  LITERAL(true),
  SYMBOLIC_KEY(true),
  WILDCARD(true),
  /** Container lookup, "{@code foods[_][nutrient]}". */
  LOOKUP(true),

  // arithmetic
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  NEGATE("-"),

  // comparisons
  EQ(" == ", 4),
  NE(" != ", 4),
  LE(" <= ", 4),
  GE(" >= ", 4),
  LT(" < ", 4),
  GT(" > ", 4),

  // functions; unparsed as "name(arg, ...)"
  SUM(true),
  GENERATOR_SUM(true),
  ABS(true),
  MAX(true),
  MIN(true),
  AND(true),
  OR(true),
  NOT(true),
  PIECEWISE_LINEAR(true),
  /** Single wildcard-bearing argument of MAX, MIN, AND, OR; stands for the
   * list of instances it expands to, not for their sum. */
  PATTERN_INSTANCE_SET(true),
  IF,

  // domains
  RANGE(" .. ", 5),
  LIST(true),

  // qualifiers
  GENERATOR(" <- "),
  FILTER,

  // declarations
  VAR_DECL,
  CONSTRAINT_DECL,
  OBJECTIVE_DECL;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the name in lower camel case, e.g. "piecewiseLinear". */
  public String lowerName() {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }

  /** Returns whether this is a comparison operator. */
  public boolean isComparison() {
    switch (this) {
    case EQ:
    case NE:
    case LE:
    case GE:
    case LT:
    case GT:
      return true;
    default:
      return false;
    }
  }

  /** Returns the comparison that holds when the operands are swapped;
   * for example, {@code a < b} is equivalent to {@code b > a}. */
  public Op reverse() {
    switch (this) {
    case EQ:
    case NE:
      return this;
    case LE:
      return GE;
    case GE:
      return LE;
    case LT:
      return GT;
    case GT:
      return LT;
    default:
      throw new AssertionError("not a comparison: " + this);
    }
  }
}

// End Op.java
