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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import org.junit.jupiter.api.Test;

/** Tests for {@link Polynomial} and {@link Interval}. */
public class PolynomialTest {
  private static final VarId X = VarId.of("x");
  private static final VarId Y = VarId.of("y");

  @Test
  void testArithmetic() {
    final Polynomial x = Polynomial.variable(X);
    final Polynomial y = Polynomial.variable(Y);
    final Polynomial p = x.times(2).plus(y).minus(Polynomial.constant(3));
    assertThat(p, hasToString("2 x + y - 3"));
    assertThat(p.coefficient(X), is(2D));
    assertThat(p.negate(), hasToString("- 2 x - y + 3"));
    assertThat(p.divide(4), hasToString("0.5 x + 0.25 y - 0.75"));

    // Repeated references accumulate; zero terms disappear
    assertThat(x.plus(x).plus(y), hasToString("2 x + y"));
    assertThat(x.plus(y).minus(x), hasToString("y"));
    assertThat(x.minus(x).isConstant(), is(true));
    assertThat(x.minus(x), is(Polynomial.ZERO));
  }

  @Test
  void testTermOrder() {
    final Polynomial p =
        Polynomial.variable(Y).plus(Polynomial.variable(X))
            .plus(Polynomial.variable(Y));
    assertThat(p, hasToString("2 y + x"));
  }

  @Test
  void testRange() {
    final Polynomial p =
        Polynomial.variable(X).times(2)
            .minus(Polynomial.variable(Y))
            .plus(1D);
    final Interval range =
        p.range(id -> id.equals(X) ? Interval.of(0, 3) : Interval.of(-1, 2));
    assertThat(range, is(Interval.of(-1, 8)));

    final Interval unbounded =
        p.range(id -> id.equals(X) ? Interval.of(0, 3) : Interval.ALL);
    assertThat(unbounded.isBounded(), is(false));
    assertThat(unbounded.upper, is(Double.POSITIVE_INFINITY));
  }

  @Test
  void testInterval() {
    assertThat(Interval.of(1, 2).hull(Interval.of(-3, 0)),
        is(Interval.of(-3, 2)));
    assertThat(Interval.of(1, 2).times(-2), is(Interval.of(-4, -2)));
    assertThat(Interval.of(0, 1).isWithinUnit(), is(true));
    assertThat(Interval.of(0, 2).isWithinUnit(), is(false));
  }
}

// End PolynomialTest.java
