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

import static net.hydromatic.tableau.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.IsInstanceOf.instanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.tableau.model.VariableKind;
import org.junit.jupiter.api.Test;

/** Tests for {@link AstBuilder} and unparsing via {@link AstWriter}. */
public class AstBuilderTest {
  private static final Ast.Exp I = ast.id("i");
  private static final Ast.Exp J = ast.id("j");

  private static Ast.VariableRef x(Ast.Exp... indices) {
    return ast.variableRef("x", indices);
  }

  @Test
  void testUnparseArithmetic() {
    final Ast.Exp e =
        ast.plus(ast.times(ast.intLiteral(2), x(I)), ast.intLiteral(1));
    assertThat(e, hasToString("2 * x(i) + 1"));

    final Ast.Exp e2 =
        ast.times(ast.plus(x(I), x(J)), ast.realLiteral(0.5));
    assertThat(e2, hasToString("(x(i) + x(j)) * 0.5"));

    final Ast.Exp e3 = ast.minus(x(I), ast.minus(x(J), ast.intLiteral(3)));
    assertThat(e3, hasToString("x(i) - (x(j) - 3)"));

    final Ast.Exp e4 = ast.times(ast.intLiteral(2), ast.negate(x(I)));
    assertThat(e4, hasToString("2 * (-x(i))"));
    assertThat(ast.negate(x(I)), hasToString("-x(i)"));
  }

  @Test
  void testUnparseVariablesAndLookups() {
    assertThat(ast.variableRef("z"), hasToString("z"));
    assertThat(ast.variableRef("qty", ast.stringLiteral("bread")),
        hasToString("qty(\"bread\")"));
    assertThat(ast.variableRef("qty", ast.wildcard()), hasToString("qty(_)"));

    final Ast.Lookup lookup =
        ast.lookup("foods", ast.wildcard(), ast.id("nutrient"));
    assertThat(lookup, hasToString("foods[_][nutrient]"));
    assertThat(lookup.root(), is(ast.id("foods")));

    final Ast.Lookup dot = ast.dot(ast.id("foods"), "bread");
    assertThat(dot, hasToString("foods.bread"));
    assertThat(dot.dot, is(true));
  }

  @Test
  void testDotRequiresSimpleName() {
    assertThat(ast.isSimpleName("bread"), is(true));
    assertThat(ast.isSimpleName("_x1"), is(true));
    assertThat(ast.isSimpleName("1x"), is(false));
    assertThat(ast.isSimpleName("whole wheat"), is(false));
    assertThrows(IllegalArgumentException.class,
        () -> ast.dot(ast.id("foods"), "whole wheat"));
    assertThrows(IllegalArgumentException.class,
        () -> ast.dot(ast.id("foods"), "a-b"));
    // Brackets accept any key
    assertThat(ast.lookup(ast.id("foods"), ast.stringLiteral("whole wheat")),
        hasToString("foods[\"whole wheat\"]"));
  }

  @Test
  void testUnparseFunctions() {
    assertThat(ast.sum(x(ast.wildcard())), hasToString("sum(x(_))"));
    assertThat(ast.abs(ast.minus(x(I), x(J))),
        hasToString("abs(x(i) - x(j))"));
    assertThat(ast.max(x(I), ast.intLiteral(0)), hasToString("max(x(i), 0)"));
    assertThat(
        ast.ifThenElse(ast.variableRef("b"), x(I), ast.intLiteral(0)),
        hasToString("if b then x(i) else 0"));
    assertThat(
        ast.plus(ast.ifThenElse(ast.variableRef("b"), x(I), x(J)),
            ast.intLiteral(1)),
        hasToString("(if b then x(i) else x(j)) + 1"));
    assertThat(
        ast.piecewiseLinear(x(I), ImmutableList.of(0, 10),
            ImmutableList.of(2), ImmutableList.of(1)),
        hasToString("pwl(x(i), [0.0, 10.0], [2.0], [1.0])"));
  }

  @Test
  void testGeneratorSum() {
    final Ast.GeneratorSum sum =
        ast.generatorSum(ast.variableRef("y", I, J),
            ImmutableList.of(ast.generator("i", ast.range(1, 3)),
                ast.generator("j",
                    ast.list(ast.stringLiteral("a"), ast.stringLiteral("b"))),
                ast.filter(ast.notEqual(I, ast.intLiteral(2)))));
    assertThat(sum,
        hasToString("sum(y(i, j) for i <- 1 .. 3, j <- [\"a\", \"b\"], "
            + "i != 2)"));
  }

  /** A single argument with a wildcard stands for the set of instances;
   * it is not summed. */
  @Test
  void testCallWrapsPattern() {
    final Ast.Call max = ast.max(x(ast.wildcard()));
    assertThat(max.args.size(), is(1));
    assertThat(max.args.get(0), instanceOf(Ast.PatternInstanceSet.class));
    assertThat(max, hasToString("max(x(_))"));

    final Ast.Call max2 = ast.max(x(I), x(J));
    assertThat(max2.args.get(0), instanceOf(Ast.VariableRef.class));

    final Ast.Call and = ast.and(ast.variableRef("b", I));
    assertThat(and.args.get(0), instanceOf(Ast.VariableRef.class));

    // The wildcard belongs to the inner sum or call, so the argument is
    // not a pattern
    final Ast.Call maxSum = ast.max(ast.sum(x(ast.wildcard())));
    assertThat(maxSum.args.get(0), instanceOf(Ast.Sum.class));
    assertThat(maxSum, hasToString("max(sum(x(_)))"));
    final Ast.Call andOr =
        ast.and(ast.or(ast.variableRef("b", ast.wildcard())));
    assertThat(andOr.args.get(0), instanceOf(Ast.Call.class));
  }

  @Test
  void testHasFreeWildcard() {
    final Ast.Exp w = ast.wildcard();
    assertThat(ast.hasFreeWildcard(x(I)), is(false));
    assertThat(ast.hasFreeWildcard(ast.plus(x(I), x(w))), is(true));
    assertThat(ast.hasFreeWildcard(ast.lookup("cost", w)), is(true));
    assertThat(ast.hasFreeWildcard(ast.abs(x(w))), is(true));
    assertThat(ast.hasFreeWildcard(ast.sum(x(w))), is(false));
    assertThat(ast.hasFreeWildcard(ast.max(x(w))), is(false));
    assertThat(
        ast.hasFreeWildcard(ast.plus(ast.sum(x(w)), ast.lookup("cost", w))),
        is(true));
  }

  @Test
  void testPiecewiseLinearValidation() {
    final Ast.Exp e = x(I);
    assertThrows(IllegalArgumentException.class,
        () -> ast.piecewiseLinear(e, ImmutableList.of(0),
            ImmutableList.of(), ImmutableList.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ast.piecewiseLinear(e, ImmutableList.of(0, 5, 5),
            ImmutableList.of(1, 2), ImmutableList.of(0, 0)));
    assertThrows(IllegalArgumentException.class,
        () -> ast.piecewiseLinear(e, ImmutableList.of(0, 5, 10),
            ImmutableList.of(1), ImmutableList.of(0, 0)));
  }

  @Test
  void testDeclarations() {
    final Ast.VarDecl varDecl =
        ast.varDecl("qty",
            ImmutableList.of(ast.generator("food", ast.id("foods"))),
            ImmutableMap.of("kind", "integer", "min_bound", 0));
    assertThat(varDecl,
        hasToString("variables qty[food <- foods] : integer"));
    assertThat(varDecl.options.kind, is(VariableKind.INTEGER));

    final Ast.ConstraintDecl constraintDecl =
        ast.constraintDecl(
            ImmutableList.of(ast.generator("i", ast.range(1, 3))),
            ast.lessThanOrEqualTo(x(I), ast.lookup("cap", I)), "cap_{i}");
    assertThat(constraintDecl,
        hasToString("constraints [i <- 1 .. 3] \"cap_{i}\": "
            + "x(i) <= cap[i]"));

    assertThat(ast.minimize(ast.plus(x(I), x(J))),
        hasToString("minimize x(i) + x(j)"));
  }

  @Test
  void testShuttleIdentity() {
    final Ast.Exp e =
        ast.sum(ast.times(ast.variableRef("qty", ast.wildcard()),
            ast.lookup("foods", ast.wildcard(), ast.id("nutrient"))));
    final Ast.Exp e2 = e.accept(new Shuttle());
    assertThat(e2, is(e));
    assertThat(e2 == e, is(true));
  }
}

// End AstBuilderTest.java
