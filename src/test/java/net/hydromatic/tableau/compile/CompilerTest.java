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
package net.hydromatic.tableau.compile;

import static net.hydromatic.tableau.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.tableau.ast.Ast;
import net.hydromatic.tableau.model.Constraint;
import net.hydromatic.tableau.model.LpWriter;
import net.hydromatic.tableau.model.Model;
import net.hydromatic.tableau.model.ModelException;
import net.hydromatic.tableau.model.VarId;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiler}. */
public class CompilerTest {
  private static final Ast.Wildcard ANY = ast.wildcard();

  private static final Map<String, Object> DIET =
      ImmutableMap.of("foods",
          ImmutableMap.of(
              "bread", ImmutableMap.of("cost", 2, "cal", 100, "protein", 4),
              "milk", ImmutableMap.of("cost", 3, "cal", 150, "protein", 8)),
          "nutrients",
          ImmutableMap.of("cal", ImmutableMap.of("min", 2000),
              "protein", ImmutableMap.of("min", 50)));

  private static Ast.VarDecl varDecl(String family, String name,
      Ast.Exp domain) {
    return ast.varDecl(family,
        ImmutableList.of(ast.generator(name, domain)),
        ImmutableMap.of("kind", "continuous", "min_bound", 0));
  }

  private static List<String> constraintNames(Model model) {
    return model.constraints().stream()
        .map(c -> c.name)
        .collect(Collectors.toList());
  }

  @Test
  void testDiet() {
    final Model model = new Model("diet");
    final Compiler compiler = new Compiler(model, DIET);
    final Ast.VarDecl qty =
        ast.varDecl("qty",
            ImmutableList.of(ast.generator("food", ast.id("foods"))),
            ImmutableMap.of("kind", "continuous", "min_bound", 0));
    final Ast.VarDecl qtyDescribed =
        ast.varDecl(qty.family, qty.qualifiers, qty.options,
            "amount of {food}");
    final Ast.ConstraintDecl need =
        ast.constraintDecl(
            ImmutableList.of(ast.generator("n", ast.id("nutrients"))),
            ast.greaterThanOrEqualTo(
                ast.sum(
                    ast.times(ast.variableRef("qty", ANY),
                        ast.lookup("foods", ANY, ast.id("n")))),
                ast.dot(ast.lookup("nutrients", ast.id("n")), "min")),
            "need_{n}");
    final Ast.ObjectiveDecl cost =
        ast.minimize(
            ast.sum(
                ast.times(ast.variableRef("qty", ANY),
                    ast.dot(ast.lookup("foods", ANY), "cost"))));
    compiler.define(ImmutableList.of(qtyDescribed, need, cost));

    assertThat(model.variable(VarId.of("qty", "milk")).description,
        is("amount of milk"));
    final String expected = "\\ Problem: diet\n"
        + "Minimize\n"
        + " obj: 2 qty(bread) + 3 qty(milk)\n"
        + "Subject To\n"
        + " need_cal: 100 qty(bread) + 150 qty(milk) >= 2000\n"
        + " need_protein: 4 qty(bread) + 8 qty(milk) >= 50\n"
        + "Bounds\n"
        + " 0 <= qty(bread) <= 1e+30\n"
        + " 0 <= qty(milk) <= 1e+30\n"
        + "End\n";
    assertThat(new LpWriter(model).toLp(), is(expected));
  }

  /** A variable's indices are the values bound to the names, never the
   * names themselves. */
  @Test
  void testIndicesAreBoundValues() {
    final Model model = new Model();
    final Compiler compiler =
        new Compiler(model,
            ImmutableMap.of("orders", ImmutableList.of("A", "B"),
                "items", ImmutableList.of("X", "Y"),
                "i", "ignored"));
    compiler.define(
        ImmutableList.of(
            ast.varDecl("x",
                ImmutableList.of(ast.generator("o", ast.id("orders")),
                    ast.generator("i", ast.id("items"))),
                ImmutableMap.of())));
    assertThat(model.instances("x"), hasSize(4));
    assertThat(model.instances("x").get(1), hasToString("x(A,Y)"));

    final Ast.Comparison cap =
        ast.lessThanOrEqualTo(
            ast.variableRef("x", ast.id("o"), ast.id("i")),
            ast.intLiteral(5));
    compiler.compile(model.define(), ast.constraintDecl(cap, "cap"),
        Environments.of(ImmutableMap.of("o", "A", "i", "X")));
    final Constraint c = model.constraint("cap");
    assertThat(c.left, hasToString("x(A,X)"));

    // "i" is a parameter, but a variable index must be bound
    assertThrows(UnboundSymbolException.class,
        () -> compiler.compile(model.define(),
            ast.constraintDecl(cap, "cap2"),
            Environments.of(ImmutableMap.of("o", "A"))));
  }

  @Test
  void testRedefinition() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    final Ast.VarDecl first = varDecl("x", "i", ast.range(1, 4));
    compiler.define(ImmutableList.of(first));
    final ModelException e =
        assertThrows(ModelException.class,
            () -> compiler.define(ImmutableList.of(first)));
    assertThat(e.reason, is(ModelException.Reason.REDEFINITION));
    assertThat(model.instances("x"), hasSize(4));
    compiler.define(ImmutableList.of(varDecl("x", "i", ast.range(5, 8))));
    assertThat(model.instances("x"), hasSize(8));

    // A filter skips some values
    compiler.define(
        ImmutableList.of(
            ast.varDecl("y",
                ImmutableList.of(ast.generator("i", ast.range(1, 4)),
                    ast.filter(ast.notEqual(ast.id("i"), ast.intLiteral(2)))),
                ImmutableMap.of("kind", "binary"))));
    assertThat(model.instances("y"), hasToString("[y(1), y(3), y(4)]"));
  }

  @Test
  void testConstraintNames() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    compiler.define(ImmutableList.of(varDecl("x", "i", ast.range(1, 2))));
    final Ast.Comparison comparison =
        ast.lessThanOrEqualTo(ast.variableRef("x", ast.id("i")),
            ast.intLiteral(1));
    final ImmutableList<Ast.Qualifier> qualifiers =
        ImmutableList.of(ast.generator("i", ast.range(1, 2)));
    compiler.define(
        ImmutableList.of(ast.constraintDecl(qualifiers, comparison, null),
            ast.constraintDecl(qualifiers, comparison, "cap"),
            ast.constraintDecl(qualifiers, comparison, "lim_{i}"),
            ast.constraintDecl(
                ast.greaterThanOrEqualTo(ast.variableRef("x",
                    ast.intLiteral(1)), ast.intLiteral(0)),
                "pos")));
    assertThat(constraintNames(model),
        is(
            ImmutableList.of("c1(1)", "c1(2)", "cap(1)", "cap(2)", "lim_1",
                "lim_2", "pos")));
    assertThat(model.constraint("cap(2)"), hasToString("cap(2): x(2) <= 1"));

    assertThrows(UnboundSymbolException.class,
        () -> compiler.define(
            ImmutableList.of(
                ast.constraintDecl(qualifiers, comparison, "bad_{k}"))));
  }

  /** A declaration that fails part way adds nothing to the model. */
  @Test
  void testAtomicDeclaration() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    compiler.define(ImmutableList.of(varDecl("x", "i", ast.range(1, 2))));
    final Ast.ConstraintDecl decl =
        ast.constraintDecl(
            ImmutableList.of(ast.generator("i", ast.range(1, 3))),
            ast.greaterThanOrEqualTo(
                ast.abs(ast.variableRef("x", ast.id("i"))),
                ast.intLiteral(1)),
            null);
    final UndefinedVariableException e =
        assertThrows(UndefinedVariableException.class,
            () -> compiler.define(ImmutableList.of(decl)));
    assertThat(e.id, hasToString("x(3)"));
    assertThat(model.constraints(), hasSize(0));
    assertThat(model.variables(), hasSize(2));

    // The failed declaration did not use up any generated names
    compiler.define(
        ImmutableList.of(
            ast.minimize(ast.abs(ast.variableRef("x", ast.intLiteral(1)))),
            ast.constraintDecl(
                ast.lessThanOrEqualTo(
                    ast.variableRef("x", ast.intLiteral(2)),
                    ast.intLiteral(5)),
                null)));
    assertThat(model.objective(), hasToString("minimize _abs1"));
    assertThat(constraintNames(model),
        is(ImmutableList.of("_abs1_pos", "_abs1_neg", "c1")));
  }

  /** Declaring a constraint again over the same values is an error; over
   * different values, it adds constraints. */
  @Test
  void testConstraintDomains() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    compiler.define(ImmutableList.of(varDecl("x", "i", ast.range(1, 4))));
    final Ast.Comparison comparison =
        ast.lessThanOrEqualTo(ast.variableRef("x", ast.id("i")),
            ast.intLiteral(1));
    final Ast.ConstraintDecl first =
        ast.constraintDecl(
            ImmutableList.of(ast.generator("i", ast.range(1, 2))),
            comparison, null);
    compiler.define(ImmutableList.of(first));
    final ModelException e =
        assertThrows(ModelException.class,
            () -> compiler.define(ImmutableList.of(first)));
    assertThat(e.reason, is(ModelException.Reason.DUPLICATE_CONSTRAINT));
    assertThat(constraintNames(model), is(ImmutableList.of("c1(1)", "c1(2)")));

    // Overlapping values
    final ModelException e2 =
        assertThrows(ModelException.class,
            () -> compiler.define(
                ImmutableList.of(
                    ast.constraintDecl(
                        ImmutableList.of(ast.generator("i", ast.range(2, 3))),
                        comparison, null))));
    assertThat(e2.reason, is(ModelException.Reason.DUPLICATE_CONSTRAINT));

    // Disjoint values
    compiler.define(
        ImmutableList.of(
            ast.constraintDecl(
                ImmutableList.of(ast.generator("i", ast.range(3, 4))),
                comparison, null)));
    assertThat(constraintNames(model),
        is(ImmutableList.of("c1(1)", "c1(2)", "c1(3)", "c1(4)")));

    // A different comparison gets a different name
    compiler.define(
        ImmutableList.of(
            ast.constraintDecl(
                ImmutableList.of(ast.generator("i", ast.range(1, 2))),
                ast.greaterThanOrEqualTo(ast.variableRef("x", ast.id("i")),
                    ast.intLiteral(0)),
                null)));
    assertThat(model.constraints(), hasSize(6));
    assertThat(model.constraint("c2(2)"), hasToString("c2(2): x(2) >= 0"));

    // Named constraints behave the same way
    final Ast.ConstraintDecl cap =
        ast.constraintDecl(
            ImmutableList.of(ast.generator("i", ast.range(1, 2))),
            comparison, "cap");
    compiler.define(ImmutableList.of(cap));
    final ModelException e3 =
        assertThrows(ModelException.class,
            () -> compiler.define(ImmutableList.of(cap)));
    assertThat(e3.reason, is(ModelException.Reason.DUPLICATE_CONSTRAINT));
    assertThat(model.constraints(), hasSize(8));
  }

  /** In "max(sum(x(_)))" the wildcard belongs to the sum. */
  @Test
  void testMaxOfSum() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    compiler.define(
        ImmutableList.of(varDecl("x", "i", ast.range(1, 3)),
            ast.constraintDecl(
                ast.lessThanOrEqualTo(
                    ast.max(ast.sum(ast.variableRef("x", ANY))),
                    ast.intLiteral(5)),
                "t")));
    assertThat(model.constraint("t"),
        hasToString("t: x(1) + x(2) + x(3) <= 5"));
    assertThat(model.variables(), hasSize(3));
  }

  /** Variables with wildcards must be declared over the same values,
   * whichever comes first. */
  @Test
  void testWildcardFamiliesDisagree() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    compiler.define(
        ImmutableList.of(varDecl("x", "i", ast.range(1, 2)),
            varDecl("z", "i", ast.range(1, 4)),
            varDecl("y", "i", ast.range(1, 2))));
    final Ast.VariableRef x = ast.variableRef("x", ANY);
    final Ast.VariableRef z = ast.variableRef("z", ANY);
    final Ast.VariableRef y = ast.variableRef("y", ANY);
    assertThrows(AmbiguousWildcardException.class,
        () -> compiler.define(
            ImmutableList.of(
                ast.constraintDecl(
                    ast.lessThanOrEqualTo(ast.sum(ast.plus(x, z)),
                        ast.intLiteral(5)),
                    "t"))));
    assertThrows(AmbiguousWildcardException.class,
        () -> compiler.define(
            ImmutableList.of(
                ast.constraintDecl(
                    ast.lessThanOrEqualTo(ast.sum(ast.plus(z, x)),
                        ast.intLiteral(5)),
                    "t"))));
    assertThat(model.constraints(), hasSize(0));

    compiler.define(
        ImmutableList.of(
            ast.constraintDecl(
                ast.lessThanOrEqualTo(ast.sum(ast.plus(x, y)),
                    ast.intLiteral(5)),
                "t")));
    assertThat(model.constraint("t"),
        hasToString("t: x(1) + y(1) + x(2) + y(2) <= 5"));
  }

  @Test
  void testObjective() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    final Ast.Exp x1 = ast.variableRef("x", ast.intLiteral(1));
    compiler.define(
        ImmutableList.of(varDecl("x", "i", ast.range(1, 2)),
            ast.maximize(x1)));
    final ModelException e =
        assertThrows(ModelException.class,
            () -> compiler.define(ImmutableList.of(ast.minimize(x1))));
    assertThat(e.reason, is(ModelException.Reason.DUPLICATE_OBJECTIVE));
    assertThat(model.objective(), hasToString("maximize x(1)"));

    compiler.modify(
        ImmutableList.of(
            ast.minimize(ast.sum(ast.variableRef("x", ANY)))));
    assertThat(model.objective(), hasToString("minimize x(1) + x(2)"));
  }

  /** Auxiliary variables and constraints appear in the LP file. */
  @Test
  void testLinearizedObjective() {
    final Model model = new Model();
    final Compiler compiler = new Compiler(model, ImmutableMap.of());
    compiler.define(
        ImmutableList.of(
            ast.varDecl("x",
                ImmutableList.of(ast.generator("i", ast.range(1, 2))),
                ImmutableMap.of("kind", "integer", "min_bound", 0,
                    "max_bound", 10)),
            ast.minimize(
                ast.sum(
                    ast.abs(
                        ast.minus(ast.variableRef("x", ANY),
                            ast.intLiteral(3)))))));
    final String expected = "\\ Problem: model\n"
        + "Minimize\n"
        + " obj: _abs1 + _abs2\n"
        + "Subject To\n"
        + " _abs1_pos: _abs1 - x(1) >= -3\n"
        + " _abs1_neg: _abs1 + x(1) >= 3\n"
        + " _abs2_pos: _abs2 - x(2) >= -3\n"
        + " _abs2_neg: _abs2 + x(2) >= 3\n"
        + "Bounds\n"
        + " 0 <= x(1) <= 10\n"
        + " 0 <= x(2) <= 10\n"
        + " 0 <= _abs1 <= 1e+30\n"
        + " 0 <= _abs2 <= 1e+30\n"
        + "General\n"
        + " x(1)\n"
        + " x(2)\n"
        + "End\n";
    assertThat(new LpWriter(model).toLp(), is(expected));
    assertThat(model.variable(VarId.of("_abs2")).description,
        is("abs(x(2) - 3)"));
  }

  @Test
  void testInterpolate() {
    final Environment env =
        Environments.of(ImmutableMap.of("food", "bread", "n", 2));
    assertThat(Compiler.interpolate("{food} x{n} {food}", env, null),
        is("bread x2 bread"));
    assertThat(Compiler.interpolate("no placeholders", env, null),
        is("no placeholders"));
    assertThrows(UnboundSymbolException.class,
        () -> Compiler.interpolate("{missing}", env, null));
  }
}

// End CompilerTest.java
