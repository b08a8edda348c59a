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
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.tableau.ast.Op;
import net.hydromatic.tableau.compile.NonLinearException;
import net.hydromatic.tableau.compile.UndefinedVariableException;
import org.junit.jupiter.api.Test;

/** Tests for {@link ModelAssembler}. */
public class ModelAssemblerTest {
  private static final VariableOptions CONTINUOUS =
      VariableOptions.of(VariableKind.CONTINUOUS);

  private static Polynomial var(String family, Object... indices) {
    return Polynomial.variable(VarId.of(family, indices));
  }

  private static ModelException.Reason reason(Runnable runnable) {
    return assertThrows(ModelException.class, runnable::run).reason;
  }

  @Test
  void testDeclareVariable() {
    final Model model = new Model();
    final VariableInstance v =
        model.define().declareVariable("x", ImmutableList.of(1),
            CONTINUOUS.withMinBound(0).withMaxBound(5), "first");
    assertThat(v.name(), is("x(1)"));
    assertThat(v.bounds(), is(Interval.of(0, 5)));
    assertThat(v.description, is("first"));
    assertThat(model.variable(VarId.of("x", 1L)), is(v));
    assertThat(model.instances("x"), is(ImmutableList.of(VarId.of("x", 1))));
    assertThat(model.instances("y").isEmpty(), is(true));
  }

  @Test
  void testIllegalBounds() {
    final ModelAssembler assembler = new Model().define();
    final ImmutableList<Object> noIndices = ImmutableList.of();
    assertThat(
        reason(() ->
            assembler.declareVariable("b", noIndices,
                VariableOptions.of(VariableKind.BINARY).withMaxBound(1),
                null)),
        is(ModelException.Reason.ILLEGAL_BOUNDS));
    assertThat(
        reason(() ->
            assembler.declareVariable("n", noIndices,
                VariableOptions.of(VariableKind.INTEGER).withMinBound(0.5),
                null)),
        is(ModelException.Reason.ILLEGAL_BOUNDS));
    assertThat(
        reason(() ->
            assembler.declareVariable("x", noIndices,
                CONTINUOUS.withMinBound(3).withMaxBound(2), null)),
        is(ModelException.Reason.ILLEGAL_BOUNDS));

    // Integer bounds may be infinite
    assembler.declareVariable("n", noIndices,
        VariableOptions.of(VariableKind.INTEGER).withMinBound(0)
            .withMaxBound(Double.POSITIVE_INFINITY),
        null);
    assertThat(assembler.model.variables(), hasSize(1));
  }

  /** Redeclaring an instance is an error; disjoint instances of the same
   * family are added. */
  @Test
  void testRedefinition() {
    final Model model = new Model();
    final ModelAssembler assembler = model.define();
    declareRange(assembler, 1, 4);
    assertThat(reason(() -> declareRange(assembler, 1, 4)),
        is(ModelException.Reason.REDEFINITION));
    assertThat(reason(() -> declareRange(assembler, 3, 6)),
        is(ModelException.Reason.REDEFINITION));
    assertThat(model.instances("x"), hasSize(4));
    declareRange(assembler, 5, 8);
    assertThat(model.instances("x"), hasSize(8));
    assertThat(model.instances("x").get(4), is(VarId.of("x", 5)));
  }

  private static void declareRange(ModelAssembler assembler, int from,
      int to) {
    final ModelAssembler.Delta delta = assembler.begin();
    for (int i = from; i <= to; i++) {
      delta.declareVariable("x", ImmutableList.of(i), CONTINUOUS, null);
    }
    delta.commit();
  }

  /** A delta that fails is never committed, so the model is unchanged. */
  @Test
  void testAtomicity() {
    final Model model = new Model();
    final ModelAssembler assembler = model.define();
    declareRange(assembler, 1, 2);
    final ModelAssembler.Delta delta = assembler.begin();
    delta.declareVariable("y", ImmutableList.of(), CONTINUOUS, null);
    delta.declareConstraint("c", var("y"), Op.LE, Polynomial.constant(3));
    assertThat(delta.variable(VarId.of("y")), notNullValue());
    assertThat(delta.instances("x"), hasSize(2));
    assertThrows(ModelException.class,
        () -> delta.declareVariable("x", ImmutableList.of(2), CONTINUOUS,
            null));
    assertThat(model.variable(VarId.of("y")), nullValue());
    assertThat(model.constraints(), hasSize(0));
    assertThat(model.variables(), hasSize(2));
  }

  @Test
  void testObjectiveDefine() {
    final Model model = new Model();
    model.define().declareVariable("x", ImmutableList.of(), CONTINUOUS,
        null);
    model.define().setObjective(var("x"), Direction.MINIMIZE);
    assertThat(
        reason(() ->
            model.define().setObjective(var("x").times(2),
                Direction.MAXIMIZE)),
        is(ModelException.Reason.DUPLICATE_OBJECTIVE));
    assertThat(model.objective(), hasToString("minimize x"));
  }

  @Test
  void testObjectiveModify() {
    final Model model = new Model();
    model.define().declareVariable("x", ImmutableList.of(), CONTINUOUS,
        null);
    model.define().setObjective(var("x"), Direction.MINIMIZE);
    model.modify().setObjective(var("x").times(2), Direction.MAXIMIZE);
    assertThat(model.objective(), hasToString("maximize 2 x"));
  }

  @Test
  void testConstraints() {
    final Model model = new Model();
    final ModelAssembler assembler = model.define();
    declareRange(assembler, 1, 2);
    final Constraint c =
        assembler.declareConstraint("cap", var("x", 1).plus(3D), Op.LT,
            var("x", 2));
    assertThat(c.relation, is(Constraint.Relation.LE));
    assertThat(c.lhs(), hasToString("x(1) - x(2)"));
    assertThat(c.rhs(), is(-3D));
    assertThat(model.constraint("cap"), is(c));

    assertThat(
        reason(() ->
            assembler.declareConstraint("cap", var("x", 1), Op.GE,
                Polynomial.ZERO)),
        is(ModelException.Reason.DUPLICATE_CONSTRAINT));
    assertThrows(NonLinearException.class,
        () -> assembler.declareConstraint("ne", var("x", 1), Op.NE,
            var("x", 2)));
    assertThrows(UndefinedVariableException.class,
        () -> assembler.declareConstraint("u", var("x", 3), Op.GE,
            Polynomial.ZERO));
  }

  @Test
  void testConstantConstraints() {
    final Model model = new Model();
    final ModelAssembler assembler = model.define();
    assertThat(
        assembler.declareConstraint("ok", Polynomial.constant(1), Op.LE,
            Polynomial.constant(2)),
        nullValue());
    assertThat(model.constraints(), hasSize(0));
    assertThat(
        reason(() ->
            assembler.declareConstraint("bad", Polynomial.constant(3),
                Op.LE, Polynomial.constant(2))),
        is(ModelException.Reason.TRIVIAL_CONSTRAINT));

    // Terms that cancel leave a constant constraint
    declareRange(assembler, 1, 1);
    assertThat(
        assembler.declareConstraint("cancel", var("x", 1), Op.EQ,
            var("x", 1)),
        nullValue());
  }

  @Test
  void testNameCollision() {
    final Model model = new Model();
    final ModelAssembler assembler = model.define();
    assembler.declareVariable("qty", ImmutableList.of("whole wheat"),
        CONTINUOUS, null);
    assertThat(
        reason(() ->
            assembler.declareVariable("qty", ImmutableList.of("whole_wheat"),
                CONTINUOUS, null)),
        is(ModelException.Reason.NAME_COLLISION));

    assembler.declareConstraint("cap 1", var("qty", "whole wheat"), Op.LE,
        Polynomial.constant(1));
    assertThat(model.constraint("cap 1").sanitizedName, is("cap_1"));
    assertThat(
        reason(() ->
            assembler.declareConstraint("cap_1", var("qty", "whole wheat"),
                Op.LE, Polynomial.constant(2))),
        is(ModelException.Reason.NAME_COLLISION));
  }

  @Test
  void testDeltaLifecycle() {
    final Model model = new Model();
    final ModelAssembler assembler = model.define();
    final ModelAssembler.Delta d1 = assembler.begin();
    final ModelAssembler.Delta d2 = assembler.begin();
    d1.declareVariable("a", ImmutableList.of(), CONTINUOUS, null);
    d2.declareVariable("b", ImmutableList.of(), CONTINUOUS, null);
    d1.commit();
    assertThrows(IllegalStateException.class, d1::commit);
    assertThrows(IllegalStateException.class, d2::commit);
    assertThat(model.families(), is(ImmutableSet.of("a")));
  }

  /** Names generated in a delta reach the model only when it commits. */
  @Test
  void testGeneratedNames() {
    final Model model = new Model();
    final ModelAssembler.Delta d1 = model.define().begin();
    assertThat(d1.nameGenerator().get("abs"), is("_abs1"));
    assertThat(d1.nameGenerator().ordinal("c", "x <= 1"), is(1));
    assertThat(d1.nameGenerator().ordinal("c", "x <= 1"), is(1));

    // d1 is abandoned
    final ModelAssembler.Delta d2 = model.define().begin();
    assertThat(d2.nameGenerator().get("abs"), is("_abs1"));
    assertThat(d2.nameGenerator().ordinal("c", "y <= 1"), is(1));
    assertThat(d2.nameGenerator().ordinal("c", "x <= 1"), is(2));
    d2.commit();

    final ModelAssembler.Delta d3 = model.define().begin();
    assertThat(d3.nameGenerator().get("abs"), is("_abs2"));
    assertThat(d3.nameGenerator().ordinal("c", "x <= 1"), is(2));
    assertThat(d3.nameGenerator().ordinal("c", "z <= 1"), is(3));
  }
}

// End ModelAssemblerTest.java
