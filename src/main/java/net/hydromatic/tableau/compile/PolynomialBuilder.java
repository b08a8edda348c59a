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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.tableau.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tableau.ast.Ast;
import net.hydromatic.tableau.ast.Op;
import net.hydromatic.tableau.model.ModelAssembler;
import net.hydromatic.tableau.model.Polynomial;
import net.hydromatic.tableau.model.VarId;

/** Converts an expression into a {@link Polynomial}.
 *
 * <p>Sums and differences are merged term by term; a product needs at
 * least one constant side and a quotient a constant divisor. Constant
 * sub-expressions are evaluated by a {@link ConstantEvaluator}; wildcards
 * are expanded by a {@link WildcardExpander}; nonlinear operators such as
 * {@code abs} and {@code max} are replaced by auxiliary variables and
 * constraints, which a {@link Linearizer} adds to the pending delta. */
public class PolynomialBuilder {
  private final ConstantEvaluator evaluator;
  private final ModelAssembler.Delta delta;
  private final WildcardExpander expander;
  private final Linearizer linearizer;

  public PolynomialBuilder(ConstantEvaluator evaluator,
      ModelAssembler.Delta delta) {
    this.evaluator = requireNonNull(evaluator);
    this.delta = requireNonNull(delta);
    this.expander = new WildcardExpander(evaluator, delta);
    this.linearizer = new Linearizer(this, delta);
  }

  public ConstantEvaluator evaluator() {
    return evaluator;
  }

  public WildcardExpander expander() {
    return expander;
  }

  /** Converts an expression, in a given environment, into a polynomial.
   *
   * @throws NonLinearException if the expression is not linear and cannot
   * be linearized
   * @throws UndefinedVariableException if it references a variable
   * instance that has not been declared */
  public Polynomial build(Ast.Exp exp, Environment env) {
    if (ast.hasFreeWildcard(exp)) {
      return build(expander.expandSum(exp, env), env);
    }
    if (evaluator.isConstant(exp)) {
      return Polynomial.constant(toNumber(evaluator.evaluate(exp, env), exp));
    }
    switch (exp.op) {
    case VARIABLE_REF:
      return Polynomial.variable(resolve((Ast.VariableRef) exp, env));

    case PLUS:
    case MINUS:
      final Ast.BinaryOp sum = (Ast.BinaryOp) exp;
      final Polynomial left = build(sum.left, env);
      final Polynomial right = build(sum.right, env);
      return exp.op == Op.PLUS
          ? left.plus(right)
          : left.minus(right);

    case TIMES:
      final Ast.BinaryOp times = (Ast.BinaryOp) exp;
      final Polynomial p0 = build(times.left, env);
      final Polynomial p1 = build(times.right, env);
      if (p0.isConstant()) {
        return p1.times(p0.constant);
      }
      if (p1.isConstant()) {
        return p0.times(p1.constant);
      }
      throw new NonLinearException("product of two non-constant "
          + "expressions is not linear", exp);

    case DIVIDE:
      final Ast.BinaryOp divide = (Ast.BinaryOp) exp;
      final Polynomial dividend = build(divide.left, env);
      final Polynomial divisor = build(divide.right, env);
      if (!divisor.isConstant()) {
        throw new NonLinearException("division by a non-constant "
            + "expression is not linear", exp);
      }
      if (divisor.constant == 0D) {
        throw new CompileException("division by zero", exp);
      }
      return dividend.divide(divisor.constant);

    case NEGATE:
      return build(((Ast.Negate) exp).exp, env).negate();

    case SUM:
      final List<Ast.Exp> args = ((Ast.Sum) exp).args;
      if (args.size() == 1 && ast.hasFreeWildcard(args.get(0))) {
        return build(expander.expandSum(args.get(0), env), env);
      }
      Polynomial total = Polynomial.ZERO;
      for (Ast.Exp arg : args) {
        total = total.plus(build(arg, env));
      }
      return total;

    case GENERATOR_SUM:
      final Ast.GeneratorSum generatorSum = (Ast.GeneratorSum) exp;
      Polynomial p = Polynomial.ZERO;
      for (Environment env2
          : Generators.enumerate(generatorSum.qualifiers, env, evaluator)) {
        p = p.plus(build(generatorSum.body, env2));
      }
      return p;

    case ABS:
    case MAX:
    case MIN:
    case AND:
    case OR:
    case IF:
    case PIECEWISE_LINEAR:
      return linearizer.linearize(exp, env);

    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
    case NOT:
      throw new NonLinearException("a condition on variables cannot be "
          + "used as a value", exp);

    case PATTERN_INSTANCE_SET:
      throw new CompileException("a wildcard pattern is only valid as the "
          + "argument of max, min, and, or", exp);

    default:
      throw new CompileException("expression cannot be used as a value",
          exp);
    }
  }

  /** Converts a list of arguments into polynomials; an argument that is a
   * {@link Ast.PatternInstanceSet} contributes one polynomial per
   * instance. */
  public List<Polynomial> buildAll(List<Ast.Exp> args, Environment env) {
    final List<Polynomial> list = new ArrayList<>();
    for (Ast.Exp arg : args) {
      if (arg instanceof Ast.PatternInstanceSet) {
        final Ast.Exp pattern = ((Ast.PatternInstanceSet) arg).pattern;
        for (Ast.Exp e : expander.expandInstances(pattern, env)) {
          list.add(build(e, env));
        }
      } else {
        list.add(build(arg, env));
      }
    }
    return list;
  }

  /** Resolves a variable reference to the identity of a declared
   * instance. */
  VarId resolve(Ast.VariableRef ref, Environment env) {
    final List<Object> indices = new ArrayList<>();
    for (Ast.Exp index : ref.indices) {
      indices.add(evaluator.resolveIndex(index, env));
    }
    final VarId id = VarId.of(ref.name, indices);
    if (delta.variable(id) == null) {
      throw new UndefinedVariableException(id, ref);
    }
    return id;
  }

  private static double toNumber(Object value, Ast.Exp exp) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? 1D : 0D;
    }
    throw new CompileException("expected a number, got '" + value + "'",
        exp);
  }
}

// End PolynomialBuilder.java
