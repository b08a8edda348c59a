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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tableau.ast.Ast;
import net.hydromatic.tableau.ast.Op;
import net.hydromatic.tableau.model.Interval;
import net.hydromatic.tableau.model.ModelAssembler;
import net.hydromatic.tableau.model.Polynomial;
import net.hydromatic.tableau.model.VarId;
import net.hydromatic.tableau.model.VariableKind;
import net.hydromatic.tableau.model.VariableOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Replaces a nonlinear operator with an auxiliary variable, plus
 * auxiliary variables and linear constraints that force the auxiliary
 * variable to equal the operator's value.
 *
 * <p>Each operator gets a family name from the model's
 * {@link NameGenerator}, such as "{@code _max2}"; its helper variables and
 * constraints are named after it, such as "{@code _max2_sel(1)}" and
 * "{@code _max2_ge(1)}".
 *
 * <p>Formulations that switch a constraint on and off with a binary
 * variable use a big-M constant derived from the ranges of the operands,
 * which are computed from the bounds of their variables. If an operand is
 * unbounded, no such constant exists. */
public class Linearizer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Linearizer.class);

  private final PolynomialBuilder builder;
  private final ModelAssembler.Delta delta;

  Linearizer(PolynomialBuilder builder, ModelAssembler.Delta delta) {
    this.builder = requireNonNull(builder);
    this.delta = requireNonNull(delta);
  }

  /** Linearizes a call to {@code abs}, {@code max}, {@code min},
   * {@code and}, {@code or}, {@code if} or a piecewise-linear function,
   * and returns the polynomial that stands for its value. */
  public Polynomial linearize(Ast.Exp exp, Environment env) {
    switch (exp.op) {
    case ABS:
      return abs((Ast.Abs) exp, builder.build(((Ast.Abs) exp).exp, env));
    case MAX:
    case MIN:
      return maxMin((Ast.Call) exp,
          builder.buildAll(((Ast.Call) exp).args, env));
    case AND:
    case OR:
      return andOr((Ast.Call) exp,
          builder.buildAll(((Ast.Call) exp).args, env));
    case IF:
      return ifThenElse((Ast.If) exp, env);
    case PIECEWISE_LINEAR:
      final Ast.PiecewiseLinear pwl = (Ast.PiecewiseLinear) exp;
      return piecewiseLinear(pwl, builder.build(pwl.exp, env));
    default:
      throw new AssertionError("cannot linearize " + exp.op);
    }
  }

  /** Linearizes "{@code abs(e)}" as {@code a >= e}, {@code a >= -e},
   * {@code a >= 0}. The auxiliary variable is at least the absolute value,
   * and equals it when the objective pushes it down. */
  private Polynomial abs(Ast.Abs abs, Polynomial e) {
    if (e.isConstant()) {
      return Polynomial.constant(Math.abs(e.constant));
    }
    final String family = family(Op.ABS);
    final Polynomial a =
        declare(family, ImmutableList.of(),
            VariableOptions.of(VariableKind.CONTINUOUS).withMinBound(0D),
            abs);
    constrain(family + "_pos", a, Op.GE, e);
    constrain(family + "_neg", a.plus(e), Op.GE, Polynomial.ZERO);
    return a;
  }

  /** Linearizes "{@code max(a1, ..., an)}" or "{@code min(a1, ..., an)}".
   *
   * <p>For max, with binary selectors {@code y_i} that sum to 1:
   * {@code z >= a_i} and {@code z <= a_i + M_i (1 - y_i)}, where
   * {@code M_i = max(U) - L_i}. Min is symmetric. */
  private Polynomial maxMin(Ast.Call call, List<Polynomial> args) {
    final boolean max = call.op == Op.MAX;
    if (args.isEmpty()) {
      throw new CompileException(call.op.lowerName()
          + " of an empty set of instances", call);
    }

    // Fold the constant operands into one.
    final List<Polynomial> operands = new ArrayList<>();
    Double constant = null;
    for (Polynomial arg : args) {
      if (arg.isConstant()) {
        constant = constant == null ? arg.constant
            : max ? Math.max(constant, arg.constant)
            : Math.min(constant, arg.constant);
      } else {
        operands.add(arg);
      }
    }
    if (constant != null) {
      operands.add(Polynomial.constant(constant));
    }
    if (operands.size() == 1) {
      return operands.get(0);
    }

    final List<Interval> ranges = ranges(call, operands);
    double lower = max ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    double upper = lower;
    for (Interval range : ranges) {
      lower = max ? Math.max(lower, range.lower) : Math.min(lower, range.lower);
      upper = max ? Math.max(upper, range.upper) : Math.min(upper, range.upper);
    }

    final String family = family(call.op);
    final Polynomial z =
        declare(family, ImmutableList.of(),
            VariableOptions.of(VariableKind.CONTINUOUS)
                .withMinBound(lower).withMaxBound(upper),
            call);
    Polynomial selectors = Polynomial.ZERO;
    for (int i = 0; i < operands.size(); i++) {
      final int ordinal = i + 1;
      final Polynomial a = operands.get(i);
      final Interval range = ranges.get(i);
      final Polynomial y =
          declare(family + "_sel", ImmutableList.of(ordinal),
              VariableOptions.of(VariableKind.BINARY), call);
      selectors = selectors.plus(y);
      if (max) {
        // z >= a_i; z + M y_i <= a_i + M
        final double m = upper - range.lower;
        constrain(family + "_ge(" + ordinal + ")", z, Op.GE, a);
        constrain(family + "_le(" + ordinal + ")", z.plus(y.times(m)),
            Op.LE, a.plus(m));
      } else {
        // z <= a_i; z - M y_i >= a_i - M
        final double m = range.upper - lower;
        constrain(family + "_le(" + ordinal + ")", z, Op.LE, a);
        constrain(family + "_ge(" + ordinal + ")", z.minus(y.times(m)),
            Op.GE, a.plus(-m));
      }
    }
    constrain(family + "_one", selectors, Op.EQ, Polynomial.constant(1D));
    return z;
  }

  /** Linearizes "{@code and(o1, ..., on)}" or "{@code or(o1, ..., on)}",
   * whose operands must take only the values 0 and 1.
   *
   * <p>For and: {@code z <= o_i}, {@code z >= sum(o_i) - (n - 1)}. For or:
   * {@code z >= o_i}, {@code z <= sum(o_i)}. */
  private Polynomial andOr(Ast.Call call, List<Polynomial> args) {
    final boolean and = call.op == Op.AND;
    final List<Polynomial> operands = new ArrayList<>();
    for (Polynomial arg : args) {
      if (arg.isConstant()) {
        if (arg.constant != 0D && arg.constant != 1D) {
          throw new NonLinearException("operand of " + call.op.lowerName()
              + " must be 0 or 1; got " + arg.constant, call);
        }
        if (and && arg.constant == 0D) {
          return Polynomial.ZERO;
        }
        if (!and && arg.constant == 1D) {
          return Polynomial.constant(1D);
        }
        // Constant 1 in "and", or 0 in "or", has no effect.
        continue;
      }
      if (!isBinaryValued(arg)) {
        throw new NonLinearException("operand of " + call.op.lowerName()
            + " must be a binary expression; '" + arg + "' has range "
            + delta.range(arg), call);
      }
      operands.add(arg);
    }
    switch (operands.size()) {
    case 0:
      return Polynomial.constant(and ? 1D : 0D);
    case 1:
      return operands.get(0);
    default:
      break;
    }

    final String family = family(call.op);
    final Polynomial z =
        declare(family, ImmutableList.of(),
            VariableOptions.of(VariableKind.BINARY), call);
    Polynomial total = Polynomial.ZERO;
    for (int i = 0; i < operands.size(); i++) {
      final int ordinal = i + 1;
      final Polynomial o = operands.get(i);
      total = total.plus(o);
      if (and) {
        constrain(family + "_le(" + ordinal + ")", z, Op.LE, o);
      } else {
        constrain(family + "_ge(" + ordinal + ")", z, Op.GE, o);
      }
    }
    if (and) {
      constrain(family + "_ge", z, Op.GE,
          total.plus(-(operands.size() - 1)));
    } else {
      constrain(family + "_le", z, Op.LE, total);
    }
    return z;
  }

  /** Linearizes "{@code if c then t else e}".
   *
   * <p>If the condition is constant, returns the chosen branch. Otherwise
   * the condition must take only the values 0 and 1, and the auxiliary
   * variable {@code z}, whose bounds are the hull of the branches' ranges,
   * is forced to {@code t} when {@code c = 1} and to {@code e} when
   * {@code c = 0}. */
  private Polynomial ifThenElse(Ast.If anIf, Environment env) {
    final ConstantEvaluator evaluator = builder.evaluator();
    if (evaluator.isConstant(anIf.condition)) {
      return evaluator.evaluateBoolean(anIf.condition, env)
          ? builder.build(anIf.ifTrue, env)
          : builder.build(anIf.ifFalse, env);
    }
    final Polynomial c = builder.build(anIf.condition, env);
    if (c.isConstant()) {
      return c.constant != 0D
          ? builder.build(anIf.ifTrue, env)
          : builder.build(anIf.ifFalse, env);
    }
    if (!isBinaryValued(c)) {
      throw new NonLinearException("condition must be a binary expression; '"
          + c + "' has range " + delta.range(c), anIf);
    }
    final Polynomial t = builder.build(anIf.ifTrue, env);
    final Polynomial e = builder.build(anIf.ifFalse, env);
    if (t.equals(e)) {
      return t;
    }
    final List<Interval> ranges = ranges(anIf, ImmutableList.of(t, e));
    final Interval rt = ranges.get(0);
    final Interval re = ranges.get(1);
    final Interval rz = rt.hull(re);

    final String family = family(Op.IF);
    final Polynomial z =
        declare(family, ImmutableList.of(),
            VariableOptions.of(VariableKind.CONTINUOUS)
                .withMinBound(rz.lower).withMaxBound(rz.upper),
            anIf);
    // c = 1 implies z = t
    final double m0 = rz.upper - rt.lower;
    final double m1 = rt.upper - rz.lower;
    constrain(family + "_then_le", z.minus(t).plus(c.times(m0)), Op.LE,
        Polynomial.constant(m0));
    constrain(family + "_then_ge", z.minus(t).minus(c.times(m1)), Op.GE,
        Polynomial.constant(-m1));
    // c = 0 implies z = e
    final double m2 = rz.upper - re.lower;
    final double m3 = re.upper - rz.lower;
    constrain(family + "_else_le", z.minus(e).minus(c.times(m2)), Op.LE,
        Polynomial.ZERO);
    constrain(family + "_else_ge", z.minus(e).plus(c.times(m3)), Op.GE,
        Polynomial.ZERO);
    return z;
  }

  /** Linearizes a piecewise-linear function of {@code x}, using one binary
   * variable {@code y_k} and one continuous variable {@code x_k} per
   * segment:
   *
   * <pre>
   * sum(y_k) = 1
   * b_(k-1) y_k &lt;= x_k &lt;= b_k y_k
   * sum(x_k) = x
   * f = sum(s_k x_k + c_k y_k)
   * </pre>
   *
   * <p>This forces {@code x} into {@code [b_0, b_n]}, and is exact
   * there. */
  private Polynomial piecewiseLinear(Ast.PiecewiseLinear pwl, Polynomial x) {
    if (x.isConstant()) {
      return Polynomial.constant(
          ConstantEvaluator.piecewiseLinear(pwl, x.constant));
    }
    final List<Double> b = pwl.breakpoints;
    final List<Double> s = pwl.slopes;
    final List<Double> c = pwl.intercepts;
    final int n = s.size();

    double lower = Double.POSITIVE_INFINITY;
    double upper = Double.NEGATIVE_INFINITY;
    for (int k = 0; k < n; k++) {
      for (double v : new double[] {s.get(k) * b.get(k) + c.get(k),
          s.get(k) * b.get(k + 1) + c.get(k)}) {
        lower = Math.min(lower, v);
        upper = Math.max(upper, v);
      }
    }

    final String family = family(Op.PIECEWISE_LINEAR);
    final Polynomial f =
        declare(family, ImmutableList.of(),
            VariableOptions.of(VariableKind.CONTINUOUS)
                .withMinBound(lower).withMaxBound(upper),
            pwl);
    Polynomial selectors = Polynomial.ZERO;
    Polynomial parts = Polynomial.ZERO;
    Polynomial value = Polynomial.ZERO;
    for (int k = 0; k < n; k++) {
      final int ordinal = k + 1;
      final double from = b.get(k);
      final double to = b.get(k + 1);
      final Polynomial y =
          declare(family + "_seg", ImmutableList.of(ordinal),
              VariableOptions.of(VariableKind.BINARY), pwl);
      final Polynomial xk =
          declare(family + "_x", ImmutableList.of(ordinal),
              VariableOptions.of(VariableKind.CONTINUOUS)
                  .withMinBound(Math.min(0D, from))
                  .withMaxBound(Math.max(0D, to)),
              pwl);
      constrain(family + "_lo(" + ordinal + ")", xk.minus(y.times(from)),
          Op.GE, Polynomial.ZERO);
      constrain(family + "_hi(" + ordinal + ")", xk.minus(y.times(to)),
          Op.LE, Polynomial.ZERO);
      selectors = selectors.plus(y);
      parts = parts.plus(xk);
      value = value.plus(xk.times(s.get(k))).plus(y.times(c.get(k)));
    }
    constrain(family + "_one", selectors, Op.EQ, Polynomial.constant(1D));
    constrain(family + "_sum", parts, Op.EQ, x);
    constrain(family + "_def", f, Op.EQ, value);
    return f;
  }

  /** Returns the ranges of some operands.
   *
   * @throws UnboundedLinearizationException if any is unbounded */
  private List<Interval> ranges(Ast.Exp exp, List<Polynomial> operands) {
    final List<Interval> ranges = new ArrayList<>();
    for (Polynomial operand : operands) {
      final Interval range = delta.range(operand);
      if (!range.isBounded()) {
        throw new UnboundedLinearizationException("cannot linearize: "
            + "operand '" + operand + "' has unbounded range " + range
            + "; declare bounds on its variables", exp);
      }
      ranges.add(range);
    }
    return ranges;
  }

  /** Returns whether a polynomial takes only the values 0 and 1. */
  private boolean isBinaryValued(Polynomial p) {
    return delta.range(p).isWithinUnit() && delta.isIntegral(p);
  }

  /** Returns an unused family name for an auxiliary variable. */
  private String family(Op op) {
    final String operator = op == Op.PIECEWISE_LINEAR ? "pwl" : op.lowerName();
    for (;;) {
      final String family = delta.nameGenerator().get(operator);
      if (delta.instances(family).isEmpty()
          && delta.instances(family + "_sel").isEmpty()) {
        return family;
      }
    }
  }

  private Polynomial declare(String family, List<?> indices,
      VariableOptions options, Ast.Exp exp) {
    final VarId id =
        delta.declareVariable(family, indices, options, exp.toString()).id;
    LOGGER.debug("Declared auxiliary variable {} for '{}'", id, exp);
    return Polynomial.variable(id);
  }

  private void constrain(String name, Polynomial left, Op op,
      Polynomial right) {
    delta.declareConstraint(name, left, op, right);
  }
}

// End Linearizer.java
