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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tableau.ast.Ast;
import net.hydromatic.tableau.ast.AstNode;
import net.hydromatic.tableau.ast.Op;
import net.hydromatic.tableau.ast.Visitor;
import net.hydromatic.tableau.model.VarId;

/** Evaluates expressions that do not reference decision variables.
 *
 * <p>Holds the model parameters, a read-only map from names to values;
 * values may be nested maps and lists.
 *
 * <p>Values are normalized (see {@link #normalize(Object)}): a result is a
 * {@link Long}, {@link Double}, {@link String}, {@link Boolean},
 * {@link List} or {@link Map}. Arithmetic on two {@code Long} values gives
 * a {@code Long}, except for division.
 *
 * <p>How a bare name is resolved depends on where it occurs:
 * <ul>
 *   <li>as a value, it is the binding in the environment if there is one,
 *   then the model parameter of that name; otherwise it is an error, and
 *   never the name itself;
 *   <li>as the index of a variable, it must be bound in the environment;
 *   <li>as a bracket key, "{@code cost[food]}", it is the binding if there
 *   is one, otherwise the text of the name;
 *   <li>as a dot key, "{@code foods.bread}", it is always the text of the
 *   name.
 * </ul>
 */
public class ConstantEvaluator {
  private final ImmutableMap<String, Object> parameters;

  public ConstantEvaluator(Map<String, ?> parameters) {
    this.parameters = ImmutableMap.copyOf(parameters);
  }

  /** Returns the model parameters. */
  public Map<String, Object> parameters() {
    return parameters;
  }

  /** Returns whether an expression is constant; that is, it references no
   * variables and contains no wildcards. */
  public boolean isConstant(AstNode node) {
    final boolean[] constant = {true};
    node.accept(
        new Visitor() {
          @Override protected void visit(Ast.VariableRef variableRef) {
            constant[0] = false;
          }

          @Override protected void visit(Ast.Wildcard wildcard) {
            constant[0] = false;
          }
        });
    return constant[0];
  }

  /** Normalizes a value. An integral number becomes a {@link Long}, any
   * other number a {@link Double}; strings, booleans, lists and maps are
   * unchanged; anything else becomes its string form. */
  public static Object normalize(Object value) {
    requireNonNull(value, "value");
    if (value instanceof Number) {
      return VarId.normalize(value);
    }
    if (value instanceof String
        || value instanceof Boolean
        || value instanceof List
        || value instanceof Map) {
      return value;
    }
    return value.toString();
  }

  /** Evaluates a constant expression.
   *
   * @throws UnboundSymbolException if a name is neither bound nor a
   * parameter
   * @throws KeyNotFoundException if a lookup key is absent
   * @throws DomainException if a lookup steps into a value that is not a
   * container, or a range has ends that are not integers
   * @throws CompileException if the expression is not constant, or an
   * operator is applied to values of the wrong type */
  public Object evaluate(Ast.Exp exp, Environment env) {
    switch (exp.op) {
    case LITERAL:
      return normalize(((Ast.Literal) exp).value);

    case SYMBOLIC_KEY:
      return resolve((Ast.SymbolicKey) exp, env);

    case LOOKUP:
      final Ast.Lookup lookup = (Ast.Lookup) exp;
      final Object container = evaluate(lookup.container, env);
      return Keys.get(container, key(lookup, env), lookup);

    case PLUS:
    case MINUS:
    case TIMES:
    case DIVIDE:
      final Ast.BinaryOp binaryOp = (Ast.BinaryOp) exp;
      return arithmetic(binaryOp.op, evaluate(binaryOp.left, env),
          evaluate(binaryOp.right, env), exp);

    case NEGATE:
      return arithmetic(Op.MINUS, 0L,
          evaluate(((Ast.Negate) exp).exp, env), exp);

    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      final Ast.Comparison comparison = (Ast.Comparison) exp;
      return compare(comparison.op, evaluate(comparison.left, env),
          evaluate(comparison.right, env), exp);

    case SUM:
      Object sum = 0L;
      for (Ast.Exp arg : ((Ast.Sum) exp).args) {
        sum = arithmetic(Op.PLUS, sum, evaluate(arg, env), exp);
      }
      return sum;

    case GENERATOR_SUM:
      final Ast.GeneratorSum generatorSum = (Ast.GeneratorSum) exp;
      Object total = 0L;
      for (Environment env2
          : Generators.enumerate(generatorSum.qualifiers, env, this)) {
        total = arithmetic(Op.PLUS, total, evaluate(generatorSum.body, env2),
            exp);
      }
      return total;

    case ABS:
      final Object v = evaluate(((Ast.Abs) exp).exp, env);
      return compare(Op.LT, v, 0L, exp)
          ? arithmetic(Op.MINUS, 0L, v, exp)
          : v;

    case MAX:
    case MIN:
      Object best = null;
      for (Ast.Exp arg : ((Ast.Call) exp).args) {
        final Object o = evaluate(arg, env);
        if (best == null
            || compare(exp.op == Op.MAX ? Op.GT : Op.LT, o, best, exp)) {
          best = o;
        }
      }
      if (best == null) {
        throw new CompileException("'" + exp.op.lowerName()
            + "' requires at least one argument", exp);
      }
      return best;

    case AND:
      for (Ast.Exp arg : ((Ast.Call) exp).args) {
        if (!evaluateBoolean(arg, env)) {
          return false;
        }
      }
      return true;

    case OR:
      for (Ast.Exp arg : ((Ast.Call) exp).args) {
        if (evaluateBoolean(arg, env)) {
          return true;
        }
      }
      return false;

    case NOT:
      return !evaluateBoolean(((Ast.Not) exp).exp, env);

    case IF:
      final Ast.If anIf = (Ast.If) exp;
      return evaluateBoolean(anIf.condition, env)
          ? evaluate(anIf.ifTrue, env)
          : evaluate(anIf.ifFalse, env);

    case PIECEWISE_LINEAR:
      final Ast.PiecewiseLinear pwl = (Ast.PiecewiseLinear) exp;
      return normalize(
          piecewiseLinear(pwl, evaluateDouble(pwl.exp, env)));

    case RANGE:
      final Ast.Range range = (Ast.Range) exp;
      final long from = integer(evaluate(range.from, env), range);
      final long to = integer(evaluate(range.to, env), range);
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (long i = from; i <= to; i++) {
        b.add(i);
      }
      return b.build();

    case LIST:
      final ImmutableList.Builder<Object> b2 = ImmutableList.builder();
      for (Ast.Exp arg : ((Ast.ListExp) exp).args) {
        b2.add(evaluate(arg, env));
      }
      return b2.build();

    case VARIABLE_REF:
      throw new CompileException("expression is not constant: it references "
          + "variable '" + ((Ast.VariableRef) exp).name + "'", exp);

    case WILDCARD:
    case PATTERN_INSTANCE_SET:
      throw new AmbiguousWildcardException("wildcard is not valid here",
          exp);

    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  /** Evaluates a constant expression that must be a number. */
  public double evaluateDouble(Ast.Exp exp, Environment env) {
    final Object o = evaluate(exp, env);
    if (!(o instanceof Number)) {
      throw new CompileException("expected a number, got '" + o + "'", exp);
    }
    return ((Number) o).doubleValue();
  }

  /** Evaluates a constant expression that must be a boolean. */
  public boolean evaluateBoolean(Ast.Exp exp, Environment env) {
    final Object o = evaluate(exp, env);
    if (!(o instanceof Boolean)) {
      throw new DomainException("expected a boolean, got '" + o + "'", exp);
    }
    return (Boolean) o;
  }

  /** Resolves an index of a {@link Ast.VariableRef}. A bare name must be
   * bound in the environment; any other expression must be constant.
   *
   * @throws UnboundSymbolException if a bare name is not bound */
  public Object resolveIndex(Ast.Exp index, Environment env) {
    switch (index.op) {
    case SYMBOLIC_KEY:
      final String name = ((Ast.SymbolicKey) index).name;
      final Binding binding = env.getOpt(name);
      if (binding == null) {
        throw new UnboundSymbolException(name, index);
      }
      return binding.value;
    case WILDCARD:
      throw new AmbiguousWildcardException("wildcard has not been expanded",
          index);
    default:
      return evaluate(index, env);
    }
  }

  /** Resolves a bare name in value position. */
  private Object resolve(Ast.SymbolicKey key, Environment env) {
    final Binding binding = env.getOpt(key.name);
    if (binding != null) {
      return binding.value;
    }
    final Object value = parameters.get(key.name);
    if (value != null) {
      return normalize(value);
    }
    throw new UnboundSymbolException(key.name, key);
  }

  /** Returns the key of one step of a lookup. */
  private Object key(Ast.Lookup lookup, Environment env) {
    if (lookup.key instanceof Ast.SymbolicKey) {
      final String name = ((Ast.SymbolicKey) lookup.key).name;
      if (lookup.dot) {
        return name;
      }
      final Binding binding = env.getOpt(name);
      return binding != null ? binding.value : name;
    }
    return evaluate(lookup.key, env);
  }

  private static long integer(Object o, AstNode node) {
    if (o instanceof Long) {
      return (Long) o;
    }
    throw new DomainException("range bound must be an integer, got '" + o
        + "'", node);
  }

  /** Applies an arithmetic operator. */
  static Object arithmetic(Op op, Object left, Object right, AstNode node) {
    if (!(left instanceof Number) || !(right instanceof Number)) {
      throw new CompileException("cannot apply '" + op.padded.trim()
          + "' to '" + left + "' and '" + right + "'", node);
    }
    if (left instanceof Long && right instanceof Long && op != Op.DIVIDE) {
      final long a = (Long) left;
      final long b = (Long) right;
      try {
        switch (op) {
        case PLUS:
          return Math.addExact(a, b);
        case MINUS:
          return Math.subtractExact(a, b);
        default:
          return Math.multiplyExact(a, b);
        }
      } catch (ArithmeticException e) {
        throw new CompileException("integer overflow in '" + a
            + op.padded + b + "'", node, e);
      }
    }
    final double a = ((Number) left).doubleValue();
    final double b = ((Number) right).doubleValue();
    switch (op) {
    case PLUS:
      return normalize(a + b);
    case MINUS:
      return normalize(a - b);
    case TIMES:
      return normalize(a * b);
    default:
      if (b == 0D) {
        throw new CompileException("division by zero", node);
      }
      return normalize(a / b);
    }
  }

  /** Applies a comparison operator. Numbers compare by value, strings
   * lexicographically; "{@code ==}" and "{@code !=}" also accept other
   * values, which are equal if they match as keys. */
  static boolean compare(Op op, Object left, Object right, AstNode node) {
    final int c;
    if (left instanceof Number && right instanceof Number) {
      c = Double.compare(((Number) left).doubleValue(),
          ((Number) right).doubleValue());
    } else if (left instanceof String && right instanceof String) {
      c = ((String) left).compareTo((String) right);
    } else if (op == Op.EQ || op == Op.NE) {
      final boolean equal = left.equals(right);
      return op == Op.EQ ? equal : !equal;
    } else {
      throw new CompileException("cannot compare '" + left + "' and '"
          + right + "'", node);
    }
    switch (op) {
    case EQ:
      return c == 0;
    case NE:
      return c != 0;
    case LT:
      return c < 0;
    case LE:
      return c <= 0;
    case GT:
      return c > 0;
    default:
      return c >= 0;
    }
  }

  /** Evaluates a piecewise-linear function at a point.
   *
   * @throws DomainException if {@code x} is outside the breakpoints */
  static double piecewiseLinear(Ast.PiecewiseLinear pwl, double x) {
    final List<Double> b = pwl.breakpoints;
    if (x < b.get(0) || x > b.get(b.size() - 1)) {
      throw new DomainException("value " + x + " is outside the domain ["
          + b.get(0) + ", " + b.get(b.size() - 1)
          + "] of the piecewise-linear function", pwl);
    }
    int k = 0;
    while (k < pwl.slopes.size() - 1 && x > b.get(k + 1)) {
      ++k;
    }
    return pwl.slopes.get(k) * x + pwl.intercepts.get(k);
  }
}

// End ConstantEvaluator.java
