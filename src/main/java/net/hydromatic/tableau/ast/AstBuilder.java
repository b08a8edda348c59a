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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import net.hydromatic.tableau.model.Direction;
import net.hydromatic.tableau.model.VariableOptions;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes.
 *
 * <p>This is the only way to create nodes; a front end that parses the
 * textual surface syntax hands the compiler trees built here. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Names that may be used after a dot, as in "{@code foods.bread}". */
  private static final Pattern SIMPLE_NAME =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private static final Ast.Wildcard WILDCARD = new Ast.Wildcard();

  /** Returns whether an expression has a wildcard that is not inside a
   * nested sum or pattern.
   *
   * <p>A {@link Ast.Sum}, {@link Ast.GeneratorSum} or
   * {@link Ast.PatternInstanceSet} owns the wildcards inside it; so
   * "{@code x(_) + 1}" has a free wildcard, and "{@code sum(x(_))}" does
   * not. */
  public boolean hasFreeWildcard(AstNode node) {
    final boolean[] found = {false};
    node.accept(
        new Visitor() {
          @Override protected void visit(Ast.Wildcard wildcard) {
            found[0] = true;
          }

          @Override protected void visit(Ast.Sum sum) {}

          @Override protected void visit(Ast.GeneratorSum generatorSum) {}

          @Override protected void visit(
              Ast.PatternInstanceSet patternInstanceSet) {
          }
        });
    return found[0];
  }

  /** Returns whether a name may be used as a dot key. */
  public boolean isSimpleName(String name) {
    return SIMPLE_NAME.matcher(name).matches();
  }

  // literals and names

  public Ast.Literal intLiteral(long value) {
    return new Ast.Literal(BigDecimal.valueOf(value));
  }

  public Ast.Literal numberLiteral(BigDecimal value) {
    return new Ast.Literal(value);
  }

  public Ast.Literal realLiteral(double value) {
    return new Ast.Literal(BigDecimal.valueOf(value));
  }

  public Ast.Literal stringLiteral(String value) {
    return new Ast.Literal(value);
  }

  public Ast.Literal boolLiteral(boolean value) {
    return new Ast.Literal(value);
  }

  /** Creates a literal from a value produced by evaluation: a number, a
   * string or a boolean. */
  public Ast.Literal literal(Object value) {
    if (value instanceof BigDecimal) {
      return numberLiteral((BigDecimal) value);
    }
    if (value instanceof Long || value instanceof Integer) {
      return intLiteral(((Number) value).longValue());
    }
    if (value instanceof Number) {
      return realLiteral(((Number) value).doubleValue());
    }
    if (value instanceof Boolean) {
      return boolLiteral((Boolean) value);
    }
    return stringLiteral(value.toString());
  }

  public Ast.SymbolicKey id(String name) {
    return new Ast.SymbolicKey(name);
  }

  public Ast.Wildcard wildcard() {
    return WILDCARD;
  }

  // variables and lookups

  public Ast.VariableRef variableRef(String name, Ast.Exp... indices) {
    return variableRef(name, ImmutableList.copyOf(indices));
  }

  public Ast.VariableRef variableRef(String name, List<Ast.Exp> indices) {
    return new Ast.VariableRef(name, ImmutableList.copyOf(indices));
  }

  /** Creates a bracket lookup, "{@code container[key]}". */
  public Ast.Lookup lookup(Ast.Exp container, Ast.Exp key) {
    return new Ast.Lookup(container, key, false);
  }

  /** Creates a chain of bracket lookups,
   * "{@code root[key0][key1]...}". */
  public Ast.Lookup lookup(String root, Ast.Exp... keys) {
    checkArgument(keys.length > 0, "lookup requires at least one key");
    Ast.Exp e = id(root);
    for (Ast.Exp key : keys) {
      e = lookup(e, key);
    }
    return (Ast.Lookup) e;
  }

  /** Creates a dot lookup, "{@code container.name}".
   *
   * <p>The shorthand is only valid for a simple name; a key with embedded
   * separators or punctuation must use brackets. */
  public Ast.Lookup dot(Ast.Exp container, String name) {
    checkArgument(isSimpleName(name),
        "'%s' is not a simple name; use %s[\"%s\"]", name, container, name);
    return new Ast.Lookup(container, id(name), true);
  }

  // arithmetic

  public Ast.BinaryOp binaryOp(Op op, Ast.Exp left, Ast.Exp right) {
    return new Ast.BinaryOp(op, left, right);
  }

  public Ast.BinaryOp plus(Ast.Exp left, Ast.Exp right) {
    return binaryOp(Op.PLUS, left, right);
  }

  public Ast.BinaryOp minus(Ast.Exp left, Ast.Exp right) {
    return binaryOp(Op.MINUS, left, right);
  }

  public Ast.BinaryOp times(Ast.Exp left, Ast.Exp right) {
    return binaryOp(Op.TIMES, left, right);
  }

  public Ast.BinaryOp divide(Ast.Exp left, Ast.Exp right) {
    return binaryOp(Op.DIVIDE, left, right);
  }

  public Ast.Negate negate(Ast.Exp exp) {
    return new Ast.Negate(exp);
  }

  // comparisons

  public Ast.Comparison comparison(Op op, Ast.Exp left, Ast.Exp right) {
    return new Ast.Comparison(op, left, right);
  }

  public Ast.Comparison equal(Ast.Exp left, Ast.Exp right) {
    return comparison(Op.EQ, left, right);
  }

  public Ast.Comparison notEqual(Ast.Exp left, Ast.Exp right) {
    return comparison(Op.NE, left, right);
  }

  public Ast.Comparison lessThanOrEqualTo(Ast.Exp left, Ast.Exp right) {
    return comparison(Op.LE, left, right);
  }

  public Ast.Comparison greaterThanOrEqualTo(Ast.Exp left, Ast.Exp right) {
    return comparison(Op.GE, left, right);
  }

  public Ast.Comparison lessThan(Ast.Exp left, Ast.Exp right) {
    return comparison(Op.LT, left, right);
  }

  public Ast.Comparison greaterThan(Ast.Exp left, Ast.Exp right) {
    return comparison(Op.GT, left, right);
  }

  // sums

  public Ast.Sum sum(Ast.Exp... args) {
    return sum(ImmutableList.copyOf(args));
  }

  public Ast.Sum sum(List<Ast.Exp> args) {
    return new Ast.Sum(ImmutableList.copyOf(args));
  }

  public Ast.GeneratorSum generatorSum(Ast.Exp body,
      Ast.Qualifier... qualifiers) {
    return generatorSum(body, ImmutableList.copyOf(qualifiers));
  }

  public Ast.GeneratorSum generatorSum(Ast.Exp body,
      List<Ast.Qualifier> qualifiers) {
    return new Ast.GeneratorSum(body, ImmutableList.copyOf(qualifiers));
  }

  // nonlinear functions

  public Ast.Abs abs(Ast.Exp exp) {
    return new Ast.Abs(exp);
  }

  public Ast.Call max(Ast.Exp... args) {
    return call(Op.MAX, ImmutableList.copyOf(args));
  }

  public Ast.Call min(Ast.Exp... args) {
    return call(Op.MIN, ImmutableList.copyOf(args));
  }

  public Ast.Call and(Ast.Exp... args) {
    return call(Op.AND, ImmutableList.copyOf(args));
  }

  public Ast.Call or(Ast.Exp... args) {
    return call(Op.OR, ImmutableList.copyOf(args));
  }

  /** Creates a call to {@code max}, {@code min}, {@code and} or {@code or}.
   *
   * <p>A single argument that has a free wildcard, as in
   * "{@code max(x(_))}", is wrapped in a {@link Ast.PatternInstanceSet}, so
   * that the function applies across the instances of the pattern. In
   * "{@code max(sum(x(_)))}" the wildcard belongs to the sum, and the
   * argument is not wrapped. */
  public Ast.Call call(Op op, List<Ast.Exp> args) {
    if (args.size() == 1
        && !(args.get(0) instanceof Ast.PatternInstanceSet)
        && hasFreeWildcard(args.get(0))) {
      return new Ast.Call(op,
          ImmutableList.of(patternInstanceSet(args.get(0))));
    }
    return new Ast.Call(op, ImmutableList.copyOf(args));
  }

  public Ast.PatternInstanceSet patternInstanceSet(Ast.Exp pattern) {
    return new Ast.PatternInstanceSet(pattern);
  }

  public Ast.Not not(Ast.Exp exp) {
    return new Ast.Not(exp);
  }

  public Ast.If ifThenElse(Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(condition, ifTrue, ifFalse);
  }

  /** Creates a piecewise-linear function.
   *
   * <p>Requires strictly increasing breakpoints, and one slope and one
   * intercept per segment (that is, one fewer than there are breakpoints). */
  public Ast.PiecewiseLinear piecewiseLinear(Ast.Exp exp,
      List<? extends Number> breakpoints, List<? extends Number> slopes,
      List<? extends Number> intercepts) {
    checkArgument(breakpoints.size() >= 2,
        "piecewise-linear function requires at least two breakpoints");
    checkArgument(slopes.size() == breakpoints.size() - 1
            && intercepts.size() == breakpoints.size() - 1,
        "piecewise-linear function with %s breakpoints requires %s slopes "
            + "and intercepts", breakpoints.size(), breakpoints.size() - 1);
    final ImmutableList<Double> b = toDoubles(breakpoints);
    for (int i = 1; i < b.size(); i++) {
      checkArgument(b.get(i - 1) < b.get(i),
          "breakpoints must be strictly increasing: %s", b);
    }
    return new Ast.PiecewiseLinear(exp, b, toDoubles(slopes),
        toDoubles(intercepts));
  }

  private static ImmutableList<Double> toDoubles(
      List<? extends Number> numbers) {
    final ImmutableList.Builder<Double> b = ImmutableList.builder();
    numbers.forEach(n -> b.add(n.doubleValue()));
    return b.build();
  }

  // domains and qualifiers

  public Ast.Range range(Ast.Exp from, Ast.Exp to) {
    return new Ast.Range(from, to);
  }

  public Ast.Range range(long from, long to) {
    return range(intLiteral(from), intLiteral(to));
  }

  public Ast.ListExp list(Ast.Exp... args) {
    return list(ImmutableList.copyOf(args));
  }

  public Ast.ListExp list(List<Ast.Exp> args) {
    return new Ast.ListExp(ImmutableList.copyOf(args));
  }

  public Ast.Generator generator(String name, Ast.Exp domain) {
    return new Ast.Generator(name, domain);
  }

  public Ast.Filter filter(Ast.Exp condition) {
    return new Ast.Filter(condition);
  }

  // declarations

  public Ast.VarDecl varDecl(String family, List<Ast.Qualifier> qualifiers,
      VariableOptions options, @Nullable String description) {
    return new Ast.VarDecl(family, ImmutableList.copyOf(qualifiers), options,
        description);
  }

  /** Creates a variable declaration whose options ("{@code kind}",
   * "{@code min_bound}", "{@code max_bound}") are given as a map. */
  public Ast.VarDecl varDecl(String family, List<Ast.Qualifier> qualifiers,
      Map<String, ?> options) {
    return varDecl(family, qualifiers, VariableOptions.of(options), null);
  }

  public Ast.ConstraintDecl constraintDecl(List<Ast.Qualifier> qualifiers,
      Ast.Comparison comparison, @Nullable String name) {
    return new Ast.ConstraintDecl(ImmutableList.copyOf(qualifiers),
        comparison, name);
  }

  public Ast.ConstraintDecl constraintDecl(Ast.Comparison comparison,
      @Nullable String name) {
    return constraintDecl(ImmutableList.of(), comparison, name);
  }

  public Ast.ObjectiveDecl objectiveDecl(Ast.Exp exp, Direction direction) {
    return new Ast.ObjectiveDecl(exp, direction);
  }

  public Ast.ObjectiveDecl minimize(Ast.Exp exp) {
    return objectiveDecl(exp, Direction.MINIMIZE);
  }

  public Ast.ObjectiveDecl maximize(Ast.Exp exp) {
    return objectiveDecl(exp, Direction.MAXIMIZE);
  }
}

// End AstBuilder.java
