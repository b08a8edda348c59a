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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tableau.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import net.hydromatic.tableau.model.Direction;
import net.hydromatic.tableau.model.VariableOptions;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /** Literal, a number or a string.
   *
   * <p>For example, "42" in "{@code 42 * x(i)}",
   * or "bread" in "{@code qty("bread")}". */
  public static class Literal extends Exp {
    public final Comparable<?> value;

    Literal(Comparable<?> value) {
      super(Op.LITERAL);
      this.value = requireNonNull(value);
      checkArgument(value instanceof BigDecimal
          || value instanceof String
          || value instanceof Boolean,
          "literal must be a number, string or boolean: %s", value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && value.equals(((Literal) o).value);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** A bare name.
   *
   * <p>Depending on where it occurs it is a generator name bound in the
   * current environment, the name of a model parameter, or a key in a
   * container lookup. For example, "i" in "{@code x(i)}", "cost" in
   * "{@code cost[i]}". */
  public static class SymbolicKey extends Exp {
    public final String name;

    SymbolicKey(String name) {
      super(Op.SYMBOLIC_KEY);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SymbolicKey
          && name.equals(((SymbolicKey) o).name);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Wildcard, "{@code _}".
   *
   * <p>Not a value: a placeholder for every value of one dimension of a
   * variable family. Valid only in the index list of a {@link VariableRef}
   * and in the key chain of a {@link Lookup}. */
  public static class Wildcard extends Exp {
    Wildcard() {
      super(Op.WILDCARD);
    }

    @Override public int hashCode() {
      return "_".hashCode();
    }

    @Override public boolean equals(Object o) {
      return o instanceof Wildcard;
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /** Reference to a decision variable.
   *
   * <p>For example, "{@code x(i, 2)}", "{@code qty(_)}", or a scalar
   * "{@code z}" (no indices). */
  public static class VariableRef extends Exp {
    public final String name;
    public final List<Exp> indices;

    VariableRef(String name, ImmutableList<Exp> indices) {
      super(Op.VARIABLE_REF);
      this.name = requireNonNull(name);
      this.indices = requireNonNull(indices);
    }

    @Override public int hashCode() {
      return Objects.hash(name, indices);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VariableRef
          && name.equals(((VariableRef) o).name)
          && indices.equals(((VariableRef) o).indices);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    AstWriter unparse(AstWriter w, int left, int right) {
      if (indices.isEmpty()) {
        return w.id(name);
      }
      return w.call(name, indices);
    }

    /** Creates a copy of this {@code VariableRef} with given indices,
     * or {@code this} if the indices are the same. */
    public VariableRef copy(List<Exp> indices) {
      return this.indices.equals(indices)
          ? this
          : ast.variableRef(name, indices);
    }
  }

  /** One step of a lookup into a nested container of model parameters.
   *
   * <p>For example, "{@code foods[_][nutrient]}" is
   * {@code Lookup(Lookup(foods, _), nutrient)}; "{@code foods.bread}" is a
   * lookup whose key is written in "dot" style. */
  public static class Lookup extends Exp {
    public final Exp container;
    public final Exp key;
    /** Whether the key was written "{@code container.key}" rather than
     * "{@code container[key]}"; a dot key is always a literal name. */
    public final boolean dot;

    Lookup(Exp container, Exp key, boolean dot) {
      super(Op.LOOKUP);
      this.container = requireNonNull(container);
      this.key = requireNonNull(key);
      this.dot = dot;
      checkArgument(container instanceof SymbolicKey
          || container instanceof Lookup,
          "container must be a name or a lookup: %s", container);
    }

    @Override public int hashCode() {
      return Objects.hash(container, key, dot);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Lookup
          && container.equals(((Lookup) o).container)
          && key.equals(((Lookup) o).key)
          && dot == ((Lookup) o).dot;
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(container, 0, 0);
      if (dot) {
        return w.append(".").append(key, 0, 0);
      }
      return w.append("[").append(key, 0, 0).append("]");
    }

    /** Returns the name at the root of the lookup chain. */
    public SymbolicKey root() {
      return container instanceof Lookup
          ? ((Lookup) container).root()
          : (SymbolicKey) container;
    }

    /** Creates a copy of this {@code Lookup} with given contents,
     * or {@code this} if the contents are the same. */
    public Lookup copy(Exp container, Exp key) {
      return this.container.equals(container)
          && this.key.equals(key)
          ? this
          : new Lookup(container, key, dot);
    }
  }

  /** Call to an infix arithmetic operator, {@code +}, {@code -}, {@code *} or
   * {@code /}. */
  public static class BinaryOp extends Exp {
    public final Exp left;
    public final Exp right;

    BinaryOp(Op op, Exp left, Exp right) {
      super(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      checkArgument(op == Op.PLUS
          || op == Op.MINUS
          || op == Op.TIMES
          || op == Op.DIVIDE, "not arithmetic: %s", op);
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof BinaryOp
          && op == ((BinaryOp) o).op
          && left.equals(((BinaryOp) o).left)
          && right.equals(((BinaryOp) o).right);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }

    /** Creates a copy of this {@code BinaryOp} with given contents
     * and same operator,
     * or {@code this} if the contents are the same. */
    public BinaryOp copy(Exp left, Exp right) {
      return this.left.equals(left)
          && this.right.equals(right)
          ? this
          : new BinaryOp(op, left, right);
    }
  }

  /** Unary minus, "{@code -e}". */
  public static class Negate extends Exp {
    public final Exp exp;

    Negate(Exp exp) {
      super(Op.NEGATE);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Negate
          && exp.equals(((Negate) o).exp);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, exp, right);
    }

    public Negate copy(Exp exp) {
      return this.exp.equals(exp) ? this : new Negate(exp);
    }
  }

  /** Comparison, such as "{@code x(i) <= cap[i]}" in a constraint or
   * "{@code i != j}" in a filter. */
  public static class Comparison extends Exp {
    public final Exp left;
    public final Exp right;

    Comparison(Op op, Exp left, Exp right) {
      super(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      checkArgument(op.isComparison(), "not a comparison: %s", op);
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Comparison
          && op == ((Comparison) o).op
          && left.equals(((Comparison) o).left)
          && right.equals(((Comparison) o).right);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }

    public Comparison copy(Exp left, Exp right) {
      return this.left.equals(left)
          && this.right.equals(right)
          ? this
          : new Comparison(op, left, right);
    }
  }

  /** Explicit sum, "{@code sum(a, b, c)}".
   *
   * <p>With a single argument that contains wildcards, such as
   * "{@code sum(x(_))}", the sum is over the instances that the wildcards
   * expand to. */
  public static class Sum extends Exp {
    public final List<Exp> args;

    Sum(ImmutableList<Exp> args) {
      super(Op.SUM);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "sum requires at least one argument");
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Sum
          && args.equals(((Sum) o).args);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.call("sum", args);
    }

    public Sum copy(List<Exp> args) {
      return this.args.equals(args) ? this : ast.sum(args);
    }
  }

  /** Sum over the bindings produced by a list of generators and filters.
   *
   * <p>For example, "{@code sum(x(i, j) for i <- 1 .. 3, j <- cols, i != j)}".
   */
  public static class GeneratorSum extends Exp {
    public final Exp body;
    public final List<Qualifier> qualifiers;

    GeneratorSum(Exp body, ImmutableList<Qualifier> qualifiers) {
      super(Op.GENERATOR_SUM);
      this.body = requireNonNull(body);
      this.qualifiers = requireNonNull(qualifiers);
    }

    @Override public int hashCode() {
      return Objects.hash(body, qualifiers);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof GeneratorSum
          && body.equals(((GeneratorSum) o).body)
          && qualifiers.equals(((GeneratorSum) o).qualifiers);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("sum(")
          .append(body, 0, 0)
          .append(" for ")
          .appendAll(qualifiers)
          .append(")");
    }

    public GeneratorSum copy(Exp body, List<Qualifier> qualifiers) {
      return this.body.equals(body)
          && this.qualifiers.equals(qualifiers)
          ? this
          : ast.generatorSum(body, qualifiers);
    }
  }

  /** Absolute value, "{@code abs(e)}". */
  public static class Abs extends Exp {
    public final Exp exp;

    Abs(Exp exp) {
      super(Op.ABS);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Abs
          && exp.equals(((Abs) o).exp);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.call("abs", ImmutableList.of(exp));
    }

    public Abs copy(Exp exp) {
      return this.exp.equals(exp) ? this : new Abs(exp);
    }
  }

  /** Call to an n-ary function: {@code max}, {@code min}, {@code and} or
   * {@code or}.
   *
   * <p>An argument may be a {@link PatternInstanceSet}, which stands for
   * all instances of a wildcard pattern. */
  public static class Call extends Exp {
    public final List<Exp> args;

    Call(Op op, ImmutableList<Exp> args) {
      super(op);
      this.args = requireNonNull(args);
      checkArgument(op == Op.MAX
          || op == Op.MIN
          || op == Op.AND
          || op == Op.OR, "not a function: %s", op);
      checkArgument(!args.isEmpty(), "%s requires at least one argument",
          op.lowerName());
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && op == ((Call) o).op
          && args.equals(((Call) o).args);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.call(op.lowerName(), args);
    }

    public Call copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new Call(op, ImmutableList.copyOf(args));
    }
  }

  /** Logical negation, "{@code not(e)}"; only valid where the argument is
   * constant, for example in a filter. */
  public static class Not extends Exp {
    public final Exp exp;

    Not(Exp exp) {
      super(Op.NOT);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Not
          && exp.equals(((Not) o).exp);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.call("not", ImmutableList.of(exp));
    }

    public Not copy(Exp exp) {
      return this.exp.equals(exp) ? this : new Not(exp);
    }
  }

  /** "{@code if condition then ifTrue else ifFalse}". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof If
          && condition.equals(((If) o).condition)
          && ifTrue.equals(((If) o).ifTrue)
          && ifFalse.equals(((If) o).ifFalse);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ")
          .append(condition, 0, 0)
          .append(" then ")
          .append(ifTrue, 0, 0)
          .append(" else ")
          .append(ifFalse, 0, 0);
    }

    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return this.condition.equals(condition)
          && this.ifTrue.equals(ifTrue)
          && this.ifFalse.equals(ifFalse)
          ? this
          : new If(condition, ifTrue, ifFalse);
    }
  }

  /** Piecewise-linear function of an expression.
   *
   * <p>Segment {@code k} covers {@code [breakpoints[k], breakpoints[k + 1]]}
   * and has value {@code slopes[k] * x + intercepts[k]} there. There is one
   * more breakpoint than there are segments. */
  public static class PiecewiseLinear extends Exp {
    public final Exp exp;
    public final List<Double> breakpoints;
    public final List<Double> slopes;
    public final List<Double> intercepts;

    PiecewiseLinear(Exp exp, ImmutableList<Double> breakpoints,
        ImmutableList<Double> slopes, ImmutableList<Double> intercepts) {
      super(Op.PIECEWISE_LINEAR);
      this.exp = requireNonNull(exp);
      this.breakpoints = requireNonNull(breakpoints);
      this.slopes = requireNonNull(slopes);
      this.intercepts = requireNonNull(intercepts);
    }

    @Override public int hashCode() {
      return Objects.hash(exp, breakpoints, slopes, intercepts);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PiecewiseLinear
          && exp.equals(((PiecewiseLinear) o).exp)
          && breakpoints.equals(((PiecewiseLinear) o).breakpoints)
          && slopes.equals(((PiecewiseLinear) o).slopes)
          && intercepts.equals(((PiecewiseLinear) o).intercepts);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("pwl(")
          .append(exp, 0, 0)
          .append(", ").append(breakpoints.toString())
          .append(", ").append(slopes.toString())
          .append(", ").append(intercepts.toString())
          .append(")");
    }

    public PiecewiseLinear copy(Exp exp) {
      return this.exp.equals(exp)
          ? this
          : new PiecewiseLinear(exp, ImmutableList.copyOf(breakpoints),
              ImmutableList.copyOf(slopes), ImmutableList.copyOf(intercepts));
    }
  }

  /** The set of instances that a wildcard pattern expands to.
   *
   * <p>For example, in "{@code max(x(_))}" the argument stands for the list
   * {@code x(1), x(2), x(3)}, and the function is applied across that list.
   * Unlike {@link Sum}, the instances are not added together. */
  public static class PatternInstanceSet extends Exp {
    public final Exp pattern;

    PatternInstanceSet(Exp pattern) {
      super(Op.PATTERN_INSTANCE_SET);
      this.pattern = requireNonNull(pattern);
    }

    @Override public int hashCode() {
      return Objects.hash(op, pattern);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PatternInstanceSet
          && pattern.equals(((PatternInstanceSet) o).pattern);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pattern, left, right);
    }

    public PatternInstanceSet copy(Exp pattern) {
      return this.pattern.equals(pattern)
          ? this
          : new PatternInstanceSet(pattern);
    }
  }

  /** Inclusive integer range, "{@code 1 .. n}". */
  public static class Range extends Exp {
    public final Exp from;
    public final Exp to;

    Range(Exp from, Exp to) {
      super(Op.RANGE);
      this.from = requireNonNull(from);
      this.to = requireNonNull(to);
    }

    @Override public int hashCode() {
      return Objects.hash(op, from, to);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Range
          && from.equals(((Range) o).from)
          && to.equals(((Range) o).to);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, from, op, to, right);
    }

    public Range copy(Exp from, Exp to) {
      return this.from.equals(from) && this.to.equals(to)
          ? this
          : new Range(from, to);
    }
  }

  /** Explicit sequence, "{@code ["bread", "milk"]}". */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(ImmutableList<Exp> args) {
      super(Op.LIST);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp
          && args.equals(((ListExp) o).args);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(args).append("]");
    }

    public ListExp copy(List<Exp> args) {
      return this.args.equals(args)
          ? this
          : new ListExp(ImmutableList.copyOf(args));
    }
  }

  /** Element of a generator list: a {@link Generator} or a {@link Filter}. */
  public abstract static class Qualifier extends AstNode {
    Qualifier(Op op) {
      super(op);
    }

    @Override public abstract Qualifier accept(Shuttle shuttle);
  }

  /** Generator, "{@code i <- 1 .. 3}"; binds {@code name} to each value of
   * {@code domain} in turn. */
  public static class Generator extends Qualifier {
    public final String name;
    public final Exp domain;

    Generator(String name, Exp domain) {
      super(Op.GENERATOR);
      this.name = requireNonNull(name);
      this.domain = requireNonNull(domain);
    }

    @Override public int hashCode() {
      return Objects.hash(name, domain);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Generator
          && name.equals(((Generator) o).name)
          && domain.equals(((Generator) o).domain);
    }

    public Qualifier accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).append(op.padded).append(domain, 0, 0);
    }

    public Generator copy(Exp domain) {
      return this.domain.equals(domain) ? this : new Generator(name, domain);
    }
  }

  /** Filter in a generator list, "{@code i != j}"; a binding for which the
   * condition is false is skipped. */
  public static class Filter extends Qualifier {
    public final Exp condition;

    Filter(Exp condition) {
      super(Op.FILTER);
      this.condition = requireNonNull(condition);
    }

    @Override public int hashCode() {
      return Objects.hash(op, condition);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Filter
          && condition.equals(((Filter) o).condition);
    }

    public Qualifier accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(condition, 0, 0);
    }

    public Filter copy(Exp condition) {
      return this.condition.equals(condition) ? this : new Filter(condition);
    }
  }

  /** Base class for a declaration in a model block. */
  public abstract static class Decl extends AstNode {
    Decl(Op op) {
      super(op);
    }

    @Override public abstract Decl accept(Shuttle shuttle);
  }

  /** Declaration of a family of variables, one instance per binding of the
   * generators.
   *
   * <p>For example, "{@code variables qty[food <- foods] : continuous}". */
  public static class VarDecl extends Decl {
    public final String family;
    public final List<Qualifier> qualifiers;
    public final VariableOptions options;
    /** Description; "{@code {food}}" is replaced with the value of
     * {@code food} in each binding. */
    public final @Nullable String description;

    VarDecl(String family, ImmutableList<Qualifier> qualifiers,
        VariableOptions options, @Nullable String description) {
      super(Op.VAR_DECL);
      this.family = requireNonNull(family);
      this.qualifiers = requireNonNull(qualifiers);
      this.options = requireNonNull(options);
      this.description = description;
    }

    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("variables ").id(family);
      if (!qualifiers.isEmpty()) {
        w.append("[").appendAll(qualifiers).append("]");
      }
      return w.append(" : ").append(options.kind.lowerName());
    }

    public VarDecl copy(List<Qualifier> qualifiers) {
      return this.qualifiers.equals(qualifiers)
          ? this
          : ast.varDecl(family, qualifiers, options, description);
    }
  }

  /** Declaration of a family of constraints, one per binding of the
   * generators.
   *
   * <p>For example,
   * "{@code constraints [i <- 1 .. 3] "cap_{i}": sum(y(i, _)) <= cap[i]}". */
  public static class ConstraintDecl extends Decl {
    public final List<Qualifier> qualifiers;
    public final Comparison comparison;
    /** Name template; "{@code {i}}" is replaced with the value of {@code i}.
     * If null, a name is generated. */
    public final @Nullable String name;

    ConstraintDecl(ImmutableList<Qualifier> qualifiers,
        Comparison comparison, @Nullable String name) {
      super(Op.CONSTRAINT_DECL);
      this.qualifiers = requireNonNull(qualifiers);
      this.comparison = requireNonNull(comparison);
      this.name = name;
    }

    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("constraints ");
      if (!qualifiers.isEmpty()) {
        w.append("[").appendAll(qualifiers).append("] ");
      }
      if (name != null) {
        w.appendLiteral(name).append(": ");
      }
      return w.append(comparison, 0, 0);
    }

    public ConstraintDecl copy(List<Qualifier> qualifiers,
        Comparison comparison) {
      return this.qualifiers.equals(qualifiers)
          && this.comparison.equals(comparison)
          ? this
          : ast.constraintDecl(qualifiers, comparison, name);
    }
  }

  /** Declaration of the objective, "{@code minimize e}" or
   * "{@code maximize e}". */
  public static class ObjectiveDecl extends Decl {
    public final Exp exp;
    public final Direction direction;

    ObjectiveDecl(Exp exp, Direction direction) {
      super(Op.OBJECTIVE_DECL);
      this.exp = requireNonNull(exp);
      this.direction = requireNonNull(direction);
    }

    public Decl accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(direction.lowerName())
          .append(" ")
          .append(exp, 0, 0);
    }

    public ObjectiveDecl copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.objectiveDecl(exp, direction);
    }
  }
}

// End Ast.java
