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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tableau.ast.Op;
import net.hydromatic.tableau.compile.NameGenerator;
import net.hydromatic.tableau.compile.NonLinearException;
import net.hydromatic.tableau.compile.UndefinedVariableException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Adds variables, constraints and an objective to a {@link Model},
 * enforcing the model's invariants.
 *
 * <p>Additions are staged in a {@link Delta}, which sees the model plus its
 * own additions. Each addition is validated as it is staged; nothing
 * reaches the model until {@link Delta#commit()}, so a declaration that
 * fails part way through leaves the model unchanged.
 *
 * <p>The two modes differ only in how they treat a second objective. */
public class ModelAssembler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ModelAssembler.class);

  public final Model model;
  public final Mode mode;

  ModelAssembler(Model model, Mode mode) {
    this.model = requireNonNull(model);
    this.mode = requireNonNull(mode);
  }

  /** Starts a set of additions. */
  public Delta begin() {
    return new Delta();
  }

  /** Declares one variable instance and commits it. */
  public VariableInstance declareVariable(String family, List<?> indices,
      VariableOptions options, @Nullable String description) {
    final Delta delta = begin();
    final VariableInstance v =
        delta.declareVariable(family, indices, options, description);
    delta.commit();
    return v;
  }

  /** Declares one constraint and commits it. Returns null if the
   * constraint has no variables and always holds. */
  public @Nullable Constraint declareConstraint(String name, Polynomial left,
      Op op, Polynomial right) {
    final Delta delta = begin();
    final Constraint c = delta.declareConstraint(name, left, op, right);
    delta.commit();
    return c;
  }

  /** Sets the objective and commits it. */
  public void setObjective(Polynomial polynomial, Direction direction) {
    final Delta delta = begin();
    delta.setObjective(polynomial, direction);
    delta.commit();
  }

  /** How an assembler treats a second objective. */
  public enum Mode {
    /** Declarative block; a second objective is an error. */
    DEFINE,
    /** Imperative modification; a second objective replaces the first,
     * with a warning. */
    MODIFY
  }

  /** Pending additions to the model. */
  public class Delta implements Catalog {
    private final Map<VarId, VariableInstance> variables =
        new LinkedHashMap<>();
    private final Map<String, List<VarId>> families = new HashMap<>();
    private final Map<String, String> variableNames = new HashMap<>();
    private final Map<String, Constraint> constraints = new LinkedHashMap<>();
    private final Map<String, String> constraintNames = new HashMap<>();
    private @Nullable Objective objective;
    private final int version = model.version;
    private final NameGenerator nameGenerator =
        new NameGenerator(model.nameGenerator);
    private boolean committed;

    Delta() {}

    public Model model() {
      return model;
    }

    /** Returns the name generator, whose changes reach the model only if
     * this delta is committed. */
    public NameGenerator nameGenerator() {
      return nameGenerator;
    }

    @Override public @Nullable VariableInstance variable(VarId id) {
      final VariableInstance v = variables.get(id);
      return v != null ? v : model.variable(id);
    }

    @Override public List<VarId> instances(String family) {
      final List<VarId> pending = families.get(family);
      if (pending == null) {
        return model.instances(family);
      }
      return ImmutableList.<VarId>builder()
          .addAll(model.instances(family))
          .addAll(pending)
          .build();
    }

    /** Returns the variables added so far, in order. */
    public List<VariableInstance> variables() {
      return ImmutableList.copyOf(variables.values());
    }

    /** Returns the constraints added so far, in order. */
    public List<Constraint> constraints() {
      return ImmutableList.copyOf(constraints.values());
    }

    /** Declares a variable instance.
     *
     * @throws ModelException if the instance is already declared
     * ({@code REDEFINITION}), if the bounds are not valid for its kind
     * ({@code ILLEGAL_BOUNDS}), or if its sanitized name is the same as that
     * of another variable ({@code NAME_COLLISION}) */
    public VariableInstance declareVariable(String family, List<?> indices,
        VariableOptions options, @Nullable String description) {
      checkNotCommitted();
      checkArgument(!family.isEmpty(), "empty family name");
      final VarId id = VarId.of(family, indices);
      if (variable(id) != null) {
        throw new ModelException(ModelException.Reason.REDEFINITION,
            "variable '" + id.name() + "' is already declared");
      }
      checkBounds(id, options);
      final String sanitizedName = id.sanitizedName();
      final String rawName = id.name();
      final String existing = variableName(sanitizedName);
      if (existing != null && !existing.equals(rawName)) {
        throw new ModelException(ModelException.Reason.NAME_COLLISION,
            "variable '" + rawName + "' and variable '" + existing
                + "' have the same sanitized name '" + sanitizedName + "'");
      }
      final VariableInstance v =
          new VariableInstance(id, options.kind, options.lower(),
              options.upper(), description, sanitizedName);
      variables.put(id, v);
      families.computeIfAbsent(family, f -> new ArrayList<>()).add(id);
      variableNames.put(sanitizedName, rawName);
      return v;
    }

    private void checkBounds(VarId id, VariableOptions options) {
      switch (options.kind) {
      case BINARY:
        if (options.minBound != null || options.maxBound != null) {
          throw new ModelException(ModelException.Reason.ILLEGAL_BOUNDS,
              "binary variable '" + id.name() + "' must not have bounds");
        }
        break;
      case INTEGER:
        for (Double bound
            : new Double[] {options.minBound, options.maxBound}) {
          if (bound != null
              && !bound.isInfinite()
              && bound != Math.rint(bound)) {
            throw new ModelException(ModelException.Reason.ILLEGAL_BOUNDS,
                "integer variable '" + id.name()
                    + "' must have integer bounds; got " + bound);
          }
        }
        break;
      default:
        break;
      }
      if (options.lower() > options.upper()
          || options.lower() == Double.POSITIVE_INFINITY
          || options.upper() == Double.NEGATIVE_INFINITY) {
        throw new ModelException(ModelException.Reason.ILLEGAL_BOUNDS,
            "variable '" + id.name() + "' has empty bounds ["
                + options.lower() + ", " + options.upper() + "]");
      }
    }

    /** Declares a constraint "{@code left op right}".
     *
     * <p>A constraint without variables is checked immediately: if it
     * holds it is dropped, and this method returns null.
     *
     * @throws NonLinearException if {@code op} is "{@code !=}"
     * @throws ModelException if the name is already used
     * ({@code DUPLICATE_CONSTRAINT}), if its sanitized name is the same as
     * that of another constraint ({@code NAME_COLLISION}), or if it has no
     * variables and does not hold ({@code TRIVIAL_CONSTRAINT}) */
    public @Nullable Constraint declareConstraint(String name,
        Polynomial left, Op op, Polynomial right) {
      checkNotCommitted();
      final Constraint.Relation relation = Constraint.Relation.of(op);
      if (relation == null) {
        throw new NonLinearException("constraint '" + name
            + "' uses '!=', which cannot be expressed as a linear "
            + "constraint", null);
      }
      if (op == Op.LT || op == Op.GT) {
        LOGGER.debug("Constraint '{}': treating '{}' as '{}'", name,
            op.padded.trim(), relation.symbol);
      }
      final Polynomial difference = left.minus(right);
      checkDefined(difference);
      if (difference.isConstant()) {
        if (holds(difference.constant, relation)) {
          LOGGER.debug("Dropping constraint '{}', which always holds: "
              + "{} {} {}", name, left, relation.symbol, right);
          return null;
        }
        throw new ModelException(ModelException.Reason.TRIVIAL_CONSTRAINT,
            "constraint '" + name + "' has no variables and never holds: "
                + left + " " + relation.symbol + " " + right);
      }
      if (constraints.containsKey(name)
          || model.constraints.containsKey(name)) {
        throw new ModelException(ModelException.Reason.DUPLICATE_CONSTRAINT,
            "constraint '" + name + "' is already declared");
      }
      final String sanitizedName = Names.sanitize(name);
      final String existing = constraintName(sanitizedName);
      if (existing != null) {
        throw new ModelException(ModelException.Reason.NAME_COLLISION,
            "constraint '" + name + "' and constraint '" + existing
                + "' have the same sanitized name '" + sanitizedName + "'");
      }
      final Constraint c =
          new Constraint(name, sanitizedName, left, relation, right);
      constraints.put(name, c);
      constraintNames.put(sanitizedName, name);
      return c;
    }

    /** Sets the objective.
     *
     * @throws ModelException if this assembler is in {@link Mode#DEFINE}
     * mode and the model already has an objective
     * ({@code DUPLICATE_OBJECTIVE}) */
    public void setObjective(Polynomial polynomial, Direction direction) {
      checkNotCommitted();
      checkDefined(polynomial);
      final Objective previous =
          objective != null ? objective : model.objective;
      if (previous != null) {
        switch (mode) {
        case DEFINE:
          throw new ModelException(ModelException.Reason.DUPLICATE_OBJECTIVE,
              "model already has an objective: " + previous);
        default:
          LOGGER.warn("Replacing objective '{}' with '{} {}'", previous,
              direction.lowerName(), polynomial);
        }
      }
      objective = new Objective(polynomial, direction);
    }

    /** Adds the pending additions to the model.
     *
     * @throws IllegalStateException if already committed, or if the model
     * has changed since this delta began */
    public void commit() {
      checkNotCommitted();
      checkState(version == model.version,
          "model was modified while delta was pending");
      committed = true;
      model.apply(variables, constraints, objective, nameGenerator);
    }

    private void checkNotCommitted() {
      checkState(!committed, "delta already committed");
    }

    private void checkDefined(Polynomial polynomial) {
      for (VarId id : polynomial.variables()) {
        if (variable(id) == null) {
          throw new UndefinedVariableException(id, null);
        }
      }
    }

    private @Nullable String variableName(String sanitizedName) {
      final String name = variableNames.get(sanitizedName);
      return name != null ? name : model.variableNames.get(sanitizedName);
    }

    private @Nullable String constraintName(String sanitizedName) {
      final String name = constraintNames.get(sanitizedName);
      return name != null ? name : model.constraintNames.get(sanitizedName);
    }
  }

  /** Returns whether "{@code constant relation 0}" holds. */
  private static boolean holds(double constant, Constraint.Relation relation) {
    switch (relation) {
    case LE:
      return constant <= 0D;
    case GE:
      return constant >= 0D;
    default:
      return constant == 0D;
    }
  }
}

// End ModelAssembler.java
