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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.tableau.compile.NameGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A linear or mixed-integer program: variables, constraints and at most
 * one objective.
 *
 * <p>Variables and constraints are kept in the order they were declared,
 * so that the LP file is deterministic.
 *
 * <p>A model is changed only through a {@link ModelAssembler}; use
 * {@link #define()} for a declarative block and {@link #modify()} to
 * change a model imperatively. Not thread-safe. */
public class Model implements Catalog {
  public final String name;
  /** Replaced by a delta's copy when the delta is committed. */
  NameGenerator nameGenerator = new NameGenerator();

  final Map<VarId, VariableInstance> variables = new LinkedHashMap<>();
  final Map<String, List<VarId>> families = new LinkedHashMap<>();
  final Map<String, Constraint> constraints = new LinkedHashMap<>();
  /** Maps each sanitized variable name to its raw name. */
  final Map<String, String> variableNames = new HashMap<>();
  /** Maps each sanitized constraint name to its raw name. */
  final Map<String, String> constraintNames = new HashMap<>();
  @Nullable Objective objective;
  /** Incremented each time a delta is committed. */
  int version;

  public Model(String name) {
    this.name = requireNonNull(name);
  }

  public Model() {
    this("model");
  }

  /** Returns an assembler for a declarative block, in which setting a
   * second objective is an error. */
  public ModelAssembler define() {
    return new ModelAssembler(this, ModelAssembler.Mode.DEFINE);
  }

  /** Returns an assembler for imperative modification, in which setting an
   * objective replaces any previous objective. */
  public ModelAssembler modify() {
    return new ModelAssembler(this, ModelAssembler.Mode.MODIFY);
  }

  @Override public @Nullable VariableInstance variable(VarId id) {
    return variables.get(id);
  }

  @Override public List<VarId> instances(String family) {
    final List<VarId> ids = families.get(family);
    return ids == null ? ImmutableList.of() : ImmutableList.copyOf(ids);
  }

  /** Returns the names of the declared families, in declaration order. */
  public Set<String> families() {
    return ImmutableSet.copyOf(families.keySet());
  }

  public List<VariableInstance> variables() {
    return ImmutableList.copyOf(variables.values());
  }

  public List<Constraint> constraints() {
    return ImmutableList.copyOf(constraints.values());
  }

  /** Returns the constraint with a given raw name, or null. */
  public @Nullable Constraint constraint(String name) {
    return constraints.get(name);
  }

  public @Nullable Objective objective() {
    return objective;
  }

  /** Adds the contents of a validated delta. */
  void apply(Map<VarId, VariableInstance> newVariables,
      Map<String, Constraint> newConstraints,
      @Nullable Objective newObjective, NameGenerator newNameGenerator) {
    newVariables.forEach((id, v) -> {
      variables.put(id, v);
      families.computeIfAbsent(id.family, f -> new ArrayList<>()).add(id);
      variableNames.put(v.sanitizedName, id.name());
    });
    newConstraints.forEach((name, c) -> {
      constraints.put(name, c);
      constraintNames.put(c.sanitizedName, name);
    });
    if (newObjective != null) {
      objective = newObjective;
    }
    nameGenerator = newNameGenerator;
    ++version;
  }

  @Override public String toString() {
    return "Model{" + name
        + ", variables=" + variables.size()
        + ", constraints=" + constraints.size()
        + ", objective=" + objective
        + "}";
  }
}

// End Model.java
