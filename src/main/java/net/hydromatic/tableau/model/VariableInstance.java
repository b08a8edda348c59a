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

import org.checkerframework.checker.nullness.qual.Nullable;

/** A declared decision variable: one instance of a variable family. */
public final class VariableInstance {
  public final VarId id;
  public final VariableKind kind;
  public final double lower;
  public final double upper;
  public final @Nullable String description;
  /** Name as written to the LP file. */
  public final String sanitizedName;

  VariableInstance(VarId id, VariableKind kind, double lower, double upper,
      @Nullable String description, String sanitizedName) {
    this.id = requireNonNull(id);
    this.kind = requireNonNull(kind);
    this.lower = lower;
    this.upper = upper;
    this.description = description;
    this.sanitizedName = requireNonNull(sanitizedName);
  }

  public String name() {
    return id.name();
  }

  public Interval bounds() {
    return Interval.of(lower, upper);
  }

  @Override public String toString() {
    return id.name() + ": " + kind.lowerName() + " " + bounds();
  }
}

// End VariableInstance.java
