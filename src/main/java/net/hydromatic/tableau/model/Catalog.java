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

import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Read access to the variables that have been declared.
 *
 * <p>Implemented by {@link Model} and by a pending
 * {@link ModelAssembler.Delta}, which also sees the variables it is about to
 * add. */
public interface Catalog {
  /** Returns a declared variable instance, or null. */
  @Nullable VariableInstance variable(VarId id);

  /** Returns the instances of a family, in the order they were declared;
   * empty if the family is not declared. */
  List<VarId> instances(String family);

  /** Returns the bounds of a declared variable. */
  default Interval bounds(VarId id) {
    final VariableInstance v = variable(id);
    if (v == null) {
      throw new IllegalArgumentException("unknown variable " + id);
    }
    return v.bounds();
  }

  /** Returns the range of values that a polynomial can take. */
  default Interval range(Polynomial polynomial) {
    return polynomial.range(this::bounds);
  }

  /** Returns whether a polynomial takes only integer values: its
   * variables are integer or binary, and its coefficients and constant are
   * integers. */
  default boolean isIntegral(Polynomial polynomial) {
    if (polynomial.constant != Math.rint(polynomial.constant)) {
      return false;
    }
    for (Map.Entry<VarId, Double> e : polynomial.terms.entrySet()) {
      final VariableInstance v = variable(e.getKey());
      if (v == null
          || v.kind == VariableKind.CONTINUOUS
          || e.getValue() != Math.rint(e.getValue())) {
        return false;
      }
    }
    return true;
  }
}

// End Catalog.java
