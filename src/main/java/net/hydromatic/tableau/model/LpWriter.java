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

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Writes a {@link Model} in CPLEX LP format.
 *
 * <p>For example:
 *
 * <pre>
 * \ Problem: diet
 * Minimize
 *  obj: 100 qty(bread) + 150 qty(milk)
 * Subject To
 *  calories: 200 qty(bread) + 150 qty(milk) &gt;= 2000
 * Bounds
 *  0 &lt;= qty(bread) &lt;= 1e+30
 *  0 &lt;= qty(milk) &lt;= 1e+30
 * End
 * </pre>
 *
 * <p>Every variable has a line in the "Bounds" section, because the LP
 * format's default lower bound is 0, not negative infinity. */
public class LpWriter {
  private final Model model;
  private final Function<VarId, String> namer;

  public LpWriter(Model model) {
    this.model = requireNonNull(model);
    this.namer = id -> {
      final VariableInstance v = model.variable(id);
      return v != null ? v.sanitizedName : id.sanitizedName();
    };
  }

  /** Writes the model to a writer. */
  public void write(Writer w) throws IOException {
    w.write(appendTo(new StringBuilder()).toString());
  }

  /** Returns the model as a string. */
  public String toLp() {
    return appendTo(new StringBuilder()).toString();
  }

  /** Appends the model to a buffer. */
  public StringBuilder appendTo(StringBuilder b) {
    b.append("\\ Problem: ").append(model.name).append('\n');

    final Objective objective = model.objective();
    final Direction direction =
        objective == null ? Direction.MINIMIZE : objective.direction;
    final Polynomial polynomial =
        objective == null ? Polynomial.ZERO : objective.polynomial;
    b.append(direction.lpName()).append('\n')
        .append(" obj: ").append(polynomial.describe(namer, true))
        .append('\n');

    b.append("Subject To\n");
    for (Constraint c : model.constraints()) {
      b.append(' ').append(c.sanitizedName).append(": ")
          .append(c.lhs().describe(namer, false))
          .append(' ').append(c.relation.symbol).append(' ')
          .append(Names.formatNumber(c.rhs()))
          .append('\n');
    }

    final List<VariableInstance> variables = model.variables();
    if (!variables.isEmpty()) {
      b.append("Bounds\n");
      for (VariableInstance v : variables) {
        b.append(' ');
        if (v.kind == VariableKind.BINARY) {
          b.append("0 <= ").append(v.sanitizedName).append(" <= 1");
        } else if (v.lower == Double.NEGATIVE_INFINITY
            && v.upper == Double.POSITIVE_INFINITY) {
          b.append(v.sanitizedName).append(" free");
        } else {
          b.append(Names.formatNumber(v.lower))
              .append(" <= ").append(v.sanitizedName).append(" <= ")
              .append(Names.formatNumber(v.upper));
        }
        b.append('\n');
      }
    }

    section(b, "General", variables, VariableKind.INTEGER);
    section(b, "Binary", variables, VariableKind.BINARY);
    return b.append("End\n");
  }

  private static void section(StringBuilder b, String title,
      List<VariableInstance> variables, VariableKind kind) {
    final List<String> names = variables.stream()
        .filter(v -> v.kind == kind)
        .map(v -> v.sanitizedName)
        .collect(Collectors.toList());
    if (names.isEmpty()) {
      return;
    }
    b.append(title).append('\n');
    names.forEach(name -> b.append(' ').append(name).append('\n'));
  }
}

// End LpWriter.java
