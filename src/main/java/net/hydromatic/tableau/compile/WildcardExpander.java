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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.tableau.ast.Ast;
import net.hydromatic.tableau.ast.Shuttle;
import net.hydromatic.tableau.ast.Visitor;
import net.hydromatic.tableau.model.Catalog;
import net.hydromatic.tableau.model.VarId;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Expands the wildcards in an expression.
 *
 * <p>The values of the wildcards come from the instances of a variable
 * family that have been declared. The first variable reference that has a
 * wildcard among its indices (in pre-order) is the <em>driver</em>; its
 * wildcard positions are slots {@code 0 .. n - 1}. For each declared
 * instance of the driver's family that matches the driver's other indices,
 * the expander produces a copy of the expression in which the {@code k}th
 * wildcard of every variable reference, and the {@code k}th wildcard of
 * every lookup chain, is replaced by the value of slot {@code k}.
 *
 * <p>For example, if {@code qty} has instances {@code qty(bread)} and
 * {@code qty(milk)}, then "{@code qty(_) * foods[_][nutrient]}" expands to
 * "{@code qty("bread") * foods["bread"][nutrient]}" and
 * "{@code qty("milk") * foods["milk"][nutrient]}".
 *
 * <p>Every other variable reference with a wildcard must match the same
 * values; if {@code x} is declared over 1..2 and {@code z} over 1..4, the
 * values of the wildcard in "{@code x(_) + z(_)}" are not determined, and
 * the expander throws rather than drop instances of either.
 *
 * <p>Wildcards inside a nested {@link Ast.Sum}, {@link Ast.GeneratorSum} or
 * {@link Ast.PatternInstanceSet} belong to that node, and are left
 * alone. */
public class WildcardExpander {
  private final ConstantEvaluator evaluator;
  private final Catalog catalog;

  public WildcardExpander(ConstantEvaluator evaluator, Catalog catalog) {
    this.evaluator = requireNonNull(evaluator);
    this.catalog = requireNonNull(catalog);
  }

  /** Expands an expression into the sum of its instances; a literal 0 if
   * there are none.
   *
   * @throws AmbiguousWildcardException if the instances cannot be
   * determined */
  public Ast.Exp expandSum(Ast.Exp exp, Environment env) {
    final List<Ast.Exp> list = expandInstances(exp, env);
    switch (list.size()) {
    case 0:
      return ast.intLiteral(0);
    case 1:
      return list.get(0);
    default:
      return ast.sum(list);
    }
  }

  /** Expands an expression into a list of instances, one per matching
   * declared instance of the driving variable family, in declaration
   * order.
   *
   * @throws AmbiguousWildcardException if the expression has no variable
   * reference with a wildcard, if a family with a wildcard has no declared
   * instances, if a variable reference or lookup has more wildcards than
   * the driver, or if two variable references with wildcards match
   * different values */
  public List<Ast.Exp> expandInstances(Ast.Exp exp, Environment env) {
    final List<Ast.VariableRef> refs = wildcardRefs(exp);
    if (refs.isEmpty()) {
      throw new AmbiguousWildcardException("cannot determine the values of "
          + "the wildcard: no variable reference has a wildcard index", exp);
    }
    final Ast.VariableRef driver = refs.get(0);
    final List<List<Object>> slotValues = slotValues(driver, exp, env);

    // Each other reference must match the same values, in as many slots
    // as it has wildcards.
    for (Ast.VariableRef ref : refs.subList(1, refs.size())) {
      final int slotCount = wildcardCount(ref);
      if (slotCount > wildcardCount(driver)) {
        throw new AmbiguousWildcardException("'" + ref + "' has more "
            + "wildcards than the variable that determines their values",
            ref);
      }
      final Set<List<Object>> expected = new LinkedHashSet<>();
      for (List<Object> values : slotValues) {
        expected.add(values.subList(0, slotCount));
      }
      final Set<List<Object>> actual =
          new LinkedHashSet<>(slotValues(ref, exp, env));
      if (!actual.equals(expected)) {
        throw new AmbiguousWildcardException("cannot determine the values "
            + "of the wildcard: '" + driver + "' matches " + expected
            + " but '" + ref + "' matches " + actual, exp);
      }
    }

    final ImmutableList.Builder<Ast.Exp> b = ImmutableList.builder();
    for (List<Object> values : slotValues) {
      final List<Ast.Literal> slots = new ArrayList<>();
      for (Object value : values) {
        slots.add(ast.literal(value));
      }
      b.add(exp.accept(new SlotSubstituter(slots)));
    }
    return b.build();
  }

  /** Returns the values of the wildcards of a variable reference, one list
   * per matching declared instance, in declaration order. */
  private List<List<Object>> slotValues(Ast.VariableRef ref, Ast.Exp exp,
      Environment env) {
    final List<VarId> instances = catalog.instances(ref.name);
    if (instances.isEmpty()) {
      throw new AmbiguousWildcardException("cannot determine the values of "
          + "the wildcard: variable '" + ref.name
          + "' has no declared instances", exp);
    }

    // Resolve the indices that are not wildcards; null means wildcard.
    final List<@Nullable Object> pattern = new ArrayList<>();
    final List<Integer> slotPositions = new ArrayList<>();
    for (int i = 0; i < ref.indices.size(); i++) {
      final Ast.Exp index = ref.indices.get(i);
      if (index instanceof Ast.Wildcard) {
        pattern.add(null);
        slotPositions.add(i);
      } else {
        pattern.add(evaluator.resolveIndex(index, env));
      }
    }

    final List<List<Object>> list = new ArrayList<>();
    for (VarId id : instances) {
      if (id.matches(pattern)) {
        final List<Object> values = new ArrayList<>();
        for (int position : slotPositions) {
          values.add(id.indices.get(position));
        }
        list.add(values);
      }
    }
    return list;
  }

  private static int wildcardCount(Ast.VariableRef ref) {
    int n = 0;
    for (Ast.Exp index : ref.indices) {
      if (index instanceof Ast.Wildcard) {
        ++n;
      }
    }
    return n;
  }

  /** Returns the variable references, in pre-order, that have a free
   * wildcard among their indices. */
  private static List<Ast.VariableRef> wildcardRefs(Ast.Exp exp) {
    final List<Ast.VariableRef> refs = new ArrayList<>();
    exp.accept(
        new FreeVisitor() {
          @Override protected void visit(Ast.VariableRef variableRef) {
            if (variableRef.indices.contains(ast.wildcard())) {
              refs.add(variableRef);
            }
            super.visit(variableRef);
          }
        });
    return refs;
  }

  /** Visitor that does not descend into nodes that own their wildcards. */
  private static class FreeVisitor extends Visitor {
    @Override protected void visit(Ast.Sum sum) {}

    @Override protected void visit(Ast.GeneratorSum generatorSum) {}

    @Override protected void visit(Ast.PatternInstanceSet patternInstanceSet) {
    }
  }

  /** Shuttle that replaces the wildcards of each variable reference and
   * each lookup chain with the values of the slots, in order. */
  private static class SlotSubstituter extends Shuttle {
    private final List<Ast.Literal> slots;

    SlotSubstituter(List<Ast.Literal> slots) {
      this.slots = ImmutableList.copyOf(slots);
    }

    @Override protected Ast.Exp visit(Ast.Wildcard wildcard) {
      throw new AmbiguousWildcardException("wildcard is only valid as the "
          + "index of a variable or the key of a lookup", wildcard);
    }

    @Override protected Ast.Exp visit(Ast.VariableRef variableRef) {
      int slot = 0;
      final List<Ast.Exp> indices = new ArrayList<>();
      for (Ast.Exp index : variableRef.indices) {
        if (index instanceof Ast.Wildcard) {
          indices.add(slot(slot++, variableRef));
        } else {
          indices.add(index.accept(this));
        }
      }
      return variableRef.copy(indices);
    }

    @Override protected Ast.Exp visit(Ast.Lookup lookup) {
      return substitute(lookup, new int[] {0}, lookup);
    }

    /** Substitutes the wildcards of a lookup chain, root first. */
    private Ast.Lookup substitute(Ast.Lookup lookup, int[] slot,
        Ast.Lookup top) {
      final Ast.Exp container =
          lookup.container instanceof Ast.Lookup
              ? substitute((Ast.Lookup) lookup.container, slot, top)
              : lookup.container;
      final Ast.Exp key =
          lookup.key instanceof Ast.Wildcard
              ? slot(slot[0]++, top)
              : lookup.key.accept(this);
      return lookup.copy(container, key);
    }

    private Ast.Literal slot(int slot, Ast.Exp node) {
      if (slot >= slots.size()) {
        throw new AmbiguousWildcardException("'" + node + "' has more "
            + "wildcards than the variable that determines their values",
            node);
      }
      return slots.get(slot);
    }

    @Override protected Ast.Exp visit(Ast.Sum sum) {
      return sum;
    }

    @Override protected Ast.Exp visit(Ast.GeneratorSum generatorSum) {
      return generatorSum;
    }

    @Override protected Ast.Exp visit(
        Ast.PatternInstanceSet patternInstanceSet) {
      return patternInstanceSet;
    }
  }
}

// End WildcardExpander.java
