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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import net.hydromatic.tableau.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Enumerates the bindings produced by a list of generators and filters.
 *
 * <p>Given "{@code i <- 1 .. 2, j <- ["a", "b"], i != 2}", produces the
 * environments {@code {i=1, j="a"}} and {@code {i=1, j="b"}}: the
 * cross-product of the domains, in nested declaration order, skipping
 * bindings for which a filter is false.
 *
 * <p>Enumeration is lazy. A domain is evaluated once for each binding of
 * the generators before it (so it may depend on them), and a filter only
 * when the enumeration reaches it. The result may be iterated more than
 * once. */
public abstract class Generators {
  private Generators() {}

  /** Returns the environments produced by a list of qualifiers, each
   * extending {@code env}. With no qualifiers, returns {@code env}
   * alone. */
  public static Iterable<Environment> enumerate(
      List<? extends Ast.Qualifier> qualifiers, Environment env,
      ConstantEvaluator evaluator) {
    final ImmutableList<Ast.Qualifier> list = ImmutableList.copyOf(qualifiers);
    requireNonNull(env);
    requireNonNull(evaluator);
    return () -> new BindingIterator(list, env, evaluator);
  }

  /** Evaluates a generator's domain to a list of values.
   *
   * <p>A list yields its elements; a map yields its keys, in iteration
   * order.
   *
   * @throws DomainException if the domain is not a list or map */
  public static List<Object> domain(Ast.Generator generator, Environment env,
      ConstantEvaluator evaluator) {
    final Object value = evaluator.evaluate(generator.domain, env);
    final Iterable<?> values;
    if (value instanceof List) {
      values = (List<?>) value;
    } else if (value instanceof Map) {
      values = ((Map<?, ?>) value).keySet();
    } else {
      throw new DomainException("domain of '" + generator.name
          + "' is not a sequence: " + value, generator);
    }
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (Object o : values) {
      if (o == null) {
        throw new DomainException("domain of '" + generator.name
            + "' contains null", generator);
      }
      b.add(ConstantEvaluator.normalize(o));
    }
    return b.build();
  }

  /** Iterator over the bindings of a list of qualifiers.
   *
   * <p>Works like an odometer: {@code iterators[k]} holds the remaining
   * values of qualifier {@code k} in environment {@code envs[k]}, and
   * {@code envs[k + 1]} is the environment after qualifier {@code k} has
   * been applied. A filter is a qualifier with zero or one values. */
  private static class BindingIterator implements Iterator<Environment> {
    private final List<Ast.Qualifier> qualifiers;
    private final ConstantEvaluator evaluator;
    private final Environment[] envs;
    private final Iterator<?>[] iterators;
    private boolean started;
    private @Nullable Environment next;

    BindingIterator(List<Ast.Qualifier> qualifiers, Environment env,
        ConstantEvaluator evaluator) {
      this.qualifiers = qualifiers;
      this.evaluator = evaluator;
      this.envs = new Environment[qualifiers.size() + 1];
      this.iterators = new Iterator<?>[qualifiers.size()];
      this.envs[0] = env;
    }

    @Override public boolean hasNext() {
      if (next == null) {
        next = advance();
      }
      return next != null;
    }

    @Override public Environment next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      final Environment env = requireNonNull(next);
      next = null;
      return env;
    }

    private @Nullable Environment advance() {
      final int n = qualifiers.size();
      int k;
      if (!started) {
        started = true;
        if (n == 0) {
          return envs[0];
        }
        open(0);
        k = 0;
      } else {
        if (n == 0) {
          return null;
        }
        k = n - 1;
      }
      while (k >= 0) {
        if (step(k)) {
          if (k == n - 1) {
            return envs[n];
          }
          ++k;
          open(k);
        } else {
          --k;
        }
      }
      return null;
    }

    /** Starts qualifier {@code k} in the environment {@code envs[k]}. */
    private void open(int k) {
      final Ast.Qualifier qualifier = qualifiers.get(k);
      if (qualifier instanceof Ast.Generator) {
        iterators[k] =
            domain((Ast.Generator) qualifier, envs[k], evaluator).iterator();
      } else {
        final Ast.Filter filter = (Ast.Filter) qualifier;
        iterators[k] = evaluator.evaluateBoolean(filter.condition, envs[k])
            ? Collections.singletonList(Boolean.TRUE).iterator()
            : Collections.emptyIterator();
      }
    }

    /** Moves qualifier {@code k} to its next value; returns false if it has
     * none. */
    private boolean step(int k) {
      final Iterator<?> iterator = iterators[k];
      if (!iterator.hasNext()) {
        return false;
      }
      final Object value = iterator.next();
      final Ast.Qualifier qualifier = qualifiers.get(k);
      envs[k + 1] = qualifier instanceof Ast.Generator
          ? envs[k].bind(((Ast.Generator) qualifier).name, value)
          : envs[k];
      return true;
    }
  }
}

// End Generators.java
