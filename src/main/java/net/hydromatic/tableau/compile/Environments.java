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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Creates an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Creates an environment containing the given names and values, for
   * names that are already in scope when a declaration is compiled. Values
   * are normalized as by {@link ConstantEvaluator#normalize(Object)}. */
  public static Environment of(Map<String, ?> values) {
    if (values.isEmpty()) {
      return empty();
    }
    final ImmutableMap.Builder<String, Binding> b = ImmutableMap.builder();
    values.forEach((name, value) ->
        b.put(name, Binding.of(name, ConstantEvaluator.normalize(value))));
    return new MapEnvironment(empty(), b.build());
  }

  /**
   * Environment that inherits from a parent environment and adds one binding.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override public String toString() {
      return binding + ", ...";
    }

    @Override public @Nullable Binding getOpt(String name) {
      if (name.equals(binding.name)) {
        return binding;
      }
      return parent.getOpt(name);
    }

    @Override protected Environment bind(Binding binding) {
      Environment env;
      if (this.binding.name.equals(binding.name)) {
        // The new binding will obscure the current environment's binding,
        // because it binds a variable of the same name. Bind the parent
        // environment instead. This strategy is worthwhile because it tends to
        // prevent long chains from forming.
        env = parent;
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).binding.name.equals(binding.name)) {
          env = ((SubEnvironment) env).parent;
        }
      } else {
        env = this;
      }
      return new SubEnvironment(env, binding);
    }

    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override public String toString() {
      return "{}";
    }

    void visit(Consumer<Binding> consumer) {}

    @Override public @Nullable Binding getOpt(String name) {
      return null;
    }
  }

  /** Environment that keeps bindings in a map. */
  static class MapEnvironment extends Environment {
    private final Environment parent;
    private final ImmutableMap<String, Binding> map;

    MapEnvironment(Environment parent, ImmutableMap<String, Binding> map) {
      this.parent = requireNonNull(parent);
      this.map = requireNonNull(map);
    }

    @Override public String toString() {
      return map.values() + ", ...";
    }

    void visit(Consumer<Binding> consumer) {
      map.values().asList().reverse().forEach(consumer);
      parent.visit(consumer);
    }

    @Override public @Nullable Binding getOpt(String name) {
      final Binding binding = map.get(name);
      return binding != null ? binding : parent.getOpt(name);
    }
  }
}

// End Environments.java
