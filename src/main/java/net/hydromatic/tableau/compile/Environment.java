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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Binding context: the values of the generator names in scope.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change. Sibling bindings produced by a generator
 * therefore never see each other's values.
 *
 * <p>Lookup is by exact name, never by position.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  abstract void visit(Consumer<Binding> consumer);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    getValueMap().forEach((k, v) -> b.append(v).append("\n"));
    return b.toString();
  }

  /** Returns the binding of {@code name} if bound, null if not. */
  public abstract @Nullable Binding getOpt(String name);

  /** Returns the value bound to {@code name}, null if not bound. */
  public @Nullable Object getValue(String name) {
    final Binding binding = getOpt(name);
    return binding == null ? null : binding.value;
  }

  /**
   * Creates an environment that is the same as this environment, plus one
   * more binding.
   */
  public Environment bind(String name, Object value) {
    return bind(Binding.of(name, value));
  }

  protected Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  /**
   * Returns a map of the names and bindings, the oldest first. Does not
   * include obscured bindings.
   */
  public final Map<String, Binding> getValueMap() {
    final List<Binding> bindings = new ArrayList<>();
    visit(bindings::add);
    final Map<String, Binding> valueMap = new LinkedHashMap<>();
    for (int i = bindings.size() - 1; i >= 0; i--) {
      final Binding binding = bindings.get(i);
      valueMap.remove(binding.name);
      valueMap.put(binding.name, binding);
    }
    return valueMap;
  }

  /**
   * Creates an environment that is the same as this, plus the given bindings.
   */
  public final Environment bindAll(Iterable<Binding> bindings) {
    Environment env = this;
    for (Binding binding : bindings) {
      env = env.bind(binding);
    }
    return env;
  }
}

// End Environment.java
