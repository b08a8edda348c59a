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

import java.util.Objects;

/** Binding of a name to a value, produced by a generator.
 *
 * <p>The value is a normalized constant: a {@link Long}, {@link Double},
 * {@link String}, {@link Boolean}, {@link java.util.List} or
 * {@link java.util.Map}. */
public final class Binding {
  public final String name;
  public final Object value;

  private Binding(String name, Object value) {
    this.name = requireNonNull(name);
    this.value = requireNonNull(value);
  }

  public static Binding of(String name, Object value) {
    return new Binding(name, value);
  }

  @Override public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Binding
        && name.equals(((Binding) o).name)
        && value.equals(((Binding) o).value);
  }

  @Override public String toString() {
    return name + " = " + value;
  }
}

// End Binding.java
