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

import java.util.List;
import java.util.Map;
import net.hydromatic.tableau.ast.AstNode;
import net.hydromatic.tableau.model.VarId;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for looking up keys in containers of model parameters.
 *
 * <p>A key matches an entry of a {@link Map} if it is equal to the entry's
 * key, or failing that, if the two have the same text after
 * normalization; so "{@code 1}", "{@code 1.0}" and "{@code "1"}" all find
 * the same entry. A {@link List} is indexed by 0-based integer
 * position. */
public abstract class Keys {
  private Keys() {}

  /** Returns the text of a key, as used for matching. */
  public static String text(Object key) {
    return VarId.indexText(key);
  }

  /** Returns whether two keys match. */
  public static boolean matches(Object key0, Object key1) {
    return key0.equals(key1) || text(key0).equals(text(key1));
  }

  /** Looks up a key in a container, and returns the normalized value.
   *
   * @throws KeyNotFoundException if the container has no such key
   * @throws DomainException if {@code container} is not a map or list, or
   * the value is null */
  public static Object get(Object container, Object key,
      @Nullable AstNode node) {
    if (container instanceof Map) {
      final Map<?, ?> map = (Map<?, ?>) container;
      for (Map.Entry<?, ?> e : map.entrySet()) {
        if (key.equals(e.getKey())) {
          return value(e.getValue(), key, node);
        }
      }
      for (Map.Entry<?, ?> e : map.entrySet()) {
        if (e.getKey() != null && matches(e.getKey(), key)) {
          return value(e.getValue(), key, node);
        }
      }
      throw new KeyNotFoundException(key, node);
    }
    if (container instanceof List) {
      final List<?> list = (List<?>) container;
      final Object k = ConstantEvaluator.normalize(key);
      if (k instanceof Long) {
        final long i = (Long) k;
        if (i >= 0 && i < list.size()) {
          return value(list.get((int) i), key, node);
        }
      }
      throw new KeyNotFoundException(key, node);
    }
    throw new DomainException("cannot look up key '" + key
        + "' in a value that is not a map or list: " + container, node);
  }

  private static Object value(@Nullable Object value, Object key,
      @Nullable AstNode node) {
    if (value == null) {
      throw new DomainException("value of key '" + key + "' is null", node);
    }
    return ConstantEvaluator.normalize(value);
  }
}

// End Keys.java
