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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique names.
 *
 * <p>Auxiliary variables created by linearization are named for the
 * operator they replace and an ordinal that is unique in the model, for
 * example "{@code _abs1}", "{@code _max2}".
 *
 * <p>Also keeps track of how many times each given prefix has been used,
 * so that unnamed constraints can be given a fresh ordinal.
 *
 * <p>A pending change to a model works on a copy, which replaces the
 * model's generator when the change is committed.
 */
public class NameGenerator {
  private int id = 0;
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();
  private final Map<String, Integer> ordinals = new HashMap<>();

  public NameGenerator() {
  }

  /** Creates a copy of a name generator. */
  public NameGenerator(NameGenerator nameGenerator) {
    this.id = nameGenerator.id;
    nameGenerator.nameCounts.forEach((name, count) ->
        nameCounts.put(name, new AtomicInteger(count.get())));
    ordinals.putAll(nameGenerator.ordinals);
  }

  /** Generates a name, such as "{@code _max3}", that is unique in this
   * model. */
  public String get(String operator) {
    return "_" + operator + ++id;
  }

  /** Returns the number of times that "name" has been used, starting at
   * 1. */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .incrementAndGet();
  }

  /** Returns the ordinal of a key among the keys that have been seen
   * with a given prefix, starting at 1. The same key always gets the same
   * ordinal. */
  public int ordinal(String prefix, String key) {
    final Integer ordinal = ordinals.get(prefix + ":" + key);
    if (ordinal != null) {
      return ordinal;
    }
    final int next = inc(prefix);
    ordinals.put(prefix + ":" + key, next);
    return next;
  }
}

// End NameGenerator.java
