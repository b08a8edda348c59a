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

import java.math.BigDecimal;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for the names and numbers written to an LP file.
 *
 * <p>Sanitization replaces each character that the LP format does not
 * allow with "{@code _}". It never fails; when it changes a name, it logs
 * the change at INFO level. */
public abstract class Names {
  private static final Logger LOGGER = LoggerFactory.getLogger(Names.class);

  /** Maximum length of a name in the LP format. */
  public static final int MAX_LENGTH = 255;

  /** Value written for an infinite bound. */
  public static final String INFINITY = "1e+30";

  private static final Pattern ILLEGAL_IN_NAME =
      Pattern.compile("[^A-Za-z0-9_!\"#$%&(),.;?@'~]");

  /** Inside an index, the characters that delimit the index list are
   * illegal too. */
  private static final Pattern ILLEGAL_IN_INDEX =
      Pattern.compile("[^A-Za-z0-9_!\"#$%&.;?@'~]");

  private Names() {}

  /** Sanitizes a constraint or objective name. */
  public static String sanitize(String name) {
    String s = ILLEGAL_IN_NAME.matcher(name).replaceAll("_");
    s = fixStartAndLength(s);
    if (!s.equals(name)) {
      LOGGER.info("Sanitized name '{}' to '{}'", name, s);
    }
    return s;
  }

  /** Sanitizes the name of a variable instance. Each index is sanitized
   * separately; the parentheses and commas that delimit the indices are
   * kept. */
  public static String sanitizeVariable(VarId id) {
    final String raw = id.name();
    String s;
    if (id.indices.isEmpty()) {
      s = ILLEGAL_IN_NAME.matcher(id.family).replaceAll("_");
    } else {
      s = id.indices.stream()
          .map(index -> sanitizeIndex(VarId.indexText(index)))
          .collect(
              Collectors.joining(",",
                  ILLEGAL_IN_INDEX.matcher(id.family).replaceAll("_") + "(",
                  ")"));
    }
    s = fixStartAndLength(s);
    if (!s.equals(raw)) {
      LOGGER.info("Sanitized variable name '{}' to '{}'", raw, s);
    }
    return s;
  }

  private static String sanitizeIndex(String index) {
    if (index.isEmpty()) {
      return "_";
    }
    return ILLEGAL_IN_INDEX.matcher(index).replaceAll("_");
  }

  private static String fixStartAndLength(String s) {
    if (s.isEmpty()) {
      s = "_";
    }
    final char c = s.charAt(0);
    if (c >= '0' && c <= '9' || c == '.') {
      s = "_" + s;
    }
    if (s.length() > MAX_LENGTH) {
      s = s.substring(0, MAX_LENGTH);
    }
    return s;
  }

  /** Formats a number for the LP format. Integral values have no decimal
   * point; infinite values are written as {@code 1e+30} or
   * {@code -1e+30}. */
  public static String formatNumber(double d) {
    if (Double.isInfinite(d)) {
      return d > 0 ? INFINITY : "-" + INFINITY;
    }
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }
}

// End Names.java
