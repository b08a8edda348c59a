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
package net.hydromatic.tableau.ast;

import java.math.BigDecimal;
import java.util.List;

/** Prints an abstract syntax tree as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** {@inheritDoc}
   *
   * <p>Returns the text written so far. */
  @Override public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, in a context with given left and right precedence. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    b.append(name);
    return this;
  }

  /** Appends a literal value; strings are quoted, numbers are printed
   * without trailing zeros. */
  public AstWriter appendLiteral(Comparable<?> value) {
    if (value instanceof String) {
      b.append('"')
          .append(((String) value).replace("\"", "\\\""))
          .append('"');
    } else if (value instanceof BigDecimal) {
      b.append(((BigDecimal) value).stripTrailingZeros().toPlainString());
    } else {
      b.append(value);
    }
    return this;
  }

  /** Appends a list of nodes separated by commas. */
  public AstWriter appendAll(List<? extends AstNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /** Appends a call, such as "{@code max(a, b)}". */
  public AstWriter call(String name, List<? extends AstNode> args) {
    return id(name).append("(").appendAll(args).append(")");
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    return append(a0, left, op.left)
        .append(op.padded)
        .append(a1, op.right, right);
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    return append(op.padded).append(a, op.right, right);
  }
}

// End AstWriter.java
