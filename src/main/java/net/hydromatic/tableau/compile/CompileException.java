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

import net.hydromatic.tableau.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An error occurred while compiling a declaration or expression.
 *
 * <p>Sub-classes distinguish the kinds of error; none of them is
 * recoverable. */
public class CompileException extends RuntimeException {
  private final @Nullable AstNode node;

  public CompileException(String message, @Nullable AstNode node) {
    super(message);
    this.node = node;
  }

  public CompileException(String message, @Nullable AstNode node,
      Throwable cause) {
    super(message, cause);
    this.node = node;
  }

  @Override public String toString() {
    return node == null
        ? super.toString()
        : super.toString() + " in " + node;
  }

  /** Returns the node being compiled when the error occurred, if known. */
  public @Nullable AstNode node() {
    return node;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(getMessage());
    if (node != null) {
      buf.append(" in '").append(node).append("'");
    }
    return buf;
  }
}

// End CompileException.java
