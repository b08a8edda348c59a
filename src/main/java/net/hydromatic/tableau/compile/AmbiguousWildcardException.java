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

/** The values that a wildcard ranges over cannot be determined. */
public class AmbiguousWildcardException extends CompileException {
  public AmbiguousWildcardException(String message, @Nullable AstNode node) {
    super(message, node);
  }
}

// End AmbiguousWildcardException.java
