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

/** A generator domain or lookup container does not have the shape required:
 * for example, a domain that is a number rather than a sequence, a range
 * whose ends are not integers, or a filter that is not boolean. */
public class DomainException extends CompileException {
  public DomainException(String message, @Nullable AstNode node) {
    super(message, node);
  }
}

// End DomainException.java
