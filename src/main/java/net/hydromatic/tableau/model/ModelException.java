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

import static java.util.Objects.requireNonNull;

import net.hydromatic.tableau.compile.CompileException;

/** A declaration would violate an invariant of the {@link Model}. */
public class ModelException extends CompileException {
  public final Reason reason;

  public ModelException(Reason reason, String message) {
    super(message, null);
    this.reason = requireNonNull(reason);
  }

  @Override public String getMessage() {
    return reason + ": " + super.getMessage();
  }

  /** Which invariant was violated. */
  public enum Reason {
    /** A variable instance is declared a second time. */
    REDEFINITION,
    /** Bounds are not valid for the kind of variable, or lower exceeds
     * upper. */
    ILLEGAL_BOUNDS,
    /** A second objective, in a declarative block. */
    DUPLICATE_OBJECTIVE,
    /** Two distinct names are the same after sanitization. */
    NAME_COLLISION,
    /** A constraint name is used a second time. */
    DUPLICATE_CONSTRAINT,
    /** A constraint has no variables and can never be satisfied. */
    TRIVIAL_CONSTRAINT
  }
}

// End ModelException.java
