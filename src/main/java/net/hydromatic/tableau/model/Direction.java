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

import com.google.common.base.Ascii;

/** Direction of optimization. */
public enum Direction {
  MINIMIZE,
  MAXIMIZE;

  /** Returns the lower-case name, e.g. "minimize". */
  public String lowerName() {
    return Ascii.toLowerCase(name());
  }

  /** Returns the section header in the LP format, e.g. "Minimize". */
  public String lpName() {
    return name().charAt(0) + Ascii.toLowerCase(name().substring(1));
  }
}

// End Direction.java
