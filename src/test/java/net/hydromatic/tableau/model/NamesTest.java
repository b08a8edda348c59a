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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.base.Strings;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

/** Tests for {@link Names} and {@link VarId}. */
public class NamesTest {
  @Test
  void testSanitize() {
    assertThat(Names.sanitize("cap_1"), is("cap_1"));
    assertThat(Names.sanitize("cap 1"), is("cap_1"));
    assertThat(Names.sanitize("a+b-c*d^e[f]"), is("a_b_c_d_e_f_"));
    assertThat(Names.sanitize("cap(1,2)"), is("cap(1,2)"));
    assertThat(Names.sanitize("1st"), is("_1st"));
    assertThat(Names.sanitize(".x"), is("_.x"));
    assertThat(Names.sanitize(""), is("_"));
    assertThat(Names.sanitize(Strings.repeat("a", 300)).length(),
        is(Names.MAX_LENGTH));
  }

  @Test
  void testSanitizeVariable() {
    assertThat(VarId.of("x", 1, 2).sanitizedName(), is("x(1,2)"));
    assertThat(VarId.of("z").sanitizedName(), is("z"));
    // Punctuation inside an index is replaced; the delimiters are kept
    assertThat(VarId.of("qty", "whole wheat").sanitizedName(),
        is("qty(whole_wheat)"));
    assertThat(VarId.of("flow", "a,b", "(c)").sanitizedName(),
        is("flow(a_b,_c_)"));
    assertThat(VarId.of("x", "").sanitizedName(), is("x(_)"));
  }

  @Test
  void testVarIdNormalization() {
    final VarId x1 = VarId.of("x", 1);
    assertThat(VarId.of("x", 1L), is(x1));
    assertThat(VarId.of("x", 1.0), is(x1));
    assertThat(VarId.of("x", new BigDecimal("1.00")), is(x1));
    assertThat(VarId.of("x", 1.5).name(), is("x(1.5)"));
    assertThat(VarId.of("x", "1").equals(x1), is(false));
    assertThat(VarId.of("x", "A", "X").name(), is("x(A,X)"));
  }

  @Test
  void testFormatNumber() {
    assertThat(Names.formatNumber(3D), is("3"));
    assertThat(Names.formatNumber(-2D), is("-2"));
    assertThat(Names.formatNumber(0.25D), is("0.25"));
    assertThat(Names.formatNumber(1e-7), is("0.0000001"));
    assertThat(Names.formatNumber(-0D), is("0"));
    assertThat(Names.formatNumber(Double.POSITIVE_INFINITY), is("1e+30"));
    assertThat(Names.formatNumber(Double.NEGATIVE_INFINITY), is("-1e+30"));
  }
}

// End NamesTest.java
