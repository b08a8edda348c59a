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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsInstanceOf.instanceOf;
import static org.hamcrest.core.IsNull.nullValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests for {@link net.hydromatic.tableau.compile.Environment}. */
public class EnvironmentTest {
  /**
   * Tests that if you call {@link Environment#bind} twice with the same name,
   * the binding chain does not get longer.
   */
  @Test
  void testOptimizeSubEnvironment() {
    final Environment e0 =
        Environments.of(ImmutableMap.of("p", 1, "q", "x"))
            .bind("a", 0L)
            .bind("b", 1L)
            .bind("c", 2L);
    assertThat(e0, instanceOf(Environments.SubEnvironment.class));
    checkOptimizeSubEnvironment(e0);
  }

  private void checkOptimizeSubEnvironment(Environment e0) {
    final Set<String> nameSet = ImmutableSet.of("p", "q", "a", "b", "c");
    final Set<String> namePlusFooSet =
        ImmutableSet.<String>builder().addAll(nameSet).add("foo").build();

    assertThat(e0.getValueMap().keySet(), is(nameSet));
    assertThat(e0, hasEnvLength(5));

    // Overwrite "c"; there are still 5 values and 5 bindings.
    final Environment e1 = e0.bind("c", "yes");
    assertThat(e1.getValueMap().keySet(), is(nameSet));
    assertThat(e1, hasEnvLength(5));
    assertThat(e1.getValue("c"), is("yes"));

    // Overwrite "p"; still 5 values, but 6 bindings.
    final Environment e2 = e1.bind("p", "no");
    assertThat(e2.getValueMap().keySet(), is(ImmutableSet.of("q", "a", "b",
        "c", "p")));
    assertThat(e2, hasEnvLength(6));
    assertThat(e2.getValue("p"), is("no"));

    // Add "foo". Value count and binding count increase.
    final Environment e3 = e2.bind("foo", "baz");
    assertThat(e3.getValueMap().keySet().size(), is(6));
    assertThat(e3.getValueMap().keySet().containsAll(namePlusFooSet),
        is(true));
    assertThat(e3, hasEnvLength(7));

    // Add "p" again. Value count stays at 6, binding count increases.
    // (We do not look beyond the "foo" for the "p"; such optimization would
    // be nice, but is expensive, so we do not do it.)
    final Environment e4 = e3.bind("p", "yes");
    assertThat(e4.getValueMap().size(), is(6));
    assertThat(e4, hasEnvLength(8));
  }

  /** Values from a map are normalized; a sibling binding does not see
   * the others. */
  @Test
  void testLookup() {
    final Environment e0 =
        Environments.of(ImmutableMap.of("n", 3, "xs", ImmutableList.of(1, 2)));
    assertThat(e0.getValue("n"), is(3L));
    assertThat(e0.getValue("xs"), is(ImmutableList.of(1, 2)));
    assertThat(e0.getValue("m"), nullValue());
    assertThat(e0.getOpt("m"), nullValue());

    final Environment e1 = e0.bind("i", 1L);
    final Environment e2 = e0.bind("i", 2L);
    assertThat(e1.getValue("i"), is(1L));
    assertThat(e2.getValue("i"), is(2L));
    assertThat(e0.getValue("i"), nullValue());
    assertThat(e1.getOpt("i"), is(Binding.of("i", 1L)));
    assertThat(Environments.empty().getValueMap().isEmpty(), is(true));
    assertThat(Environments.of(ImmutableMap.of()),
        is(Environments.empty()));
  }

  private Matcher<Environment> hasEnvLength(int i) {
    return new CustomTypeSafeMatcher<Environment>("environment depth " + i) {
      @Override protected boolean matchesSafely(Environment env) {
        return depth(env) == i;
      }

      private int depth(Environment env) {
        final AtomicInteger c = new AtomicInteger();
        env.visit(b -> c.incrementAndGet());
        return c.get();
      }
    };
  }
}

// End EnvironmentTest.java
