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
package net.hydromatic.opl.eval;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/** Tests {@link EvalEnv}. */
class EvalEnvTest {
  @Test void testPushAndPop() {
    final EvalEnv env = new EvalEnv();
    assertThat(env.getOpt("i"), nullValue());
    try (EvalEnv.Frame ignored = env.push("i", 1)) {
      assertThat(env.getOpt("i"), is((Object) 1));
      assertThat(env.depth(), is(1));
      try (EvalEnv.Frame ignored2 = env.push("j", 2)) {
        assertThat(env.describe(), is("i=1, j=2"));
        assertThat(env.toString(), is("{i=1, j=2}"));
      }
      assertThat(env.getOpt("j"), nullValue());
    }
    assertThat(env.depth(), is(0));
    assertThat(env.describe(), is(""));
  }

  @Test void testShadow() {
    final EvalEnv env = new EvalEnv();
    try (EvalEnv.Frame ignored = env.push("i", 1)) {
      try (EvalEnv.Frame ignored2 = env.push("i", "a")) {
        assertThat(env.getOpt("i"), is((Object) "a"));
        assertThat(env.valueMap(), is(ImmutableMap.of("i", "a")));
        assertThat(env.describe(), is("i=1, i=a"));
      }
      assertThat(env.getOpt("i"), is((Object) 1));
    }
  }

  @Test void testBindingIsRemovedOnException() {
    final EvalEnv env = new EvalEnv();
    assertThrows(IllegalArgumentException.class, () -> {
      try (EvalEnv.Frame ignored = env.push("i", 1)) {
        throw new IllegalArgumentException("fail");
      }
    });
    assertThat(env.depth(), is(0));
  }

  @Test void testCloseOutOfOrder() {
    final EvalEnv env = new EvalEnv();
    final EvalEnv.Frame outer = env.push("i", 1);
    final EvalEnv.Frame inner = env.push("j", 2);
    assertThrows(IllegalStateException.class, outer::close);
    inner.close();
    outer.close();
    assertThat(env.depth(), is(0));

    // Closing twice has no effect.
    outer.close();
    assertThat(env.depth(), is(0));
  }
}

// End EvalEnvTest.java
