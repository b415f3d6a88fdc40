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

import static net.hydromatic.opl.Matchers.assertThrowsKind;
import static net.hydromatic.opl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.opl.Fixture;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests {@link Expander}. */
class ExpanderTest {
  private static final Session SESSION =
      Fixture.model("range I = 1..2;\n"
          + "range J = 1..2;\n"
          + "range K = 1..3;\n"
          + "range Empty = 1..0;\n").session();

  private static Ast.Iterator iterator(String var, String domain,
      @Nullable String filter) {
    return ast.iterator(Pos.ZERO, var, ast.namedDomain(Pos.ZERO, domain, null),
        filter == null ? null : exp(filter));
  }

  private static Ast.Exp exp(String s) {
    return Parsers.parseExp(SESSION.registry, s);
  }

  @Test void testFilter() {
    final EvalEnv env = new EvalEnv();
    final List<String> list = new ArrayList<>();
    SESSION.evaluator().expander()
        .expand(
            ImmutableList.of(iterator("i", "I", null),
                iterator("j", "J", null)),
            exp("i != j"), env, e -> list.add(e.describe()));
    assertThat(list, is(ImmutableList.of("i=1, j=2", "i=2, j=1")));
    assertThat(env.depth(), is(0));
  }

  @Test void testIteratorFilter() {
    final List<Object> list = new ArrayList<>();
    SESSION.evaluator().expander()
        .expand(ImmutableList.of(iterator("k", "K", "k > 1")), null,
            new EvalEnv(), e -> list.add(e.getOpt("k")));
    assertThat(list, is(ImmutableList.<Object>of(2, 3)));
  }

  @Test void testEmptyDomain() {
    final List<Object> list = new ArrayList<>();
    SESSION.evaluator().expander()
        .expand(
            ImmutableList.of(iterator("i", "I", null),
                iterator("e", "Empty", null)),
            null, new EvalEnv(), e -> list.add(e.describe()));
    assertThat(list.isEmpty(), is(true));
  }

  /** An error in the callback records the bindings of the iteration that
   * failed, and every binding is removed. */
  @Test void testErrorRecordsBindings() {
    final EvalEnv env = new EvalEnv();
    final CompileException e =
        assertThrowsKind(CompileException.Kind.UNBOUND_NAME, () ->
            SESSION.evaluator().expander()
                .expand(
                    ImmutableList.of(iterator("i", "I", null),
                        iterator("j", "J", null)),
                    null, env, e2 -> {
                      throw new CompileException(
                          CompileException.Kind.UNBOUND_NAME, "boom");
                    }));
    assertThat(e.bindings(), is("i=1, j=1"));
    assertThat(e.getMessage(), is("boom [i=1, j=1]"));
    assertThat(env.depth(), is(0));
  }

  @Test void testMaxDepth() {
    final Evaluator evaluator = new Evaluator(SESSION.registry, 1);
    assertThrowsKind(CompileException.Kind.DIMENSION_MISMATCH, () ->
        evaluator.expander()
            .expand(
                ImmutableList.of(iterator("i", "I", null),
                    iterator("j", "J", null)),
                null, new EvalEnv(), e -> { }));
  }

  @Test void testUnknownDomain() {
    assertThrowsKind(CompileException.Kind.DOMAIN_NOT_FOUND, () ->
        SESSION.evaluator().expander()
            .expand(ImmutableList.of(iterator("i", "Nope", null)), null,
                new EvalEnv(), e -> { }));
  }
}

// End ExpanderTest.java
