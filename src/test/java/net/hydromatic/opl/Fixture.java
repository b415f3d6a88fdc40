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
package net.hydromatic.opl;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.opl.Matchers.describe;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Prop;
import net.hydromatic.opl.eval.Session;
import net.hydromatic.opl.parse.Parsers;

/** Fluent test helper that compiles a model. */
public class Fixture {
  private final String text;
  private final Map<Prop, Object> propMap;

  private Fixture(String text, Map<Prop, Object> propMap) {
    this.text = requireNonNull(text);
    this.propMap = propMap;
  }

  /** Creates a fixture for a model. */
  public static Fixture model(String text) {
    return new Fixture(text, new LinkedHashMap<>());
  }

  /** Returns a fixture with a property set. */
  public Fixture withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Fixture(text, map);
  }

  /** Returns a fixture that expands sums in the text of each statement. */
  public Fixture textual() {
    return withProp(Prop.SUM_EXPANSION, Prop.SumExpansion.TEXTUAL);
  }

  /** Returns a fixture whose model has extra text appended. */
  public Fixture with(String moreText) {
    return new Fixture(text + "\n" + moreText, propMap);
  }

  /** Compiles the model in a new session. */
  public Session session() {
    final Session session = new Session(new LinkedHashMap<>(propMap));
    session.compile(text);
    return session;
  }

  /** Compiles the model and checks the equations, in order. */
  public Fixture assertEquations(String... expected) {
    final List<String> actual = describe(session().equations());
    assertThat(actual, is(ImmutableList.copyOf(expected)));
    return this;
  }

  /** Checks that compiling the model fails with a given kind of error;
   * returns the error. */
  public CompileException assertFails(CompileException.Kind kind) {
    return Matchers.assertThrowsKind(kind, this::session);
  }

  /** Compiles the model, then evaluates an expression. */
  public Object evaluate(String expression) {
    final Session session = session();
    final Ast.Exp exp = Parsers.parseExp(session.registry, expression);
    return session.evaluator().evaluateValue(exp, new EvalEnv());
  }
}

// End Fixture.java
