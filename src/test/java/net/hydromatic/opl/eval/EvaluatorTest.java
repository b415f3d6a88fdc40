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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.opl.Fixture;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests {@link Evaluator}. */
class EvaluatorTest {
  private static final Fixture MODEL =
      Fixture.model("tuple Arc { key int from; key int to; float weight; }\n"
          + "{Arc} Arcs = {<1, 2, 7>, <2, 3, 4>};\n"
          + "range I = 1..3;\n"
          + "float c[I] = [10, 20, 30];\n"
          + "int n = 4;\n"
          + "float ext[I] = ...;\n"
          + "string name = \"abc\";\n"
          + "dvar float x;\n"
          + "dexpr float d = n * 2;\n"
          + "dexpr float a = b + 1;\n"
          + "dexpr float b = a + 1;\n");

  private static Object evaluate(String expression) {
    return MODEL.evaluate(expression);
  }

  private static void check(String expression, Object expected) {
    assertThat(evaluate(expression), is(expected));
  }

  private static CompileException checkFails(String expression,
      CompileException.Kind kind) {
    return assertThrowsKind(kind, () -> evaluate(expression));
  }

  @Test void testArithmetic() {
    check("1 + 2 * 3", 7d);
    check("(1 + 2) * 3", 9d);
    check("-n + 1", -3d);
    check("c[2] / 4", 5d);
    check("n", 4);
  }

  @Test void testDivideByZero() {
    check("1 / 0", Double.POSITIVE_INFINITY);
  }

  @Test void testComparisonWithinTolerance() {
    check("1 == 1 + 1e-12", 1d);
    check("1 == 1.001", 0d);
    check("1 != 1 + 1e-12", 0d);
    check("2 >= 2 + 1e-12", 1d);
    check("1 < 2 && 3 > 4", 0d);
    check("1 < 2 || 3 > 4", 1d);
    check("!(n == 4)", 0d);
  }

  @Test void testStrings() {
    check("name", "abc");
    check("name == \"abc\"", 1d);
    check("\"abc\" < \"abd\"", 1d);
  }

  @Test void testItem() {
    check("item(Arcs, <1, 2>).weight", 7d);
    check("item(Arcs, <2, 3>).to", 3);
    check("item(Arcs, <1, 2>).weight * 2", 14d);
  }

  @Test void testItemErrors() {
    checkFails("item(Arcs, <3, 1>)", CompileException.Kind.KEY_LOOKUP_FAILED);
    checkFails("item(Arcs, 1)", CompileException.Kind.DIMENSION_MISMATCH);
    checkFails("item(Nodes, 1)", CompileException.Kind.DOMAIN_NOT_FOUND);
    checkFails("item(Arcs, <1, 2>).cost", CompileException.Kind.UNKNOWN_FIELD);
  }

  @Test void testFieldOfNonTuple() {
    checkFails("n.weight", CompileException.Kind.TYPE_COERCION_FAILED);
  }

  @Test void testNames() {
    checkFails("zz", CompileException.Kind.UNBOUND_NAME);
    checkFails("x", CompileException.Kind.UNBOUND_NAME);
    checkFails("ext[1]", CompileException.Kind.MISSING_INDEXED_VALUE);
    checkFails("c", CompileException.Kind.NON_SCALAR_PARAMETER);
    checkFails("c[1, 2]", CompileException.Kind.DIMENSION_MISMATCH);
  }

  @Test void testDecisionExpression() {
    check("d + 1", 9d);
    final CompileException e =
        checkFails("a", CompileException.Kind.CYCLIC_DECISION_EXPRESSION);
    assertThat(e.getMessage(),
        is("decision expression 'a' refers to itself: a -> b -> a"));
  }

  @Test void testSum() {
    check("sum(i in I) c[i]", 60d);
    check("sum(i in I: i > 1) c[i]", 50d);
    check("sum(i in 1..n) i", 10d);
    check("sum(arc in Arcs) arc.weight", 11d);
  }

  @Test void testBoundVariable() {
    final Session session = MODEL.session();
    final Evaluator evaluator = session.evaluator();
    final EvalEnv env = new EvalEnv();
    try (EvalEnv.Frame ignored = env.push("i", 2)) {
      assertThat(
          evaluator.evaluate(Parsers.parseExp(session.registry, "c[i] + 1"),
              env),
          is(21d));
      assertThat(
          evaluator.isTrue(Parsers.parseExp(session.registry, "i == 2"), env),
          is(true));
    }
  }
}

// End EvaluatorTest.java
