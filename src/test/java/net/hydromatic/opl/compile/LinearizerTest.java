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
package net.hydromatic.opl.compile;

import static net.hydromatic.opl.Matchers.assertThrowsKind;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.opl.Fixture;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Session;
import net.hydromatic.opl.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests {@link Linearizer}. */
class LinearizerTest {
  private static final Fixture MODEL =
      Fixture.model("range I = 1..3;\n"
          + "float c[I] = [10, 20, 30];\n"
          + "dvar float x;\n"
          + "dvar float y;\n"
          + "dvar float+ z[I];\n"
          + "dexpr float total = sum(i in I) c[i] * z[i];\n"
          + "dexpr float w[i in I] = c[i] * z[i];\n");

  private static final Pattern VARIABLE =
      Pattern.compile("\\b([xy])\\b|\\bz\\[([1-3])\\]");

  private static Linear linearize(Fixture fixture, String expression,
      EvalEnv env) {
    final Session session = fixture.session();
    return new Linearizer(session.evaluator())
        .linearize(Parsers.parseExp(session.registry, expression), env);
  }

  private static Linear linearize(String expression) {
    return linearize(MODEL, expression, new EvalEnv());
  }

  private static void check(String expression, String expected) {
    assertThat(linearize(expression).toString(), is(expected));
  }

  @Test void testAffine() {
    check("2*x + 3*y - 4", "2*x + 3*y - 4");
    check("(x + y) * 3", "3*x + 3*y");
    check("x / 2", "0.5*x");
    check("-(x - 2*y)", "-x + 2*y");
    check("x + 2*x - y + 1", "3*x - y + 1");
  }

  @Test void testCancel() {
    final Linear linear = linearize("x - x");
    assertThat(linear.isConstant(), is(true));
    assertThat(linear.toString(), is("0"));
  }

  @Test void testConstant() {
    final Linear linear = linearize("c[1] + 5");
    assertThat(linear.isConstant(), is(true));
    assertThat(linear.constant, is(15d));
  }

  @Test void testTinyCoefficientIsDropped() {
    check("x + 1e-12 * y", "x");
  }

  @Test void testNonLinear() {
    assertThrowsKind(CompileException.Kind.NON_LINEAR_TERM,
        () -> linearize("x * y"));
    assertThrowsKind(CompileException.Kind.NON_LINEAR_TERM,
        () -> linearize("2 / x"));
    assertThrowsKind(CompileException.Kind.NON_LINEAR_TERM,
        () -> linearize("(x + 1) * (y - 1)"));
  }

  /** Multiplying a non-linear term by zero is simplified away first. */
  @Test void testSimplifiedBeforeLinearizing() {
    check("x * 1 + 0 * (x * y)", "x");
    check("(1 - 1) * y + x", "x");
  }

  /** The affine form has the same value as the expression, whatever values
   * are assigned to the variables. */
  @Test void testFormEvaluatesLikeExpression() {
    final List<String> expressions =
        ImmutableList.of("2*x + 3*y - 4",
            "(x + y) * 3 - c[2] / 4",
            "x / 4 + y / -2",
            "-(x - 2*y) / 0.5",
            "(x + 2) * (3 - c[1] / 5) - z[2] / 8",
            "(x / 4 - z[1]) / (c[3] / 10) + 7",
            "x + z[1] + z[2] + z[3] - (z[3] - 1) * 2",
            "1 - -x");
    final Random random = new Random(1234);
    for (int k = 0; k < 10; k++) {
      final Map<String, Double> assignment = new HashMap<>();
      for (String name : ImmutableList.of("x", "y", "z1", "z2", "z3")) {
        assignment.put(name, (random.nextInt(81) - 40) / 4d);
      }
      for (String expression : expressions) {
        final Linear linear = linearize(expression);
        final Object expected = MODEL.evaluate(assign(expression, assignment));
        assertThat(expression + " at " + assignment,
            linear.evaluate(assignment), closeTo((Double) expected, 1e-9));
      }
    }
  }

  /** Replaces each variable in an expression with its value. */
  private static String assign(String expression,
      Map<String, Double> assignment) {
    final Matcher matcher = VARIABLE.matcher(expression);
    final StringBuffer b = new StringBuffer();
    while (matcher.find()) {
      final String name = matcher.group(1) != null
          ? matcher.group(1)
          : "z" + matcher.group(2);
      matcher.appendReplacement(b, "(" + assignment.get(name) + ")");
    }
    matcher.appendTail(b);
    return b.toString();
  }

  @Test void testConstantForm() {
    final Linear five = Linear.of(5);
    assertThat(five.isConstant(), is(true));
    assertThat(five.evaluate(ImmutableMap.of("x", 3d)), is(5d));
    assertThat(linearize("x + 5").minus(five).toString(), is("x"));
  }

  @Test void testSum() {
    final Linear linear = linearize("sum(i in I) c[i] * z[i]");
    assertThat(linear.toString(), is("10*z1 + 20*z2 + 30*z3"));
    assertThat(linear.coefficient("z2"), is(20d));
    assertThat(linear.coefficient("x"), is(0d));
  }

  @Test void testDecisionExpression() {
    check("total + 1", "10*z1 + 20*z2 + 30*z3 + 1");
    check("2 * total", "20*z1 + 40*z2 + 60*z3");
    check("w[2]", "20*z2");
  }

  @Test void testIndexBoundInEnvironment() {
    final EvalEnv env = new EvalEnv();
    try (EvalEnv.Frame ignored = env.push("i", 2)) {
      final Linear linear = linearize(MODEL, "c[i] * z[i]", env);
      assertThat(linear.toString(), is("20*z2"));
      assertThat(env.depth(), is(1));
    }
    assertThat(env.depth(), is(0));
  }

  @Test void testWrongArity() {
    assertThrowsKind(CompileException.Kind.DIMENSION_MISMATCH,
        () -> linearize("z"));
    assertThrowsKind(CompileException.Kind.DIMENSION_MISMATCH,
        () -> linearize("x[1]"));
  }

  @Test void testCycle() {
    final Fixture fixture =
        Fixture.model("dvar float v;\n"
            + "dexpr float a = v + b;\n"
            + "dexpr float b = a;\n"
            + "dexpr float s = v + s;\n");
    final CompileException e =
        assertThrowsKind(CompileException.Kind.CYCLIC_DECISION_EXPRESSION,
            () -> linearize(fixture, "a", new EvalEnv()));
    assertThat(e.getMessage(),
        is("decision expression 'a' refers to itself: a -> b -> a"));
    assertThrowsKind(CompileException.Kind.CYCLIC_DECISION_EXPRESSION,
        () -> linearize(fixture, "s + 1", new EvalEnv()));
  }
}

// End LinearizerTest.java
