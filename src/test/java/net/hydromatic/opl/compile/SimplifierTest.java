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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.model.ModelRegistry;
import net.hydromatic.opl.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests {@link Simplifier}. */
class SimplifierTest {
  private static Ast.Exp parse(String s) {
    return Parsers.parseExp(new ModelRegistry(), s);
  }

  private static void checkSimplify(String s, String expected) {
    final Ast.Exp exp = Simplifier.simplify(parse(s));
    assertThat(exp.toString(), is(expected));

    // Simplifying again changes nothing.
    assertThat(Simplifier.simplify(exp), sameInstance(exp));
  }

  @Test void testFoldConstants() {
    checkSimplify("3 + 1", "4");
    checkSimplify("6 / 4", "1.5");
    checkSimplify("2 * (3 - 5)", "-4");
    checkSimplify("1 < 2", "1");
    checkSimplify("2 == 3", "0");
    checkSimplify("!(1 < 2)", "0");
    checkSimplify("1 && 0 || 1", "1");
  }

  @Test void testIdentities() {
    checkSimplify("x + 0", "x");
    checkSimplify("0 + x", "x");
    checkSimplify("y - 0", "y");
    checkSimplify("0 * y", "0");
    checkSimplify("y * 0", "0");
    checkSimplify("1 * y", "y");
    checkSimplify("y * 1", "y");
    checkSimplify("(2 - 1) * y + (3 - 3)", "y");
  }

  /** "0 - y" is not "y"; it stays as it is. */
  @Test void testZeroMinus() {
    checkSimplify("0 - y", "0 - y");
  }

  @Test void testUnchangedIsSameInstance() {
    final Ast.Exp exp = parse("a * b + c");
    assertThat(Simplifier.simplify(exp), sameInstance(exp));
  }

  @Test void testNestedInsideSum() {
    checkSimplify("sum(i in I) (1 * c[i])", "sum(i in I) c[i]");
  }
}

// End SimplifierTest.java
