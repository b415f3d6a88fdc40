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
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.jupiter.api.Test;

/** Tests {@link ParenthesesExpander}. */
class ParenthesesExpanderTest {
  private static void check(String text, String expected) {
    assertThat(ParenthesesExpander.distribute(text), is(expected));
  }

  private static void checkUnchanged(String text) {
    check(text, text);
  }

  @Test void testDistribute() {
    check("2*(x[1] + x[2] - y) <= 4", "(2*x[1] + 2*x[2] - 2*y) <= 4");
    check("2 * (x[1] + x[2]) >= 1", "(2*x[1] + 2*x[2]) >= 1");
    check("0.5*(a + b)", "(0.5*a + 0.5*b)");
    check("3*(-a + b)", "(-3*a + 3*b)");
    check("y + 2*(a - b) == 0", "y + (2*a - 2*b) == 0");
  }

  @Test void testUnitCoefficient() {
    check("1*(a - b)", "(a - b)");
  }

  @Test void testLeftUnchanged() {
    // coefficient is itself a divisor or factor
    checkUnchanged("x / 2*(a + b)");
    // parentheses are a factor
    checkUnchanged("2*(a + b) * c");
    // single term
    checkUnchanged("2*(a)");
    // comparison inside parentheses
    checkUnchanged("2*(a <= b)");
    // digit is part of a name
    checkUnchanged("x2*(a + b)");
  }
}

// End ParenthesesExpanderTest.java
