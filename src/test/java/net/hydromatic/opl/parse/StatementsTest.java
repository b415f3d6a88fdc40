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
package net.hydromatic.opl.parse;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests {@link Statements}. */
class StatementsTest {
  private static void check(String text, String... statements) {
    assertThat(Statements.split(text), is(ImmutableList.copyOf(statements)));
  }

  @Test void testSplit() {
    check("range I = 1..3;\nfloat c[I] = [1, 2, 3];\n",
        "range I = 1..3", "float c[I] = [1, 2, 3]");
    check(";; x <= 1 ;", "x <= 1");
    check("x <= 1", "x <= 1");
    check("");
  }

  @Test void testComments() {
    check("range I = 1..3; // size; of I\nint n = 2;",
        "range I = 1..3", "int n = 2");
    check("x /* ; */ <= 1;", "x   <= 1");
    check("int n = 2; // no newline", "int n = 2");
  }

  /** A block ends at its closing brace; the ';' is optional. */
  @Test void testBlocks() {
    check("tuple T { key int a; int b; } {T} Ts = ...;",
        "tuple T { key int a; int b; }", "{T} Ts = ...");
    check("forall(i in I) { x[i] <= 1; y[i] >= 0; } z <= 1;",
        "forall(i in I) { x[i] <= 1; y[i] >= 0; }", "z <= 1");
    check("subject to { c1: x <= 1; };",
        "subject to { c1: x <= 1; }");
  }

  /** Braces that are not blocks, as in sets, do not end a statement. */
  @Test void testSetBraces() {
    check("{int} S = {1, 2}; {int} T = {j | j in S: j > 1};",
        "{int} S = {1, 2}", "{int} T = {j | j in S: j > 1}");
    check("float c[S] = {1, 2};", "float c[S] = {1, 2}");
  }

  @Test void testStrings() {
    check("string s = \"a;b\"; x <= 1", "string s = \"a;b\"", "x <= 1");
    check("string s = \"// not a comment\";",
        "string s = \"// not a comment\"");
    check("string s = \"say \\\"hi;\\\"\";",
        "string s = \"say \\\"hi;\\\"\"");
  }
}

// End StatementsTest.java
