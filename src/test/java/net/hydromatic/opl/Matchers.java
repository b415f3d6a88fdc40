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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.model.LinearEquation;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;
import org.junit.jupiter.api.function.Executable;

/** Matchers for use in OPL tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a {@link CompileException} of a given kind. */
  public static Matcher<CompileException> hasKind(CompileException.Kind kind) {
    return new CustomTypeSafeMatcher<CompileException>(
        "compile exception of kind " + kind) {
      @Override protected boolean matchesSafely(CompileException e) {
        return e.kind() == kind;
      }
    };
  }

  /** Matches an equation whose coefficient for a variable is within
   * tolerance of a value. */
  public static Matcher<LinearEquation> hasCoefficient(String variable,
      double value) {
    return new TypeSafeMatcher<LinearEquation>() {
      @Override protected boolean matchesSafely(LinearEquation equation) {
        return Math.abs(equation.coefficient(variable) - value) < 1e-9;
      }

      @Override public void describeTo(Description description) {
        description.appendText("equation with coefficient " + value
            + " for " + variable);
      }
    };
  }

  /** Asserts that running some code throws a {@link CompileException} of a
   * given kind, and returns the exception. */
  public static CompileException assertThrowsKind(CompileException.Kind kind,
      Executable executable) {
    final CompileException e =
        assertThrows(CompileException.class, executable);
    assertThat(e, hasKind(kind));
    return e;
  }

  /** Describes each equation, prefixed by its identifier if it has one, e.g.
   * "cap[1]: x1 &lt;= 10". */
  public static List<String> describe(List<LinearEquation> equations) {
    final List<String> list = new ArrayList<>();
    for (LinearEquation equation : equations) {
      final String id = equation.fullIdentifier();
      list.add(id == null ? equation.toString() : id + ": " + equation);
    }
    return list;
  }
}

// End Matchers.java
