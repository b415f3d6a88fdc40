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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.opl.ast.AstWriter;
import net.hydromatic.opl.parse.Statements;

/** Distributes a numeric coefficient over a parenthesized sum, in the text
 * of a statement.
 *
 * <p>For example, {@code 2*(x[1] + x[2] - y)} becomes
 * {@code (2*x[1] + 2*x[2] - 2*y)}. A coefficient of 1 is not written,
 * so that {@code 1*(a - b)} becomes {@code (a - b)}.
 *
 * <p>The rewrite is skipped where it would change the meaning: if the
 * coefficient follows {@code *} or {@code /}, if the parentheses are
 * followed by {@code *}, {@code /}, {@code .} or {@code [}, or if the
 * parentheses hold a single term or a comparison. */
public abstract class ParenthesesExpander {
  private static final Pattern COEFFICIENT_PATTERN =
      Pattern.compile("(?<![\\w.])(\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?)"
          + "\\s*\\*\\s*\\(");

  private ParenthesesExpander() {}

  /** Distributes all numeric coefficients over parenthesized sums. */
  public static String distribute(String text) {
    String s = text;
    int from = 0;
    for (;;) {
      final Matcher matcher = COEFFICIENT_PATTERN.matcher(s);
      if (!matcher.find(from)) {
        return s;
      }
      final int open = matcher.end() - 1;
      final int close = findClose(s, open);
      final String rewritten =
          close < 0 || !canDistribute(s, matcher.start(), close)
              ? null
              : rewrite(Double.parseDouble(matcher.group(1)),
                  s.substring(open + 1, close));
      if (rewritten == null) {
        from = matcher.end();
        continue;
      }
      s = s.substring(0, matcher.start()) + rewritten
          + s.substring(close + 1);
      from = matcher.start();
    }
  }

  private static boolean canDistribute(String s, int start, int close) {
    int i = start - 1;
    while (i >= 0 && Character.isWhitespace(s.charAt(i))) {
      --i;
    }
    if (i >= 0 && (s.charAt(i) == '*' || s.charAt(i) == '/')) {
      return false;
    }
    int j = close + 1;
    while (j < s.length() && Character.isWhitespace(s.charAt(j))) {
      ++j;
    }
    return j >= s.length() || "*/.[".indexOf(s.charAt(j)) < 0;
  }

  /** Returns the offset of the parenthesis that closes the one at
   * {@code open}, or -1. */
  private static int findClose(String s, int open) {
    int depth = 0;
    for (int i = open; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '"') {
        i = Statements.skipString(s, i);
      } else if (c == '(' || c == '[') {
        ++depth;
      } else if (c == ')' || c == ']') {
        if (--depth == 0) {
          return c == ')' ? i : -1;
        }
      }
    }
    return -1;
  }

  /** Multiplies each term of {@code inner} by {@code coefficient}; returns
   * null if {@code inner} is not a sum of two or more terms. */
  private static String rewrite(double coefficient, String inner) {
    final List<String> terms = new ArrayList<>();
    final List<Boolean> negated = new ArrayList<>();
    int start = 0;
    while (start < inner.length()) {
      int i = start;
      while (i < inner.length() && Character.isWhitespace(inner.charAt(i))) {
        ++i;
      }
      boolean negative = false;
      while (i < inner.length()
          && (inner.charAt(i) == '-' || inner.charAt(i) == '+'
              || Character.isWhitespace(inner.charAt(i)))) {
        if (inner.charAt(i) == '-') {
          negative = !negative;
        }
        ++i;
      }
      final int end = SumExpander.findTermEnd(inner, i);
      if (end < inner.length()
          && inner.charAt(end) != '+' && inner.charAt(end) != '-') {
        return null; // a comparison, or a separator
      }
      final String term = inner.substring(i, end).trim();
      if (term.isEmpty()) {
        return null;
      }
      terms.add(term);
      negated.add(negative);
      start = end;
    }
    if (terms.size() < 2) {
      return null;
    }
    final StringBuilder b = new StringBuilder("(");
    for (int k = 0; k < terms.size(); k++) {
      double c = negated.get(k) ? -coefficient : coefficient;
      if (k > 0) {
        b.append(c < 0 ? " - " : " + ");
        c = Math.abs(c);
      } else if (c < 0) {
        b.append('-');
        c = -c;
      }
      if (c != 1d) {
        b.append(AstWriter.formatNumber(c)).append('*');
      }
      b.append(terms.get(k));
    }
    return b.append(')').toString();
  }
}

// End ParenthesesExpander.java
