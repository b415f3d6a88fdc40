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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.opl.compile.CompileException.Kind.DOMAIN_NOT_FOUND;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import net.hydromatic.opl.model.BoundRange;
import net.hydromatic.opl.model.Domain;
import net.hydromatic.opl.model.IndexSet;
import net.hydromatic.opl.model.PrimitiveSet;
import net.hydromatic.opl.model.Values;
import net.hydromatic.opl.parse.OplParseException;
import net.hydromatic.opl.parse.Statements;

/** Expands {@code sum} in the text of a statement, before it is parsed.
 *
 * <p>Each occurrence of {@code sum(v in D) term}, where {@code D} is an
 * index set, a range or a primitive set, is replaced by copies of
 * {@code term}, one per element of {@code D}, with {@code v} replaced by the
 * element, joined by {@code +}. If there is more than one copy, the result
 * is parenthesized, so that {@code 2*sum(i in I) x[i]} becomes
 * {@code 2*(x[1] + x[2])}. An empty domain gives {@code 0}.
 *
 * <p>Sums over tuple sets and computed sets, and sums with filters or
 * several iterators, are left alone; the parser handles them.
 *
 * <p>The term ends at a relational operator, {@code ;}, {@code ,},
 * {@code :}, {@code &&}, {@code ||}, or a closing bracket, at nesting
 * depth 0; and at a binary {@code +} or {@code -}. A sign is unary if it
 * starts the term or follows {@code *}, {@code /}, {@code (}, {@code [} or
 * {@code ,}. */
public class SumExpander {
  private static final Logger LOGGER =
      Logger.getLogger(SumExpander.class.getName());

  private static final Pattern SUM_PATTERN =
      Pattern.compile("\\bsum\\s*\\(\\s*([A-Za-z_]\\w*)\\s+in\\s+"
          + "([A-Za-z_]\\w*)\\s*\\)");

  /** A term that needs no parentheses: a number, or a name followed by
   * zero or more indexes. */
  private static final Pattern ATOM_PATTERN =
      Pattern.compile("[0-9.]+|[A-Za-z_]\\w*(\\[[^\\[\\]]*\\])*");

  private final Evaluator evaluator;
  private final int maxExpansions;

  public SumExpander(Evaluator evaluator, int maxExpansions) {
    this.evaluator = requireNonNull(evaluator);
    this.maxExpansions = maxExpansions;
  }

  /** Expands every expandable sum in a piece of text. */
  public String expand(String text) {
    String s = text;
    int from = 0;
    int expansions = 0;
    for (;;) {
      final Matcher matcher = SUM_PATTERN.matcher(s);
      if (!matcher.find(from)) {
        return s;
      }
      if (inString(s, matcher.start())) {
        from = matcher.end();
        continue;
      }
      final String var = matcher.group(1);
      final String setName = matcher.group(2);
      final Domain domain = evaluator.registry().domainOpt(setName);
      if (domain == null) {
        throw new CompileException(DOMAIN_NOT_FOUND,
            "domain '" + setName + "' not found",
            Pos.of(s, "", matcher.start(2), matcher.end(2)));
      }
      if (!(domain instanceof IndexSet
          || domain instanceof BoundRange
          || domain instanceof PrimitiveSet)) {
        from = matcher.end();
        continue;
      }
      if (++expansions > maxExpansions) {
        throw new OplParseException("more than " + maxExpansions
            + " sums to expand", Pos.of(s, "", matcher.start(), matcher.end()));
      }
      final int start = matcher.end();
      int end = findTermEnd(s, start);
      while (end > start && Character.isWhitespace(s.charAt(end - 1))) {
        --end;
      }
      final String term = s.substring(start, end).trim();
      if (term.isEmpty()) {
        throw new OplParseException("sum over '" + setName + "' has no term",
            Pos.of(s, "", matcher.start(), matcher.end()));
      }
      final List<String> terms = new ArrayList<>();
      for (Object element : evaluator.resolve(setName, new EvalEnv())) {
        terms.add(substitute(term, var, element));
      }
      final String expanded;
      if (terms.isEmpty()) {
        expanded = "0";
      } else if (terms.size() == 1
          && ATOM_PATTERN.matcher(terms.get(0)).matches()) {
        expanded = terms.get(0);
      } else {
        expanded = "(" + String.join(" + ", terms) + ")";
      }
      if (LOGGER.isLoggable(Level.FINER)) {
        LOGGER.finer("sum(" + var + " in " + setName + ") " + term
            + " expands to " + expanded);
      }
      s = s.substring(0, matcher.start()) + expanded + s.substring(end);
      from = matcher.start();
    }
  }

  /** Returns the offset just after the term that starts at {@code start}. */
  static int findTermEnd(String s, int start) {
    int depth = 0;
    boolean empty = true;
    char prev = 0;
    for (int i = start; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '"') {
        i = Statements.skipString(s, i);
        empty = false;
        prev = c;
        continue;
      }
      switch (c) {
      case '(':
      case '[':
        ++depth;
        break;
      case ')':
      case ']':
        if (depth == 0) {
          return i;
        }
        --depth;
        break;
      default:
        if (depth == 0) {
          if (";,:<>=≤≥&|".indexOf(c) >= 0) {
            return i;
          }
          if (c == '!' && i + 1 < s.length() && s.charAt(i + 1) == '=') {
            return i;
          }
          if ((c == '+' || c == '-')
              && !empty
              && "*/([,".indexOf(prev) < 0
              && !isExponent(s, i)) {
            return i;
          }
        }
      }
      if (!Character.isWhitespace(c)) {
        empty = false;
        prev = c;
      }
    }
    return s.length();
  }

  /** Returns whether the sign at {@code i} belongs to a number's exponent,
   * as in "1e-5". */
  private static boolean isExponent(String s, int i) {
    if (i < 2) {
      return false;
    }
    final char e = s.charAt(i - 1);
    if (e != 'e' && e != 'E' || !Character.isDigit(s.charAt(i - 2))) {
      return false;
    }
    int j = i - 2;
    while (j >= 0
        && (Character.isDigit(s.charAt(j)) || s.charAt(j) == '.')) {
      --j;
    }
    return j < 0 || !Character.isLetter(s.charAt(j)) && s.charAt(j) != '_';
  }

  private static boolean inString(String s, int offset) {
    boolean in = false;
    for (int i = 0; i < offset; i++) {
      final char c = s.charAt(i);
      if (in && c == '\\') {
        ++i;
      } else if (c == '"') {
        in = !in;
      }
    }
    return in;
  }

  /** Replaces each occurrence of an identifier in a term with a value.
   * Field names (after a '.') and string contents are not replaced. */
  static String substitute(String term, String var, Object value) {
    final String text = literal(value);
    final StringBuilder b = new StringBuilder();
    int i = 0;
    while (i < term.length()) {
      final char c = term.charAt(i);
      if (c == '"') {
        final int j = Statements.skipString(term, i);
        b.append(term, i, j + 1);
        i = j + 1;
      } else if (Character.isLetter(c) || c == '_') {
        int j = i + 1;
        while (j < term.length()
            && (Character.isLetterOrDigit(term.charAt(j))
                || term.charAt(j) == '_')) {
          ++j;
        }
        final String word = term.substring(i, j);
        if (word.equals(var) && !afterDot(term, i)) {
          b.append(text);
        } else {
          b.append(word);
        }
        i = j;
      } else if (Character.isDigit(c)) {
        final int j = numberEnd(term, i);
        b.append(term, i, j);
        i = j;
      } else {
        b.append(c);
        ++i;
      }
    }
    return b.toString();
  }

  /** Returns the offset after a number literal such as "12", "1.5" or
   * "2e-3". In "1..n", the number is "1". */
  private static int numberEnd(String s, int i) {
    int j = i;
    while (j < s.length() && Character.isDigit(s.charAt(j))) {
      ++j;
    }
    if (j + 1 < s.length() && s.charAt(j) == '.'
        && Character.isDigit(s.charAt(j + 1))) {
      ++j;
      while (j < s.length() && Character.isDigit(s.charAt(j))) {
        ++j;
      }
    }
    if (j < s.length() && (s.charAt(j) == 'e' || s.charAt(j) == 'E')) {
      int k = j + 1;
      if (k < s.length() && (s.charAt(k) == '+' || s.charAt(k) == '-')) {
        ++k;
      }
      if (k < s.length() && Character.isDigit(s.charAt(k))) {
        j = k;
        while (j < s.length() && Character.isDigit(s.charAt(j))) {
          ++j;
        }
      }
    }
    return j;
  }

  private static boolean afterDot(String s, int i) {
    int j = i - 1;
    while (j >= 0 && Character.isWhitespace(s.charAt(j))) {
      --j;
    }
    return j >= 0 && s.charAt(j) == '.' && (j == 0 || s.charAt(j - 1) != '.');
  }

  /** Formats a value as source text. */
  private static String literal(Object value) {
    if (value instanceof String) {
      return "\"" + ((String) value).replace("\\", "\\\\")
          .replace("\"", "\\\"") + "\"";
    }
    final String key = Values.keyOf(value);
    return key.startsWith("-") ? "(" + key + ")" : key;
  }
}

// End SumExpander.java
