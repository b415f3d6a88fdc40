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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Splits the text of a model into statements.
 *
 * <p>Comments ({@code //} to end of line, and {@code /* ... *}{@code /})
 * are removed. Statements end with ';' at nesting depth 0. A statement
 * that starts with {@code tuple}, {@code forall}, {@code subject} or
 * {@code constraints} also ends at the '}' that closes its block, so the
 * ';' after a block is optional. The terminating ';' is not part of the
 * statement; empty statements are dropped. */
public abstract class Statements {
  private Statements() {}

  /** Splits model text into statements. */
  public static List<String> split(String text) {
    final String s = stripComments(text);
    final ImmutableList.Builder<String> statements = ImmutableList.builder();
    final StringBuilder b = new StringBuilder();
    int depth = 0;
    boolean sawBlock = false;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '"') {
        final int end = skipString(s, i);
        b.append(s, i, end + 1);
        i = end;
        continue;
      }
      switch (c) {
      case ';':
        if (depth == 0) {
          add(statements, b);
          sawBlock = false;
          continue;
        }
        break;
      case '(':
      case '[':
        ++depth;
        break;
      case '{':
        ++depth;
        sawBlock = true;
        break;
      case ')':
      case ']':
        --depth;
        break;
      case '}':
        --depth;
        if (depth == 0 && sawBlock && endsAtBrace(b)) {
          b.append(c);
          add(statements, b);
          sawBlock = false;
          continue;
        }
        break;
      default:
        break;
      }
      b.append(c);
    }
    add(statements, b);
    return statements.build();
  }

  /** Returns the offset of the quote that closes the string literal that
   * starts at offset {@code i}, or the last offset if it is not closed. */
  public static int skipString(String s, int i) {
    for (int j = i + 1; j < s.length(); j++) {
      final char c = s.charAt(j);
      if (c == '\\') {
        ++j;
      } else if (c == '"') {
        return j;
      }
    }
    return s.length() - 1;
  }

  private static boolean endsAtBrace(CharSequence statement) {
    final String s = statement.toString().trim();
    return startsWithWord(s, "tuple")
        || startsWithWord(s, "forall")
        || startsWithWord(s, "subject")
        || startsWithWord(s, "constraints");
  }

  private static boolean startsWithWord(String s, String word) {
    return s.startsWith(word)
        && (s.length() == word.length()
            || !Character.isLetterOrDigit(s.charAt(word.length())));
  }

  private static void add(ImmutableList.Builder<String> statements,
      StringBuilder b) {
    final String statement = b.toString().trim();
    if (!statement.isEmpty()) {
      statements.add(statement);
    }
    b.setLength(0);
  }

  /** Removes comments; a block comment becomes a space. Comment markers
   * inside string literals are not comments. */
  static String stripComments(String text) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '"') {
        final int end = skipString(text, i);
        b.append(text, i, end + 1);
        i = end;
      } else if (text.startsWith("//", i)) {
        final int end = text.indexOf('\n', i);
        if (end < 0) {
          break;
        }
        i = end - 1;
      } else if (text.startsWith("/*", i)) {
        final int end = text.indexOf("*/", i + 2);
        b.append(' ');
        if (end < 0) {
          break;
        }
        i = end + 1;
      } else {
        b.append(c);
      }
    }
    return b.toString();
  }
}

// End Statements.java
