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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.StringReader;
import java.util.List;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.model.ModelRegistry;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Parses an expression. */
  public static Ast.Exp parseExp(ModelRegistry registry, String text) {
    final OplParserImpl parser = create(registry, text);
    try {
      return parser.expressionEof();
    } catch (ParseException e) {
      throw toException(parser, e);
    } catch (TokenMgrError e) {
      throw new OplParseException(e, parser.pos());
    }
  }

  /** Parses a statement, without its terminating ';', into declarations. */
  public static List<Ast.Decl> parseStatement(ModelRegistry registry,
      String text) {
    final OplParserImpl parser = create(registry, text);
    try {
      return parser.statementEof();
    } catch (ParseException e) {
      throw toException(parser, e);
    } catch (TokenMgrError e) {
      throw new OplParseException(e, parser.pos());
    }
  }

  private static OplParserImpl create(ModelRegistry registry, String text) {
    final OplParserImpl parser = new OplParserImpl(new StringReader(text));
    parser.zero("", registry);
    return parser;
  }

  /** Converts an exception from the generated parser, positioning it at the
   * token that could not be parsed. */
  private static OplParseException toException(OplParserImpl parser,
      ParseException e) {
    final Token token = e.currentToken;
    final Pos pos = token != null && token.next != null
        ? parser.pos(token.next)
        : parser.pos();
    return new OplParseException(e, pos);
  }

  /**
   * Given quoted string {@code "abc"} returns {@code abc}. The escapes
   * {@code \n} and {@code \t} become newline and tab; any other escaped
   * character stands for itself, so {@code \"} becomes {@code "}.
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length()) {
        c = s.charAt(++i);
        switch (c) {
        case 'n':
          b.append('\n');
          break;
        case 't':
          b.append('\t');
          break;
        default:
          b.append(c);
        }
      } else {
        b.append(c);
      }
    }
    return b.toString();
  }
}

// End Parsers.java
