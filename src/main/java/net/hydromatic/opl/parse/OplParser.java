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

import java.util.List;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.model.ModelRegistry;

/** Parser of the model language.
 *
 * <p>The implementation, {@code OplParserImpl}, is generated by JavaCC from
 * {@code OplParser.jj}. */
public interface OplParser {
  /** Sets the name of the file being parsed, and the registry that is used
   * to tell decision variables and decision expressions from parameters. */
  void zero(String file, ModelRegistry registry);

  /** Returns the position of the last token consumed. */
  Pos pos();

  /** Parses an expression followed by end of input. */
  Ast.Exp expressionEof() throws ParseException;

  /** Parses a statement, without its terminating ';', followed by end of
   * input. Most statements produce one declaration; a {@code subject to}
   * block produces one per constraint. */
  List<Ast.Decl> statementEof() throws ParseException;
}

// End OplParser.java
