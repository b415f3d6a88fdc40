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

import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.model.LinearEquation;
import net.hydromatic.opl.model.Objective;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when a statement has been parsed, before it is compiled. */
  void onStatement(Ast.Decl decl);

  /** Called when a constraint has produced an equation. */
  void onEquation(LinearEquation equation);

  /** Called when the objective has been linearized. */
  void onObjective(Objective objective);

  /**
   * Called with an exception that is not a compile exception, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean onException(@Nullable Throwable e);

  /**
   * Called with the exception thrown during compilation, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
