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
package net.hydromatic.opl.model;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Range of integers whose bounds are expressions, e.g.
 * "range T = 1..nT".
 *
 * <p>The bounds are evaluated when the range is first used, rounded to the
 * nearest integer, and cached until {@link #invalidate()} is called. */
public class BoundRange extends Domain {
  private static final Logger LOGGER =
      Logger.getLogger(BoundRange.class.getName());

  public final Ast.Exp startExp;
  public final Ast.Exp endExp;
  private int @Nullable [] bounds;

  public BoundRange(String name, Ast.Exp startExp, Ast.Exp endExp) {
    super(name);
    this.startExp = requireNonNull(startExp);
    this.endExp = requireNonNull(endExp);
  }

  @Override public List<Object> elements(Evaluator evaluator, EvalEnv env) {
    final int[] bounds = bounds(evaluator, env);
    return IndexSet.range(bounds[0], bounds[1]);
  }

  /** Returns the evaluated start and end. */
  public int[] bounds(Evaluator evaluator, EvalEnv env) {
    int[] bounds = this.bounds;
    if (bounds == null) {
      bounds = new int[] {
          Values.toInt(evaluator.evaluate(startExp, env), startExp.pos),
          Values.toInt(evaluator.evaluate(endExp, env), endExp.pos)
      };
      this.bounds = bounds;
    }
    return bounds;
  }

  /** Returns whether the bounds are currently cached. */
  public boolean isCached() {
    return bounds != null;
  }

  @Override public void invalidate() {
    if (bounds != null && LOGGER.isLoggable(Level.FINER)) {
      LOGGER.finer("invalidating range " + name);
    }
    bounds = null;
  }

  @Override public String describe() {
    return "range " + name + " = " + startExp + ".." + endExp;
  }
}

// End BoundRange.java
