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
package net.hydromatic.opl.eval;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.opl.compile.CompileException.Kind.DIMENSION_MISMATCH;

import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Enumerates the cartesian product of a list of iterators.
 *
 * <p>Iterators are bound outer to inner in declaration order, and each
 * domain's elements in the domain's own order. An iterator's filter is
 * tested as soon as its variable is bound; the global filter is tested when
 * all variables are bound. For each combination that passes, the callback
 * is called with the environment.
 *
 * <p>This one routine expands {@code forall} statements, {@code sum}
 * expressions and set comprehensions; only the callback differs.
 *
 * <p>Every binding is removed when its iteration ends, whether it succeeds,
 * is filtered out, or fails. A {@link CompileException} that passes through
 * is annotated with the bindings that were active. */
public class Expander {
  private final Evaluator evaluator;
  private final int maxDepth;

  Expander(Evaluator evaluator, int maxDepth) {
    this.evaluator = requireNonNull(evaluator);
    this.maxDepth = maxDepth;
  }

  /** Enumerates combinations of iterator values.
   *
   * @param iterators Iterators, each with a variable
   * @param filter Condition on all variables, or null
   * @param env Environment; on return, it has the same bindings as on entry
   * @param callback Called once per combination that passes all filters
   */
  public void expand(List<Ast.Iterator> iterators, Ast.@Nullable Exp filter,
      EvalEnv env, Consumer<EvalEnv> callback) {
    if (env.depth() + iterators.size() > maxDepth) {
      throw new CompileException(DIMENSION_MISMATCH,
          "too many nested iterators: more than " + maxDepth,
          iterators.isEmpty() ? Pos.ZERO
              : iterators.get(0).pos);
    }
    expand(iterators, 0, filter, env, callback);
  }

  private void expand(List<Ast.Iterator> iterators, int i,
      Ast.@Nullable Exp filter, EvalEnv env, Consumer<EvalEnv> callback) {
    if (i == iterators.size()) {
      if (filter == null || evaluator.isTrue(filter, env)) {
        callback.accept(env);
      }
      return;
    }
    final Ast.Iterator iterator = iterators.get(i);
    final String var = requireNonNull(iterator.var, "var");
    for (Object element : evaluator.resolve(iterator.domain, env)) {
      try (EvalEnv.Frame ignored = env.push(var, element)) {
        try {
          if (iterator.filter != null
              && !evaluator.isTrue(iterator.filter, env)) {
            continue;
          }
          expand(iterators, i + 1, filter, env, callback);
        } catch (CompileException e) {
          throw e.withBindings(env.describe());
        }
      }
    }
  }
}

// End Expander.java
