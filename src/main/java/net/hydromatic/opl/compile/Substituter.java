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
import static net.hydromatic.opl.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Op;
import net.hydromatic.opl.ast.Shuttle;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import net.hydromatic.opl.model.TupleInstance;

/** Replaces iterator variables with their values, and flattens sums.
 *
 * <p>A reference to a name that is bound in the environment becomes a
 * literal. A {@code sum} becomes a chain of {@code +} calls, one per
 * element of its domain that passes its filter; a sum over an empty domain
 * becomes {@code 0}. A field of a tuple literal becomes the field's
 * value. */
public class Substituter extends Shuttle {
  private final Evaluator evaluator;
  private final EvalEnv env;

  private Substituter(Evaluator evaluator, EvalEnv env) {
    this.evaluator = requireNonNull(evaluator);
    this.env = requireNonNull(env);
  }

  /** Substitutes bound variables in an expression. */
  public static Ast.Exp substitute(Evaluator evaluator, EvalEnv env,
      Ast.Exp exp) {
    return exp.accept(new Substituter(evaluator, env));
  }

  @Override protected Ast.Exp visit(Ast.ParamRef paramRef) {
    final Object value = env.getOpt(paramRef.name);
    return value == null
        ? paramRef
        : ast.valueLiteral(paramRef.pos, value);
  }

  @Override protected Ast.Exp visit(Ast.FieldAccess fieldAccess) {
    final Ast.FieldAccess access = (Ast.FieldAccess) super.visit(fieldAccess);
    if (access.base.op == Op.VALUE_LITERAL
        && ((Ast.Literal) access.base).value instanceof TupleInstance) {
      final TupleInstance tuple =
          (TupleInstance) ((Ast.Literal) access.base).value;
      return ast.valueLiteral(access.pos, tuple.field(access.field));
    }
    return access;
  }

  @Override protected Ast.Exp visit(Ast.Sum sum) {
    final List<Ast.Exp> terms = new ArrayList<>();
    evaluator.expander().expand(ImmutableList.of(sum.iterator), null, env,
        e -> terms.add(sum.body.accept(this)));
    if (terms.isEmpty()) {
      return ast.numberLiteral(sum.pos, 0);
    }
    return ast.plusAll(terms);
  }
}

// End Substituter.java
