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
import static net.hydromatic.opl.compile.CompileException.Kind.CYCLIC_DECISION_EXPRESSION;
import static net.hydromatic.opl.compile.CompileException.Kind.DIMENSION_MISMATCH;
import static net.hydromatic.opl.compile.CompileException.Kind.NON_LINEAR_TERM;
import static net.hydromatic.opl.compile.CompileException.Kind.UNBOUND_NAME;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import net.hydromatic.opl.model.DecisionExpression;
import net.hydromatic.opl.model.IndexedVariable;
import net.hydromatic.opl.model.ModelRegistry;
import net.hydromatic.opl.model.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts an expression into an affine form.
 *
 * <p>First, bound iterator variables are replaced by their values and sums
 * are flattened (see {@link Substituter}), and the result is simplified
 * (see {@link Simplifier}). Then the tree is walked with a
 * running factor, initially 1:
 *
 * <ul>
 *   <li>a variable adds the factor to its coefficient;
 *   <li>a sub-expression that does not depend on any variable is evaluated
 *       and added, times the factor, to the constant;
 *   <li>{@code a + b} walks both sides; {@code a - b} and {@code -a} negate
 *       the factor for the negated side;
 *   <li>in {@code a * b} one side must not depend on variables; its value
 *       multiplies the factor for the other side;
 *   <li>in {@code a / b} the divisor must not depend on variables;
 *   <li>a decision expression that depends on variables is inlined.
 * </ul>
 *
 * <p>Any other shape, such as the product of two variables, is a
 * {@link CompileException.Kind#NON_LINEAR_TERM} error. */
public class Linearizer {
  private final Evaluator evaluator;
  private final ModelRegistry registry;
  /** Decision expressions currently being inlined or checked. */
  private final Deque<String> active = new ArrayDeque<>();

  public Linearizer(Evaluator evaluator) {
    this.evaluator = requireNonNull(evaluator);
    this.registry = evaluator.registry();
  }

  /** Linearizes an expression in an empty environment. */
  public Linear linearize(Ast.Exp exp) {
    return linearize(exp, new EvalEnv());
  }

  /** Linearizes an expression in a given environment. */
  public Linear linearize(Ast.Exp exp, EvalEnv env) {
    final Linear.Builder builder = Linear.builder();
    final Ast.Exp substituted = Substituter.substitute(evaluator, env, exp);
    extract(Simplifier.simplify(substituted), 1d, env, builder);
    return builder.build();
  }

  private void extract(Ast.Exp exp, double factor, EvalEnv env,
      Linear.Builder builder) {
    if (!dependsOnVariables(exp, env)) {
      builder.addConstant(factor * evaluator.evaluate(exp, env));
      return;
    }
    switch (exp.op) {
    case VAR:
      builder.add(variable((Ast.VarRef) exp), factor);
      return;

    case INDEXED_VAR:
      builder.add(variable((Ast.IndexedVarRef) exp, env), factor);
      return;

    case ID:
      final Ast.ParamRef ref = (Ast.ParamRef) exp;
      if (registry.isDexpr(ref.name)) {
        inline(ref.name, null, ref.pos, factor, env, builder);
      } else {
        builder.add(variable(ref.name, 0, ref.pos), factor);
      }
      return;

    case DEXPR:
      final Ast.DexprRef dexprRef = (Ast.DexprRef) exp;
      final @Nullable Object indexValue = dexprRef.index == null
          ? null
          : evaluator.evaluateValue(dexprRef.index, env);
      inline(dexprRef.name, indexValue, exp.pos, factor, env, builder);
      return;

    case PLUS:
      final Ast.InfixCall plus = (Ast.InfixCall) exp;
      extract(plus.a0, factor, env, builder);
      extract(plus.a1, factor, env, builder);
      return;

    case MINUS:
      final Ast.InfixCall minus = (Ast.InfixCall) exp;
      extract(minus.a0, factor, env, builder);
      extract(minus.a1, -factor, env, builder);
      return;

    case NEGATE:
      extract(((Ast.PrefixCall) exp).a, -factor, env, builder);
      return;

    case TIMES:
      final Ast.InfixCall times = (Ast.InfixCall) exp;
      if (!dependsOnVariables(times.a0, env)) {
        extract(times.a1, factor * evaluator.evaluate(times.a0, env), env,
            builder);
      } else if (!dependsOnVariables(times.a1, env)) {
        extract(times.a0, factor * evaluator.evaluate(times.a1, env), env,
            builder);
      } else {
        throw nonLinear(exp, "product of two terms that contain variables");
      }
      return;

    case DIVIDE:
      final Ast.InfixCall divide = (Ast.InfixCall) exp;
      if (dependsOnVariables(divide.a1, env)) {
        throw nonLinear(exp, "divisor contains a variable");
      }
      extract(divide.a0, factor / evaluator.evaluate(divide.a1, env), env,
          builder);
      return;

    case SUM:
      throw new AssertionError("sum must be flattened before linearization: "
          + exp);

    default:
      throw nonLinear(exp, "operator " + exp.op + " applied to a variable");
    }
  }

  private static CompileException nonLinear(Ast.Exp exp, String reason) {
    return new CompileException(NON_LINEAR_TERM,
        "term " + exp + " is not linear: " + reason, exp.pos);
  }

  private String variable(Ast.VarRef ref) {
    return variable(ref.name, 0, ref.pos);
  }

  private String variable(Ast.IndexedVarRef ref, EvalEnv env) {
    variable(ref.name, ref.indexes.size(), ref.pos);
    return Values.variableName(ref.name,
        evaluator.evaluateAll(ref.indexes, env));
  }

  /** Checks that a variable is declared with a given number of indexes. */
  private String variable(String name, int arity, Pos pos) {
    final IndexedVariable variable = registry.variableOpt(name);
    if (variable == null) {
      throw new CompileException(UNBOUND_NAME,
          "decision variable '" + name + "' is not declared", pos);
    }
    if (variable.arity() != arity) {
      throw new CompileException(DIMENSION_MISMATCH,
          "variable '" + name + "' has " + variable.arity()
              + " dimensions, but " + arity + " indexes were given", pos);
    }
    return name;
  }

  /** Linearizes the body of a decision expression in place of a reference
   * to it. */
  private void inline(String name, @Nullable Object indexValue, Pos pos,
      double factor, EvalEnv env, Linear.Builder builder) {
    final DecisionExpression dexpr = evaluator.dexpr(name, pos);
    enter(name, pos);
    try {
      evaluator.withDexprIndex(dexpr, indexValue, pos, env, () -> {
        final Ast.Exp body =
            Simplifier.simplify(
                Substituter.substitute(evaluator, env, dexpr.exp));
        extract(body, factor, env, builder);
        return body;
      });
    } finally {
      active.pop();
    }
  }

  private void enter(String name, Pos pos) {
    if (active.contains(name)) {
      final List<String> path = new ArrayList<>(active);
      Collections.reverse(path);
      path.add(name);
      throw new CompileException(CYCLIC_DECISION_EXPRESSION,
          "decision expression '" + name + "' refers to itself: "
              + String.join(" -> ", path), pos);
    }
    active.push(name);
  }

  /** Returns whether an expression refers, directly or through decision
   * expressions, to a decision variable. */
  boolean dependsOnVariables(Ast.Exp exp, EvalEnv env) {
    switch (exp.op) {
    case VAR:
    case INDEXED_VAR:
      return true;

    case ID:
      final Ast.ParamRef ref = (Ast.ParamRef) exp;
      if (env.getOpt(ref.name) != null) {
        return false;
      }
      if (registry.isVariable(ref.name)) {
        return true;
      }
      return registry.isDexpr(ref.name)
          && dexprDependsOnVariables(ref.name, ref.pos, env);

    case DEXPR:
      final Ast.DexprRef dexprRef = (Ast.DexprRef) exp;
      return dexprRef.index != null
          && dependsOnVariables(dexprRef.index, env)
          || dexprDependsOnVariables(dexprRef.name, exp.pos, env);

    case SUM:
      final Ast.Sum sum = (Ast.Sum) exp;
      return sum.iterator.filter != null
          && dependsOnVariables(sum.iterator.filter, env)
          || dependsOnVariables(sum.body, env);

    default:
      for (Ast.Exp arg : exp.args()) {
        if (dependsOnVariables(arg, env)) {
          return true;
        }
      }
      return false;
    }
  }

  private boolean dexprDependsOnVariables(String name, Pos pos, EvalEnv env) {
    final DecisionExpression dexpr = evaluator.dexpr(name, pos);
    enter(name, pos);
    try {
      return dependsOnVariables(dexpr.exp, env);
    } finally {
      active.pop();
    }
  }
}

// End Linearizer.java
