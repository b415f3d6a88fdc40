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
import static net.hydromatic.opl.ast.AstBuilder.ast;
import static net.hydromatic.opl.compile.CompileException.Kind.CYCLIC_DECISION_EXPRESSION;
import static net.hydromatic.opl.compile.CompileException.Kind.DIMENSION_MISMATCH;
import static net.hydromatic.opl.compile.CompileException.Kind.DOMAIN_NOT_FOUND;
import static net.hydromatic.opl.compile.CompileException.Kind.KEY_LOOKUP_FAILED;
import static net.hydromatic.opl.compile.CompileException.Kind.TYPE_COERCION_FAILED;
import static net.hydromatic.opl.compile.CompileException.Kind.UNBOUND_NAME;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Op;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.model.AbstractParameter;
import net.hydromatic.opl.model.ComputedSet;
import net.hydromatic.opl.model.DecisionExpression;
import net.hydromatic.opl.model.Domain;
import net.hydromatic.opl.model.IndexSet;
import net.hydromatic.opl.model.ModelRegistry;
import net.hydromatic.opl.model.TupleInstance;
import net.hydromatic.opl.model.TupleSet;
import net.hydromatic.opl.model.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Evaluates expressions against a registry and a binding environment.
 *
 * <p>{@link #evaluate} returns a number; {@link #evaluateValue} returns a
 * number, a string or a tuple. Comparisons and logical operators return 1
 * for true and 0 for false.
 *
 * <p>Division follows floating-point semantics; dividing by zero gives an
 * infinity or NaN, which is returned to the caller. */
public class Evaluator {
  private final ModelRegistry registry;
  private final int maxIteratorDepth;
  /** Decision expressions currently being evaluated, to detect cycles. */
  private final Deque<String> activeDexprs = new ArrayDeque<>();

  public Evaluator(ModelRegistry registry, int maxIteratorDepth) {
    this.registry = requireNonNull(registry);
    this.maxIteratorDepth = maxIteratorDepth;
  }

  public Evaluator(ModelRegistry registry) {
    this(registry, Prop.MAX_ITERATOR_DEPTH.intValue(ImmutableMap.of()));
  }

  public ModelRegistry registry() {
    return registry;
  }

  /** Creates an expander that enumerates iterators using this evaluator. */
  public Expander expander() {
    return new Expander(this, maxIteratorDepth);
  }

  /** Evaluates an expression to a number. */
  public double evaluate(Ast.Exp exp, EvalEnv env) {
    final Object value = evaluateValue(exp, env);
    try {
      return Values.toDouble(value);
    } catch (CompileException e) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "expression " + exp + " is not numeric: " + Values.describe(value),
          exp.pos);
    }
  }

  /** Evaluates a condition; true if the value is within tolerance of 1. */
  public boolean isTrue(Ast.Exp exp, EvalEnv env) {
    return Values.isTrue(evaluate(exp, env));
  }

  /** Evaluates an expression to a value. */
  public Object evaluateValue(Ast.Exp exp, EvalEnv env) {
    switch (exp.op) {
    case NUMBER_LITERAL:
    case STRING_LITERAL:
    case VALUE_LITERAL:
      return ((Ast.Literal) exp).value;

    case ID:
      return lookup((Ast.ParamRef) exp, env);

    case INDEXED_PARAM:
      final Ast.IndexedParamRef indexedParamRef = (Ast.IndexedParamRef) exp;
      final AbstractParameter indexed =
          parameter(indexedParamRef.name, exp.pos);
      final List<Object> indexes = evaluateAll(indexedParamRef.indexes, env);
      try {
        return indexed.get(indexes);
      } catch (CompileException e) {
        throw e.withPos(exp.pos);
      }

    case VAR:
    case INDEXED_VAR:
      throw new CompileException(UNBOUND_NAME,
          "decision variable in " + exp + " has no value until solved",
          exp.pos);

    case DEXPR:
      final Ast.DexprRef dexprRef = (Ast.DexprRef) exp;
      return evaluateDexpr(dexprRef, env);

    case ITEM:
      final Ast.Item item = (Ast.Item) exp;
      return item(item.setName, evaluateAll(item.keys, env), exp.pos);

    case DOT:
      final Ast.FieldAccess fieldAccess = (Ast.FieldAccess) exp;
      final Object base = evaluateValue(fieldAccess.base, env);
      if (!(base instanceof TupleInstance)) {
        throw new CompileException(TYPE_COERCION_FAILED,
            "cannot access field '" + fieldAccess.field + "' of "
                + Values.describe(base), exp.pos);
      }
      return ((TupleInstance) base).field(fieldAccess.field);

    case TUPLE:
      return evaluateAll(((Ast.Tuple) exp).args, env);

    case ARRAY:
      throw new CompileException(TYPE_COERCION_FAILED,
          "array " + exp + " is not a value", exp.pos);

    case SUM:
      return sum((Ast.Sum) exp, env);

    case PLUS:
    case MINUS:
    case TIMES:
    case DIVIDE:
      final Ast.InfixCall call = (Ast.InfixCall) exp;
      final double a0 = evaluate(call.a0, env);
      final double a1 = evaluate(call.a1, env);
      switch (exp.op) {
      case PLUS:
        return a0 + a1;
      case MINUS:
        return a0 - a1;
      case TIMES:
        return a0 * a1;
      default:
        return a0 / a1;
      }

    case NEGATE:
      return -evaluate(((Ast.PrefixCall) exp).a, env);

    case NOT:
      return Values.of(!isTrue(((Ast.PrefixCall) exp).a, env));

    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      final Ast.InfixCall comparison = (Ast.InfixCall) exp;
      return Values.of(
          compare(exp.op, evaluateValue(comparison.a0, env),
              evaluateValue(comparison.a1, env)));

    case ANDALSO:
      final Ast.InfixCall and = (Ast.InfixCall) exp;
      return Values.of(isTrue(and.a0, env) && isTrue(and.a1, env));

    case ORELSE:
      final Ast.InfixCall or = (Ast.InfixCall) exp;
      return Values.of(isTrue(or.a0, env) || isTrue(or.a1, env));

    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  /** Evaluates a list of expressions to values. */
  public List<Object> evaluateAll(List<Ast.Exp> exps, EvalEnv env) {
    final ImmutableList.Builder<Object> values = ImmutableList.builder();
    for (Ast.Exp exp : exps) {
      values.add(evaluateValue(exp, env));
    }
    return values.build();
  }

  private static boolean compare(Op op, Object v0,
      Object v1) {
    switch (op) {
    case EQ:
      return Values.equal(v0, v1);
    case NE:
      return !Values.equal(v0, v1);
    case LT:
      return Values.compare(v0, v1) < 0;
    case LE:
      return Values.compare(v0, v1) <= 0;
    case GT:
      return Values.compare(v0, v1) > 0;
    case GE:
      return Values.compare(v0, v1) >= 0;
    default:
      throw new AssertionError(op);
    }
  }

  /** Looks up a name: an iterator variable bound in the environment, then a
   * scalar parameter, then a scalar decision expression. */
  private Object lookup(Ast.ParamRef ref, EvalEnv env) {
    final Object value = env.getOpt(ref.name);
    if (value != null) {
      return value;
    }
    final AbstractParameter parameter = registry.parameterOpt(ref.name);
    if (parameter != null) {
      try {
        return parameter.scalarValue();
      } catch (CompileException e) {
        throw e.withPos(ref.pos);
      }
    }
    if (registry.isDexpr(ref.name)) {
      return evaluateDexpr(ast.dexprRef(ref.pos, ref.name, null), env);
    }
    if (registry.isVariable(ref.name)) {
      throw new CompileException(UNBOUND_NAME,
          "decision variable '" + ref.name + "' has no value until solved",
          ref.pos);
    }
    throw new CompileException(UNBOUND_NAME,
        "name '" + ref.name + "' is not bound", ref.pos);
  }

  private AbstractParameter parameter(String name, Pos pos) {
    final AbstractParameter parameter = registry.parameterOpt(name);
    if (parameter == null) {
      throw new CompileException(UNBOUND_NAME,
          "parameter '" + name + "' is not declared", pos);
    }
    return parameter;
  }

  /** Evaluates a reference to a decision expression. The expression must
   * not depend on decision variables. */
  private Object evaluateDexpr(Ast.DexprRef ref, EvalEnv env) {
    final DecisionExpression dexpr = dexpr(ref.name, ref.pos);
    final @Nullable Object indexValue =
        ref.index == null ? null : evaluateValue(ref.index, env);
    enterDexpr(dexpr.name, ref.pos);
    try {
      return withDexprIndex(dexpr, indexValue, ref.pos, env,
          () -> evaluateValue(dexpr.exp, env));
    } finally {
      activeDexprs.pop();
    }
  }

  /** Returns a declared decision expression, or throws. */
  public DecisionExpression dexpr(String name, Pos pos) {
    final DecisionExpression dexpr = registry.dexprOpt(name);
    if (dexpr == null) {
      throw new CompileException(UNBOUND_NAME,
          "decision expression '" + name + "' is not declared", pos);
    }
    return dexpr;
  }

  private void enterDexpr(String name, Pos pos) {
    if (activeDexprs.contains(name)) {
      final List<String> path = new ArrayList<>(activeDexprs);
      Collections.reverse(path);
      path.add(name);
      throw new CompileException(CYCLIC_DECISION_EXPRESSION,
          "decision expression '" + name + "' refers to itself: "
              + String.join(" -> ", path), pos);
    }
    activeDexprs.push(name);
  }

  /** Runs an action with a decision expression's index variable bound to a
   * value. Fails if the reference's arity does not match the
   * declaration. */
  public <T> T withDexprIndex(DecisionExpression dexpr,
      @Nullable Object indexValue, Pos pos, EvalEnv env,
      Supplier<T> action) {
    if (dexpr.index == null) {
      if (indexValue != null) {
        throw new CompileException(DIMENSION_MISMATCH,
            "decision expression '" + dexpr.name + "' is not indexed", pos);
      }
      return action.get();
    }
    if (indexValue == null) {
      throw new CompileException(DIMENSION_MISMATCH,
          "decision expression '" + dexpr.name + "' requires an index", pos);
    }
    try (EvalEnv.Frame ignored =
             env.push(requireNonNull(dexpr.index.var), indexValue)) {
      return action.get();
    }
  }

  /** Finds the tuple in a tuple set whose key fields equal the given
   * values. If several match, returns the first in set order. */
  public TupleInstance item(String setName, List<Object> keys, Pos pos) {
    final TupleSet tupleSet = registry.tupleSetOpt(setName);
    if (tupleSet == null) {
      throw new CompileException(DOMAIN_NOT_FOUND,
          "tuple set '" + setName + "' not found", pos);
    }
    final int keyCount = tupleSet.schema.keyFields.size();
    if (keys.size() != keyCount) {
      throw new CompileException(DIMENSION_MISMATCH,
          "tuple '" + tupleSet.schema.name + "' has " + keyCount
              + " key fields, but " + keys.size() + " keys were given", pos);
    }
    final TupleInstance tuple = tupleSet.findByKey(keys);
    if (tuple == null) {
      throw new CompileException(KEY_LOOKUP_FAILED,
          "no tuple in '" + setName + "' has key <"
              + Values.joinKey(keys).replace('_', ',') + ">", pos);
    }
    return tuple;
  }

  private double sum(Ast.Sum sum, EvalEnv env) {
    final double[] total = {0d};
    expander().expand(ImmutableList.of(sum.iterator), null, env, e ->
        total[0] += evaluate(sum.body, e));
    return total[0];
  }

  /** Returns the elements of a named domain. */
  public List<Object> resolve(String name, EvalEnv env) {
    return registry.resolve(name, this, env);
  }

  /** Returns the elements of the domain of an iterator: a named domain, a
   * member of an indexed family of sets, or an inline range. */
  public List<Object> resolve(Ast.DomainRef ref, EvalEnv env) {
    if (ref instanceof Ast.RangeDomain) {
      final Ast.RangeDomain range = (Ast.RangeDomain) ref;
      final int lo = Values.toInt(evaluate(range.lo, env), range.lo.pos);
      final int hi = Values.toInt(evaluate(range.hi, env), range.hi.pos);
      return IndexSet.range(lo, hi);
    }
    final Ast.NamedDomain named = (Ast.NamedDomain) ref;
    if (named.index == null) {
      try {
        return resolve(named.name, env);
      } catch (CompileException e) {
        throw e.withPos(ref.pos);
      }
    }
    final Domain domain = registry.domain(named.name);
    if (!(domain instanceof ComputedSet)
        || !((ComputedSet) domain).isIndexed()) {
      throw new CompileException(DIMENSION_MISMATCH,
          "domain '" + named.name + "' is not an indexed set", ref.pos);
    }
    return ((ComputedSet) domain)
        .elementsAt(evaluateValue(named.index, env), this, env);
  }
}

// End Evaluator.java
