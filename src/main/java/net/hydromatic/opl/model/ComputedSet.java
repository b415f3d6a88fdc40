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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.opl.compile.CompileException.Kind.MISSING_OUTER_INDEX;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Set defined by a comprehension.
 *
 * <p>A filter comprehension emits bound elements,
 * "{j | j in Arcs: j.cost &gt; 0}"; a projection emits a field,
 * "{a.id | a in Arcs}". Several iterators form a cartesian product.
 *
 * <p>If {@link #outer} is not null, this is a family of sets, one per element
 * of the outer domain, e.g. "{Arc} out[i in Nodes] = {a | a in Arcs:
 * a.from == i}". Each member is computed on first use and memoized by the
 * outer value. */
public class ComputedSet extends Domain {
  public final String elementType;
  public final Ast.@Nullable Iterator outer;
  public final Ast.Exp output;
  public final List<Ast.Iterator> iterators;
  public final Ast.@Nullable Exp filter;
  private final Map<String, List<Object>> cache = new HashMap<>();

  public ComputedSet(String name, String elementType,
      Ast.@Nullable Iterator outer, Ast.Exp output,
      List<Ast.Iterator> iterators, Ast.@Nullable Exp filter) {
    super(name);
    this.elementType = requireNonNull(elementType);
    this.outer = outer;
    this.output = requireNonNull(output);
    this.iterators = ImmutableList.copyOf(iterators);
    this.filter = filter;
    checkArgument(outer == null || outer.var != null,
        "outer index of %s must have a variable", name);
  }

  /** Returns whether this is a family of sets. */
  public boolean isIndexed() {
    return outer != null;
  }

  /** {@inheritDoc}
   *
   * <p>For a family of sets, the outer variable must be bound in
   * {@code env}. */
  @Override public List<Object> elements(Evaluator evaluator, EvalEnv env) {
    if (outer == null) {
      return compute("", null, evaluator, env);
    }
    final String var = requireNonNull(outer.var);
    final Object outerValue = env.getOpt(var);
    if (outerValue == null) {
      throw new CompileException(MISSING_OUTER_INDEX,
          "set '" + name + "' is indexed by '" + var + "', which is not bound");
    }
    return elementsAt(outerValue, evaluator, env);
  }

  /** Returns the member of this family of sets for a given outer value. */
  public List<Object> elementsAt(Object outerValue, Evaluator evaluator,
      EvalEnv env) {
    if (outer == null) {
      throw new CompileException(CompileException.Kind.DIMENSION_MISMATCH,
          "set '" + name + "' is not indexed");
    }
    return compute(Values.keyOf(outerValue), outerValue, evaluator, env);
  }

  private List<Object> compute(String key, @Nullable Object outerValue,
      Evaluator evaluator, EvalEnv env) {
    final List<Object> cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    final Set<Object> values = new LinkedHashSet<>();
    if (outer != null && outerValue != null) {
      try (EvalEnv.Frame ignored =
               env.push(requireNonNull(outer.var), outerValue)) {
        evaluator.expander().expand(iterators, filter, env, e ->
            values.add(evaluator.evaluateValue(output, e)));
      }
    } else {
      evaluator.expander().expand(iterators, filter, env, e ->
          values.add(evaluator.evaluateValue(output, e)));
    }
    final List<Object> list = ImmutableList.copyOf(values);
    cache.put(key, list);
    return list;
  }

  @Override public void invalidate() {
    cache.clear();
  }

  @Override public String describe() {
    final StringBuilder b = new StringBuilder("{").append(elementType)
        .append("} ").append(name);
    if (outer != null) {
      b.append('[').append(outer).append(']');
    }
    b.append(" = {").append(output).append(" |");
    for (int i = 0; i < iterators.size(); i++) {
      b.append(i == 0 ? " " : ", ").append(iterators.get(i));
    }
    if (filter != null) {
      b.append(": ").append(filter);
    }
    return b.append('}').toString();
  }
}

// End ComputedSet.java
