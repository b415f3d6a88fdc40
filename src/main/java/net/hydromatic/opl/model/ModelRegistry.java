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
import static net.hydromatic.opl.compile.CompileException.Kind.DOMAIN_NOT_FOUND;
import static net.hydromatic.opl.compile.CompileException.Kind.DUPLICATE_NAME;
import static net.hydromatic.opl.compile.CompileException.Kind.TYPE_COERCION_FAILED;
import static net.hydromatic.opl.compile.CompileException.Kind.UNBOUND_NAME;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Registry of the named entities of one model: domains, tuple schemas,
 * parameters, decision variables and decision expressions.
 *
 * <p>A name may be declared only once, whatever its kind.
 *
 * <p>The methods {@link #setParameter}, {@link #addElement} and
 * {@link #addTuple} are the interface for loading external data. Each
 * discards cached range bounds and computed sets, because they may depend on
 * the data that changed. */
public class ModelRegistry {
  private static final Logger LOGGER =
      Logger.getLogger(ModelRegistry.class.getName());

  private final Map<String, IndexSet> indexSets = new LinkedHashMap<>();
  private final Map<String, BoundRange> boundRanges = new LinkedHashMap<>();
  private final Map<String, PrimitiveSet> primitiveSets =
      new LinkedHashMap<>();
  private final Map<String, TupleSet> tupleSets = new LinkedHashMap<>();
  private final Map<String, ComputedSet> computedSets = new LinkedHashMap<>();
  private final Map<String, TupleSchema> schemas = new LinkedHashMap<>();
  private final Map<String, AbstractParameter> parameters =
      new LinkedHashMap<>();
  private final Map<String, IndexedVariable> variables =
      new LinkedHashMap<>();
  private final Map<String, DecisionExpression> dexprs =
      new LinkedHashMap<>();

  // registration

  private void checkUnused(String name) {
    if (isDeclared(name)) {
      throw new CompileException(DUPLICATE_NAME,
          "'" + name + "' is already declared");
    }
  }

  /** Returns whether a name has been declared, of any kind. */
  public boolean isDeclared(String name) {
    return domainOpt(name) != null
        || schemas.containsKey(name)
        || parameters.containsKey(name)
        || variables.containsKey(name)
        || dexprs.containsKey(name);
  }

  private <T> T register(Map<String, T> map, String name, T t) {
    checkUnused(name);
    map.put(name, t);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("registered " + t.getClass().getSimpleName() + " " + name);
    }
    return t;
  }

  public IndexSet add(IndexSet indexSet) {
    return register(indexSets, indexSet.name, indexSet);
  }

  public BoundRange add(BoundRange boundRange) {
    return register(boundRanges, boundRange.name, boundRange);
  }

  public PrimitiveSet add(PrimitiveSet primitiveSet) {
    return register(primitiveSets, primitiveSet.name, primitiveSet);
  }

  public TupleSet add(TupleSet tupleSet) {
    return register(tupleSets, tupleSet.name, tupleSet);
  }

  public ComputedSet add(ComputedSet computedSet) {
    return register(computedSets, computedSet.name, computedSet);
  }

  public TupleSchema add(TupleSchema schema) {
    return register(schemas, schema.name, schema);
  }

  public <P extends AbstractParameter> P add(P parameter) {
    register(parameters, parameter.name, parameter);
    return parameter;
  }

  public IndexedVariable add(IndexedVariable variable) {
    return register(variables, variable.name, variable);
  }

  public DecisionExpression add(DecisionExpression dexpr) {
    return register(dexprs, dexpr.name, dexpr);
  }

  // lookup

  /** Returns the domain with a given name, or null.
   *
   * <p>Tries, in order: tuple sets, computed sets, primitive sets, index
   * sets, bound ranges. */
  public @Nullable Domain domainOpt(String name) {
    final TupleSet tupleSet = tupleSets.get(name);
    if (tupleSet != null) {
      return tupleSet;
    }
    final ComputedSet computedSet = computedSets.get(name);
    if (computedSet != null) {
      return computedSet;
    }
    final PrimitiveSet primitiveSet = primitiveSets.get(name);
    if (primitiveSet != null) {
      return primitiveSet;
    }
    final IndexSet indexSet = indexSets.get(name);
    if (indexSet != null) {
      return indexSet;
    }
    return boundRanges.get(name);
  }

  /** Returns the domain with a given name; throws
   * {@link CompileException.Kind#DOMAIN_NOT_FOUND} if there is none. */
  public Domain domain(String name) {
    final Domain domain = domainOpt(name);
    if (domain == null) {
      throw new CompileException(DOMAIN_NOT_FOUND,
          "domain '" + name + "' not found");
    }
    return domain;
  }

  /** Returns the elements of a named domain, in the domain's order. */
  public List<Object> resolve(String name, Evaluator evaluator, EvalEnv env) {
    return domain(name).elements(evaluator, env);
  }

  public @Nullable TupleSet tupleSetOpt(String name) {
    return tupleSets.get(name);
  }

  public @Nullable TupleSchema schemaOpt(String name) {
    return schemas.get(name);
  }

  public @Nullable AbstractParameter parameterOpt(String name) {
    return parameters.get(name);
  }

  public @Nullable IndexedVariable variableOpt(String name) {
    return variables.get(name);
  }

  public @Nullable DecisionExpression dexprOpt(String name) {
    return dexprs.get(name);
  }

  public boolean isVariable(String name) {
    return variables.containsKey(name);
  }

  public boolean isDexpr(String name) {
    return dexprs.containsKey(name);
  }

  public boolean isSchema(String name) {
    return schemas.containsKey(name);
  }

  /** Returns all domains: index sets, bound ranges, primitive sets, tuple
   * sets, then computed sets, each in declaration order. */
  public List<Domain> domains() {
    return ImmutableList.<Domain>builder()
        .addAll(indexSets.values())
        .addAll(boundRanges.values())
        .addAll(primitiveSets.values())
        .addAll(tupleSets.values())
        .addAll(computedSets.values())
        .build();
  }

  public List<TupleSchema> schemas() {
    return ImmutableList.copyOf(schemas.values());
  }

  public List<AbstractParameter> parameters() {
    return ImmutableList.copyOf(parameters.values());
  }

  public List<IndexedVariable> variables() {
    return ImmutableList.copyOf(variables.values());
  }

  public List<DecisionExpression> dexprs() {
    return ImmutableList.copyOf(dexprs.values());
  }

  // data loading

  private AbstractParameter parameter(String name) {
    final AbstractParameter parameter = parameters.get(name);
    if (parameter == null) {
      throw new CompileException(UNBOUND_NAME,
          "parameter '" + name + "' is not declared");
    }
    return parameter;
  }

  /** Sets the value of a scalar parameter. */
  public void setParameter(String name, Object value) {
    parameter(name).setValue(requireNonNull(value));
    invalidate();
  }

  /** Sets the value of an indexed parameter at a given index. */
  public void setParameter(String name, List<?> index, Object value) {
    parameter(name).setValue(index, requireNonNull(value));
    invalidate();
  }

  /** Adds an element to a primitive set. */
  public void addElement(String setName, Object value) {
    final Domain domain = domain(setName);
    if (!(domain instanceof PrimitiveSet)) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "'" + setName + "' is not a set of int, float or string");
    }
    ((PrimitiveSet) domain).add(value);
    invalidate();
  }

  /** Adds a tuple to a tuple set. */
  public void addTuple(String setName, TupleInstance tuple) {
    final TupleSet tupleSet = tupleSets.get(setName);
    if (tupleSet == null) {
      throw new CompileException(DOMAIN_NOT_FOUND,
          "tuple set '" + setName + "' not found");
    }
    if (!tupleSet.schema.name.equals(tuple.schemaName)) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "set '" + setName + "' requires tuples of type '"
              + tupleSet.schema.name + "', got " + tuple.schemaName);
    }
    tupleSet.add(tuple);
    invalidate();
  }

  /** Discards cached bounds of ranges and cached members of computed
   * sets. */
  public void invalidate() {
    boundRanges.values().forEach(Domain::invalidate);
    computedSets.values().forEach(Domain::invalidate);
  }
}

// End ModelRegistry.java
