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
import static net.hydromatic.opl.compile.CompileException.Kind.DIMENSION_MISMATCH;
import static net.hydromatic.opl.compile.CompileException.Kind.MISSING_INDEXED_VALUE;
import static net.hydromatic.opl.compile.CompileException.Kind.NON_SCALAR_PARAMETER;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.opl.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Named data value, scalar or indexed over zero or more domains.
 *
 * <p>A scalar parameter holds one value; an indexed parameter holds a sparse
 * map from a joined index key (see {@link Values#joinKey}) to a value.
 * An external parameter has no value when declared; values are supplied
 * through {@link ModelRegistry#setParameter}. */
public abstract class AbstractParameter {
  public final String name;
  /** Names of the domains that index this parameter; empty if scalar. */
  public final List<String> domains;
  public final boolean external;
  private @Nullable Object scalar;
  private final Map<String, Object> values = new LinkedHashMap<>();

  protected AbstractParameter(String name, List<String> domains,
      boolean external) {
    this.name = requireNonNull(name);
    this.domains = ImmutableList.copyOf(domains);
    this.external = external;
  }

  /** Returns the number of indexes. */
  public int arity() {
    return domains.size();
  }

  /** Returns whether a value has been assigned: the scalar value, or at
   * least one indexed value. */
  public boolean hasValue() {
    return domains.isEmpty() ? scalar != null : !values.isEmpty();
  }

  /** Converts a value to this parameter's type, or throws. */
  protected abstract Object coerce(Object value);

  /** Returns the name of this parameter's type, e.g. "float". */
  public abstract String typeName();

  void setValue(Object value) {
    if (!domains.isEmpty()) {
      throw new CompileException(NON_SCALAR_PARAMETER,
          "parameter '" + name + "' is indexed, cannot assign a scalar");
    }
    scalar = coerce(value);
  }

  void setValue(List<?> index, Object value) {
    checkArity(index);
    values.put(Values.joinKey(index), coerce(value));
  }

  private void checkArity(List<?> index) {
    if (index.size() != domains.size()) {
      throw new CompileException(DIMENSION_MISMATCH,
          "parameter '" + name + "' has " + domains.size()
              + " indexes, but " + index.size() + " were given");
    }
  }

  /** Returns the value of a scalar parameter. */
  public Object scalarValue() {
    if (!domains.isEmpty()) {
      throw new CompileException(NON_SCALAR_PARAMETER,
          "parameter '" + name + "' is indexed, cannot evaluate as scalar");
    }
    if (scalar == null) {
      throw new CompileException(MISSING_INDEXED_VALUE,
          "parameter '" + name + "' has no value assigned");
    }
    return scalar;
  }

  /** Returns the value at a given index. */
  public Object get(List<?> index) {
    if (domains.isEmpty()) {
      throw new CompileException(DIMENSION_MISMATCH,
          "parameter '" + name + "' is not indexed");
    }
    checkArity(index);
    final String key = Values.joinKey(index);
    final Object value = values.get(key);
    if (value == null) {
      throw new CompileException(MISSING_INDEXED_VALUE,
          "parameter '" + name + "' has no value at index [" + key + "]");
    }
    return value;
  }

  /** Returns the indexed values, keyed by joined index. */
  public Map<String, Object> valueMap() {
    return ImmutableMap.copyOf(values);
  }

  /** Describes this parameter, for reports. */
  public String describe() {
    final StringBuilder b = new StringBuilder(typeName()).append(' ')
        .append(name);
    domains.forEach(d -> b.append('[').append(d).append(']'));
    if (!domains.isEmpty()) {
      b.append(" (").append(values.size()).append(" values)");
    } else if (scalar != null) {
      b.append(" = ").append(Values.keyOf(scalar));
    }
    if (external && !hasValue()) {
      b.append(" = ...");
    }
    return b.toString();
  }
}

// End AbstractParameter.java
