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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;

/** Explicit set of integers, floats or strings, e.g.
 * "{string} Cities = {"Paris", "Rome"}".
 *
 * <p>Elements are kept in insertion order, without duplicates. An external
 * set is declared empty and filled by the data-loading collaborator. */
public class PrimitiveSet extends Domain {
  public final ScalarType type;
  public final boolean external;
  private final Set<Object> values = new LinkedHashSet<>();

  public PrimitiveSet(String name, ScalarType type, boolean external) {
    super(name);
    this.type = requireNonNull(type);
    this.external = external;
    checkArgument(type != ScalarType.BOOL, "set of bool is not supported");
  }

  /** Adds an element, converting it to this set's type. Package-private;
   * call {@link ModelRegistry#addElement} to load data. */
  void add(Object value) {
    values.add(type.coerce(value));
  }

  public int size() {
    return values.size();
  }

  @Override public List<Object> elements(Evaluator evaluator, EvalEnv env) {
    return ImmutableList.copyOf(values);
  }

  @Override public String describe() {
    return "{" + type.lowerName() + "} " + name + " = "
        + (external && values.isEmpty()
            ? "..."
            : "{" + Joiner.on(", ").join(values) + "}");
  }
}

// End PrimitiveSet.java
