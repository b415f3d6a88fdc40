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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a decision variable, scalar or indexed over one or two
 * domains, e.g. "dvar float+ x[I, J] in 0..10".
 *
 * <p>Purely declarative; a variable has no value until it is solved. Each
 * element becomes one solver column, named by
 * {@link Values#variableName}. */
public class IndexedVariable {
  public final String name;
  public final VarKind kind;
  public final List<String> domains;
  public final @Nullable Double lowerBound;
  public final @Nullable Double upperBound;

  public IndexedVariable(String name, VarKind kind, List<String> domains,
      @Nullable Double lowerBound, @Nullable Double upperBound) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.domains = ImmutableList.copyOf(domains);
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    checkArgument(domains.size() <= 2,
        "variable %s has more than 2 dimensions", name);
  }

  public int arity() {
    return domains.size();
  }

  /** Returns the names of all elements of this variable, e.g. "x1", "x2",
   * "x3", in domain order. */
  public List<String> columnNames(Evaluator evaluator) {
    final List<String> names = new ArrayList<>();
    final EvalEnv env = new EvalEnv();
    switch (domains.size()) {
    case 0:
      names.add(name);
      break;
    case 1:
      for (Object i : evaluator.resolve(domains.get(0), env)) {
        names.add(Values.variableName(name, ImmutableList.of(i)));
      }
      break;
    default:
      for (Object i : evaluator.resolve(domains.get(0), env)) {
        for (Object j : evaluator.resolve(domains.get(1), env)) {
          names.add(Values.variableName(name, ImmutableList.of(i, j)));
        }
      }
    }
    return names;
  }

  /** Describes this declaration, for reports. */
  public String describe() {
    final StringBuilder b = new StringBuilder("dvar ")
        .append(kind.name().toLowerCase(Locale.ROOT))
        .append(' ')
        .append(name);
    if (!domains.isEmpty()) {
      b.append('[').append(String.join(", ", domains)).append(']');
    }
    if (lowerBound != null || upperBound != null) {
      b.append(" in ")
          .append(lowerBound == null ? "-inf" : Values.keyOf(lowerBound))
          .append("..")
          .append(upperBound == null ? "inf" : Values.keyOf(upperBound));
    }
    return b.toString();
  }
}

// End IndexedVariable.java
