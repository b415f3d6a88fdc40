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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.AstWriter;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Objective function: a sense and an affine expression. */
public class Objective {
  public final Sense sense;
  public final ImmutableMap<String, Ast.Exp> coefficients;
  public final Ast.Exp constant;
  public final @Nullable String name;

  public Objective(Sense sense, Map<String, ? extends Ast.Exp> coefficients,
      Ast.Exp constant, @Nullable String name) {
    this.sense = requireNonNull(sense);
    this.coefficients = ImmutableMap.copyOf(coefficients);
    this.constant = requireNonNull(constant);
    this.name = name;
    this.coefficients.forEach((v, c) ->
        checkArgument(!Values.isZero(LinearEquation.numberValue(c)),
            "zero coefficient for %s", v));
  }

  public double coefficient(String variable) {
    final Ast.Exp c = coefficients.get(variable);
    return c == null ? 0d : LinearEquation.numberValue(c);
  }

  public double constantValue() {
    return LinearEquation.numberValue(constant);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder(sense.lowerName()).append(' ');
    if (name != null) {
      b.append(name).append(": ");
    }
    b.append(LinearEquation.formatTerms(coefficients));
    final double c = constantValue();
    if (!Values.isZero(c)) {
      b.append(c < 0 ? " - " : " + ")
          .append(AstWriter.formatNumber(Math.abs(c)));
    }
    return b.toString();
  }
}

// End Objective.java
