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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.AstWriter;
import net.hydromatic.opl.model.LinearEquation;
import net.hydromatic.opl.model.Values;

/** Affine form: a coefficient for each variable, plus a constant.
 *
 * <p>Coefficients are kept in order of first appearance. No coefficient is
 * zero (within {@link Values#TOLERANCE}). */
public class Linear {
  public final ImmutableMap<String, Double> coefficients;
  public final double constant;

  private Linear(ImmutableMap<String, Double> coefficients, double constant) {
    this.coefficients = requireNonNull(coefficients);
    this.constant = constant;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Creates a form with no variables. */
  public static Linear of(double constant) {
    return new Linear(ImmutableMap.of(), constant);
  }

  /** Returns whether this form has no variables. */
  public boolean isConstant() {
    return coefficients.isEmpty();
  }

  /** Returns the coefficient of a variable, or 0. */
  public double coefficient(String name) {
    return coefficients.getOrDefault(name, 0d);
  }

  /** Evaluates this form for an assignment of values to variables.
   * Variables that are not assigned count as zero. */
  public double evaluate(Map<String, Double> assignment) {
    double d = constant;
    for (Map.Entry<String, Double> e : coefficients.entrySet()) {
      d += e.getValue() * assignment.getOrDefault(e.getKey(), 0d);
    }
    return d;
  }

  /** Returns this minus another form. */
  public Linear minus(Linear other) {
    return builder().addScaled(this, 1d).addScaled(other, -1d).build();
  }

  /** Returns the coefficients as literal expressions. */
  public Map<String, Ast.Exp> coefficientExps() {
    final Map<String, Ast.Exp> map = new LinkedHashMap<>();
    coefficients.forEach((name, c) -> map.put(name, ast.numberLiteral(c)));
    return map;
  }

  public Ast.Exp constantExp() {
    return ast.numberLiteral(constant);
  }

  @Override public String toString() {
    final String terms = LinearEquation.formatTerms(coefficientExps());
    if (Values.isZero(constant)) {
      return terms;
    }
    if (isConstant()) {
      return AstWriter.formatNumber(constant);
    }
    return terms + (constant < 0 ? " - " : " + ")
        + AstWriter.formatNumber(Math.abs(constant));
  }

  /** Accumulates terms of an affine form. */
  public static class Builder {
    private final Map<String, Double> coefficients = new LinkedHashMap<>();
    private double constant;

    /** Adds a multiple of a variable. */
    public Builder add(String name, double coefficient) {
      coefficients.merge(name, coefficient, Double::sum);
      return this;
    }

    public Builder addConstant(double value) {
      constant += value;
      return this;
    }

    /** Adds a multiple of another form. */
    public Builder addScaled(Linear linear, double factor) {
      linear.coefficients.forEach((name, c) -> add(name, c * factor));
      constant += linear.constant * factor;
      return this;
    }

    /** Creates the form, removing variables whose coefficient is zero. */
    public Linear build() {
      final ImmutableMap.Builder<String, Double> b = ImmutableMap.builder();
      coefficients.forEach((name, c) -> {
        if (!Values.isZero(c)) {
          b.put(name, c);
        }
      });
      return new Linear(b.build(), constant);
    }
  }
}

// End Linear.java
