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

/** Linear equation: the sum of coefficient times variable, compared to a
 * constant.
 *
 * <p>No coefficient is zero. The label, base name and indexes trace the
 * equation back to the statement and iteration that generated it. */
public class LinearEquation {
  /** Coefficient of each variable, in order of first appearance. */
  public final ImmutableMap<String, Ast.Exp> coefficients;
  public final Ast.Exp constant;
  public final RelOp op;
  public final @Nullable String label;
  public final @Nullable String baseName;
  public final @Nullable String index;
  public final @Nullable String secondIndex;

  public LinearEquation(Map<String, ? extends Ast.Exp> coefficients,
      Ast.Exp constant, RelOp op, @Nullable String label,
      @Nullable String baseName, @Nullable String index,
      @Nullable String secondIndex) {
    this.coefficients = ImmutableMap.copyOf(coefficients);
    this.constant = requireNonNull(constant);
    this.op = requireNonNull(op);
    this.label = label;
    this.baseName = baseName;
    this.index = index;
    this.secondIndex = secondIndex;
    this.coefficients.forEach((name, c) ->
        checkArgument(!Values.isZero(numberValue(c)),
            "zero coefficient for %s", name));
  }

  /** Returns the numeric value of a folded coefficient or constant. */
  public static double numberValue(Ast.Exp exp) {
    checkArgument(exp instanceof Ast.Literal && ((Ast.Literal) exp).isNumber(),
        "not a number: %s", exp);
    return ((Ast.Literal) exp).doubleValue();
  }

  /** Returns the coefficient of a variable, or 0 if it does not occur. */
  public double coefficient(String variable) {
    final Ast.Exp c = coefficients.get(variable);
    return c == null ? 0d : numberValue(c);
  }

  public double constantValue() {
    return numberValue(constant);
  }

  /** Returns the identifier of this equation, e.g. "cap[1]" or
   * "flow[2,3]"; or the label if there are no indexes; or null if there
   * is no label. */
  public @Nullable String fullIdentifier() {
    if (label == null) {
      return null;
    }
    if (index == null) {
      return label;
    }
    return label + "[" + index
        + (secondIndex == null ? "" : "," + secondIndex) + "]";
  }

  @Override public String toString() {
    return formatTerms(coefficients) + " " + op.symbol + " "
        + AstWriter.formatNumber(constantValue());
  }

  /** Formats a map of coefficients as a sum, e.g. "10*x1 - x2". */
  public static String formatTerms(Map<String, ? extends Ast.Exp> terms) {
    if (terms.isEmpty()) {
      return "0";
    }
    final StringBuilder b = new StringBuilder();
    terms.forEach((name, exp) -> {
      final double c = numberValue(exp);
      if (b.length() == 0) {
        b.append(c < 0 ? "-" : "");
      } else {
        b.append(c < 0 ? " - " : " + ");
      }
      final double abs = Math.abs(c);
      if (abs != 1d) {
        b.append(AstWriter.formatNumber(abs)).append('*');
      }
      b.append(name);
    });
    return b.toString();
  }
}

// End LinearEquation.java
