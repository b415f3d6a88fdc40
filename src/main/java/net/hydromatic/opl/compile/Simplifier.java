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

import static net.hydromatic.opl.ast.AstBuilder.ast;

import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Shuttle;
import net.hydromatic.opl.model.Values;

/** Simplifier of expressions.
 *
 * <p>Simplifies children first, then applies these rules:
 *
 * <ul>
 *   <li>{@code 3 + 1} &rarr; {@code 4}, and likewise for other arithmetic,
 *       comparison and logical operators whose operands are both numeric
 *       literals
 *   <li>{@code -(3)} &rarr; {@code -3}
 *   <li>{@code 0 + x} &rarr; {@code x}; {@code x + 0} &rarr; {@code x}
 *   <li>{@code x - 0} &rarr; {@code x}
 *   <li>{@code 0 * x} &rarr; {@code 0}; {@code x * 0} &rarr; {@code 0}
 *   <li>{@code 1 * x} &rarr; {@code x}; {@code x * 1} &rarr; {@code x}
 * </ul>
 *
 * <p>The transform is pure and idempotent. If nothing changes, returns the
 * original expression. */
public class Simplifier extends Shuttle {
  private static final Simplifier INSTANCE = new Simplifier();

  private Simplifier() {}

  /** Simplifies an expression. */
  public static Ast.Exp simplify(Ast.Exp exp) {
    return exp.accept(INSTANCE);
  }

  @Override protected Ast.Exp visit(Ast.InfixCall infixCall) {
    final Ast.InfixCall call = (Ast.InfixCall) super.visit(infixCall);
    final Ast.Exp a0 = call.a0;
    final Ast.Exp a1 = call.a1;
    if (isNumber(a0) && isNumber(a1)) {
      return fold(call, value(a0), value(a1));
    }
    switch (call.op) {
    case PLUS:
      if (isNumber(a0, 0)) {
        return a1;
      }
      if (isNumber(a1, 0)) {
        return a0;
      }
      break;
    case MINUS:
      if (isNumber(a1, 0)) {
        return a0;
      }
      break;
    case TIMES:
      if (isNumber(a0, 0)) {
        return a0;
      }
      if (isNumber(a1, 0)) {
        return a1;
      }
      if (isNumber(a0, 1)) {
        return a1;
      }
      if (isNumber(a1, 1)) {
        return a0;
      }
      break;
    default:
      break;
    }
    return call;
  }

  @Override protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    final Ast.PrefixCall call = (Ast.PrefixCall) super.visit(prefixCall);
    if (isNumber(call.a)) {
      final double d = value(call.a);
      switch (call.op) {
      case NEGATE:
        return ast.numberLiteral(call.pos, -d);
      case NOT:
        return ast.numberLiteral(call.pos, Values.of(!Values.isTrue(d)));
      default:
        break;
      }
    }
    return call;
  }

  private static Ast.Exp fold(Ast.InfixCall call, double d0, double d1) {
    final double d;
    switch (call.op) {
    case PLUS:
      d = d0 + d1;
      break;
    case MINUS:
      d = d0 - d1;
      break;
    case TIMES:
      d = d0 * d1;
      break;
    case DIVIDE:
      d = d0 / d1;
      break;
    case EQ:
      d = Values.of(Values.equal(d0, d1));
      break;
    case NE:
      d = Values.of(!Values.equal(d0, d1));
      break;
    case LT:
      d = Values.of(Values.compare(d0, d1) < 0);
      break;
    case LE:
      d = Values.of(Values.compare(d0, d1) <= 0);
      break;
    case GT:
      d = Values.of(Values.compare(d0, d1) > 0);
      break;
    case GE:
      d = Values.of(Values.compare(d0, d1) >= 0);
      break;
    case ANDALSO:
      d = Values.of(Values.isTrue(d0) && Values.isTrue(d1));
      break;
    case ORELSE:
      d = Values.of(Values.isTrue(d0) || Values.isTrue(d1));
      break;
    default:
      return call;
    }
    return ast.numberLiteral(call.pos, d);
  }

  private static boolean isNumber(Ast.Exp exp) {
    return exp instanceof Ast.Literal && ((Ast.Literal) exp).isNumber();
  }

  private static boolean isNumber(Ast.Exp exp, double value) {
    return isNumber(exp) && value(exp) == value;
  }

  private static double value(Ast.Exp exp) {
    return ((Ast.Literal) exp).doubleValue();
  }
}

// End Simplifier.java
