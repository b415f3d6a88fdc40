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
package net.hydromatic.opl.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // literals
  NUMBER_LITERAL(true),
  STRING_LITERAL(true),
  /** Literal whose value is a non-atomic value, such as a tuple instance. */
  VALUE_LITERAL(true),

  // references
  /** Reference to a scalar parameter or to a bound iterator variable. */
  ID(true),
  INDEXED_PARAM(true),
  VAR(true),
  INDEXED_VAR(true),
  DEXPR(true),
  ITEM(true),
  DOT(true),

  // value constructors
  TUPLE(true),
  ARRAY(true),

  SUM("sum", 7),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  NEGATE("-", 8),
  NOT("!", 8),
  LE(" <= ", 4),
  LT(" < ", 4),
  GE(" >= ", 4),
  GT(" > ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),
  ANDALSO(" && ", 2),
  ORELSE(" || ", 1),

  // iteration
  ITERATOR,
  NAMED_DOMAIN,
  RANGE_DOMAIN(" .. "),

  // declarations
  RANGE_DECL,
  SET_DECL,
  TUPLE_DECL,
  FIELD_DECL,
  COMPUTED_SET_DECL,
  PARAM_DECL,
  DVAR_DECL,
  DEXPR_DECL,
  OBJECTIVE_DECL,
  CONSTRAINT_DECL,
  FORALL_DECL;

  /** Padded name, e.g. " * ". */
  public final @Nullable String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Relational operators, keyed by the symbol used in source text. */
  public static final ImmutableMap<String, Op> BY_SYMBOL =
      ImmutableMap.<String, Op>builder()
          .put("==", EQ)
          .put("!=", NE)
          .put("<=", LE)
          .put("≤", LE)
          .put("<", LT)
          .put(">=", GE)
          .put("≥", GE)
          .put(">", GT)
          .build();

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(@Nullable String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a comparison operator. */
  public boolean isComparison() {
    switch (this) {
    case EQ:
    case NE:
    case LE:
    case LT:
    case GE:
    case GT:
      return true;
    default:
      return false;
    }
  }

  /** Returns the operator with the operands swapped; for example
   * {@code LT.reverse()} is {@code GT}. */
  public Op reverse() {
    switch (this) {
    case LE:
      return GE;
    case LT:
      return GT;
    case GE:
      return LE;
    case GT:
      return LT;
    default:
      return this;
    }
  }

  /** Returns the source symbol of this operator, e.g. "==" for {@link #EQ}. */
  public String symbol() {
    return padded == null ? name() : padded.trim();
  }
}

// End Op.java
