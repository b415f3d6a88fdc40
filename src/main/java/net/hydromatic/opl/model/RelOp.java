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

import net.hydromatic.opl.ast.Op;

/** Relational operator of a linear equation. */
public enum RelOp {
  EQ("==", 'E'),
  LE("<=", 'L'),
  GE(">=", 'G'),
  LT("<", 'L'),
  GT(">", 'G');

  /** Symbol, e.g. "<=". */
  public final String symbol;

  /** Row type in an MPS file; strict inequalities map to the corresponding
   * non-strict type. */
  public final char mpsType;

  RelOp(String symbol, char mpsType) {
    this.symbol = symbol;
    this.mpsType = mpsType;
  }

  /** Converts a comparison operator from the syntax tree. */
  public static RelOp of(Op op) {
    switch (op) {
    case EQ:
      return EQ;
    case LE:
      return LE;
    case GE:
      return GE;
    case LT:
      return LT;
    case GT:
      return GT;
    default:
      throw new IllegalArgumentException("not a relational operator: " + op);
    }
  }
}

// End RelOp.java
