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

import net.hydromatic.opl.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Named, reusable sub-expression, e.g.
 * "dexpr float total = sum(i in I) x[i]".
 *
 * <p>A reference to a decision expression is inlined where it is used, with
 * the reference's index bound to {@link #index}'s variable. */
public class DecisionExpression {
  public final String name;
  public final ScalarType type;
  public final Ast.Exp exp;
  public final Ast.@Nullable Iterator index;

  public DecisionExpression(String name, ScalarType type, Ast.Exp exp,
      Ast.@Nullable Iterator index) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    this.exp = requireNonNull(exp);
    this.index = index;
    checkArgument(index == null || index.var != null,
        "index of %s must have a variable", name);
  }

  public String describe() {
    return "dexpr " + type.lowerName() + " " + name
        + (index == null ? "" : "[" + index + "]")
        + " = " + exp;
  }
}

// End DecisionExpression.java
