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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a numeric literal. */
  public Ast.Literal numberLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  /** Creates a numeric literal with no position. */
  public Ast.Literal numberLiteral(double value) {
    return numberLiteral(Pos.ZERO, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a literal that wraps a value of any kind: a number, a string, or
   * a tuple instance. */
  public Ast.Literal valueLiteral(Pos pos, Object value) {
    if (value instanceof Number) {
      return numberLiteral(pos, ((Number) value).doubleValue());
    }
    if (value instanceof String) {
      return stringLiteral(pos, (String) value);
    }
    return new Ast.Literal(pos, Op.VALUE_LITERAL, value);
  }

  public Ast.ParamRef paramRef(Pos pos, String name) {
    return new Ast.ParamRef(pos, name);
  }

  public Ast.IndexedParamRef indexedParamRef(Pos pos, String name,
      List<? extends Ast.Exp> indexes) {
    return new Ast.IndexedParamRef(pos, name, ImmutableList.copyOf(indexes));
  }

  public Ast.VarRef varRef(Pos pos, String name) {
    return new Ast.VarRef(pos, name);
  }

  public Ast.IndexedVarRef indexedVarRef(Pos pos, String name,
      List<? extends Ast.Exp> indexes) {
    return new Ast.IndexedVarRef(pos, name, ImmutableList.copyOf(indexes));
  }

  public Ast.DexprRef dexprRef(Pos pos, String name, Ast.@Nullable Exp index) {
    return new Ast.DexprRef(pos, name, index);
  }

  public Ast.Item item(Pos pos, String setName,
      List<? extends Ast.Exp> keys) {
    return new Ast.Item(pos, setName, ImmutableList.copyOf(keys));
  }

  public Ast.FieldAccess fieldAccess(Pos pos, Ast.Exp base, String field) {
    return new Ast.FieldAccess(pos, base, field);
  }

  public Ast.Tuple tuple(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.Array array(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Array(pos, ImmutableList.copyOf(args));
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  public Ast.InfixCall plus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.PLUS, a0, a1);
  }

  public Ast.InfixCall minus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.MINUS, a0, a1);
  }

  public Ast.InfixCall times(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.TIMES, a0, a1);
  }

  public Ast.InfixCall divide(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(a0.pos.plus(a1.pos), Op.DIVIDE, a0, a1);
  }

  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  public Ast.PrefixCall negate(Pos pos, Ast.Exp a) {
    return prefixCall(pos, Op.NEGATE, a);
  }

  public Ast.Sum sum(Pos pos, Ast.Iterator iterator, Ast.Exp body) {
    return new Ast.Sum(pos, iterator, body);
  }

  /** Creates a sum over several iterators, as nested sums. */
  public Ast.Exp sum(Pos pos, List<Ast.Iterator> iterators, Ast.Exp body) {
    checkArgument(!iterators.isEmpty());
    Ast.Exp e = body;
    for (int i = iterators.size() - 1; i >= 0; i--) {
      e = sum(pos, iterators.get(i), e);
    }
    return e;
  }

  /** Creates a sum of a list of expressions, as a left-deep tree of
   * {@link Op#PLUS} calls; an empty list gives zero. */
  public Ast.Exp plusAll(List<? extends Ast.Exp> exps) {
    if (exps.isEmpty()) {
      return numberLiteral(0);
    }
    Ast.Exp e = exps.get(0);
    for (int i = 1; i < exps.size(); i++) {
      e = plus(e, exps.get(i));
    }
    return e;
  }

  public Ast.Iterator iterator(Pos pos, @Nullable String var,
      Ast.DomainRef domain, Ast.@Nullable Exp filter) {
    return new Ast.Iterator(pos, var, domain, filter);
  }

  public Ast.NamedDomain namedDomain(Pos pos, String name,
      Ast.@Nullable Exp index) {
    return new Ast.NamedDomain(pos, name, index);
  }

  public Ast.RangeDomain rangeDomain(Pos pos, Ast.Exp lo, Ast.Exp hi) {
    return new Ast.RangeDomain(pos, lo, hi);
  }

  // declarations

  public Ast.RangeDecl rangeDecl(Pos pos, String name, Ast.Exp lo,
      Ast.Exp hi) {
    return new Ast.RangeDecl(pos, name, lo, hi);
  }

  public Ast.SetDecl setDecl(Pos pos, String elementType, String name,
      @Nullable List<? extends Ast.Exp> elements) {
    return new Ast.SetDecl(pos, elementType, name,
        elements == null ? null : ImmutableList.copyOf(elements));
  }

  public Ast.FieldDecl fieldDecl(Pos pos, boolean key, String type,
      String name) {
    return new Ast.FieldDecl(pos, key, type, name);
  }

  public Ast.TupleDecl tupleDecl(Pos pos, String name,
      List<Ast.FieldDecl> fields) {
    return new Ast.TupleDecl(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.ComputedSetDecl computedSetDecl(Pos pos, String elementType,
      String name, Ast.@Nullable Iterator outer, Ast.Exp output,
      List<Ast.Iterator> iterators, Ast.@Nullable Exp filter) {
    return new Ast.ComputedSetDecl(pos, elementType, name, outer, output,
        ImmutableList.copyOf(iterators), filter);
  }

  public Ast.ParamDecl paramDecl(Pos pos, String type, String name,
      List<Ast.Iterator> dims, Ast.@Nullable Exp value) {
    return new Ast.ParamDecl(pos, type, name, ImmutableList.copyOf(dims),
        value);
  }

  public Ast.DvarDecl dvarDecl(Pos pos, String type, String sign, String name,
      List<Ast.Iterator> dims, Ast.@Nullable Exp lo, Ast.@Nullable Exp hi) {
    return new Ast.DvarDecl(pos, type, sign, name, ImmutableList.copyOf(dims),
        lo, hi);
  }

  public Ast.DexprDecl dexprDecl(Pos pos, String type, String name,
      Ast.@Nullable Iterator index, Ast.Exp exp) {
    return new Ast.DexprDecl(pos, type, name, index, exp);
  }

  public Ast.ObjectiveDecl objectiveDecl(Pos pos, boolean maximize,
      @Nullable String name, Ast.Exp exp) {
    return new Ast.ObjectiveDecl(pos, maximize, name, exp);
  }

  public Ast.ConstraintDecl constraintDecl(Pos pos, @Nullable String label,
      Ast.Exp lhs, Op relOp, Ast.Exp rhs) {
    return new Ast.ConstraintDecl(pos, label, lhs, relOp, rhs);
  }

  public Ast.ForallDecl forallDecl(Pos pos, List<Ast.Iterator> iterators,
      Ast.@Nullable Exp filter, List<? extends Ast.Decl> body) {
    return new Ast.ForallDecl(pos, ImmutableList.copyOf(iterators), filter,
        ImmutableList.copyOf(body));
  }
}

// End AstBuilder.java
