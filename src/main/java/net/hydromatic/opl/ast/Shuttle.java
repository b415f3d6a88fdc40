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

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits and transforms expression trees.
 *
 * <p>Each method returns its argument if no child changed. */
public class Shuttle {
  protected <E extends Ast.Exp> List<Ast.Exp> visitList(List<E> nodes) {
    final List<Ast.Exp> list = new ArrayList<>();
    for (E node : nodes) {
      list.add(node.accept(this));
    }
    return list;
  }

  protected Ast.@Nullable Exp visitOpt(Ast.@Nullable Exp exp) {
    return exp == null ? null : exp.accept(this);
  }

  // expressions

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.ParamRef paramRef) {
    return paramRef; // leaf
  }

  protected Ast.Exp visit(Ast.IndexedParamRef indexedParamRef) {
    return indexedParamRef.copy(visitList(indexedParamRef.indexes));
  }

  protected Ast.Exp visit(Ast.VarRef varRef) {
    return varRef; // leaf
  }

  protected Ast.Exp visit(Ast.IndexedVarRef indexedVarRef) {
    return indexedVarRef.copy(visitList(indexedVarRef.indexes));
  }

  protected Ast.Exp visit(Ast.DexprRef dexprRef) {
    return dexprRef.copy(visitOpt(dexprRef.index));
  }

  protected Ast.Exp visit(Ast.Item item) {
    return item.copy(visitList(item.keys));
  }

  protected Ast.Exp visit(Ast.FieldAccess fieldAccess) {
    return fieldAccess.copy(fieldAccess.base.accept(this));
  }

  protected Ast.Exp visit(Ast.Tuple tuple) {
    final List<Ast.Exp> args = visitList(tuple.args);
    return args.equals(tuple.args)
        ? tuple
        : AstBuilder.ast.tuple(tuple.pos, args);
  }

  protected Ast.Exp visit(Ast.Array array) {
    final List<Ast.Exp> args = visitList(array.args);
    return args.equals(array.args)
        ? array
        : AstBuilder.ast.array(array.pos, args);
  }

  // calls

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this),
        infixCall.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    return prefixCall.copy(prefixCall.a.accept(this));
  }

  protected Ast.Exp visit(Ast.Sum sum) {
    return sum.copy(sum.iterator.accept(this), sum.body.accept(this));
  }

  // iteration

  protected Ast.Iterator visit(Ast.Iterator iterator) {
    return iterator.copy(iterator.domain.accept(this),
        visitOpt(iterator.filter));
  }

  protected Ast.DomainRef visit(Ast.NamedDomain namedDomain) {
    return namedDomain.copy(visitOpt(namedDomain.index));
  }

  protected Ast.DomainRef visit(Ast.RangeDomain rangeDomain) {
    return rangeDomain.copy(rangeDomain.lo.accept(this),
        rangeDomain.hi.accept(this));
  }
}

// End Shuttle.java
