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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.ObjIntConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    public abstract Exp accept(Shuttle shuttle);

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, i) -> args.add(exp));
      return args.build();
    }

    /** Returns whether this expression contains no reference to a decision
     * variable.
     *
     * <p>Parameter and decision-expression references count as constant,
     * because relative to a fixed environment they hold data, not
     * solver-controlled unknowns. */
    public boolean isConstant() {
      for (Exp arg : args()) {
        if (!arg.isConstant()) {
          return false;
        }
      }
      return true;
    }
  }

  /** Parse tree node of a literal (constant). */
  public static class Literal extends Exp {
    public final Object value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Object value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.NUMBER_LITERAL && value instanceof Double
          || op == Op.STRING_LITERAL && value instanceof String
          || op == Op.VALUE_LITERAL);
    }

    /** Returns whether this literal holds a number. */
    public boolean isNumber() {
      return op == Op.NUMBER_LITERAL;
    }

    /** Returns the numeric value; fails if this is not a number. */
    public double doubleValue() {
      checkArgument(isNumber(), "not a number: %s", value);
      return (Double) value;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.value.equals(((Literal) o).value);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (isNumber() && doubleValue() < 0 && left > Op.NEGATE.left) {
        return w.append("(").appendLiteral(value).append(")");
      }
      return w.appendLiteral(value);
    }
  }

  /** Reference to a scalar parameter, or to an iterator variable that is
   * bound in the environment. */
  public static class ParamRef extends Exp {
    public final String name;

    ParamRef(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ParamRef
          && this.name.equals(((ParamRef) o).name);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Reference to an element of an indexed parameter, e.g. "cost[i]". */
  public static class IndexedParamRef extends Exp {
    public final String name;
    public final List<Exp> indexes;

    IndexedParamRef(Pos pos, String name, ImmutableList<Exp> indexes) {
      super(pos, Op.INDEXED_PARAM);
      this.name = requireNonNull(name);
      this.indexes = requireNonNull(indexes);
      checkArgument(!indexes.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < indexes.size(); i++) {
        action.accept(indexes.get(i), i);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(name, indexes);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IndexedParamRef
          && this.name.equals(((IndexedParamRef) o).name)
          && this.indexes.equals(((IndexedParamRef) o).indexes);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).appendIndexes(indexes);
    }

    public IndexedParamRef copy(List<Exp> indexes) {
      return this.indexes.equals(indexes)
          ? this
          : new IndexedParamRef(pos, name, ImmutableList.copyOf(indexes));
    }
  }

  /** Reference to a scalar decision variable. */
  public static class VarRef extends Exp {
    public final String name;

    VarRef(Pos pos, String name) {
      super(pos, Op.VAR);
      this.name = requireNonNull(name);
    }

    @Override public boolean isConstant() {
      return false;
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarRef
          && this.name.equals(((VarRef) o).name);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Reference to an element of an indexed decision variable, e.g.
   * "x[i, j]". */
  public static class IndexedVarRef extends Exp {
    public final String name;
    public final List<Exp> indexes;

    IndexedVarRef(Pos pos, String name, ImmutableList<Exp> indexes) {
      super(pos, Op.INDEXED_VAR);
      this.name = requireNonNull(name);
      this.indexes = requireNonNull(indexes);
      checkArgument(!indexes.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < indexes.size(); i++) {
        action.accept(indexes.get(i), i);
      }
    }

    @Override public boolean isConstant() {
      return false;
    }

    @Override public int hashCode() {
      return Objects.hash(name, indexes);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IndexedVarRef
          && this.name.equals(((IndexedVarRef) o).name)
          && this.indexes.equals(((IndexedVarRef) o).indexes);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).appendIndexes(indexes);
    }

    public IndexedVarRef copy(List<Exp> indexes) {
      return this.indexes.equals(indexes)
          ? this
          : new IndexedVarRef(pos, name, ImmutableList.copyOf(indexes));
    }
  }

  /** Reference to a named decision expression ("dexpr"), optionally with
   * an index. */
  public static class DexprRef extends Exp {
    public final String name;
    public final @Nullable Exp index;

    DexprRef(Pos pos, String name, @Nullable Exp index) {
      super(pos, Op.DEXPR);
      this.name = requireNonNull(name);
      this.index = index;
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      if (index != null) {
        action.accept(index, 0);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(name, index);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof DexprRef
          && this.name.equals(((DexprRef) o).name)
          && Objects.equals(this.index, ((DexprRef) o).index);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.id(name);
      if (index != null) {
        w.appendIndexes(ImmutableList.of(index));
      }
      return w;
    }

    public DexprRef copy(@Nullable Exp index) {
      return Objects.equals(this.index, index)
          ? this
          : new DexprRef(pos, name, index);
    }
  }

  /** Keyed lookup of a tuple in a tuple set, e.g. "item(Arcs, &lt;1, 2&gt;)".
   */
  public static class Item extends Exp {
    public final String setName;
    public final List<Exp> keys;

    Item(Pos pos, String setName, ImmutableList<Exp> keys) {
      super(pos, Op.ITEM);
      this.setName = requireNonNull(setName);
      this.keys = requireNonNull(keys);
      checkArgument(!keys.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < keys.size(); i++) {
        action.accept(keys.get(i), i);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(setName, keys);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Item
          && this.setName.equals(((Item) o).setName)
          && this.keys.equals(((Item) o).keys);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("item(").id(setName).append(", ");
      if (keys.size() == 1) {
        keys.get(0).unparse(w, 0, 0);
      } else {
        w.appendAll(keys, "<", ", ", ">");
      }
      return w.append(")");
    }

    public Item copy(List<Exp> keys) {
      return this.keys.equals(keys)
          ? this
          : new Item(pos, setName, ImmutableList.copyOf(keys));
    }
  }

  /** Access to a field of a tuple, e.g. "a.weight". */
  public static class FieldAccess extends Exp {
    public final Exp base;
    public final String field;

    FieldAccess(Pos pos, Exp base, String field) {
      super(pos, Op.DOT);
      this.base = requireNonNull(base);
      this.field = requireNonNull(field);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(base, 0);
    }

    @Override public int hashCode() {
      return Objects.hash(base, field);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FieldAccess
          && this.base.equals(((FieldAccess) o).base)
          && this.field.equals(((FieldAccess) o).field);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      base.unparse(w, op.left, op.left);
      return w.append(".").id(field);
    }

    public FieldAccess copy(Exp base) {
      return this.base.equals(base)
          ? this
          : new FieldAccess(pos, base, field);
    }
  }

  /** Tuple constructor, e.g. "&lt;1, 2, 7&gt;". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override public int hashCode() {
      return args.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple
          && this.args.equals(((Tuple) o).args);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "<", ", ", ">");
    }
  }

  /** Array initializer, e.g. "[10, 20, 30]". */
  public static class Array extends Exp {
    public final List<Exp> args;

    Array(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.ARRAY);
      this.args = requireNonNull(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i);
      }
    }

    @Override public int hashCode() {
      return args.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Array
          && this.args.equals(((Array) o).args);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "[", ", ", "]");
    }
  }

  /** Call to an infix operator. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
          && this.op == ((InfixCall) o).op
          && this.a0.equals(((InfixCall) o).a0)
          && this.a1.equals(((InfixCall) o).a1);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /** Creates a copy of this {@code InfixCall} with given contents,
     * or {@code this} if the contents are the same. */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0.equals(a0)
          && this.a1.equals(a1)
          ? this
          : new InfixCall(pos, op, a0, a1);
    }
  }

  /** Call to a prefix operator. */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a, 0);
    }

    @Override public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PrefixCall
          && this.op == ((PrefixCall) o).op
          && this.a.equals(((PrefixCall) o).a);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    public PrefixCall copy(Exp a) {
      return this.a.equals(a) ? this : new PrefixCall(pos, op, a);
    }
  }

  /** Summation, e.g. "sum(i in I) cost[i] * x[i]".
   *
   * <p>A sum over several iterators is represented as nested sums; the
   * filter of the innermost iterator then sees every variable bound. */
  public static class Sum extends Exp {
    public final Iterator iterator;
    public final Exp body;

    Sum(Pos pos, Iterator iterator, Exp body) {
      super(pos, Op.SUM);
      this.iterator = requireNonNull(iterator);
      this.body = requireNonNull(body);
      checkArgument(iterator.var != null, "sum iterator must have a variable");
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(body, 0);
    }

    @Override public int hashCode() {
      return Objects.hash(iterator, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Sum
          && this.iterator.equals(((Sum) o).iterator)
          && this.body.equals(((Sum) o).body);
    }

    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || right >= op.left) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      w.append("sum(");
      iterator.unparse(w, 0, 0);
      w.append(") ");
      return body.unparse(w, op.left, right);
    }

    public Sum copy(Iterator iterator, Exp body) {
      return this.iterator.equals(iterator)
          && this.body.equals(body)
          ? this
          : new Sum(pos, iterator, body);
    }
  }

  /** Iterator, "var in domain", with an optional filter.
   *
   * <p>In the index list of a declaration such as "float cost[I]" there is
   * no variable, and {@link #var} is null. */
  public static class Iterator extends AstNode {
    public final @Nullable String var;
    public final DomainRef domain;
    public final @Nullable Exp filter;

    Iterator(Pos pos, @Nullable String var, DomainRef domain,
        @Nullable Exp filter) {
      super(pos, Op.ITERATOR);
      this.var = var;
      this.domain = requireNonNull(domain);
      this.filter = filter;
    }

    @Override public int hashCode() {
      return Objects.hash(var, domain, filter);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Iterator
          && Objects.equals(this.var, ((Iterator) o).var)
          && this.domain.equals(((Iterator) o).domain)
          && Objects.equals(this.filter, ((Iterator) o).filter);
    }

    public Iterator accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (var != null) {
        w.id(var).append(" in ");
      }
      domain.unparse(w, 0, 0);
      if (filter != null) {
        w.append(": ");
        filter.unparse(w, 0, 0);
      }
      return w;
    }

    public Iterator copy(DomainRef domain, @Nullable Exp filter) {
      return this.domain.equals(domain)
          && Objects.equals(this.filter, filter)
          ? this
          : new Iterator(pos, var, domain, filter);
    }
  }

  /** Reference to a domain that an iterator ranges over. */
  public abstract static class DomainRef extends AstNode {
    DomainRef(Pos pos, Op op) {
      super(pos, op);
    }

    public abstract DomainRef accept(Shuttle shuttle);
  }

  /** Reference to a named domain, e.g. "I", or to one member of an
   * indexed family of sets, e.g. "out[i]". */
  public static class NamedDomain extends DomainRef {
    public final String name;
    public final @Nullable Exp index;

    NamedDomain(Pos pos, String name, @Nullable Exp index) {
      super(pos, Op.NAMED_DOMAIN);
      this.name = requireNonNull(name);
      this.index = index;
    }

    @Override public int hashCode() {
      return Objects.hash(name, index);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NamedDomain
          && this.name.equals(((NamedDomain) o).name)
          && Objects.equals(this.index, ((NamedDomain) o).index);
    }

    public DomainRef accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.id(name);
      if (index != null) {
        w.appendIndexes(ImmutableList.of(index));
      }
      return w;
    }

    public NamedDomain copy(@Nullable Exp index) {
      return Objects.equals(this.index, index)
          ? this
          : new NamedDomain(pos, name, index);
    }
  }

  /** Inline integer range, e.g. "1..n". */
  public static class RangeDomain extends DomainRef {
    public final Exp lo;
    public final Exp hi;

    RangeDomain(Pos pos, Exp lo, Exp hi) {
      super(pos, Op.RANGE_DOMAIN);
      this.lo = requireNonNull(lo);
      this.hi = requireNonNull(hi);
    }

    @Override public int hashCode() {
      return Objects.hash(lo, hi);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof RangeDomain
          && this.lo.equals(((RangeDomain) o).lo)
          && this.hi.equals(((RangeDomain) o).hi);
    }

    public DomainRef accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      lo.unparse(w, 0, 0);
      w.append("..");
      return hi.unparse(w, 0, 0);
    }

    public RangeDomain copy(Exp lo, Exp hi) {
      return this.lo.equals(lo) && this.hi.equals(hi)
          ? this
          : new RangeDomain(pos, lo, hi);
    }
  }

  /** Base class for a declaration or statement. */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Range declaration, e.g. "range I = 1..n". */
  public static class RangeDecl extends Decl {
    public final String name;
    public final Exp lo;
    public final Exp hi;

    RangeDecl(Pos pos, String name, Exp lo, Exp hi) {
      super(pos, Op.RANGE_DECL);
      this.name = requireNonNull(name);
      this.lo = requireNonNull(lo);
      this.hi = requireNonNull(hi);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("range ").id(name).append(" = ");
      lo.unparse(w, 0, 0);
      w.append("..");
      return hi.unparse(w, 0, 0);
    }
  }

  /** Set declaration with explicit elements, e.g. "{int} S = {1, 2}", or
   * external elements, e.g. "{Arc} Arcs = ...". */
  public static class SetDecl extends Decl {
    public final String elementType;
    public final String name;
    /** Elements, or null if the set is external. */
    public final @Nullable List<Exp> elements;

    SetDecl(Pos pos, String elementType, String name,
        @Nullable ImmutableList<Exp> elements) {
      super(pos, Op.SET_DECL);
      this.elementType = requireNonNull(elementType);
      this.name = requireNonNull(name);
      this.elements = elements;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{").id(elementType).append("} ").id(name).append(" = ");
      if (elements == null) {
        return w.append("...");
      }
      return w.appendAll(elements, "{", ", ", "}");
    }
  }

  /** Field of a tuple declaration, e.g. "key int from". */
  public static class FieldDecl extends Decl {
    public final boolean key;
    public final String type;
    public final String name;

    FieldDecl(Pos pos, boolean key, String type, String name) {
      super(pos, Op.FIELD_DECL);
      this.key = key;
      this.type = requireNonNull(type);
      this.name = requireNonNull(name);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(key ? "key " : "").id(type).append(" ").id(name);
    }
  }

  /** Tuple declaration, e.g. "tuple Arc { key int from; float w; }". */
  public static class TupleDecl extends Decl {
    public final String name;
    public final List<FieldDecl> fields;

    TupleDecl(Pos pos, String name, ImmutableList<FieldDecl> fields) {
      super(pos, Op.TUPLE_DECL);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("tuple ").id(name).append(" {");
      for (FieldDecl field : fields) {
        w.append(" ");
        field.unparse(w, 0, 0);
        w.append(";");
      }
      return w.append(" }");
    }
  }

  /** Set comprehension, e.g. "{Arc} out[i in N] = {a | a in Arcs: a.from ==
   * i}". */
  public static class ComputedSetDecl extends Decl {
    public final String elementType;
    public final String name;
    public final @Nullable Iterator outer;
    public final Exp output;
    public final List<Iterator> iterators;
    public final @Nullable Exp filter;

    ComputedSetDecl(Pos pos, String elementType, String name,
        @Nullable Iterator outer, Exp output, ImmutableList<Iterator> iterators,
        @Nullable Exp filter) {
      super(pos, Op.COMPUTED_SET_DECL);
      this.elementType = requireNonNull(elementType);
      this.name = requireNonNull(name);
      this.outer = outer;
      this.output = requireNonNull(output);
      this.iterators = requireNonNull(iterators);
      this.filter = filter;
      checkArgument(!iterators.isEmpty());
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{").id(elementType).append("} ").id(name);
      if (outer != null) {
        w.append("[");
        outer.unparse(w, 0, 0);
        w.append("]");
      }
      w.append(" = {");
      output.unparse(w, 0, 0);
      w.appendAll(iterators, " | ", ", ", "");
      if (filter != null) {
        w.append(": ");
        filter.unparse(w, 0, 0);
      }
      return w.append("}");
    }
  }

  /** Parameter declaration, e.g. "float cost[I] = [10, 20, 30]". The type
   * may be a tuple type. */
  public static class ParamDecl extends Decl {
    public final String type;
    public final String name;
    public final List<Iterator> dims;
    /** Value, or null if the parameter is external. */
    public final @Nullable Exp value;

    ParamDecl(Pos pos, String type, String name, ImmutableList<Iterator> dims,
        @Nullable Exp value) {
      super(pos, Op.PARAM_DECL);
      this.type = requireNonNull(type);
      this.name = requireNonNull(name);
      this.dims = requireNonNull(dims);
      this.value = value;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.id(type).append(" ").id(name);
      for (Iterator dim : dims) {
        w.append("[");
        dim.unparse(w, 0, 0);
        w.append("]");
      }
      w.append(" = ");
      if (value == null) {
        return w.append("...");
      }
      return value.unparse(w, 0, 0);
    }
  }

  /** Decision variable declaration, e.g. "dvar float+ x[I] in 0..10". */
  public static class DvarDecl extends Decl {
    public final String type;
    /** "+", "-" or "". */
    public final String sign;
    public final String name;
    public final List<Iterator> dims;
    public final @Nullable Exp lo;
    public final @Nullable Exp hi;

    DvarDecl(Pos pos, String type, String sign, String name,
        ImmutableList<Iterator> dims, @Nullable Exp lo, @Nullable Exp hi) {
      super(pos, Op.DVAR_DECL);
      this.type = requireNonNull(type);
      this.sign = requireNonNull(sign);
      this.name = requireNonNull(name);
      this.dims = requireNonNull(dims);
      this.lo = lo;
      this.hi = hi;
      checkArgument((lo == null) == (hi == null));
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("dvar ").id(type).append(sign).append(" ").id(name);
      if (!dims.isEmpty()) {
        w.appendIndexes(dims);
      }
      if (lo != null && hi != null) {
        w.append(" in ");
        lo.unparse(w, 0, 0);
        w.append("..");
        hi.unparse(w, 0, 0);
      }
      return w;
    }
  }

  /** Decision expression declaration, e.g. "dexpr float total = sum(i in I)
   * x[i]". */
  public static class DexprDecl extends Decl {
    public final String type;
    public final String name;
    public final @Nullable Iterator index;
    public final Exp exp;

    DexprDecl(Pos pos, String type, String name, @Nullable Iterator index,
        Exp exp) {
      super(pos, Op.DEXPR_DECL);
      this.type = requireNonNull(type);
      this.name = requireNonNull(name);
      this.index = index;
      this.exp = requireNonNull(exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("dexpr ").id(type).append(" ").id(name);
      if (index != null) {
        w.appendIndexes(ImmutableList.of(index));
      }
      w.append(" = ");
      return exp.unparse(w, 0, 0);
    }
  }

  /** Objective, e.g. "minimize cost: sum(i in I) c[i] * x[i]". */
  public static class ObjectiveDecl extends Decl {
    public final boolean maximize;
    public final @Nullable String name;
    public final Exp exp;

    ObjectiveDecl(Pos pos, boolean maximize, @Nullable String name, Exp exp) {
      super(pos, Op.OBJECTIVE_DECL);
      this.maximize = maximize;
      this.name = name;
      this.exp = requireNonNull(exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(maximize ? "maximize " : "minimize ");
      if (name != null) {
        w.id(name).append(": ");
      }
      return exp.unparse(w, 0, 0);
    }
  }

  /** Constraint, e.g. "cap: x[1] + x[2] &lt;= 10". */
  public static class ConstraintDecl extends Decl {
    public final @Nullable String label;
    public final Exp lhs;
    public final Op relOp;
    public final Exp rhs;

    ConstraintDecl(Pos pos, @Nullable String label, Exp lhs, Op relOp,
        Exp rhs) {
      super(pos, Op.CONSTRAINT_DECL);
      this.label = label;
      this.lhs = requireNonNull(lhs);
      this.relOp = requireNonNull(relOp);
      this.rhs = requireNonNull(rhs);
      checkArgument(relOp.isComparison() && relOp != Op.NE,
          "not a constraint operator: %s", relOp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (label != null) {
        w.id(label).append(": ");
      }
      lhs.unparse(w, 0, relOp.left);
      w.append(relOp.padded);
      return rhs.unparse(w, relOp.right, 0);
    }
  }

  /** Quantified constraint, e.g. "forall(i in I, j in J: i != j) x[i] &lt;=
   * y[j]". The body is one or more constraints or nested foralls. */
  public static class ForallDecl extends Decl {
    public final List<Iterator> iterators;
    public final @Nullable Exp filter;
    public final List<Decl> body;

    ForallDecl(Pos pos, ImmutableList<Iterator> iterators,
        @Nullable Exp filter, ImmutableList<Decl> body) {
      super(pos, Op.FORALL_DECL);
      this.iterators = requireNonNull(iterators);
      this.filter = filter;
      this.body = requireNonNull(body);
      checkArgument(!iterators.isEmpty());
      checkArgument(!body.isEmpty());
      for (Decl decl : body) {
        checkArgument(decl instanceof ConstraintDecl
            || decl instanceof ForallDecl, "not a constraint: %s", decl);
      }
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.appendAll(iterators, "forall(", ", ", "");
      if (filter != null) {
        w.append(": ");
        filter.unparse(w, 0, 0);
      }
      w.append(") ");
      if (body.size() == 1) {
        return body.get(0).unparse(w, 0, 0);
      }
      return w.appendAll(body, "{", "; ", ";}");
    }
  }
}

// End Ast.java
