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
package net.hydromatic.opl.parse;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.opl.Fixture;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Op;
import net.hydromatic.opl.model.ModelRegistry;
import org.junit.jupiter.api.Test;

/** Tests the parser on statements. */
class StatementTest {
  private static final ModelRegistry REGISTRY =
      Fixture.model("range I = 1..2;\n"
          + "tuple Arc { key int from; key int to; }\n").session().registry;

  private static List<Ast.Decl> parseAll(String s) {
    return Parsers.parseStatement(REGISTRY, s);
  }

  /** Parses a statement that yields exactly one declaration. */
  @SuppressWarnings("unchecked")
  private static <D extends Ast.Decl> D parse(String s) {
    final List<Ast.Decl> decls = parseAll(s);
    assertThat(decls.size(), is(1));
    return (D) decls.get(0);
  }

  private static void checkFails(String s, String message) {
    final OplParseException e =
        assertThrows(OplParseException.class, () -> parseAll(s));
    assertThat(e.getMessage(), containsString(message));
  }

  @Test void testRange() {
    final Ast.RangeDecl range = parse("range R = 1..n");
    assertThat(range.name, is("R"));
    assertThat(range.lo.toString(), is("1"));
    assertThat(range.hi.toString(), is("n"));
  }

  @Test void testSet() {
    final Ast.SetDecl set = parse("{int} S = {1, 2, 3}");
    assertThat(set.elementType, is("int"));
    assertThat(set.elements.size(), is(3));

    final Ast.SetDecl external = parse("{string} Names = ...");
    assertThat(external.elements, nullValue());

    final Ast.SetDecl empty = parse("{int} E = {}");
    assertThat(empty.elements.size(), is(0));

    final Ast.SetDecl tuples = parse("{Arc} Arcs = {<1, 2>, <2, 1>}");
    assertThat(tuples.elementType, is("Arc"));
    assertThat(tuples.elements.get(1).op, is(Op.TUPLE));
  }

  @Test void testComputedSet() {
    final Ast.ComputedSetDecl set =
        parse("{int} later[i in I] = {j | j in I: j > i}");
    assertThat(set.name, is("later"));
    assertThat(set.outer.var, is("i"));
    assertThat(set.output.toString(), is("j"));
    assertThat(set.iterators.size(), is(1));
    assertThat(set.filter.toString(), is("j > i"));
  }

  @Test void testTuple() {
    final Ast.TupleDecl tuple =
        parse("tuple Edge { key int a; key int b; float w; }");
    assertThat(tuple.name, is("Edge"));
    assertThat(tuple.fields.size(), is(3));
    assertThat(tuple.fields.get(0).key, is(true));
    assertThat(tuple.fields.get(2).key, is(false));
    assertThat(tuple.fields.get(2).type, is("float"));
    assertThat(tuple.fields.get(2).name, is("w"));

    // Fields may have the names of keywords.
    final Ast.TupleDecl link =
        parse("tuple Link { key int from; key int to; int key }");
    assertThat(link.fields.get(1).name, is("to"));
    assertThat(link.fields.get(2).key, is(false));
    assertThat(link.fields.get(2).name, is("key"));
  }

  @Test void testParam() {
    final Ast.ParamDecl c = parse("float c[I] = [1, 2]");
    assertThat(c.type, is("float"));
    assertThat(c.dims.size(), is(1));
    assertThat(c.dims.get(0).var, nullValue());
    assertThat(c.value.op, is(Op.ARRAY));

    final Ast.ParamDecl n = parse("int n = ...");
    assertThat(n.dims.size(), is(0));
    assertThat(n.value, nullValue());

    final Ast.ParamDecl d = parse("float d[I][I] = {{1, 2}, {3, 4}}");
    assertThat(d.dims.size(), is(2));
    assertThat(d.value.toString(), is("[[1, 2], [3, 4]]"));

    final Ast.ParamDecl t = parse("float t[i in I] = 2 * i");
    assertThat(t.dims.get(0).var, is("i"));
    assertThat(t.value.toString(), is("2 * i"));

    // A tuple type is a type name too.
    final Ast.ParamDecl a = parse("Arc best = <1, 2>");
    assertThat(a.type, is("Arc"));
  }

  @Test void testDvar() {
    final Ast.DvarDecl x = parse("dvar float+ x[I, I] in 0..10");
    assertThat(x.type, is("float"));
    assertThat(x.sign, is("+"));
    assertThat(x.dims.size(), is(2));
    assertThat(x.lo.toString(), is("0"));
    assertThat(x.hi.toString(), is("10"));

    final Ast.DvarDecl z = parse("dvar int- z");
    assertThat(z.sign, is("-"));
    assertThat(z.lo, nullValue());

    final Ast.DvarDecl b = parse("dvar boolean b[I]");
    assertThat(b.sign, is(""));
  }

  @Test void testDexpr() {
    final Ast.DexprDecl total = parse("dexpr float total = sum(i in I) y[i]");
    assertThat(total.name, is("total"));
    assertThat(total.index, nullValue());
    assertThat(total.exp.op, is(Op.SUM));

    final Ast.DexprDecl flow = parse("dexpr float flow[i in I] = y[i]");
    assertThat(flow.index.var, is("i"));

    // Within its own definition, the name is a decision expression.
    final Ast.DexprDecl self = parse("dexpr float s = s + 1");
    assertThat(((Ast.InfixCall) self.exp).a0.op, is(Op.DEXPR));
  }

  @Test void testObjective() {
    final Ast.ObjectiveDecl min = parse("minimize cost: 2 * y");
    assertThat(min.maximize, is(false));
    assertThat(min.name, is("cost"));
    assertThat(min.exp.toString(), is("2 * y"));

    final Ast.ObjectiveDecl max = parse("maximize y");
    assertThat(max.maximize, is(true));
    assertThat(max.name, nullValue());
  }

  @Test void testConstraint() {
    final Ast.ConstraintDecl c = parse("c1: y + 1 <= 2 * z");
    assertThat(c.label, is("c1"));
    assertThat(c.relOp, is(Op.LE));
    assertThat(c.lhs.toString(), is("y + 1"));
    assertThat(c.rhs.toString(), is("2 * z"));

    final Ast.ConstraintDecl unlabeled = parse("y ≥ 3");
    assertThat(unlabeled.label, nullValue());
    assertThat(unlabeled.relOp, is(Op.GE));
  }

  @Test void testForall() {
    final Ast.ForallDecl forall =
        parse("forall(i in I, j in I: i != j) { a: y <= 1; z >= 2; }");
    assertThat(forall.iterators.size(), is(2));
    assertThat(forall.filter, notNullValue());
    assertThat(forall.body.size(), is(2));
    assertThat(((Ast.ConstraintDecl) forall.body.get(0)).label, is("a"));
    assertThat(((Ast.ConstraintDecl) forall.body.get(1)).label, nullValue());

    final Ast.ForallDecl labeled = parse("forall(i in I) cap: y <= 1");
    assertThat(((Ast.ConstraintDecl) labeled.body.get(0)).label, is("cap"));

    final Ast.ForallDecl nested =
        parse("forall(i in I) forall(j in I: j > i) y <= 1");
    assertThat(nested.body.get(0).op, is(Op.FORALL_DECL));
  }

  /** "cap[i in I]: c" is shorthand for "forall(i in I) cap: c". */
  @Test void testIndexedConstraint() {
    final Ast.ForallDecl forall = parse("cap[i in I]: y <= 1");
    assertThat(forall.iterators.get(0).var, is("i"));
    assertThat(((Ast.ConstraintDecl) forall.body.get(0)).label, is("cap"));
  }

  @Test void testSubjectTo() {
    final List<Ast.Decl> decls =
        parseAll("subject to { y <= 1; forall(i in I) z >= 0; }");
    assertThat(decls.size(), is(2));
    assertThat(decls.get(0).op, is(Op.CONSTRAINT_DECL));
    assertThat(decls.get(1).op, is(Op.FORALL_DECL));
    assertThat(parseAll("constraints { y <= 1 }").size(), is(1));
  }

  @Test void testErrors() {
    checkFails("y != 1", "'!=' is not allowed in a constraint");
    checkFails("y + 1", "expected comparison operator");
    assertThrows(OplParseException.class, () -> parseAll("range R 1..2"));
    assertThrows(OplParseException.class, () -> parseAll("dvar float"));
    checkFails("subject { y <= 1 }", "expected 'to'");
    checkFails("forall(i in I) { }", "forall has no constraints");
    checkFails("{int} S[i in I] = {1, 2}", "expected '|'");
  }
}

// End StatementTest.java
