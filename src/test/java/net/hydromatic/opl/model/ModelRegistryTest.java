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

import static net.hydromatic.opl.Matchers.assertThrowsKind;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import net.hydromatic.opl.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests {@link ModelRegistry}. */
class ModelRegistryTest {
  @Test void testDuplicateName() {
    final ModelRegistry registry = new ModelRegistry();
    registry.add(new IndexSet("I", 1, 3));
    assertThrowsKind(CompileException.Kind.DUPLICATE_NAME,
        () -> registry.add(
            new Parameter("I", ScalarType.INT, ImmutableList.of(), false)));
    assertThat(registry.isDeclared("I"), is(true));
    assertThat(registry.parameterOpt("I"), nullValue());
  }

  @Test void testLookup() {
    final ModelRegistry registry = new ModelRegistry();
    registry.add(new IndexSet("I", 1, 3));
    assertThat(registry.domainOpt("I"), notNullValue());
    assertThat(registry.domainOpt("J"), nullValue());
    assertThrowsKind(CompileException.Kind.DOMAIN_NOT_FOUND,
        () -> registry.domain("J"));
  }

  /** Setting a parameter recomputes the ranges that depend on it. */
  @Test void testBoundRangeIsInvalidated() {
    final ModelRegistry registry = new ModelRegistry();
    final Evaluator evaluator = new Evaluator(registry);
    registry.add(
        new Parameter("n", ScalarType.INT, ImmutableList.of(), false));
    registry.setParameter("n", 3);
    final BoundRange range =
        registry.add(
            new BoundRange("R", Parsers.parseExp(registry, "1"),
                Parsers.parseExp(registry, "n")));
    assertThat(registry.resolve("R", evaluator, new EvalEnv()),
        is(ImmutableList.<Object>of(1, 2, 3)));
    assertThat(range.isCached(), is(true));

    registry.setParameter("n", 5);
    assertThat(range.isCached(), is(false));
    assertThat(registry.resolve("R", evaluator, new EvalEnv()).size(),
        is(5));
  }

  @Test void testAddElement() {
    final ModelRegistry registry = new ModelRegistry();
    final Evaluator evaluator = new Evaluator(registry);
    registry.add(new PrimitiveSet("S", ScalarType.INT, false));
    registry.addElement("S", 2d);
    registry.addElement("S", "3");
    registry.addElement("S", 2);
    assertThat(registry.resolve("S", evaluator, new EvalEnv()),
        is(ImmutableList.<Object>of(2, 3)));

    registry.add(new IndexSet("I", 1, 3));
    assertThrowsKind(CompileException.Kind.TYPE_COERCION_FAILED,
        () -> registry.addElement("I", 4));
    assertThrowsKind(CompileException.Kind.TYPE_COERCION_FAILED,
        () -> registry.addElement("S", 2.5d));
  }

  @Test void testAddTuple() {
    final ModelRegistry registry = new ModelRegistry();
    final TupleSchema arc =
        registry.add(
            new TupleSchema("Arc",
                ImmutableList.of(
                    new TupleSchema.Field("from", ScalarType.INT, true),
                    new TupleSchema.Field("to", ScalarType.INT, true))));
    final TupleSchema node =
        registry.add(
            new TupleSchema("Node",
                ImmutableList.of(
                    new TupleSchema.Field("id", ScalarType.INT, true))));
    registry.add(new TupleSet("Arcs", arc, false));
    registry.addTuple("Arcs", arc.instance(ImmutableList.of(1, 2)));
    assertThat(registry.tupleSetOpt("Arcs").size(), is(1));
    assertThrowsKind(CompileException.Kind.TYPE_COERCION_FAILED,
        () -> registry.addTuple("Arcs", node.instance(ImmutableList.of(1))));
    assertThrowsKind(CompileException.Kind.DOMAIN_NOT_FOUND,
        () -> registry.addTuple("Nodes", node.instance(ImmutableList.of(1))));
  }

  @Test void testParameterValues() {
    final ModelRegistry registry = new ModelRegistry();
    registry.add(new IndexSet("I", 1, 2));
    registry.add(
        new Parameter("c", ScalarType.FLOAT, ImmutableList.of("I"), false));
    registry.setParameter("c", ImmutableList.of(1), 10);
    assertThat(registry.parameterOpt("c").get(ImmutableList.of(1)),
        is((Object) 10d));
    assertThrowsKind(CompileException.Kind.MISSING_INDEXED_VALUE,
        () -> registry.parameterOpt("c").get(ImmutableList.of(2)));
    assertThrowsKind(CompileException.Kind.NON_SCALAR_PARAMETER,
        () -> registry.setParameter("c", 3));
    assertThrowsKind(CompileException.Kind.UNBOUND_NAME,
        () -> registry.setParameter("d", 3));
  }
}

// End ModelRegistryTest.java
