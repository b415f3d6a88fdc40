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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Ordered collection of tuples that share one schema, e.g.
 * "{Arc} Arcs = {&lt;1, 2, 7&gt;}". */
public class TupleSet extends Domain {
  public final TupleSchema schema;
  public final boolean external;
  private final List<TupleInstance> tuples = new ArrayList<>();

  public TupleSet(String name, TupleSchema schema, boolean external) {
    super(name);
    this.schema = requireNonNull(schema);
    this.external = external;
  }

  /** Adds a tuple. Package-private; call {@link ModelRegistry#addTuple} to
   * load data. */
  void add(TupleInstance tuple) {
    checkArgument(tuple.schemaName.equals(schema.name),
        "tuple %s does not belong to set %s of %s", tuple, name, schema.name);
    tuples.add(tuple);
  }

  public int size() {
    return tuples.size();
  }

  @Override public List<Object> elements(Evaluator evaluator, EvalEnv env) {
    return ImmutableList.copyOf(tuples);
  }

  /** Returns the first tuple whose key fields equal the given values, in
   * schema key order; or null if there is none. */
  public @Nullable TupleInstance findByKey(List<?> keys) {
    for (TupleInstance tuple : tuples) {
      if (tuple.matchesKey(keys)) {
        return tuple;
      }
    }
    return null;
  }

  @Override public String describe() {
    return "{" + schema.name + "} " + name + " = "
        + (external && tuples.isEmpty() ? "..." : tuples.size() + " tuples");
  }
}

// End TupleSet.java
