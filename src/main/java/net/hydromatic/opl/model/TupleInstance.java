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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.opl.compile.CompileException.Kind.UNKNOWN_FIELD;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Objects;
import net.hydromatic.opl.compile.CompileException;

/** Instance of a tuple: a schema name and a value for each field.
 *
 * <p>Immutable. Create instances via {@link TupleSchema#instance}. */
public class TupleInstance {
  public final String schemaName;
  private final ImmutableMap<String, Object> fields;
  private final ImmutableList<String> keyNames;

  TupleInstance(TupleSchema schema, ImmutableMap<String, Object> fields) {
    this.schemaName = schema.name;
    this.fields = requireNonNull(fields);
    final ImmutableList.Builder<String> keyNames = ImmutableList.builder();
    schema.keyFields.forEach(f -> keyNames.add(f.name));
    this.keyNames = keyNames.build();
  }

  /** Returns the value of a field; throws
   * {@link CompileException.Kind#UNKNOWN_FIELD} if there is no such field. */
  public Object field(String name) {
    final Object value = fields.get(name);
    if (value == null) {
      throw new CompileException(UNKNOWN_FIELD,
          "tuple '" + schemaName + "' has no field '" + name + "'");
    }
    return value;
  }

  /** Returns the values of the key fields, in key order. */
  public List<Object> keyValues() {
    final ImmutableList.Builder<Object> values = ImmutableList.builder();
    keyNames.forEach(name -> values.add(fields.get(name)));
    return values.build();
  }

  /** Returns whether the key fields equal the given values. */
  public boolean matchesKey(List<?> keys) {
    if (keys.size() != keyNames.size()) {
      return false;
    }
    for (int i = 0; i < keys.size(); i++) {
      if (!Values.equal(fields.get(keyNames.get(i)), keys.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the key as text, e.g. "1_2"; used to name variables and to
   * store values of parameters indexed by a tuple set. */
  public String key() {
    return Values.joinKey(keyValues());
  }

  @Override public int hashCode() {
    return Objects.hash(schemaName, fields);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof TupleInstance
        && schemaName.equals(((TupleInstance) o).schemaName)
        && fields.equals(((TupleInstance) o).fields);
  }

  @Override public String toString() {
    final ImmutableList.Builder<String> values = ImmutableList.builder();
    fields.values().forEach(v ->
        values.add(v instanceof String ? "\"" + v + "\"" : Values.keyOf(v)));
    return "<" + Joiner.on(", ").join(values.build()) + ">";
  }
}

// End TupleInstance.java
