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
import static net.hydromatic.opl.compile.CompileException.Kind.DIMENSION_MISMATCH;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.opl.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a tuple type: an ordered list of typed fields, some of
 * which are keys. */
public class TupleSchema {
  public final String name;
  public final List<Field> fields;
  /** Key fields, in declaration order. If no field is marked as a key, every
   * field is a key. */
  public final List<Field> keyFields;

  public TupleSchema(String name, List<Field> fields) {
    this.name = requireNonNull(name);
    this.fields = ImmutableList.copyOf(fields);
    final Set<String> names = new HashSet<>();
    final ImmutableList.Builder<Field> keys = ImmutableList.builder();
    for (Field field : fields) {
      checkArgument(names.add(field.name),
          "duplicate field '%s' in tuple '%s'", field.name, name);
      if (field.key) {
        keys.add(field);
      }
    }
    final ImmutableList<Field> keyList = keys.build();
    this.keyFields = keyList.isEmpty() ? this.fields : keyList;
  }

  /** Returns the field with a given name, or null. */
  public @Nullable Field fieldOpt(String fieldName) {
    for (Field field : fields) {
      if (field.name.equals(fieldName)) {
        return field;
      }
    }
    return null;
  }

  /** Creates an instance from field values in declaration order. */
  public TupleInstance instance(List<?> values) {
    if (values.size() != fields.size()) {
      throw new CompileException(DIMENSION_MISMATCH,
          "tuple '" + name + "' has " + fields.size() + " fields, but "
              + values.size() + " values were given");
    }
    final ImmutableMap.Builder<String, Object> map = ImmutableMap.builder();
    for (int i = 0; i < fields.size(); i++) {
      final Field field = fields.get(i);
      map.put(field.name, field.type.coerce(values.get(i)));
    }
    return new TupleInstance(this, map.build());
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder("tuple ").append(name)
        .append(" {");
    for (Field field : fields) {
      b.append(field.key ? " key " : " ")
          .append(field.type.lowerName())
          .append(' ')
          .append(field.name)
          .append(';');
    }
    return b.append(" }").toString();
  }

  /** Field of a tuple. */
  public static class Field {
    public final String name;
    public final ScalarType type;
    public final boolean key;

    public Field(String name, ScalarType type, boolean key) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.key = key;
    }
  }
}

// End TupleSchema.java
