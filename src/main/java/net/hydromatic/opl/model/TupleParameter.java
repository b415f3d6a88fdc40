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
import static net.hydromatic.opl.compile.CompileException.Kind.TYPE_COERCION_FAILED;

import java.util.List;
import net.hydromatic.opl.compile.CompileException;

/** Parameter whose values are tuples of one schema, e.g.
 * "ArcT at[a in Arcs][t in T] = item(ArcTs, &lt;a.id, t&gt;)". */
public class TupleParameter extends AbstractParameter {
  public final TupleSchema schema;

  public TupleParameter(String name, TupleSchema schema, List<String> domains,
      boolean external) {
    super(name, domains, external);
    this.schema = requireNonNull(schema);
  }

  /** Accepts a tuple of this parameter's schema, or a list of field values
   * such as the value of "&lt;1, 2, 7&gt;". */
  @Override protected Object coerce(Object value) {
    if (value instanceof TupleInstance
        && ((TupleInstance) value).schemaName.equals(schema.name)) {
      return value;
    }
    if (value instanceof List) {
      return schema.instance((List<?>) value);
    }
    throw new CompileException(TYPE_COERCION_FAILED,
        "parameter '" + name + "' requires a tuple of type '" + schema.name
            + "', got " + Values.describe(value));
  }

  @Override public String typeName() {
    return schema.name;
  }
}

// End TupleParameter.java
