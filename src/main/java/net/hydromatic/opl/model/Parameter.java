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

import java.util.List;

/** Parameter of scalar type: int, float, string or bool. */
public class Parameter extends AbstractParameter {
  public final ScalarType type;

  public Parameter(String name, ScalarType type, List<String> domains,
      boolean external) {
    super(name, domains, external);
    this.type = requireNonNull(type);
  }

  @Override protected Object coerce(Object value) {
    return type.coerce(value);
  }

  @Override public String typeName() {
    return type.lowerName();
  }
}

// End Parameter.java
