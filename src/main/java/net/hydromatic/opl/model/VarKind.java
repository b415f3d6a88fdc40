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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Numeric kind of a decision variable. */
public enum VarKind {
  FLOAT,
  INTEGER,
  BOOLEAN;

  /** Returns the kind declared by a type name ("float", "int" or "bool"),
   * or null. */
  public static @Nullable VarKind of(String typeName) {
    switch (typeName) {
    case "float":
      return FLOAT;
    case "int":
      return INTEGER;
    case "bool":
    case "boolean":
      return BOOLEAN;
    default:
      return null;
    }
  }

  /** Whether a solver must give this variable an integral value. */
  public boolean isIntegral() {
    return this != FLOAT;
  }
}

// End VarKind.java
