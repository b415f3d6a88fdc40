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

import static net.hydromatic.opl.compile.CompileException.Kind.TYPE_COERCION_FAILED;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import java.util.Locale;
import net.hydromatic.opl.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type of a parameter, of a set element, or of a tuple field. */
public enum ScalarType {
  INT,
  FLOAT,
  STRING,
  BOOL;

  /** Returns the type with a given name, e.g. "float", or null. */
  public static @Nullable ScalarType lookup(String name) {
    final Optional<ScalarType> type =
        Enums.getIfPresent(ScalarType.class, name.toUpperCase(Locale.ROOT));
    return type.orNull();
  }

  /** Converts a value to this type.
   *
   * <p>Integers become {@link Integer}, floats and booleans become
   * {@link Double}. Strings that look like numbers are accepted for numeric
   * types. */
  public Object coerce(Object value) {
    switch (this) {
    case STRING:
      if (value instanceof TupleInstance) {
        break;
      }
      return Values.keyOf(value);
    case INT:
      final double d = number(value);
      if (d != Math.rint(d)) {
        break;
      }
      return (int) d;
    case FLOAT:
      return number(value);
    case BOOL:
      final double b = number(value);
      if (b != 0d && b != 1d) {
        break;
      }
      return b;
    default:
      throw new AssertionError(this);
    }
    throw new CompileException(TYPE_COERCION_FAILED,
        "cannot convert " + Values.describe(value) + " to " + lowerName());
  }

  private double number(Object value) {
    if (value instanceof String) {
      try {
        return Double.parseDouble((String) value);
      } catch (NumberFormatException e) {
        throw new CompileException(TYPE_COERCION_FAILED,
            "cannot convert " + Values.describe(value) + " to "
                + lowerName());
      }
    }
    return Values.toDouble(value);
  }

  /** Returns the name as written in a model, e.g. "float". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End ScalarType.java
