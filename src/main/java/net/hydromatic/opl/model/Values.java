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

import com.google.common.base.Joiner;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.opl.ast.AstWriter;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.compile.CompileException;

/** Utilities for values.
 *
 * <p>A value is a {@link Number} (an {@link Integer} element of an integer
 * set, or a {@link Double} computed by arithmetic), a {@link String}, or a
 * {@link TupleInstance}. Booleans are the numbers 0 and 1. */
public abstract class Values {
  /** Tolerance for numeric equality and for truth tests. */
  public static final double TOLERANCE = 1e-10;

  private static final Joiner KEY_JOINER = Joiner.on('_');

  private Values() {}

  /** Returns whether a number is "true", that is, within tolerance of 1. */
  public static boolean isTrue(double d) {
    return Math.abs(d - 1d) < TOLERANCE;
  }

  /** Converts a boolean to 1 or 0. */
  public static double of(boolean b) {
    return b ? 1d : 0d;
  }

  /** Returns whether a number is zero, within tolerance. */
  public static boolean isZero(double d) {
    return Math.abs(d) < TOLERANCE;
  }

  /** Converts a value to a number, or throws
   * {@link CompileException.Kind#TYPE_COERCION_FAILED}. */
  public static double toDouble(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return of((Boolean) value);
    }
    throw new CompileException(TYPE_COERCION_FAILED,
        "cannot convert " + describe(value) + " to a number");
  }

  /** Rounds a number to the nearest {@code int}, or throws
   * {@link CompileException.Kind#TYPE_COERCION_FAILED} if it is not finite
   * or is too large. */
  public static int toInt(double d, Pos pos) {
    if (Double.isNaN(d)) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "cannot convert NaN to an integer", pos);
    }
    try {
      return Ints.checkedCast(Math.round(d));
    } catch (IllegalArgumentException e) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "integer " + describe(d) + " is out of range", pos);
    }
  }

  /** Returns the text of a value as it appears in an index key or a
   * variable name. Integral numbers have no fractional part. */
  public static String keyOf(Object value) {
    if (value instanceof Number) {
      return AstWriter.formatNumber(((Number) value).doubleValue());
    }
    if (value instanceof TupleInstance) {
      return ((TupleInstance) value).key();
    }
    return value.toString();
  }

  /** Joins index values into a storage key, e.g. [1, 2] to "1_2". */
  public static String joinKey(List<?> values) {
    final List<String> keys = new ArrayList<>();
    for (Object value : values) {
      keys.add(keyOf(value));
    }
    return KEY_JOINER.join(keys);
  }

  /** Returns the name of an element of an indexed variable; for example,
   * "x" and [1, 2] give "x1_2". */
  public static String variableName(String baseName, List<?> index) {
    return index.isEmpty() ? baseName : baseName + joinKey(index);
  }

  /** Returns whether two values are equal. Numbers are compared within
   * tolerance; a number and a string are compared by their key text. */
  public static boolean equal(Object v0, Object v1) {
    if (v0 instanceof Number && v1 instanceof Number) {
      return Math.abs(((Number) v0).doubleValue()
          - ((Number) v1).doubleValue()) < TOLERANCE;
    }
    if (v0 instanceof TupleInstance || v1 instanceof TupleInstance) {
      return v0.equals(v1);
    }
    return keyOf(v0).equals(keyOf(v1));
  }

  /** Compares two values. Numbers compare numerically, other values by
   * their key text. Tuples cannot be ordered. */
  public static int compare(Object v0, Object v1) {
    if (v0 instanceof TupleInstance || v1 instanceof TupleInstance) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "cannot order " + describe(v0) + " and " + describe(v1));
    }
    if (v0 instanceof Number && v1 instanceof Number) {
      if (equal(v0, v1)) {
        return 0;
      }
      return Double.compare(((Number) v0).doubleValue(),
          ((Number) v1).doubleValue());
    }
    return keyOf(v0).compareTo(keyOf(v1));
  }

  /** Describes a value for an error message. */
  public static String describe(Object value) {
    if (value instanceof String) {
      return "string \"" + value + "\"";
    }
    if (value instanceof TupleInstance) {
      return "tuple " + value;
    }
    return value.getClass().getSimpleName().toLowerCase(Locale.ROOT) + " "
        + value;
  }
}

// End Values.java
