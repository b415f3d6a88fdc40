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
package net.hydromatic.opl.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import net.hydromatic.opl.ast.Pos;
import net.hydromatic.opl.util.OplException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An error occurred while compiling a model statement.
 *
 * <p>Every error has a {@link Kind}. If it occurred while iterators were
 * bound, it also records those bindings, so that the message says which
 * iteration failed. */
public class CompileException extends RuntimeException
    implements OplException {
  private final Kind kind;
  private final Pos pos;
  private final @Nullable String bindings;
  private final @Nullable String statement;

  public CompileException(Kind kind, String message, Pos pos) {
    this(kind, message, pos, null, null);
  }

  public CompileException(Kind kind, String message) {
    this(kind, message, Pos.ZERO, null, null);
  }

  private CompileException(Kind kind, String message, Pos pos,
      @Nullable String bindings, @Nullable String statement) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
    this.bindings = bindings;
    this.statement = statement;
  }

  private CompileException copy(Pos pos, @Nullable String bindings,
      @Nullable String statement) {
    final CompileException e =
        new CompileException(kind, super.getMessage(), pos, bindings,
            statement);
    e.setStackTrace(getStackTrace());
    return e;
  }

  /** Returns a copy of this exception that records the iterator bindings
   * active when it was thrown; or this exception, if it already has
   * bindings. The innermost bindings are the most specific. */
  public CompileException withBindings(String bindings) {
    if (this.bindings != null || bindings.isEmpty()) {
      return this;
    }
    return copy(pos, bindings, statement);
  }

  /** Returns a copy of this exception that records the text of the
   * statement being compiled; or this exception, if it already has one. */
  public CompileException withStatement(String statement) {
    if (this.statement != null) {
      return this;
    }
    return copy(pos, bindings, statement);
  }

  /** Returns a copy of this exception at a given position, if it has no
   * position yet; otherwise this exception. */
  public CompileException withPos(Pos pos) {
    if (!this.pos.equals(Pos.ZERO)) {
      return this;
    }
    return copy(pos, bindings, statement);
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the bindings that were active, e.g. "i=1, j=2", or null. */
  public @Nullable String bindings() {
    return bindings;
  }

  /** Returns the text of the statement that failed, or null. */
  public @Nullable String statement() {
    return statement;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public String getMessage() {
    final String message = super.getMessage();
    return bindings == null ? message : message + " [" + bindings + "]";
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    pos.describeTo(buf)
        .append(" Error: ")
        .append(kind.camelName)
        .append(": ")
        .append(getMessage());
    if (statement != null) {
      buf.append(" in statement '").append(statement).append("'");
    }
    return buf;
  }

  /** Kind of compilation error. */
  public enum Kind {
    /** A name used as an iteration domain is not a set or range. */
    DOMAIN_NOT_FOUND,
    /** An indexed family of sets was used without its outer index. */
    MISSING_OUTER_INDEX,
    /** A name is neither bound nor declared. */
    UNBOUND_NAME,
    /** Wrong number of indexes, or too many nested iterators. */
    DIMENSION_MISMATCH,
    /** An indexed parameter has no value for the requested index. */
    MISSING_INDEXED_VALUE,
    /** An indexed parameter was used without indexes. */
    NON_SCALAR_PARAMETER,
    /** An expression is not affine in the decision variables. */
    NON_LINEAR_TERM,
    /** A decision expression refers to itself, directly or indirectly. */
    CYCLIC_DECISION_EXPRESSION,
    /** {@code item} found no tuple with the requested key. */
    KEY_LOOKUP_FAILED,
    /** A tuple has no field of the requested name. */
    UNKNOWN_FIELD,
    /** A value has the wrong type, for example a string used as a number. */
    TYPE_COERCION_FAILED,
    /** A name is declared twice. */
    DUPLICATE_NAME;

    /** Name in upper-camel case, e.g. "NonLinearTerm". */
    public final String camelName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
  }
}

// End CompileException.java
