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
package net.hydromatic.opl.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.hydromatic.opl.compile.CompileException;
import net.hydromatic.opl.compile.Compiler;
import net.hydromatic.opl.compile.Tracer;
import net.hydromatic.opl.compile.Tracers;
import net.hydromatic.opl.model.AbstractParameter;
import net.hydromatic.opl.model.DecisionExpression;
import net.hydromatic.opl.model.Domain;
import net.hydromatic.opl.model.IndexedVariable;
import net.hydromatic.opl.model.LinearEquation;
import net.hydromatic.opl.model.ModelRegistry;
import net.hydromatic.opl.model.Objective;
import net.hydromatic.opl.model.TupleSchema;
import net.hydromatic.opl.parse.OplParseException;
import net.hydromatic.opl.parse.Statements;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Compilation session.
 *
 * <p>Holds the property values, the registry of declarations, and the
 * equations and objective compiled so far. Statements compiled later see
 * the declarations of statements compiled earlier. */
public class Session {
  private static final Logger LOGGER =
      Logger.getLogger(Session.class.getName());

  /** Property values. */
  public final Map<Prop, Object> map;
  public final ModelRegistry registry = new ModelRegistry();

  private Tracer tracer = Tracers.empty();
  private @Nullable Evaluator evaluator;
  private final List<LinearEquation> equations = new ArrayList<>();
  private @Nullable Objective objective;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains property values */
  public Session(Map<Prop, Object> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a Session with default property values. */
  public Session() {
    this(new LinkedHashMap<>());
  }

  public Tracer tracer() {
    return tracer;
  }

  public void setTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the evaluator, creating it on first use. */
  public Evaluator evaluator() {
    if (evaluator == null) {
      evaluator =
          new Evaluator(registry, Prop.MAX_ITERATOR_DEPTH.intValue(map));
    }
    return evaluator;
  }

  /** Compiles the text of a model, one statement at a time.
   *
   * <p>If a statement fails, the tracer may handle the error, in which case
   * compilation continues with the next statement; otherwise the error is
   * thrown. */
  public void compile(String modelText) {
    final Compiler compiler = new Compiler(this);
    final List<String> statements = Statements.split(modelText);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("compiling " + statements.size() + " statements");
    }
    for (String statement : statements) {
      try {
        compiler.compileStatement(statement);
      } catch (CompileException e) {
        final CompileException e2 = e.withStatement(statement.trim());
        if (!tracer.handleCompileException(e2)) {
          throw e2;
        }
      } catch (OplParseException e) {
        if (!tracer.onException(e)) {
          throw e;
        }
      }
    }
  }

  /** Compiles the text of one statement. */
  public void compileStatement(String statement) {
    new Compiler(this).compileStatement(statement);
  }

  public void addEquations(List<LinearEquation> list) {
    equations.addAll(list);
  }

  /** Returns the equations compiled so far, in order of generation. */
  public List<LinearEquation> equations() {
    return ImmutableList.copyOf(equations);
  }

  public @Nullable Objective objective() {
    return objective;
  }

  /** Sets the objective, replacing any previous objective. */
  public void setObjective(Objective objective) {
    if (this.objective != null) {
      LOGGER.warning("objective '" + this.objective
          + "' is replaced by '" + objective + "'");
    }
    this.objective = requireNonNull(objective);
  }

  /** Describes the model: declarations, objective and equations. */
  public String report() {
    final StringBuilder b = new StringBuilder();
    section(b, "Domains");
    for (Domain domain : registry.domains()) {
      b.append("  ").append(domain.describe()).append('\n');
    }
    section(b, "Tuple types");
    for (TupleSchema schema : registry.schemas()) {
      b.append("  ").append(schema).append('\n');
    }
    section(b, "Parameters");
    for (AbstractParameter parameter : registry.parameters()) {
      b.append("  ").append(parameter.describe()).append('\n');
    }
    section(b, "Variables");
    for (IndexedVariable variable : registry.variables()) {
      b.append("  ").append(variable.describe()).append('\n');
    }
    section(b, "Decision expressions");
    for (DecisionExpression dexpr : registry.dexprs()) {
      b.append("  ").append(dexpr.describe()).append('\n');
    }
    section(b, "Objective");
    if (objective != null) {
      b.append("  ").append(objective).append('\n');
    }
    section(b, "Equations");
    for (LinearEquation equation : equations) {
      final String id = equation.fullIdentifier();
      b.append("  ");
      if (id != null) {
        b.append(id).append(": ");
      }
      b.append(equation).append('\n');
    }
    return b.toString();
  }

  private static void section(StringBuilder b, String title) {
    b.append(title).append(":\n");
  }
}

// End Session.java
