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
package net.hydromatic.opl.export;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import net.hydromatic.opl.ast.AstWriter;
import net.hydromatic.opl.eval.Prop;
import net.hydromatic.opl.eval.Session;
import net.hydromatic.opl.model.IndexedVariable;
import net.hydromatic.opl.model.LinearEquation;
import net.hydromatic.opl.model.Objective;
import net.hydromatic.opl.model.Sense;
import net.hydromatic.opl.model.Values;
import net.hydromatic.opl.model.VarKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Writes the equations and objective of a session in MPS format.
 *
 * <p>MPS minimizes, so the objective coefficients of a maximization are
 * negated. Columns of integer and boolean variables are enclosed in
 * {@code MARKER} lines. Row and column names contain only letters, digits
 * and '_'; "cap[1,2]" becomes "cap_1_2". Rows without a label are named
 * "c1", "c2", and so on. */
public class MpsWriter {
  private static final Logger LOGGER =
      Logger.getLogger(MpsWriter.class.getName());

  private static final String RHS = "RHS";
  private static final String BOUND = "BND";

  private final Session session;
  private final StringBuilder b = new StringBuilder();

  private MpsWriter(Session session) {
    this.session = requireNonNull(session);
  }

  /** Writes a session's model to a writer. */
  public static void write(Session session, Writer writer)
      throws IOException {
    writer.write(toMps(session));
    writer.flush();
  }

  /** Returns a session's model as MPS text. */
  public static String toMps(Session session) {
    return new MpsWriter(session).generate();
  }

  private String generate() {
    final Objective objective = session.objective();
    if (objective == null) {
      LOGGER.warning("model has no objective; writing an empty objective row");
    }
    final List<LinearEquation> equations = session.equations();
    final List<String> rowNames = rowNames(equations);
    final String objName = objective == null || objective.name == null
        ? "obj" : sanitize(objective.name);

    b.append(Strings.padEnd("NAME", 14, ' '))
        .append(Prop.MODEL_NAME.stringValue(session.map)).append('\n');

    b.append("ROWS\n");
    b.append(" N  ").append(objName).append('\n');
    for (int i = 0; i < equations.size(); i++) {
      b.append(' ').append(equations.get(i).op.mpsType).append("  ")
          .append(rowNames.get(i)).append('\n');
    }

    b.append("COLUMNS\n");
    final Map<String, VarKind> columns = columns(equations, objective);
    boolean integral = false;
    int marker = 0;
    for (Map.Entry<String, VarKind> column : columns.entrySet()) {
      final String name = column.getKey();
      if (column.getValue().isIntegral() != integral) {
        integral = !integral;
        marker(marker++, integral ? "'INTORG'" : "'INTEND'");
      }
      if (objective != null) {
        final double c = objective.coefficient(name);
        if (!Values.isZero(c)) {
          entry(sanitize(name), objName,
              objective.sense == Sense.MAXIMIZE ? -c : c);
        }
      }
      for (int i = 0; i < equations.size(); i++) {
        final double c = equations.get(i).coefficient(name);
        if (!Values.isZero(c)) {
          entry(sanitize(name), rowNames.get(i), c);
        }
      }
    }
    if (integral) {
      marker(marker, "'INTEND'");
    }

    b.append("RHS\n");
    if (objective != null && !Values.isZero(objective.constantValue())) {
      // The objective row's RHS is minus its constant.
      final double c = objective.constantValue();
      entry(RHS, objName, objective.sense == Sense.MAXIMIZE ? c : -c);
    }
    for (int i = 0; i < equations.size(); i++) {
      final double c = equations.get(i).constantValue();
      if (!Values.isZero(c)) {
        entry(RHS, rowNames.get(i), c);
      }
    }

    // Only columns that appear in COLUMNS have bounds.
    b.append("BOUNDS\n");
    for (IndexedVariable variable : session.registry.variables()) {
      for (String name : variable.columnNames(session.evaluator())) {
        if (columns.containsKey(name)) {
          bounds(variable, sanitize(name));
        }
      }
    }
    b.append("ENDATA\n");
    return b.toString();
  }

  private void bounds(IndexedVariable variable, String column) {
    final @Nullable Double lower = variable.lowerBound;
    final @Nullable Double upper = variable.upperBound;
    if (variable.kind == VarKind.BOOLEAN
        && lower != null && lower == 0d
        && upper != null && upper == 1d) {
      bound("BV", column, null);
      return;
    }
    if (lower == null && upper == null) {
      bound("FR", column, null);
      return;
    }
    if (lower == null) {
      bound("MI", column, null);
    } else if (lower != 0d) {
      bound("LO", column, lower);
    }
    if (upper != null) {
      bound("UP", column, upper);
    }
  }

  /** Returns the columns in declaration order, then any that occur only in
   * equations. */
  private Map<String, VarKind> columns(List<LinearEquation> equations,
      @Nullable Objective objective) {
    final Map<String, VarKind> columns = new LinkedHashMap<>();
    for (IndexedVariable variable : session.registry.variables()) {
      for (String name : variable.columnNames(session.evaluator())) {
        columns.put(name, variable.kind);
      }
    }
    final Set<String> used = new LinkedHashSet<>();
    if (objective != null) {
      used.addAll(objective.coefficients.keySet());
    }
    equations.forEach(e -> used.addAll(e.coefficients.keySet()));
    used.forEach(name -> columns.putIfAbsent(name, VarKind.FLOAT));
    return columns;
  }

  /** Returns a unique name for each row. */
  static List<String> rowNames(List<LinearEquation> equations) {
    final List<String> names = new ArrayList<>();
    final Set<String> used = new HashSet<>();
    for (int i = 0; i < equations.size(); i++) {
      final String id = equations.get(i).fullIdentifier();
      final String base = id == null ? "c" + (i + 1) : sanitize(id);
      String name = base;
      for (int k = 1; !used.add(name); k++) {
        name = base + "_" + k;
      }
      names.add(name);
    }
    return names;
  }

  /** Converts a name to one that MPS accepts, e.g. "cap[1,2]" to
   * "cap_1_2". */
  static String sanitize(String name) {
    final StringBuilder s = new StringBuilder();
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_') {
        s.append(c);
      } else if ((c == '[' || c == ',') && i < name.length() - 1) {
        s.append('_');
      }
    }
    if (s.length() == 0 || !Character.isLetter(s.charAt(0))) {
      s.insert(0, 'V');
    }
    return s.toString();
  }

  private void marker(int n, String kind) {
    b.append("    ").append(Strings.padEnd("MARKER" + n, 10, ' '))
        .append(" 'MARKER'                 ").append(kind).append('\n');
  }

  private void entry(String column, String row, double value) {
    b.append("    ").append(Strings.padEnd(column, 10, ' ')).append(' ')
        .append(Strings.padEnd(row, 10, ' ')).append(' ')
        .append(AstWriter.formatNumber(value)).append('\n');
  }

  private void bound(String type, String column, @Nullable Double value) {
    b.append(' ').append(type).append(' ')
        .append(Strings.padEnd(BOUND, 10, ' ')).append(' ');
    if (value == null) {
      b.append(column);
    } else {
      b.append(Strings.padEnd(column, 10, ' ')).append(' ')
          .append(AstWriter.formatNumber(value));
    }
    b.append('\n');
  }
}

// End MpsWriter.java
