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
import static net.hydromatic.opl.ast.AstBuilder.ast;
import static net.hydromatic.opl.compile.CompileException.Kind.DIMENSION_MISMATCH;
import static net.hydromatic.opl.compile.CompileException.Kind.DOMAIN_NOT_FOUND;
import static net.hydromatic.opl.compile.CompileException.Kind.TYPE_COERCION_FAILED;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.ast.Op;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;
import net.hydromatic.opl.eval.Prop;
import net.hydromatic.opl.eval.Session;
import net.hydromatic.opl.model.BoundRange;
import net.hydromatic.opl.model.ComputedSet;
import net.hydromatic.opl.model.DecisionExpression;
import net.hydromatic.opl.model.IndexSet;
import net.hydromatic.opl.model.IndexedVariable;
import net.hydromatic.opl.model.LinearEquation;
import net.hydromatic.opl.model.ModelRegistry;
import net.hydromatic.opl.model.Objective;
import net.hydromatic.opl.model.Parameter;
import net.hydromatic.opl.model.PrimitiveSet;
import net.hydromatic.opl.model.RelOp;
import net.hydromatic.opl.model.ScalarType;
import net.hydromatic.opl.model.Sense;
import net.hydromatic.opl.model.TupleInstance;
import net.hydromatic.opl.model.TupleParameter;
import net.hydromatic.opl.model.TupleSchema;
import net.hydromatic.opl.model.TupleSet;
import net.hydromatic.opl.model.Values;
import net.hydromatic.opl.model.VarKind;
import net.hydromatic.opl.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Compiles statements into declarations in a {@link ModelRegistry}, linear
 * equations and an objective.
 *
 * <p>Each statement is all-or-nothing with respect to equations: the
 * equations generated by a statement are added to the session only if the
 * whole statement compiles. Declarations that precede the failing
 * declaration in the same statement stay registered. */
public class Compiler {
  private static final Logger LOGGER =
      Logger.getLogger(Compiler.class.getName());

  private final Session session;
  private final ModelRegistry registry;
  private final Evaluator evaluator;
  private final Linearizer linearizer;

  public Compiler(Session session) {
    this.session = requireNonNull(session);
    this.registry = session.registry;
    this.evaluator = session.evaluator();
    this.linearizer = new Linearizer(evaluator);
  }

  /** Compiles the text of one statement.
   *
   * <p>If property {@link Prop#SUM_EXPANSION} is
   * {@link Prop.SumExpansion#TEXTUAL TEXTUAL}, sums are expanded in the text
   * before it is parsed; decision expressions keep their sums, because
   * their iterators may be bound only when they are used. */
  public void compileStatement(String text) {
    final String expanded = preprocess(text);
    final List<Ast.Decl> decls = Parsers.parseStatement(registry, expanded);
    compile(decls);
  }

  private String preprocess(String text) {
    final Map<Prop, Object> map = session.map;
    final Prop.SumExpansion sumExpansion =
        Prop.SUM_EXPANSION.enumValue(map, Prop.SumExpansion.class);
    if (sumExpansion != Prop.SumExpansion.TEXTUAL
        || startsWithWord(text.trim(), "dexpr")) {
      return text;
    }
    String s = new SumExpander(evaluator,
        Prop.MAX_SUM_EXPANSIONS.intValue(map)).expand(text);
    if (Prop.DISTRIBUTE_COEFFICIENTS.booleanValue(map)) {
      s = ParenthesesExpander.distribute(s);
    }
    if (LOGGER.isLoggable(Level.FINER) && !s.equals(text)) {
      LOGGER.finer("expanded statement: " + s);
    }
    return s;
  }

  private static boolean startsWithWord(String s, String word) {
    return s.startsWith(word)
        && (s.length() == word.length()
            || !Character.isLetterOrDigit(s.charAt(word.length())));
  }

  /** Compiles a list of parsed declarations. Equations are committed to the
   * session after the last declaration succeeds. */
  public void compile(List<Ast.Decl> decls) {
    final List<LinearEquation> pending = new ArrayList<>();
    for (Ast.Decl decl : decls) {
      session.tracer().onStatement(decl);
      compileDecl(decl, pending);
    }
    if (!pending.isEmpty()) {
      session.addEquations(pending);
      pending.forEach(session.tracer()::onEquation);
    }
  }

  private void compileDecl(Ast.Decl decl, List<LinearEquation> pending) {
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("compile " + decl.op.name().toLowerCase(Locale.ROOT)
          + ": " + decl);
    }
    switch (decl.op) {
    case RANGE_DECL:
      compileRange((Ast.RangeDecl) decl);
      break;
    case SET_DECL:
      compileSet((Ast.SetDecl) decl);
      break;
    case TUPLE_DECL:
      compileTuple((Ast.TupleDecl) decl);
      break;
    case COMPUTED_SET_DECL:
      final Ast.ComputedSetDecl c = (Ast.ComputedSetDecl) decl;
      registry.add(
          new ComputedSet(c.name, c.elementType, c.outer, c.output,
              c.iterators, c.filter));
      break;
    case PARAM_DECL:
      compileParam((Ast.ParamDecl) decl);
      break;
    case DVAR_DECL:
      compileDvar((Ast.DvarDecl) decl);
      break;
    case DEXPR_DECL:
      final Ast.DexprDecl d = (Ast.DexprDecl) decl;
      registry.add(
          new DecisionExpression(d.name, scalarType(d.type, d), d.exp,
              d.index));
      break;
    case OBJECTIVE_DECL:
      compileObjective((Ast.ObjectiveDecl) decl);
      break;
    case CONSTRAINT_DECL:
      pending.add(
          equation((Ast.ConstraintDecl) decl, new EvalEnv(), null, null));
      break;
    case FORALL_DECL:
      final int before = pending.size();
      forall((Ast.ForallDecl) decl, new EvalEnv(), pending);
      if (LOGGER.isLoggable(Level.FINE)) {
        LOGGER.fine("forall generated " + (pending.size() - before)
            + " equations");
      }
      break;
    default:
      throw new AssertionError("unknown declaration " + decl.op);
    }
  }

  private void compileRange(Ast.RangeDecl decl) {
    if (decl.lo.op == Op.NUMBER_LITERAL && decl.hi.op == Op.NUMBER_LITERAL) {
      registry.add(
          new IndexSet(decl.name, intValue(decl.lo), intValue(decl.hi)));
    } else {
      registry.add(new BoundRange(decl.name, decl.lo, decl.hi));
    }
  }

  private static int intValue(Ast.Exp exp) {
    return Values.toInt(((Ast.Literal) exp).doubleValue(), exp.pos);
  }

  private void compileSet(Ast.SetDecl decl) {
    final boolean external = decl.elements == null;
    final TupleSchema schema = registry.schemaOpt(decl.elementType);
    if (schema != null) {
      registry.add(new TupleSet(decl.name, schema, external));
      if (decl.elements != null) {
        for (Ast.Exp element : decl.elements) {
          registry.addTuple(decl.name, tuple(schema, element));
        }
      }
      return;
    }
    final ScalarType type = scalarType(decl.elementType, decl);
    if (type == ScalarType.BOOL) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "set '" + decl.name + "' cannot have elements of type bool",
          decl.pos);
    }
    registry.add(new PrimitiveSet(decl.name, type, external));
    if (decl.elements != null) {
      final EvalEnv env = new EvalEnv();
      for (Ast.Exp element : decl.elements) {
        registry.addElement(decl.name,
            evaluator.evaluateValue(element, env));
      }
    }
  }

  /** Evaluates a tuple expression, such as "&lt;1, 2, 7&gt;", as an
   * instance of a schema. */
  private TupleInstance tuple(TupleSchema schema, Ast.Exp exp) {
    final Object value = evaluator.evaluateValue(exp, new EvalEnv());
    if (value instanceof TupleInstance) {
      return (TupleInstance) value;
    }
    if (value instanceof List) {
      try {
        return schema.instance((List<?>) value);
      } catch (CompileException e) {
        throw e.withPos(exp.pos);
      }
    }
    throw new CompileException(TYPE_COERCION_FAILED,
        "expected a tuple of type '" + schema.name + "', got "
            + Values.describe(value), exp.pos);
  }

  private void compileTuple(Ast.TupleDecl decl) {
    final ImmutableList.Builder<TupleSchema.Field> fields =
        ImmutableList.builder();
    for (Ast.FieldDecl field : decl.fields) {
      fields.add(
          new TupleSchema.Field(field.name, scalarType(field.type, field),
              field.key));
    }
    registry.add(new TupleSchema(decl.name, fields.build()));
  }

  private void compileParam(Ast.ParamDecl decl) {
    final List<String> domains = domainNames(decl.name, decl.dims);
    final boolean external = decl.value == null;
    final TupleSchema schema = registry.schemaOpt(decl.type);
    if (schema != null) {
      registry.add(
          new TupleParameter(decl.name, schema, domains, external));
    } else {
      registry.add(
          new Parameter(decl.name, scalarType(decl.type, decl), domains,
              external));
    }
    if (decl.value == null) {
      return;
    }
    final EvalEnv env = new EvalEnv();
    if (decl.dims.isEmpty()) {
      registry.setParameter(decl.name,
          evaluator.evaluateValue(decl.value, env));
      return;
    }
    final List<Ast.Iterator> iterators = dimIterators(decl.dims);
    if (decl.value instanceof Ast.Array) {
      final List<Ast.Exp> leaves = new ArrayList<>();
      flatten((Ast.Array) decl.value, leaves);
      final List<List<Object>> indexes = new ArrayList<>();
      evaluator.expander().expand(iterators, null, env, e ->
          indexes.add(currentIndex(iterators, e)));
      if (leaves.size() != indexes.size()) {
        throw new CompileException(DIMENSION_MISMATCH,
            "parameter '" + decl.name + "' has " + indexes.size()
                + " elements, but " + leaves.size() + " values were given",
            decl.value.pos);
      }
      for (int i = 0; i < leaves.size(); i++) {
        registry.setParameter(decl.name, indexes.get(i),
            evaluator.evaluateValue(leaves.get(i), env));
      }
      return;
    }
    // One value per index, evaluated with the index variables bound.
    final List<List<Object>> indexes = new ArrayList<>();
    final List<Object> values = new ArrayList<>();
    final Ast.Exp value = decl.value;
    evaluator.expander().expand(iterators, null, env, e -> {
      indexes.add(currentIndex(iterators, e));
      values.add(evaluator.evaluateValue(value, e));
    });
    for (int i = 0; i < indexes.size(); i++) {
      registry.setParameter(decl.name, indexes.get(i), values.get(i));
    }
  }

  /** Returns the iterators that enumerate a declaration's dimensions. A
   * dimension without a variable, as in "float c[I]", gets a variable that
   * no model can mention. */
  private static List<Ast.Iterator> dimIterators(List<Ast.Iterator> dims) {
    final ImmutableList.Builder<Ast.Iterator> b = ImmutableList.builder();
    for (int i = 0; i < dims.size(); i++) {
      final Ast.Iterator dim = dims.get(i);
      b.add(dim.var != null ? dim
          : ast.iterator(dim.pos, "$" + i, dim.domain, dim.filter));
    }
    return b.build();
  }

  private static List<Object> currentIndex(List<Ast.Iterator> iterators,
      EvalEnv env) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (Ast.Iterator iterator : iterators) {
      b.add(requireNonNull(env.getOpt(requireNonNull(iterator.var))));
    }
    return b.build();
  }

  private static void flatten(Ast.Array array, List<Ast.Exp> leaves) {
    for (Ast.Exp arg : array.args) {
      if (arg instanceof Ast.Array) {
        flatten((Ast.Array) arg, leaves);
      } else {
        leaves.add(arg);
      }
    }
  }

  /** Returns the names of the domains that index a parameter or variable.
   * Each must be a declared set or range. */
  private List<String> domainNames(String name, List<Ast.Iterator> dims) {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Ast.Iterator dim : dims) {
      if (!(dim.domain instanceof Ast.NamedDomain)
          || ((Ast.NamedDomain) dim.domain).index != null) {
        throw new CompileException(DOMAIN_NOT_FOUND,
            "dimension " + dim.domain + " of '" + name
                + "' must be a declared set or range", dim.pos);
      }
      final String domainName = ((Ast.NamedDomain) dim.domain).name;
      if (registry.domainOpt(domainName) == null) {
        throw new CompileException(DOMAIN_NOT_FOUND,
            "domain '" + domainName + "' not found", dim.pos);
      }
      names.add(domainName);
    }
    return names.build();
  }

  private void compileDvar(Ast.DvarDecl decl) {
    final VarKind kind = VarKind.of(decl.type);
    if (kind == null) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "unknown variable type '" + decl.type + "'", decl.pos);
    }
    if (decl.dims.size() > 2) {
      throw new CompileException(DIMENSION_MISMATCH,
          "variable '" + decl.name + "' has " + decl.dims.size()
              + " dimensions; at most 2 are allowed", decl.pos);
    }
    final List<String> domains = domainNames(decl.name, decl.dims);
    @Nullable Double lower = null;
    @Nullable Double upper = null;
    if (kind == VarKind.BOOLEAN) {
      lower = 0d;
      upper = 1d;
    }
    if (decl.lo != null && decl.hi != null) {
      final EvalEnv env = new EvalEnv();
      lower = evaluator.evaluate(decl.lo, env);
      upper = evaluator.evaluate(decl.hi, env);
    }
    if (decl.sign.equals("+")) {
      lower = lower == null ? 0d : Math.max(lower, 0d);
    } else if (decl.sign.equals("-")) {
      upper = upper == null ? 0d : Math.min(upper, 0d);
    }
    registry.add(new IndexedVariable(decl.name, kind, domains, lower, upper));
  }

  private void compileObjective(Ast.ObjectiveDecl decl) {
    final Linear linear = linearizer.linearize(decl.exp);
    final Objective objective =
        new Objective(decl.maximize ? Sense.MAXIMIZE : Sense.MINIMIZE,
            linear.coefficientExps(), linear.constantExp(), decl.name);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("objective: " + objective);
    }
    session.setObjective(objective);
    session.tracer().onObjective(objective);
  }

  /** Expands a forall, adding one equation per combination of iterator
   * values to {@code pending}. The equation's indexes are the keys of the
   * outermost two bound values. */
  private void forall(Ast.ForallDecl forall, EvalEnv env,
      List<LinearEquation> pending) {
    evaluator.expander().expand(forall.iterators, forall.filter, env, e -> {
      for (Ast.Decl decl : forall.body) {
        if (decl instanceof Ast.ForallDecl) {
          forall((Ast.ForallDecl) decl, e, pending);
        } else {
          final Ast.ConstraintDecl constraint = (Ast.ConstraintDecl) decl;
          final List<String> keys = new ArrayList<>();
          e.visit((name, value) -> keys.add(Values.keyOf(value)));
          pending.add(
              equation(constraint, e,
                  keys.isEmpty() ? null : keys.get(0),
                  keys.size() < 2 ? null : keys.get(1)));
        }
      }
    });
  }

  /** Converts a constraint into an equation, with the constant on the
   * right-hand side. */
  private LinearEquation equation(Ast.ConstraintDecl constraint, EvalEnv env,
      @Nullable String index, @Nullable String secondIndex) {
    final Linear lhs = linearizer.linearize(constraint.lhs, env);
    final Linear rhs = linearizer.linearize(constraint.rhs, env);
    final Linear diff = lhs.minus(rhs);
    // "+ 0d" turns -0.0 into 0.0
    final double constant = -diff.constant + 0d;
    final String label = constraint.label;
    final LinearEquation equation =
        new LinearEquation(diff.coefficientExps(), ast.numberLiteral(constant),
            RelOp.of(constraint.relOp), label, label, index, secondIndex);
    if (LOGGER.isLoggable(Level.FINER)) {
      LOGGER.finer("equation: " + equation);
    }
    return equation;
  }

  private static ScalarType scalarType(String typeName, Ast.Decl decl) {
    final ScalarType type = ScalarType.lookup(typeName);
    if (type == null) {
      throw new CompileException(TYPE_COERCION_FAILED,
          "unknown type '" + typeName + "'", decl.pos);
    }
    return type;
  }
}

// End Compiler.java
