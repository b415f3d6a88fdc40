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

import java.util.function.Consumer;
import net.hydromatic.opl.ast.Ast;
import net.hydromatic.opl.model.LinearEquation;
import net.hydromatic.opl.model.Objective;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a statement,
   * then calls the underlying tracer. */
  public static Tracer withOnStatement(Tracer tracer,
      Consumer<Ast.Decl> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStatement(Ast.Decl decl) {
        consumer.accept(decl);
        super.onStatement(decl);
      }
    };
  }

  /** Returns a tracer that performs the given action on each equation,
   * then calls the underlying tracer. */
  public static Tracer withOnEquation(Tracer tracer,
      Consumer<LinearEquation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onEquation(LinearEquation equation) {
        consumer.accept(equation);
        super.onEquation(equation);
      }
    };
  }

  public static Tracer withOnObjective(Tracer tracer,
      Consumer<Objective> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onObjective(Objective objective) {
        consumer.accept(objective);
        super.onObjective(objective);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<@Nullable Throwable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean onException(@Nullable Throwable e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleCompileException(
          @Nullable CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onStatement(Ast.Decl decl) {
    }

    @Override public void onEquation(LinearEquation equation) {
    }

    @Override public void onObjective(Objective objective) {
    }

    @Override public boolean onException(@Nullable Throwable e) {
      return false;
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onStatement(Ast.Decl decl) {
      tracer.onStatement(decl);
    }

    @Override public void onEquation(LinearEquation equation) {
      tracer.onEquation(equation);
    }

    @Override public void onObjective(Objective objective) {
      tracer.onObjective(objective);
    }

    @Override public boolean onException(@Nullable Throwable e) {
      return tracer.onException(e);
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
