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
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;

/** Named collection that an iterator can range over.
 *
 * <p>Every domain produces its elements in a deterministic order: ascending
 * for integer ranges, insertion order for explicit sets, and enumeration
 * order for computed sets. */
public abstract class Domain {
  public final String name;

  protected Domain(String name) {
    this.name = requireNonNull(name);
  }

  /** Returns the elements of this domain.
   *
   * @param evaluator Evaluator, for domains defined by expressions
   * @param env Bindings of iterator variables that are currently in scope
   */
  public abstract List<Object> elements(Evaluator evaluator, EvalEnv env);

  /** Discards any cached elements. */
  public void invalidate() {
  }

  /** Describes this domain's definition, for reports. */
  public abstract String describe();

  @Override public String toString() {
    return name;
  }
}

// End Domain.java
