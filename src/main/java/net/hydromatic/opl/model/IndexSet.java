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

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.List;
import net.hydromatic.opl.eval.EvalEnv;
import net.hydromatic.opl.eval.Evaluator;

/** Contiguous range of integers with literal bounds, e.g.
 * "range I = 1..3". Empty if {@code start > end}. */
public class IndexSet extends Domain {
  public final int start;
  public final int end;

  public IndexSet(String name, int start, int end) {
    super(name);
    this.start = start;
    this.end = end;
  }

  /** Returns the integers from start to end, inclusive. */
  public static List<Object> range(int start, int end) {
    if (start > end) {
      return ImmutableList.of();
    }
    return ImmutableList.<Object>copyOf(
        ContiguousSet.create(Range.closed(start, end),
            DiscreteDomain.integers()));
  }

  @Override public List<Object> elements(Evaluator evaluator, EvalEnv env) {
    return range(start, end);
  }

  public int size() {
    return Math.max(0, end - start + 1);
  }

  @Override public String describe() {
    return "range " + name + " = " + start + ".." + end;
  }
}

// End IndexSet.java
