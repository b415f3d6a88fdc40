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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.opl.model.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Stack of iterator-variable bindings.
 *
 * <p>{@link #push} returns a {@link Frame}; closing the frame removes the
 * binding. Use it in a try-with-resources block, so that the binding is
 * removed however the block exits:
 *
 * <blockquote><pre>
 * try (EvalEnv.Frame ignored = env.push("i", 1)) {
 *   ...
 * }
 * </pre></blockquote>
 *
 * <p>A later binding of a name hides an earlier one. */
public class EvalEnv {
  private final List<Binding> bindings = new ArrayList<>();

  /** Binds a variable; returns a frame that removes the binding when
   * closed. */
  public Frame push(String name, Object value) {
    bindings.add(new Binding(name, value));
    return new Frame(bindings.size());
  }

  /** Returns the value of the innermost binding of a name, or null. */
  public @Nullable Object getOpt(String name) {
    for (int i = bindings.size() - 1; i >= 0; i--) {
      final Binding binding = bindings.get(i);
      if (binding.name.equals(name)) {
        return binding.value;
      }
    }
    return null;
  }

  /** Returns the number of bindings. */
  public int depth() {
    return bindings.size();
  }

  /** Calls a consumer for each binding, outermost first. */
  public void visit(BiConsumer<String, Object> consumer) {
    bindings.forEach(b -> consumer.accept(b.name, b.value));
  }

  /** Returns the visible bindings; a name bound more than once maps to its
   * innermost value. */
  public Map<String, Object> valueMap() {
    final Map<String, Object> map = new LinkedHashMap<>();
    visit(map::put);
    return map;
  }

  /** Describes the bindings, e.g. "i=1, j=2". */
  public String describe() {
    final List<String> list = new ArrayList<>();
    visit((name, value) -> list.add(name + "=" + Values.keyOf(value)));
    return Joiner.on(", ").join(list);
  }

  @Override public String toString() {
    return "{" + describe() + "}";
  }

  /** Binding of a name to a value. */
  private static class Binding {
    final String name;
    final Object value;

    Binding(String name, Object value) {
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }
  }

  /** Scope of one binding. Frames must be closed in reverse order of
   * creation. */
  public class Frame implements AutoCloseable {
    private final int depth;
    private boolean closed;

    private Frame(int depth) {
      this.depth = depth;
    }

    @Override public void close() {
      if (closed) {
        return;
      }
      checkState(bindings.size() == depth,
          "frame closed out of order: depth %s, expected %s",
          bindings.size(), depth);
      bindings.remove(depth - 1);
      closed = true;
    }
  }
}

// End EvalEnv.java
