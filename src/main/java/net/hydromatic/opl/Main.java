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
package net.hydromatic.opl;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.hydromatic.opl.eval.Prop;
import net.hydromatic.opl.eval.Session;
import net.hydromatic.opl.export.MpsWriter;
import net.hydromatic.opl.util.OplException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Command-line compiler of optimization models.
 *
 * <p>Usage: {@code opl [--textual] [--mps=FILE] [--property=value]
 * [model.mod]}. Reads the model from the file, or from standard input if
 * there is no file; prints a report of the compiled model; and, if
 * {@code --mps} is given, writes the model in MPS format. */
public class Main {
  private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

  private final Reader in;
  private final PrintWriter out;
  private final List<String> args;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new InputStreamReader(System.in, StandardCharsets.UTF_8),
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8),
            new LinkedHashMap<>());
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> args, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    this.args = ImmutableList.copyOf(args);
    this.in = in;
    this.out = out instanceof PrintWriter ? (PrintWriter) out
        : new PrintWriter(new BufferedWriter(out));
    this.session = new Session(propMap);
  }

  /** Compiles the model; returns 0 on success, 1 on error. */
  public int run() {
    try {
      @Nullable String mpsFile = null;
      @Nullable String modelFile = null;
      for (String arg : args) {
        if (arg.equals("--textual")) {
          Prop.SUM_EXPANSION.set(session.map, Prop.SumExpansion.TEXTUAL);
        } else if (arg.startsWith("--mps=")) {
          mpsFile = arg.substring("--mps=".length());
        } else if (arg.startsWith("--") && arg.contains("=")) {
          final int i = arg.indexOf('=');
          Prop.lookup(arg.substring(2, i))
              .setLenient(session.map, arg.substring(i + 1));
        } else if (arg.startsWith("-")) {
          throw new IllegalArgumentException("unknown option '" + arg + "'");
        } else if (modelFile == null) {
          modelFile = arg;
        } else {
          throw new IllegalArgumentException("more than one model file");
        }
      }
      final String text = modelFile == null ? read(in) : readFile(modelFile);
      session.compile(text);
      out.print(session.report());
      if (mpsFile != null) {
        try (Writer w =
                 Files.asCharSink(new File(mpsFile), StandardCharsets.UTF_8)
                     .openBufferedStream()) {
          MpsWriter.write(session, w);
        }
        out.println("Wrote " + mpsFile);
      }
      return 0;
    } catch (RuntimeException | IOException e) {
      final StringBuilder buf = new StringBuilder();
      if (e instanceof OplException) {
        ((OplException) e).describeTo(buf);
      } else {
        buf.append(e.getMessage());
      }
      LOGGER.log(Level.SEVERE, "compilation failed", e);
      out.println(buf);
      return 1;
    } finally {
      out.flush();
    }
  }

  private static String readFile(String fileName) throws IOException {
    return Files.asCharSource(new File(fileName), StandardCharsets.UTF_8)
        .read();
  }

  private static String read(Reader r) throws IOException {
    final StringBuilder b = new StringBuilder();
    try (BufferedReader br = new BufferedReader(r)) {
      final char[] chars = new char[1024];
      for (;;) {
        final int read = br.read(chars);
        if (read < 0) {
          return b.toString();
        }
        b.append(chars, 0, read);
      }
    }
  }
}

// End Main.java
