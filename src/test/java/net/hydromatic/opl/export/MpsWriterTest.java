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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.StringWriter;
import net.hydromatic.opl.Fixture;
import net.hydromatic.opl.eval.Prop;
import net.hydromatic.opl.eval.Session;
import org.junit.jupiter.api.Test;

/** Tests {@link MpsWriter}. */
class MpsWriterTest {
  private static final String MODEL = "range I = 1..2;\n"
      + "dvar float+ x[I];\n"
      + "dvar int y in 0..10;\n"
      + "dvar boolean b;\n"
      + "maximize profit: 3 * x[1] + 2 * x[2] + y + 5;\n"
      + "cap: x[1] + x[2] <= 4;\n"
      + "x[1] - y >= -2;\n"
      + "b + y == 3;\n";

  @Test void testWrite() throws IOException {
    final String expected = "NAME          MODEL\n"
        + "ROWS\n"
        + " N  profit\n"
        + " L  cap\n"
        + " G  c2\n"
        + " E  c3\n"
        + "COLUMNS\n"
        + "    x1         profit     -3\n"
        + "    x1         cap        1\n"
        + "    x1         c2         1\n"
        + "    x2         profit     -2\n"
        + "    x2         cap        1\n"
        + "    MARKER0    'MARKER'                 'INTORG'\n"
        + "    y          profit     -1\n"
        + "    y          c2         -1\n"
        + "    y          c3         1\n"
        + "    b          c3         1\n"
        + "    MARKER1    'MARKER'                 'INTEND'\n"
        + "RHS\n"
        + "    RHS        profit     5\n"
        + "    RHS        cap        4\n"
        + "    RHS        c2         -2\n"
        + "    RHS        c3         3\n"
        + "BOUNDS\n"
        + " UP BND        y          10\n"
        + " BV BND        b\n"
        + "ENDATA\n";
    final Session session = Fixture.model(MODEL).session();
    assertThat(MpsWriter.toMps(session), is(expected));

    final StringWriter w = new StringWriter();
    MpsWriter.write(session, w);
    assertThat(w.toString(), is(expected));
  }

  @Test void testMinimize() {
    final Session session =
        Fixture.model(MODEL + "minimize 3 * x[1] - y + 1;")
            .withProp(Prop.MODEL_NAME, "TEST")
            .session();
    final String mps = MpsWriter.toMps(session);
    assertThat(mps, containsString("NAME          TEST\n"));
    assertThat(mps, containsString(" N  obj\n"));
    assertThat(mps, containsString("    x1         obj        3\n"));
    assertThat(mps, containsString("    y          obj        -1\n"));
    assertThat(mps, containsString("    RHS        obj        -1\n"));
    assertThat(mps, not(containsString("x2         obj")));
  }

  @Test void testNoObjective() {
    final Session session =
        Fixture.model("dvar float z;\n"
            + "z >= 1;").session();
    assertThat(MpsWriter.toMps(session),
        is("NAME          MODEL\n"
            + "ROWS\n"
            + " N  obj\n"
            + " G  c1\n"
            + "COLUMNS\n"
            + "    z          c1         1\n"
            + "RHS\n"
            + "    RHS        c1         1\n"
            + "BOUNDS\n"
            + " FR BND        z\n"
            + "ENDATA\n"));
  }

  @Test void testBounds() {
    final Session session =
        Fixture.model("dvar float f;\n"
            + "dvar float- g;\n"
            + "dvar float h in -5..5;\n"
            + "dvar int k in 2..4;\n"
            + "dvar float+ unused in 0..7;\n"
            + "f + g + h + k <= 10;\n").session();
    final String mps = MpsWriter.toMps(session);
    assertThat(mps, not(containsString("unused")));
    assertThat(mps,
        containsString("BOUNDS\n"
            + " FR BND        f\n"
            + " MI BND        g\n"
            + " UP BND        g          0\n"
            + " LO BND        h          -5\n"
            + " UP BND        h          5\n"
            + " LO BND        k          2\n"
            + " UP BND        k          4\n"
            + "ENDATA\n"));
  }

  @Test void testSanitize() {
    assertThat(MpsWriter.sanitize("cap[1,2]"), is("cap_1_2"));
    assertThat(MpsWriter.sanitize("cap[1]"), is("cap_1"));
    assertThat(MpsWriter.sanitize("x1_2"), is("x1_2"));
    assertThat(MpsWriter.sanitize("1st"), is("V1st"));
    assertThat(MpsWriter.sanitize("a b"), is("ab"));
  }

  @Test void testRowNames() {
    final Session session =
        Fixture.model("range I = 1..2;\n"
            + "dvar float x[I];\n"
            + "c2: x[1] <= 1;\n"
            + "x[2] <= 1;\n"
            + "forall(i in I) cap: x[i] >= 0;\n"
            + "cap: x[1] + x[2] <= 3;\n"
            + "cap: x[1] - x[2] <= 3;\n").session();
    assertThat(MpsWriter.rowNames(session.equations()),
        is(
            ImmutableList.of("c2", "c2_1", "cap_1", "cap_2", "cap",
                "cap_3")));
  }
}

// End MpsWriterTest.java
