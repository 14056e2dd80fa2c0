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
package net.hydromatic.polyglot;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polyglot.compile.Tracer;
import net.hydromatic.polyglot.compile.Tracers;
import net.hydromatic.polyglot.compile.TypeResolver;
import net.hydromatic.polyglot.parse.UnsupportedConstructException;
import net.hydromatic.polyglot.render.Backend;
import net.hydromatic.polyglot.render.Prop;
import net.hydromatic.polyglot.render.RenderOptions;
import net.hydromatic.polyglot.util.PolyglotException;
import org.junit.jupiter.api.Test;

/** Tests the {@link Polyglot} entry point. */
public class PolyglotTest {
  @Test void testRenderByName() {
    final String source = "[x * x for x in range(n)]";
    final String text =
        Polyglot.render(source, "goroutine",
            ImmutableMap.of("parallel", "true", "intWidth", "32"));
    assertThat(text, containsString("func program(n int32) []int32 {"));
    assertThat(text, containsString("go func(w int) {"));
    assertThat(text,
        is(Polyglot.render(source, Backend.GOROUTINE,
            RenderOptions.DEFAULT.with(
                Prop.PARALLEL, true)
                .with(Prop.INT_WIDTH, 32))));
  }

  /** Tests that the tracer sees each stage, in order. */
  @Test void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnAst(tracer, e -> events.add("ast " + e));
    for (int pass = 0; pass < 3; pass++) {
      final int p = pass;
      tracer = Tracers.withOnCore(tracer, pass, program ->
          events.add("core" + p + " " + program));
    }
    tracer = Tracers.withOnSkip(tracer, (rule, reason) ->
        events.add("skip " + rule));
    tracer = Tracers.withOnResult(tracer, text -> events.add("result"));

    Polyglot.render("[x for x in range(3) if 2 > 1]", Backend.SQL,
        RenderOptions.DEFAULT, tracer);
    assertThat(events.toString(),
        is("[ast [x for x in range(3) if 2 > 1], "
            + "core0 [x for x in range(0, 3) if 2 > 1], "
            + "core1 [x for x in range(0, 3) if 2 > 1], "
            + "skip PREDICATE_PUSHDOWN, "
            + "core2 [x for x in range(0, 3)], "
            + "result]"));

    // Other backends have no optimization pass
    events.clear();
    Polyglot.render("[x for x in range(3)]", Backend.SCIENTIFIC,
        RenderOptions.DEFAULT, tracer);
    assertThat(events.size(), is(4));
  }

  /** Tests that each kind of error has a position. */
  @Test void testErrors() {
    checkError("[x for x in range(3) if x in y]",
        UnsupportedConstructException.class);
    checkError("[x for x in", PolyglotException.class);
    final TypeResolver.TypeException e =
        assertThrows(TypeResolver.TypeException.class, () ->
            Polyglot.render("[x for x in xs]", Backend.SCIENTIFIC,
                RenderOptions.DEFAULT.with(
                    Prop.STRICT_TYPES,
                    true)));
    assertThat(e.pos().toString(), containsString("1."));
  }

  private static void checkError(String source, Class<?> expectedClass) {
    try {
      Polyglot.render(source, Backend.SCIENTIFIC, RenderOptions.DEFAULT);
      fail("expected error");
    } catch (RuntimeException e) {
      assertThat(e, instanceOf(expectedClass));
      assertThat(e, instanceOf(PolyglotException.class));
      final String description =
          ((PolyglotException) e).describeTo(new StringBuilder()).toString();
      assertThat(description, containsString(" Error: "));
    }
  }
}

// End PolyglotTest.java
