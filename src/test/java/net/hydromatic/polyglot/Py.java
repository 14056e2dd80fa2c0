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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import net.hydromatic.polyglot.ast.Ast;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.compile.Compiles;
import net.hydromatic.polyglot.compile.Resolver;
import net.hydromatic.polyglot.compile.SqlOptimizer;
import net.hydromatic.polyglot.compile.Tracer;
import net.hydromatic.polyglot.compile.Tracers;
import net.hydromatic.polyglot.json.IrJson;
import net.hydromatic.polyglot.parse.PolyglotParser;
import net.hydromatic.polyglot.render.Backend;
import net.hydromatic.polyglot.render.Prop;
import net.hydromatic.polyglot.render.RenderOptions;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Py {
  private final String source;
  private final Backend backend;
  private final RenderOptions options;
  private final Tracer tracer;

  Py(String source, Backend backend, RenderOptions options, Tracer tracer) {
    this.source = source;
    this.backend = backend;
    this.options = options;
    this.tracer = tracer;
  }

  /** Creates a {@code Py}. */
  static Py py(String source) {
    return new Py(source, Backend.SCIENTIFIC, RenderOptions.DEFAULT,
        Tracers.empty());
  }

  /** Returns a copy that renders using a given backend. */
  Py withBackend(Backend backend) {
    return new Py(source, backend, options, tracer);
  }

  /** Returns a copy with a property set. */
  Py with(Prop prop, Object value) {
    return new Py(source, backend, options.with(prop, value), tracer);
  }

  /** Returns a copy that requests parallel code. */
  Py parallel() {
    return with(Prop.PARALLEL, true);
  }

  /** Returns a copy with a tracer wrapped around the current one. */
  Py withTracer(UnaryOperator<Tracer> transform) {
    return new Py(source, backend, options, transform.apply(tracer));
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  static void assertError(Runnable runnable, Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  /** Checks that the source parses and unparses to a given string. */
  @CanIgnoreReturnValue
  Py assertParse(String expected) {
    final Ast.Exp e = PolyglotParser.parse(source);
    assertThat(e.toString(), is(expected));
    return this;
  }

  /** Checks that the source parses and unparses to itself. */
  @CanIgnoreReturnValue
  Py assertParseSame() {
    return assertParse(source);
  }

  /** Checks that parsing or compiling the source throws. */
  @CanIgnoreReturnValue
  Py assertCompileThrows(Matcher<Throwable> matcher) {
    assertError(() -> Compiles.compile(source, backend, options, tracer),
        matcher);
    return this;
  }

  /** Checks the resolved, but not yet typed, program. */
  @CanIgnoreReturnValue
  Py assertResolved(Matcher<Core.Program> matcher) {
    assertThat(Resolver.resolve(PolyglotParser.parse(source)), matcher);
    return this;
  }

  /** Checks the program after a given pass: 0 resolved, 1 typed,
   * 2 optimized (SQL only). */
  @CanIgnoreReturnValue
  Py assertCore(int pass, Matcher<Core.Program> matcher) {
    final List<Core.Program> programs = new ArrayList<>();
    final Tracer tracer2 =
        Tracers.withOnCore(tracer, pass, programs::add);
    Compiles.compile(source, backend, options, tracer2);
    assertThat("pass " + pass + " was not reached", programs.size(), is(1));
    assertThat(programs.get(0), matcher);
    return this;
  }

  /** Checks the typed program. */
  @CanIgnoreReturnValue
  Py assertTyped(Consumer<Core.Program> consumer) {
    consumer.accept(
        Compiles.compile(source, null, options, tracer));
    return this;
  }

  /** Checks the reasons that the SQL optimizer gave for skipping rules. */
  @CanIgnoreReturnValue
  Py assertSkips(Matcher<? super List<String>> matcher) {
    final List<String> skips = new ArrayList<>();
    final Tracer tracer2 =
        Tracers.withOnSkip(tracer, (SqlOptimizer.Rule rule, String reason) ->
            skips.add(rule + ": " + reason));
    Compiles.compile(source, Backend.SQL, options, tracer2);
    assertThat(skips, matcher);
    return this;
  }

  /** Returns the generated code. */
  String render() {
    return Polyglot.render(source, backend, options, tracer);
  }

  /** Checks the generated code. */
  @CanIgnoreReturnValue
  Py assertRender(Matcher<String> matcher) {
    assertThat(render(), matcher);
    return this;
  }

  /** Checks the generated code against an exact string. */
  @CanIgnoreReturnValue
  Py assertRender(String expected) {
    return assertRender(is(expected));
  }

  /** Checks that rendering throws. */
  @CanIgnoreReturnValue
  Py assertRenderThrows(Matcher<Throwable> matcher) {
    assertError(this::render, matcher);
    return this;
  }

  /** Checks the JSON of the annotated program. */
  @CanIgnoreReturnValue
  Py assertIr(Matcher<String> matcher) {
    assertThat(
        IrJson.toString(Compiles.compile(source, null, options, tracer)),
        matcher);
    return this;
  }
}

// End Py.java
