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

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.compile.Compiles;
import net.hydromatic.polyglot.compile.Tracer;
import net.hydromatic.polyglot.compile.Tracers;
import net.hydromatic.polyglot.json.IrJson;
import net.hydromatic.polyglot.render.Backend;
import net.hydromatic.polyglot.render.RenderOptions;

/**
 * Entry point to the transpiler.
 *
 * <p>Translates a single Python expression (a list, set or dict
 * comprehension, or a reduction such as {@code sum}, {@code max} or
 * {@code any} over a generator expression) into an equivalent function in
 * one of the languages listed in {@link Backend}.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * Polyglot.render("sum(i * i for i in range(10))", Backend.SCIENTIFIC,
 *     RenderOptions.DEFAULT)
 * </pre></blockquote>
 *
 * <p>returns the source text of a Julia function. Errors are reported by
 * throwing {@link net.hydromatic.polyglot.parse.PolyglotParseException}
 * (including its sub-class
 * {@link net.hydromatic.polyglot.parse.UnsupportedConstructException}) or
 * {@link net.hydromatic.polyglot.compile.TypeResolver.TypeException}; all
 * implement {@link net.hydromatic.polyglot.util.PolyglotException}.
 */
public class Polyglot {
  private Polyglot() {}

  /** Translates Python source text to code for a backend. */
  public static String render(String source, Backend backend,
      RenderOptions options) {
    return render(source, backend, options, Tracers.empty());
  }

  /** Translates Python source text to code for a backend, calling a
   * tracer as each stage completes. */
  public static String render(String source, Backend backend,
      RenderOptions options, Tracer tracer) {
    return Compiles.render(source, backend, options, tracer);
  }

  /** Translates Python source text to code for a backend identified by
   * name (for example "goroutine" or "sql"), with options given as a map
   * from property name to value (for example "parallel" to "true"). */
  public static String render(String source, String backend,
      Map<String, ?> options) {
    return render(source, Backend.of(backend), RenderOptions.of(options));
  }

  /** Returns the annotated intermediate representation of Python source
   * text as a JSON tree. */
  public static ObjectNode emitIr(String source) {
    return IrJson.toJson(annotate(source));
  }

  /** Returns the annotated intermediate representation of Python source
   * text as JSON text. The text is the same on every platform. */
  public static String emitIrString(String source) {
    return IrJson.toString(annotate(source));
  }

  private static Core.Program annotate(String source) {
    return Compiles.compile(source, null, RenderOptions.DEFAULT,
        Tracers.empty());
  }
}

// End Polyglot.java
