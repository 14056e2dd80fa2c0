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
package net.hydromatic.polyglot.compile;

import net.hydromatic.polyglot.ast.Ast;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.parse.PolyglotParser;
import net.hydromatic.polyglot.render.Backend;
import net.hydromatic.polyglot.render.RenderOptions;
import net.hydromatic.polyglot.render.Renderers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Helpers that run the stages of the compiler, from source text to
 * generated code. */
public abstract class Compiles {
  private static final Logger LOGGER = LoggerFactory.getLogger(Compiles.class);

  private Compiles() {}

  /**
   * Parses, resolves and type-checks a source expression, and prepares it
   * for a given backend.
   *
   * <p>For the {@link Backend#SQL} backend, also checks that every iterable
   * is a range with constant bounds, and (if {@link RenderOptions#optimize()})
   * runs {@link SqlOptimizer}.
   *
   * @param source Python source text
   * @param backend Backend; null if the program will not be rendered
   * @param options Options
   * @param tracer Tracer
   * @return Annotated program
   */
  public static Core.Program compile(String source,
      @Nullable Backend backend,
      RenderOptions options, Tracer tracer) {
    final Ast.Exp exp = PolyglotParser.parse(source);
    tracer.onAst(exp);

    final Core.Program program0 = Resolver.resolve(exp);
    tracer.onCore(0, program0);

    final Core.Program program1 =
        TypeResolver.infer(program0, options.intWidth(),
            options.strictTypes());
    LOGGER.debug("annotated {} with {}", program1, program1.annotation);
    tracer.onCore(1, program1);

    if (backend != Backend.SQL) {
      return program1;
    }
    SqlValidator.validate(program1, options.intWidth());
    final Core.Program program2 =
        options.optimize()
            ? SqlOptimizer.optimize(program1, options.intWidth(), tracer)
            : program1;
    tracer.onCore(2, program2);
    return program2;
  }

  /** Compiles source text and generates code for a backend. */
  public static String render(String source, Backend backend,
      RenderOptions options, Tracer tracer) {
    final Core.Program program = compile(source, backend, options, tracer);
    final String text = Renderers.render(program, backend, options);
    LOGGER.debug("rendered {} as {}", source, backend);
    tracer.onResult(text);
    return text;
  }
}

// End Compiles.java
