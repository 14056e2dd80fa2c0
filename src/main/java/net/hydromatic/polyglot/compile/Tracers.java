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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.polyglot.ast.Ast;
import net.hydromatic.polyglot.ast.Core;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the parse tree,
   * then calls the underlying tracer. */
  public static Tracer withOnAst(Tracer tracer, Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onAst(Ast.Exp e) {
        consumer.accept(e);
        super.onAst(e);
      }
    };
  }

  /** Returns a tracer that performs the given action on a program at a
   * given pass, then calls the underlying tracer. */
  public static Tracer withOnCore(Tracer tracer, int pass,
      Consumer<Core.Program> consumer) {
    final int expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override
      public void onCore(int pass, Core.Program program) {
        if (pass == expectedPass) {
          consumer.accept(program);
        }
        super.onCore(pass, program);
      }
    };
  }

  /** Returns a tracer that performs the given action when an optimizer rule
   * is skipped, then calls the underlying tracer. */
  public static Tracer withOnSkip(Tracer tracer,
      BiConsumer<SqlOptimizer.Rule, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSkip(SqlOptimizer.Rule rule, String reason) {
        consumer.accept(rule, reason);
        super.onSkip(rule, reason);
      }
    };
  }

  /** Returns a tracer that performs the given action on the generated text,
   * then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(String text) {
        consumer.accept(text);
        super.onResult(text);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onAst(Ast.Exp e) {}

    @Override
    public void onCore(int pass, Core.Program program) {}

    @Override
    public void onSkip(SqlOptimizer.Rule rule, String reason) {}

    @Override
    public void onResult(String text) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onAst(Ast.Exp e) {
      tracer.onAst(e);
    }

    @Override
    public void onCore(int pass, Core.Program program) {
      tracer.onCore(pass, program);
    }

    @Override
    public void onSkip(SqlOptimizer.Rule rule, String reason) {
      tracer.onSkip(rule, reason);
    }

    @Override
    public void onResult(String text) {
      tracer.onResult(text);
    }
  }
}

// End Tracers.java
