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
package net.hydromatic.polyglot.render;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.polyglot.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.Pos;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.compile.ConstantFolder;
import net.hydromatic.polyglot.compile.FreeFinder;
import net.hydromatic.polyglot.type.PrimitiveType;
import net.hydromatic.polyglot.type.TypeAnnotation;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for renderers.
 *
 * <p>A renderer is a stateless singleton. Each call to {@link #render}
 * creates a {@link Context} that holds the state of that call.
 *
 * @param <W> Type of expression writer
 */
abstract class AbstractRenderer<W extends ExpWriter> implements Renderer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(AbstractRenderer.class);

  private final Backend backend;

  AbstractRenderer(Backend backend) {
    this.backend = requireNonNull(backend);
  }

  @Override
  public Backend backend() {
    return backend;
  }

  @Override
  public String render(Core.Program program, RenderOptions options) {
    final Context<W> cx =
        new Context<>(program, options, expWriter(options), indent());
    LOGGER.debug("rendering {} as {}; parallel plan {}", program, backend,
        cx.plan.parallel ? "parallel"
            : cx.plan.fallbackReason != null ? "fallback" : "sequential");
    write(cx);
    return cx.out.toString();
  }

  /** Creates an expression writer. */
  abstract W expWriter(RenderOptions options);

  /** Returns the unit of indentation. */
  String indent() {
    return "    ";
  }

  /** Writes the program. */
  abstract void write(Context<W> cx);

  /** Writes the explanation of the parallel plan as comments, if
   * explanations are enabled. */
  void writeNotes(Context<W> cx) {
    if (cx.options.explain()) {
      for (String note : cx.plan.notes(cx.program)) {
        cx.out.line(backend.lineComment + " " + note);
      }
    }
  }

  /** Returns an expression for the number of values in a range, which must
   * have a constant step. The expression is folded to a literal if the
   * bounds are constant. */
  static Core.Exp rangeLength(Core.Range range, int intWidth) {
    final long step = requireNonNull(range.constantStep());
    final Core.Exp lo = step > 0 ? range.start : range.stop;
    final Core.Exp hi = step > 0 ? range.stop : range.start;
    final Pos pos = range.pos;
    // For step 3: "(hi - lo + 2) // 3 if hi > lo else 0"
    Core.Exp length = core.call(pos, Op.MINUS, hi, lo, PrimitiveType.INT);
    final long abs = Math.abs(step);
    if (abs != 1) {
      length = core.call(pos, Op.FLOOR_DIVIDE,
          core.call(pos, Op.PLUS, length, core.intLiteral(abs - 1),
              PrimitiveType.INT),
          core.intLiteral(abs), PrimitiveType.INT);
    }
    final Core.Exp e =
        core.ifExp(pos,
            core.call(pos, Op.GT, hi, lo, PrimitiveType.BOOL),
            length, core.intLiteral(0))
            .withType(PrimitiveType.INT);
    return e.accept(new ConstantFolder(intWidth));
  }

  /** Returns the value at index {@code k} of a range with a constant step,
   * {@code start + k * step}. */
  static String valueAt(ExpWriter w, Core.Range range, String k) {
    final long step = requireNonNull(range.constantStep());
    final String product = step == 1 ? k : k + " * " + step;
    if (range.start.op == Op.INT_LITERAL
        && ((Core.Literal) range.start).longValue() == 0) {
      return product;
    }
    return w.write(range.start, 0, Op.PLUS.left) + " + " + product;
  }

  /** Returns an integer expression plus a constant, folded if possible;
   * for example, {@code n} adjusted by -1 gives {@code n - 1}, and
   * {@code 6} gives {@code 5}. */
  static Core.Exp adjust(Core.Exp e, long delta, int intWidth) {
    if (delta == 0) {
      return e;
    }
    final Core.Exp e2 =
        core.call(e.pos, delta > 0 ? Op.PLUS : Op.MINUS, e,
            core.intLiteral(Math.abs(delta)), PrimitiveType.INT);
    return e2.accept(new ConstantFolder(intWidth));
  }

  /** Per-call state of a renderer. */
  static class Context<W extends ExpWriter> {
    final Core.Program program;
    final Core.Comprehension c;
    final @Nullable ReduceOp reduceOp;
    final TypeAnnotation annotation;
    final RenderOptions options;
    final ParallelPlan plan;
    final List<FreeFinder.Param> params;
    final W w;
    final CodeWriter out;

    Context(Core.Program program, RenderOptions options, W w,
        String indent) {
      this.program = requireNonNull(program);
      this.c = program.comprehension();
      this.reduceOp = program instanceof Core.Reduction
          ? ((Core.Reduction) program).reduceOp : null;
      this.annotation = program.annotation();
      this.options = requireNonNull(options);
      this.plan = ParallelPlan.of(program, options.parallel());
      this.params = ImmutableList.copyOf(FreeFinder.params(program));
      this.w = requireNonNull(w);
      this.out = new CodeWriter(indent);
    }

    /** Returns the reduction; the program must be a reduction. */
    Core.Reduction reduction() {
      return (Core.Reduction) program;
    }

    /** Returns the initial value ("start" or "default") of the reduction,
     * or null. */
    Core.@Nullable Exp initial() {
      return program instanceof Core.Reduction
          ? ((Core.Reduction) program).initial : null;
    }

    /** Returns the type of the elements; for a dict, the type of the
     * values. */
    PrimitiveType elementType() {
      return annotation.elementType;
    }

    /** Returns the type of the keys of a dict. */
    PrimitiveType keyType() {
      return requireNonNull(annotation.keyType);
    }

    /** Returns the type of the result of a reduction. */
    PrimitiveType resultType() {
      return requireNonNull(annotation.resultType);
    }

    /** Returns the name of the function to generate. */
    String functionName() {
      return options.functionName();
    }

    /** Returns the message of the error raised when max or min has an
     * empty source and no default. */
    String emptyMessage() {
      return requireNonNull(reduceOp).functionName
          + "() arg is an empty sequence";
    }
  }
}

// End AbstractRenderer.java
