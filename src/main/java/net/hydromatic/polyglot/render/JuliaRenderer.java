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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.compile.FreeFinder;
import net.hydromatic.polyglot.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renderer for the {@link Backend#SCIENTIFIC} backend; generates a Julia
 * function made of nested {@code for} loops.
 *
 * <p>In parallel mode, {@code Threads.@spawn} starts one task per chunk of
 * the index space, and the function fetches the partial results in chunk
 * order.
 */
class JuliaRenderer extends AbstractRenderer<JuliaRenderer.JuliaExpWriter> {
  static final JuliaRenderer INSTANCE = new JuliaRenderer();

  private JuliaRenderer() {
    super(Backend.SCIENTIFIC);
  }

  @Override
  JuliaExpWriter expWriter(RenderOptions options) {
    return new JuliaExpWriter(options.intWidth());
  }

  @Override
  void write(Context<JuliaExpWriter> cx) {
    final JuliaExpWriter w = cx.w;
    final CodeWriter out = cx.out;
    final List<String> params = new ArrayList<>();
    for (FreeFinder.Param param : cx.params) {
      params.add(param.name + "::" + (param.collection
          ? "Vector{" + w.typeName(param.type) + "}"
          : w.typeName(param.type)));
    }
    out.begin("function " + cx.functionName() + "("
        + String.join(", ", params) + ")::" + resultType(cx));
    writeNotes(cx);
    if (cx.plan.parallel) {
      parallelBody(cx, out);
    } else {
      declare(cx, out);
      loops(cx, out, 0, false);
      finish(cx, out);
    }
    out.end("end");
  }

  private static String resultType(Context<JuliaExpWriter> cx) {
    final JuliaExpWriter w = cx.w;
    if (cx.reduceOp != null) {
      return w.typeName(cx.resultType());
    }
    final String t = w.typeName(cx.elementType());
    switch (cx.c.op) {
      case LIST_COMP:
        return "Vector{" + t + "}";
      case SET_COMP:
        return "Set{" + t + "}";
      case DICT_COMP:
        return "Dict{" + w.typeName(cx.keyType()) + ", " + t + "}";
      default:
        throw new AssertionError(cx.c.op);
    }
  }

  /** Returns an empty collection of the result type. */
  private static String emptyCollection(Context<JuliaExpWriter> cx) {
    if (cx.c.op == Op.LIST_COMP) {
      return cx.w.typeName(cx.elementType()) + "[]";
    }
    return resultType(cx) + "()";
  }

  /** Declares the accumulator, with its type, so that assignments convert
   * to the integer width. In a chunk, a sum or product starts from its
   * identity. */
  private static void declare(Context<JuliaExpWriter> cx, CodeWriter out) {
    final JuliaExpWriter w = cx.w;
    if (cx.reduceOp == null) {
      out.line("result = " + emptyCollection(cx));
      return;
    }
    final Core.Exp initial = cx.initial();
    final String t = w.typeName(cx.elementType());
    final boolean chunk = cx.plan.parallel;
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        final String identity = cx.reduceOp == ReduceOp.SUM ? "0" : "1";
        out.line("acc::" + t + " = "
            + (initial == null || chunk ? identity : w.write(initial)));
        return;
      case ANY:
      case ALL:
        if (chunk) {
          out.line("result = " + (cx.reduceOp == ReduceOp.ALL));
        }
        return;
      case MAX:
      case MIN:
        out.line("best::Union{Nothing, " + t + "} = nothing");
        return;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  /** Writes the loop over generator {@code i} and the loops nested inside
   * it. In a chunk, the loop over the first generator has already been
   * written. */
  private void loops(Context<JuliaExpWriter> cx, CodeWriter out, int i,
      boolean chunk) {
    final JuliaExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(i);
    final boolean header = !chunk || i > 0;
    if (header) {
      out.begin("for " + g.variable + " in " + iterable(cx, g));
    }
    for (Core.Exp condition : cx.c.conditionsAt(i)) {
      out.begin("if !(" + w.write(condition) + ")");
      out.line("continue");
      out.end("end");
    }
    if (i < cx.c.generators.size() - 1) {
      loops(cx, out, i + 1, chunk);
    } else {
      accumulate(cx, out, chunk);
    }
    if (header) {
      out.end("end");
    }
  }

  /** Returns a Julia range, whose stop is inclusive, or the name of a
   * collection. */
  private static String iterable(Context<JuliaExpWriter> cx,
      Core.Generator g) {
    final JuliaExpWriter w = cx.w;
    if (g.iterable instanceof Core.OpaqueIterable) {
      return ((Core.OpaqueIterable) g.iterable).name;
    }
    final Core.Range range = (Core.Range) g.iterable;
    final int strength = Op.PLUS.left;
    final String start = w.write(range.start, 0, strength);
    final Long step = range.constantStep();
    if (step == null) {
      final String s = w.write(range.step, strength, strength);
      return start + ":" + s + ":("
          + w.write(range.stop, 0, Op.MINUS.left) + " - sign(" + w.write(
              range.step) + "))";
    }
    final String last =
        w.write(adjust(range.stop, -Long.signum(step),
            cx.options.intWidth()), strength, 0);
    return step == 1 ? start + ":" + last
        : start + ":" + step + ":" + last;
  }

  private static void accumulate(Context<JuliaExpWriter> cx, CodeWriter out,
      boolean chunk) {
    final JuliaExpWriter w = cx.w;
    final String e = w.write(cx.c.element);
    if (cx.reduceOp == null) {
      switch (cx.c.op) {
        case LIST_COMP:
        case SET_COMP:
          out.line("push!(result, " + e + ")");
          return;
        default:
          out.line("result[" + w.write(requireNonNull(cx.c.key)) + "] = "
              + e);
          return;
      }
    }
    switch (cx.reduceOp) {
      case SUM:
        out.line("acc += " + e);
        return;
      case PRODUCT:
        out.line("acc *= " + e);
        return;
      case ANY:
      case ALL:
        final boolean any = cx.reduceOp == ReduceOp.ANY;
        out.begin("if " + (any ? e : "!(" + e + ")"));
        if (chunk) {
          out.line("result = " + any);
          out.line("break");
        } else {
          out.line("return " + any);
        }
        out.end("end");
        return;
      case MAX:
      case MIN:
        out.line("v = " + e);
        out.begin("if best === nothing || v "
            + cx.reduceOp.combiner.opString.trim() + " best");
        out.line("best = v");
        out.end("end");
        return;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  private static void finish(Context<JuliaExpWriter> cx, CodeWriter out) {
    if (cx.reduceOp == null) {
      out.line("return result");
      return;
    }
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        out.line("return acc");
        return;
      case ANY:
        out.line("return false");
        return;
      case ALL:
        out.line("return true");
        return;
      default:
        selection(cx, out);
    }
  }

  /** Writes the end of max or min, which fails if there was no value and
   * no default. */
  private static void selection(Context<JuliaExpWriter> cx,
      CodeWriter out) {
    final Core.Exp initial = cx.initial();
    out.begin("if best === nothing");
    if (initial == null) {
      out.line("throw(ArgumentError(\"" + cx.emptyMessage() + "\"))");
    } else {
      out.line("return " + cx.w.write(initial));
    }
    out.end("end");
    out.line("return best");
  }

  private void parallelBody(Context<JuliaExpWriter> cx, CodeWriter out) {
    final JuliaExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(0);
    final String value;
    if (g.iterable instanceof Core.Range) {
      final Core.Range range = (Core.Range) g.iterable;
      final Core.Exp length = rangeLength(range, cx.options.intWidth());
      out.line("count = " + (length.op == Op.INT_LITERAL ? w.write(length)
          : "Int(" + w.write(length) + ")"));
      value = valueAt(w, range, "k");
    } else {
      final String name = ((Core.OpaqueIterable) g.iterable).name;
      out.line("count = length(" + name + ")");
      // Julia arrays are indexed from 1
      value = name + "[k + 1]";
    }
    out.line("workers = Threads.nthreads()");
    out.line("chunk = cld(count, workers)");
    out.begin("tasks = map(1:workers) do w");
    out.begin("Threads.@spawn begin");
    out.line("lo = (w - 1) * chunk");
    out.line("hi = min(w * chunk, count)");
    declare(cx, out);
    out.begin("for k in lo:(hi - 1)");
    out.line(g.variable + " = " + value);
    loops(cx, out, 0, true);
    out.end("end");
    out.line(partial(cx));
    out.end("end");
    out.end("end");
    out.line("partials = fetch.(tasks)");
    combine(cx, out);
  }

  /** Returns the name of the partial result of a chunk. */
  private static String partial(Context<JuliaExpWriter> cx) {
    if (cx.reduceOp == null) {
      return "result";
    }
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        return "acc";
      case ANY:
      case ALL:
        return "result";
      default:
        return "best";
    }
  }

  private static void combine(Context<JuliaExpWriter> cx, CodeWriter out) {
    final JuliaExpWriter w = cx.w;
    if (cx.reduceOp == null) {
      switch (cx.c.op) {
        case LIST_COMP:
          out.line("return reduce(vcat, partials; init = "
              + emptyCollection(cx) + ")");
          return;
        case SET_COMP:
          out.line("return union(" + emptyCollection(cx) + ", partials...)");
          return;
        default:
          // Later chunks overwrite the keys of earlier chunks
          out.line("return merge(" + emptyCollection(cx) + ", partials...)");
          return;
      }
    }
    final Core.Exp initial = cx.initial();
    switch (cx.reduceOp) {
      case SUM:
        out.line("return "
            + (initial == null ? "" : w.write(initial, 0, Op.PLUS.left)
                + " + ")
            + "sum(partials)");
        return;
      case PRODUCT:
        out.line("return "
            + (initial == null ? "" : w.write(initial, 0, Op.TIMES.left)
                + " * ")
            + "prod(partials)");
        return;
      case ANY:
        out.line("return any(partials)");
        return;
      case ALL:
        out.line("return all(partials)");
        return;
      default:
        out.line("best::Union{Nothing, " + w.typeName(cx.elementType())
            + "} = nothing");
        out.begin("for p in partials");
        out.begin("if p !== nothing && (best === nothing || p "
            + cx.reduceOp.combiner.opString.trim() + " best)");
        out.line("best = p");
        out.end("end");
        out.end("end");
        selection(cx, out);
    }
  }

  /** Writes expressions in Julia. */
  static class JuliaExpWriter extends ExpWriter {
    JuliaExpWriter(int intWidth) {
      super(intWidth);
    }

    @Override
    String typeName(PrimitiveType type) {
      switch (type) {
        case BOOL:
          return "Bool";
        case INT:
          return intWidth == 32 ? "Int32" : "Int64";
        case REAL:
          return "Float64";
        case STRING:
          return "String";
        default:
          throw new AssertionError(type);
      }
    }

    @Override
    String stringLiteral(String s) {
      // "$" interpolates in a Julia string
      return super.stringLiteral(s).replace("$", "\\$");
    }

    @Override
    @Nullable String opString(Op op, PrimitiveType type) {
      switch (op) {
        case AND:
          return " && ";
        case OR:
          return " || ";
        case NOT:
          return "!";
        case NEGATE:
          return "-";
        case INVERT:
          return "~";
        case POWER:
          return " ^ ";
        case PLUS:
          return type == PrimitiveType.STRING ? " * " : op.opString;
        case EQ:
        case NE:
        case LT:
        case LE:
        case GT:
        case GE:
        case BIT_AND:
        case BIT_OR:
        case LSHIFT:
        case RSHIFT:
        case MINUS:
        case TIMES:
        case DIVIDE:
          return op.opString;
        default:
          return null;
      }
    }

    @Override
    void special(StringBuilder b, Core.Call call, int left, int right) {
      switch (call.op) {
        case BIT_XOR:
          function(b, "xor", call.arg(0), call.arg(1));
          return;
        case FLOOR_DIVIDE:
          function(b, "fld", call.arg(0), call.arg(1));
          return;
        case MOD:
          function(b, "mod", call.arg(0), call.arg(1));
          return;
        default:
          throw new AssertionError(call.op);
      }
    }

    @Override
    void conditional(StringBuilder b, Core.If ifExp, int left, int right) {
      final boolean parens = left > 0 || right > 0;
      if (parens) {
        b.append('(');
      }
      write(b, ifExp.condition, Op.IF_EXP.right + 1, Op.IF_EXP.left + 1);
      b.append(" ? ");
      write(b, ifExp.ifTrue, 0, 0);
      b.append(" : ");
      write(b, ifExp.ifFalse, 0, 0);
      if (parens) {
        b.append(')');
      }
    }

    @Override
    void cast(StringBuilder b, Core.Call call, int left, int right) {
      final Core.Exp a = call.arg(0);
      if (call.type() == PrimitiveType.STRING) {
        function(b, "string", a);
      } else if (call.type() == PrimitiveType.INT
          && a.type() == PrimitiveType.REAL) {
        // Int64(2.5) fails; Python's int() truncates
        b.append("trunc(").append(typeName(PrimitiveType.INT)).append(", ");
        write(b, a, 0, 0);
        b.append(')');
      } else {
        function(b, typeName(call.type()), a);
      }
    }

    @Override
    void apply(StringBuilder b, Core.Apply apply) {
      if (apply.args.size() == 1) {
        final Core.Exp a = apply.args.get(0);
        switch (apply.fn) {
          case "len":
            function(b, "length", a);
            return;
          case "int":
          case "float":
          case "str":
            cast(b, core.cast(a, apply.type()), 0, 0);
            return;
          case "math.floor":
          case "math.ceil":
          case "round":
            // Julia's round, like Python's, rounds half to even
            b.append(apply.fn.equals("math.ceil") ? "ceil"
                : apply.fn.equals("math.floor") ? "floor" : "round")
                .append('(').append(typeName(PrimitiveType.INT))
                .append(", ");
            write(b, a, 0, 0);
            b.append(')');
            return;
          case "math.sqrt":
          case "math.exp":
          case "math.log":
          case "math.sin":
          case "math.cos":
            function(b, apply.fn.substring("math.".length()), a);
            return;
          default:
            break;
        }
      }
      super.apply(b, apply);
    }
  }
}

// End JuliaRenderer.java
