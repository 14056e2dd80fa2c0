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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.compile.FreeFinder;
import net.hydromatic.polyglot.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renderer for the {@link Backend#WEB_WORKER} backend; generates a
 * TypeScript function made of nested {@code for} loops.
 *
 * <p>In parallel mode, the function is {@code async}. The loop is the body
 * of a web worker, created from a {@code Blob}; each worker reduces one
 * chunk of the index space and posts its partial result, and the function
 * combines the results of {@code Promise.all} in chunk order.
 *
 * <p>TypeScript has one numeric type, so integers are {@code number}
 * whatever the integer width.
 */
class TypeScriptRenderer
    extends AbstractRenderer<TypeScriptRenderer.TsExpWriter> {
  static final TypeScriptRenderer INSTANCE = new TypeScriptRenderer();

  private static final ImmutableMap<String, String> HELPERS =
      ImmutableMap.of("pyMod",
          "function pyMod(a: number, b: number): number {\n"
              + "    return ((a % b) + b) % b;\n"
              + "}");

  private TypeScriptRenderer() {
    super(Backend.WEB_WORKER);
  }

  @Override
  TsExpWriter expWriter(RenderOptions options) {
    return new TsExpWriter(options.intWidth());
  }

  @Override
  void write(Context<TsExpWriter> cx) {
    final TsExpWriter w = cx.w;
    final CodeWriter body = new CodeWriter(indent());
    body.indent();
    if (cx.plan.parallel) {
      parallelBody(cx, body);
    } else {
      declare(cx, body, false);
      loops(cx, body, 0, false);
      finish(cx, body);
    }

    final CodeWriter out = cx.out;
    final List<String> params = new ArrayList<>();
    for (FreeFinder.Param param : cx.params) {
      params.add(param.name + ": " + w.typeName(param.type)
          + (param.collection ? "[]" : ""));
    }
    final String resultType = resultType(cx);
    out.begin("export " + (cx.plan.parallel ? "async " : "") + "function "
        + cx.functionName() + "(" + String.join(", ", params) + "): "
        + (cx.plan.parallel ? "Promise<" + resultType + ">" : resultType)
        + " {");
    writeNotes(cx);
    out.outdent();
    out.lines(body.toString().replaceAll("\n$", ""));
    out.line("}");
    for (String helper : w.helpers) {
      out.blank();
      out.lines(requireNonNull(HELPERS.get(helper)));
    }
  }

  private static String resultType(Context<TsExpWriter> cx) {
    final TsExpWriter w = cx.w;
    if (cx.reduceOp != null) {
      return w.typeName(cx.resultType());
    }
    final String t = w.typeName(cx.elementType());
    switch (cx.c.op) {
      case LIST_COMP:
        return t + "[]";
      case SET_COMP:
        return "Set<" + t + ">";
      case DICT_COMP:
        return "Map<" + w.typeName(cx.keyType()) + ", " + t + ">";
      default:
        throw new AssertionError(cx.c.op);
    }
  }

  /** Declares the accumulator. Code in a worker is JavaScript, and has
   * no type annotations. */
  private static void declare(Context<TsExpWriter> cx, CodeWriter out,
      boolean worker) {
    final TsExpWriter w = cx.w;
    if (cx.reduceOp == null) {
      final String type = worker ? "" : ": " + resultType(cx);
      switch (cx.c.op) {
        case LIST_COMP:
          out.line("const result" + type + " = [];");
          return;
        case SET_COMP:
          out.line("const result" + type + " = new Set();");
          return;
        default:
          out.line("const result" + type + " = new Map();");
          return;
      }
    }
    final Core.Exp initial = cx.initial();
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        final String identity = cx.reduceOp == ReduceOp.SUM ? "0" : "1";
        out.line("let acc = "
            + (initial == null || worker ? identity : w.write(initial))
            + ";");
        return;
      case ANY:
      case ALL:
        if (worker) {
          out.line("let result = " + (cx.reduceOp == ReduceOp.ALL) + ";");
        }
        return;
      case MAX:
      case MIN:
        out.line("let best" + (worker ? ""
            : ": " + w.typeName(cx.elementType()) + " | undefined")
            + " = undefined;");
        return;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  /** Writes the loop over generator {@code i} and the loops nested inside
   * it. In a worker, the loop over the first generator has already been
   * written. */
  private void loops(Context<TsExpWriter> cx, CodeWriter out, int i,
      boolean worker) {
    final TsExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(i);
    final boolean header = !worker || i > 0;
    if (header) {
      out.begin(loop(cx, g));
    }
    for (Core.Exp condition : cx.c.conditionsAt(i)) {
      out.begin("if (!(" + w.write(condition) + ")) {");
      out.line("continue;");
      out.end("}");
    }
    if (i < cx.c.generators.size() - 1) {
      loops(cx, out, i + 1, worker);
    } else {
      accumulate(cx, out, worker);
    }
    if (header) {
      out.end("}");
    }
  }

  private static String loop(Context<TsExpWriter> cx, Core.Generator g) {
    final TsExpWriter w = cx.w;
    final String v = g.variable;
    if (g.iterable instanceof Core.OpaqueIterable) {
      return "for (const " + v + " of "
          + ((Core.OpaqueIterable) g.iterable).name + ") {";
    }
    final Core.Range range = (Core.Range) g.iterable;
    final String start = w.write(range.start);
    final String stop = w.write(range.stop, Op.LT.right + 1, 0);
    final Long step = range.constantStep();
    if (step == null) {
      final String s = w.write(range.step, Op.GT.left + 1, Op.GT.left + 1);
      return "for (let " + v + " = " + start + "; (" + s + " > 0 && " + v
          + " < " + stop + ") || (" + s + " < 0 && " + v + " > " + stop
          + "); " + v + " += " + w.write(range.step) + ") {";
    }
    final String update = step == 1 ? v + "++"
        : step == -1 ? v + "--"
        : step > 0 ? v + " += " + step
        : v + " -= " + -step;
    return "for (let " + v + " = " + start + "; " + v
        + (step > 0 ? " < " : " > ") + stop + "; " + update + ") {";
  }

  private static void accumulate(Context<TsExpWriter> cx, CodeWriter out,
      boolean worker) {
    final TsExpWriter w = cx.w;
    final String e = w.write(cx.c.element);
    if (cx.reduceOp == null) {
      switch (cx.c.op) {
        case LIST_COMP:
          out.line("result.push(" + e + ");");
          return;
        case SET_COMP:
          out.line("result.add(" + e + ");");
          return;
        default:
          out.line("result.set(" + w.write(requireNonNull(cx.c.key)) + ", "
              + e + ");");
          return;
      }
    }
    switch (cx.reduceOp) {
      case SUM:
        out.line("acc += " + e + ";");
        return;
      case PRODUCT:
        out.line("acc *= " + e + ";");
        return;
      case ANY:
      case ALL:
        final boolean any = cx.reduceOp == ReduceOp.ANY;
        out.begin("if (" + (any ? e : "!(" + e + ")") + ") {");
        if (worker) {
          out.line("result = " + any + ";");
          out.line("break;");
        } else {
          out.line("return " + any + ";");
        }
        out.end("}");
        return;
      case MAX:
      case MIN:
        out.line("const v = " + e + ";");
        out.begin("if (best === undefined || v "
            + cx.reduceOp.combiner.opString.trim() + " best) {");
        out.line("best = v;");
        out.end("}");
        return;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  private static void finish(Context<TsExpWriter> cx, CodeWriter out) {
    if (cx.reduceOp == null) {
      out.line("return result;");
      return;
    }
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        out.line("return acc;");
        return;
      case ANY:
        out.line("return false;");
        return;
      case ALL:
        out.line("return true;");
        return;
      default:
        selection(cx, out);
    }
  }

  /** Writes the end of max or min, which fails if there was no value and
   * no default. */
  private static void selection(Context<TsExpWriter> cx, CodeWriter out) {
    final Core.Exp initial = cx.initial();
    out.begin("if (best === undefined) {");
    if (initial == null) {
      out.line("throw new Error(\"" + cx.emptyMessage() + "\");");
    } else {
      out.line("return " + cx.w.write(initial) + ";");
    }
    out.end("}");
    out.line("return best;");
  }

  private void parallelBody(Context<TsExpWriter> cx, CodeWriter out) {
    final TsExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(0);
    final String value;
    if (g.iterable instanceof Core.Range) {
      final Core.Range range = (Core.Range) g.iterable;
      out.line("const count = "
          + w.write(rangeLength(range, cx.options.intWidth())) + ";");
      value = valueAt(w, range, "k");
    } else {
      final String name = ((Core.OpaqueIterable) g.iterable).name;
      out.line("const count = " + name + ".length;");
      value = name + "[k]";
    }
    out.line("const workers = navigator.hardwareConcurrency || 4;");
    out.line("const chunk = Math.ceil(count / workers);");

    // The body of the worker, in JavaScript
    final CodeWriter worker = new CodeWriter(indent());
    final List<String> names = new ArrayList<>();
    names.add("lo");
    names.add("hi");
    cx.params.forEach(p -> names.add(p.name));
    worker.begin("self.onmessage = (event) => {");
    worker.line("const [" + String.join(", ", names) + "] = event.data;");
    declare(cx, worker, true);
    worker.begin("for (let k = lo; k < hi; k++) {");
    worker.line("const " + g.variable + " = " + value + ";");
    loops(cx, worker, 0, true);
    worker.end("}");
    worker.line("self.postMessage(" + partial(cx) + ");");
    worker.end("};");
    final String workerText = worker.toString()
        .replace("\\", "\\\\")
        .replace("`", "\\`")
        .replace("${", "\\${");

    out.begin("const source = `");
    for (String helper : w.helpers) {
      out.line("${" + helper + ".toString()}");
    }
    out.lines(workerText.replaceAll("\n$", ""));
    out.end("`;");
    out.line("const url = URL.createObjectURL("
        + "new Blob([source], { type: \"text/javascript\" }));");
    out.begin("const partials = await Promise.all(");
    out.begin("Array.from({ length: workers }, (_, w) =>");
    out.begin("new Promise<" + partialType(cx)
        + ">((resolve, reject) => {");
    out.line("const worker = new Worker(url);");
    out.begin("worker.onmessage = (event) => {");
    out.line("resolve(event.data);");
    out.line("worker.terminate();");
    out.end("};");
    out.line("worker.onerror = reject;");
    final List<String> args = new ArrayList<>();
    args.add("w * chunk");
    args.add("Math.min((w + 1) * chunk, count)");
    cx.params.forEach(p -> args.add(p.name));
    out.line("worker.postMessage([" + String.join(", ", args) + "]);");
    out.end("})));");
    out.outdent();
    out.outdent();
    out.line("URL.revokeObjectURL(url);");
    combine(cx, out);
  }

  /** Returns the expression that a worker posts. */
  private static String partial(Context<TsExpWriter> cx) {
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
        return "best === undefined ? null : best";
    }
  }

  private static String partialType(Context<TsExpWriter> cx) {
    if (cx.reduceOp == null) {
      return resultType(cx);
    }
    switch (cx.reduceOp) {
      case MAX:
      case MIN:
        return cx.w.typeName(cx.elementType()) + " | null";
      default:
        return cx.w.typeName(cx.resultType());
    }
  }

  /** Writes the statements that combine the partial results, in chunk
   * order. */
  private static void combine(Context<TsExpWriter> cx, CodeWriter out) {
    final TsExpWriter w = cx.w;
    if (cx.reduceOp == null) {
      switch (cx.c.op) {
        case LIST_COMP:
          out.line("return partials.flat();");
          return;
        case SET_COMP:
          out.line("return new Set(partials.flatMap((p) => [...p]));");
          return;
        default:
          // Later chunks overwrite the keys of earlier chunks
          out.line("return new Map(partials.flatMap((p) => [...p]));");
          return;
      }
    }
    final Core.Exp initial = cx.initial();
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        final boolean sum = cx.reduceOp == ReduceOp.SUM;
        out.line("return partials.reduce((acc, p) => acc "
            + (sum ? "+" : "*") + " p, "
            + (initial != null ? w.write(initial) : sum ? "0" : "1")
            + ");");
        return;
      case ANY:
        out.line("return partials.some((p) => p);");
        return;
      case ALL:
        out.line("return partials.every((p) => p);");
        return;
      default:
        declare(cx, out, false);
        out.begin("for (const p of partials) {");
        out.begin("if (p !== null && (best === undefined || p "
            + cx.reduceOp.combiner.opString.trim() + " best)) {");
        out.line("best = p;");
        out.end("}");
        out.end("}");
        selection(cx, out);
    }
  }

  /** Writes expressions in TypeScript. */
  static class TsExpWriter extends ExpWriter {
    TsExpWriter(int intWidth) {
      super(intWidth);
    }

    @Override
    String typeName(PrimitiveType type) {
      switch (type) {
        case BOOL:
          return "boolean";
        case INT:
        case REAL:
          return "number";
        case STRING:
          return "string";
        default:
          throw new AssertionError(type);
      }
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
        case EQ:
          return " === ";
        case NE:
          return " !== ";
        case LT:
        case LE:
        case GT:
        case GE:
        case BIT_AND:
        case BIT_OR:
        case BIT_XOR:
        case LSHIFT:
        case RSHIFT:
        case PLUS:
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
        case FLOOR_DIVIDE:
          b.append("Math.floor(");
          infix(b, call.arg(0), Op.DIVIDE, " / ", call.arg(1), 0, 0);
          b.append(')');
          return;
        case MOD:
          helpers.add("pyMod");
          function(b, "pyMod", call.arg(0), call.arg(1));
          return;
        case POWER:
          function(b, "Math.pow", call.arg(0), call.arg(1));
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
      switch (call.type()) {
        case INT:
          if (a.type() == PrimitiveType.REAL) {
            function(b, "Math.trunc", a);
          } else {
            function(b, "Number", a);
          }
          return;
        case REAL:
          if (a.type() == PrimitiveType.BOOL) {
            function(b, "Number", a);
          } else {
            // An integer is already a number
            write(b, a, left, right);
          }
          return;
        case STRING:
          function(b, "String", a);
          return;
        default:
          function(b, "Boolean", a);
      }
    }

    @Override
    void apply(StringBuilder b, Core.Apply apply) {
      if (apply.args.size() == 1) {
        final Core.Exp a = apply.args.get(0);
        switch (apply.fn) {
          case "abs":
          case "round":
            function(b, "Math." + apply.fn, a);
            return;
          case "len":
            write(b, a, ATOM, ATOM);
            b.append(".length");
            return;
          case "int":
            function(b, "Math.trunc", a);
            return;
          case "float":
            function(b, "Number", a);
            return;
          case "str":
            function(b, "String", a);
            return;
          case "math.floor":
          case "math.ceil":
          case "math.sqrt":
          case "math.exp":
          case "math.log":
          case "math.sin":
          case "math.cos":
            function(b, "Math." + apply.fn.substring("math.".length()), a);
            return;
          default:
            break;
        }
      }
      super.apply(b, apply);
    }
  }
}

// End TypeScriptRenderer.java
