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
 * Renderer for the {@link Backend#OOP_LINQ} backend; generates a C# method
 * that evaluates the program as a LINQ query.
 *
 * <p>Nested generators become {@code SelectMany}, filters become
 * {@code Where}. In parallel mode, PLINQ runs one task per chunk of the
 * index space; {@code AsOrdered} keeps the partial results in chunk
 * order.
 */
class CSharpRenderer extends AbstractRenderer<CSharpRenderer.CsExpWriter> {
  static final CSharpRenderer INSTANCE = new CSharpRenderer();

  private static final ImmutableMap<String, String> HELPERS =
      ImmutableMap.<String, String>builder()
          .put("FloorDiv",
              "static $I FloorDiv($I a, $I b)\n"
                  + "{\n"
                  + "    var q = a / b;\n"
                  + "    return a % b != 0 && (a < 0) != (b < 0) ? q - 1 : q;\n"
                  + "}")
          .put("FloorMod",
              "static $I FloorMod($I a, $I b)\n"
                  + "{\n"
                  + "    var r = a % b;\n"
                  + "    return r != 0 && (r < 0) != (b < 0) ? r + b : r;\n"
                  + "}")
          .put("FloorModDouble",
              "static double FloorMod(double a, double b)\n"
                  + "{\n"
                  + "    return a - b * Math.Floor(a / b);\n"
                  + "}")
          .put("IPow",
              "static $I IPow($I b, $I e)\n"
                  + "{\n"
                  + "    $I result = 1;\n"
                  + "    for (; e > 0; e--)\n"
                  + "    {\n"
                  + "        result *= b;\n"
                  + "    }\n"
                  + "    return result;\n"
                  + "}")
          .put("Range",
              "static IEnumerable<$I> Range($I start, $I stop, $I step)\n"
                  + "{\n"
                  + "    for (var i = start; step > 0 ? i < stop : i > stop;"
                  + " i += step)\n"
                  + "    {\n"
                  + "        yield return i;\n"
                  + "    }\n"
                  + "}")
          .build();

  private CSharpRenderer() {
    super(Backend.OOP_LINQ);
  }

  @Override
  CsExpWriter expWriter(RenderOptions options) {
    return new CsExpWriter(options.intWidth());
  }

  @Override
  void write(Context<CsExpWriter> cx) {
    final CsExpWriter w = cx.w;
    final CodeWriter body = new CodeWriter(indent());
    body.indent();
    body.indent();
    if (cx.plan.parallel) {
      parallelBody(cx, body);
    } else {
      final Core.Exp initial = cx.initial();
      body.lines("return "
          + (cx.reduceOp == ReduceOp.SUM && initial != null
              ? w.write(initial, 0, Op.PLUS.left) + " + " : "")
          + chain(cx, 0, null) + terminal(cx, "\n    ", false) + ";");
    }

    final CodeWriter out = cx.out;
    out.line("using System;");
    out.line("using System.Collections.Generic;");
    out.line("using System.Linq;");
    out.blank();
    out.line("public static class Polyglot");
    out.begin("{");
    final List<String> params = new ArrayList<>();
    for (FreeFinder.Param param : cx.params) {
      params.add(w.typeName(param.type) + (param.collection ? "[] " : " ")
          + param.name);
    }
    out.line("public static " + resultType(cx) + " " + cx.functionName()
        + "(" + String.join(", ", params) + ")");
    out.begin("{");
    writeNotes(cx);
    out.outdent();
    out.outdent();
    out.lines(body.toString().replaceAll("\n$", ""));
    out.indent();
    out.line("}");
    for (String helper : w.helpers) {
      out.blank();
      out.lines(requireNonNull(HELPERS.get(helper))
          .replace("$I", w.typeName(PrimitiveType.INT)));
    }
    out.end("}");
  }

  private static String resultType(Context<CsExpWriter> cx) {
    final CsExpWriter w = cx.w;
    if (cx.reduceOp != null) {
      return w.typeName(cx.resultType());
    }
    final String t = w.typeName(cx.elementType());
    switch (cx.c.op) {
      case LIST_COMP:
        return "List<" + t + ">";
      case SET_COMP:
        return "HashSet<" + t + ">";
      case DICT_COMP:
        return "Dictionary<" + w.typeName(cx.keyType()) + ", " + t + ">";
      default:
        throw new AssertionError(cx.c.op);
    }
  }

  /** Returns the query over generator {@code i} and the generators nested
   * inside it, one method call per line. If {@code source} is not null, it
   * replaces the source of the first generator. */
  private static String chain(Context<CsExpWriter> cx, int i,
      @Nullable String source) {
    final CsExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(i);
    final StringBuilder b = new StringBuilder();
    if (source != null) {
      b.append(source);
    } else if (g.iterable instanceof Core.OpaqueIterable) {
      b.append(((Core.OpaqueIterable) g.iterable).name);
    } else {
      final Core.Range range = (Core.Range) g.iterable;
      w.helpers.add("Range");
      b.append("Range(").append(w.write(range.start)).append(", ")
          .append(w.write(range.stop)).append(", ")
          .append(w.write(range.step)).append(')');
    }
    final String v = g.variable;
    for (Core.Exp condition : cx.c.conditionsAt(i)) {
      b.append("\n    .Where(").append(v).append(" => ")
          .append(w.write(condition)).append(')');
    }
    if (i < cx.c.generators.size() - 1) {
      b.append("\n    .SelectMany(").append(v).append(" => ")
          .append(chain(cx, i + 1, null).replace("\n", "\n    "))
          .append(')');
    } else if (cx.c.key != null) {
      b.append("\n    .Select(").append(v).append(" => (Key: ")
          .append(w.write(cx.c.key)).append(", Value: ")
          .append(w.write(cx.c.element)).append("))");
    } else if (!(cx.c.element instanceof Core.Id
        && ((Core.Id) cx.c.element).generatorIndex == i)) {
      b.append("\n    .Select(").append(v).append(" => ")
          .append(w.write(cx.c.element)).append(')');
    }
    return b.toString();
  }

  /** Returns the call that reduces or collects a query; if {@code chunk},
   * the partial result of a chunk. The call is preceded by
   * {@code receiver}, typically a line break and an indent. */
  private static String terminal(Context<CsExpWriter> cx, String receiver,
      boolean chunk) {
    final CsExpWriter w = cx.w;
    final String t = w.typeName(cx.elementType());
    final Core.Exp initial = cx.initial();
    if (cx.reduceOp == null) {
      switch (cx.c.op) {
        case LIST_COMP:
          return receiver + ".ToList()";
        case SET_COMP:
          return receiver + ".ToHashSet()";
        case DICT_COMP:
          if (chunk) {
            return receiver + ".ToList()";
          }
          // Unlike ToDictionary, a later value for a key replaces an
          // earlier one
          return receiver + ".Aggregate(new " + resultType(cx)
              + "(), (d, p) =>" + receiver + "{" + receiver
              + "    d[p.Key] = p.Value;" + receiver + "    return d;"
              + receiver + "})";
        default:
          throw new AssertionError(cx.c.op);
      }
    }
    switch (cx.reduceOp) {
      case SUM:
        return receiver + ".Sum()";
      case PRODUCT:
        return receiver + ".Aggregate(" + w.typedLiteral(cx.elementType(),
            initial == null || chunk ? "1" : w.write(initial))
            + ", (acc, v) => acc * v)";
      case ANY:
        return receiver + ".Any(v => v)";
      case ALL:
        return receiver + ".All(v => v)";
      default:
        final String method = cx.reduceOp == ReduceOp.MAX ? "Max" : "Min";
        if (chunk) {
          // A nullable value, which is null for an empty chunk
          return cx.elementType() == PrimitiveType.STRING
              ? receiver + "." + method + "()"
              : receiver + ".Select(v => (" + t + "?) v)." + method + "()";
        }
        if (initial != null) {
          return receiver + ".DefaultIfEmpty(" + w.write(initial) + ")."
              + method + "()";
        }
        return receiver + "." + method + "()";
    }
  }

  private void parallelBody(Context<CsExpWriter> cx, CodeWriter out) {
    final CsExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(0);
    final String value;
    if (g.iterable instanceof Core.Range) {
      final Core.Range range = (Core.Range) g.iterable;
      final Core.Exp length = rangeLength(range, cx.options.intWidth());
      out.line("var count = "
          + (length.op == Op.INT_LITERAL ? w.write(length)
              : "(int)(" + w.write(length) + ")") + ";");
      value = valueAt(w, range, "(" + w.typeName(PrimitiveType.INT) + ")k");
    } else {
      final String name = ((Core.OpaqueIterable) g.iterable).name;
      out.line("var count = " + name + ".Length;");
      value = name + "[k]";
    }
    out.line("var workers = Environment.ProcessorCount;");
    out.line("var chunk = (count + workers - 1) / workers;");
    out.line("var partials = ParallelEnumerable.Range(0, workers)");
    out.indent();
    out.line(".AsOrdered()");
    out.line(".Select(w =>");
    out.begin("{");
    out.line("var lo = Math.Min(w * chunk, count);");
    out.line("var hi = Math.Min(lo + chunk, count);");
    final String query = chain(cx, 0,
        "Enumerable.Range(lo, hi - lo)\n    .Select(k => " + value + ")");
    out.lines("return " + query + terminal(cx, "\n    ", true) + ";");
    out.end("})");
    out.line(".ToList();");
    out.outdent();
    combine(cx, out);
  }

  private static void combine(Context<CsExpWriter> cx, CodeWriter out) {
    final CsExpWriter w = cx.w;
    if (cx.reduceOp == null) {
      out.lines("return partials.SelectMany(p => p)"
          + terminal(cx, "\n    ", false) + ";");
      return;
    }
    final Core.Exp initial = cx.initial();
    switch (cx.reduceOp) {
      case SUM:
        out.line("return "
            + (initial == null ? "" : w.write(initial, 0, Op.PLUS.left)
                + " + ")
            + "partials.Sum();");
        return;
      case PRODUCT:
        out.line("return partials.Aggregate(" + w.typedLiteral(cx.elementType(),
            initial == null ? "1" : w.write(initial))
            + ", (acc, p) => acc * p);");
        return;
      case ANY:
        out.line("return partials.Any(p => p);");
        return;
      case ALL:
        out.line("return partials.All(p => p);");
        return;
      default:
        // Max and Min skip the nulls of empty chunks
        final String method = cx.reduceOp == ReduceOp.MAX ? "Max" : "Min";
        out.line("return partials." + method + "() ?? "
            + (initial == null
                ? "throw new InvalidOperationException(\""
                    + cx.emptyMessage() + "\")"
                : w.write(initial)) + ";");
    }
  }

  /** Writes expressions in C#. */
  static class CsExpWriter extends ExpWriter {
    CsExpWriter(int intWidth) {
      super(intWidth);
    }

    @Override
    String typeName(PrimitiveType type) {
      switch (type) {
        case BOOL:
          return "bool";
        case INT:
          return intWidth == 32 ? "int" : "long";
        case REAL:
          return "double";
        case STRING:
          return "string";
        default:
          throw new AssertionError(type);
      }
    }

    /** Returns a numeric literal of a given type; for example, "1" as a
     * 64-bit integer is "1L". */
    String typedLiteral(PrimitiveType type, String s) {
      if (!s.matches("-?[0-9]+")) {
        return s;
      }
      switch (type) {
        case INT:
          return intWidth == 32 ? s : s + "L";
        case REAL:
          return s + ".0";
        default:
          return s;
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
        case LT:
        case LE:
        case GT:
        case GE:
          return type == PrimitiveType.STRING ? null : op.opString;
        case EQ:
        case NE:
        case BIT_AND:
        case BIT_OR:
        case BIT_XOR:
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
      final Core.Exp a0 = call.arg(0);
      final Core.Exp a1 = call.arg(1);
      final boolean real = call.type() == PrimitiveType.REAL;
      switch (call.op) {
        case LT:
        case LE:
        case GT:
        case GE:
          // Strings have no "<" operator
          final StringBuilder b2 = new StringBuilder();
          function(b2, "string.CompareOrdinal", a0, a1);
          final boolean parens = left > call.op.left || call.op.right < right;
          b.append(parens ? "(" : "").append(b2).append(call.op.opString)
              .append('0').append(parens ? ")" : "");
          return;
        case LSHIFT:
        case RSHIFT:
          // The count of a shift is an int
          b.append('(');
          write(b, a0, 0, ATOM);
          b.append(call.op.opString).append("(int)");
          write(b, a1, ATOM, 0);
          b.append(')');
          return;
        case FLOOR_DIVIDE:
          if (real) {
            b.append("Math.Floor(");
            infix(b, a0, Op.DIVIDE, " / ", a1, 0, 0);
            b.append(')');
          } else {
            helpers.add("FloorDiv");
            function(b, "FloorDiv", a0, a1);
          }
          return;
        case MOD:
          helpers.add(real ? "FloorModDouble" : "FloorMod");
          function(b, "FloorMod", a0, a1);
          return;
        case POWER:
          if (real) {
            function(b, "Math.Pow", a0, a1);
          } else {
            helpers.add("IPow");
            function(b, "IPow", a0, a1);
          }
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
      if (a.type() == PrimitiveType.BOOL) {
        function(b, call.type() == PrimitiveType.REAL ? "Convert.ToDouble"
            : intWidth == 32 ? "Convert.ToInt32" : "Convert.ToInt64", a);
      } else if (call.type() == PrimitiveType.STRING) {
        method(b, a, "ToString");
      } else {
        final int strength = Op.NEGATE.left;
        final boolean parens = left > strength || strength < right;
        b.append(parens ? "(" : "").append('(')
            .append(typeName(call.type())).append(')');
        write(b, a, ATOM, ATOM);
        b.append(parens ? ")" : "");
      }
    }

    @Override
    void apply(StringBuilder b, Core.Apply apply) {
      if (apply.args.size() == 1) {
        final Core.Exp a = apply.args.get(0);
        switch (apply.fn) {
          case "abs":
            function(b, "Math.Abs", a);
            return;
          case "len":
            write(b, a, ATOM, ATOM);
            b.append(intWidth == 32 ? ".Length" : ".LongLength");
            return;
          case "int":
          case "float":
          case "str":
            cast(b, core.cast(a, apply.type()), 0, 0);
            return;
          case "math.floor":
          case "math.ceil":
          case "round":
            // Math.Round rounds half to even, like Python
            final String name = apply.fn.equals("round") ? "Round"
                : apply.fn.equals("math.floor") ? "Floor" : "Ceiling";
            b.append('(').append(typeName(PrimitiveType.INT)).append(')');
            function(b, "Math." + name, a);
            return;
          case "math.sqrt":
          case "math.exp":
          case "math.log":
          case "math.sin":
          case "math.cos":
            final String fn = apply.fn.substring("math.".length());
            function(b, "Math." + Character.toUpperCase(fn.charAt(0))
                + fn.substring(1), a);
            return;
          default:
            break;
        }
      }
      super.apply(b, apply);
    }
  }
}

// End CSharpRenderer.java
