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
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.ast.Visitor;
import net.hydromatic.polyglot.compile.FreeFinder;
import net.hydromatic.polyglot.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renderer for the {@link Backend#GOROUTINE} backend; generates a Go
 * function made of nested {@code for} loops.
 *
 * <p>In parallel mode, each chunk of the index space is reduced by a
 * goroutine, which sends its partial result on a channel of its own; the
 * function receives from the channels in chunk order.
 */
class GoRenderer extends AbstractRenderer<GoRenderer.GoExpWriter> {
  static final GoRenderer INSTANCE = new GoRenderer();

  private static final ImmutableMap<String, String> HELPERS =
      ImmutableMap.<String, String>builder()
          .put("absInt",
              "func absInt(a $I) $I {\n"
                  + "\tif a < 0 {\n"
                  + "\t\treturn -a\n"
                  + "\t}\n"
                  + "\treturn a\n"
                  + "}")
          .put("b2i",
              "func b2i(b bool) $I {\n"
                  + "\tif b {\n"
                  + "\t\treturn 1\n"
                  + "\t}\n"
                  + "\treturn 0\n"
                  + "}")
          .put("floorDiv",
              "func floorDiv(a, b $I) $I {\n"
                  + "\tq := a / b\n"
                  + "\tif a%b != 0 && (a < 0) != (b < 0) {\n"
                  + "\t\tq--\n"
                  + "\t}\n"
                  + "\treturn q\n"
                  + "}")
          .put("floorMod",
              "func floorMod(a, b $I) $I {\n"
                  + "\tr := a % b\n"
                  + "\tif r != 0 && (r < 0) != (b < 0) {\n"
                  + "\t\tr += b\n"
                  + "\t}\n"
                  + "\treturn r\n"
                  + "}")
          .put("floorModFloat",
              "func floorModFloat(a, b float64) float64 {\n"
                  + "\treturn a - b*math.Floor(a/b)\n"
                  + "}")
          .put("ipow",
              "func ipow(base, exp $I) $I {\n"
                  + "\tresult := $I(1)\n"
                  + "\tfor ; exp > 0; exp-- {\n"
                  + "\t\tresult *= base\n"
                  + "\t}\n"
                  + "\treturn result\n"
                  + "}")
          .build();

  private GoRenderer() {
    super(Backend.GOROUTINE);
  }

  @Override
  GoExpWriter expWriter(RenderOptions options) {
    return new GoExpWriter(options.intWidth());
  }

  @Override
  String indent() {
    return "\t";
  }

  @Override
  void write(Context<GoExpWriter> cx) {
    final GoExpWriter w = cx.w;
    final CodeWriter body = new CodeWriter(indent());
    body.indent();
    if (cx.plan.parallel) {
      w.imports.add("runtime");
      parallelBody(cx, body);
    } else {
      sequentialBody(cx, body);
    }

    final CodeWriter out = cx.out;
    out.line("package polyglot");
    out.blank();
    if (w.imports.size() == 1) {
      out.line("import \"" + w.imports.first() + "\"");
      out.blank();
    } else if (!w.imports.isEmpty()) {
      out.begin("import (");
      w.imports.forEach(i -> out.line("\"" + i + "\""));
      out.end(")");
      out.blank();
    }
    final StringBuilder signature = new StringBuilder("func ")
        .append(cx.functionName()).append('(');
    for (FreeFinder.Param param : cx.params) {
      if (signature.charAt(signature.length() - 1) != '(') {
        signature.append(", ");
      }
      signature.append(param.name).append(' ')
          .append(param.collection ? "[]" : "")
          .append(w.typeName(param.type));
    }
    signature.append(") ").append(resultType(cx)).append(" {");
    out.begin(signature.toString());
    writeNotes(cx);
    out.outdent();
    out.lines(body.toString().replaceAll("\n$", ""));
    out.line("}");
    for (String helper : w.helpers) {
      out.blank();
      out.lines(requireNonNull(HELPERS.get(helper))
          .replace("$I", w.typeName(PrimitiveType.INT)));
    }
  }

  private static String resultType(Context<GoExpWriter> cx) {
    if (cx.reduceOp != null) {
      return cx.w.typeName(cx.resultType());
    }
    return collectionType(cx);
  }

  private static String collectionType(Context<GoExpWriter> cx) {
    final GoExpWriter w = cx.w;
    final String t = w.typeName(cx.elementType());
    switch (cx.c.op) {
      case LIST_COMP:
        return "[]" + t;
      case SET_COMP:
        return "map[" + t + "]bool";
      case DICT_COMP:
        return "map[" + w.typeName(cx.keyType()) + "]" + t;
      default:
        throw new AssertionError(cx.c.op);
    }
  }

  private void sequentialBody(Context<GoExpWriter> cx, CodeWriter out) {
    declare(cx, out, false);
    loops(cx, out, 0, false);
    finish(cx, out);
  }

  /** Declares the accumulator. In a chunk, a sum or product starts from
   * its identity, and the initial value is added when the chunks are
   * combined. */
  private static void declare(Context<GoExpWriter> cx, CodeWriter out,
      boolean chunk) {
    final GoExpWriter w = cx.w;
    final Core.Exp initial = cx.initial();
    if (cx.reduceOp == null) {
      out.line("result := " + collectionType(cx) + "{}");
      return;
    }
    final String t = w.typeName(cx.elementType());
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        final String identity = cx.reduceOp == ReduceOp.SUM ? "0" : "1";
        out.line("acc := " + t + "("
            + (initial == null || chunk ? identity : w.write(initial))
            + ")");
        return;
      case ANY:
      case ALL:
        if (chunk) {
          out.line("result := " + (cx.reduceOp == ReduceOp.ALL));
        }
        return;
      case MAX:
      case MIN:
        out.line("var best " + t);
        out.line("found := false");
        return;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  /** Writes the loop over generator {@code i} and the loops nested inside
   * it. In a chunk, the loop over the first generator has already been
   * written. */
  private void loops(Context<GoExpWriter> cx, CodeWriter out, int i,
      boolean chunk) {
    final GoExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(i);
    if (!chunk) {
      out.begin(loop(cx, g));
    }
    if ((chunk || g.iterable instanceof Core.OpaqueIterable)
        && !used(cx.c, i)) {
      // Go rejects a variable that is declared and not used
      out.line("_ = " + g.variable);
    }
    for (Core.Exp condition : cx.c.conditionsAt(i)) {
      out.begin("if !(" + w.write(condition) + ") {");
      out.line("continue");
      out.end("}");
    }
    if (i < cx.c.generators.size() - 1) {
      loops(cx, out, i + 1, false);
    } else {
      accumulate(cx, out, chunk);
    }
    if (!chunk) {
      out.end("}");
    }
  }

  /** Returns the header of the loop over a generator. */
  private static String loop(Context<GoExpWriter> cx, Core.Generator g) {
    final GoExpWriter w = cx.w;
    final String v = g.variable;
    if (g.iterable instanceof Core.OpaqueIterable) {
      return "for _, " + v + " := range "
          + ((Core.OpaqueIterable) g.iterable).name + " {";
    }
    final Core.Range range = (Core.Range) g.iterable;
    final String start = range.start.op == Op.INT_LITERAL
        ? w.typeName(PrimitiveType.INT) + "(" + w.write(range.start) + ")"
        : w.write(range.start);
    final String stop = w.write(range.stop, Op.LT.right + 1, 0);
    final Long step = range.constantStep();
    if (step == null) {
      final String s = w.write(range.step, Op.GT.left + 1, Op.GT.left + 1);
      return "for " + v + " := " + start + "; (" + s + " > 0 && " + v
          + " < " + stop + ") || (" + s + " < 0 && " + v + " > " + stop
          + "); " + v + " += " + w.write(range.step) + " {";
    }
    final String update = step == 1 ? v + "++"
        : step == -1 ? v + "--"
        : step > 0 ? v + " += " + step
        : v + " -= " + -step;
    return "for " + v + " := " + start + "; " + v
        + (step > 0 ? " < " : " > ") + stop + "; " + update + " {";
  }

  /** Returns whether the variable of generator {@code i} is used. */
  private static boolean used(Core.Comprehension c, int i) {
    final boolean[] used = {false};
    c.accept(new Visitor() {
      @Override
      public void visit(Core.Id id) {
        if (id.generatorIndex == i) {
          used[0] = true;
        }
      }
    });
    return used[0];
  }

  /** Writes the statements that add the element to the accumulator. */
  private static void accumulate(Context<GoExpWriter> cx, CodeWriter out,
      boolean chunk) {
    final GoExpWriter w = cx.w;
    final String e = w.write(cx.c.element);
    if (cx.reduceOp == null) {
      switch (cx.c.op) {
        case LIST_COMP:
          out.line("result = append(result, " + e + ")");
          return;
        case SET_COMP:
          out.line("result[" + e + "] = true");
          return;
        case DICT_COMP:
          out.line("result[" + w.write(requireNonNull(cx.c.key)) + "] = "
              + e);
          return;
        default:
          throw new AssertionError(cx.c.op);
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
        out.begin("if " + (any ? e : "!(" + e + ")") + " {");
        if (chunk) {
          out.line("result = " + any);
          out.line("break");
        } else {
          out.line("return " + any);
        }
        out.end("}");
        return;
      case MAX:
      case MIN:
        out.line("v := " + e);
        out.begin("if !found || v " + cx.reduceOp.combiner.opString.trim()
            + " best {");
        out.line("best = v");
        out.line("found = true");
        out.end("}");
        return;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  /** Writes the statements after the loops, which return the result. */
  private static void finish(Context<GoExpWriter> cx, CodeWriter out) {
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
        final Core.Exp initial = cx.initial();
        out.begin("if !found {");
        if (initial == null) {
          out.line("panic(\"" + cx.emptyMessage() + "\")");
        } else {
          out.line("return " + cx.w.write(initial));
        }
        out.end("}");
        out.line("return best");
    }
  }

  private void parallelBody(Context<GoExpWriter> cx, CodeWriter out) {
    final GoExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(0);
    final String value;
    if (g.iterable instanceof Core.Range) {
      final Core.Range range = (Core.Range) g.iterable;
      final Core.Exp length = rangeLength(range, cx.options.intWidth());
      out.line("count := "
          + (length.op == Op.INT_LITERAL ? w.write(length)
              : "int(" + w.write(length) + ")"));
      value = valueAt(w, range, w.typeName(PrimitiveType.INT) + "(k)");
    } else {
      final String name = ((Core.OpaqueIterable) g.iterable).name;
      out.line("count := len(" + name + ")");
      value = name + "[k]";
    }
    final String partial = partialType(cx);
    out.line("workers := runtime.NumCPU()");
    out.line("chunk := (count + workers - 1) / workers");
    out.line("channels := make([]chan " + partial + ", workers)");
    out.begin("for w := 0; w < workers; w++ {");
    out.line("channels[w] = make(chan " + partial + ", 1)");
    out.begin("go func(w int) {");
    out.line("lo := w * chunk");
    out.line("hi := lo + chunk");
    out.begin("if hi > count {");
    out.line("hi = count");
    out.end("}");
    declare(cx, out, true);
    out.begin("for k := lo; k < hi; k++ {");
    out.line(g.variable + " := " + value);
    loops(cx, out, 0, true);
    out.end("}");
    if (cx.reduceOp == null) {
      out.line("channels[w] <- result");
    } else {
      switch (cx.reduceOp) {
        case SUM:
        case PRODUCT:
          out.line("channels[w] <- acc");
          break;
        case ANY:
        case ALL:
          out.line("channels[w] <- result");
          break;
        default:
          out.begin("if found {");
          out.line("channels[w] <- &best");
          out.end("} else {");
          out.indent();
          out.line("channels[w] <- nil");
          out.end("}");
      }
    }
    out.end("}(w)");
    out.end("}");
    combine(cx, out);
  }

  /** Returns the type of the partial result of a chunk. */
  private static String partialType(Context<GoExpWriter> cx) {
    if (cx.reduceOp == null) {
      return collectionType(cx);
    }
    switch (cx.reduceOp) {
      case ANY:
      case ALL:
        return "bool";
      case MAX:
      case MIN:
        return "*" + cx.w.typeName(cx.elementType());
      default:
        return cx.w.typeName(cx.elementType());
    }
  }

  /** Writes the statements that receive the partial results, in chunk
   * order, and combine them. */
  private static void combine(Context<GoExpWriter> cx, CodeWriter out) {
    if (cx.reduceOp == null) {
      declare(cx, out, false);
      out.begin("for _, ch := range channels {");
      switch (cx.c.op) {
        case LIST_COMP:
          out.line("result = append(result, (<-ch)...)");
          break;
        default:
          // Later chunks overwrite the keys of earlier chunks
          out.begin("for key, value := range <-ch {");
          out.line("result[key] = value");
          out.end("}");
      }
      out.end("}");
      out.line("return result");
      return;
    }
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        declare(cx, out, false);
        out.begin("for _, ch := range channels {");
        out.line("acc " + (cx.reduceOp == ReduceOp.SUM ? "+=" : "*=")
            + " <-ch");
        out.end("}");
        out.line("return acc");
        return;
      case ANY:
      case ALL:
        final boolean any = cx.reduceOp == ReduceOp.ANY;
        out.begin("for _, ch := range channels {");
        out.begin("if " + (any ? "" : "!") + "<-ch {");
        out.line("return " + any);
        out.end("}");
        out.end("}");
        out.line("return " + !any);
        return;
      default:
        declare(cx, out, false);
        out.begin("for _, ch := range channels {");
        out.begin("if p := <-ch; p != nil && (!found || *p "
            + cx.reduceOp.combiner.opString.trim() + " best) {");
        out.line("best = *p");
        out.line("found = true");
        out.end("}");
        out.end("}");
        finish(cx, out);
    }
  }

  /** Writes expressions in Go. */
  static class GoExpWriter extends ExpWriter {
    /** Packages that the written expressions use. */
    final SortedSet<String> imports = new TreeSet<>();

    GoExpWriter(int intWidth) {
      super(intWidth);
    }

    @Override
    String typeName(PrimitiveType type) {
      switch (type) {
        case BOOL:
          return "bool";
        case INT:
          return intWidth == 32 ? "int32" : "int64";
        case REAL:
          return "float64";
        case STRING:
          return "string";
        default:
          throw new AssertionError(type);
      }
    }

    private void helper(String name) {
      helpers.add(name);
      if (name.equals("floorModFloat")) {
        imports.add("math");
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
          return "^";
        case EQ:
        case NE:
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
      final boolean real = call.type() == PrimitiveType.REAL;
      switch (call.op) {
        case FLOOR_DIVIDE:
          if (real) {
            imports.add("math");
            b.append("math.Floor(");
            infix(b, call.arg(0), Op.DIVIDE, " / ", call.arg(1), 0, 0);
            b.append(')');
          } else {
            helper("floorDiv");
            function(b, "floorDiv", call.arg(0), call.arg(1));
          }
          return;
        case MOD:
          final String mod = real ? "floorModFloat" : "floorMod";
          helper(mod);
          function(b, mod, call.arg(0), call.arg(1));
          return;
        case POWER:
          if (real) {
            imports.add("math");
            function(b, "math.Pow", call.arg(0), call.arg(1));
          } else {
            helper("ipow");
            function(b, "ipow", call.arg(0), call.arg(1));
          }
          return;
        default:
          throw new AssertionError(call.op);
      }
    }

    @Override
    void conditional(StringBuilder b, Core.If ifExp, int left, int right) {
      // Go has no conditional expression
      b.append("func() ").append(typeName(ifExp.type())).append(" { if ");
      write(b, ifExp.condition, 0, 0);
      b.append(" { return ");
      write(b, ifExp.ifTrue, 0, 0);
      b.append(" }; return ");
      write(b, ifExp.ifFalse, 0, 0);
      b.append(" }()");
    }

    @Override
    void cast(StringBuilder b, Core.Call call, int left, int right) {
      final Core.Exp a = call.arg(0);
      if (a.type() == PrimitiveType.BOOL) {
        helper("b2i");
        final StringBuilder b2 = new StringBuilder();
        function(b2, "b2i", a);
        if (call.type() == PrimitiveType.REAL) {
          b.append("float64(").append(b2).append(')');
        } else {
          b.append(b2);
        }
      } else if (call.type() == PrimitiveType.STRING) {
        imports.add("fmt");
        function(b, "fmt.Sprint", a);
      } else {
        function(b, typeName(call.type()), a);
      }
    }

    @Override
    void apply(StringBuilder b, Core.Apply apply) {
      if (apply.args.size() == 1) {
        final Core.Exp a = apply.args.get(0);
        final boolean real = a.type() == PrimitiveType.REAL;
        switch (apply.fn) {
          case "abs":
            if (real) {
              imports.add("math");
              function(b, "math.Abs", a);
            } else {
              helper("absInt");
              function(b, "absInt", a);
            }
            return;
          case "len":
            b.append(typeName(PrimitiveType.INT)).append('(');
            function(b, "len", a);
            b.append(')');
            return;
          case "int":
          case "float":
            cast(b, core.cast(a, apply.type()), 0, 0);
            return;
          case "str":
            imports.add("fmt");
            function(b, "fmt.Sprint", a);
            return;
          case "math.floor":
          case "math.ceil":
          case "round":
            imports.add("math");
            b.append(typeName(PrimitiveType.INT)).append('(');
            b.append(apply.fn.equals("round") ? "math.RoundToEven"
                : apply.fn.equals("math.floor") ? "math.Floor" : "math.Ceil");
            b.append('(');
            floatArg(b, a);
            b.append("))");
            return;
          case "math.sqrt":
          case "math.exp":
          case "math.log":
          case "math.sin":
          case "math.cos":
            imports.add("math");
            final String name = apply.fn.substring("math.".length());
            b.append("math.").append(Character.toUpperCase(name.charAt(0)))
                .append(name.substring(1)).append('(');
            floatArg(b, a);
            b.append(')');
            return;
          default:
            break;
        }
      }
      super.apply(b, apply);
    }

    /** Writes an argument of a function that requires a float. */
    private void floatArg(StringBuilder b, Core.Exp a) {
      if (a.type() == PrimitiveType.REAL) {
        write(b, a, 0, 0);
      } else {
        function(b, "float64", a);
      }
    }
  }
}

// End GoRenderer.java
