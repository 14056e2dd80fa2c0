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
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.compile.FreeFinder;
import net.hydromatic.polyglot.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renderer for the {@link Backend#SYSTEMS_PARALLEL} backend; generates a
 * Rust function that evaluates the program as an iterator chain.
 *
 * <p>Nested generators become {@code flat_map}, filters become
 * {@code filter}. A reduction folds the chain without collecting it. In
 * parallel mode, the index space of the generator is split into chunks
 * that Rayon reduces on its thread pool.
 */
class RustRenderer extends AbstractRenderer<RustRenderer.RustExpWriter> {
  static final RustRenderer INSTANCE = new RustRenderer();

  /** Definitions of helper functions; "$I" is replaced by the integer
   * type. */
  private static final ImmutableMap<String, String> HELPERS =
      ImmutableMap.<String, String>builder()
          .put("py_div",
              "fn py_div(a: $I, b: $I) -> $I {\n"
                  + "    let q = a / b;\n"
                  + "    if a % b != 0 && ((a < 0) != (b < 0)) {\n"
                  + "        q - 1\n"
                  + "    } else {\n"
                  + "        q\n"
                  + "    }\n"
                  + "}")
          .put("py_fmod",
              "fn py_fmod(a: f64, b: f64) -> f64 {\n"
                  + "    a - b * (a / b).floor()\n"
                  + "}")
          .put("py_mod",
              "fn py_mod(a: $I, b: $I) -> $I {\n"
                  + "    let r = a % b;\n"
                  + "    if r != 0 && ((r < 0) != (b < 0)) {\n"
                  + "        r + b\n"
                  + "    } else {\n"
                  + "        r\n"
                  + "    }\n"
                  + "}")
          .put("py_range",
              "fn py_range(start: $I, stop: $I, step: $I)"
                  + " -> impl Iterator<Item = $I> {\n"
                  + "    std::iter::successors(Some(start),"
                  + " move |&i| Some(i + step))\n"
                  + "        .take_while(move |&i|"
                  + " if step > 0 { i < stop } else { i > stop })\n"
                  + "}")
          .build();

  private RustRenderer() {
    super(Backend.SYSTEMS_PARALLEL);
  }

  @Override
  RustExpWriter expWriter(RenderOptions options) {
    return new RustExpWriter(options.intWidth());
  }

  @Override
  void write(Context<RustExpWriter> cx) {
    // Render the body first, so that we know which helpers it needs.
    final CodeWriter body = new CodeWriter(indent());
    body.indent();
    if (cx.plan.parallel) {
      parallelBody(cx, body);
    } else {
      sequentialBody(cx, body);
    }
    body.outdent();

    final CodeWriter out = cx.out;
    final List<String> uses = new ArrayList<>();
    if (cx.c.op == Op.SET_COMP) {
      uses.add("use std::collections::HashSet;");
    }
    if (cx.c.op == Op.DICT_COMP) {
      uses.add("use std::collections::HashMap;");
    }
    if (cx.plan.parallel) {
      uses.add("use rayon::prelude::*;");
    }
    if (!uses.isEmpty()) {
      uses.forEach(out::line);
      out.blank();
    }
    final StringBuilder signature = new StringBuilder("pub fn ")
        .append(cx.functionName()).append('(');
    for (FreeFinder.Param param : cx.params) {
      if (signature.charAt(signature.length() - 1) != '(') {
        signature.append(", ");
      }
      signature.append(param.name).append(": ")
          .append(param.collection ? "&[" + cx.w.typeName(param.type) + "]"
              : cx.w.typeName(param.type));
    }
    signature.append(") -> ").append(resultType(cx)).append(" {");
    out.begin(signature.toString());
    writeNotes(cx);
    out.outdent();
    out.lines(body.toString().replaceAll("\n$", ""));
    out.line("}");
    for (String helper : cx.w.helpers) {
      out.blank();
      out.lines(requireNonNull(HELPERS.get(helper))
          .replace("$I", cx.w.intType()));
    }
  }

  private static String resultType(Context<RustExpWriter> cx) {
    final RustExpWriter w = cx.w;
    if (cx.reduceOp != null) {
      return w.typeName(cx.resultType());
    }
    switch (cx.c.op) {
      case LIST_COMP:
        return "Vec<" + w.typeName(cx.elementType()) + ">";
      case SET_COMP:
        return "HashSet<" + w.typeName(cx.elementType()) + ">";
      case DICT_COMP:
        return "HashMap<" + w.typeName(cx.keyType()) + ", "
            + w.typeName(cx.elementType()) + ">";
      default:
        throw new AssertionError(cx.c.op);
    }
  }

  private void sequentialBody(Context<RustExpWriter> cx, CodeWriter out) {
    chain(cx, out, 0, null);
    out.indent();
    terminal(cx, out, false);
    if (cx.reduceOp != null && cx.reduceOp.isSelection()) {
      unwrap(cx, out);
    }
    out.outdent();
  }

  /** Writes the iterator chain for generator {@code i} and the generators
   * nested inside it. If {@code source} is not null, it replaces the
   * source of the generator. */
  private void chain(Context<RustExpWriter> cx, CodeWriter out, int i,
      @Nullable String source) {
    final RustExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(i);
    final String move = i == 0 ? "" : "move ";
    out.line(source != null ? source : source(cx, g));
    out.indent();
    for (Core.Exp condition : cx.c.conditionsAt(i)) {
      out.line(".filter(" + move + "|&" + g.variable + "| "
          + w.write(condition) + ")");
    }
    if (i < cx.c.generators.size() - 1) {
      out.begin(".flat_map(" + move + "|" + g.variable + "| {");
      chain(cx, out, i + 1, null);
      out.end("})");
    } else if (cx.c.key != null) {
      out.line(".map(" + move + "|" + g.variable + "| (" + w.write(cx.c.key)
          + ", " + w.write(cx.c.element) + "))");
    } else if (!isVariable(cx.c.element, i)) {
      out.line(".map(" + move + "|" + g.variable + "| "
          + w.write(cx.c.element) + ")");
    }
    out.outdent();
  }

  /** Returns whether an expression is a reference to the variable of
   * generator {@code i}. */
  private static boolean isVariable(Core.Exp e, int i) {
    return e instanceof Core.Id && ((Core.Id) e).generatorIndex == i;
  }

  /** Returns an iterator over the values of a generator. */
  private static String source(Context<RustExpWriter> cx, Core.Generator g) {
    final RustExpWriter w = cx.w;
    if (g.iterable instanceof Core.OpaqueIterable) {
      return ((Core.OpaqueIterable) g.iterable).name + ".iter().copied()";
    }
    final Core.Range range = (Core.Range) g.iterable;
    final Long step = range.constantStep();
    final int intWidth = cx.options.intWidth();
    if (step == null) {
      w.helpers.add("py_range");
      return "py_range(" + w.write(range.start) + ", "
          + w.write(range.stop) + ", " + w.write(range.step) + ")";
    }
    if (step > 0) {
      return "(" + w.bound(range.start) + ".." + w.write(range.stop) + ")"
          + (step == 1 ? "" : ".step_by(" + step + ")");
    }
    // "range(10, 0, -3)" is 10, 7, 4, 1
    return "(" + w.bound(adjust(range.stop, 1, intWidth)) + ".."
        + w.write(adjust(range.start, 1, intWidth)) + ").rev()"
        + (step == -1 ? "" : ".step_by(" + -step + ")");
  }

  /** Writes the method that reduces or collects a chain. If
   * {@code chunk}, writes the reduction of one chunk of a parallel
   * program. */
  private static void terminal(Context<RustExpWriter> cx, CodeWriter out,
      boolean chunk) {
    final RustExpWriter w = cx.w;
    final String t = w.typeName(cx.elementType());
    if (cx.reduceOp == null) {
      out.line(".collect::<" + collectionType(cx, chunk) + ">()");
      return;
    }
    final Core.Exp initial = cx.initial();
    switch (cx.reduceOp) {
      case SUM:
      case PRODUCT:
        final String method = cx.reduceOp == ReduceOp.SUM ? "sum" : "product";
        if (initial == null || chunk) {
          out.line("." + method + "::<" + t + ">()");
        } else {
          out.line(".fold(" + w.write(initial) + ", |acc, v| acc "
              + (cx.reduceOp == ReduceOp.SUM ? "+" : "*") + " v)");
        }
        return;
      case ANY:
        out.line(".any(|v| v)");
        return;
      case ALL:
        out.line(".all(|v| v)");
        return;
      case MAX:
      case MIN:
        out.line(".reduce(|a, v| if v " + (cx.reduceOp == ReduceOp.MAX
            ? ">" : "<") + " a { v } else { a })");
        return;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  /** Returns the type of the collection that a comprehension collects
   * into; a chunk of a dict is a vector of pairs, so that the merge
   * preserves the order of writes. */
  private static String collectionType(Context<RustExpWriter> cx,
      boolean chunk) {
    final RustExpWriter w = cx.w;
    final String t = w.typeName(cx.elementType());
    switch (cx.c.op) {
      case LIST_COMP:
        return "Vec<" + t + ">";
      case SET_COMP:
        return "HashSet<" + t + ">";
      case DICT_COMP:
        final String k = w.typeName(cx.keyType());
        return chunk ? "Vec<(" + k + ", " + t + ")>"
            : "HashMap<" + k + ", " + t + ">";
      default:
        throw new AssertionError(cx.c.op);
    }
  }

  /** Writes the call that extracts the value of max or min, which fails if
   * the source was empty and there is no default. */
  private static void unwrap(Context<RustExpWriter> cx, CodeWriter out) {
    final Core.Exp initial = cx.initial();
    if (initial == null) {
      out.line(".expect(\"" + cx.emptyMessage() + "\")");
    } else {
      out.line(".unwrap_or(" + cx.w.write(initial) + ")");
    }
  }

  private void parallelBody(Context<RustExpWriter> cx, CodeWriter out) {
    final RustExpWriter w = cx.w;
    final Core.Generator g = cx.c.generators.get(0);
    final String value;
    if (g.iterable instanceof Core.Range) {
      final Core.Range range = (Core.Range) g.iterable;
      final Core.Exp length = rangeLength(range, cx.options.intWidth());
      if (length.op == Op.INT_LITERAL) {
        out.line("let count: usize = " + w.write(length) + ";");
      } else {
        out.line("let count = (" + w.write(length) + ") as usize;");
      }
      value = valueAt(w, range, "k as " + w.intType());
    } else {
      final String name = ((Core.OpaqueIterable) g.iterable).name;
      out.line("let count = " + name + ".len();");
      value = name + "[k]";
    }
    out.line("let workers = rayon::current_num_threads().max(1);");
    out.line("let chunk = (count + workers - 1) / workers;");
    out.line("let partials: Vec<" + partialType(cx) + "> = (0..workers)");
    out.indent();
    out.line(".into_par_iter()");
    out.begin(".map(|w| {");
    out.line("let lo = (w * chunk).min(count);");
    out.line("let hi = ((w + 1) * chunk).min(count);");
    out.line("(lo..hi)");
    out.indent();
    out.line(".map(|k| " + value + ")");
    out.outdent();
    // The chain continues from the values of the chunk.
    final CodeWriter chunk = new CodeWriter(indent());
    chain(cx, chunk, 0, "");
    chunk.indent();
    terminal(cx, chunk, true);
    chunk.outdent();
    out.indent();
    for (String line : chunk.toString().split("\n")) {
      if (!line.isEmpty()) {
        out.line(line.substring(indent().length()));
      }
    }
    out.outdent();
    out.end("})");
    out.line(".collect();");
    out.outdent();
    combine(cx, out);
  }

  /** Returns the type of the partial result of a chunk. */
  private static String partialType(Context<RustExpWriter> cx) {
    final RustExpWriter w = cx.w;
    if (cx.reduceOp == null) {
      return collectionType(cx, true);
    }
    switch (cx.reduceOp) {
      case ANY:
      case ALL:
        return "bool";
      case MAX:
      case MIN:
        return "Option<" + w.typeName(cx.elementType()) + ">";
      default:
        return w.typeName(cx.elementType());
    }
  }

  /** Writes the expression that combines the partial results of the
   * chunks, in chunk order. */
  private static void combine(Context<RustExpWriter> cx, CodeWriter out) {
    out.line("partials");
    out.indent();
    out.line(".into_iter()");
    if (cx.reduceOp == null) {
      out.line(".flatten()");
      out.line(".collect::<" + collectionType(cx, false) + ">()");
    } else if (cx.reduceOp.isSelection()) {
      out.line(".flatten()");
      terminal(cx, out, false);
      unwrap(cx, out);
    } else {
      terminal(cx, out, false);
    }
    out.outdent();
  }

  /** Writes expressions in Rust. */
  static class RustExpWriter extends ExpWriter {
    RustExpWriter(int intWidth) {
      super(intWidth);
    }

    String intType() {
      return intWidth == 32 ? "i32" : "i64";
    }

    @Override
    String typeName(PrimitiveType type) {
      switch (type) {
        case BOOL:
          return "bool";
        case INT:
          return intType();
        case REAL:
          return "f64";
        case STRING:
          return "String";
        default:
          throw new AssertionError(type);
      }
    }

    /** Writes the start of a range; an integer literal has a suffix, so
     * that the range has the right type. */
    String bound(Core.Exp e) {
      if (e.op == Op.INT_LITERAL) {
        return ((Core.Literal) e).value + intType();
      }
      return write(e);
    }

    @Override
    String stringLiteral(String s) {
      return "String::from(" + super.stringLiteral(s) + ")";
    }

    @Override
    @Nullable String opString(Op op, PrimitiveType type) {
      switch (op) {
        case AND:
          return " && ";
        case OR:
          return " || ";
        case NOT:
        case INVERT:
          return "!";
        case NEGATE:
          return "-";
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
        case MINUS:
        case TIMES:
        case DIVIDE:
          return op.opString;
        case PLUS:
          return type == PrimitiveType.STRING ? null : op.opString;
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
        case PLUS:
          b.append("format!(\"{}{}\", ");
          write(b, a0, 0, 0);
          b.append(", ");
          write(b, a1, 0, 0);
          b.append(')');
          return;
        case FLOOR_DIVIDE:
          if (real) {
            b.append('(');
            infix(b, a0, Op.DIVIDE, " / ", a1, 0, 0);
            b.append(").floor()");
          } else if (isPositiveInt(a1)) {
            // For a positive divisor, Euclidean division rounds down.
            method(b, a0, "div_euclid", a1);
          } else {
            helpers.add("py_div");
            function(b, "py_div", a0, a1);
          }
          return;
        case MOD:
          if (real) {
            helpers.add("py_fmod");
            function(b, "py_fmod", a0, a1);
          } else if (isPositiveInt(a1)) {
            method(b, a0, "rem_euclid", a1);
          } else {
            helpers.add("py_mod");
            function(b, "py_mod", a0, a1);
          }
          return;
        case POWER:
          if (real) {
            method(b, a0, "powf", a1);
          } else {
            receiver(b, a0);
            b.append(".pow(");
            if (a1.op == Op.INT_LITERAL) {
              write(b, a1, 0, 0);
            } else {
              write(b, a1, ATOM, ATOM);
              b.append(" as u32");
            }
            b.append(')');
          }
          return;
        default:
          throw new AssertionError(call.op);
      }
    }

    @Override
    void method(StringBuilder b, Core.Exp receiver, String name,
        Core.Exp... args) {
      receiver(b, receiver);
      function(b.append('.'), name, args);
    }

    /** Writes the receiver of a method call. A literal needs a suffix,
     * because Rust cannot call a method on a number of unknown type. */
    private void receiver(StringBuilder b, Core.Exp e) {
      switch (e.op) {
        case INT_LITERAL:
          number(b, ((Core.Literal) e).value + intType(), ATOM, ATOM);
          return;
        case REAL_LITERAL:
          number(b, realText((BigDecimal) ((Core.Literal) e).value)
              + "_f64", ATOM, ATOM);
          return;
        default:
          write(b, e, ATOM, ATOM);
      }
    }

    @Override
    void conditional(StringBuilder b, Core.If ifExp, int left,
        int right) {
      final boolean parens = left > 0 || right > 0;
      if (parens) {
        b.append('(');
      }
      b.append("if ");
      write(b, ifExp.condition, 0, 0);
      b.append(" { ");
      write(b, ifExp.ifTrue, 0, 0);
      b.append(" } else { ");
      write(b, ifExp.ifFalse, 0, 0);
      b.append(" }");
      if (parens) {
        b.append(')');
      }
    }

    @Override
    void cast(StringBuilder b, Core.Call call, int left, int right) {
      // Always parenthesized; "x as i64 < y" does not parse.
      b.append('(');
      write(b, call.arg(0), 0, Op.POWER.right);
      b.append(" as ").append(typeName(call.type())).append(')');
    }

    @Override
    void apply(StringBuilder b, Core.Apply apply) {
      if (apply.args.size() == 1) {
        final Core.Exp a = apply.args.get(0);
        switch (apply.fn) {
          case "abs":
            method(b, a, "abs");
            return;
          case "len":
            b.append('(');
            method(b, a, "len");
            b.append(" as ").append(intType()).append(')');
            return;
          case "int":
          case "float":
            final PrimitiveType t = apply.fn.equals("int")
                ? PrimitiveType.INT : PrimitiveType.REAL;
            if (a.type() == PrimitiveType.REAL && t == PrimitiveType.INT) {
              b.append('(');
              method(b, a, "trunc");
              b.append(" as ").append(intType()).append(')');
            } else {
              b.append('(');
              write(b, a, 0, Op.POWER.right);
              b.append(" as ").append(typeName(t)).append(')');
            }
            return;
          case "math.floor":
          case "math.ceil":
          case "round":
            b.append('(');
            if (a.type() == PrimitiveType.REAL) {
              method(b, a, apply.fn.equals("round") ? "round_ties_even"
                  : apply.fn.substring("math.".length()));
            } else {
              write(b, a, 0, Op.POWER.right);
            }
            b.append(" as ").append(intType()).append(')');
            return;
          case "str":
            method(b, a, "to_string");
            return;
          case "math.sqrt":
          case "math.exp":
          case "math.log":
          case "math.sin":
          case "math.cos":
            final String name = apply.fn.substring("math.".length());
            if (a.type() == PrimitiveType.REAL) {
              method(b, a, name);
            } else {
              b.append('(');
              write(b, a, 0, Op.POWER.right);
              b.append(" as f64).").append(name).append("()");
            }
            return;
          default:
            break;
        }
      }
      super.apply(b, apply);
    }
  }
}

// End RustRenderer.java
