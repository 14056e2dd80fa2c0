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

import java.math.BigDecimal;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Writes a typed {@link Core} expression in the syntax of a target language.
 *
 * <p>Parenthesization uses the binding strengths in {@link Op}, the same
 * scheme that {@link net.hydromatic.polyglot.ast.AstWriter} uses; a node is
 * parenthesized if it binds less tightly than its context requires.
 * Target languages disagree about the precedence of bit-wise operators, so
 * a bit-wise operation is always parenthesized if it is an operand, and its
 * own compound operands are parenthesized too.
 *
 * <p>Operators whose semantics differ between languages (floor division,
 * modulo, power, string concatenation) have no default spelling; each
 * target writes them in {@link #special}, often as a call to a helper
 * function. The names of the helpers used are collected in
 * {@link #helpers}, so that the renderer can define them.
 */
abstract class ExpWriter {
  /** Binding strength of an atom, such as an identifier or a function
   * call. */
  static final int ATOM = 30;

  /** Width of integers, 32 or 64. */
  final int intWidth;

  /** Helper functions that the written expressions call. */
  final SortedSet<String> helpers = new TreeSet<>();

  ExpWriter(int intWidth) {
    this.intWidth = intWidth;
  }

  /** Returns the name of a type in the target language. */
  abstract String typeName(PrimitiveType type);

  /** Returns the spelling of an operator, padded with spaces if it is
   * infix, or null if it is written by {@link #special}.
   *
   * @param op Operator
   * @param type Type of the operands
   */
  abstract @Nullable String opString(Op op, PrimitiveType type);

  /** Writes a call to an operator that has no spelling. */
  abstract void special(StringBuilder b, Core.Call call, int left,
      int right);

  /** Writes a conditional expression. */
  abstract void conditional(StringBuilder b, Core.If ifExp, int left,
      int right);

  /** Writes a conversion to {@code call.type}. */
  abstract void cast(StringBuilder b, Core.Call call, int left, int right);

  /** Writes an expression as a string, in a context that binds no
   * operand. */
  String write(Core.Exp e) {
    return write(e, 0, 0);
  }

  /** Writes an expression as a string, in a given context. */
  String write(Core.Exp e, int left, int right) {
    final StringBuilder b = new StringBuilder();
    write(b, e, left, right);
    return b.toString();
  }

  void write(StringBuilder b, Core.Exp e, int left, int right) {
    switch (e.op) {
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
        literal(b, (Core.Literal) e, left, right);
        return;
      case ID:
        id(b, (Core.Id) e);
        return;
      case IF_EXP:
        conditional(b, (Core.If) e, left, right);
        return;
      case APPLY:
        apply(b, (Core.Apply) e);
        return;
      case CAST:
        cast(b, (Core.Call) e, left, right);
        return;
      default:
        call(b, (Core.Call) e, left, right);
    }
  }

  void literal(StringBuilder b, Core.Literal literal, int left,
      int right) {
    switch (literal.op) {
      case BOOL_LITERAL:
        b.append(literal.booleanValue());
        return;
      case STRING_LITERAL:
        b.append(stringLiteral((String) literal.value));
        return;
      case REAL_LITERAL:
        number(b, realText((BigDecimal) literal.value), left, right);
        return;
      default:
        number(b, literal.value.toString(), left, right);
    }
  }

  /** Writes a number, parenthesizing it if it is negative and the context
   * binds more tightly than negation. */
  static void number(StringBuilder b, String s, int left, int right) {
    if (s.startsWith("-")
        && (left > Op.NEGATE.left || Op.NEGATE.right < right)) {
      b.append('(').append(s).append(')');
    } else {
      b.append(s);
    }
  }

  /** Returns the text of a real number, which always contains a decimal
   * point or an exponent. */
  static String realText(BigDecimal value) {
    final String s = value.toString();
    return s.contains(".") || s.contains("E") ? s : s + ".0";
  }

  /** Returns a string literal; by default, double-quoted with
   * backslash escapes. */
  String stringLiteral(String s) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
        case '\\':
          b.append('\\').append(c);
          break;
        case '\n':
          b.append("\\n");
          break;
        case '\t':
          b.append("\\t");
          break;
        case '\r':
          b.append("\\r");
          break;
        default:
          b.append(c);
      }
    }
    return b.append('"').toString();
  }

  void id(StringBuilder b, Core.Id id) {
    b.append(id.name);
  }

  /** Writes a call to an uninterpreted function. By default, writes
   * {@code f(a, b)} using the name from {@link #functionName}. */
  void apply(StringBuilder b, Core.Apply apply) {
    b.append(functionName(apply.fn)).append('(');
    for (int i = 0; i < apply.args.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      write(b, apply.args.get(i), 0, 0);
    }
    b.append(')');
  }

  /** Returns the name of a function in the target language; by default the
   * same as in the source. */
  String functionName(String fn) {
    return fn;
  }

  /** Returns the binding strength of a prefix operator. */
  int prefixStrength(Op op) {
    return Op.NEGATE.left;
  }

  void call(StringBuilder b, Core.Call call, int left, int right) {
    final PrimitiveType argType = call.arg(0).type();
    Op op = call.op;
    if (call.type() == PrimitiveType.BOOL && op.isBitwise()) {
      // On booleans, "&" is "and", "|" is "or", "^" is "!="
      op = op == Op.BIT_AND ? Op.AND
          : op == Op.BIT_OR ? Op.OR
          : Op.NE;
    }
    final String opString = opString(op, argType);
    if (opString == null) {
      special(b, call, left, right);
    } else if (call.isPrefix()) {
      prefix(b, op, opString, call.arg(0), left, right);
    } else {
      infix(b, call.arg(0), op, opString, call.arg(1), left, right);
    }
  }

  void prefix(StringBuilder b, Op op, String opString, Core.Exp a,
      int left, int right) {
    final int strength = prefixStrength(op);
    final boolean parens = op.isBitwise()
        ? left > 0 || right > 0
        : left > strength || strength < right;
    if (parens) {
      b.append('(');
      right = 0;
    }
    b.append(opString);
    if (op.isBitwise() || isNegativeOrPrefix(a)) {
      // Avoid "--x" and "!!x"
      write(b, a, ATOM, ATOM);
    } else {
      write(b, a, strength, right);
    }
    if (parens) {
      b.append(')');
    }
  }

  private static boolean isNegativeOrPrefix(Core.Exp a) {
    if (a instanceof Core.Call) {
      return ((Core.Call) a).isPrefix() && a.op != Op.CAST;
    }
    return a.op.isLiteral()
        && a.op != Op.BOOL_LITERAL
        && a.op != Op.STRING_LITERAL
        && ((BigDecimal) ((Core.Literal) a).value).signum() < 0;
  }

  void infix(StringBuilder b, Core.Exp a0, Op op, String opString,
      Core.Exp a1, int left, int right) {
    final boolean bitwise = op.isBitwise();
    final boolean parens = bitwise
        ? left > 0 || right > 0
        : left > op.left || op.right < right;
    if (parens) {
      b.append('(');
      left = 0;
      right = 0;
    }
    if (bitwise) {
      write(b, a0, left, ATOM);
      b.append(opString);
      write(b, a1, ATOM, right);
    } else if (op.nonAssociative) {
      write(b, a0, left, op.left + 1);
      b.append(opString);
      write(b, a1, op.right + 1, right);
    } else {
      write(b, a0, left, op.left);
      b.append(opString);
      write(b, a1, op.right, right);
    }
    if (parens) {
      b.append(')');
    }
  }

  /** Writes a call to a function, {@code name(a0, a1, ...)}. */
  void function(StringBuilder b, String name, Core.Exp... args) {
    b.append(name).append('(');
    for (int i = 0; i < args.length; i++) {
      if (i > 0) {
        b.append(", ");
      }
      write(b, args[i], 0, 0);
    }
    b.append(')');
  }

  /** Writes a call to a method, {@code receiver.name(a0, ...)}. */
  void method(StringBuilder b, Core.Exp receiver, String name,
      Core.Exp... args) {
    write(b, receiver, ATOM, ATOM);
    function(b.append('.'), name, args);
  }

  /** Returns whether an expression is a positive integer literal. */
  static boolean isPositiveInt(Core.Exp e) {
    return e.op == Op.INT_LITERAL
        && ((BigDecimal) ((Core.Literal) e).value).signum() > 0;
  }
}

// End ExpWriter.java
