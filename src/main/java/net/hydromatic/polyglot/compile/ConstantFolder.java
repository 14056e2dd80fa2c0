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

import static net.hydromatic.polyglot.ast.CoreBuilder.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replaces sub-expressions that have no free variables with their values.
 *
 * <p>Evaluation follows the semantics of the source language: integer
 * division and modulo round towards negative infinity, and booleans count as
 * 0 and 1 in arithmetic. An expression is left alone if evaluating it would
 * fail (division by zero, a negative shift), or if its value would not fit
 * in an integer of the target width.
 */
public class ConstantFolder extends Shuttle {
  /** Largest exponent or shift that we are prepared to evaluate. */
  private static final int MAX_EXPONENT = 256;

  private final int intWidth;

  public ConstantFolder(int intWidth) {
    this.intWidth = intWidth;
  }

  @Override
  public Core.Exp visit(Core.Call call) {
    final Core.Call call2 = (Core.Call) super.visit(call);
    for (Core.Exp arg : call2.args) {
      if (!arg.isConstant()) {
        return call2;
      }
    }
    final Comparable value = evaluate(call2);
    if (value == null || !fits(value)) {
      return call2;
    }
    final Core.Literal literal = toLiteral(call2, value);
    if (call2.type != null && literal.type != call2.type) {
      return call2;
    }
    return literal;
  }

  @Override
  public Core.Exp visit(Core.If ifExp) {
    final Core.If ifExp2 = (Core.If) super.visit(ifExp);
    if (!ifExp2.condition.isConstant()) {
      return ifExp2;
    }
    final Comparable value = evaluate(ifExp2.condition);
    if (value == null) {
      return ifExp2;
    }
    final Core.Exp branch = truthy(value) ? ifExp2.ifTrue : ifExp2.ifFalse;
    return branch.type == ifExp2.type ? branch : ifExp2;
  }

  private boolean fits(Comparable value) {
    if (value instanceof BigInteger) {
      return ((BigInteger) value).bitLength() < intWidth;
    }
    if (value instanceof Double) {
      return !((Double) value).isNaN() && !((Double) value).isInfinite();
    }
    return true;
  }

  private static Core.Literal toLiteral(Core.Exp e, Comparable value) {
    if (value instanceof BigInteger) {
      return core.intLiteral(e.pos, new BigDecimal((BigInteger) value));
    }
    if (value instanceof Double) {
      return core.realLiteral(e.pos, BigDecimal.valueOf((Double) value));
    }
    if (value instanceof Boolean) {
      return core.boolLiteral(e.pos, (Boolean) value);
    }
    return core.stringLiteral(e.pos, (String) value);
  }

  /**
   * Evaluates an expression that has no free variables.
   *
   * <p>Returns a {@link BigInteger} for an integer, a {@link Double} for a
   * real, a {@link Boolean} or a {@link String}; or null if the expression
   * references a variable or calls a function, or if evaluation would
   * fail.
   */
  public static @Nullable Comparable evaluate(Core.Exp e) {
    switch (e.op) {
      case INT_LITERAL:
        return ((BigDecimal) ((Core.Literal) e).value).toBigIntegerExact();
      case REAL_LITERAL:
        return ((BigDecimal) ((Core.Literal) e).value).doubleValue();
      case BOOL_LITERAL:
      case STRING_LITERAL:
        return ((Core.Literal) e).value;
      case IF_EXP:
        final Core.If ifExp = (Core.If) e;
        final Comparable c = evaluate(ifExp.condition);
        return c == null ? null
            : evaluate(truthy(c) ? ifExp.ifTrue : ifExp.ifFalse);
      case ID:
      case APPLY:
        return null;
      default:
        break;
    }
    final Core.Call call = (Core.Call) e;
    final List<Comparable> values = new ArrayList<>();
    for (Core.Exp arg : call.args) {
      final Comparable value = evaluate(arg);
      if (value == null) {
        return null;
      }
      values.add(value);
    }
    if (call.isPrefix()) {
      return unary(call.op, values.get(0));
    }
    return binary(call.op, values.get(0), values.get(1));
  }

  /** Returns whether a value is "truthy": not false, zero or empty. */
  static boolean truthy(Comparable v) {
    if (v instanceof Boolean) {
      return (Boolean) v;
    }
    if (v instanceof BigInteger) {
      return ((BigInteger) v).signum() != 0;
    }
    if (v instanceof Double) {
      return (Double) v != 0d;
    }
    return !((String) v).isEmpty();
  }

  private static @Nullable Comparable unary(Op op, Comparable v) {
    switch (op) {
      case NOT:
        return !truthy(v);
      case NEGATE:
        if (v instanceof Double) {
          return -(Double) v;
        }
        return v instanceof String ? null : toInteger(v).negate();
      case INVERT:
        return v instanceof Double || v instanceof String ? null
            : toInteger(v).not();
      default:
        return null;
    }
  }

  private static @Nullable Comparable binary(Op op, Comparable v0,
      Comparable v1) {
    switch (op) {
      case AND:
        return truthy(v0) ? v1 : v0;
      case OR:
        return truthy(v0) ? v0 : v1;
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return compare(op, v0, v1);
      default:
        break;
    }
    if (v0 instanceof String || v1 instanceof String) {
      return op == Op.PLUS && v0 instanceof String && v1 instanceof String
          ? (String) v0 + v1
          : null;
    }
    if (v0 instanceof Double || v1 instanceof Double) {
      return real(op, toDouble(v0), toDouble(v1));
    }
    if (v0 instanceof Boolean && v1 instanceof Boolean) {
      switch (op) {
        case BIT_AND:
          return (Boolean) v0 & (Boolean) v1;
        case BIT_OR:
          return (Boolean) v0 | (Boolean) v1;
        case BIT_XOR:
          return (Boolean) v0 ^ (Boolean) v1;
        default:
          break;
      }
    }
    return integer(op, toInteger(v0), toInteger(v1));
  }

  private static @Nullable Comparable integer(Op op, BigInteger a,
      BigInteger b) {
    switch (op) {
      case PLUS:
        return a.add(b);
      case MINUS:
        return a.subtract(b);
      case TIMES:
        return a.multiply(b);
      case DIVIDE:
        return b.signum() == 0 ? null : a.doubleValue() / b.doubleValue();
      case FLOOR_DIVIDE:
        if (b.signum() == 0) {
          return null;
        }
        final BigInteger[] qr = a.divideAndRemainder(b);
        return qr[1].signum() != 0 && qr[1].signum() != b.signum()
            ? qr[0].subtract(BigInteger.ONE)
            : qr[0];
      case MOD:
        if (b.signum() == 0) {
          return null;
        }
        final BigInteger r = a.mod(b.abs());
        return b.signum() < 0 && r.signum() != 0 ? r.add(b) : r;
      case POWER:
        if (b.signum() < 0) {
          return a.signum() == 0 ? null : Math.pow(a.doubleValue(),
              b.doubleValue());
        }
        return b.intValue() > MAX_EXPONENT || b.bitLength() > 31 ? null
            : a.pow(b.intValue());
      case BIT_AND:
        return a.and(b);
      case BIT_OR:
        return a.or(b);
      case BIT_XOR:
        return a.xor(b);
      case LSHIFT:
        return b.signum() < 0 || b.compareTo(BigInteger.valueOf(MAX_EXPONENT))
            > 0 ? null : a.shiftLeft(b.intValue());
      case RSHIFT:
        return b.signum() < 0 || b.compareTo(BigInteger.valueOf(MAX_EXPONENT))
            > 0 ? null : a.shiftRight(b.intValue());
      default:
        return null;
    }
  }

  private static @Nullable Comparable real(Op op, double a, double b) {
    switch (op) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case TIMES:
        return a * b;
      case DIVIDE:
        return b == 0d ? null : a / b;
      case FLOOR_DIVIDE:
        return b == 0d ? null : Math.floor(a / b);
      case MOD:
        return b == 0d ? null : a - b * Math.floor(a / b);
      case POWER:
        return a < 0d && b != Math.rint(b) ? null : Math.pow(a, b);
      default:
        return null;
    }
  }

  private static @Nullable Comparable compare(Op op, Comparable v0,
      Comparable v1) {
    final int c;
    if (v0 instanceof String || v1 instanceof String) {
      if (!(v0 instanceof String && v1 instanceof String)) {
        // "1 == 'a'" is false, "1 < 'a'" fails
        return op == Op.EQ ? Boolean.FALSE
            : op == Op.NE ? Boolean.TRUE
            : null;
      }
      c = ((String) v0).compareTo((String) v1);
    } else if (v0 instanceof Double || v1 instanceof Double) {
      c = Double.compare(toDouble(v0), toDouble(v1));
    } else {
      c = toInteger(v0).compareTo(toInteger(v1));
    }
    switch (op) {
      case EQ:
        return c == 0;
      case NE:
        return c != 0;
      case LT:
        return c < 0;
      case LE:
        return c <= 0;
      case GT:
        return c > 0;
      case GE:
        return c >= 0;
      default:
        throw new AssertionError(op);
    }
  }

  private static BigInteger toInteger(Comparable v) {
    if (v instanceof Boolean) {
      return (Boolean) v ? BigInteger.ONE : BigInteger.ZERO;
    }
    return (BigInteger) v;
  }

  private static double toDouble(Comparable v) {
    if (v instanceof Double) {
      return (Double) v;
    }
    return toInteger(v).doubleValue();
  }
}

// End ConstantFolder.java
