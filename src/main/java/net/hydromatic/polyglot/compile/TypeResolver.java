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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.Pos;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.ast.Shuttle;
import net.hydromatic.polyglot.ast.Visitor;
import net.hydromatic.polyglot.type.PrimitiveType;
import net.hydromatic.polyglot.type.TypeAnnotation;
import net.hydromatic.polyglot.util.PolyglotException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns a type to every expression in a program, and attaches a
 * {@link TypeAnnotation} to the comprehension and reduction.
 *
 * <p>Never modifies its argument; returns a new program. Types are
 * recomputed from the structure of the program, ignoring any types already
 * present, so running the resolver on its own output gives an identical
 * program.
 *
 * <p>Besides assigning types, the resolver makes implicit conversions
 * explicit, so that renderers for statically typed targets need not deal
 * with them:
 *
 * <ul>
 *   <li>a boolean in arithmetic becomes an integer, and an integer mixed
 *       with a real becomes a real (a {@link Op#CAST} call);
 *   <li>a non-boolean used as a condition (a filter, the condition of a
 *       conditional expression, the operand of {@code not}, the element of
 *       {@code any} or {@code all}) is compared with zero or the empty
 *       string;
 *   <li>{@code a and b} on non-boolean values, which returns one of its
 *       operands, becomes {@code b if a else a}.
 * </ul>
 *
 * <p>If the type of an expression cannot be determined (a free variable, an
 * element of an opaque collection, a call to an unknown function) it
 * defaults to integer and the annotation is marked as a fallback; in strict
 * mode, a {@link TypeException} is thrown instead.
 */
public class TypeResolver {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(TypeResolver.class);

  /** Result types of functions that we know. A null value means "same as
   * the first argument". */
  private static final ImmutableMap<String, PrimitiveType> FUNCTION_TYPES =
      ImmutableMap.<String, PrimitiveType>builder()
          .put("int", PrimitiveType.INT)
          .put("len", PrimitiveType.INT)
          .put("ord", PrimitiveType.INT)
          .put("math.floor", PrimitiveType.INT)
          .put("math.ceil", PrimitiveType.INT)
          .put("math.isqrt", PrimitiveType.INT)
          .put("math.gcd", PrimitiveType.INT)
          .put("float", PrimitiveType.REAL)
          .put("math.sqrt", PrimitiveType.REAL)
          .put("math.exp", PrimitiveType.REAL)
          .put("math.log", PrimitiveType.REAL)
          .put("math.sin", PrimitiveType.REAL)
          .put("math.cos", PrimitiveType.REAL)
          .put("bool", PrimitiveType.BOOL)
          .put("str", PrimitiveType.STRING)
          .put("chr", PrimitiveType.STRING)
          .build();

  private final int intWidth;
  private final boolean strict;
  /** Free variables that are used as a bound of a range, and are
   * therefore integers. */
  private final Set<String> rangeParams = new HashSet<>();
  private boolean fallback;

  private TypeResolver(int intWidth, boolean strict) {
    this.intWidth = intWidth;
    this.strict = strict;
  }

  /** Infers the types of a program.
   *
   * @param program Program; may or may not have been annotated already
   * @param intWidth Width of integers, 32 or 64
   * @param strict Whether to throw rather than use a default type
   * @return Annotated program
   */
  public static Core.Program infer(Core.Program program, int intWidth,
      boolean strict) {
    return new TypeResolver(intWidth, strict).program(program);
  }

  private Core.Program program(Core.Program program) {
    program.accept(new Visitor() {
      @Override
      public void visit(Core.Range range) {
        for (Core.Exp e : new Core.Exp[] {range.start, range.stop,
            range.step}) {
          if (e instanceof Core.Id && ((Core.Id) e).isFree()) {
            rangeParams.add(((Core.Id) e).name);
          }
        }
        super.visit(range);
      }
    });
    final Core.Program result;
    if (program instanceof Core.Reduction) {
      result = reduction((Core.Reduction) program);
    } else {
      result = comprehension((Core.Comprehension) program);
    }
    LOGGER.debug("inferred {} for {}", result.annotation, result);
    return result;
  }

  private Core.Reduction reduction(Core.Reduction reduction) {
    final Core.Comprehension source0 = comprehension(reduction.source);
    Core.Exp element = source0.element;
    Core.@Nullable Exp initial = reduction.initial == null ? null
        : reduction.initial.accept(new ExpTyper());
    final PrimitiveType resultType;
    switch (reduction.reduceOp) {
      case ANY:
      case ALL:
        element = truth(element);
        resultType = PrimitiveType.BOOL;
        break;
      case SUM:
      case PRODUCT:
        PrimitiveType t = element.type() == PrimitiveType.BOOL
            ? PrimitiveType.INT : element.type();
        if (t == PrimitiveType.STRING) {
          t = fallback(reduction.pos, "cannot " + reduction.reduceOp.kind
              .toLowerCase(Locale.ROOT) + " strings");
        }
        if (initial != null) {
          final PrimitiveType t2 =
              PrimitiveType.arithmetic(t, initial.type());
          t = t2 != null ? t2 : fallback(initial.pos,
              "incompatible initial value of type " + initial.type());
          initial = cast(initial, t);
        }
        element = cast(element, t);
        resultType = t;
        break;
      case MAX:
      case MIN:
        PrimitiveType t3 = element.type();
        if (initial != null) {
          final PrimitiveType t4 =
              PrimitiveType.union(t3, initial.type());
          t3 = t4 != null ? t4 : fallback(initial.pos,
              "incompatible default value of type " + initial.type());
          initial = cast(initial, t3);
          element = cast(element, t3);
        }
        resultType = t3;
        break;
      default:
        throw new AssertionError(reduction.reduceOp);
    }
    final TypeAnnotation annotation =
        TypeAnnotation.of(element.type(), intWidth, fallback);
    final Core.Comprehension source =
        source0.copy(null, element, source0.generators, source0.filters,
            source0.empty, annotation);
    return reduction.copy(source, initial,
        annotation.withResultType(resultType));
  }

  private Core.Comprehension comprehension(Core.Comprehension c) {
    final ExpTyper typer = new ExpTyper();
    final List<Core.Generator> generators = new ArrayList<>();
    for (Core.Generator generator : c.generators) {
      final Core.Iter iterable;
      if (generator.iterable instanceof Core.Range) {
        final Core.Range range = (Core.Range) generator.iterable;
        iterable = range.copy(bound(range.start, typer),
            bound(range.stop, typer), bound(range.step, typer));
      } else {
        fallback(generator.iterable.pos, "element type of '"
            + ((Core.OpaqueIterable) generator.iterable).name
            + "' is unknown; assuming int");
        iterable = generator.iterable;
      }
      final List<Core.Exp> conditions = new ArrayList<>();
      generator.conditions.forEach(e -> conditions.add(truth(e.accept(typer))));
      generators.add(generator.copy(iterable, conditions));
    }
    final List<Core.Filter> filters = new ArrayList<>();
    c.filters.forEach(f ->
        filters.add(f.copy(truth(f.condition.accept(typer)))));
    final Core.@Nullable Exp key = c.key == null ? null : c.key.accept(typer);
    final Core.Exp element = c.element.accept(typer);
    final TypeAnnotation annotation = key == null
        ? TypeAnnotation.of(element.type(), intWidth, fallback)
        : TypeAnnotation.ofDict(key.type(), element.type(), intWidth,
            fallback);
    return c.copy(key, element, generators, filters, c.empty, annotation);
  }

  /** Types a bound of a range, which must be an integer. */
  private Core.Exp bound(Core.Exp e, ExpTyper typer) {
    final Core.Exp e2 = e.accept(typer);
    switch (e2.type()) {
      case INT:
        return e2;
      case BOOL:
        return cast(e2, PrimitiveType.INT);
      default:
        fallback(e.pos, "range() argument must be an integer, got "
            + e2.type());
        return e2;
    }
  }

  /** Records that a type could not be inferred; throws in strict mode,
   * otherwise returns the default type, integer. */
  private PrimitiveType fallback(Pos pos, String message) {
    if (strict) {
      throw new TypeException(message, pos);
    }
    LOGGER.debug("type inference fallback at {}: {}", pos, message);
    fallback = true;
    return PrimitiveType.INT;
  }

  /** Converts an expression to a given type, if it does not have that type
   * already. */
  private static Core.Exp cast(Core.Exp e, PrimitiveType type) {
    if (e.type() == type
        || !e.type().isNumeric()
        || !type.isNumeric()
        || type == PrimitiveType.BOOL) {
      return e;
    }
    if (e.isConstant()) {
      // Convert "1" to "1.0" and "True" to "1" without a call.
      final Comparable v = ((Core.Literal) e).value;
      final BigDecimal d = v instanceof Boolean
          ? ((Boolean) v ? BigDecimal.ONE : BigDecimal.ZERO)
          : (BigDecimal) v;
      return core.literal(e.pos, type, d);
    }
    return core.cast(e, type);
  }

  /** Converts an expression to a boolean, the way that a condition is
   * tested. */
  private static Core.Exp truth(Core.Exp e) {
    switch (e.type()) {
      case BOOL:
        return e;
      case STRING:
        return core.call(e.pos, Op.NE, e, core.stringLiteral(Pos.ZERO, ""),
            PrimitiveType.BOOL);
      case REAL:
        return core.call(e.pos, Op.NE, e,
            core.realLiteral(Pos.ZERO, BigDecimal.ZERO), PrimitiveType.BOOL);
      default:
        return core.call(e.pos, Op.NE, e, core.intLiteral(0),
            PrimitiveType.BOOL);
    }
  }

  /** Shuttle that assigns types to expressions. */
  private class ExpTyper extends Shuttle {
    @Override
    public Core.Exp visit(Core.Literal literal) {
      switch (literal.op) {
        case INT_LITERAL:
          return literal.withType(PrimitiveType.INT);
        case REAL_LITERAL:
          return literal.withType(PrimitiveType.REAL);
        case BOOL_LITERAL:
          return literal.withType(PrimitiveType.BOOL);
        default:
          return literal.withType(PrimitiveType.STRING);
      }
    }

    @Override
    public Core.Exp visit(Core.Id id) {
      if (!id.isFree() || rangeParams.contains(id.name)) {
        return id.withType(PrimitiveType.INT);
      }
      return id.withType(
          fallback(id.pos, "type of '" + id.name + "' is unknown"));
    }

    @Override
    public Core.Exp visit(Core.If ifExp) {
      final Core.Exp condition = truth(ifExp.condition.accept(this));
      final Core.Exp ifTrue = ifExp.ifTrue.accept(this);
      final Core.Exp ifFalse = ifExp.ifFalse.accept(this);
      PrimitiveType type = PrimitiveType.union(ifTrue.type(), ifFalse.type());
      if (type == null) {
        type = fallback(ifExp.pos, "branches have incompatible types "
            + ifTrue.type() + " and " + ifFalse.type());
      }
      return ifExp.copy(condition, cast(ifTrue, type), cast(ifFalse, type))
          .withType(type);
    }

    @Override
    public Core.Exp visit(Core.Apply apply) {
      final Core.Apply apply2 = (Core.Apply) super.visit(apply);
      final PrimitiveType type;
      if (FUNCTION_TYPES.containsKey(apply2.fn)) {
        type = FUNCTION_TYPES.get(apply2.fn);
      } else if (apply2.fn.equals("abs") && apply2.args.size() == 1) {
        type = apply2.args.get(0).type() == PrimitiveType.BOOL
            ? PrimitiveType.INT : apply2.args.get(0).type();
      } else if (apply2.fn.equals("round")) {
        type = apply2.args.size() == 1 ? PrimitiveType.INT
            : PrimitiveType.REAL;
      } else {
        type = fallback(apply.pos,
            "result type of '" + apply2.fn + "' is unknown");
      }
      return apply2.withType(type);
    }

    @Override
    public Core.Exp visit(Core.Call call) {
      if (call.op == Op.CAST) {
        // A conversion keeps the type it was created with.
        final Core.Exp arg = call.arg(0).accept(this);
        return call.copy(ImmutableList.of(arg));
      }
      if (call.isPrefix()) {
        return prefix(call, call.arg(0).accept(this));
      }
      return infix(call, call.arg(0).accept(this), call.arg(1).accept(this));
    }

    private Core.Exp prefix(Core.Call call, Core.Exp a) {
      switch (call.op) {
        case NOT:
          return call.copy(ImmutableList.of(truth(a)))
              .withType(PrimitiveType.BOOL);
        case NEGATE:
        case INVERT:
          PrimitiveType t = a.type() == PrimitiveType.BOOL
              ? PrimitiveType.INT : a.type();
          if (t == PrimitiveType.STRING
              || t == PrimitiveType.REAL && call.op == Op.INVERT) {
            t = fallback(call.pos, "bad operand type for unary "
                + call.op.opString + ": " + a.type());
          }
          return call.copy(
              ImmutableList.of(cast(a, t)))
              .withType(t);
        default:
          throw new AssertionError(call.op);
      }
    }

    private Core.Exp infix(Core.Call call, Core.Exp a0, Core.Exp a1) {
      final PrimitiveType t0 = a0.type();
      final PrimitiveType t1 = a1.type();
      switch (call.op) {
        case AND:
        case OR:
          if (t0 == PrimitiveType.BOOL && t1 == PrimitiveType.BOOL) {
            return call.copy(ImmutableList.of(a0, a1))
                .withType(PrimitiveType.BOOL);
          }
          // "a and b" is "b if a else a"; "a or b" is "a if a else b"
          final Core.If ifExp = call.op == Op.AND
              ? core.ifExp(call.pos, a0, a1, a0)
              : core.ifExp(call.pos, a0, a0, a1);
          return visit(ifExp);

        case EQ:
        case NE:
        case LT:
        case LE:
        case GT:
        case GE:
          PrimitiveType t = PrimitiveType.union(t0, t1);
          if (t == null) {
            t = fallback(call.pos, "cannot compare " + t0 + " with " + t1);
            return call.copy(ImmutableList.of(a0, a1))
                .withType(PrimitiveType.BOOL);
          }
          if (t0 == PrimitiveType.BOOL && t1 == PrimitiveType.BOOL) {
            t = PrimitiveType.BOOL;
          }
          return call.copy(
              ImmutableList.of(cast(a0, t),
                  cast(a1, t)))
              .withType(PrimitiveType.BOOL);

        case BIT_AND:
        case BIT_OR:
        case BIT_XOR:
          if (t0 == PrimitiveType.BOOL && t1 == PrimitiveType.BOOL) {
            return call.copy(ImmutableList.of(a0, a1))
                .withType(PrimitiveType.BOOL);
          }
          // fall through
        case LSHIFT:
        case RSHIFT:
          if (t0 == PrimitiveType.REAL || t0 == PrimitiveType.STRING
              || t1 == PrimitiveType.REAL || t1 == PrimitiveType.STRING) {
            fallback(call.pos, "unsupported operand types for "
                + call.op.opString.trim() + ": " + t0 + " and " + t1);
          }
          return call.copy(
              ImmutableList.of(
                  cast(a0, PrimitiveType.INT), cast(a1, PrimitiveType.INT)))
              .withType(PrimitiveType.INT);

        case DIVIDE:
          if (t0 == PrimitiveType.STRING || t1 == PrimitiveType.STRING) {
            fallback(call.pos, "unsupported operand types for /: " + t0
                + " and " + t1);
          }
          return call.copy(
              ImmutableList.of(
                  cast(a0, PrimitiveType.REAL), cast(a1, PrimitiveType.REAL)))
              .withType(PrimitiveType.REAL);

        case POWER:
          PrimitiveType tp = PrimitiveType.arithmetic(t0, t1);
          if (tp == null || tp == PrimitiveType.STRING) {
            tp = fallback(call.pos, "unsupported operand types for **: "
                + t0 + " and " + t1);
          } else if (tp == PrimitiveType.INT
              && a1.isConstant()
              && ((BigDecimal) ((Core.Literal) a1).value).signum() < 0) {
            // "2 ** -1" is 0.5
            tp = PrimitiveType.REAL;
          }
          return call.copy(
              ImmutableList.of(cast(a0, tp),
                  tp == PrimitiveType.REAL ? cast(a1, tp)
                      : cast(a1, PrimitiveType.INT)))
              .withType(tp);

        case PLUS:
        case MINUS:
        case TIMES:
        case FLOOR_DIVIDE:
        case MOD:
          PrimitiveType ta = PrimitiveType.arithmetic(t0, t1);
          if (ta == null || ta == PrimitiveType.STRING && call.op != Op.PLUS) {
            ta = fallback(call.pos, "unsupported operand types for "
                + call.op.opString.trim() + ": " + t0 + " and " + t1);
          }
          return call.copy(
              ImmutableList.of(cast(a0, ta),
                  cast(a1, ta)))
              .withType(ta);

        default:
          throw new AssertionError(call.op);
      }
    }
  }

  /** Error raised when the type of an expression cannot be inferred and
   * strict mode is on. */
  public static class TypeException extends RuntimeException
      implements PolyglotException {
    private final Pos pos;

    public TypeException(String message, Pos pos) {
      super(message);
      this.pos = pos;
    }

    @Override
    public String toString() {
      return super.toString() + " at " + pos;
    }

    @Override
    public Pos pos() {
      return pos;
    }

    @Override
    public StringBuilder describeTo(StringBuilder buf) {
      return pos.describeTo(buf).append(" Error: ").append(getMessage());
    }
  }
}

// End TypeResolver.java
