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
package net.hydromatic.polyglot.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import net.hydromatic.polyglot.type.PrimitiveType;
import net.hydromatic.polyglot.type.TypeAnnotation;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds nodes in the {@link Core} intermediate representation. */
public enum CoreBuilder {
  /**
   * The singleton instance of the Core builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  core;

  /** Creates an integer literal. */
  public Core.Literal intLiteral(long value) {
    return intLiteral(Pos.ZERO, BigDecimal.valueOf(value));
  }

  /** Creates an integer literal with a position. */
  public Core.Literal intLiteral(Pos pos, BigDecimal value) {
    return new Core.Literal(pos, Op.INT_LITERAL, value, PrimitiveType.INT);
  }

  /** Creates a floating-point literal. */
  public Core.Literal realLiteral(Pos pos, BigDecimal value) {
    return new Core.Literal(pos, Op.REAL_LITERAL, value, PrimitiveType.REAL);
  }

  /** Creates a boolean literal. */
  public Core.Literal boolLiteral(boolean value) {
    return boolLiteral(Pos.ZERO, value);
  }

  /** Creates a boolean literal with a position. */
  public Core.Literal boolLiteral(Pos pos, boolean value) {
    return new Core.Literal(pos, Op.BOOL_LITERAL, value, PrimitiveType.BOOL);
  }

  /** Creates a string literal. */
  public Core.Literal stringLiteral(Pos pos, String value) {
    return new Core.Literal(pos, Op.STRING_LITERAL, value,
        PrimitiveType.STRING);
  }

  /** Creates a literal of the same kind as a given value: a
   * {@link BigDecimal} is an integer if it has no fractional part and the
   * requested type is not real. */
  public Core.Literal literal(Pos pos, PrimitiveType type, Comparable value) {
    switch (type) {
      case BOOL:
        return boolLiteral(pos, (Boolean) value);
      case INT:
        return intLiteral(pos, (BigDecimal) value);
      case REAL:
        return realLiteral(pos, (BigDecimal) value);
      case STRING:
        return stringLiteral(pos, (String) value);
      default:
        throw new AssertionError(type);
    }
  }

  /** Creates a reference to a variable bound by a generator, or to a free
   * variable if {@code generatorIndex} is -1. */
  public Core.Id id(Pos pos, String name, int generatorIndex) {
    return new Core.Id(pos, name, generatorIndex, null);
  }

  /** Creates a call to a prefix operator. */
  public Core.Call call(Pos pos, Op op, Core.Exp a) {
    return new Core.Call(pos, op, ImmutableList.of(a), null);
  }

  /** Creates a call to an infix operator. */
  public Core.Call call(Pos pos, Op op, Core.Exp a0, Core.Exp a1) {
    return new Core.Call(pos, op, ImmutableList.of(a0, a1), null);
  }

  /** Creates a call to an infix operator, with a result type. */
  public Core.Call call(Pos pos, Op op, Core.Exp a0, Core.Exp a1,
      PrimitiveType type) {
    return new Core.Call(pos, op, ImmutableList.of(a0, a1), type);
  }

  /** Creates a conversion of an expression to a given type. */
  public Core.Call cast(Core.Exp e, PrimitiveType type) {
    return new Core.Call(e.pos, Op.CAST, ImmutableList.of(e), type);
  }

  /** Creates a conditional expression. */
  public Core.If ifExp(Pos pos, Core.Exp condition, Core.Exp ifTrue,
      Core.Exp ifFalse) {
    return new Core.If(pos, condition, ifTrue, ifFalse, null);
  }

  /** Creates a call to an uninterpreted function. */
  public Core.Apply apply(Pos pos, String fn, List<Core.Exp> args) {
    return new Core.Apply(pos, fn, ImmutableList.copyOf(args), null);
  }

  /** Creates a conjunction of a list of boolean expressions; the list must
   * not be empty. */
  public Core.Exp andAlso(List<Core.Exp> exps) {
    checkArgument(!exps.isEmpty());
    Core.Exp e = exps.get(0);
    for (Core.Exp e2 : exps.subList(1, exps.size())) {
      e = new Core.Call(e.pos.plus(e2.pos), Op.AND, ImmutableList.of(e, e2),
          e.type == null ? null : PrimitiveType.BOOL);
    }
    return e;
  }

  /** Creates a range. */
  public Core.Range range(Pos pos, Core.Exp start, Core.Exp stop,
      Core.Exp step) {
    return new Core.Range(pos, start, stop, step);
  }

  /** Creates a range that contains no values. */
  public Core.Range emptyRange(Pos pos) {
    return new Core.Range(pos, intLiteral(0), intLiteral(0), intLiteral(1));
  }

  /** Creates a reference to an opaque collection. */
  public Core.OpaqueIterable opaqueIterable(Pos pos, String name) {
    return new Core.OpaqueIterable(pos, name);
  }

  /** Creates a generator with no pushed-down conditions. */
  public Core.Generator generator(Pos pos, String variable,
      Core.Iter iterable) {
    return new Core.Generator(pos, variable, iterable, ImmutableList.of());
  }

  /** Creates a filter. */
  public Core.Filter filter(Pos pos, int generatorIndex,
      Core.Exp condition) {
    return new Core.Filter(pos, generatorIndex, condition);
  }

  /** Creates a comprehension. */
  public Core.Comprehension comprehension(Pos pos, Op op,
      Core.@Nullable Exp key, Core.Exp element,
      List<Core.Generator> generators, List<Core.Filter> filters) {
    return new Core.Comprehension(pos, op, key, element,
        ImmutableList.copyOf(generators), ImmutableList.copyOf(filters),
        false, null);
  }

  /** Creates a reduction. */
  public Core.Reduction reduction(Pos pos, ReduceOp reduceOp,
      Core.Comprehension source, Core.@Nullable Exp initial) {
    return new Core.Reduction(pos, reduceOp, source, initial, null);
  }

  /** Creates a reduction with an annotation. */
  public Core.Reduction reduction(Pos pos, ReduceOp reduceOp,
      Core.Comprehension source, Core.@Nullable Exp initial,
      TypeAnnotation annotation) {
    return new Core.Reduction(pos, reduceOp, source, initial, annotation);
  }
}

// End CoreBuilder.java
