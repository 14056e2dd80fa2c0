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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates an identifier. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates a floating-point literal. */
  public Ast.Literal realLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.REAL_LITERAL, value);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates a None literal. */
  public Ast.Literal noneLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.NONE_LITERAL, null);
  }

  public Ast.Attribute attribute(Pos pos, Ast.Exp exp, String name) {
    return new Ast.Attribute(pos, exp, name);
  }

  public Ast.Call call(Pos pos, Ast.Exp fn, List<Ast.Exp> args,
      List<Ast.Keyword> keywords) {
    return new Ast.Call(pos, fn, ImmutableList.copyOf(args),
        ImmutableList.copyOf(keywords));
  }

  public Ast.Keyword keyword(Pos pos, String name, Ast.Exp value) {
    return new Ast.Keyword(pos, name, value);
  }

  public Ast.Subscript subscript(Pos pos, Ast.Exp exp,
      List<Ast.Exp> indexes) {
    return new Ast.Subscript(pos, exp, ImmutableList.copyOf(indexes));
  }

  public Ast.Starred starred(Pos pos, Ast.Exp exp) {
    return new Ast.Starred(pos, exp);
  }

  public Ast.NamedExpr namedExpr(Pos pos, Ast.Id target, Ast.Exp value) {
    return new Ast.NamedExpr(pos, target, value);
  }

  public Ast.Lambda lambda(Pos pos, List<String> params, Ast.Exp body) {
    return new Ast.Lambda(pos, ImmutableList.copyOf(params), body);
  }

  public Ast.IfExp ifExp(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.IfExp(pos, condition, ifTrue, ifFalse);
  }

  /** Creates a call to an infix operator. */
  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a call to a prefix operator. */
  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  /** Creates a comparison, possibly a chain. */
  public Ast.Compare compare(Pos pos, List<Op> ops, List<Ast.Exp> operands) {
    return new Ast.Compare(pos, ImmutableList.copyOf(ops),
        ImmutableList.copyOf(operands));
  }

  /** Creates a tuple, list or set display. */
  public Ast.Display display(Pos pos, Op op, List<Ast.Exp> args) {
    return new Ast.Display(pos, op, ImmutableList.copyOf(args));
  }

  public Ast.DictDisplay dictDisplay(Pos pos, List<Ast.Exp> keys,
      List<Ast.Exp> values) {
    return new Ast.DictDisplay(pos, ImmutableList.copyOf(keys),
        ImmutableList.copyOf(values));
  }

  /** Creates a list, set or dict comprehension or a generator expression. */
  public Ast.Comp comp(Pos pos, Op op, Ast.@Nullable Exp key, Ast.Exp element,
      List<Ast.CompFor> generators) {
    return new Ast.Comp(pos, op, key, element,
        ImmutableList.copyOf(generators));
  }

  public Ast.CompFor compFor(Pos pos, Ast.Exp target, Ast.Exp iter,
      List<Ast.Exp> ifs, boolean async) {
    return new Ast.CompFor(pos, target, iter, ImmutableList.copyOf(ifs),
        async);
  }
}

// End AstBuilder.java
