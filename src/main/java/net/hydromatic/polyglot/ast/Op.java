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

/**
 * Sub-types of {@link AstNode}.
 *
 * <p>Each operator knows the name of the corresponding node in the source
 * language's own syntax tree (used to report unsupported constructs), and, if
 * it is an operator, its spelling and binding strength.
 */
public enum Op {
  // identifiers
  ID("Name"),
  ATTRIBUTE("Attribute", ".", 30, 30),

  // literals
  BOOL_LITERAL("Constant"),
  INT_LITERAL("Constant"),
  REAL_LITERAL("Constant"),
  STRING_LITERAL("Constant"),
  NONE_LITERAL("Constant"),

  // calls
  CALL("Call", "", 30, 30),
  KEYWORD("keyword"),
  SUBSCRIPT("Subscript", "", 30, 30),
  STARRED("Starred"),
  NAMED_EXPR("NamedExpr", " := ", 0, 0),
  LAMBDA("Lambda", "lambda", 0, 0),
  IF_EXP("IfExp", " if ", 2, 2),
  COMPARE("Compare"),

  // binary operators, weakest first
  OR("BoolOp", " or ", 4, 5),
  AND("BoolOp", " and ", 6, 7),
  NOT("UnaryOp", "not ", 8, 8),
  EQ("Compare", " == ", 10, 10, true),
  NE("Compare", " != ", 10, 10, true),
  LT("Compare", " < ", 10, 10, true),
  LE("Compare", " <= ", 10, 10, true),
  GT("Compare", " > ", 10, 10, true),
  GE("Compare", " >= ", 10, 10, true),
  IN("Compare", " in ", 10, 10, true),
  NOT_IN("Compare", " not in ", 10, 10, true),
  IS("Compare", " is ", 10, 10, true),
  IS_NOT("Compare", " is not ", 10, 10, true),
  BIT_OR("BinOp", " | ", 12, 13),
  BIT_XOR("BinOp", " ^ ", 14, 15),
  BIT_AND("BinOp", " & ", 16, 17),
  LSHIFT("BinOp", " << ", 18, 19),
  RSHIFT("BinOp", " >> ", 18, 19),
  PLUS("BinOp", " + ", 20, 21),
  MINUS("BinOp", " - ", 20, 21),
  TIMES("BinOp", " * ", 22, 23),
  DIVIDE("BinOp", " / ", 22, 23),
  FLOOR_DIVIDE("BinOp", " // ", 22, 23),
  MOD("BinOp", " % ", 22, 23),
  MAT_MULT("BinOp", " @ ", 22, 23),
  NEGATE("UnaryOp", "-", 24, 24),
  POSITIVE("UnaryOp", "+", 24, 24),
  INVERT("UnaryOp", "~", 24, 24),
  POWER("BinOp", " ** ", 27, 26),

  // displays
  TUPLE("Tuple"),
  LIST("List"),
  SET("Set"),
  DICT("Dict"),

  // comprehensions
  LIST_COMP("ListComp"),
  SET_COMP("SetComp"),
  DICT_COMP("DictComp"),
  GENERATOR_EXP("GeneratorExp"),
  COMPREHENSION_FOR("comprehension"),

  // occur in Core, not in Ast
  /** Call to a function that is passed through without interpretation. */
  APPLY("Call", "", 30, 30),
  /** Conversion of a value to the type of the call, such as "int(b)" for a
   * boolean "b" in an arithmetic expression. */
  CAST("Call", "", 30, 30),
  RANGE("range"),
  OPAQUE_ITERABLE("OpaqueIterable"),
  GENERATOR("comprehension"),
  FILTER("if"),
  REDUCTION("Call");

  /** Name of the node in the source language's syntax tree. */
  public final String kind;

  /** Spelling of the operator, padded with spaces if it is infix. */
  public final String opString;

  /** Left binding strength; higher binds more tightly. */
  public final int left;

  /** Right binding strength; higher binds more tightly. */
  public final int right;

  /** Whether the operator is non-associative, like a comparison. */
  public final boolean nonAssociative;

  Op(String kind) {
    this(kind, "", 30, 30, false);
  }

  Op(String kind, String opString, int left, int right) {
    this(kind, opString, left, right, false);
  }

  Op(String kind, String opString, int left, int right,
      boolean nonAssociative) {
    this.kind = kind;
    this.opString = opString;
    this.left = left;
    this.right = right;
    this.nonAssociative = nonAssociative;
  }

  /** Returns whether this is a bit-wise operator. */
  public boolean isBitwise() {
    switch (this) {
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
      case LSHIFT:
      case RSHIFT:
      case INVERT:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this is a literal. */
  public boolean isLiteral() {
    switch (this) {
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case NONE_LITERAL:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
