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
package net.hydromatic.polyglot;

import static net.hydromatic.polyglot.Matchers.isUnsupported;
import static net.hydromatic.polyglot.Matchers.throwsA;
import static net.hydromatic.polyglot.Py.assertError;
import static net.hydromatic.polyglot.Py.py;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.polyglot.parse.PolyglotParseException;
import net.hydromatic.polyglot.parse.PolyglotParser;
import net.hydromatic.polyglot.parse.UnsupportedConstructException;
import org.junit.jupiter.api.Test;

/** Tests the parser. */
public class ParserTest {
  @Test void testComprehensions() {
    py("[x * 2 for x in range(10) if x % 3 == 0]").assertParseSame();
    py("{x for x in range(10)}").assertParseSame();
    py("{x: x * x for x in range(5)}").assertParseSame();
    py("[(i, j) for i in range(3) for j in range(i)]").assertParseSame();
    py("sum(i * i for i in range(1, 6) if i % 2 == 1)").assertParseSame();
    py("max(x for x in xs)").assertParseSame();
    py("math.prod(x for x in range(1, 5))").assertParseSame();
  }

  @Test void testKeywordArguments() {
    py("max((x for x in xs), default=0)").assertParseSame();
    py("sum((x for x in xs), start=10)").assertParseSame();
  }

  @Test void testPrecedence() {
    py("[a + b * c for a in range(3)]").assertParseSame();
    py("[(a + b) * c for a in range(3)]").assertParseSame();
    py("[a - (b - c) for a in range(3)]").assertParseSame();
    py("[a - b - c for a in range(3)]").assertParseSame();
    py("[-x ** 2 for x in range(3)]").assertParseSame();
    py("[(-x) ** 2 for x in range(3)]").assertParseSame();
    py("[2 ** 3 ** x for x in range(3)]").assertParseSame();
    py("[not a and b or c for a in range(3)]").assertParseSame();
    py("[a if b else c for a in range(3)]").assertParseSame();
    py("[x for x in range(10) if 0 < x < 5]").assertParseSame();
    py("[x & 1 | x ^ 2 for x in range(3)]").assertParseSame();
  }

  @Test void testRedundantParentheses() {
    py("[((x)) for x in range((10))]")
        .assertParse("[x for x in range(10)]");
    py("[(a * b) + c for a in range(3)]")
        .assertParse("[a * b + c for a in range(3)]");
    py("  [x for x in range(10)]  \n")
        .assertParse("[x for x in range(10)]");
  }

  @Test void testLiterals() {
    py("[1_000 + 0.5 for x in range(3)]")
        .assertParse("[1000 + 0.5 for x in range(3)]");
    py("[True for x in range(3)]").assertParseSame();
    py("['a' + 'b' for x in range(3)]").assertParseSame();
    py("[\"it's\" for x in range(3)]")
        .assertParse("['it\\'s' for x in range(3)]");
  }

  @Test void testStatementsAreUnsupported() {
    checkUnsupported("x = 1", "Assign");
    checkUnsupported("x += 1", "AugAssign");
    checkUnsupported("import math", "Import");
    checkUnsupported("def f(): pass", "FunctionDef");
    checkUnsupported("for x in y: pass", "For");
    checkUnsupported("while True: pass", "While");
    checkUnsupported("return 1", "Return");
  }

  @Test void testExpressionsThatAreUnsupported() {
    // The parser accepts a lambda; resolution rejects it
    PolyglotParser.parse("[lambda x: x for y in range(3)]");
    py("[lambda x: x for y in range(3)]")
        .assertCompileThrows(isUnsupported("Lambda"));
    checkUnsupported("[f'{x}' for x in range(3)]", "JoinedStr");
    checkUnsupported("[1j for x in range(3)]", "Constant");
  }

  @Test void testSyntaxErrors() {
    checkSyntaxError("[x for x in]");
    checkSyntaxError("[x for x in range(10)");
    checkSyntaxError("x +");
    checkSyntaxError("");
    checkSyntaxError("[x for x in range(3)]\n[y for y in range(3)]");
  }

  /** Tests that the position of an error is reported. */
  @Test void testErrorPosition() {
    assertError(() -> PolyglotParser.parse("x = 1"),
        throwsA("1.1"));
  }

  /** Tests that an unclosed bracket is reported at the bracket, even if
   * the call it opens has a generator argument. */
  @Test void testUnclosedBracket() {
    assertError(() -> PolyglotParser.parse("sum(x for x in range(3)"),
        throwsA("'(' was never closed at 1.4"));
    assertError(() -> PolyglotParser.parse("[x for x in range(10)"),
        throwsA("'[' was never closed at 1.1"));
    assertError(() -> PolyglotParser.parse("x +"),
        throwsA("unexpected end of input"));
  }

  @Test void testGeneratorMustBeParenthesized() {
    assertError(() -> PolyglotParser.parse("sum(x for x in range(3), 1)"),
        throwsA("Generator expression must be parenthesized at 1.5-1.24"));
    assertError(() -> PolyglotParser.parse("f(1, x for x in y)"),
        throwsA("Generator expression must be parenthesized"));
    py("max((x for x in xs), default=0)").assertParseSame();
  }

  @Test void testLexicalErrors() {
    assertError(() -> PolyglotParser.parse("[x ! 1 for x in y]"),
        throwsA("invalid character '!' at 1.4"));
    assertError(() -> PolyglotParser.parse("['abc for x in y]"),
        throwsA("unterminated string literal"));
    assertError(() -> PolyglotParser.parse("[007 for x in y]"),
        throwsA("leading zeros in decimal integer literals are not "
            + "permitted"));
    assertError(() -> PolyglotParser.parse("[1x for x in y]"),
        throwsA("invalid decimal literal"));
    py("[0x1F + 0o17 + 0b101 for x in range(3)]")
        .assertParse("[31 + 15 + 5 for x in range(3)]");
  }

  private static void checkUnsupported(String source, String kind) {
    assertError(() -> PolyglotParser.parse(source), isUnsupported(kind));
  }

  private static void checkSyntaxError(String source) {
    try {
      PolyglotParser.parse(source);
      throw new AssertionError("expected error");
    } catch (PolyglotParseException e) {
      assertThat(e, not(instanceOf(UnsupportedConstructException.class)));
      assertThat(e.pos() != null, is(true));
    }
  }
}

// End ParserTest.java
