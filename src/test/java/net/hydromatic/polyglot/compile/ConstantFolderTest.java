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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import java.math.BigInteger;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.parse.PolyglotParser;
import org.junit.jupiter.api.Test;

/** Tests {@link ConstantFolder}. */
public class ConstantFolderTest {
  /** Parses an expression, and returns it resolved and typed. */
  private static Core.Exp exp(String s) {
    final Core.Program program =
        Resolver.resolve(PolyglotParser.parse("[" + s + " for _ in x]"));
    return TypeResolver.infer(program, 64, false).comprehension().element;
  }

  private static Comparable eval(String s) {
    return ConstantFolder.evaluate(exp(s));
  }

  private static void checkInt(String s, long expected) {
    assertThat(s, eval(s), is(BigInteger.valueOf(expected)));
  }

  /** Tests that integer division and modulo round towards negative
   * infinity. */
  @Test void testFloorDivision() {
    checkInt("7 // 2", 3);
    checkInt("-7 // 2", -4);
    checkInt("7 // -2", -4);
    checkInt("-7 // -2", 3);
    checkInt("7 % 2", 1);
    checkInt("-7 % 2", 1);
    checkInt("7 % -2", -1);
    checkInt("-7 % -2", -1);
    checkInt("6 % 3", 0);
    checkInt("-6 % 3", 0);
    assertThat(eval("7.5 // 2"), is(3d));
    assertThat(eval("-7.5 % 2"), is(0.5d));
  }

  @Test void testArithmetic() {
    checkInt("1 + 2 * 3", 7);
    checkInt("(1 + 2) * 3", 9);
    checkInt("2 ** 10", 1024);
    checkInt("-2 ** 2", -4);
    checkInt("1 << 4", 16);
    checkInt("-16 >> 2", -4);
    checkInt("~5", -6);
    checkInt("6 & 3 | 8", 10);
    checkInt("6 ^ 3", 5);
    checkInt("True + True", 2);
    assertThat(eval("7 / 2"), is(3.5d));
    assertThat(eval("2 ** -1"), is(0.5d));
    assertThat(eval("'a' + 'b'"), is("ab"));
  }

  @Test void testLogic() {
    assertThat(eval("1 < 2 < 3"), is(true));
    assertThat(eval("3 < 2 < 1"), is(false));
    assertThat(eval("not 0"), is(true));
    assertThat(eval("1 == 1.0"), is(true));
    assertThat(eval("'a' < 'b'"), is(true));
    assertThat(eval("True & False"), is(false));
    checkInt("1 if 2 > 1 else 0", 1);
  }

  /** Tests expressions that cannot be evaluated. */
  @Test void testNotEvaluated() {
    assertThat(eval("1 // 0"), nullValue());
    assertThat(eval("1 % 0"), nullValue());
    assertThat(eval("1.0 / 0"), nullValue());
    assertThat(eval("1 << -1"), nullValue());
    assertThat(eval("'a' < 1"), nullValue());
    assertThat(eval("abs(-1)"), nullValue());
    assertThat(eval("_ + 1"), nullValue());
  }

  /** Tests that the folder replaces constant sub-expressions, and leaves
   * alone those that would fail or overflow. */
  @Test void testFold() {
    final ConstantFolder folder = new ConstantFolder(64);
    assertThat(exp("_ + 2 * 3").accept(folder), hasToString("_ + 6"));
    assertThat(exp("1 // 0").accept(folder), hasToString("1 // 0"));
    assertThat(exp("2 ** 62").accept(folder),
        hasToString("4611686018427387904"));
    assertThat(exp("2 ** 63").accept(folder), hasToString("2 ** 63"));
    assertThat(exp("2 ** 31").accept(new ConstantFolder(32)),
        hasToString("2 ** 31"));
    assertThat(exp("_ if 1 > 0 else 2").accept(folder), hasToString("_"));
  }

  /** Tests that a shuttle applied to a reduction rewrites both its source
   * and its start value, and returns a reduction. */
  @Test void testFoldReduction() {
    final Core.Program program =
        TypeResolver.infer(
            Resolver.resolve(
                PolyglotParser.parse("sum((x * (2 + 3) for x in range(4)),"
                    + " start=4 * 5)")),
            64, false);
    final Core.Reduction reduction = (Core.Reduction) program;
    final Core.Reduction reduction2 =
        reduction.accept(new ConstantFolder(64));
    assertThat(reduction2.reduceOp, is(reduction.reduceOp));
    assertThat(reduction2.initial, hasToString("20"));
    assertThat(reduction2.source.element, hasToString("x * 5"));
    assertThat(reduction2.annotation, is(reduction.annotation));
  }
}

// End ConstantFolderTest.java
