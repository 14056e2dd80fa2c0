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

import static net.hydromatic.polyglot.Matchers.throwsA;
import static net.hydromatic.polyglot.Py.py;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import java.util.function.Consumer;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.compile.Resolver;
import net.hydromatic.polyglot.compile.TypeResolver;
import net.hydromatic.polyglot.parse.PolyglotParser;
import net.hydromatic.polyglot.render.Prop;
import net.hydromatic.polyglot.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests {@link TypeResolver}. */
public class TypeResolverTest {
  /** Returns a consumer that checks the string form of a typed program and
   * of its annotation. */
  private static Consumer<Core.Program> typed(String expected,
      String expectedAnnotation) {
    return program -> {
      assertThat(program, hasToString(expected));
      assertThat(program.annotation(), hasToString(expectedAnnotation));
    };
  }

  @Test void testElementTypes() {
    py("[x for x in range(3)]")
        .assertTyped(typed("[x for x in range(0, 3)]",
            "{element: int, intWidth: 64}"));
    py("[x > 1 for x in range(3)]")
        .assertTyped(typed("[x > 1 for x in range(0, 3)]",
            "{element: bool, intWidth: 64}"));
    py("['a' for x in range(3)]")
        .assertTyped(typed("['a' for x in range(0, 3)]",
            "{element: string, intWidth: 64}"));
    py("{x: x * 1.5 for x in range(3)}")
        .assertTyped(typed("{x: float(x) * 1.5 for x in range(0, 3)}",
            "{element: real, key: int, value: real, intWidth: 64}"));
    py("[x for x in range(3)]")
        .with(Prop.INT_WIDTH, 32)
        .assertTyped(typed("[x for x in range(0, 3)]",
            "{element: int, intWidth: 32}"));
  }

  /** Tests that implicit conversions are made explicit. */
  @Test void testConversions() {
    py("[x / 2 for x in range(3)]")
        .assertTyped(typed("[float(x) / 2.0 for x in range(0, 3)]",
            "{element: real, intWidth: 64}"));
    py("[x if x > 1 else 0.5 for x in range(3)]")
        .assertTyped(typed("[float(x) if x > 1 else 0.5 for x in range(0, 3)]",
            "{element: real, intWidth: 64}"));
    py("[True + x for x in range(3)]")
        .assertTyped(typed("[1 + x for x in range(0, 3)]",
            "{element: int, intWidth: 64}"));
  }

  /** Tests that a condition that is not a boolean is compared with zero or
   * the empty string. */
  @Test void testTruth() {
    py("[x for x in range(5) if x % 2]")
        .assertTyped(typed("[x for x in range(0, 5) if x % 2 != 0]",
            "{element: int, intWidth: 64}"));
    py("[x for x in range(5) if not x]")
        .assertTyped(typed("[x for x in range(0, 5) if not x != 0]",
            "{element: int, intWidth: 64}"));
    py("[x for x in range(5) if str(x)]")
        .assertTyped(typed("[x for x in range(0, 5) if str(x) != '']",
            "{element: int, intWidth: 64}"));
    py("any(x for x in range(3))")
        .assertTyped(typed("any(x != 0 for x in range(0, 3))",
            "{element: bool, result: bool, intWidth: 64}"));
  }

  @Test void testReductions() {
    py("sum(x for x in range(3))")
        .assertTyped(typed("sum(x for x in range(0, 3))",
            "{element: int, result: int, intWidth: 64}"));
    py("sum(x > 1 for x in range(3))")
        .assertTyped(typed("sum(int(x > 1) for x in range(0, 3))",
            "{element: int, result: int, intWidth: 64}"));
    py("sum((x for x in range(3)), 0.5)")
        .assertTyped(typed("sum((float(x) for x in range(0, 3)), 0.5)",
            "{element: real, result: real, intWidth: 64}"));
    py("max((x for x in range(3)), default=0.5)")
        .assertTyped(
            typed("max((float(x) for x in range(0, 3)), default=0.5)",
                "{element: real, result: real, intWidth: 64}"));
    py("all(x < 10 for x in range(3))")
        .assertTyped(typed("all(x < 10 for x in range(0, 3))",
            "{element: bool, result: bool, intWidth: 64}"));
    py("math.prod(x * 0.5 for x in range(1, 3))")
        .assertTyped(typed("math.prod(float(x) * 0.5 for x in range(1, 3))",
            "{element: real, result: real, intWidth: 64}"));
  }

  /** Tests that a free variable used as the bound of a range is an
   * integer, and that other unknown types fall back to integer. */
  @Test void testFallback() {
    py("[x for x in range(n)]")
        .assertTyped(typed("[x for x in range(0, n)]",
            "{element: int, intWidth: 64}"));
    py("[x * n for x in range(n)]")
        .assertTyped(typed("[x * n for x in range(0, n)]",
            "{element: int, intWidth: 64}"));
    py("[x for x in xs]")
        .assertTyped(typed("[x for x in xs]",
            "{element: int, intWidth: 64, fallback}"));
    py("[x + m for x in range(3)]")
        .assertTyped(typed("[x + m for x in range(0, 3)]",
            "{element: int, intWidth: 64, fallback}"));
    py("[foo(x) for x in range(3)]")
        .assertTyped(typed("[foo(x) for x in range(0, 3)]",
            "{element: int, intWidth: 64, fallback}"));
  }

  @Test void testStrict() {
    py("[x for x in xs]")
        .with(Prop.STRICT_TYPES, true)
        .assertCompileThrows(
            throwsA("element type of 'xs' is unknown; assuming int"));
    py("[x + m for x in range(3)]")
        .with(Prop.STRICT_TYPES, true)
        .assertCompileThrows(throwsA("type of 'm' is unknown"));
    py("[foo(x) for x in range(3)]")
        .with(Prop.STRICT_TYPES, true)
        .assertCompileThrows(throwsA("result type of 'foo' is unknown"));
    py("[x + 'a' for x in range(3)]")
        .with(Prop.STRICT_TYPES, true)
        .assertCompileThrows(
            throwsA("unsupported operand types for +: int and string"));
    py("sum(str(x) for x in range(3))")
        .with(Prop.STRICT_TYPES, true)
        .assertCompileThrows(throwsA("cannot sum strings"));

    // No fallback is needed, so strict mode succeeds
    py("[x * n for x in range(n)]")
        .with(Prop.STRICT_TYPES, true)
        .assertTyped(typed("[x * n for x in range(0, n)]",
            "{element: int, intWidth: 64}"));
  }

  /** Tests that inferring the types of a typed program gives the same
   * program. */
  @Test void testIdempotent() {
    final String[] sources = {
        "sum(x > 1 for x in range(3))",
        "[x / 2 for x in range(5) if x % 2]",
        "max((x for x in xs), default=0.5)",
        "{x: str(x) for x in range(3) if x and x - 1}",
    };
    for (String source : sources) {
      final Core.Program program0 =
          Resolver.resolve(PolyglotParser.parse(source));
      final Core.Program program1 = TypeResolver.infer(program0, 64, false);
      final Core.Program program2 = TypeResolver.infer(program1, 64, false);
      assertThat(program2.toString(), is(program1.toString()));
      assertThat(program2.annotation(), is(program1.annotation()));
      assertThat(program2.comprehension().element.type(),
          is(program1.comprehension().element.type()));
    }
  }

  @Test void testResultType() {
    py("max((x for x in range(3)), default=-1)")
        .assertTyped(program ->
            assertThat(((Core.Reduction) program).resultType(),
                is(PrimitiveType.INT)));
  }
}

// End TypeResolverTest.java
