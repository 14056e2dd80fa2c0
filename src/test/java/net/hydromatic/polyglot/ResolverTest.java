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
import static net.hydromatic.polyglot.Py.py;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.compile.Resolver;
import net.hydromatic.polyglot.parse.PolyglotParser;
import org.junit.jupiter.api.Test;

/** Tests {@link Resolver}, which converts a parse tree to the intermediate
 * representation. */
public class ResolverTest {
  private static Core.Program resolve(String source) {
    return Resolver.resolve(PolyglotParser.parse(source));
  }

  @Test void testComprehensions() {
    py("[i * i for i in range(5) if i % 2 == 0]")
        .assertResolved(
            hasToString("[i * i for i in range(0, 5) if i % 2 == 0]"));
    py("{x for x in range(2, 8, 3)}")
        .assertResolved(hasToString("{x for x in range(2, 8, 3)}"));
    py("{x: x * x for x in range(3)}")
        .assertResolved(hasToString("{x: x * x for x in range(0, 3)}"));
    py("[x for x in range(10, 0, -1)]")
        .assertResolved(hasToString("[x for x in range(10, 0, -1)]"));
    py("[x + y for x in xs for y in range(n) if x < y]")
        .assertResolved(
            hasToString("[x + y for x in xs for y in range(0, n) if x < y]"));
  }

  @Test void testReductions() {
    py("sum(x for x in range(10))")
        .assertResolved(hasToString("sum(x for x in range(0, 10))"));
    py("sum([x for x in range(10)])")
        .assertResolved(hasToString("sum(x for x in range(0, 10))"));
    py("sum((x for x in range(10)), 5)")
        .assertResolved(hasToString("sum((x for x in range(0, 10)), 5)"));
    py("sum((x for x in range(10)), start=5)")
        .assertResolved(hasToString("sum((x for x in range(0, 10)), 5)"));
    py("max((x for x in range(3)), default=-1)")
        .assertResolved(
            hasToString("max((x for x in range(0, 3)), default=-1)"));
    py("any(x > 2 for x in range(5))")
        .assertResolved(hasToString("any(x > 2 for x in range(0, 5))"));

    // "prod", "product" and "math.prod" are the same reduction
    for (String fn : new String[] {"prod", "product", "math.prod"}) {
      final Core.Program program =
          resolve(fn + "(x for x in range(1, 5))");
      assertThat(program, instanceOf(Core.Reduction.class));
      assertThat(((Core.Reduction) program).reduceOp, is(ReduceOp.PRODUCT));
      assertThat(program,
          hasToString("math.prod(x for x in range(1, 5))"));
    }
  }

  @Test void testExpressions() {
    // "+x" is "x"; "-1" is a literal
    py("[+x for x in range(3)]")
        .assertResolved(hasToString("[x for x in range(0, 3)]"));
    py("[-x - -1 for x in range(3)]")
        .assertResolved(hasToString("[-x - -1 for x in range(0, 3)]"));

    // comparison chains become conjunctions
    py("[x for x in range(10) if 1 < x <= 5]")
        .assertResolved(
            hasToString("[x for x in range(0, 10) if 1 < x and x <= 5]"));
    py("[a if a > 0 else -a for a in range(-3, 3)]")
        .assertResolved(
            hasToString("[a if a > 0 else -a for a in range(-3, 3)]"));
    py("[abs(x) + math.floor(x / 2) for x in range(3)]")
        .assertResolved(
            hasToString(
                "[abs(x) + math.floor(x / 2) for x in range(0, 3)]"));
  }

  /** Tests that each name is resolved to the generator that binds it. */
  @Test void testScope() {
    final Core.Comprehension c = (Core.Comprehension)
        resolve("[x + n for x in range(3) for x in range(x)]");
    assertThat(c.generators.size(), is(2));
    final Core.Range range = (Core.Range) c.generators.get(1).iterable;
    // In "range(x)", "x" is bound by the first generator
    assertThat(((Core.Id) range.stop).generatorIndex, is(0));
    // In the element, "x" is bound by the second generator, which hides the
    // first; "n" is free
    final Core.Call plus = (Core.Call) c.element;
    assertThat(((Core.Id) plus.arg(0)).generatorIndex, is(1));
    assertThat(((Core.Id) plus.arg(1)).isFree(), is(true));
  }

  @Test void testFilterPosition() {
    final Core.Comprehension c = (Core.Comprehension)
        resolve("[x for x in range(3) if x > 0 for y in range(2) if y > x]");
    assertThat(c.filters.size(), is(2));
    assertThat(c.filters.get(0).generatorIndex, is(0));
    assertThat(c.filters.get(1).generatorIndex, is(1));
    assertThat(c.filtersAt(1).get(0).condition, hasToString("y > x"));
  }

  @Test void testUnsupported() {
    py("(x for x in range(3))")
        .assertCompileThrows(isUnsupported("GeneratorExp"));
    py("[(x, y) for x in range(3) for y in range(3)]")
        .assertCompileThrows(isUnsupported("Tuple"));
    py("[x for x, y in z]")
        .assertCompileThrows(isUnsupported("Tuple"));
    py("[x for x in [1, 2, 3]]")
        .assertCompileThrows(isUnsupported("List"));
    py("[x for x in range(3) for y in x]")
        .assertCompileThrows(isUnsupported("Name"));
    py("[None for x in range(3)]")
        .assertCompileThrows(isUnsupported("Constant"));
    py("[x @ x for x in range(3)]")
        .assertCompileThrows(isUnsupported("BinOp"));
    py("[x for x in range(10) if x in y]")
        .assertCompileThrows(isUnsupported("Compare"));
    py("[x for x in range(10) if x is not y]")
        .assertCompileThrows(isUnsupported("Compare"));
    py("[f(x)(1) for x in range(3)]")
        .assertCompileThrows(isUnsupported("Call"));
    py("[xs[x] for x in range(3)]")
        .assertCompileThrows(isUnsupported("Subscript"));
    py("[round(x, ndigits=2) for x in range(3)]")
        .assertCompileThrows(isUnsupported("keyword"));
    py("max((x for x in range(3)), key=abs)")
        .assertCompileThrows(isUnsupported("keyword"));
    py("max(1, 2)")
        .assertCompileThrows(isUnsupported("Call"));
    py("sorted(x for x in range(3))")
        .assertCompileThrows(isUnsupported("Call"));
    py("sum(xs)")
        .assertCompileThrows(isUnsupported("Name"));
    py("1 + 2")
        .assertCompileThrows(isUnsupported("BinOp"));
  }

  @Test void testErrors() {
    py("[x for x in range(3, 5, 0)]")
        .assertCompileThrows(throwsA("range() arg 3 must not be zero"));
    py("[x for x in range(1, 2, 3, 4)]")
        .assertCompileThrows(
            throwsA("range expected 1 to 3 arguments, got 4"));
    py("[x for x in range(stop=3)]")
        .assertCompileThrows(throwsA("range() takes no keyword arguments"));
    py("sum()")
        .assertCompileThrows(throwsA("sum() expected at least 1 argument"));
    py("any((x for x in range(3)), start=0)")
        .assertCompileThrows(
            throwsA("any() got an unexpected keyword argument 'start'"));
  }
}

// End ResolverTest.java
