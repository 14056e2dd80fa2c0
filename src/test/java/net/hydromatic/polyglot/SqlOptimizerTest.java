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
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.compile.SqlOptimizer;
import net.hydromatic.polyglot.render.Backend;
import net.hydromatic.polyglot.render.Prop;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests {@link SqlOptimizer} and the validation that precedes it. */
public class SqlOptimizerTest {
  /** Matches a program whose comprehension has a given number of filters
   * and conditions in its generators, and is or is not empty. */
  private static Matcher<Core.Program> isComprehension(int filterCount,
      int conditionCount, boolean empty) {
    return new CustomTypeSafeMatcher<Core.Program>("comprehension with "
        + filterCount + " filters, " + conditionCount + " conditions, empty "
        + empty) {
      @Override protected boolean matchesSafely(Core.Program item) {
        final Core.Comprehension c = item.comprehension();
        int conditions = 0;
        for (Core.Generator g : c.generators) {
          conditions += g.conditions.size();
        }
        return c.filters.size() == filterCount
            && conditions == conditionCount
            && c.empty == empty;
      }
    };
  }

  @Test void testPushDown() {
    final String source = "sum(i * i for i in range(1, 6) if i % 2 == 1)";
    py(source).withBackend(Backend.SQL)
        .assertCore(1, isComprehension(1, 0, false))
        .assertCore(2, isComprehension(0, 1, false))
        .assertCore(2, hasToString(source));
    py(source).assertSkips(empty());
  }

  @Test void testPushDownSkipped() {
    py("[i + j for i in range(3) for j in range(3) if i < j]")
        .assertSkips(
            contains("PREDICATE_PUSHDOWN: cannot push 'i < j': "
                + "references variables of generators [0, 1]"));
    py("[x for x in range(3) if x > 0 for x in range(2)]")
        .assertSkips(
            contains("PREDICATE_PUSHDOWN: cannot push 'x > 0': "
                + "variable 'x' is shadowed by a later generator"));
    py("[x for x in range(3) if x > 0 for x in range(2)]")
        .withBackend(Backend.SQL)
        .assertCore(2, isComprehension(1, 0, false));
  }

  /** Tests that a provably empty range is replaced and the comprehension
   * is marked empty. */
  @Test void testRangeClipping() {
    py("[x for x in range(10, 5)]").withBackend(Backend.SQL)
        .assertCore(2, hasToString("[x for x in range(0, 0)]"))
        .assertCore(2, isComprehension(0, 0, true));
    py("[x for x in range(5, 10, -1)]").withBackend(Backend.SQL)
        .assertCore(2, isComprehension(0, 0, true));
    py("[x for x in range(10, 5, -1)]").withBackend(Backend.SQL)
        .assertCore(2, hasToString("[x for x in range(10, 5, -1)]"))
        .assertCore(2, isComprehension(0, 0, false));
    py("max(x for x in range(0))").withBackend(Backend.SQL)
        .assertCore(2, isComprehension(0, 0, true));
  }

  @Test void testConstantFolding() {
    py("[x + 2 * 3 for x in range(5)]").withBackend(Backend.SQL)
        .assertCore(2, hasToString("[x + 6 for x in range(0, 5)]"));

    // A filter that is always true is removed
    py("[x for x in range(5) if 2 > 1]").withBackend(Backend.SQL)
        .assertCore(2, hasToString("[x for x in range(0, 5)]"))
        .assertCore(2, isComprehension(0, 0, false));

    // A filter that is always false makes the comprehension empty
    py("[x for x in range(5) if 1 > 2]").withBackend(Backend.SQL)
        .assertCore(2, isComprehension(0, 0, true));
    py("[x for x in range(5) if 1 > 2]")
        .assertSkips(
            contains("PREDICATE_PUSHDOWN: cannot push '1 > 2': "
                + "references no generator variable"));

    // A condition that is only partly constant is pushed down and kept
    py("[x for x in range(5) if x > 2 and 1 > 2]").withBackend(Backend.SQL)
        .assertCore(2, isComprehension(0, 1, false));
  }

  @Test void testOptimizeOff() {
    py("sum(i * i for i in range(1, 6) if i % 2 == 1)")
        .withBackend(Backend.SQL)
        .with(Prop.OPTIMIZE, false)
        .assertCore(2, isComprehension(1, 0, false))
        .assertSkips(empty());
    py("[x for x in range(10, 5)]")
        .withBackend(Backend.SQL)
        .with(Prop.OPTIMIZE, false)
        .assertCore(2, isComprehension(0, 0, false));
  }

  /** Tests programs that cannot be translated to SQL. */
  @Test void testValidation() {
    py("[x for x in xs]").withBackend(Backend.SQL)
        .assertCompileThrows(isUnsupported("OpaqueIterable"))
        .assertCompileThrows(throwsA("SQL requires a range; cannot iterate "
            + "over 'xs'"));
    py("[x + n for x in range(3)]").withBackend(Backend.SQL)
        .assertCompileThrows(
            throwsA("SQL does not support free variable 'n'"));
    py("[x for x in range(n)]").withBackend(Backend.SQL)
        .assertCompileThrows(
            throwsA("SQL does not support free variable 'n'"));
    py("[x for x in range(abs(-3))]").withBackend(Backend.SQL)
        .assertCompileThrows(
            throwsA("SQL requires range bounds that are integer constants"));
    py("[y for x in range(3) for y in range(x)]").withBackend(Backend.SQL)
        .assertCompileThrows(
            throwsA("SQL requires range bounds that do not depend on "
                + "generator variable 'x'"));

    // Bounds, and the last value of the range, must fit in an integer
    py("sum(x for x in range(2 ** 70))").withBackend(Backend.SQL)
        .assertCompileThrows(isUnsupported("range"))
        .assertCompileThrows(
            throwsA("SQL requires range bounds that fit in a 64-bit "
                + "integer; 2 ** 70 is 1180591620717411303424"));
    py("[x for x in range(2 ** 40)]").withBackend(Backend.SQL)
        .with(Prop.INT_WIDTH, 32)
        .assertCompileThrows(isUnsupported("range"))
        .assertRenderThrows(
            throwsA("SQL requires range bounds that fit in a 32-bit "
                + "integer"));
    py("[x for x in range(2 ** 40)]").withBackend(Backend.SQL)
        .assertRender(containsString("generate_series(0, 1099511627775, 1)"));
    py("[x for x in range(2 ** 31)]").withBackend(Backend.SQL)
        .with(Prop.INT_WIDTH, 32)
        .assertCompileThrows(isUnsupported("range"));

    // Other backends accept the same programs
    py("[y for x in range(3) for y in range(x)]")
        .assertRender(containsString("function program("));
  }
}

// End SqlOptimizerTest.java
