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

import static net.hydromatic.polyglot.Py.py;
import static org.hamcrest.CoreMatchers.allOf;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polyglot.render.Backend;
import net.hydromatic.polyglot.render.Prop;
import net.hydromatic.polyglot.render.SqlDialect;
import org.junit.jupiter.api.Test;

/** Runs generated SQL in DuckDB and SQLite, and checks that the results
 * are the ones that the comprehension would compute. */
public class SqlExecutionTest {
  private static String url(SqlDialect dialect) {
    switch (dialect) {
      case DUCKDB:
        return "jdbc:duckdb:";
      case SQLITE:
        return "jdbc:sqlite::memory:";
      default:
        throw new AssertionError(dialect);
    }
  }

  /** Renders a program as SQL and runs it; returns each row as a string
   * of comma-separated values. */
  private static List<String> run(String source, SqlDialect dialect,
      boolean optimize) throws SQLException {
    String sql = py(source).withBackend(Backend.SQL)
        .with(Prop.DIALECT, dialect)
        .with(Prop.OPTIMIZE, optimize)
        .render()
        .trim();
    if (sql.endsWith(";")) {
      sql = sql.substring(0, sql.length() - 1);
    }
    final List<String> rows = new ArrayList<>();
    try (Connection connection = DriverManager.getConnection(url(dialect));
         Statement statement = connection.createStatement();
         ResultSet resultSet = statement.executeQuery(sql)) {
      final int columnCount = resultSet.getMetaData().getColumnCount();
      while (resultSet.next()) {
        final StringBuilder b = new StringBuilder();
        for (int i = 1; i <= columnCount; i++) {
          if (i > 1) {
            b.append(", ");
          }
          b.append(resultSet.getString(i));
        }
        rows.add(b.toString());
      }
    }
    return rows;
  }

  /** Checks that a program gives the expected rows in both dialects, with
   * and without optimization. */
  private static void check(String source, boolean sort, String... expected)
      throws SQLException {
    for (SqlDialect dialect : SqlDialect.values()) {
      for (boolean optimize : new boolean[] {true, false}) {
        List<String> rows = run(source, dialect, optimize);
        if (sort) {
          rows = Ordering.natural().sortedCopy(rows);
        }
        assertThat(source + " in " + dialect + ", optimize " + optimize,
            rows, is(ImmutableList.copyOf(expected)));
      }
    }
  }

  @Test void testSum() throws SQLException {
    check("sum(i * i for i in range(1, 6) if i % 2 == 1)", false, "35");
    check("sum(x for x in range(10, 5))", false, "0");
    check("sum((x for x in range(4)), 10)", false, "16");
    check("sum(x * y for x in range(3) for y in range(3) if x < y)", false,
        "2");
  }

  @Test void testProduct() throws SQLException {
    check("math.prod(x for x in range(1, 6))", false, "120");
    check("math.prod(x for x in range(1, 6) if x % 2 == 0)", false, "8");
  }

  @Test void testList() throws SQLException {
    check("[x * 2 for x in range(3)]", false, "0", "2", "4");
    check("[x for x in range(10, 0, -3)]", false, "10", "7", "4", "1");
    check("[x * 10 + y for x in range(2) for y in range(2)]", false,
        "0", "1", "10", "11");
  }

  /** Tests that an empty list has no rows. */
  @Test void testEmpty() throws SQLException {
    check("[x for x in range(10, 5)]", false);
    check("[x for x in range(5) if 1 > 2]", false);
    check("max(x for x in range(0))", false);
    check("[x for x in range(0, 5, -1)]", false);
    check("[x * y for x in range(3) for y in range(4, 4)]", false);
  }

  /** Tests that moving a filter into the sub-query of the only generator
   * it references gives the same rows as filtering after the join. */
  @Test void testPushDown() throws SQLException {
    final String source =
        "[x * 10 + y for x in range(3) for y in range(3) if y > 0]";
    for (SqlDialect dialect : SqlDialect.values()) {
      py(source).withBackend(Backend.SQL)
          .with(Prop.DIALECT, dialect)
          .assertRender(
              allOf(containsString(" WHERE y > 0) AS g1\n"),
                  not(containsString("g1.y > 0"))));
      py(source).withBackend(Backend.SQL)
          .with(Prop.DIALECT, dialect)
          .with(Prop.OPTIMIZE, false)
          .assertRender(containsString("WHERE g1.y > 0"));
    }
    check(source, false, "1", "2", "11", "12", "21", "22");
    check("[x * 10 + y for x in range(4) if x % 2 == 1 for y in range(2)]",
        false, "10", "11", "30", "31");
  }

  @Test void testSet() throws SQLException {
    check("{x % 3 for x in range(10)}", true, "0", "1", "2");
  }

  /** Tests that, as in a dict comprehension, the last value written for a
   * key wins. */
  @Test void testDict() throws SQLException {
    check("{x % 3: x for x in range(10)}", true, "0, 9", "1, 7", "2, 8");
  }

  @Test void testMaxMin() throws SQLException {
    check("max(x % 3 for x in range(10))", false, "2");
    check("min(10 - x for x in range(10))", false, "1");
    check("max((x for x in range(0)), default=-1)", false, "-1");
  }

  /** Tests that integer division and modulo round towards negative
   * infinity, as in Python. */
  @Test void testFloorDivision() throws SQLException {
    check("[x // 2 for x in range(-5, 0)]", false,
        "-3", "-2", "-2", "-1", "-1");
    check("[x % 3 for x in range(-4, 0)]", false, "2", "0", "1", "2");
  }

  @Test void testAnyAll() throws SQLException {
    for (SqlDialect dialect : SqlDialect.values()) {
      assertThat(isTrue(run("any(x > 3 for x in range(5))", dialect, true)),
          is(true));
      assertThat(isTrue(run("any(x > 5 for x in range(5))", dialect, true)),
          is(false));
      assertThat(isTrue(run("all(x < 3 for x in range(5))", dialect, true)),
          is(false));
      assertThat(isTrue(run("all(x < 5 for x in range(5))", dialect, true)),
          is(true));
    }
  }

  /** Returns whether a single-row, single-column result is true; DuckDB
   * returns a boolean, SQLite an integer. */
  private static boolean isTrue(List<String> rows) {
    assertThat(rows.size(), is(1));
    final String s = rows.get(0);
    return s.equalsIgnoreCase("true") || s.equals("1");
  }
}

// End SqlExecutionTest.java
