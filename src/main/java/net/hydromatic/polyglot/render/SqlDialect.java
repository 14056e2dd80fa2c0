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
package net.hydromatic.polyglot.render;

import net.hydromatic.polyglot.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Dialect of SQL.
 *
 * <p>Each dialect is a strategy for the few things that differ between
 * engines: how a range of integers is materialized, the names of types,
 * integer division and conversion from a real to an integer. The rest of
 * the query is assembled by {@link SqlRenderer}, the same for every
 * dialect.
 */
public enum SqlDialect {
  /** DuckDB; materializes a range with the table function
   * {@code generate_series}. */
  DUCKDB {
    @Override String typeName(PrimitiveType type, int intWidth) {
      switch (type) {
        case BOOL:
          return "BOOLEAN";
        case INT:
          return intWidth == 32 ? "INTEGER" : "BIGINT";
        case REAL:
          return "DOUBLE";
        case STRING:
          return "VARCHAR";
        default:
          throw new AssertionError(type);
      }
    }

    @Override @Nullable String rangeDefinition(String name, String column,
        long start, long last, long step) {
      return null;
    }

    @Override String rangeSource(String name, String column, long start,
        long last, long step) {
      if (isEmpty(start, last, step)) {
        // generate_series fails if the bounds run against the step
        return "(SELECT CAST(NULL AS BIGINT) AS " + column
            + " WHERE FALSE) AS " + name;
      }
      return "generate_series(" + start + ", " + last + ", " + step
          + ") AS " + name + "(" + column + ")";
    }

    @Override String intDivide() {
      return " // ";
    }

    @Override String realToInt(String e, int intWidth) {
      // CAST rounds; Python's int() truncates
      return "CAST(TRUNC(" + e + ") AS "
          + typeName(PrimitiveType.INT, intWidth) + ")";
    }
  },

  /** SQLite; has no table function for ranges, so materializes a range as
   * a recursive common table expression. */
  SQLITE {
    @Override String typeName(PrimitiveType type, int intWidth) {
      switch (type) {
        case BOOL:
        case INT:
          return "INTEGER";
        case REAL:
          return "REAL";
        case STRING:
          return "TEXT";
        default:
          throw new AssertionError(type);
      }
    }

    @Override String rangeDefinition(String name, String column,
        long start, long last, long step) {
      final String cmp = step > 0 ? " <= " : " >= ";
      return name + "(" + column + ") AS (SELECT " + start
          + " WHERE " + start + cmp + last
          + " UNION ALL SELECT " + column + " + " + step
          + " FROM " + name
          + " WHERE " + column + " + " + step + cmp + last + ")";
    }

    @Override String rangeSource(String name, String column, long start,
        long last, long step) {
      return name;
    }

    @Override String intDivide() {
      return " / ";
    }

    @Override String realToInt(String e, int intWidth) {
      return "CAST(" + e + " AS INTEGER)";
    }
  };

  /** Returns whether a range has no values. */
  static boolean isEmpty(long start, long last, long step) {
    return step > 0 ? start > last : start < last;
  }

  /** Returns the name of a type. */
  abstract String typeName(PrimitiveType type, int intWidth);

  /** Returns the definition of a common table expression that holds the
   * values of a range, or null if the dialect does not need one.
   *
   * @param name Name of the range, e.g. "r0"
   * @param column Name of the column that holds the values
   * @param start First value
   * @param last Last value, inclusive
   * @param step Step, not zero
   */
  abstract @Nullable String rangeDefinition(String name, String column,
      long start, long last, long step);

  /** Returns an item of a FROM clause that yields the values of a range,
   * in a column called {@code column}. */
  abstract String rangeSource(String name, String column, long start,
      long last, long step);

  /** Returns the operator that divides two integers, padded with spaces;
   * the operands are always exact multiples. */
  abstract String intDivide();

  /** Returns an expression that converts a real to an integer, truncating
   * toward zero. */
  abstract String realToInt(String e, int intWidth);
}

// End SqlDialect.java
