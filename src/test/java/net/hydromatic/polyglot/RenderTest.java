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
import static net.hydromatic.polyglot.Py.py;
import static org.hamcrest.CoreMatchers.allOf;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;

import net.hydromatic.polyglot.render.Backend;
import net.hydromatic.polyglot.render.Prop;
import net.hydromatic.polyglot.render.SqlDialect;
import org.junit.jupiter.api.Test;

/** Tests the code generated by each backend. */
public class RenderTest {
  static final String SUM_ODD_SQUARES =
      "sum(i * i for i in range(1, 6) if i % 2 == 1)";

  @Test void testJulia() {
    py(SUM_ODD_SQUARES)
        .assertRender("function program()::Int64\n"
            + "    acc::Int64 = 0\n"
            + "    for i in 1:5\n"
            + "        if !(mod(i, 2) == 1)\n"
            + "            continue\n"
            + "        end\n"
            + "        acc += i * i\n"
            + "    end\n"
            + "    return acc\n"
            + "end\n");
    py("[x * x for x in range(n)]")
        .assertRender("function program(n::Int64)::Vector{Int64}\n"
            + "    result = Int64[]\n"
            + "    for x in 0:n - 1\n"
            + "        push!(result, x * x)\n"
            + "    end\n"
            + "    return result\n"
            + "end\n");
    py("{x: str(x) for x in range(3) if x != 1}")
        .assertRender("function program()::Dict{Int64, String}\n"
            + "    result = Dict{Int64, String}()\n"
            + "    for x in 0:2\n"
            + "        if !(x != 1)\n"
            + "            continue\n"
            + "        end\n"
            + "        result[x] = string(x)\n"
            + "    end\n"
            + "    return result\n"
            + "end\n");
    py("any(x > 3 for x in range(10))")
        .assertRender("function program()::Bool\n"
            + "    for x in 0:9\n"
            + "        if x > 3\n"
            + "            return true\n"
            + "        end\n"
            + "    end\n"
            + "    return false\n"
            + "end\n");
    py("max((x for x in xs), default=-1)")
        .assertRender("function program(xs::Vector{Int64})::Int64\n"
            + "    best::Union{Nothing, Int64} = nothing\n"
            + "    for x in xs\n"
            + "        v = x\n"
            + "        if best === nothing || v > best\n"
            + "            best = v\n"
            + "        end\n"
            + "    end\n"
            + "    if best === nothing\n"
            + "        return -1\n"
            + "    end\n"
            + "    return best\n"
            + "end\n");
    py("min(x for x in range(3))")
        .assertRender(
            containsString("throw(ArgumentError(\"min() arg is an empty "
                + "sequence\"))"));
  }

  @Test void testJuliaParallel() {
    py("sum(x for x in range(10))").parallel()
        .assertRender("function program()::Int64\n"
            + "    # NOTE: parallel: the index space is split into contiguous "
            + "chunks, one per worker\n"
            + "    # NOTE: partial results are combined in chunk order: "
            + "sum (identity 0)\n"
            + "    count = 10\n"
            + "    workers = Threads.nthreads()\n"
            + "    chunk = cld(count, workers)\n"
            + "    tasks = map(1:workers) do w\n"
            + "        Threads.@spawn begin\n"
            + "            lo = (w - 1) * chunk\n"
            + "            hi = min(w * chunk, count)\n"
            + "            acc::Int64 = 0\n"
            + "            for k in lo:(hi - 1)\n"
            + "                x = k\n"
            + "                acc += x\n"
            + "            end\n"
            + "            acc\n"
            + "        end\n"
            + "    end\n"
            + "    partials = fetch.(tasks)\n"
            + "    return sum(partials)\n"
            + "end\n");
    py("sum(x for x in range(10))").parallel()
        .with(Prop.EXPLAIN, false)
        .assertRender(
            allOf(not(containsString("NOTE")),
                containsString("Threads.@spawn")));
  }

  /** Tests that a program with several generators is rendered sequentially
   * even if parallel code was requested. */
  @Test void testParallelFallback() {
    final String source = "sum(x * y for x in range(3) for y in range(3))";
    final String note = "NOTE: parallel fallback -> sequential (2 generators;"
        + " nested loops over a cross product are not parallelized)";
    py(source).parallel()
        .assertRender(
            allOf(containsString("# " + note),
                not(containsString("Threads.@spawn"))));
    py(source).parallel().withBackend(Backend.SYSTEMS_PARALLEL)
        .assertRender(
            allOf(containsString("// " + note),
                not(containsString("rayon"))));
    py(source).parallel().withBackend(Backend.GOROUTINE)
        .assertRender(
            allOf(containsString("// " + note),
                not(containsString("go func"))));
    py("[x for x in range(0, 10, s)]").parallel()
        .assertRender(
            containsString("# NOTE: parallel fallback -> sequential "
                + "(the step of the range is not a constant)"));
  }

  @Test void testParallelNotes() {
    py("[x for x in range(10)]").parallel()
        .withBackend(Backend.WEB_WORKER)
        .assertRender(
            allOf(
                containsString("// NOTE: partial results are combined in "
                    + "chunk order: concatenation"),
                containsString("new Worker(url)"),
                containsString("export async function program(): "
                    + "Promise<")));
    py("{x % 3 for x in range(10)}").parallel()
        .withBackend(Backend.GOROUTINE)
        .assertRender(
            allOf(
                containsString("// NOTE: partial results are combined in "
                    + "chunk order: union"),
                containsString("go func(w int) {")));
    py("{x % 3: x for x in range(10)}").parallel()
        .withBackend(Backend.OOP_LINQ)
        .assertRender(
            allOf(
                containsString("// NOTE: partial results are combined in "
                    + "chunk order: merge, later chunks overwrite earlier "
                    + "keys"),
                containsString("ParallelEnumerable.Range(0, workers)")));
    py("max(x % 7 for x in range(100))").parallel()
        .withBackend(Backend.SYSTEMS_PARALLEL)
        .assertRender(
            allOf(
                containsString("// NOTE: partial results are combined in "
                    + "chunk order: max, first seen wins ties; empty chunks "
                    + "are skipped"),
                containsString("use rayon::prelude::*;"),
                containsString(".into_par_iter()")));
    py("all(x < 5 for x in range(3))").parallel()
        .assertRender(
            containsString("# NOTE: partial results are combined in chunk "
                + "order: and (identity true)"));
  }

  /** Tests that max and min replace the best value only with a strictly
   * greater (or smaller) one, so that the first of equal values wins, in
   * each chunk and when the partial results are combined. */
  @Test void testSelectionKeepsFirst() {
    final String max = "max(x % 7 for x in range(100))";
    final String min = "min(x % 7 for x in range(100))";
    for (boolean parallel : new boolean[] {false, true}) {
      py(max).withBackend(Backend.SYSTEMS_PARALLEL)
          .with(Prop.PARALLEL, parallel)
          .assertRender(
              allOf(
                  containsString(".reduce(|a, v| if v > a { v } else { a })"),
                  not(containsString("v >= a"))));
      py(min).withBackend(Backend.SYSTEMS_PARALLEL)
          .with(Prop.PARALLEL, parallel)
          .assertRender(
              containsString(".reduce(|a, v| if v < a { v } else { a })"));
      py(max).with(Prop.PARALLEL, parallel)
          .assertRender(
              allOf(containsString("if best === nothing || v > best\n"),
                  not(containsString(">= best"))));
      py(max).withBackend(Backend.GOROUTINE)
          .with(Prop.PARALLEL, parallel)
          .assertRender(
              allOf(containsString("if !found || v > best {\n"),
                  not(containsString(">= best"))));
      py(min).withBackend(Backend.WEB_WORKER)
          .with(Prop.PARALLEL, parallel)
          .assertRender(
              allOf(containsString("(best === undefined || v < best) {\n"),
                  not(containsString("<= best"))));
    }
    py(max).parallel()
        .assertRender(
            containsString("if p !== nothing && (best === nothing "
                + "|| p > best)\n"));
    py(max).withBackend(Backend.GOROUTINE).parallel()
        .assertRender(containsString("(!found || *p > best) {\n"));
    py(min).withBackend(Backend.WEB_WORKER).parallel()
        .assertRender(
            containsString("if (p !== null && (best === undefined "
                + "|| p < best)) {\n"));
  }

  @Test void testRust() {
    py(SUM_ODD_SQUARES).withBackend(Backend.SYSTEMS_PARALLEL)
        .assertRender("pub fn program() -> i64 {\n"
            + "    (1i64..6)\n"
            + "        .filter(|&i| i.rem_euclid(2) == 1)\n"
            + "        .map(|i| i * i)\n"
            + "        .sum::<i64>()\n"
            + "}\n");
    py(SUM_ODD_SQUARES).withBackend(Backend.SYSTEMS_PARALLEL)
        .with(Prop.INT_WIDTH, 32)
        .assertRender(containsString("pub fn program() -> i32 {"));
  }

  @Test void testGo() {
    py(SUM_ODD_SQUARES).withBackend(Backend.GOROUTINE)
        .assertRender(
            allOf(startsWith("package polyglot\n\n"),
                containsString("func program() int64 {\n"),
                containsString("\tacc := int64(0)\n"),
                containsString("\tfor i := int64(1); i < 6; i++ {\n"),
                containsString("\t\tif !(floorMod(i, 2) == 1) {\n"),
                containsString("\t\tacc += i * i\n"),
                containsString("\treturn acc\n"),
                containsString("func floorMod(a, b int64) int64 {")));
  }

  @Test void testCSharp() {
    py(SUM_ODD_SQUARES).withBackend(Backend.OOP_LINQ)
        .assertRender(
            allOf(startsWith("using System;\n"),
                containsString("using System.Linq;\n"),
                containsString("public static class Polyglot\n{\n"),
                containsString("    public static long program()\n"),
                containsString("        return Range(1, 6, 1)\n"
                    + "            .Where(i => FloorMod(i, 2) == 1)\n"
                    + "            .Select(i => i * i)\n"
                    + "            .Sum();\n")));
  }

  @Test void testTypeScript() {
    py(SUM_ODD_SQUARES).withBackend(Backend.WEB_WORKER)
        .assertRender(
            allOf(startsWith("export function program(): number {\n"),
                containsString("let acc = 0;"),
                containsString("for (let i = 1; i < 6; i++) {"),
                containsString("pyMod(i, 2)"),
                containsString("return acc;"),
                containsString("function pyMod(a: number, b: number): "
                    + "number {")));
  }

  @Test void testFunctionName() {
    for (Backend backend : new Backend[] {Backend.SCIENTIFIC,
        Backend.SYSTEMS_PARALLEL, Backend.GOROUTINE, Backend.OOP_LINQ,
        Backend.WEB_WORKER}) {
      py("[x for x in range(3)]").withBackend(backend)
          .with(Prop.FUNCTION_NAME, "squares")
          .assertRender(
              allOf(containsString("squares("),
                  not(containsString("program("))));
    }
  }

  @Test void testSql() {
    py(SUM_ODD_SQUARES).withBackend(Backend.SQL)
        .assertRender("SELECT CAST(COALESCE(SUM(g0.i * g0.i), 0) AS BIGINT)"
            + " AS result\n"
            + "FROM (SELECT i FROM generate_series(1, 5, 1) AS r0(i)"
            + " WHERE (((i % 2) + 2) % 2) = 1) AS g0;\n");
    py(SUM_ODD_SQUARES).withBackend(Backend.SQL)
        .with(Prop.DIALECT, SqlDialect.SQLITE)
        .assertRender("WITH RECURSIVE\n"
            + "  r0(i) AS (SELECT 1 WHERE 1 <= 5 UNION ALL SELECT i + 1"
            + " FROM r0 WHERE i + 1 <= 5)\n"
            + "SELECT CAST(COALESCE(SUM(g0.i * g0.i), 0) AS INTEGER)"
            + " AS result\n"
            + "FROM (SELECT i FROM r0"
            + " WHERE (((i % 2) + 2) % 2) = 1) AS g0;\n");
    py(SUM_ODD_SQUARES).withBackend(Backend.SQL)
        .with(Prop.OPTIMIZE, false)
        .assertRender("SELECT CAST(COALESCE(SUM(g0.i * g0.i), 0) AS BIGINT)"
            + " AS result\n"
            + "FROM (SELECT i FROM generate_series(1, 5, 1) AS r0(i))"
            + " AS g0\n"
            + "WHERE (((g0.i % 2) + 2) % 2) = 1;\n");
    py("[x * 2 for x in range(3)]").withBackend(Backend.SQL)
        .assertRender("SELECT g0.x * 2 AS value\n"
            + "FROM (SELECT x FROM generate_series(0, 2, 1) AS r0(x))"
            + " AS g0\n"
            + "ORDER BY g0.x;\n");
    py("max(x % 3 for x in range(10))").withBackend(Backend.SQL)
        .assertRender("SELECT MAX(((g0.x % 3) + 3) % 3) AS result\n"
            + "FROM (SELECT x FROM generate_series(0, 9, 1) AS r0(x))"
            + " AS g0\n"
            + "HAVING COUNT(*) > 0;\n");
  }

  /** Tests SQL for comprehensions that the optimizer proves empty. */
  @Test void testSqlEmpty() {
    py("sum(x for x in range(10, 5))").withBackend(Backend.SQL)
        .assertRender("SELECT 0 AS result;\n");
    py("any(x > 1 for x in range(3) if 1 > 2)").withBackend(Backend.SQL)
        .assertRender("SELECT FALSE AS result;\n");
    py("[x for x in range(10, 5)]").withBackend(Backend.SQL)
        .assertRender("SELECT g0.x AS value\n"
            + "FROM (SELECT x FROM (SELECT CAST(NULL AS BIGINT) AS x"
            + " WHERE FALSE) AS r0) AS g0\n"
            + "WHERE 1 = 0\n"
            + "ORDER BY g0.x;\n");
    py("[x for x in range(10, 5)]").withBackend(Backend.SQL)
        .with(Prop.OPTIMIZE, false)
        .assertRender(
            allOf(containsString("FROM (SELECT x FROM (SELECT CAST(NULL AS"
                    + " BIGINT) AS x WHERE FALSE) AS r0) AS g0\n"),
                not(containsString("generate_series"))));
    py("[x for x in range(0, 5, -1)]").withBackend(Backend.SQL)
        .with(Prop.OPTIMIZE, false)
        .assertRender(not(containsString("generate_series")));
  }

  @Test void testSqlParallel() {
    py("[x for x in range(3)]").withBackend(Backend.SQL).parallel()
        .assertRender(
            startsWith("-- NOTE: parallel: execution is left to the query "
                + "engine\n"));
    py("[x for x in range(3)]").withBackend(Backend.SQL)
        .assertRender(not(containsString("NOTE")));
  }

  @Test void testSqlUnsupported() {
    py("[x for x in xs]").withBackend(Backend.SQL)
        .assertRenderThrows(isUnsupported("OpaqueIterable"));
  }
}

// End RenderTest.java
