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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}, {@link RenderOptions} and {@link Backend}. */
public class PropTest {
  @Test void testDefaults() {
    final RenderOptions options = RenderOptions.DEFAULT;
    assertThat(options.parallel(), is(false));
    assertThat(options.intWidth(), is(64));
    assertThat(options.dialect(), is(SqlDialect.DUCKDB));
    assertThat(options.strictTypes(), is(false));
    assertThat(options.functionName(), is("program"));
    assertThat(options.explain(), is(true));
    assertThat(options.optimize(), is(true));
    assertThat(options.map().isEmpty(), is(true));
    assertThat(options.toString(),
        is("{dialect: DUCKDB, explain: true, functionName: program, "
            + "intWidth: 64, optimize: true, parallel: false, "
            + "strictTypes: false}"));
  }

  /** Tests that options given as strings are converted. */
  @Test void testLenient() {
    final RenderOptions options =
        RenderOptions.of(
            ImmutableMap.of("intWidth", "32",
                "DIALECT", "sqlite",
                "parallel", "TRUE",
                "functionName", "squares"));
    assertThat(options.intWidth(), is(32));
    assertThat(options.dialect(), is(SqlDialect.SQLITE));
    assertThat(options.parallel(), is(true));
    assertThat(options.functionName(), is("squares"));
    assertThat(options,
        is(RenderOptions.DEFAULT
            .with(Prop.INT_WIDTH, 32)
            .with(Prop.DIALECT, SqlDialect.SQLITE)
            .with(Prop.PARALLEL, true)
            .with(Prop.FUNCTION_NAME, "squares")));
  }

  @Test void testInvalid() {
    checkInvalid(Prop.INT_WIDTH, 16,
        "invalid value for property intWidth: 16");
    checkInvalid(Prop.INT_WIDTH, "wide",
        "value for property intWidth must be an integer");
    checkInvalid(Prop.DIALECT, "oracle",
        "value must be one of: 'DUCKDB', 'SQLITE'");
    checkInvalid(Prop.EXPLAIN, "yes",
        "value for property explain must be 'true' or 'false'");
    checkInvalid(Prop.PARALLEL, 1,
        "value for property parallel must have type Boolean");
    checkInvalid(Prop.FUNCTION_NAME, null,
        "property functionName is required");

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> RenderOptions.of(ImmutableMap.of("color", "red")));
    assertThat(e.getMessage(), is("property color not found"));
  }

  private static void checkInvalid(Prop prop, Object value, String message) {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> RenderOptions.DEFAULT.with(prop, value));
    assertThat(e.getMessage(), is(message));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("strictTypes"), is(Prop.STRICT_TYPES));
    assertThat(Prop.lookup("STRICT_TYPES"), is(Prop.STRICT_TYPES));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.DIALECT));
  }

  @Test void testBackend() {
    assertThat(Backend.of("systems-parallel"), is(Backend.SYSTEMS_PARALLEL));
    assertThat(Backend.of("rust"), is(Backend.SYSTEMS_PARALLEL));
    assertThat(Backend.of("Web-Worker"), is(Backend.WEB_WORKER));
    assertThat(Backend.of("go"), is(Backend.GOROUTINE));
    assertThat(Backend.of("OOP_LINQ"), is(Backend.OOP_LINQ));
    assertThat(Backend.of("sql"), is(Backend.SQL));
    assertThat(Backend.of("julia"), is(Backend.SCIENTIFIC));
    assertThat(Backend.SCIENTIFIC.toString(), is("scientific"));
    assertThat(Backend.SQL.lineComment, is("--"));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Backend.of("cobol"));
    assertThat(e.getMessage().startsWith("unknown backend 'cobol'"),
        is(true));

    // Every backend has a renderer
    for (Backend backend : Backend.values()) {
      assertThat(Renderers.of(backend).backend(), is(backend));
    }
  }
}

// End PropTest.java
