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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Reduction operator; the fold applied by a {@link Core.Reduction}. */
public enum ReduceOp {
  SUM("sum", Op.PLUS),
  PRODUCT("math.prod", Op.TIMES),
  ANY("any", Op.OR),
  ALL("all", Op.AND),
  MAX("max", Op.GT),
  MIN("min", Op.LT);

  /** Canonical name of the function in comprehension syntax. */
  public final String functionName;

  /** Operator that combines two values; for {@link #MAX} and {@link #MIN},
   * the strict comparison that decides whether a new value replaces the
   * current one. */
  public final Op combiner;

  /** Name used in the serialized IR, e.g. "Sum". */
  public final String kind;

  private static final ImmutableMap<String, ReduceOp> BY_NAME =
      ImmutableMap.<String, ReduceOp>builder()
          .put("sum", SUM)
          .put("prod", PRODUCT)
          .put("product", PRODUCT)
          .put("math.prod", PRODUCT)
          .put("any", ANY)
          .put("all", ALL)
          .put("max", MAX)
          .put("min", MIN)
          .build();

  ReduceOp(String functionName, Op combiner) {
    this.functionName = functionName;
    this.combiner = combiner;
    this.kind = name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
  }

  /** Looks up a reduction by the name of the function that calls it
   * ("sum", "math.prod", etc.); returns null if there is no such
   * reduction. */
  public static @Nullable ReduceOp of(String functionName) {
    return BY_NAME.get(functionName);
  }

  /** Whether the reduction has a boolean result (any, all). */
  public boolean isBoolean() {
    return this == ANY || this == ALL;
  }

  /** Whether the reduction selects an element (max, min). Such reductions
   * have no identity value, and fail on an empty source unless there is a
   * default. */
  public boolean isSelection() {
    return this == MAX || this == MIN;
  }

  /** Whether the reduction may be given an initial value ("start" for sum
   * and product, "default" for max and min). */
  public boolean allowsInitial() {
    return !isBoolean();
  }
}

// End ReduceOp.java
