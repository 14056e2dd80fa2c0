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
package net.hydromatic.polyglot.type;

import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Primitive type of a value in a comprehension. */
public enum PrimitiveType {
  BOOL,
  INT,
  REAL,
  STRING;

  /** The name in the language, e.g. {@code bool}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  @Override
  public String toString() {
    return moniker;
  }

  /** Returns whether this type is numeric. Booleans count as integers in
   * arithmetic, so they are numeric too. */
  public boolean isNumeric() {
    return this != STRING;
  }

  /**
   * Returns the type of an arithmetic expression whose operands have the
   * given types, or null if there is no such type.
   *
   * <p>Two operands of the same type preserve that type, except that
   * arithmetic on booleans yields an integer; an integer and a real yield a
   * real.
   */
  public static @Nullable PrimitiveType arithmetic(PrimitiveType t0,
      PrimitiveType t1) {
    if (!t0.isNumeric() || !t1.isNumeric()) {
      return t0 == STRING && t1 == STRING ? STRING : null;
    }
    if (t0 == REAL || t1 == REAL) {
      return REAL;
    }
    return INT;
  }

  /** Returns the least type that can hold values of both types, or null. */
  public static @Nullable PrimitiveType union(PrimitiveType t0,
      PrimitiveType t1) {
    if (t0 == t1) {
      return t0;
    }
    return arithmetic(t0, t1);
  }
}

// End PrimitiveType.java
