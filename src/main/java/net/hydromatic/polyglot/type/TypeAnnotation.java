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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Types inferred for a comprehension or reduction.
 *
 * <p>Immutable. For a dict comprehension, {@link #keyType} and
 * {@link #valueType} are set and {@link #elementType} equals the value type.
 * For a reduction, {@link #resultType} is the type of the reduced value.
 */
public class TypeAnnotation {
  public final PrimitiveType elementType;
  public final @Nullable PrimitiveType keyType;
  public final @Nullable PrimitiveType valueType;
  public final @Nullable PrimitiveType resultType;
  /** Width of integers, 32 or 64. */
  public final int intWidth;
  /** Whether any type was defaulted because it could not be inferred. */
  public final boolean fallback;

  public TypeAnnotation(PrimitiveType elementType,
      @Nullable PrimitiveType keyType, @Nullable PrimitiveType valueType,
      @Nullable PrimitiveType resultType, int intWidth, boolean fallback) {
    checkArgument(intWidth == 32 || intWidth == 64,
        "int width must be 32 or 64: %s", intWidth);
    checkArgument((keyType == null) == (valueType == null));
    this.elementType = requireNonNull(elementType);
    this.keyType = keyType;
    this.valueType = valueType;
    this.resultType = resultType;
    this.intWidth = intWidth;
    this.fallback = fallback;
  }

  /** Creates an annotation for a list, set or generator. */
  public static TypeAnnotation of(PrimitiveType elementType, int intWidth,
      boolean fallback) {
    return new TypeAnnotation(elementType, null, null, null, intWidth,
        fallback);
  }

  /** Creates an annotation for a dict comprehension. */
  public static TypeAnnotation ofDict(PrimitiveType keyType,
      PrimitiveType valueType, int intWidth, boolean fallback) {
    return new TypeAnnotation(valueType, keyType, valueType, null, intWidth,
        fallback);
  }

  /** Returns a copy of this annotation with a given result type. */
  public TypeAnnotation withResultType(PrimitiveType resultType) {
    if (resultType == this.resultType) {
      return this;
    }
    return new TypeAnnotation(elementType, keyType, valueType, resultType,
        intWidth, fallback);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, keyType, valueType, resultType, intWidth,
        fallback);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TypeAnnotation
            && elementType == ((TypeAnnotation) o).elementType
            && keyType == ((TypeAnnotation) o).keyType
            && valueType == ((TypeAnnotation) o).valueType
            && resultType == ((TypeAnnotation) o).resultType
            && intWidth == ((TypeAnnotation) o).intWidth
            && fallback == ((TypeAnnotation) o).fallback;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{element: ").append(elementType);
    if (keyType != null) {
      b.append(", key: ").append(keyType)
          .append(", value: ").append(valueType);
    }
    if (resultType != null) {
      b.append(", result: ").append(resultType);
    }
    b.append(", intWidth: ").append(intWidth);
    if (fallback) {
      b.append(", fallback");
    }
    return b.append("}").toString();
  }
}

// End TypeAnnotation.java
