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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable set of property values that control compilation and rendering.
 *
 * <p>Properties that have not been set have their default value; see
 * {@link Prop}.
 */
public class RenderOptions {
  /** Options with every property at its default value. */
  public static final RenderOptions DEFAULT =
      new RenderOptions(ImmutableMap.of());

  private final ImmutableMap<Prop, Object> map;

  private RenderOptions(ImmutableMap<Prop, Object> map) {
    this.map = requireNonNull(map);
  }

  /** Creates options from a map whose keys are property names, either
   * camel-case ("intWidth") or upper-case ("INT_WIDTH"); values may be
   * strings, such as "32" or "sqlite". */
  public static RenderOptions of(Map<String, ?> values) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    values.forEach((name, value) -> Prop.lookup(name).setLenient(map, value));
    return new RenderOptions(ImmutableMap.copyOf(map));
  }

  /** Returns a copy of these options with a property set to a value; a
   * string value is converted to the type of the property. */
  public RenderOptions with(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(this.map);
    prop.setLenient(map, value);
    return new RenderOptions(ImmutableMap.copyOf(map));
  }

  /** Returns the value of a property, or its default value. */
  public Object get(Prop prop) {
    return prop.get(map);
  }

  /** Returns the properties that have been set explicitly. */
  public ImmutableMap<Prop, Object> map() {
    return map;
  }

  public boolean parallel() {
    return Prop.PARALLEL.booleanValue(map);
  }

  public int intWidth() {
    return Prop.INT_WIDTH.intValue(map);
  }

  public SqlDialect dialect() {
    return Prop.DIALECT.enumValue(map, SqlDialect.class);
  }

  public boolean strictTypes() {
    return Prop.STRICT_TYPES.booleanValue(map);
  }

  public String functionName() {
    return Prop.FUNCTION_NAME.stringValue(map);
  }

  public boolean explain() {
    return Prop.EXPLAIN.booleanValue(map);
  }

  public boolean optimize() {
    return Prop.OPTIMIZE.booleanValue(map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RenderOptions
            && map.equals(((RenderOptions) o).map);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(prop.camelName).append(": ").append(prop.get(map));
    }
    return b.append("}").toString();
  }
}

// End RenderOptions.java
