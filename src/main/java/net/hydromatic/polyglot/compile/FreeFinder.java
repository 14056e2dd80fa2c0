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
package net.hydromatic.polyglot.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Visitor;
import net.hydromatic.polyglot.type.PrimitiveType;

/** Finds free variables in a program; they become the parameters of the
 * generated code. */
public class FreeFinder extends Visitor {
  private final Map<String, Param> params = new LinkedHashMap<>();

  private FreeFinder() {}

  /** Returns the parameters of a program that has been annotated with
   * types, in order of first occurrence. */
  public static ImmutableList<Param> params(Core.Program program) {
    final FreeFinder finder = new FreeFinder();
    program.accept(finder);
    return ImmutableList.copyOf(finder.params.values());
  }

  @Override
  public void visit(Core.Id id) {
    if (id.isFree() && !params.containsKey(id.name)) {
      params.put(id.name, new Param(id.name, id.type(), false));
    }
  }

  @Override
  public void visit(Core.OpaqueIterable iterable) {
    // A collection parameter wins over a scalar of the same name.
    params.put(iterable.name,
        new Param(iterable.name, PrimitiveType.INT, true));
  }

  /** Parameter of generated code. */
  public static class Param {
    public final String name;
    /** Type of the parameter, or of its elements if it is a collection. */
    public final PrimitiveType type;
    public final boolean collection;

    Param(String name, PrimitiveType type, boolean collection) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.collection = collection;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type, collection);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Param
              && name.equals(((Param) o).name)
              && type == ((Param) o).type
              && collection == ((Param) o).collection;
    }

    @Override
    public String toString() {
      return name + ": " + (collection ? "[" + type + "]" : type.toString());
    }
  }
}

// End FreeFinder.java
