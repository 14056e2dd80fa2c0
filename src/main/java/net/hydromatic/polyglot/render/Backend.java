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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Target of code generation.
 *
 * <p>The set of backends is closed; {@link Renderers#of(Backend)} maps each
 * to its renderer. */
public enum Backend {
  /** Systems language with safe parallel iterators (Rust and Rayon). */
  SYSTEMS_PARALLEL("systems-parallel", "rust", "//"),
  /** Web language with worker-thread parallelism (TypeScript). */
  WEB_WORKER("web-worker", "ts", "//"),
  /** Concurrent language with goroutines and channels (Go). */
  GOROUTINE("goroutine", "go", "//"),
  /** Object-oriented language with data-parallel LINQ (C#). */
  OOP_LINQ("oop-linq", "csharp", "//"),
  /** Relational query language (SQL); see {@link SqlDialect}. */
  SQL("sql", "sql", "--"),
  /** Scientific-computing language with native threads (Julia). */
  SCIENTIFIC("scientific", "julia", "#");

  /** Identifier, such as "systems-parallel". */
  public final String id;

  /** Short name of the target language, such as "rust". */
  public final String language;

  /** Prefix of a line comment in the target language. */
  public final String lineComment;

  private static final ImmutableMap<String, Backend> BY_NAME;

  static {
    final Map<String, Backend> map = new LinkedHashMap<>();
    for (Backend backend : values()) {
      map.put(backend.id, backend);
      map.put(backend.language, backend);
      map.put(backend.name().toLowerCase(Locale.ROOT), backend);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Backend(String id, String language, String lineComment) {
    this.id = id;
    this.language = language;
    this.lineComment = lineComment;
  }

  /** Looks up a backend by its identifier ("oop-linq"), its language
   * ("csharp") or its name ("OOP_LINQ"), ignoring case. Throws if not
   * found; never returns null. */
  public static Backend of(String name) {
    final Backend backend = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (backend == null) {
      throw new IllegalArgumentException("unknown backend '" + name
          + "'; expected one of " + BY_NAME.keySet());
    }
    return backend;
  }

  @Override
  public String toString() {
    return id;
  }
}

// End Backend.java
