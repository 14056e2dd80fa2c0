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
package net.hydromatic.polyglot.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.polyglot.ast.Pos;

/** Exception thrown when the input is well-formed but uses a construct
 * that cannot be translated.
 *
 * <p>{@link #kind()} names the construct the way the source language's own
 * syntax tree does, for example "Lambda", "Assign" or "Tuple", so that a
 * caller can decide whether to simplify the input. */
public class UnsupportedConstructException extends PolyglotParseException {
  private final String kind;

  public UnsupportedConstructException(String kind, Pos pos) {
    this(kind, "unsupported construct: " + kind, pos);
  }

  public UnsupportedConstructException(String kind, String message,
      Pos pos) {
    super(message, pos);
    this.kind = requireNonNull(kind);
  }

  /** Returns the kind of construct, e.g. "Lambda". */
  public String kind() {
    return kind;
  }
}

// End UnsupportedConstructException.java
