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

/** Builds the text of a program, one line at a time, keeping track of the
 * indentation. */
class CodeWriter {
  private final StringBuilder b = new StringBuilder();
  private final String indentUnit;
  private int indent;

  CodeWriter(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  /** Writes a line at the current indentation. */
  CodeWriter line(String s) {
    if (!s.isEmpty()) {
      for (int i = 0; i < indent; i++) {
        b.append(indentUnit);
      }
      b.append(s);
    }
    b.append('\n');
    return this;
  }

  /** Writes an empty line. */
  CodeWriter blank() {
    return line("");
  }

  /** Writes a line, then increases the indentation. */
  CodeWriter begin(String s) {
    line(s);
    ++indent;
    return this;
  }

  /** Decreases the indentation, then writes a line. */
  CodeWriter end(String s) {
    --indent;
    return line(s);
  }

  /** Increases the indentation. */
  CodeWriter indent() {
    ++indent;
    return this;
  }

  /** Decreases the indentation. */
  CodeWriter outdent() {
    --indent;
    return this;
  }

  /** Writes each line of a block of text at the current indentation. */
  CodeWriter lines(String text) {
    for (String s : text.split("\n", -1)) {
      line(s);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End CodeWriter.java
