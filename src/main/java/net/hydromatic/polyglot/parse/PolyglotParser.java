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

import net.hydromatic.polyglot.ast.Ast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the parser for comprehension expressions.
 *
 * <p>The grammar is in {@code PolyglotParser.jj}; JavaCC generates
 * {@link PolyglotParserImpl} from it. This class runs the generated parser
 * and converts its errors into {@link PolyglotParseException}s that carry
 * a position.
 */
public class PolyglotParser {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(PolyglotParser.class);

  private PolyglotParser() {
  }

  /** Parses a source fragment containing a single expression.
   *
   * @throws UnsupportedConstructException if the fragment is a statement
   *   other than an expression
   * @throws PolyglotParseException if the fragment is not well-formed
   */
  public static Ast.Exp parse(String source) {
    final PolyglotParserImpl parser = PolyglotParserImpl.of(source);
    final Ast.Exp exp;
    try {
      exp = parser.statementEof();
    } catch (ParseException e) {
      final PolyglotParseException e2 = parser.convert(e);
      e2.initCause(e);
      throw e2;
    }
    LOGGER.debug("parsed {}", exp);
    return exp;
  }
}

// End PolyglotParser.java
