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

import net.hydromatic.polyglot.ast.Ast;
import net.hydromatic.polyglot.ast.Core;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when the source text has been parsed. */
  void onAst(Ast.Exp e);

  /** Called when the program has been converted to core (pass 0), annotated
   * with types (pass 1), and optimized (pass 2). */
  void onCore(int pass, Core.Program program);

  /** Called when an optimizer rule decides that it cannot safely apply. */
  void onSkip(SqlOptimizer.Rule rule, String reason);

  /** Called on the generated source text. */
  void onResult(String text);
}

// End Tracer.java
