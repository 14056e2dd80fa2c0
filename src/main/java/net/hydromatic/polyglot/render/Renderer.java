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

import net.hydromatic.polyglot.ast.Core;

/** Generates source code in a target language from a program that has been
 * annotated with types.
 *
 * <p>A renderer holds no state; {@link #render} is a deterministic function
 * of its arguments, and its result always ends with a line feed. */
public interface Renderer {
  /** Returns the backend that this renderer generates code for. */
  Backend backend();

  /** Generates source code for a program. */
  String render(Core.Program program, RenderOptions options);
}

// End Renderer.java
