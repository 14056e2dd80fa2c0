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

/** Utilities for {@link Renderer}. */
public abstract class Renderers {
  private Renderers() {}

  /** Returns the renderer for a backend. */
  public static Renderer of(Backend backend) {
    switch (backend) {
      case SYSTEMS_PARALLEL:
        return RustRenderer.INSTANCE;
      case WEB_WORKER:
        return TypeScriptRenderer.INSTANCE;
      case GOROUTINE:
        return GoRenderer.INSTANCE;
      case OOP_LINQ:
        return CSharpRenderer.INSTANCE;
      case SQL:
        return SqlRenderer.INSTANCE;
      case SCIENTIFIC:
        return JuliaRenderer.INSTANCE;
      default:
        throw new AssertionError(backend);
    }
  }

  /** Generates source code for a program using a given backend. */
  public static String render(Core.Program program, Backend backend,
      RenderOptions options) {
    return of(backend).render(program, options);
  }
}

// End Renderers.java
