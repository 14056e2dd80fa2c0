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
package net.hydromatic.polyglot.ast;

/** Visits a tree of {@link Core} nodes. The default implementation of each
 * method visits the children. */
public class Visitor {
  public void visit(Core.Literal literal) {}

  public void visit(Core.Id id) {}

  public void visit(Core.Call call) {
    call.args.forEach(arg -> arg.accept(this));
  }

  public void visit(Core.If ifExp) {
    ifExp.condition.accept(this);
    ifExp.ifTrue.accept(this);
    ifExp.ifFalse.accept(this);
  }

  public void visit(Core.Apply apply) {
    apply.args.forEach(arg -> arg.accept(this));
  }

  public void visit(Core.Range range) {
    range.start.accept(this);
    range.stop.accept(this);
    range.step.accept(this);
  }

  public void visit(Core.OpaqueIterable iterable) {}

  public void visit(Core.Generator generator) {
    generator.iterable.accept(this);
    generator.conditions.forEach(c -> c.accept(this));
  }

  public void visit(Core.Filter filter) {
    filter.condition.accept(this);
  }

  public void visit(Core.Comprehension comprehension) {
    comprehension.generators.forEach(g -> g.accept(this));
    comprehension.filters.forEach(f -> f.accept(this));
    if (comprehension.key != null) {
      comprehension.key.accept(this);
    }
    comprehension.element.accept(this);
  }

  public void visit(Core.Reduction reduction) {
    reduction.source.accept(this);
    if (reduction.initial != null) {
      reduction.initial.accept(this);
    }
  }
}

// End Visitor.java
