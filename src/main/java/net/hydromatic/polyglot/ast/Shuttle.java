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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms a tree of {@link Core} nodes.
 *
 * <p>The default implementation of each method visits the children and, if
 * any of them changed, returns a copy of the node; otherwise it returns the
 * node itself. */
public class Shuttle {
  protected <E extends Core.Exp> List<Core.Exp> visitList(List<E> nodes) {
    final List<Core.Exp> list = new ArrayList<>();
    for (E node : nodes) {
      list.add(node.accept(this));
    }
    return list;
  }

  public Core.Exp visit(Core.Literal literal) {
    return literal;
  }

  public Core.Exp visit(Core.Id id) {
    return id;
  }

  public Core.Exp visit(Core.Call call) {
    return call.copy(visitList(call.args));
  }

  public Core.Exp visit(Core.If ifExp) {
    return ifExp.copy(ifExp.condition.accept(this),
        ifExp.ifTrue.accept(this), ifExp.ifFalse.accept(this));
  }

  public Core.Exp visit(Core.Apply apply) {
    return apply.copy(visitList(apply.args));
  }

  public Core.Iter visit(Core.Range range) {
    return range.copy(range.start.accept(this), range.stop.accept(this),
        range.step.accept(this));
  }

  public Core.Iter visit(Core.OpaqueIterable iterable) {
    return iterable;
  }

  public Core.Generator visit(Core.Generator generator) {
    return generator.copy(generator.iterable.accept(this),
        visitList(generator.conditions));
  }

  public Core.Filter visit(Core.Filter filter) {
    return filter.copy(filter.condition.accept(this));
  }

  public Core.Comprehension visit(Core.Comprehension comprehension) {
    final List<Core.Generator> generators = new ArrayList<>();
    comprehension.generators.forEach(g -> generators.add(g.accept(this)));
    final List<Core.Filter> filters = new ArrayList<>();
    comprehension.filters.forEach(f -> filters.add(f.accept(this)));
    return comprehension.copy(
        comprehension.key == null ? null : comprehension.key.accept(this),
        comprehension.element.accept(this), generators, filters,
        comprehension.empty, comprehension.annotation);
  }

  public Core.Reduction visit(Core.Reduction reduction) {
    return reduction.copy(reduction.source.accept(this),
        reduction.initial == null ? null : reduction.initial.accept(this),
        reduction.annotation);
  }
}

// End Shuttle.java
