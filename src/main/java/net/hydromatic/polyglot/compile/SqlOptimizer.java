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

import static net.hydromatic.polyglot.ast.CoreBuilder.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a program before it is rendered as SQL.
 *
 * <p>Rules are applied in the order of {@link Rule}. Each rule is
 * conservative: if it cannot prove that a rewrite preserves the result, it
 * leaves the program unchanged and reports the skip to the
 * {@link Tracer}.
 */
public class SqlOptimizer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SqlOptimizer.class);

  private final int intWidth;
  private final Tracer tracer;

  private SqlOptimizer(int intWidth, Tracer tracer) {
    this.intWidth = intWidth;
    this.tracer = tracer;
  }

  /** Optimizes a program that has been annotated with types. */
  public static Core.Program optimize(Core.Program program, int intWidth,
      Tracer tracer) {
    final SqlOptimizer optimizer = new SqlOptimizer(intWidth, tracer);
    Core.Comprehension c = program.comprehension();
    for (Rule rule : Rule.values()) {
      final Core.Comprehension c2 = optimizer.apply(rule, c);
      if (c2 != c) {
        LOGGER.debug("rule {} rewrote {} to {}", rule, c, c2);
      }
      c = c2;
    }
    if (program instanceof Core.Reduction) {
      final Core.Reduction reduction = (Core.Reduction) program;
      Core.Exp initial = reduction.initial;
      if (initial != null) {
        initial = initial.accept(new ConstantFolder(intWidth));
      }
      return reduction.copy(c, initial, reduction.annotation);
    }
    return c;
  }

  private Core.Comprehension apply(Rule rule, Core.Comprehension c) {
    switch (rule) {
      case RANGE_CLIPPING:
        return clipRanges(c);
      case PREDICATE_PUSHDOWN:
        return pushDownPredicates(c);
      case CONSTANT_FOLDING:
        return foldConstants(c);
      default:
        throw new AssertionError(rule);
    }
  }

  private void skip(Rule rule, String reason) {
    LOGGER.debug("skipped rule {}: {}", rule, reason);
    tracer.onSkip(rule, reason);
  }

  /** Replaces each range that is provably empty with an empty range, and
   * marks the comprehension empty. */
  private Core.Comprehension clipRanges(Core.Comprehension c) {
    boolean empty = c.empty;
    final List<Core.Generator> generators = new ArrayList<>();
    for (Core.Generator generator : c.generators) {
      if (!(generator.iterable instanceof Core.Range)) {
        skip(Rule.RANGE_CLIPPING, "iterable of '" + generator.variable
            + "' is not a range");
        generators.add(generator);
        continue;
      }
      final Core.Range range = (Core.Range) generator.iterable;
      final Comparable start = ConstantFolder.evaluate(range.start);
      final Comparable stop = ConstantFolder.evaluate(range.stop);
      final Comparable step = ConstantFolder.evaluate(range.step);
      if (!(start instanceof BigInteger
          && stop instanceof BigInteger
          && step instanceof BigInteger)) {
        skip(Rule.RANGE_CLIPPING, "bounds of range of '"
            + generator.variable + "' are not constant");
        generators.add(generator);
        continue;
      }
      final int signum = ((BigInteger) step).signum();
      final int c0 = ((BigInteger) start).compareTo((BigInteger) stop);
      if (signum > 0 && c0 >= 0 || signum < 0 && c0 <= 0) {
        generators.add(
            generator.copy(core.emptyRange(range.pos), generator.conditions));
        empty = true;
      } else {
        generators.add(generator);
      }
    }
    return c.copy(c.key, c.element, generators, c.filters, empty,
        c.annotation);
  }

  /** Moves each filter that references the variable of only one generator
   * into that generator. */
  private Core.Comprehension pushDownPredicates(Core.Comprehension c) {
    final List<List<Core.Exp>> conditions = new ArrayList<>();
    c.generators.forEach(g -> conditions.add(new ArrayList<>(g.conditions)));
    final List<Core.Filter> filters = new ArrayList<>();
    for (Core.Filter filter : c.filters) {
      final SortedSet<Integer> ordinals = new TreeSet<>();
      final SortedSet<String> freeNames = new TreeSet<>();
      filter.condition.accept(new Visitor() {
        @Override
        public void visit(Core.Id id) {
          if (id.isFree()) {
            freeNames.add(id.name);
          } else {
            ordinals.add(id.generatorIndex);
          }
        }
      });
      final String reason = pushDownBlocker(c, ordinals, freeNames);
      if (reason != null) {
        skip(Rule.PREDICATE_PUSHDOWN,
            "cannot push '" + filter.condition + "': " + reason);
        filters.add(filter);
      } else {
        conditions.get(ordinals.first()).add(filter.condition);
      }
    }
    final List<Core.Generator> generators = new ArrayList<>();
    for (int i = 0; i < c.generators.size(); i++) {
      final Core.Generator g = c.generators.get(i);
      generators.add(g.copy(g.iterable, conditions.get(i)));
    }
    return c.copy(c.key, c.element, generators, filters, c.empty,
        c.annotation);
  }

  /** Returns why a filter that references the given generators and free
   * variables cannot be pushed down, or null if it can. */
  private static @Nullable String pushDownBlocker(Core.Comprehension c,
      SortedSet<Integer> ordinals, SortedSet<String> freeNames) {
    if (!freeNames.isEmpty()) {
      return "references free variables " + freeNames;
    }
    if (ordinals.isEmpty()) {
      return "references no generator variable";
    }
    if (ordinals.size() > 1) {
      return "references variables of generators " + ordinals;
    }
    final int i = ordinals.first();
    final Core.Generator generator = c.generators.get(i);
    for (Core.Generator g : c.generators.subList(i + 1, c.generators.size())) {
      if (g.variable.equals(generator.variable)) {
        return "variable '" + generator.variable
            + "' is shadowed by a later generator";
      }
    }
    if (!(generator.iterable instanceof Core.Range)) {
      return "iterable of '" + generator.variable + "' is not a range";
    }
    return null;
  }

  /** Evaluates constant sub-expressions; removes conditions that are always
   * true, and marks the comprehension empty if a condition is always
   * false. */
  private Core.Comprehension foldConstants(Core.Comprehension c) {
    final Core.Comprehension c2 = c.accept(new ConstantFolder(intWidth));
    boolean empty = c2.empty;
    final List<Core.Generator> generators = new ArrayList<>();
    for (Core.Generator g : c2.generators) {
      final List<Core.Exp> conditions = new ArrayList<>();
      for (Core.Exp condition : g.conditions) {
        if (condition.op == Op.BOOL_LITERAL) {
          empty |= !((Core.Literal) condition).booleanValue();
        } else {
          conditions.add(condition);
        }
      }
      generators.add(g.copy(g.iterable, conditions));
    }
    final List<Core.Filter> filters = new ArrayList<>();
    for (Core.Filter filter : c2.filters) {
      if (filter.condition.op == Op.BOOL_LITERAL) {
        empty |= !((Core.Literal) filter.condition).booleanValue();
      } else {
        filters.add(filter);
      }
    }
    return c2.copy(c2.key, c2.element, generators, filters, empty,
        c2.annotation);
  }

  /** Optimization rule, in the order that rules are applied. */
  public enum Rule {
    /** Replaces a range that is provably empty with an empty range. */
    RANGE_CLIPPING,
    /** Moves a filter into the only generator whose variable it
     * references. */
    PREDICATE_PUSHDOWN,
    /** Evaluates sub-expressions that have no variables. */
    CONSTANT_FOLDING
  }
}

// End SqlOptimizer.java
