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

import com.google.common.collect.ImmutableList;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether to generate parallel code for a program, and describes
 * how.
 *
 * <p>A program is parallelized only if parallelism was requested and it has
 * exactly one generator, over an opaque collection or over a range with a
 * constant step. The generator's index space {@code [0, n)} is split into
 * contiguous chunks, one per worker; each chunk is reduced with the same
 * operator as the whole program, and the partial results are combined in
 * chunk order. Combining in chunk order makes the parallel result equal to
 * the sequential one: lists are concatenated, sets are united, dicts are
 * merged so that a later chunk overwrites an earlier one, and a tie for
 * max or min is won by the earlier chunk.
 *
 * <p>A program with more than one generator is a cross product; it is
 * rendered sequentially.
 */
class ParallelPlan {
  /** Whether to generate parallel code. */
  final boolean parallel;

  /** If parallelism was requested but is not possible, the reason. */
  final @Nullable String fallbackReason;

  private ParallelPlan(boolean parallel, @Nullable String fallbackReason) {
    this.parallel = parallel;
    this.fallbackReason = fallbackReason;
  }

  /** Creates a plan for a program. */
  static ParallelPlan of(Core.Program program, boolean requested) {
    if (!requested) {
      return new ParallelPlan(false, null);
    }
    final Core.Comprehension c = program.comprehension();
    if (c.generators.size() > 1) {
      return new ParallelPlan(false, c.generators.size()
          + " generators; nested loops over a cross product are not"
          + " parallelized");
    }
    final Core.Iter iterable = c.generators.get(0).iterable;
    if (iterable instanceof Core.Range
        && ((Core.Range) iterable).constantStep() == null) {
      return new ParallelPlan(false, "the step of the range is not a"
          + " constant");
    }
    return new ParallelPlan(true, null);
  }

  /** Returns lines of explanation, without comment markers. */
  ImmutableList<String> notes(Core.Program program) {
    if (fallbackReason != null) {
      return ImmutableList.of("NOTE: parallel fallback -> sequential ("
          + fallbackReason + ")");
    }
    if (!parallel) {
      return ImmutableList.of();
    }
    return ImmutableList.of(
        "NOTE: parallel: the index space is split into contiguous chunks,"
            + " one per worker",
        "NOTE: partial results are combined in chunk order: "
            + combineDescription(program));
  }

  /** Describes how partial results are combined. */
  static String combineDescription(Core.Program program) {
    if (program instanceof Core.Reduction) {
      switch (((Core.Reduction) program).reduceOp) {
        case SUM:
          return "sum (identity 0)";
        case PRODUCT:
          return "product (identity 1)";
        case ANY:
          return "or (identity false)";
        case ALL:
          return "and (identity true)";
        case MAX:
          return "max, first seen wins ties; empty chunks are skipped";
        case MIN:
          return "min, first seen wins ties; empty chunks are skipped";
        default:
          throw new AssertionError(program);
      }
    }
    final Op op = program.op;
    switch (op) {
      case LIST_COMP:
        return "concatenation";
      case SET_COMP:
        return "union";
      case DICT_COMP:
        return "merge, later chunks overwrite earlier keys";
      default:
        throw new AssertionError(op);
    }
  }
}

// End ParallelPlan.java
