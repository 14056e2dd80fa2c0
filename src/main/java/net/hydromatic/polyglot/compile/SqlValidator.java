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

import java.math.BigInteger;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Visitor;
import net.hydromatic.polyglot.parse.UnsupportedConstructException;

/**
 * Checks that a program can be translated to SQL.
 *
 * <p>A SQL query can only draw rows from a range whose bounds are known
 * before the query starts, so the SQL backend rejects collections that are
 * not ranges, ranges whose bounds depend on the variable of another
 * generator or cannot be evaluated, and free variables.
 */
public class SqlValidator extends Visitor {
  private final int intWidth;

  private SqlValidator(int intWidth) {
    this.intWidth = intWidth;
  }

  /** Validates a program; throws {@link UnsupportedConstructException} if
   * it cannot be translated.
   *
   * @param program Program annotated with types
   * @param intWidth Width of integers, 32 or 64; the bounds of each range,
   *   and its last value, must fit
   */
  public static void validate(Core.Program program, int intWidth) {
    program.accept(new SqlValidator(intWidth));
  }

  @Override
  public void visit(Core.OpaqueIterable iterable) {
    throw new UnsupportedConstructException(iterable.op.kind,
        "SQL requires a range; cannot iterate over '" + iterable.name + "'",
        iterable.pos);
  }

  @Override
  public void visit(Core.Range range) {
    range.accept(new Visitor() {
      @Override
      public void visit(Core.Id id) {
        if (!id.isFree()) {
          throw new UnsupportedConstructException(range.op.kind,
              "SQL requires range bounds that do not depend on generator "
                  + "variable '" + id.name + "'",
              range.pos);
        }
      }
    });
    super.visit(range);
    for (Core.Exp e : new Core.Exp[] {range.start, range.stop, range.step}) {
      final Comparable value = ConstantFolder.evaluate(e);
      if (!(value instanceof BigInteger)) {
        throw new UnsupportedConstructException(range.op.kind,
            "SQL requires range bounds that are integer constants", e.pos);
      }
      checkWidth(range, e, (BigInteger) value);
    }
    // The query holds the last value, one step before the stop
    final BigInteger step = (BigInteger) ConstantFolder.evaluate(range.step);
    final BigInteger stop = (BigInteger) ConstantFolder.evaluate(range.stop);
    checkWidth(range, range.stop,
        stop.subtract(BigInteger.valueOf(step.signum())));
  }

  private void checkWidth(Core.Range range, Core.Exp e, BigInteger value) {
    if (value.bitLength() >= intWidth) {
      throw new UnsupportedConstructException(range.op.kind,
          "SQL requires range bounds that fit in a " + intWidth
              + "-bit integer; " + e + " is " + value,
          e.pos);
    }
  }

  @Override
  public void visit(Core.Id id) {
    if (id.isFree()) {
      throw new UnsupportedConstructException(id.op.kind,
          "SQL does not support free variable '" + id.name + "'", id.pos);
    }
  }
}

// End SqlValidator.java
