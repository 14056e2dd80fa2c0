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

import static net.hydromatic.polyglot.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.Pos;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.compile.ConstantFolder;
import net.hydromatic.polyglot.compile.SqlValidator;
import net.hydromatic.polyglot.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renderer for the {@link Backend#SQL} backend; generates a query.
 *
 * <p>Each generator becomes a sub-query over a range of integers, which
 * also evaluates the conditions that the optimizer pushed into the
 * generator; the sub-queries are cross-joined, and the remaining filters
 * form the {@code WHERE} clause. The {@link SqlDialect} decides how a range
 * is materialized.
 *
 * <p>A comprehension that the optimizer proved empty becomes a constant
 * query (for sum, product, any and all) or a query that returns no rows.
 */
class SqlRenderer extends AbstractRenderer<SqlRenderer.SqlExpWriter> {
  static final SqlRenderer INSTANCE = new SqlRenderer();

  private SqlRenderer() {
    super(Backend.SQL);
  }

  @Override
  SqlExpWriter expWriter(RenderOptions options) {
    return new SqlExpWriter(options.dialect(), options.intWidth());
  }

  @Override
  String indent() {
    return "  ";
  }

  @Override
  void writeNotes(Context<SqlExpWriter> cx) {
    if (cx.options.explain() && cx.options.parallel()) {
      cx.out.line(Backend.SQL.lineComment
          + " NOTE: parallel: execution is left to the query engine");
    }
  }

  @Override
  void write(Context<SqlExpWriter> cx) {
    SqlValidator.validate(cx.program, cx.options.intWidth());
    writeNotes(cx);
    final Query q = new Query(cx);
    if (cx.c.empty && cx.reduceOp != null && !cx.reduceOp.isSelection()) {
      // An empty sum, product, any or all is its identity
      cx.out.line("SELECT " + cx.w.write(identity(cx)) + " AS result;");
      return;
    }
    if (cx.reduceOp == ReduceOp.PRODUCT) {
      writeProduct(cx, q);
      return;
    }
    final CodeWriter out = cx.out;
    q.writeWith(out, ImmutableList.of());
    if (cx.reduceOp == null) {
      writeCollection(cx, q);
      return;
    }
    final SqlExpWriter w = cx.w;
    final Core.Exp initial = cx.initial();
    final String e = w.write(cx.c.element);
    switch (cx.reduceOp) {
      case SUM:
        final String zero = cx.resultType() == PrimitiveType.REAL
            ? "0.0" : "0";
        String sum = "COALESCE(SUM(" + e + "), " + zero + ")";
        if (cx.resultType() == PrimitiveType.INT) {
          // DuckDB widens the sum of BIGINT values to HUGEINT
          sum = "CAST(" + sum + " AS " + w.typeName(PrimitiveType.INT) + ")";
        }
        if (initial != null) {
          sum = w.write(initial, 0, Op.PLUS.left) + " + " + sum;
        }
        out.line("SELECT " + sum + " AS result");
        q.writeFrom(out, ImmutableList.of(), ";");
        break;
      case ANY:
      case ALL:
        final boolean any = cx.reduceOp == ReduceOp.ANY;
        final Core.Exp element = any ? cx.c.element
            : core.call(cx.c.element.pos, Op.NOT, cx.c.element)
                .withType(PrimitiveType.BOOL);
        out.begin("SELECT " + (any ? "" : "NOT ") + "EXISTS (");
        out.line("SELECT 1");
        q.writeFrom(out, ImmutableList.of(element), "");
        out.end(") AS result;");
        break;
      case MAX:
      case MIN:
        final String agg = cx.reduceOp.name() + "(" + e + ")";
        if (initial != null) {
          out.line("SELECT COALESCE(" + agg + ", " + w.write(initial)
              + ") AS result");
          q.writeFrom(out, ImmutableList.of(), ";");
        } else {
          // No rows if the source is empty, like Python's ValueError
          out.line("SELECT " + agg + " AS result");
          q.writeFrom(out, ImmutableList.of(), "");
          out.line("HAVING COUNT(*) > 0;");
        }
        break;
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  /** Returns the value of a reduction whose source is empty. */
  private static Core.Exp identity(Context<SqlExpWriter> cx) {
    final Core.Exp initial = cx.initial();
    if (initial != null) {
      return initial;
    }
    final boolean real = cx.resultType() == PrimitiveType.REAL;
    switch (Objects.requireNonNull(cx.reduceOp)) {
      case SUM:
        return real ? core.realLiteral(Pos.ZERO, BigDecimal.ZERO)
            : core.intLiteral(0);
      case PRODUCT:
        return real ? core.realLiteral(Pos.ZERO, BigDecimal.ONE)
            : core.intLiteral(1);
      case ANY:
        return core.boolLiteral(false);
      case ALL:
        return core.boolLiteral(true);
      default:
        throw new AssertionError(cx.reduceOp);
    }
  }

  private static void writeCollection(Context<SqlExpWriter> cx, Query q) {
    final CodeWriter out = cx.out;
    final SqlExpWriter w = cx.w;
    switch (cx.c.op) {
      case LIST_COMP:
        out.line("SELECT " + w.write(cx.c.element) + " AS value");
        q.writeFrom(out, ImmutableList.of(), "");
        out.line("ORDER BY " + q.orderBy(false) + ";");
        return;
      case SET_COMP:
        out.line("SELECT DISTINCT " + w.write(cx.c.element) + " AS value");
        q.writeFrom(out, ImmutableList.of(), ";");
        return;
      case DICT_COMP:
        // The last value written for a key wins, so number the rows of
        // each key in reverse loop order and keep the first.
        final String key = w.write(Objects.requireNonNull(cx.c.key));
        out.line("SELECT key, value");
        out.begin("FROM (");
        out.line("SELECT " + key + " AS key, " + w.write(cx.c.element)
            + " AS value,");
        out.line(cx.w.indentUnit() + "ROW_NUMBER() OVER (PARTITION BY " + key
            + " ORDER BY " + q.orderBy(true) + ") AS rn");
        q.writeFrom(out, ImmutableList.of(), "");
        out.end(") AS t");
        out.line("WHERE rn = 1;");
        return;
      default:
        throw new AssertionError(cx.c.op);
    }
  }

  /** Writes a product. SQL has no product aggregate, so the rows are
   * numbered and multiplied by a recursive query. */
  private static void writeProduct(Context<SqlExpWriter> cx, Query q) {
    final CodeWriter out = cx.out;
    final SqlExpWriter w = cx.w;
    final Core.Exp initial = cx.initial();
    final String type = w.typeName(cx.resultType());
    final String one = "CAST(" + (initial == null ? "1" : w.write(initial))
        + " AS " + type + ")";

    final CodeWriter terms = new CodeWriter("  ");
    terms.begin("terms(n, v) AS (");
    terms.line("SELECT ROW_NUMBER() OVER (), " + w.write(cx.c.element));
    q.writeFrom(terms, ImmutableList.of(), "");
    terms.end(")");
    final CodeWriter acc = new CodeWriter("  ");
    acc.begin("acc(n, v) AS (");
    acc.line("SELECT 0, " + one);
    acc.line("UNION ALL");
    acc.line("SELECT terms.n, acc.v * terms.v");
    acc.line("FROM acc JOIN terms ON terms.n = acc.n + 1");
    acc.end(")");
    q.writeWith(out, ImmutableList.of(strip(terms), strip(acc)));
    out.line("SELECT v AS result");
    out.line("FROM acc");
    out.line("ORDER BY n DESC");
    out.line("LIMIT 1;");
  }

  private static String strip(CodeWriter w) {
    final String s = w.toString();
    return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
  }

  /** The generators of a comprehension, as sub-queries, and its
   * filters. */
  private static class Query {
    final Context<SqlExpWriter> cx;
    final List<RangeBounds> ranges = new ArrayList<>();

    Query(Context<SqlExpWriter> cx) {
      this.cx = cx;
      for (Core.Generator g : cx.c.generators) {
        ranges.add(new RangeBounds((Core.Range) g.iterable));
      }
    }

    private String rangeName(int i) {
      return "r" + i;
    }

    /** Writes the WITH clause, if the dialect needs common table
     * expressions for ranges or there are extra ones. */
    void writeWith(CodeWriter out, List<String> extra) {
      final List<String> definitions = new ArrayList<>();
      for (int i = 0; i < ranges.size(); i++) {
        final RangeBounds r = ranges.get(i);
        final String definition =
            cx.w.dialect.rangeDefinition(rangeName(i), variable(i), r.start,
                r.last, r.step);
        if (definition != null) {
          definitions.add(definition);
        }
      }
      definitions.addAll(extra);
      if (definitions.isEmpty()) {
        return;
      }
      out.begin("WITH RECURSIVE");
      for (int i = 0; i < definitions.size(); i++) {
        final String[] lines = definitions.get(i).split("\n");
        for (int j = 0; j < lines.length; j++) {
          out.line(j == lines.length - 1 && i < definitions.size() - 1
              ? lines[j] + "," : lines[j]);
        }
      }
      out.outdent();
    }

    private String variable(int i) {
      return cx.c.generators.get(i).variable;
    }

    /** Writes the FROM and WHERE clauses, and appends {@code suffix} to
     * the last line. The WHERE clause holds the filters, any extra
     * conditions, and a false condition if the comprehension is empty. */
    void writeFrom(CodeWriter out, List<Core.Exp> extra, String suffix) {
      final List<String> lines = new ArrayList<>();
      final SqlExpWriter w = cx.w;
      for (int i = 0; i < ranges.size(); i++) {
        final RangeBounds r = ranges.get(i);
        final String v = variable(i);
        final StringBuilder b = new StringBuilder()
            .append(i == 0 ? "FROM (SELECT " : "CROSS JOIN (SELECT ")
            .append(v)
            .append(" FROM ")
            .append(
                w.dialect.rangeSource(rangeName(i), v, r.start, r.last,
                    r.step));
        final List<Core.Exp> conditions =
            cx.c.generators.get(i).conditions;
        if (!conditions.isEmpty()) {
          // Conditions inside the sub-query see the bare column
          w.qualify = false;
          b.append(" WHERE ").append(w.write(core.andAlso(conditions)));
          w.qualify = true;
        }
        lines.add(b.append(") AS g").append(i).toString());
      }
      final List<Core.Exp> conditions = new ArrayList<>();
      cx.c.filters.forEach(f -> conditions.add(f.condition));
      conditions.addAll(extra);
      final List<String> where = new ArrayList<>();
      if (!conditions.isEmpty()) {
        where.add(
            w.write(core.andAlso(conditions), 0,
                cx.c.empty ? Op.AND.right : 0));
      }
      if (cx.c.empty) {
        where.add("1 = 0");
      }
      if (!where.isEmpty()) {
        lines.add("WHERE " + String.join(" AND ", where));
      }
      for (int i = 0; i < lines.size(); i++) {
        out.line(i == lines.size() - 1 ? lines.get(i) + suffix
            : lines.get(i));
      }
    }

    /** Returns the ORDER BY list that sorts rows in the order of the
     * nested loops, or in the reverse order. */
    String orderBy(boolean reverse) {
      final List<String> list = new ArrayList<>();
      for (int i = 0; i < ranges.size(); i++) {
        final boolean ascending = ranges.get(i).step > 0 != reverse;
        list.add("g" + i + "." + variable(i) + (ascending ? "" : " DESC"));
      }
      return String.join(", ", list);
    }
  }

  /** The constant bounds of a range. */
  private static class RangeBounds {
    final long start;
    final long last;
    final long step;

    RangeBounds(Core.Range range) {
      this.start = longValue(range.start);
      this.step = longValue(range.step);
      // The stop is exclusive, the last value is inclusive
      this.last = longValue(range.stop) - Long.signum(step);
    }

    private static long longValue(Core.Exp e) {
      return ((BigInteger) Objects.requireNonNull(ConstantFolder.evaluate(e)))
          .longValueExact();
    }
  }

  /** Writes expressions in SQL. */
  static class SqlExpWriter extends ExpWriter {
    final SqlDialect dialect;

    /** Whether to qualify a reference to a generator variable with the
     * alias of its sub-query. */
    boolean qualify = true;

    SqlExpWriter(SqlDialect dialect, int intWidth) {
      super(intWidth);
      this.dialect = dialect;
    }

    String indentUnit() {
      return "  ";
    }

    @Override
    String typeName(PrimitiveType type) {
      return dialect.typeName(type, intWidth);
    }

    @Override
    void literal(StringBuilder b, Core.Literal literal, int left,
        int right) {
      if (literal.op == Op.BOOL_LITERAL) {
        b.append(literal.booleanValue() ? "TRUE" : "FALSE");
      } else {
        super.literal(b, literal, left, right);
      }
    }

    @Override
    String stringLiteral(String s) {
      return "'" + s.replace("'", "''") + "'";
    }

    @Override
    void id(StringBuilder b, Core.Id id) {
      if (qualify && !id.isFree()) {
        b.append('g').append(id.generatorIndex).append('.');
      }
      b.append(id.name);
    }

    @Override
    int prefixStrength(Op op) {
      // In SQL, as in Python, "NOT" binds less tightly than "="
      return op == Op.NOT ? Op.NOT.left : super.prefixStrength(op);
    }

    @Override
    @Nullable String opString(Op op, PrimitiveType type) {
      switch (op) {
        case AND:
          return " AND ";
        case OR:
          return " OR ";
        case NOT:
          return "NOT ";
        case NEGATE:
          return "-";
        case INVERT:
          return "~";
        case EQ:
          return " = ";
        case NE:
          return " <> ";
        case PLUS:
          return type == PrimitiveType.STRING ? " || " : op.opString;
        case LT:
        case LE:
        case GT:
        case GE:
        case BIT_AND:
        case BIT_OR:
        case LSHIFT:
        case RSHIFT:
        case MINUS:
        case TIMES:
        case DIVIDE:
          return op.opString;
        default:
          return null;
      }
    }

    @Override
    void special(StringBuilder b, Core.Call call, int left, int right) {
      final String a0 = write(call.arg(0), ATOM, ATOM);
      final String a1 = write(call.arg(1), ATOM, ATOM);
      final boolean real = call.type() == PrimitiveType.REAL;
      final String s;
      switch (call.op) {
        case BIT_XOR:
          // "a ^ b" is "(a | b) - (a & b)"
          s = "(" + a0 + " | " + a1 + ") - (" + a0 + " & " + a1 + ")";
          break;
        case MOD:
          s = real
              ? a0 + " - " + a1 + " * FLOOR(" + a0 + " / " + a1 + ")"
              : mod(a0, a1);
          break;
        case FLOOR_DIVIDE:
          if (real) {
            b.append("FLOOR(").append(a0).append(" / ").append(a1)
                .append(')');
            return;
          }
          // Subtract the modulo, so that the division is exact
          s = "(" + a0 + " - (" + mod(a0, a1) + "))" + dialect.intDivide()
              + a1;
          break;
        case POWER:
          final String power = "POWER(" + write(call.arg(0)) + ", "
              + write(call.arg(1)) + ")";
          b.append(real ? power
              : "CAST(" + power + " AS " + typeName(PrimitiveType.INT) + ")");
          return;
        default:
          throw new AssertionError(call.op);
      }
      if (left > 0 || right > 0) {
        b.append('(').append(s).append(')');
      } else {
        b.append(s);
      }
    }

    /** Returns the modulo of two integers, with the sign of the
     * divisor. */
    private static String mod(String a0, String a1) {
      return "((" + a0 + " % " + a1 + ") + " + a1 + ") % " + a1;
    }

    @Override
    void conditional(StringBuilder b, Core.If ifExp, int left, int right) {
      b.append("CASE WHEN ");
      write(b, ifExp.condition, 0, 0);
      b.append(" THEN ");
      write(b, ifExp.ifTrue, 0, 0);
      b.append(" ELSE ");
      write(b, ifExp.ifFalse, 0, 0);
      b.append(" END");
    }

    @Override
    void cast(StringBuilder b, Core.Call call, int left, int right) {
      final Core.Exp a = call.arg(0);
      if (call.type() == PrimitiveType.INT
          && a.type() == PrimitiveType.REAL) {
        b.append(dialect.realToInt(write(a), intWidth));
      } else {
        b.append("CAST(");
        write(b, a, 0, 0);
        b.append(" AS ").append(typeName(call.type())).append(')');
      }
    }

    @Override
    void apply(StringBuilder b, Core.Apply apply) {
      if (apply.args.size() == 1) {
        final Core.Exp a = apply.args.get(0);
        switch (apply.fn) {
          case "int":
          case "float":
          case "str":
            final PrimitiveType t = apply.fn.equals("int") ? PrimitiveType.INT
                : apply.fn.equals("float") ? PrimitiveType.REAL
                : PrimitiveType.STRING;
            cast(b, core.cast(a, t), 0, 0);
            return;
          case "math.floor":
          case "math.ceil":
          case "round":
            b.append("CAST(").append(functionName(apply.fn)).append('(');
            write(b, a, 0, 0);
            b.append(") AS ").append(typeName(PrimitiveType.INT)).append(')');
            return;
          default:
            break;
        }
      }
      super.apply(b, apply);
    }

    @Override
    String functionName(String fn) {
      switch (fn) {
        case "math.log":
          return "LN";
        default:
          return fn.substring(fn.lastIndexOf('.') + 1)
              .toUpperCase(Locale.ROOT);
      }
    }
  }
}

// End SqlRenderer.java
