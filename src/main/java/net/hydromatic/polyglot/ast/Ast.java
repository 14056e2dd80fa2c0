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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>The syntax tree mirrors the source text closely. It contains every
 * construct that the parser recognizes, including many (lambdas, tuples,
 * subscripts) that {@link net.hydromatic.polyglot.compile.Resolver} will
 * reject.
 */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Named identifier, such as "i" or "range". */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Literal: integer, real, boolean, string or None. */
  public static class Literal extends Exp {
    /** Value; a {@link BigDecimal} for numbers, a {@link Boolean},
     * a {@link String}, or null for None. */
    public final @Nullable Comparable value;

    Literal(Pos pos, Op op, @Nullable Comparable value) {
      super(pos, op);
      checkArgument(op.isLiteral());
      this.value = value;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case NONE_LITERAL:
          return w.append("None");
        case BOOL_LITERAL:
          return w.append((Boolean) requireNonNull(value) ? "True" : "False");
        case STRING_LITERAL:
          return w.append(quote((String) requireNonNull(value)));
        case REAL_LITERAL:
          final String s = ((BigDecimal) requireNonNull(value)).toString();
          return w.append(s.contains(".") || s.contains("E") ? s : s + ".0");
        default:
          return w.append(String.valueOf(value));
      }
    }

    /** Converts a string to a quoted literal. */
    static String quote(String s) {
      return "'"
          + s.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n")
          + "'";
    }
  }

  /** Attribute reference, "exp.name", such as "math.prod". */
  public static class Attribute extends Exp {
    public final Exp exp;
    public final String name;

    Attribute(Pos pos, Exp exp, String name) {
      super(pos, Op.ATTRIBUTE);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.left).append(".").id(name);
    }

    /** Returns the dotted name, e.g. "math.prod", or null if the target is
     * not a chain of identifiers. */
    public @Nullable String dottedName() {
      if (exp instanceof Id) {
        return ((Id) exp).name + "." + name;
      }
      if (exp instanceof Attribute) {
        final String s = ((Attribute) exp).dottedName();
        return s == null ? null : s + "." + name;
      }
      return null;
    }
  }

  /** Function call, "f(arg, ..., name=value, ...)". */
  public static class Call extends Exp {
    public final Exp fn;
    public final List<Exp> args;
    public final List<Keyword> keywords;

    Call(Pos pos, Exp fn, ImmutableList<Exp> args,
        ImmutableList<Keyword> keywords) {
      super(pos, Op.CALL);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      this.keywords = requireNonNull(keywords);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(fn, left, op.left).append("(");
      if (args.size() == 1
          && args.get(0).op == Op.GENERATOR_EXP
          && keywords.isEmpty()) {
        // "sum(x for x in y)" needs no extra parentheses
        return ((Comp) args.get(0)).unparseBare(w).append(")");
      }
      w.commaList(args);
      if (!args.isEmpty() && !keywords.isEmpty()) {
        w.append(", ");
      }
      return w.commaList(keywords).append(")");
    }

    /** Returns the name of the function, if it is an identifier or a dotted
     * name, otherwise null. */
    public @Nullable String fnName() {
      if (fn instanceof Id) {
        return ((Id) fn).name;
      }
      if (fn instanceof Attribute) {
        return ((Attribute) fn).dottedName();
      }
      return null;
    }

    /** Returns the keyword argument with a given name, or null. */
    public @Nullable Keyword keyword(String name) {
      for (Keyword keyword : keywords) {
        if (keyword.name.equals(name)) {
          return keyword;
        }
      }
      return null;
    }
  }

  /** Keyword argument to a call, "name=value". */
  public static class Keyword extends AstNode {
    public final String name;
    public final Exp value;

    Keyword(Pos pos, String name, Exp value) {
      super(pos, Op.KEYWORD);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).append("=").append(value, 0, 0);
    }
  }

  /** Subscript, "exp[index]"; the index is unparsed text if it is a
   * slice. */
  public static class Subscript extends Exp {
    public final Exp exp;
    public final List<Exp> indexes;

    Subscript(Pos pos, Exp exp, ImmutableList<Exp> indexes) {
      super(pos, Op.SUBSCRIPT);
      this.exp = requireNonNull(exp);
      this.indexes = requireNonNull(indexes);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.left)
          .append("[")
          .commaList(indexes)
          .append("]");
    }
  }

  /** Starred expression, "*exp", as an argument to a call. */
  public static class Starred extends Exp {
    public final Exp exp;

    Starred(Pos pos, Exp exp) {
      super(pos, Op.STARRED);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("*").append(exp, Op.BIT_OR.right, 0);
    }
  }

  /** Assignment expression, "name := exp". */
  public static class NamedExpr extends Exp {
    public final Id target;
    public final Exp value;

    NamedExpr(Pos pos, Id target, Exp value) {
      super(pos, Op.NAMED_EXPR);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(")
          .append(target, 0, 0)
          .append(op.opString)
          .append(value, 0, 0)
          .append(")");
    }
  }

  /** Lambda expression, "lambda x, y: body". */
  public static class Lambda extends Exp {
    public final List<String> params;
    public final Exp body;

    Lambda(Pos pos, ImmutableList<String> params, Exp body) {
      super(pos, Op.LAMBDA);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("lambda");
      for (int i = 0; i < params.size(); i++) {
        w.append(i == 0 ? " " : ", ").id(params.get(i));
      }
      return w.append(": ").append(body, 0, right);
    }
  }

  /** Conditional expression, "ifTrue if condition else ifFalse". */
  public static class IfExp extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    IfExp(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF_EXP);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(ifTrue, left, op.left + 1)
          .append(" if ")
          .append(condition, op.left + 1, op.left + 1)
          .append(" else ")
          .append(ifFalse, op.right, right);
    }
  }

  /** Call to a binary operator, such as "a + b" or "a and b". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a unary operator, such as "-a" or "not a". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /** Comparison, possibly chained, such as "a &lt; b &lt;= c".
   *
   * <p>Each operator in {@link #ops} is a comparison operator, and there is
   * one more operand than there are operators. */
  public static class Compare extends Exp {
    public final List<Op> ops;
    public final List<Exp> operands;

    Compare(Pos pos, ImmutableList<Op> ops, ImmutableList<Exp> operands) {
      super(pos, Op.COMPARE);
      checkArgument(!ops.isEmpty());
      checkArgument(operands.size() == ops.size() + 1);
      this.ops = ops;
      this.operands = operands;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final int prec = Op.EQ.left;
      if (left > prec || prec < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(operands.get(0), left, prec + 1);
      for (int i = 0; i < ops.size(); i++) {
        w.append(ops.get(i).opString);
        final boolean last = i == ops.size() - 1;
        w.append(operands.get(i + 1), prec + 1, last ? right : prec + 1);
      }
      return w;
    }
  }

  /** Tuple, list or set display, such as "(1, 2)", "[a, b]", "{x}". */
  public static class Display extends Exp {
    public final List<Exp> args;

    Display(Pos pos, Op op, ImmutableList<Exp> args) {
      super(pos, op);
      checkArgument(op == Op.TUPLE || op == Op.LIST || op == Op.SET);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case LIST:
          return w.append("[").commaList(args).append("]");
        case SET:
          return w.append("{").commaList(args).append("}");
        default:
          w.append("(").commaList(args);
          return w.append(args.size() == 1 ? ",)" : ")");
      }
    }
  }

  /** Dictionary display, such as "{k: v, ...}". */
  public static class DictDisplay extends Exp {
    public final List<Exp> keys;
    public final List<Exp> values;

    DictDisplay(Pos pos, ImmutableList<Exp> keys, ImmutableList<Exp> values) {
      super(pos, Op.DICT);
      checkArgument(keys.size() == values.size());
      this.keys = keys;
      this.values = values;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      for (int i = 0; i < keys.size(); i++) {
        w.append(i == 0 ? "" : ", ")
            .append(keys.get(i), 0, 0)
            .append(": ")
            .append(values.get(i), 0, 0);
      }
      return w.append("}");
    }
  }

  /** Comprehension: list, set or dict comprehension, or generator
   * expression.
   *
   * <p>If {@link #op} is {@link Op#DICT_COMP}, {@link #key} is not null and
   * {@link #element} is the value. */
  public static class Comp extends Exp {
    public final @Nullable Exp key;
    public final Exp element;
    public final List<CompFor> generators;

    Comp(Pos pos, Op op, @Nullable Exp key, Exp element,
        ImmutableList<CompFor> generators) {
      super(pos, op);
      checkArgument((key != null) == (op == Op.DICT_COMP));
      checkArgument(!generators.isEmpty());
      this.key = key;
      this.element = requireNonNull(element);
      this.generators = requireNonNull(generators);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case LIST_COMP:
          return unparseBare(w.append("[")).append("]");
        case GENERATOR_EXP:
          return unparseBare(w.append("(")).append(")");
        default:
          return unparseBare(w.append("{")).append("}");
      }
    }

    /** Writes the contents, without brackets. */
    AstWriter unparseBare(AstWriter w) {
      if (key != null) {
        w.append(key, 0, 0).append(": ");
      }
      w.append(element, 0, 0);
      generators.forEach(g -> g.unparse(w, 0, 0));
      return w;
    }
  }

  /** One "for target in iter if c1 if c2" clause of a comprehension. */
  public static class CompFor extends AstNode {
    public final Exp target;
    public final Exp iter;
    public final List<Exp> ifs;
    public final boolean async;

    CompFor(Pos pos, Exp target, Exp iter, ImmutableList<Exp> ifs,
        boolean async) {
      super(pos, Op.COMPREHENSION_FOR);
      this.target = requireNonNull(target);
      this.iter = requireNonNull(iter);
      this.ifs = requireNonNull(ifs);
      this.async = async;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      // Operands are at "or" level; a conditional expression needs
      // parentheses.
      final int prec = Op.IF_EXP.left + 1;
      w.append(async ? " async for " : " for ")
          .append(target, prec, prec)
          .append(" in ")
          .append(iter, prec, prec);
      for (Exp e : ifs) {
        w.append(" if ").append(e, prec, prec);
      }
      return w;
    }
  }
}

// End Ast.java
