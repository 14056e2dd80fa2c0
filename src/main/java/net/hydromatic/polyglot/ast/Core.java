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
import java.util.Objects;
import net.hydromatic.polyglot.type.PrimitiveType;
import net.hydromatic.polyglot.type.TypeAnnotation;
import net.hydromatic.polyglot.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Core expressions; the intermediate representation shared by every
 * backend.
 *
 * <p>Every node is immutable. Methods that appear to modify a node, such as
 * {@code copy} and {@code withType}, return a new node, or the same node if
 * nothing changed, and never modify the original.
 */
public class Core {
  private Core() {}

  /** Abstract (scalar) expression.
   *
   * <p>{@link #type} is null until the expression has been through
   * {@link net.hydromatic.polyglot.compile.TypeResolver}. */
  public abstract static class Exp extends AstNode {
    public final @Nullable PrimitiveType type;

    Exp(Pos pos, Op op, @Nullable PrimitiveType type) {
      super(pos, op);
      this.type = type;
    }

    /** Returns the type, which must have been assigned. */
    public PrimitiveType type() {
      return requireNonNull(type, "type");
    }

    /** Returns a copy of this expression with a given type. */
    public abstract Exp withType(PrimitiveType type);

    public abstract Exp accept(Shuttle shuttle);

    public abstract void accept(Visitor visitor);

    /** Returns whether this expression is a literal. */
    public boolean isConstant() {
      return false;
    }
  }

  /** Code of a literal: integer, real, boolean or string. */
  public static class Literal extends Exp {
    /** Value; a {@link BigDecimal} for numbers, a {@link Boolean} or a
     * {@link String}. */
    public final Comparable value;

    Literal(Pos pos, Op op, Comparable value,
        @Nullable PrimitiveType type) {
      super(pos, op, type);
      checkArgument(op.isLiteral() && op != Op.NONE_LITERAL);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && op == ((Literal) o).op
              && value.equals(((Literal) o).value);
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    /** Returns the value as a long; the literal must be an integer. */
    public long longValue() {
      return ((BigDecimal) value).longValueExact();
    }

    /** Returns the value as a boolean; the literal must be a boolean. */
    public boolean booleanValue() {
      return (Boolean) value;
    }

    @Override
    public Literal withType(PrimitiveType type) {
      return type == this.type ? this : new Literal(pos, op, value, type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case BOOL_LITERAL:
          return w.append(booleanValue() ? "True" : "False");
        case STRING_LITERAL:
          return w.append(Ast.Literal.quote((String) value));
        case REAL_LITERAL:
          final String s = value.toString();
          return w.append(s.contains(".") || s.contains("E") ? s : s + ".0");
        default:
          if (((BigDecimal) value).signum() < 0) {
            // "-1 ** 2" would mean "-(1 ** 2)"
            return w.append(left > Op.NEGATE.left || Op.NEGATE.right < right
                ? "(" + value + ")"
                : value.toString());
          }
          return w.append(value.toString());
      }
    }
  }

  /** Reference to a variable.
   *
   * <p>If {@link #generatorIndex} is non-negative, the variable is bound by
   * the generator at that position; if it is -1, the variable is free, and
   * will become a parameter of the generated code. */
  public static class Id extends Exp {
    public final String name;
    public final int generatorIndex;

    Id(Pos pos, String name, int generatorIndex,
        @Nullable PrimitiveType type) {
      super(pos, Op.ID, type);
      checkArgument(generatorIndex >= -1);
      this.name = requireNonNull(name);
      this.generatorIndex = generatorIndex;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, generatorIndex);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Id
              && name.equals(((Id) o).name)
              && generatorIndex == ((Id) o).generatorIndex;
    }

    /** Returns whether this variable is free (not bound by a generator). */
    public boolean isFree() {
      return generatorIndex < 0;
    }

    @Override
    public Id withType(PrimitiveType type) {
      return type == this.type ? this
          : new Id(pos, name, generatorIndex, type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Call to a built-in operator: one argument if the operator is prefix
   * (such as {@link Op#NOT}), two if infix (such as {@link Op#PLUS}). */
  public static class Call extends Exp {
    public final List<Exp> args;

    Call(Pos pos, Op op, ImmutableList<Exp> args,
        @Nullable PrimitiveType type) {
      super(pos, op, type);
      checkArgument(args.size() == 1 || args.size() == 2,
          "bad arity for %s", op);
      this.args = requireNonNull(args);
    }

    public Exp arg(int i) {
      return args.get(i);
    }

    /** Returns whether this is a call to a prefix operator. */
    public boolean isPrefix() {
      return args.size() == 1;
    }

    @Override
    public Call withType(PrimitiveType type) {
      return type == this.type ? this : new Call(pos, op,
          (ImmutableList<Exp>) args, type);
    }

    /** Creates a copy of this {@code Call} with given arguments, or
     * {@code this} if the arguments are the same. */
    public Call copy(List<Exp> args) {
      return Static.sameElements(args, this.args) ? this
          : new Call(pos, op, ImmutableList.copyOf(args), type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (op == Op.CAST) {
        return w.append(type == PrimitiveType.REAL ? "float(" : "int(")
            .append(arg(0), 0, 0)
            .append(")");
      }
      if (isPrefix()) {
        return w.prefix(left, op, arg(0), right);
      }
      return w.infix(left, arg(0), op, arg(1), right);
    }
  }

  /** Conditional expression, "ifTrue if condition else ifFalse". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse,
        @Nullable PrimitiveType type) {
      super(pos, Op.IF_EXP, type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public If withType(PrimitiveType type) {
      return type == this.type ? this
          : new If(pos, condition, ifTrue, ifFalse, type);
    }

    /** Creates a copy of this {@code If} with given contents,
     * or {@code this} if the contents are the same. */
    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return condition == this.condition
          && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : new If(pos, condition, ifTrue, ifFalse, type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
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

  /** Call to a function that is not interpreted, such as "abs(x)"; the
   * function name and arguments pass through to the generated code. */
  public static class Apply extends Exp {
    public final String fn;
    public final List<Exp> args;

    Apply(Pos pos, String fn, ImmutableList<Exp> args,
        @Nullable PrimitiveType type) {
      super(pos, Op.APPLY, type);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    public Apply withType(PrimitiveType type) {
      return type == this.type ? this
          : new Apply(pos, fn, (ImmutableList<Exp>) args, type);
    }

    /** Creates a copy of this {@code Apply} with given arguments, or
     * {@code this} if the arguments are the same. */
    public Apply copy(List<Exp> args) {
      return Static.sameElements(args, this.args) ? this
          : new Apply(pos, fn, ImmutableList.copyOf(args), type);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(fn).append("(").commaList(args).append(")");
    }
  }

  /** Source of values for a generator; either a {@link Range} or an
   * {@link OpaqueIterable}. */
  public abstract static class Iter extends AstNode {
    Iter(Pos pos, Op op) {
      super(pos, op);
    }

    public abstract Iter accept(Shuttle shuttle);

    public abstract void accept(Visitor visitor);
  }

  /** Integer range, "range(start, stop, step)". Excludes {@code stop}. */
  public static class Range extends Iter {
    public final Exp start;
    public final Exp stop;
    public final Exp step;

    Range(Pos pos, Exp start, Exp stop, Exp step) {
      super(pos, Op.RANGE);
      this.start = requireNonNull(start);
      this.stop = requireNonNull(stop);
      this.step = requireNonNull(step);
    }

    /** Returns whether start, stop and step are all literals. */
    public boolean isConstant() {
      return start.isConstant() && stop.isConstant() && step.isConstant();
    }

    /** Returns the step if it is an integer literal, otherwise null. */
    public @Nullable Long constantStep() {
      return step.isConstant() && step.op == Op.INT_LITERAL
          ? ((Literal) step).longValue()
          : null;
    }

    /** Creates a copy of this {@code Range} with given contents,
     * or {@code this} if the contents are the same. */
    public Range copy(Exp start, Exp stop, Exp step) {
      return start == this.start && stop == this.stop && step == this.step
          ? this
          : new Range(pos, start, stop, step);
    }

    @Override
    public Iter accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("range(").append(start, 0, 0).append(", ").append(stop, 0, 0);
      if (!(step.isConstant() && step.equals(CoreBuilder.core.intLiteral(1)))) {
        w.append(", ").append(step, 0, 0);
      }
      return w.append(")");
    }
  }

  /** Reference to a collection that is not known until run time, such as a
   * parameter "xs" in "sum(x for x in xs)". Its elements are integers. */
  public static class OpaqueIterable extends Iter {
    public final String name;

    OpaqueIterable(Pos pos, String name) {
      super(pos, Op.OPAQUE_ITERABLE);
      this.name = requireNonNull(name);
    }

    @Override
    public Iter accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Generator, "for variable in iterable".
   *
   * <p>{@link #conditions} are predicates that reference only this
   * generator's variable, and which the optimizer has moved here from
   * filters; they are empty in an IR that has not been optimized. */
  public static class Generator extends AstNode {
    public final String variable;
    public final Iter iterable;
    public final List<Exp> conditions;

    Generator(Pos pos, String variable, Iter iterable,
        ImmutableList<Exp> conditions) {
      super(pos, Op.GENERATOR);
      this.variable = requireNonNull(variable);
      this.iterable = requireNonNull(iterable);
      this.conditions = requireNonNull(conditions);
    }

    /** Creates a copy of this {@code Generator} with given contents,
     * or {@code this} if the contents are the same. */
    public Generator copy(Iter iterable, List<Exp> conditions) {
      return iterable == this.iterable
          && Static.sameElements(conditions, this.conditions)
          ? this
          : new Generator(pos, variable, iterable,
              ImmutableList.copyOf(conditions));
    }

    public Generator accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final int prec = Op.IF_EXP.left + 1;
      w.append(" for ").id(variable).append(" in ")
          .append(iterable, prec, prec);
      conditions.forEach(c -> w.append(" if ").append(c, prec, prec));
      return w;
    }
  }

  /** Filter, "if condition", evaluated after the generator at position
   * {@link #generatorIndex} has bound its variable. */
  public static class Filter extends AstNode {
    public final int generatorIndex;
    public final Exp condition;

    Filter(Pos pos, int generatorIndex, Exp condition) {
      super(pos, Op.FILTER);
      checkArgument(generatorIndex >= 0);
      this.generatorIndex = generatorIndex;
      this.condition = requireNonNull(condition);
    }

    /** Creates a copy of this {@code Filter} with given condition,
     * or {@code this} if the condition is the same. */
    public Filter copy(Exp condition) {
      return condition == this.condition ? this
          : new Filter(pos, generatorIndex, condition);
    }

    public Filter accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final int prec = Op.IF_EXP.left + 1;
      return w.append(" if ").append(condition, prec, prec);
    }
  }

  /** Top-level node of the IR; a {@link Comprehension} or a
   * {@link Reduction}. */
  public abstract static class Program extends AstNode {
    /** Types; null until the program has been through
     * {@link net.hydromatic.polyglot.compile.TypeResolver}. */
    public final @Nullable TypeAnnotation annotation;

    Program(Pos pos, Op op, @Nullable TypeAnnotation annotation) {
      super(pos, op);
      this.annotation = annotation;
    }

    /** Returns the annotation, which must have been assigned. */
    public TypeAnnotation annotation() {
      return requireNonNull(annotation, "annotation");
    }

    /** Returns the comprehension whose elements this program produces or
     * reduces. */
    public abstract Comprehension comprehension();

    public abstract Program accept(Shuttle shuttle);

    public abstract void accept(Visitor visitor);
  }

  /** List, set or dict comprehension, or generator expression (the source
   * of a {@link Reduction}).
   *
   * <p>If {@link #op} is {@link Op#DICT_COMP}, {@link #key} is not null and
   * {@link #element} is the value.
   *
   * <p>Generators execute in order, outermost first. Filters are sorted by
   * generator index, and filters on the same generator execute in order.
   *
   * <p>If {@link #empty}, the optimizer has proved that the comprehension
   * produces no elements. */
  public static class Comprehension extends Program {
    public final @Nullable Exp key;
    public final Exp element;
    public final List<Generator> generators;
    public final List<Filter> filters;
    public final boolean empty;

    Comprehension(Pos pos, Op op, @Nullable Exp key, Exp element,
        ImmutableList<Generator> generators, ImmutableList<Filter> filters,
        boolean empty, @Nullable TypeAnnotation annotation) {
      super(pos, op, annotation);
      checkArgument(op == Op.LIST_COMP || op == Op.SET_COMP
          || op == Op.DICT_COMP || op == Op.GENERATOR_EXP, "bad op %s", op);
      checkArgument((key != null) == (op == Op.DICT_COMP));
      checkArgument(!generators.isEmpty());
      int previous = 0;
      for (Filter filter : filters) {
        checkArgument(filter.generatorIndex < generators.size(),
            "filter refers to generator %s but there are only %s",
            filter.generatorIndex, generators.size());
        checkArgument(filter.generatorIndex >= previous,
            "filters out of order");
        previous = filter.generatorIndex;
      }
      this.key = key;
      this.element = requireNonNull(element);
      this.generators = requireNonNull(generators);
      this.filters = requireNonNull(filters);
      this.empty = empty;
    }

    @Override
    public Comprehension comprehension() {
      return this;
    }

    /** Returns the filters evaluated after the generator at a given
     * position. */
    public List<Filter> filtersAt(int generatorIndex) {
      final ImmutableList.Builder<Filter> b = ImmutableList.builder();
      for (Filter filter : filters) {
        if (filter.generatorIndex == generatorIndex) {
          b.add(filter);
        }
      }
      return b.build();
    }

    /** Returns the conditions evaluated after the generator at a given
     * position: first those pushed into the generator, then its
     * filters. */
    public List<Exp> conditionsAt(int generatorIndex) {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      b.addAll(generators.get(generatorIndex).conditions);
      filtersAt(generatorIndex).forEach(f -> b.add(f.condition));
      return b.build();
    }

    /** Creates a copy of this {@code Comprehension} with given contents,
     * or {@code this} if the contents are the same. */
    public Comprehension copy(@Nullable Exp key, Exp element,
        List<Generator> generators, List<Filter> filters, boolean empty,
        @Nullable TypeAnnotation annotation) {
      return key == this.key
          && element == this.element
          && Static.sameElements(generators, this.generators)
          && Static.sameElements(filters, this.filters)
          && empty == this.empty
          && Objects.equals(annotation, this.annotation)
          ? this
          : new Comprehension(pos, op, key, element,
              ImmutableList.copyOf(generators), ImmutableList.copyOf(filters),
              empty, annotation);
    }

    @Override
    public Comprehension accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
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
      for (int i = 0; i < generators.size(); i++) {
        generators.get(i).unparse(w, 0, 0);
        for (Filter filter : filtersAt(i)) {
          filter.unparse(w, 0, 0);
        }
      }
      return w;
    }
  }

  /** Reduction of the elements of a generator expression, such as
   * "sum(x for x in range(10))".
   *
   * <p>{@link #initial}, if present, is the "start" argument of sum and
   * product, or the "default" argument of max and min. */
  public static class Reduction extends Program {
    public final ReduceOp reduceOp;
    public final Comprehension source;
    public final @Nullable Exp initial;

    Reduction(Pos pos, ReduceOp reduceOp, Comprehension source,
        @Nullable Exp initial, @Nullable TypeAnnotation annotation) {
      super(pos, Op.REDUCTION, annotation);
      checkArgument(source.op == Op.GENERATOR_EXP);
      checkArgument(initial == null || reduceOp.allowsInitial());
      this.reduceOp = requireNonNull(reduceOp);
      this.source = requireNonNull(source);
      this.initial = initial;
    }

    @Override
    public Comprehension comprehension() {
      return source;
    }

    /** Returns the type of the result, which must have been assigned. */
    public PrimitiveType resultType() {
      return requireNonNull(annotation().resultType, "resultType");
    }

    /** Creates a copy of this {@code Reduction} with given contents,
     * or {@code this} if the contents are the same. */
    public Reduction copy(Comprehension source, @Nullable Exp initial,
        @Nullable TypeAnnotation annotation) {
      return source == this.source
          && initial == this.initial
          && Objects.equals(annotation, this.annotation)
          ? this
          : new Reduction(pos, reduceOp, source, initial, annotation);
    }

    @Override
    public Reduction accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.id(reduceOp.functionName).append("(");
      if (initial == null) {
        return source.unparseBare(w).append(")");
      }
      source.unparse(w, 0, 0);
      w.append(reduceOp.isSelection() ? ", default=" : ", ");
      return w.append(initial, 0, 0).append(")");
    }
  }
}

// End Core.java
