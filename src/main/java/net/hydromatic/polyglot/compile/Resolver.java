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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.polyglot.ast.Ast;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.ast.Pos;
import net.hydromatic.polyglot.ast.ReduceOp;
import net.hydromatic.polyglot.parse.PolyglotParseException;
import net.hydromatic.polyglot.parse.UnsupportedConstructException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a parse tree to the {@link Core} intermediate representation.
 *
 * <p>The top of the tree must be a list, set or dict comprehension, or a
 * call to a reduction ({@code sum}, {@code math.prod}, {@code any},
 * {@code all}, {@code max}, {@code min}) whose argument is a generator
 * expression or a list comprehension. Anything else is reported as an
 * {@link UnsupportedConstructException} naming the construct.
 *
 * <p>Resolves each identifier to the generator that binds it. A generator's
 * variable is visible in its own filters, in later generators, and in the
 * element; a later generator that binds the same name hides an earlier one.
 */
public class Resolver {
  /** Variables of the generators resolved so far, in order. */
  private final List<String> variables = new ArrayList<>();

  private Resolver() {}

  /** Converts a parse tree to a program. */
  public static Core.Program resolve(Ast.Exp e) {
    return new Resolver().program(e);
  }

  private Core.Program program(Ast.Exp e) {
    switch (e.op) {
      case LIST_COMP:
      case SET_COMP:
      case DICT_COMP:
        return comprehension((Ast.Comp) e, e.op);
      case GENERATOR_EXP:
        throw new UnsupportedConstructException(e.op.kind,
            "unsupported construct: GeneratorExp; a generator expression "
                + "must be the argument of a reduction",
            e.pos);
      case CALL:
        return reduction((Ast.Call) e);
      default:
        throw new UnsupportedConstructException(e.op.kind, e.pos);
    }
  }

  private Core.Reduction reduction(Ast.Call call) {
    final String fnName = call.fnName();
    final ReduceOp reduceOp = fnName == null ? null : ReduceOp.of(fnName);
    if (reduceOp == null) {
      throw new UnsupportedConstructException("Call",
          "unsupported construct: Call; "
              + (fnName == null ? "call" : "'" + fnName + "'")
              + " is not a reduction (expected sum, math.prod, any, all, "
              + "max or min)",
          call.pos);
    }
    if (call.args.isEmpty()) {
      throw new PolyglotParseException(
          fnName + "() expected at least 1 argument", call.pos);
    }
    for (Ast.Exp arg : call.args) {
      if (arg.op == Op.STARRED) {
        throw new UnsupportedConstructException(arg.op.kind, arg.pos);
      }
    }

    // The initial value: "start" for sum and product, "default" for max
    // and min.
    Ast.@Nullable Exp initial = null;
    for (Ast.Keyword keyword : call.keywords) {
      final boolean allowed;
      switch (reduceOp) {
        case SUM:
        case PRODUCT:
          allowed = keyword.name.equals("start");
          break;
        case MAX:
        case MIN:
          if (keyword.name.equals("key")) {
            throw new UnsupportedConstructException(keyword.op.kind,
                "unsupported construct: keyword; " + fnName
                    + "() with 'key' is not supported",
                keyword.pos);
          }
          allowed = keyword.name.equals("default");
          break;
        default:
          allowed = false;
      }
      if (!allowed) {
        throw new PolyglotParseException(fnName
            + "() got an unexpected keyword argument '" + keyword.name + "'",
            keyword.pos);
      }
      initial = keyword.value;
    }
    if (call.args.size() > 1) {
      if (reduceOp != ReduceOp.SUM || call.args.size() > 2 || initial != null) {
        // max(a, b) compares its arguments; it is not a reduction of a
        // generator
        throw new UnsupportedConstructException("Call",
            "unsupported construct: Call; " + fnName
                + "() with more than one positional argument",
            call.pos);
      }
      initial = call.args.get(1);
    }

    final Ast.Exp arg = call.args.get(0);
    final Ast.Comp comp;
    switch (arg.op) {
      case GENERATOR_EXP:
      case LIST_COMP:
        // "sum([x for x in xs])" gives the same result as
        // "sum(x for x in xs)"
        comp = (Ast.Comp) arg;
        break;
      default:
        throw new UnsupportedConstructException(arg.op.kind,
            "unsupported construct: " + arg.op.kind + "; the argument of "
                + fnName + "() must be a generator expression",
            arg.pos);
    }
    final Core.Comprehension source =
        comprehension(comp, Op.GENERATOR_EXP);
    // The initial value is evaluated outside the comprehension.
    variables.clear();
    return core.reduction(call.pos, reduceOp, source,
        initial == null ? null : exp(initial));
  }

  private Core.Comprehension comprehension(Ast.Comp comp, Op op) {
    final List<Core.Generator> generators = new ArrayList<>();
    final List<Core.Filter> filters = new ArrayList<>();
    for (Ast.CompFor compFor : comp.generators) {
      if (compFor.async) {
        throw new UnsupportedConstructException(compFor.op.kind,
            "unsupported construct: asynchronous comprehension",
            compFor.pos);
      }
      final Core.Iter iterable = iterable(compFor.iter);
      if (compFor.target.op != Op.ID) {
        throw new UnsupportedConstructException(compFor.target.op.kind,
            "unsupported construct: " + compFor.target.op.kind
                + "; the target of 'for' must be a single name",
            compFor.target.pos);
      }
      final String name = ((Ast.Id) compFor.target).name;
      generators.add(core.generator(compFor.pos, name, iterable));
      variables.add(name);
      for (Ast.Exp condition : compFor.ifs) {
        filters.add(
            core.filter(condition.pos, generators.size() - 1,
                exp(condition)));
      }
    }
    final Core.Exp key = comp.key == null ? null : exp(comp.key);
    final Core.Exp element = exp(comp.element);
    return core.comprehension(comp.pos, op, key, element, generators,
        filters);
  }

  /** Converts the iterable of a generator. */
  private Core.Iter iterable(Ast.Exp e) {
    if (e.op == Op.CALL) {
      final Ast.Call call = (Ast.Call) e;
      if ("range".equals(call.fnName()) && variables.indexOf("range") < 0) {
        return range(call);
      }
    }
    if (e.op == Op.ID) {
      final String name = ((Ast.Id) e).name;
      if (variables.contains(name)) {
        throw new UnsupportedConstructException(e.op.kind,
            "unsupported construct: Name; cannot iterate over '" + name
                + "', which is bound by a generator",
            e.pos);
      }
      return core.opaqueIterable(e.pos, name);
    }
    throw new UnsupportedConstructException(e.op.kind,
        "unsupported construct: " + e.op.kind
            + "; the iterable of 'for' must be range(...) or a name",
        e.pos);
  }

  private Core.Range range(Ast.Call call) {
    if (!call.keywords.isEmpty()) {
      throw new PolyglotParseException(
          "range() takes no keyword arguments", call.keywords.get(0).pos);
    }
    final List<Core.Exp> args = new ArrayList<>();
    for (Ast.Exp arg : call.args) {
      if (arg.op == Op.STARRED) {
        throw new UnsupportedConstructException(arg.op.kind, arg.pos);
      }
      args.add(exp(arg));
    }
    switch (args.size()) {
      case 1:
        return core.range(call.pos, core.intLiteral(0), args.get(0),
            core.intLiteral(1));
      case 2:
        return core.range(call.pos, args.get(0), args.get(1),
            core.intLiteral(1));
      case 3:
        final Comparable step = ConstantFolder.evaluate(args.get(2));
        if (step instanceof Number && ((Number) step).longValue() == 0) {
          throw new PolyglotParseException("range() arg 3 must not be zero",
              call.args.get(2).pos);
        }
        return core.range(call.pos, args.get(0), args.get(1), args.get(2));
      default:
        throw new PolyglotParseException(
            "range expected 1 to 3 arguments, got " + args.size(),
            call.pos);
    }
  }

  /** Converts an expression. */
  private Core.Exp exp(Ast.Exp e) {
    switch (e.op) {
      case ID:
        return id((Ast.Id) e);

      case INT_LITERAL:
        return core.intLiteral(e.pos, (BigDecimal) ((Ast.Literal) e).value);
      case REAL_LITERAL:
        return core.realLiteral(e.pos, (BigDecimal) ((Ast.Literal) e).value);
      case BOOL_LITERAL:
        return core.boolLiteral(e.pos, (Boolean) ((Ast.Literal) e).value);
      case STRING_LITERAL:
        return core.stringLiteral(e.pos, (String) ((Ast.Literal) e).value);
      case NONE_LITERAL:
        throw new UnsupportedConstructException(e.op.kind,
            "unsupported construct: Constant; None is not supported", e.pos);

      case OR:
      case AND:
      case BIT_OR:
      case BIT_XOR:
      case BIT_AND:
      case LSHIFT:
      case RSHIFT:
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case FLOOR_DIVIDE:
      case MOD:
      case POWER:
        final Ast.InfixCall infix = (Ast.InfixCall) e;
        return core.call(e.pos, e.op, exp(infix.a0), exp(infix.a1));

      case MAT_MULT:
        throw new UnsupportedConstructException(e.op.kind,
            "unsupported construct: BinOp; operator '@' is not supported",
            e.pos);

      case NEGATE:
        final Core.Exp a = exp(((Ast.PrefixCall) e).a);
        // "-1" is a literal, so that "range(10, 0, -1)" has a constant step
        if (a.op == Op.INT_LITERAL) {
          return core.intLiteral(e.pos,
              ((BigDecimal) ((Core.Literal) a).value).negate());
        }
        if (a.op == Op.REAL_LITERAL) {
          return core.realLiteral(e.pos,
              ((BigDecimal) ((Core.Literal) a).value).negate());
        }
        return core.call(e.pos, e.op, a);

      case NOT:
      case INVERT:
        return core.call(e.pos, e.op, exp(((Ast.PrefixCall) e).a));

      case POSITIVE:
        // "+x" is "x"
        return exp(((Ast.PrefixCall) e).a);

      case COMPARE:
        return compare((Ast.Compare) e);

      case IF_EXP:
        final Ast.IfExp ifExp = (Ast.IfExp) e;
        return core.ifExp(e.pos, exp(ifExp.condition), exp(ifExp.ifTrue),
            exp(ifExp.ifFalse));

      case CALL:
        return apply((Ast.Call) e);

      case ATTRIBUTE:
      case SUBSCRIPT:
      case STARRED:
      case NAMED_EXPR:
      case LAMBDA:
      case TUPLE:
      case LIST:
      case SET:
      case DICT:
      case LIST_COMP:
      case SET_COMP:
      case DICT_COMP:
      case GENERATOR_EXP:
        throw new UnsupportedConstructException(e.op.kind, e.pos);

      case KEYWORD:
      case COMPREHENSION_FOR:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case IN:
      case NOT_IN:
      case IS:
      case IS_NOT:
      case APPLY:
      case CAST:
      case RANGE:
      case OPAQUE_ITERABLE:
      case GENERATOR:
      case FILTER:
      case REDUCTION:
      default:
        // These operators never occur as expressions in a parse tree.
        throw new AssertionError("unexpected " + e.op);
    }
  }

  private Core.Id id(Ast.Id id) {
    return core.id(id.pos, id.name, variables.lastIndexOf(id.name));
  }

  /** Converts a comparison; "a &lt; b &lt; c" becomes
   * "a &lt; b and b &lt; c". */
  private Core.Exp compare(Ast.Compare compare) {
    final List<Core.Exp> conjuncts = new ArrayList<>();
    Core.Exp left = exp(compare.operands.get(0));
    for (int i = 0; i < compare.ops.size(); i++) {
      final Op op = compare.ops.get(i);
      final Ast.Exp rightAst = compare.operands.get(i + 1);
      switch (op) {
        case IN:
        case NOT_IN:
        case IS:
        case IS_NOT:
          throw new UnsupportedConstructException(compare.op.kind,
              "unsupported construct: Compare; operator '"
                  + op.opString.trim() + "' is not supported",
              compare.pos);
        default:
          break;
      }
      final Core.Exp right = exp(rightAst);
      final Pos pos = compare.operands.get(i).pos.plus(rightAst.pos);
      conjuncts.add(core.call(pos, op, left, right));
      left = right;
    }
    return core.andAlso(conjuncts);
  }

  /** Converts a call to a function other than a reduction. The call passes
   * through to the generated code without interpretation. */
  private Core.Exp apply(Ast.Call call) {
    final String fnName = call.fnName();
    if (fnName == null) {
      throw new UnsupportedConstructException(call.op.kind,
          "unsupported construct: Call; the function must be a name",
          call.pos);
    }
    if (!call.keywords.isEmpty()) {
      throw new UnsupportedConstructException(call.keywords.get(0).op.kind,
          "unsupported construct: keyword; keyword arguments to '" + fnName
              + "' are not supported",
          call.keywords.get(0).pos);
    }
    final List<Core.Exp> args = new ArrayList<>();
    for (Ast.Exp arg : call.args) {
      args.add(exp(arg));
    }
    return core.apply(call.pos, fnName, args);
  }
}

// End Resolver.java
