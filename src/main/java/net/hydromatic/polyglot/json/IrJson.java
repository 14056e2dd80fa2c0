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
package net.hydromatic.polyglot.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import net.hydromatic.polyglot.ast.Core;
import net.hydromatic.polyglot.ast.Op;
import net.hydromatic.polyglot.type.PrimitiveType;
import net.hydromatic.polyglot.type.TypeAnnotation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a {@link Core.Program} to JSON.
 *
 * <p>The JSON is a snapshot format for tests: fields are written in a fixed
 * order, and positions are omitted, so that the text depends only on the
 * structure of the program. The {@code irVersion} field changes whenever
 * the structure of the JSON changes.
 */
public class IrJson {
  /** Version of the JSON format. */
  public static final int IR_VERSION = 1;

  private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private IrJson() {}

  /** Converts a program to a JSON tree. */
  public static ObjectNode toJson(Core.Program program) {
    final ObjectNode node = FACTORY.objectNode();
    node.put("irVersion", IR_VERSION);
    program(node, program);
    return node;
  }

  /** Converts a program to JSON text, indented by two spaces, with
   * {@code \n} line endings on every platform. */
  public static String toString(Core.Program program) {
    final DefaultPrettyPrinter printer =
        new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n"));
    try {
      return MAPPER.writer(printer).writeValueAsString(toJson(program))
          + "\n";
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  private static void program(ObjectNode node, Core.Program program) {
    if (program instanceof Core.Reduction) {
      final Core.Reduction reduction = (Core.Reduction) program;
      node.put("kind", "Reduction");
      node.put("op", reduction.reduceOp.kind);
      node.set("initial", exp(reduction.initial));
      annotation(node, reduction.annotation);
      program(node.putObject("source"), reduction.source);
      return;
    }
    final Core.Comprehension c = (Core.Comprehension) program;
    node.put("kind", c.op.kind);
    annotation(node, c.annotation);
    final ArrayNode generators = node.putArray("generators");
    for (Core.Generator g : c.generators) {
      final ObjectNode generator = generators.addObject();
      generator.put("variable", g.variable);
      generator.set("iterable", iterable(g.iterable));
      final ArrayNode conditions = generator.putArray("conditions");
      g.conditions.forEach(e -> conditions.add(exp(e)));
    }
    final ArrayNode filters = node.putArray("filters");
    for (Core.Filter f : c.filters) {
      final ObjectNode filter = filters.addObject();
      filter.put("generator", f.generatorIndex);
      filter.set("condition", exp(f.condition));
    }
    if (c.key != null) {
      node.set("key", exp(c.key));
    }
    node.set("element", exp(c.element));
    node.put("empty", c.empty);
  }

  private static void annotation(ObjectNode node,
      @Nullable TypeAnnotation annotation) {
    if (annotation == null) {
      node.putNull("types");
      return;
    }
    final ObjectNode types = node.putObject("types");
    types.put("element", annotation.elementType.moniker);
    putType(types, "key", annotation.keyType);
    putType(types, "value", annotation.valueType);
    putType(types, "result", annotation.resultType);
    types.put("intWidth", annotation.intWidth);
    types.put("fallback", annotation.fallback);
  }

  private static void putType(ObjectNode node, String name,
      @Nullable PrimitiveType type) {
    if (type != null) {
      node.put(name, type.moniker);
    }
  }

  private static ObjectNode iterable(Core.Iter iterable) {
    final ObjectNode node = FACTORY.objectNode();
    if (iterable instanceof Core.OpaqueIterable) {
      node.put("kind", iterable.op.kind);
      node.put("name", ((Core.OpaqueIterable) iterable).name);
      return node;
    }
    final Core.Range range = (Core.Range) iterable;
    node.put("kind", "Range");
    node.set("start", exp(range.start));
    node.set("stop", exp(range.stop));
    node.set("step", exp(range.step));
    return node;
  }

  private static JsonNode exp(
      Core.@Nullable Exp e) {
    if (e == null) {
      return FACTORY.nullNode();
    }
    final ObjectNode node = FACTORY.objectNode();
    switch (e.op) {
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
        final Core.Literal literal = (Core.Literal) e;
        node.put("kind", "Constant");
        putType(node, "type", e.type);
        if (literal.value instanceof BigDecimal) {
          node.put("value", (BigDecimal) literal.value);
        } else if (literal.value instanceof Boolean) {
          node.put("value", (Boolean) literal.value);
        } else {
          node.put("value", (String) literal.value);
        }
        return node;
      case ID:
        final Core.Id id = (Core.Id) e;
        node.put("kind", "Name");
        putType(node, "type", e.type);
        node.put("name", id.name);
        if (id.isFree()) {
          node.put("free", true);
        } else {
          node.put("generator", id.generatorIndex);
        }
        return node;
      case IF_EXP:
        final Core.If ifExp = (Core.If) e;
        node.put("kind", "IfExp");
        putType(node, "type", e.type);
        node.set("test", exp(ifExp.condition));
        node.set("body", exp(ifExp.ifTrue));
        node.set("orelse", exp(ifExp.ifFalse));
        return node;
      case APPLY:
        final Core.Apply apply = (Core.Apply) e;
        node.put("kind", "Call");
        putType(node, "type", e.type);
        node.put("func", apply.fn);
        final ArrayNode applyArgs = node.putArray("args");
        apply.args.forEach(arg -> applyArgs.add(exp(arg)));
        return node;
      default:
        final Core.Call call = (Core.Call) e;
        node.put("kind", e.op == Op.CAST ? "Cast" : e.op.kind);
        putType(node, "type", e.type);
        node.put("op", e.op.name());
        final ArrayNode args = node.putArray("args");
        call.args.forEach(arg -> args.add(exp(arg)));
        return node;
    }
  }
}

// End IrJson.java
