// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;
import org.genstep.interpreter.Node.*;

/** Reads the JSON AST produced by the parser into {@link Node} program trees. */
public record TreeParser(String filename) {

  /** Parses a {@code Module} (or a lone {@code GeneratorDef}) into its generator definitions. */
  public List<Program.GeneratorDef> parseDefinitions(JsonElement element) {
    try {
      String type = getType(element);
      switch (type) {
        case "Module":
          {
            var definitions = new ArrayList<Program.GeneratorDef>();
            for (var definition : getAttr(element, "body").getAsJsonArray()) {
              definitions.add(parseGeneratorDef(definition));
            }
            return definitions;
          }

        case "GeneratorDef":
          return List.of(parseGeneratorDef(element));

        default:
          throw new CompileException(
              "%s: expected Module or GeneratorDef but got: %s".formatted(filename, element));
      }
    } catch (CompileException e) {
      throw e;
    } catch (RuntimeException e) {
      throw malformed(e);
    }
  }

  private CompileException malformed(RuntimeException e) {
    return new CompileException(
        "%s: malformed program tree: %s".formatted(filename, e.getMessage()), e);
  }

  private Program.GeneratorDef parseGeneratorDef(JsonElement element) {
    var params =
        StreamSupport.stream(getAttr(element, "params").getAsJsonArray().spliterator(), false)
            .map(JsonElement::getAsString)
            .toList();
    return new Program.GeneratorDef(
        getAttr(element, "name").getAsString(),
        params,
        toNode(getAttr(element, "body")),
        getLineno(element));
  }

  /** Parses a single program tree node, such as a generator body. */
  public Node parseNode(JsonElement element) {
    try {
      return toNode(element);
    } catch (CompileException e) {
      throw e;
    } catch (RuntimeException e) {
      throw malformed(e);
    }
  }

  private Node toNode(JsonElement element) {
    String type = getType(element);
    switch (type) {
      case "Block":
        {
          var body = getAttr(element, "body").getAsJsonArray();
          if (body.size() == 1) {
            return toNode(body.get(0));
          }
          return new Sequence(parseNodes(body));
        }

      case "Constant":
        return new Literal(parseConstant(element));

      case "Name":
        return new Variable(getAttr(element, "id").getAsString());

      case "Quote":
        return new Quote(parseDatum(getAttr(element, "datum")));

      case "If":
        {
          var orelse = getAttrOrJavaNull(element, "orelse");
          return new If(
              toNode(getAttr(element, "test")),
              toNode(getAttr(element, "body")),
              orelse == null ? new Literal(null) : toNode(orelse));
        }

      case "While":
        return new While(toNode(getAttr(element, "test")), toNode(getAttr(element, "body")));

      case "Let":
        return new Let(
            parseLetMode(getAttr(element, "mode").getAsString()),
            parseBindings(getAttr(element, "bindings").getAsJsonArray()),
            toNode(getAttr(element, "body")));

      case "Assign":
        return new Assign(
            toNode(getAttr(element, "target")), toNode(getAttr(element, "value")));

      case "Call":
        return new Call(
            toNode(getAttr(element, "func")),
            parseNodes(getAttr(element, "args").getAsJsonArray()));

      case "Yield":
        {
          var value = getAttrOrJavaNull(element, "value");
          var tag = getAttrOrJavaNull(element, "tag");
          return new Yield(
              value == null ? new Literal(null) : toNode(value),
              Optional.ofNullable(tag).map(JsonElement::getAsString));
        }

      case "YieldFrom":
        return new Delegate(toNode(getAttr(element, "value")));

      case "Try":
        {
          var handlers = new ArrayList<Handler>();
          for (var handler : getAttr(element, "handlers").getAsJsonArray()) {
            var variable = getAttrOrJavaNull(handler, "name");
            handlers.add(
                new Handler(
                    getAttr(handler, "pattern").getAsString(),
                    Optional.ofNullable(variable).map(JsonElement::getAsString),
                    toNode(getAttr(handler, "body"))));
          }
          return new HandlerCase(toNode(getAttr(element, "body")), handlers);
        }
    }
    throw new CompileException(
        "%s: unknown program tree node type at line %d: %s"
            .formatted(filename, getLineno(element), element));
  }

  private List<Node> parseNodes(JsonArray array) {
    return StreamSupport.stream(array.spliterator(), false).map(this::toNode).toList();
  }

  private static Let.Mode parseLetMode(String mode) {
    switch (mode) {
      case "sequential":
        return Let.Mode.SEQUENTIAL;
      case "simultaneous":
        return Let.Mode.SIMULTANEOUS;
      default:
        throw new CompileException("Unknown let mode: " + mode);
    }
  }

  // Bindings are either {"name": ..., "value": ...} objects or [name, value] pairs.
  private List<Binding> parseBindings(JsonArray array) {
    var bindings = new ArrayList<Binding>();
    for (var binding : array) {
      if (binding.isJsonArray()) {
        var pair = binding.getAsJsonArray();
        if (pair.size() != 2) {
          throw new CompileException(
              "%s: binding must be a [name, value] pair but got: %s".formatted(filename, binding));
        }
        bindings.add(new Binding(pair.get(0).getAsString(), toNode(pair.get(1))));
      } else {
        bindings.add(
            new Binding(
                getAttr(binding, "name").getAsString(), toNode(getAttr(binding, "value"))));
      }
    }
    return bindings;
  }

  private static Object parseConstant(JsonElement element) {
    var value = getAttrOrJavaNull(element, "value");
    if (value == null) {
      return null;
    }
    var typename = getAttrOrJavaNull(element, "typename");
    return parsePrimitive(
        value.getAsJsonPrimitive(), typename == null ? null : typename.getAsString());
  }

  private static Object parsePrimitive(JsonPrimitive primitive, String typename) {
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean();
    } else if (primitive.isString()) {
      return primitive.getAsString();
    } else if ("float".equals(typename)) {
      return primitive.getAsDouble();
    } else {
      var number = primitive.getAsNumber();
      double doubleValue = number.doubleValue();
      if (!"int".equals(typename) && doubleValue != Math.rint(doubleValue)) {
        return doubleValue;
      }
      long longValue = number.longValue();
      if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
        return (int) longValue;
      }
      return longValue;
    }
  }

  // Quoted data: symbols stay symbols and lists stay lists.
  private Object parseDatum(JsonElement element) {
    String type = getType(element);
    switch (type) {
      case "Constant":
        return parseConstant(element);

      case "Symbol":
        return new Symbol(getAttr(element, "id").getAsString());

      case "List":
        {
          var elements = new ArrayList<Object>();
          for (var datum : getAttr(element, "elts").getAsJsonArray()) {
            elements.add(parseDatum(datum));
          }
          return Collections.unmodifiableList(elements);
        }
    }
    throw new CompileException(
        "%s: unknown quoted datum type: %s".formatted(filename, element));
  }

  private static String getType(JsonElement element) {
    return element.getAsJsonObject().get("type").getAsString();
  }

  private static JsonElement getAttr(JsonElement element, String attr) {
    var result = element.getAsJsonObject().get(attr);
    if (result == null) {
      throw new CompileException(
          "Missing attribute '%s' in %s node: %s".formatted(attr, getType(element), element));
    }
    return result;
  }

  private static JsonElement getAttrOrJavaNull(JsonElement element, String attr) {
    var result = element.getAsJsonObject().get(attr);
    return result == null || result.isJsonNull() ? null : result;
  }

  private static int getLineno(JsonElement element) {
    var lineno = getAttrOrJavaNull(element, "lineno");
    return lineno == null ? -1 : lineno.getAsInt();
  }
}
