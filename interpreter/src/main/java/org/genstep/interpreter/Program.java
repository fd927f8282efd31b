// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static java.util.stream.Collectors.joining;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Host-facing entry point: holds the global environment, compiles generator definitions and
 * starts generator instances.
 *
 * <pre>{@code
 * var program = new Program().parse(GenstepParser.parse("<stdin>", code));
 * Generator counter = program.start("counter", 0, 1);
 * Status status = counter.advance(); // yield 0
 * }</pre>
 */
public class Program {

  public interface DebugLogger {
    /** Formats `message` containing printf-style "%s", "%d", etc with values from `args`. */
    void log(String message, Object... args);
  }

  static DebugLogger logger = (message, args) -> {};

  static boolean debug = false;

  public static void setVerboseDebugging(boolean enable) {
    debug = enable;
  }

  // To enable debug logging to stderr:
  // Program.setDebugLogger((str, args) -> System.err.printf(str + "%n", args));
  public static void setDebugLogger(DebugLogger newLogger) {
    logger = newLogger;
  }

  private static VersionInfo versionInfo = null;

  public static VersionInfo versionInfo() throws IOException {
    if (versionInfo == null) {
      versionInfo = VersionInfo.load();
    }
    return versionInfo;
  }

  /** Generator definition as read from the JSON AST. */
  public record GeneratorDef(String name, List<String> params, Node body, int lineno) {
    public GeneratorDef {
      params = List.copyOf(params);
    }
  }

  public Consumer<String> stdout = System.out::println;

  private final Environment globals = new Environment();
  private final Map<String, GeneratorFunction> functions = new LinkedHashMap<>();

  public Program() {
    Builtins.install(
        globals,
        message -> {
          if (stdout != null) {
            stdout.accept(message);
          }
        });
  }

  public Program parse(JsonElement element) {
    return parse(element, "<stdin>");
  }

  /**
   * Compiles every generator definition in the {@code Module} or {@code GeneratorDef} AST.
   *
   * <p>Nothing is installed unless every definition compiles.
   */
  public Program parse(JsonElement element, String filename) {
    var compiled = new ArrayList<GeneratorFunction>();
    for (var definition : new TreeParser(filename).parseDefinitions(element)) {
      compiled.add(compile(definition));
    }
    compiled.forEach(this::install);
    return this;
  }

  /**
   * Compiles {@code definition} and binds it as a global, replacing any earlier generator or
   * global with the same name.
   */
  public GeneratorFunction define(GeneratorDef definition) {
    var function = compile(definition);
    install(function);
    return function;
  }

  private static GeneratorFunction compile(GeneratorDef definition) {
    if (debug) logger.log("Compiling %s (line %d)", definition.name(), definition.lineno());
    return new GeneratorFunction(
        Compiler.compile(definition.name(), definition.body(), definition.params()));
  }

  private void install(GeneratorFunction function) {
    functions.put(function.name(), function);
    globals.set(function.name(), function);
  }

  /** Returns the generator function named {@code name}, or null if there's none. */
  public GeneratorFunction getFunction(String name) {
    return functions.get(name);
  }

  public Collection<GeneratorFunction> functions() {
    return Collections.unmodifiableCollection(functions.values());
  }

  /** Creates an unstarted instance of the generator named {@code name}. */
  public Generator start(String name, Object... args) {
    var function = getFunction(name);
    if (function == null) {
      throw new IllegalArgumentException("No generator named '%s'".formatted(name));
    }
    return function.call(globals, args);
  }

  public Environment globals() {
    return globals;
  }

  public static boolean convertToBool(Object value) {
    if (value == null) {
      return false;
    } else if (value instanceof Boolean bool) {
      return bool;
    } else if (value instanceof String str) {
      return !str.isEmpty();
    } else if (value instanceof Collection<?> collection) {
      return !collection.isEmpty();
    } else if (value instanceof Number number) {
      return number.doubleValue() != 0.;
    } else {
      return true;
    }
  }

  public static String toString(Object value) {
    if (value == null) {
      return "null";
    } else if (value instanceof List<?> list) {
      return list.stream().map(Program::toRepr).collect(joining(", ", "[", "]"));
    } else if (value instanceof RaisedCondition condition) {
      return "<condition %s>".formatted(condition.getMessage());
    } else {
      return value.toString();
    }
  }

  public static String toRepr(Object value) {
    if (value instanceof String string) {
      Gson gson = new GsonBuilder().disableHtmlEscaping().create();
      return gson.toJson(string);
    } else {
      return toString(value);
    }
  }
}
