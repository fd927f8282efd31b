// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.genstep.interpreter.Program;
import org.genstep.parser.GenstepParser;

/**
 * Command-line driver. Reads Genstep source (or, with {@code read-ast}, its JSON AST) from stdin.
 *
 * <pre>
 * genstep [dump-parse-tree] [dump-ast] [dump-steps] [read-ast] [--limit=N] [NAME [ARGS...]]
 * </pre>
 *
 * With {@code NAME}, starts the generator of that name with JSON-parsed {@code ARGS} and prints
 * each status until it terminates or {@code N} statuses (default 100) have been printed.
 */
public class App {
  static final int DEFAULT_LIMIT = 100;

  public static void main(String[] args) throws Exception {
    if (System.getenv("GENSTEP_DEBUG") != null) {
      Program.setDebugLogger((message, params) -> System.out.printf(message + "\n", params));
      Program.setVerboseDebugging(true);
    }

    List<String> argsList = new ArrayList<>(Arrays.asList(args));
    if (argsList.remove("--version")) {
      System.out.println(Program.versionInfo());
      return;
    }

    String stdinString =
        new BufferedReader(new InputStreamReader(System.in))
            .lines()
            .collect(Collectors.joining("\n"));
    run(argsList, stdinString, System.out);
  }

  static void run(List<String> args, String source, PrintStream out) {
    var argsList = new ArrayList<>(args);
    int limit = DEFAULT_LIMIT;
    for (var iter = argsList.iterator(); iter.hasNext(); ) {
      String arg = iter.next();
      if (arg.startsWith("--limit=")) {
        limit = Integer.parseInt(arg.substring("--limit=".length()));
        iter.remove();
      }
    }

    JsonElement jsonAst = null;
    if (argsList.remove("read-ast")) {
      jsonAst = JsonParser.parseString(source);
    } else {
      boolean intermediateOutput = false;
      if (argsList.remove("dump-parse-tree")) {
        var parserOutput = GenstepParser.parseTrees("<stdin>", source);
        var parser = parserOutput.parser();
        out.println(parserOutput.parseTree().toStringTree(parser));
        intermediateOutput = true;
      }
      if (argsList.remove("dump-ast")) {
        jsonAst = GenstepParser.parse("<stdin>", source);
        Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();
        out.println(gson.toJson(jsonAst));
        intermediateOutput = true;
      }
      if (intermediateOutput) {
        return;
      }
    }

    if (jsonAst == null) {
      jsonAst = GenstepParser.parse("<stdin>", source);
    }

    var program = new Program();
    program.stdout = out::println;
    program.parse(jsonAst);

    if (argsList.remove("dump-steps")) {
      for (var function : program.functions()) {
        out.print(function.code().dump(-1));
      }
    }

    if (!argsList.isEmpty()) {
      String name = argsList.get(0);
      Object[] generatorArgs =
          argsList.subList(1, argsList.size()).stream()
              .map(arg -> fromJson(JsonParser.parseString(arg)))
              .toArray();
      var generator = program.start(name, generatorArgs);
      for (int i = 0; i < limit; ++i) {
        var status = generator.advance();
        out.println(status);
        if (status.isTerminal()) {
          break;
        }
      }
    }
  }

  /** Converts a JSON command-line argument to the value passed to a generator. */
  static Object fromJson(JsonElement element) {
    if (element.isJsonNull()) {
      return null;
    } else if (element.isJsonArray()) {
      JsonArray array = element.getAsJsonArray();
      var list = new ArrayList<Object>(array.size());
      for (var item : array) {
        list.add(fromJson(item));
      }
      return list;
    } else if (element.isJsonPrimitive()) {
      var primitive = element.getAsJsonPrimitive();
      if (primitive.isBoolean()) {
        return primitive.getAsBoolean();
      } else if (primitive.isString()) {
        return primitive.getAsString();
      }
      double number = primitive.getAsDouble();
      if (number == Math.rint(number) && !primitive.getAsString().contains(".")) {
        long longValue = primitive.getAsLong();
        if (longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
          return (int) longValue;
        }
        return longValue;
      }
      return number;
    }
    throw new IllegalArgumentException("Unsupported generator argument: " + element);
  }
}
