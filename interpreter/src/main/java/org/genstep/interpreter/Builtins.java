// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static java.util.stream.Collectors.joining;
import static org.genstep.interpreter.Program.convertToBool;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.stream.IntStream;

/** Runtime library of functions callable from generator bodies. */
public class Builtins {
  private Builtins() {}

  /** Installs every built-in function into {@code env}; {@code print} writes to {@code stdout}. */
  public static void install(Environment env, Consumer<String> stdout) {
    env.set("+", new BinaryOp("+", Builtins::plus));
    env.set("-", new BinaryOp("-", (x, y) -> Numbers.subtract(number("-", x), number("-", y))));
    env.set("*", new BinaryOp("*", (x, y) -> Numbers.multiply(number("*", x), number("*", y))));
    env.set("/", new BinaryOp("/", (x, y) -> Numbers.divide(number("/", x), number("/", y))));
    env.set("%", new BinaryOp("%", (x, y) -> Numbers.mod(number("%", x), number("%", y))));
    env.set("==", new BinaryOp("==", Builtins::equal));
    env.set("!=", new BinaryOp("!=", (x, y) -> !equal(x, y)));
    env.set("<", new BinaryOp("<", (x, y) -> compare("<", x, y) < 0));
    env.set("<=", new BinaryOp("<=", (x, y) -> compare("<=", x, y) <= 0));
    env.set(">", new BinaryOp(">", (x, y) -> compare(">", x, y) > 0));
    env.set(">=", new BinaryOp(">=", (x, y) -> compare(">=", x, y) >= 0));
    env.set("neg", NegateFunction.INSTANCE);
    env.set("not", NotFunction.INSTANCE);
    env.set("print", new PrintFunction(stdout));
    env.set("raise", RaiseFunction.INSTANCE);
    env.set("list", ListFunction.INSTANCE);
    env.set("append", AppendFunction.INSTANCE);
    env.set("get", GetFunction.INSTANCE);
    env.set("len", LenFunction.INSTANCE);
    env.set("str", StrFunction.INSTANCE);
    env.set("range", RangeFunction.INSTANCE);
    env.set("condition_tag", ConditionTagFunction.INSTANCE);
    env.set("condition_payload", ConditionPayloadFunction.INSTANCE);
  }

  static Object plus(Object x, Object y) {
    if (x instanceof String || y instanceof String) {
      return Program.toString(x) + Program.toString(y);
    }
    return Numbers.add(number("+", x), number("+", y));
  }

  static boolean equal(Object x, Object y) {
    if (x instanceof Number n && y instanceof Number m) {
      return Numbers.equals(n, m);
    }
    return Objects.equals(x, y);
  }

  static int compare(String op, Object x, Object y) {
    if (x instanceof Number n && y instanceof Number m) {
      return Numbers.compare(n, m);
    }
    if (x instanceof String s && y instanceof String t) {
      return s.compareTo(t);
    }
    throw new RaisedCondition(
        "TypeError",
        "'%s' not supported between %s and %s".formatted(op, typeName(x), typeName(y)));
  }

  private static Number number(String op, Object value) {
    if (value instanceof Number number) {
      return number;
    }
    throw new RaisedCondition(
        "TypeError", "unsupported operand for '%s': %s".formatted(op, typeName(value)));
  }

  private static List<Object> list(String function, Object value) {
    if (value instanceof List<?> list) {
      @SuppressWarnings("unchecked")
      var objects = (List<Object>) list;
      return objects;
    }
    throw new RaisedCondition(
        "TypeError", "%s() expects a list but got %s".formatted(function, typeName(value)));
  }

  static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  public record BinaryOp(String symbol, BiFunction<Object, Object, Object> operator)
      implements Function {
    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 2);
      return operator.apply(params[0], params[1]);
    }

    @Override
    public String toString() {
      return "<builtin %s>".formatted(symbol);
    }
  }

  public static class NegateFunction implements Function {
    public static final NegateFunction INSTANCE = new NegateFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 1);
      return Numbers.negate(number("neg", params[0]));
    }
  }

  public static class NotFunction implements Function {
    public static final NotFunction INSTANCE = new NotFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 1);
      return !convertToBool(params[0]);
    }
  }

  public record PrintFunction(Consumer<String> out) implements Function {
    @Override
    public Object call(Environment env, Object... params) {
      if (out != null) {
        out.accept(Arrays.stream(params).map(Program::toString).collect(joining(" ")));
      }
      return null;
    }
  }

  /** {@code raise(tag[, payload])}: tag is a string or a quoted symbol. */
  public static class RaiseFunction implements Function {
    public static final RaiseFunction INSTANCE = new RaiseFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectParamRange(params, 1, 2);
      String tag;
      if (params[0] instanceof Symbol symbol) {
        tag = symbol.name();
      } else if (params[0] instanceof String string) {
        tag = string;
      } else {
        throw new RaisedCondition(
            "TypeError", "raise() expects a symbol or string tag but got " + typeName(params[0]));
      }
      throw new RaisedCondition(tag, params.length > 1 ? params[1] : null);
    }
  }

  public static class ListFunction implements Function {
    public static final ListFunction INSTANCE = new ListFunction();

    @Override
    public Object call(Environment env, Object... params) {
      return new ArrayList<Object>(Arrays.asList(params));
    }
  }

  /** Appends to the list in place and returns the list. */
  public static class AppendFunction implements Function {
    public static final AppendFunction INSTANCE = new AppendFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 2);
      var list = list("append", params[0]);
      list.add(params[1]);
      return list;
    }
  }

  public static class GetFunction implements Function {
    public static final GetFunction INSTANCE = new GetFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 2);
      var list = list("get", params[0]);
      int index = number("get", params[1]).intValue();
      if (index < 0 || index >= list.size()) {
        throw new RaisedCondition(
            "IndexError",
            "index %d out of range for list of size %d".formatted(index, list.size()));
      }
      return list.get(index);
    }
  }

  public static class LenFunction implements Function {
    public static final LenFunction INSTANCE = new LenFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 1);
      var value = params[0];
      if (value instanceof Collection<?> collection) {
        return collection.size();
      } else if (value instanceof String str) {
        return str.length();
      }
      throw new RaisedCondition(
          "TypeError", "Object of type '%s' has no len()".formatted(typeName(value)));
    }
  }

  public static class StrFunction implements Function {
    public static final StrFunction INSTANCE = new StrFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 1);
      return Program.toString(params[0]);
    }
  }

  /** {@code range(start, stop)}: lazy iterable over the ints in [start, stop). */
  public static class RangeFunction implements Function {
    public static final RangeFunction INSTANCE = new RangeFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 2);
      int start = number("range", params[0]).intValue();
      int stop = number("range", params[1]).intValue();
      return new Range(start, stop);
    }
  }

  public record Range(int start, int stop) implements Iterable<Object> {
    @Override
    public Iterator<Object> iterator() {
      return IntStream.range(start, stop).<Object>mapToObj(i -> i).iterator();
    }

    @Override
    public String toString() {
      return "range(%d, %d)".formatted(start, stop);
    }
  }

  /** Tag of a caught condition, as a symbol. */
  public static class ConditionTagFunction implements Function {
    public static final ConditionTagFunction INSTANCE = new ConditionTagFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 1);
      return new Symbol(condition("condition_tag", params[0]).tag);
    }
  }

  public static class ConditionPayloadFunction implements Function {
    public static final ConditionPayloadFunction INSTANCE = new ConditionPayloadFunction();

    @Override
    public Object call(Environment env, Object... params) {
      expectNumParams(params, 1);
      return condition("condition_payload", params[0]).payload;
    }
  }

  private static RaisedCondition condition(String function, Object value) {
    if (value instanceof RaisedCondition condition) {
      return condition;
    }
    throw new RaisedCondition(
        "TypeError", "%s() expects a condition but got %s".formatted(function, typeName(value)));
  }
}
