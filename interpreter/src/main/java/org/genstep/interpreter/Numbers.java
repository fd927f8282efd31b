// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

/**
 * Arithmetic over boxed numbers. The wider operand decides the result type: double, then long,
 * then int.
 */
public class Numbers {
  private Numbers() {}

  public static Number add(Number x, Number y) {
    if (x instanceof Double || y instanceof Double || x instanceof Float || y instanceof Float) {
      return x.doubleValue() + y.doubleValue();
    } else if (x instanceof Long || y instanceof Long) {
      return x.longValue() + y.longValue();
    } else if (isInt(x) && isInt(y)) {
      return x.intValue() + y.intValue();
    } else {
      throw unsupported("add", x, "+", y);
    }
  }

  public static Number subtract(Number x, Number y) {
    if (x instanceof Double || y instanceof Double || x instanceof Float || y instanceof Float) {
      return x.doubleValue() - y.doubleValue();
    } else if (x instanceof Long || y instanceof Long) {
      return x.longValue() - y.longValue();
    } else if (isInt(x) && isInt(y)) {
      return x.intValue() - y.intValue();
    } else {
      throw unsupported("subtract", x, "-", y);
    }
  }

  public static Number multiply(Number x, Number y) {
    if (x instanceof Double || y instanceof Double || x instanceof Float || y instanceof Float) {
      return x.doubleValue() * y.doubleValue();
    } else if (x instanceof Long || y instanceof Long) {
      return x.longValue() * y.longValue();
    } else if (isInt(x) && isInt(y)) {
      return x.intValue() * y.intValue();
    } else {
      throw unsupported("multiply", x, "*", y);
    }
  }

  /** Integer operands use floor division; any floating-point operand gives a double quotient. */
  public static Number divide(Number x, Number y) {
    checkNonZero(y);
    if (x instanceof Double || y instanceof Double || x instanceof Float || y instanceof Float) {
      return x.doubleValue() / y.doubleValue();
    } else if (x instanceof Long || y instanceof Long) {
      return Math.floorDiv(x.longValue(), y.longValue());
    } else if (isInt(x) && isInt(y)) {
      return Math.floorDiv(x.intValue(), y.intValue());
    } else {
      throw unsupported("divide", x, "/", y);
    }
  }

  /** Modulus whose result takes the sign of the divisor. */
  public static Number mod(Number x, Number y) {
    checkNonZero(y);
    if (x instanceof Double || y instanceof Double || x instanceof Float || y instanceof Float) {
      double divisor = y.doubleValue();
      double remainder = x.doubleValue() % divisor;
      if (remainder != 0 && (remainder < 0) != (divisor < 0)) {
        remainder += divisor;
      }
      return remainder;
    } else if (x instanceof Long || y instanceof Long) {
      return Math.floorMod(x.longValue(), y.longValue());
    } else if (isInt(x) && isInt(y)) {
      return Math.floorMod(x.intValue(), y.intValue());
    } else {
      throw unsupported("take modulus of", x, "%", y);
    }
  }

  public static Number negate(Number x) {
    if (x instanceof Double d) {
      return -d;
    } else if (x instanceof Float f) {
      return -f;
    } else if (x instanceof Long l) {
      return -l;
    } else if (isInt(x)) {
      return -x.intValue();
    } else {
      throw new IllegalArgumentException(
          String.format("Unable to negate number: %s (%s)", x, x.getClass().getName()));
    }
  }

  public static boolean equals(Number x, Number y) {
    return compare(x, y) == 0;
  }

  public static int compare(Number x, Number y) {
    if (x instanceof Double || y instanceof Double || x instanceof Float || y instanceof Float) {
      return Double.compare(x.doubleValue(), y.doubleValue());
    } else if (x instanceof Long || y instanceof Long || (isInt(x) && isInt(y))) {
      return Long.compare(x.longValue(), y.longValue());
    } else {
      throw new IllegalArgumentException(
          String.format(
              "Unable to compare numbers %s vs %s (%s vs %s)",
              x, y, x.getClass().getName(), y.getClass().getName()));
    }
  }

  private static boolean isInt(Number x) {
    return x instanceof Integer || x instanceof Short || x instanceof Byte;
  }

  private static void checkNonZero(Number y) {
    if (y.doubleValue() == 0.) {
      throw new ArithmeticException("division by zero");
    }
  }

  private static IllegalArgumentException unsupported(String verb, Number x, String op, Number y) {
    return new IllegalArgumentException(
        String.format(
            "Unable to %s numbers: %s %s %s (%s %s %s)",
            verb, x, op, y, x.getClass().getName(), op, y.getClass().getName()));
  }
}
