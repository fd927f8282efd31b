// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

/** Callable value. Calls are evaluated within a single step and never suspend. */
public interface Function {
  Object call(Environment env, Object... params);

  static void expectNumParams(Object[] params, int n, Object message) {
    if (params.length != n) {
      throw new IllegalArgumentException(
          String.format(
              "Expected %d params but got %d for function: %s", n, params.length, message));
    }
  }

  static void expectParamRange(Object[] params, int min, int max, Object message) {
    if (params.length < min || params.length > max) {
      throw new IllegalArgumentException(
          String.format(
              "Expected %d to %d params but got %d for function: %s",
              min, max, params.length, message));
    }
  }

  default void expectNumParams(Object[] params, int n) {
    expectNumParams(params, n, this);
  }

  default void expectParamRange(Object[] params, int min, int max) {
    expectParamRange(params, min, max, this);
  }
}
