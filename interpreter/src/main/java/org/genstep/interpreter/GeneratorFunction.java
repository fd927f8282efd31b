// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

/** Compiled generator definition. Calling it creates a new, unstarted {@link Generator}. */
public record GeneratorFunction(Code code) implements Function {
  public String name() {
    return code.name();
  }

  @Override
  public Generator call(Environment env, Object... params) {
    return new Generator(new Context(code, env, params));
  }

  @Override
  public String toString() {
    return "<generator function %s>".formatted(code.name());
  }
}
