// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.List;
import java.util.Optional;

/** Program tree consumed by {@link Compiler}: a closed set of node kinds. */
public sealed interface Node {

  /** Constant value. */
  record Literal(Object value) implements Node {}

  /** Reference to a lifted local or, when not bound in scope, a global. */
  record Variable(String name) implements Node {}

  /** Datum taken verbatim: symbols inside it are never resolved as variables. */
  record Quote(Object datum) implements Node {}

  record Sequence(List<Node> elements) implements Node {
    public Sequence {
      elements = List.copyOf(elements);
    }
  }

  record If(Node condition, Node thenBranch, Node elseBranch) implements Node {}

  record While(Node test, Node body) implements Node {}

  record Binding(String name, Node init) {
    public Binding {
      if (name == null || name.isEmpty()) {
        throw new CompileException("Binding requires a variable name, got: " + name);
      }
    }
  }

  record Let(Mode mode, List<Binding> bindings, Node body) implements Node {
    public enum Mode {
      // Each initializer sees the variables bound before it.
      SEQUENTIAL,
      // Every initializer is evaluated in the enclosing scope before any variable is bound.
      SIMULTANEOUS
    }

    public Let {
      bindings = List.copyOf(bindings);
    }
  }

  record Assign(Node target, Node value) implements Node {}

  record Call(Node function, List<Node> args) implements Node {
    public Call {
      args = List.copyOf(args);
    }
  }

  record Yield(Node value, Optional<String> tag) implements Node {}

  /** Delegates to a nested generator (or iterator) until it finishes. */
  record Delegate(Node iterator) implements Node {}

  /**
   * Handler clause of a {@link HandlerCase}. {@code pattern} is a condition tag, or {@code "*"}
   * to match any condition.
   */
  record Handler(String pattern, Optional<String> variable, Node body) {}

  record HandlerCase(Node body, List<Handler> handlers) implements Node {
    public HandlerCase {
      handlers = List.copyOf(handlers);
    }
  }
}
