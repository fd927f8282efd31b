// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.Optional;

/** Result of advancing a generator, as observed by its caller. */
public record Status(Kind kind, Object value, Optional<String> tag, RaisedCondition error) {
  public enum Kind {
    YIELD,
    DONE,
    ERROR
  }

  public static Status yielded(Object value) {
    return new Status(Kind.YIELD, value, Optional.empty(), null);
  }

  public static Status yielded(Object value, Optional<String> tag) {
    return new Status(Kind.YIELD, value, tag, null);
  }

  public static Status done(Object value) {
    return new Status(Kind.DONE, value, Optional.empty(), null);
  }

  public static Status error(RaisedCondition error) {
    return new Status(Kind.ERROR, null, Optional.empty(), error);
  }

  public boolean isYield() {
    return kind == Kind.YIELD;
  }

  public boolean isTerminal() {
    return kind != Kind.YIELD;
  }

  @Override
  public String toString() {
    return switch (kind) {
      case YIELD -> tag.map(t -> "yield @%s %s".formatted(t, Program.toString(value)))
          .orElseGet(() -> "yield " + Program.toString(value));
      case DONE -> "done " + Program.toString(value);
      case ERROR -> "error " + error.getMessage();
    };
  }
}
