// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.List;

/**
 * Operand evaluated entirely within one step. Operands never suspend, so they are evaluated
 * directly instead of being compiled into steps of their own.
 */
sealed interface Expression {
  Object eval(Context context);

  record Constant(Object value) implements Expression {
    @Override
    public Object eval(Context context) {
      return value;
    }

    @Override
    public String toString() {
      return Program.toString(value);
    }
  }

  record SlotRef(int slot, String name) implements Expression {
    @Override
    public Object eval(Context context) {
      return context.get(slot);
    }

    @Override
    public String toString() {
      return "%s@%d".formatted(name, slot);
    }
  }

  record GlobalRef(String name) implements Expression {
    @Override
    public Object eval(Context context) {
      return context.globals().lookup(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record Invoke(Expression function, List<Expression> args) implements Expression {
    @Override
    public Object eval(Context context) {
      Object caller = function.eval(context);
      if (!(caller instanceof Function callable)) {
        throw new RaisedCondition(
            "TypeError",
            "'%s' is not callable"
                .formatted(caller == null ? "null" : caller.getClass().getName()));
      }
      Object[] params = new Object[args.size()];
      for (int i = 0; i < params.length; ++i) {
        params[i] = args.get(i).eval(context);
      }
      return callable.call(context.globals(), params);
    }

    @Override
    public String toString() {
      var out = new StringBuilder().append(function).append('(');
      for (int i = 0; i < args.size(); ++i) {
        if (i > 0) out.append(", ");
        out.append(args.get(i));
      }
      return out.append(')').toString();
    }
  }
}
