// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static org.genstep.interpreter.Program.convertToBool;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Body of a compiled {@link Step}. Instructions capture only compile-time constants: slot indices,
 * step names and operand expressions.
 */
sealed interface Instruction {
  Signal execute(Context context) throws RuntimeException;

  /** Names of the steps this instruction may jump to. */
  default List<String> targets() {
    return List.of();
  }

  /** Stores the operand's value into the value slot. */
  record Evaluate(Expression expression, String next) implements Instruction {
    @Override
    public Signal execute(Context context) {
      context.setValue(expression.eval(context));
      return new Signal.Jump(next);
    }

    @Override
    public List<String> targets() {
      return List.of(next);
    }
  }

  /** Copies the value slot into {@code slot}. */
  record Store(int slot, String next) implements Instruction {
    @Override
    public Signal execute(Context context) {
      context.set(slot, context.value());
      return new Signal.Jump(next);
    }

    @Override
    public List<String> targets() {
      return List.of(next);
    }
  }

  /** Copies every temporary slot into its variable slot at once. */
  record Bind(List<Integer> fromSlots, List<Integer> toSlots, String next) implements Instruction {
    @Override
    public Signal execute(Context context) {
      for (int i = 0; i < fromSlots.size(); ++i) {
        context.set(toSlots.get(i), context.get(fromSlots.get(i)));
      }
      return new Signal.Jump(next);
    }

    @Override
    public List<String> targets() {
      return List.of(next);
    }
  }

  record Branch(Expression test, String ifTrue, String ifFalse) implements Instruction {
    @Override
    public Signal execute(Context context) {
      return new Signal.Jump(convertToBool(test.eval(context)) ? ifTrue : ifFalse);
    }

    @Override
    public List<String> targets() {
      return List.of(ifTrue, ifFalse);
    }
  }

  record Goto(String target) implements Instruction {
    @Override
    public Signal execute(Context context) {
      return new Signal.Jump(target);
    }

    @Override
    public List<String> targets() {
      return List.of(target);
    }
  }

  /** Suspends with a value. Must be followed in the step array by a {@link Resume}. */
  record YieldValue(Expression value, Optional<String> tag) implements Instruction {
    @Override
    public Signal execute(Context context) {
      Object result = value.eval(context);
      context.setValue(result);
      return new Signal.Yield(result, tag);
    }
  }

  /** Suspends in favor of a sub-generator. Always followed by a {@link Resume}. */
  record DelegateTo(Expression iterator) implements Instruction {
    @Override
    public Signal execute(Context context) {
      Object target = iterator.eval(context);
      context.setValue(target);
      return new Signal.Delegating(Sendable.of(target));
    }
  }

  /**
   * First step run after a suspension. A pending exception (raised into the generator, or by a
   * failed delegate) is rethrown here so that handlers around the suspension point see it.
   */
  record Resume(String next) implements Instruction {
    @Override
    public Signal execute(Context context) {
      RaisedCondition pending = context.takeException();
      if (pending != null) {
        throw pending;
      }
      return new Signal.Jump(next);
    }

    @Override
    public List<String> targets() {
      return List.of(next);
    }
  }

  /** Reserved final step. */
  record Finish() implements Instruction {
    @Override
    public Signal execute(Context context) {
      return new Signal.Done(context.get(Code.FINAL_SLOT));
    }
  }

  record HandlerEntry(String pattern, String entryStep) {}

  /**
   * Runs {@code body} under the handlers lexically enclosing its step, innermost first. A
   * matching handler receives the condition in the value slot.
   */
  record Guarded(Instruction body, List<HandlerEntry> handlers) implements Instruction {
    @Override
    public Signal execute(Context context) {
      try {
        return body.execute(context);
      } catch (RuntimeException e) {
        var condition = RaisedCondition.from(e);
        for (var handler : handlers) {
          if (condition.matches(handler.pattern())) {
            context.setValue(condition);
            return new Signal.Jump(handler.entryStep());
          }
        }
        throw condition;
      }
    }

    @Override
    public List<String> targets() {
      var targets = new ArrayList<>(body.targets());
      handlers.forEach(handler -> targets.add(handler.entryStep()));
      return targets;
    }

    @Override
    public String toString() {
      return "%s guarded by %s".formatted(body, handlers);
    }
  }
}
