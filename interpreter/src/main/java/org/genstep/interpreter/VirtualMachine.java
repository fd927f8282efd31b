// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static org.genstep.interpreter.Program.debug;
import static org.genstep.interpreter.Program.logger;

/**
 * Executes the steps of one generator instance until it suspends or terminates.
 *
 * <p>The machine holds no state of its own; delegation to sub-generators is handled by {@link
 * Generator}, which interprets the {@link Signal.Delegating} signals returned here.
 */
public class VirtualMachine {

  private static final VirtualMachine INSTANCE = new VirtualMachine();

  public static VirtualMachine getInstance() {
    return INSTANCE;
  }

  private VirtualMachine() {}

  /**
   * Runs steps starting at the context's cursor, following jumps, until a step yields, delegates,
   * finishes or fails. After a yield or delegation the cursor points at the step following the
   * suspending one; after completion or failure the context is terminated.
   *
   * @throws IllegalStateException if the context has already terminated
   */
  public Signal run(Context context) {
    if (context.terminated) {
      throw new IllegalStateException(
          "Cannot run %s: generator has already terminated".formatted(context.code.name()));
    }
    var code = context.code;
    var steps = code.steps();
    while (true) {
      var step = steps.get(context.ip);
      if (debug) {
        logger.log("%s[%d] %s", code.name(), context.ip, step);
      }

      Signal signal;
      try {
        signal = step.instruction().execute(context);
      } catch (RuntimeException e) {
        signal = new Signal.Error(RaisedCondition.from(e));
      }

      if (signal instanceof Signal.Jump jump) {
        context.ip = code.indexOf(jump.target());
      } else if (signal instanceof Signal.Yield || signal instanceof Signal.Delegating) {
        ++context.ip;
        return signal;
      } else {
        context.terminated = true;
        if (debug) {
          logger.log("%s terminated with %s", code.name(), signal);
        }
        return signal;
      }
    }
  }

  /** Deposits {@code value} as the result of the suspended expression, then continues to run. */
  public Signal resume(Context context, Object value) {
    if (context.terminated) {
      throw new IllegalStateException(
          "Cannot resume %s: generator has already terminated".formatted(context.code.name()));
    }
    context.setValue(value);
    return run(context);
  }

  /** Whether the context is suspended at a resume point and can continue. */
  public boolean wasSuspended(Context context) {
    return context.ip > 0 && !context.terminated;
  }

  /** Terminates the context without running any further steps. */
  public void abandon(Context context) {
    context.terminated = true;
  }
}
