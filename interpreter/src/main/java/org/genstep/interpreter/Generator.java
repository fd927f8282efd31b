// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Generator instance: a private {@link Context} over shared {@link Code}.
 *
 * <p>Delegation is resolved here rather than in the {@link VirtualMachine}. While a delegate is
 * active, every advance is forwarded to it and its yields are passed through unchanged. When the
 * delegate finishes, its final value becomes the value of the delegation expression; when it
 * fails, the condition is rethrown at the delegation site, under the handlers that enclose it.
 *
 * <p>Advancing a generator that has finished, failed or been closed is a protocol violation and
 * always throws {@link IllegalStateException}.
 *
 * <p>Not thread-safe: callers must serialize calls on one instance.
 */
public class Generator implements Sendable, Iterable<Object> {
  private final VirtualMachine vm = VirtualMachine.getInstance();
  private final Context context;
  private Sendable delegate;
  private boolean running = false;
  private boolean closed = false;

  Generator(Context context) {
    this.context = context;
  }

  public String name() {
    return context.code.name();
  }

  public Status advance() {
    return send(null);
  }

  public Status advance(Object resumeValue) {
    return send(resumeValue);
  }

  @Override
  public Status send(Object value) {
    checkAdvanceable();
    return guardReentry(
        () -> {
          if (delegate != null) {
            return forwardToDelegate(() -> delegate.send(value));
          }
          return drive(vm.wasSuspended(context) ? vm.resume(context, value) : vm.run(context));
        });
  }

  @Override
  public Status raise(RaisedCondition condition) {
    checkAdvanceable();
    return guardReentry(
        () -> {
          if (delegate != null) {
            return forwardToDelegate(() -> delegate.raise(condition));
          }
          if (!vm.wasSuspended(context)) {
            vm.abandon(context);
            return Status.error(condition);
          }
          context.setException(condition);
          return drive(vm.run(context));
        });
  }

  /** Abandons the generator and any active delegate. No further steps run. */
  @Override
  public void close() {
    if (delegate != null) {
      delegate.close();
      delegate = null;
    }
    closed = true;
    vm.abandon(context);
  }

  public boolean isSuspended() {
    return !closed && vm.wasSuspended(context);
  }

  public boolean isTerminated() {
    return closed || context.terminated;
  }

  /**
   * Iterates over the values this generator yields, advancing it with null resume values. A failed
   * generator surfaces its condition from {@link Iterator#hasNext()}.
   */
  @Override
  public Iterator<Object> iterator() {
    return new Iterator<>() {
      private Status pending;

      @Override
      public boolean hasNext() {
        if (pending == null) {
          if (isTerminated()) {
            return false;
          }
          pending = advance();
        }
        if (pending.kind() == Status.Kind.ERROR) {
          throw pending.error();
        }
        return pending.isYield();
      }

      @Override
      public Object next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        var value = pending.value();
        pending = null;
        return value;
      }
    };
  }

  private void checkAdvanceable() {
    if (closed) {
      throw new IllegalStateException("Generator %s has been closed".formatted(name()));
    }
    if (context.terminated) {
      throw new IllegalStateException("Generator %s has already terminated".formatted(name()));
    }
    if (running) {
      throw new IllegalStateException("Generator %s is already running".formatted(name()));
    }
  }

  private Status guardReentry(Supplier<Status> advance) {
    running = true;
    try {
      return advance.get();
    } finally {
      running = false;
    }
  }

  /**
   * Runs the parent until it yields or terminates, starting each delegation it requests and
   * resuming it whenever a delegate finishes without yielding.
   */
  private Status drive(Signal signal) {
    while (true) {
      if (signal instanceof Signal.Yield yield) {
        return Status.yielded(yield.value(), yield.tag());
      } else if (signal instanceof Signal.Done done) {
        return Status.done(done.value());
      } else if (signal instanceof Signal.Error error) {
        return Status.error(error.condition());
      } else if (signal instanceof Signal.Delegating delegating) {
        delegate = delegating.target();
        var status = callDelegate(() -> delegate.send(null));
        if (status.isYield()) {
          return status;
        }
        signal = finishDelegation(status);
      } else {
        throw new IllegalStateException("Unexpected signal from %s: %s".formatted(name(), signal));
      }
    }
  }

  private Status forwardToDelegate(Supplier<Status> call) {
    var status = callDelegate(call);
    if (status.isYield()) {
      return status;
    }
    return drive(finishDelegation(status));
  }

  private static Status callDelegate(Supplier<Status> call) {
    try {
      return call.get();
    } catch (RuntimeException e) {
      // Includes protocol violations by the delegate, e.g. delegating to a finished generator.
      return Status.error(RaisedCondition.from(e));
    }
  }

  private Signal finishDelegation(Status status) {
    delegate = null;
    if (status.kind() == Status.Kind.DONE) {
      return vm.resume(context, status.value());
    }
    context.setException(status.error());
    return vm.run(context);
  }

  @Override
  public String toString() {
    String state = isTerminated() ? "terminated" : isSuspended() ? "suspended" : "created";
    return "<generator %s (%s)>".formatted(name(), state);
  }
}
