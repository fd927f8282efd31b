// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.Iterator;

/** Target of delegation: something that can be advanced with resume values. */
public interface Sendable {
  /** Advances with {@code value} as the result of the pending suspension point. */
  Status send(Object value);

  /** Raises {@code condition} at the pending suspension point. */
  Status raise(RaisedCondition condition);

  default void close() {}

  /**
   * Converts the operand of a delegation into a {@link Sendable}.
   *
   * @throws RaisedCondition tagged {@code TypeError} if {@code value} can't be delegated to
   */
  static Sendable of(Object value) {
    if (value instanceof Sendable sendable) {
      return sendable;
    } else if (value instanceof Iterator<?> iterator) {
      return new IteratorAdapter(iterator);
    } else if (value instanceof Iterable<?> iterable) {
      return new IteratorAdapter(iterable.iterator());
    }
    throw new RaisedCondition(
        "TypeError",
        "Cannot delegate to %s".formatted(value == null ? "null" : value.getClass().getName()));
  }

  /** Delegation to a host iterator: yields each element, then finishes with null. */
  record IteratorAdapter(Iterator<?> iterator) implements Sendable {
    @Override
    public Status send(Object value) {
      return iterator.hasNext() ? Status.yielded(iterator.next()) : Status.done(null);
    }

    @Override
    public Status raise(RaisedCondition condition) {
      return Status.error(condition);
    }
  }
}
