// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.lang.reflect.InvocationTargetException;

/**
 * Condition raised while a generator step executes.
 *
 * <p>Handlers match conditions by {@link #tag}; the {@link #payload} is opaque to the compiler and
 * the engine. Runtime exceptions thrown by host code are converted with {@link #from(Throwable)},
 * using the exception's simple class name as the tag.
 */
public class RaisedCondition extends RuntimeException {
  public static final String MATCH_ANY = "*";

  public final String tag;
  public final Object payload;

  public RaisedCondition(String tag, Object payload) {
    super(buildMessage(tag, payload));
    this.tag = tag;
    this.payload = payload;
  }

  private RaisedCondition(String tag, Object payload, Throwable cause) {
    super(buildMessage(tag, payload), cause);
    this.tag = tag;
    this.payload = payload;
  }

  public static RaisedCondition from(Throwable thrown) {
    while (thrown instanceof InvocationTargetException ite && ite.getTargetException() != null) {
      thrown = ite.getTargetException();
    }
    if (thrown instanceof RaisedCondition condition) {
      return condition;
    }
    return new RaisedCondition(thrown.getClass().getSimpleName(), thrown.getMessage(), thrown);
  }

  public boolean matches(String pattern) {
    return MATCH_ANY.equals(pattern) || tag.equals(pattern);
  }

  private static String buildMessage(String tag, Object payload) {
    return payload == null ? tag : tag + ": " + Program.toString(payload);
  }
}
