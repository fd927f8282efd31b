// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Global names visible to every generator of a program: built-in functions and generator
 * definitions. Generator-local variables never live here.
 */
public class Environment {
  // ConcurrentHashMap doesn't allow null values, so null globals are stored as this sentinel.
  private static final Object NULL = new Object();

  private final Map<String, Object> vars = new ConcurrentHashMap<>();

  public Object get(String name) {
    var value = vars.get(name);
    return value == NULL ? null : value;
  }

  /**
   * Returns the value of the global named {@code name}.
   *
   * @throws RaisedCondition tagged {@code UnboundVariable} if there's no such global
   */
  public Object lookup(String name) {
    var value = vars.get(name);
    if (value == null) {
      throw new RaisedCondition("UnboundVariable", name);
    }
    return value == NULL ? null : value;
  }

  public void set(String name, Object value) {
    vars.put(name, value == null ? NULL : value);
  }

  public boolean contains(String name) {
    return vars.containsKey(name);
  }
}
