// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static org.genstep.interpreter.Program.debug;
import static org.genstep.interpreter.Program.logger;

import java.util.Arrays;

/**
 * Mutable state of one generator instance: its lifted slots, the cursor into the shared step
 * array, the terminal flag and the pending exception.
 */
class Context {
  final Code code;
  private final Environment globals;
  private final Object[] slots;

  int ip = 0; // index of the next step to execute
  boolean terminated = false;

  // Set while a condition waits to be rethrown at the resume point.
  private RaisedCondition exception;

  Context(Code code, Environment globals, Object[] args) {
    var parameterSlots = code.parameterSlots();
    if (args.length != parameterSlots.size()) {
      throw new IllegalArgumentException(
          "%s() takes %d arguments but %d were given"
              .formatted(code.name(), parameterSlots.size(), args.length));
    }
    this.code = code;
    this.globals = globals;
    this.slots = new Object[code.slotNames().size()];
    for (int i = 0; i < args.length; ++i) {
      slots[parameterSlots.get(i)] = args[i];
    }
  }

  Environment globals() {
    return globals;
  }

  Object get(int slot) {
    var data = slots[slot];
    if (debug) logger.log("get[%s]: %s", code.slotNames().get(slot), data);
    return data;
  }

  void set(int slot, Object data) {
    if (debug) logger.log("set[%s]: %s", code.slotNames().get(slot), data);
    slots[slot] = data;
  }

  Object value() {
    return get(Code.VALUE_SLOT);
  }

  void setValue(Object data) {
    set(Code.VALUE_SLOT, data);
  }

  void setException(RaisedCondition exception) {
    this.exception = exception;
  }

  RaisedCondition takeException() {
    var pending = exception;
    exception = null;
    return pending;
  }

  @Override
  public String toString() {
    return "Context[%s ip=%d terminated=%s slots=%s]"
        .formatted(code.name(), ip, terminated, Arrays.toString(slots));
  }
}
