// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

/** Name appearing inside quoted data. */
public record Symbol(String name) {
  @Override
  public String toString() {
    return name;
  }
}
