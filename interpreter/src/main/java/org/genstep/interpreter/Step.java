// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

public record Step(String name, Instruction instruction) {
  @Override
  public String toString() {
    return name + ": " + instruction;
  }
}
