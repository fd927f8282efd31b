// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

/** Malformed program tree. No partial {@link Code} is produced when this is thrown. */
public class CompileException extends RuntimeException {
  public CompileException(String message) {
    super(message);
  }

  public CompileException(String message, Throwable cause) {
    super(message, cause);
  }
}
