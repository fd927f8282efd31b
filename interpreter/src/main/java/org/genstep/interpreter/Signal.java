// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.Optional;

/** Control signal returned by each executed step. */
public sealed interface Signal {

  /** Continue at {@code target} within the same run. Never observed outside the engine. */
  record Jump(String target) implements Signal {}

  /** Suspend; the instance resumes at the step following the yielding one. */
  record Yield(Object value, Optional<String> tag) implements Signal {}

  /** Suspend in favor of {@code target} until it finishes. */
  record Delegating(Sendable target) implements Signal {}

  record Done(Object value) implements Signal {}

  record Error(RaisedCondition condition) implements Signal {}
}
