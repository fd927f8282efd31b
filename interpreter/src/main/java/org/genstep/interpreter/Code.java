// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled generator definition: the step array, the lifted slots each instance allocates, and the
 * slots that receive the generator's arguments. Immutable and shareable across instances.
 */
public class Code {
  /** Slot holding the most recently produced value. */
  public static final int VALUE_SLOT = 0;

  /** Slot holding the value the generator finishes with. */
  public static final int FINAL_SLOT = 1;

  private final String name;
  private final List<Step> steps;
  private final Map<String, Integer> stepIndex = new HashMap<>();
  private final List<String> slotNames;
  private final List<Integer> parameterSlots;
  private final String finalStep;

  Code(
      String name,
      List<Step> steps,
      List<String> slotNames,
      List<Integer> parameterSlots,
      String finalStep) {
    this.name = name;
    this.steps = List.copyOf(steps);
    this.slotNames = List.copyOf(slotNames);
    this.parameterSlots = List.copyOf(parameterSlots);
    this.finalStep = finalStep;

    for (int i = 0; i < this.steps.size(); ++i) {
      if (stepIndex.put(this.steps.get(i).name(), i) != null) {
        throw new IllegalStateException(
            "Duplicate step name in %s: %s".formatted(name, this.steps.get(i).name()));
      }
    }
    for (int i = 0; i < this.steps.size(); ++i) {
      var step = this.steps.get(i);
      for (var target : step.instruction().targets()) {
        if (!stepIndex.containsKey(target)) {
          throw new IllegalStateException(
              "Step %s in %s jumps to undefined step %s".formatted(step.name(), name, target));
        }
      }
      if (suspends(step.instruction())
          && (i + 1 == this.steps.size()
              || !(unguarded(this.steps.get(i + 1).instruction()) instanceof Instruction.Resume))) {
        throw new IllegalStateException(
            "Suspending step %s in %s is not followed by a resume step"
                .formatted(step.name(), name));
      }
    }
    if (!stepIndex.containsKey(finalStep)) {
      throw new IllegalStateException("Missing final step in " + name);
    }
  }

  private static Instruction unguarded(Instruction instruction) {
    return instruction instanceof Instruction.Guarded guarded ? guarded.body() : instruction;
  }

  private static boolean suspends(Instruction instruction) {
    var body = unguarded(instruction);
    return body instanceof Instruction.YieldValue || body instanceof Instruction.DelegateTo;
  }

  public String name() {
    return name;
  }

  public List<Step> steps() {
    return steps;
  }

  /** Names of all lifted slots, indexed by slot. Includes the value and final slots. */
  public List<String> slotNames() {
    return slotNames;
  }

  public List<Integer> parameterSlots() {
    return parameterSlots;
  }

  public String finalStep() {
    return finalStep;
  }

  public int indexOf(String stepName) {
    Integer index = stepIndex.get(stepName);
    if (index == null) {
      throw new IllegalStateException("No step named %s in %s".formatted(stepName, name));
    }
    return index;
  }

  /** Human-readable listing of the step array, marking the step at {@code ip}. */
  public String dump(int ip) {
    var out = new StringBuilder();
    out.append(name).append(" slots=").append(slotNames).append('\n');
    for (int i = 0; i < steps.size(); ++i) {
      out.append(i == ip ? "> " : "  ").append('[').append(i).append("] ").append(steps.get(i));
      out.append('\n');
    }
    return out.toString();
  }

  @Override
  public String toString() {
    return "Code[%s, %d steps, %d slots]".formatted(name, steps.size(), slotNames.size());
  }
}
