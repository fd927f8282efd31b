// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/** Mutable state threaded through the compilation of one generator definition. */
class CompilationContext {
  private final String name;

  // Steps in reverse order of execution; reversed once when the code is built.
  private final List<Step> steps = new ArrayList<>();

  private final List<String> slotNames = new ArrayList<>();
  private Map<String, Integer> bindings = new HashMap<>();

  // Innermost handler first.
  private List<Instruction.HandlerEntry> handlerStack = List.of();

  private int symbolCounter = 0;
  private final String finalStep;

  CompilationContext(String name) {
    this.name = name;
    slotNames.add("$value");
    slotNames.add("$final");
    finalStep = newStepName("final");
  }

  String name() {
    return name;
  }

  String finalStep() {
    return finalStep;
  }

  String newStepName(String kind) {
    return "%s#%d".formatted(kind, ++symbolCounter);
  }

  /** Allocates a fresh slot. Slots are never shared, even between same-named variables. */
  int newSlot(String variableName) {
    slotNames.add(variableName);
    return slotNames.size() - 1;
  }

  Optional<Integer> lookup(String variableName) {
    return Optional.ofNullable(bindings.get(variableName));
  }

  /** Binds {@code variableName} in the current scope. */
  void bind(String variableName, int slot) {
    bindings.put(variableName, slot);
  }

  Map<String, Integer> bindings() {
    return bindings;
  }

  /** Compiles within the given scope; the enclosing scope's map is restored afterwards. */
  <T> T withBindings(Map<String, Integer> scope, Supplier<T> compilation) {
    var saved = bindings;
    bindings = scope;
    try {
      return compilation.get();
    } finally {
      bindings = saved;
    }
  }

  List<Instruction.HandlerEntry> handlers() {
    return handlerStack;
  }

  <T> T withHandlers(List<Instruction.HandlerEntry> handlers, Supplier<T> compilation) {
    var saved = handlerStack;
    handlerStack = List.copyOf(handlers);
    try {
      return compilation.get();
    } finally {
      handlerStack = saved;
    }
  }

  String addStep(String kind, Instruction instruction) {
    return addNamedStep(newStepName(kind), instruction);
  }

  /**
   * Appends a step ahead of all steps added so far. Steps added while handlers are in scope are
   * guarded by them, except for the final step.
   */
  String addNamedStep(String stepName, Instruction instruction) {
    if (!handlerStack.isEmpty() && !stepName.equals(finalStep)) {
      instruction = new Instruction.Guarded(instruction, handlerStack);
    }
    steps.add(new Step(stepName, instruction));
    return stepName;
  }

  Code build(String entryStep, List<Integer> parameterSlots) {
    var ordered = new ArrayList<>(steps);
    Collections.reverse(ordered);
    if (!ordered.get(0).name().equals(entryStep)) {
      throw new IllegalStateException(
          "Entry step %s of %s is not the first step".formatted(entryStep, name));
    }
    return new Code(name, ordered, slotNames, parameterSlots, finalStep);
  }
}
