// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.genstep.interpreter.Node.*;
import org.junit.jupiter.api.Test;

public class CompilerTest {

  @Test
  public void literalSequence() throws Exception {
    var body = new Sequence(List.of(new Literal(1), new Literal(2)));
    Code code = Compiler.compile("lit", body, List.of());

    var steps = code.steps();
    assertEquals(4, steps.size());
    assertEquals(code.finalStep(), steps.get(steps.size() - 1).name());
    assertInstanceOf(Instruction.Finish.class, steps.get(steps.size() - 1).instruction());
    assertEquals(List.of("$value", "$final"), code.slotNames());
  }

  @Test
  public void entryStepIsFirst() throws Exception {
    Code code = Compiler.compile("counter", counterBody(), List.of("start", "step"));

    // Entry evaluates `start` for the assignment to `n`.
    var entry = (Instruction.Evaluate) code.steps().get(0).instruction();
    var operand = (Expression.SlotRef) entry.expression();
    assertEquals("start", operand.name());
    assertEquals(code.parameterSlots().get(0).intValue(), operand.slot());
  }

  @Test
  public void parametersAndLocalsGetDistinctSlots() throws Exception {
    Code code = Compiler.compile("counter", counterBody(), List.of("start", "step"));

    assertEquals(List.of(2, 3), code.parameterSlots());
    assertEquals(List.of("$value", "$final", "start", "step", "n"), code.slotNames());
  }

  @Test
  public void everySuspendingStepIsFollowedByResume() throws Exception {
    var body =
        new Sequence(
            List.of(
                new If(
                    new Variable("flag"),
                    new Yield(new Literal("then"), Optional.empty()),
                    new Yield(new Literal("else"), Optional.of("tagged"))),
                new Delegate(new Variable("items")),
                new Yield(
                    new Call(new Variable("+"), List.of(new Literal(1), new Literal(2))),
                    Optional.empty())));
    Code code = Compiler.compile("branches", body, List.of("flag", "items"));

    var steps = code.steps();
    int suspending = 0;
    for (int i = 0; i < steps.size(); ++i) {
      var instruction = steps.get(i).instruction();
      if (instruction instanceof Instruction.YieldValue
          || instruction instanceof Instruction.DelegateTo) {
        ++suspending;
        assertInstanceOf(Instruction.Resume.class, steps.get(i + 1).instruction());
      }
    }
    assertEquals(4, suspending);
  }

  @Test
  public void stepNamesAreUnique() throws Exception {
    Code code = Compiler.compile("counter", counterBody(), List.of("start", "step"));

    var names = code.steps().stream().map(Step::name).toList();
    assertEquals(names.size(), names.stream().distinct().count());
    for (var name : names) {
      assertEquals(names.indexOf(name), code.indexOf(name));
    }
  }

  @Test
  public void stepsInsideHandlerAreGuarded() throws Exception {
    var body =
        new HandlerCase(
            new Call(new Variable("raise"), List.of(new Quote(new Symbol("Oops")))),
            List.of(new Handler("Oops", Optional.empty(), new Literal("handled"))));
    Code code = Compiler.compile("guarded", body, List.of());

    var entry = code.steps().get(0).instruction();
    var guarded = assertInstanceOf(Instruction.Guarded.class, entry);
    assertEquals(1, guarded.handlers().size());
    assertEquals("Oops", guarded.handlers().get(0).pattern());
    assertFalse(
        code.steps().get(code.indexOf(code.finalStep())).instruction()
            instanceof Instruction.Guarded);
  }

  @Test
  public void compoundCallOperandsAreHoisted() throws Exception {
    // f(if (c) 1 else 2, x)
    var body =
        new Call(
            new Variable("f"),
            List.of(new If(new Variable("c"), new Literal(1), new Literal(2)), new Variable("x")));
    Code code = Compiler.compile("hoist", body, List.of("f", "c", "x"));

    assertEquals(3, countArgSlots(code));
  }

  @Test
  public void suspendingCallOperandIsRejected() throws Exception {
    var body =
        new Call(new Variable("print"), List.of(new Yield(new Literal(1), Optional.empty())));

    var e = assertThrows(CompileException.class, () -> Compiler.compile("bad", body, List.of()));
    assertTrue(e.getMessage().contains("suspends"), e.getMessage());
  }

  @Test
  public void assignmentToNonVariableIsRejected() throws Exception {
    var body = new Assign(new Literal(1), new Literal(2));

    assertThrows(CompileException.class, () -> Compiler.compile("bad", body, List.of()));
  }

  @Test
  public void duplicateParametersAreRejected() throws Exception {
    assertThrows(
        CompileException.class,
        () -> Compiler.compile("bad", new Literal(null), List.of("a", "a")));
  }

  @Test
  public void duplicateSimultaneousBindingsAreRejected() throws Exception {
    var body =
        new Let(
            Let.Mode.SIMULTANEOUS,
            List.of(new Binding("a", new Literal(1)), new Binding("a", new Literal(2))),
            new Variable("a"));

    assertThrows(CompileException.class, () -> Compiler.compile("bad", body, List.of()));
  }

  @Test
  public void emptyBindingNameIsRejected() throws Exception {
    assertThrows(CompileException.class, () -> new Binding("", new Literal(1)));
  }

  @Test
  public void shadowingBindingGetsFreshSlot() throws Exception {
    // let x = 1 { let x = 2 { x } }
    var body =
        new Let(
            Let.Mode.SEQUENTIAL,
            List.of(new Binding("x", new Literal(1))),
            new Let(
                Let.Mode.SEQUENTIAL, List.of(new Binding("x", new Literal(2))), new Variable("x")));
    Code code = Compiler.compile("shadow", body, List.of());

    assertEquals(2, code.slotNames().stream().filter("x"::equals).count());
  }

  // n = start; while (true) { yield n; n = n + step; }
  static Node counterBody() {
    return new Sequence(
        List.of(
            new Assign(new Variable("n"), new Variable("start")),
            new While(
                new Literal(true),
                new Sequence(
                    List.of(
                        new Yield(new Variable("n"), Optional.empty()),
                        new Assign(
                            new Variable("n"),
                            new Call(
                                new Variable("+"),
                                List.of(new Variable("n"), new Variable("step")))))))));
  }

  private static int countArgSlots(Code code) {
    return (int) code.slotNames().stream().filter("$arg"::equals).count();
  }
}
