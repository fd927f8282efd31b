// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.genstep.parser.GenstepParser;
import org.junit.jupiter.api.Test;

public class GeneratorTest {
  private static final String FIB =
      """
      def fib(count) {
        a = 0;
        b = 1;
        i = 0;
        while (i < count) {
          yield a;
          t = a + b;
          a = b;
          b = t;
          i = i + 1;
        }
      }
      """;

  private Program program;

  @Test
  public void literalProgramFinishesInOneAdvance() throws Exception {
    var generator = start("def lit() { 1; \"two\"; 3; }", "lit");

    assertEquals(Status.done(3), generator.advance());
    assertTrue(generator.isTerminated());
  }

  @Test
  public void emptyBodyFinishesWithNull() throws Exception {
    var generator = start("def empty() {}", "empty");

    assertEquals(Status.done(null), generator.advance());
  }

  @Test
  public void counterYieldsIndefinitely() throws Exception {
    var generator =
        start(
            """
            def counter(start, step) {
              n = start;
              while (true) {
                yield n;
                n = n + step;
              }
            }
            """,
            "counter",
            0,
            1);

    assertEquals(Status.yielded(0), generator.advance());
    assertEquals(Status.yielded(1), generator.advance("any"));
    assertEquals(Status.yielded(2), generator.advance(42));
    for (int i = 3; i < 100; ++i) {
      assertEquals(Status.yielded(i), generator.advance());
    }
    assertTrue(generator.isSuspended());
  }

  @Test
  public void firstResumeValueIsIgnored() throws Exception {
    var generator = start("def echo() { x = yield 1; yield x; }", "echo");

    assertEquals(Status.yielded(1), generator.advance("dropped"));
    assertEquals(Status.yielded("kept"), generator.advance("kept"));
  }

  @Test
  public void delegationIsTransparent() throws Exception {
    var generator =
        start(
            FIB
                + """
                def main() {
                  yield "intro";
                  yield* fib(5);
                  yield "outro";
                }
                """,
            "main");

    assertEquals(Status.yielded("intro"), generator.advance());
    assertEquals(Status.yielded(0), generator.advance());
    assertEquals(Status.yielded(1), generator.advance());
    assertEquals(Status.yielded(1), generator.advance());
    assertEquals(Status.yielded(2), generator.advance());
    assertEquals(Status.yielded(3), generator.advance());
    assertEquals(Status.yielded("outro"), generator.advance());
    assertEquals(Status.done(null), generator.advance());
  }

  @Test
  public void delegateFinalValueIsDelegationValue() throws Exception {
    var generator =
        start(
            """
            def inner() {
              x = yield "inner";
              "inner got " + x;
            }
            def outer() {
              result = yield* inner();
              yield result;
            }
            """,
            "outer");

    assertEquals(Status.yielded("inner"), generator.advance());
    assertEquals(Status.yielded("inner got sent"), generator.advance("sent"));
  }

  @Test
  public void delegateThatNeverYieldsContinuesParent() throws Exception {
    var generator =
        start(
            """
            def nothing() { 7; }
            def outer() {
              x = yield* nothing();
              yield x + 1;
            }
            """,
            "outer");

    assertEquals(Status.yielded(8), generator.advance());
  }

  @Test
  public void variablesSurviveSuspension() throws Exception {
    var generator =
        start(
            """
            def keep() {
              total = 0;
              x = yield "first";
              total = total + x;
              y = yield "second";
              total = total + y;
              yield total;
            }
            """,
            "keep");

    assertEquals(Status.yielded("first"), generator.advance());
    assertEquals(Status.yielded("second"), generator.advance(5));
    assertEquals(Status.yielded(12), generator.advance(7));
  }

  @Test
  public void instancesDoNotShareState() throws Exception {
    program = newProgram(FIB);
    var first = program.start("fib", 3);
    var second = program.start("fib", 3);

    assertEquals(Status.yielded(0), first.advance());
    assertEquals(Status.yielded(1), first.advance());
    assertEquals(Status.yielded(0), second.advance());
    assertEquals(Status.yielded(1), first.advance());
    assertEquals(Status.yielded(1), second.advance());
  }

  @Test
  public void handledConditionDoesNotTerminate() throws Exception {
    var generator =
        start(
            """
            def safe() {
              try {
                let x = 1 {
                  yield x;
                  raise(#Oops, 42);
                  yield "unreachable";
                }
              } catch (Oops c) {
                yield condition_payload(c);
              }
              yield "after";
            }
            """,
            "safe");

    assertEquals(Status.yielded(1), generator.advance());
    assertEquals(Status.yielded(42), generator.advance());
    assertEquals(Status.yielded("after"), generator.advance());
    assertEquals(Status.done(null), generator.advance());
  }

  @Test
  public void unhandledConditionIsTerminalError() throws Exception {
    var generator =
        start(
            """
            def bad() {
              try {
                yield 1;
                raise(#Boom, "payload");
              } catch (Other e) {
                yield "wrong handler";
              }
              yield 2;
            }
            """,
            "bad");

    assertEquals(Status.yielded(1), generator.advance());
    var status = generator.advance();
    assertEquals(Status.Kind.ERROR, status.kind());
    assertEquals("Boom", status.error().tag);
    assertEquals("payload", status.error().payload);
    assertTrue(generator.isTerminated());
    assertFalse(generator.isSuspended());
  }

  @Test
  public void terminalGeneratorAlwaysThrows() throws Exception {
    var done = start("def one() { yield 1; }", "one");
    assertEquals(Status.yielded(1), done.advance());
    assertEquals(Status.done(null), done.advance());
    assertThrows(IllegalStateException.class, () -> done.advance());
    assertThrows(IllegalStateException.class, () -> done.advance());
    assertThrows(IllegalStateException.class, () -> done.advance("value"));

    var failed = start("def fail() { raise(#Boom); }", "fail");
    assertEquals(Status.Kind.ERROR, failed.advance().kind());
    assertThrows(IllegalStateException.class, () -> failed.advance());
    assertThrows(IllegalStateException.class, () -> failed.advance());
    assertThrows(IllegalStateException.class, () -> failed.raise(new RaisedCondition("X", null)));
  }

  @Test
  public void wildcardHandlerCatchesEverything() throws Exception {
    var generator =
        start(
            """
            def wild() {
              try {
                yield nope;
              } catch (* e) {
                yield condition_tag(e);
              }
            }
            """,
            "wild");

    assertEquals(Status.yielded(new Symbol("UnboundVariable")), generator.advance());
  }

  @Test
  public void innermostMatchingHandlerWins() throws Exception {
    var generator =
        start(
            """
            def nested() {
              try {
                try {
                  raise(#Inner);
                } catch (Inner e) {
                  yield "inner caught Inner";
                }
                try {
                  raise(#Outer);
                } catch (Inner e) {
                  yield "inner caught Outer";
                }
              } catch (Outer e) {
                yield "outer caught Outer";
              }
            }
            """,
            "nested");

    assertEquals(Status.yielded("inner caught Inner"), generator.advance());
    assertEquals(Status.yielded("outer caught Outer"), generator.advance());
    assertEquals(Status.done(null), generator.advance());
  }

  @Test
  public void conditionInHandlerBodyGoesToEnclosingHandler() throws Exception {
    var generator =
        start(
            """
            def rethrow() {
              try {
                try {
                  raise(#First);
                } catch (First e) {
                  raise(#Second);
                }
              } catch (Second e) {
                yield "second";
              }
            }
            """,
            "rethrow");

    assertEquals(Status.yielded("second"), generator.advance());
  }

  @Test
  public void delegateConditionIsHandledByParent() throws Exception {
    var generator =
        start(
            """
            def failing() {
              yield 1;
              raise(#Bad, "from child");
            }
            def parent() {
              try {
                yield* failing();
              } catch (Bad e) {
                yield condition_payload(e);
              }
              yield "end";
            }
            """,
            "parent");

    assertEquals(Status.yielded(1), generator.advance());
    assertEquals(Status.yielded("from child"), generator.advance());
    assertEquals(Status.yielded("end"), generator.advance());
    assertEquals(Status.done(null), generator.advance());
  }

  @Test
  public void delegateHandlersDoNotApplyToParent() throws Exception {
    var generator =
        start(
            """
            def child() {
              try {
                yield 1;
              } catch (Bad e) {
                yield "child handled";
              }
            }
            def parent() {
              yield* child();
              raise(#Bad);
            }
            """,
            "parent");

    assertEquals(Status.yielded(1), generator.advance());
    var status = generator.advance();
    assertEquals(Status.Kind.ERROR, status.kind());
    assertEquals("Bad", status.error().tag);
  }

  @Test
  public void unhandledDelegateConditionFailsParent() throws Exception {
    var generator =
        start(
            """
            def failing() { raise(#Bad); }
            def parent() { yield* failing(); yield "unreachable"; }
            """,
            "parent");

    var status = generator.advance();
    assertEquals(Status.Kind.ERROR, status.kind());
    assertEquals("Bad", status.error().tag);
    assertThrows(IllegalStateException.class, () -> generator.advance());
  }

  @Test
  public void delegatingToFinishedGeneratorIsCondition() throws Exception {
    program = newProgram("def parent(g) { try { yield* g; } catch (* e) { yield \"caught\"; } }");
    program.parse(GenstepParser.parse("generator_test.gs", "def one() { 1; }"));
    var finished = program.start("one");
    assertEquals(Status.done(1), finished.advance());

    var parent = program.start("parent", finished);
    assertEquals(Status.yielded("caught"), parent.advance());
  }

  @Test
  public void selfDelegationIsCondition() throws Exception {
    program = newProgram("def selfish() { yield* me; }");
    var generator = program.start("selfish");
    program.globals().set("me", generator);

    var status = generator.advance();
    assertEquals(Status.Kind.ERROR, status.kind());
    assertEquals("IllegalStateException", status.error().tag);
  }

  @Test
  public void delegateToHostIterables() throws Exception {
    var generator =
        start(
            """
            def items() {
              yield* range(0, 3);
              yield* list("a", "b");
              yield "done";
            }
            """,
            "items");

    var values = new ArrayList<Object>();
    for (var value : generator) {
      values.add(value);
    }
    assertEquals(List.of(0, 1, 2, "a", "b", "done"), values);
  }

  @Test
  public void delegatingToNonIterableIsTypeError() throws Exception {
    var generator =
        start(
            """
            def bad() {
              try {
                yield* 5;
              } catch (TypeError e) {
                yield "not iterable";
              }
            }
            """,
            "bad");

    assertEquals(Status.yielded("not iterable"), generator.advance());
  }

  @Test
  public void taggedYield() throws Exception {
    var generator = start("def progress() { yield @percent 50; yield 100; }", "progress");

    assertEquals(Status.yielded(50, Optional.of("percent")), generator.advance());
    assertEquals(Status.yielded(100), generator.advance());
  }

  @Test
  public void raiseIntoSuspendedGenerator() throws Exception {
    var generator =
        start(
            """
            def stoppable() {
              try {
                yield 1;
                yield 2;
              } catch (Stop c) {
                yield "stopped";
              }
            }
            """,
            "stoppable");

    assertEquals(Status.yielded(1), generator.advance());
    assertEquals(Status.yielded("stopped"), generator.raise(new RaisedCondition("Stop", null)));
    assertEquals(Status.done(null), generator.advance());
  }

  @Test
  public void raiseWithoutHandlerFails() throws Exception {
    var generator = start("def plain() { yield 1; yield 2; }", "plain");
    assertEquals(Status.yielded(1), generator.advance());

    var condition = new RaisedCondition("Stop", "now");
    assertEquals(Status.error(condition), generator.raise(condition));
    assertTrue(generator.isTerminated());
  }

  @Test
  public void raiseIsForwardedToDelegate() throws Exception {
    var generator =
        start(
            """
            def child() {
              try {
                yield "child";
              } catch (Stop c) {
                yield "child stopped";
              }
            }
            def parent() {
              yield* child();
              yield "parent";
            }
            """,
            "parent");

    assertEquals(Status.yielded("child"), generator.advance());
    assertEquals(
        Status.yielded("child stopped"), generator.raise(new RaisedCondition("Stop", null)));
    assertEquals(Status.yielded("parent"), generator.advance());
  }

  @Test
  public void raiseIntoUnstartedGenerator() throws Exception {
    var generator = start("def never() { yield 1; }", "never");

    var condition = new RaisedCondition("Stop", null);
    assertEquals(Status.error(condition), generator.raise(condition));
    assertTrue(generator.isTerminated());
    assertThrows(IllegalStateException.class, () -> generator.advance());
  }

  @Test
  public void closeAbandonsGenerator() throws Exception {
    var output = new ArrayList<String>();
    program = newProgram("def chatty() { yield 1; print(\"resumed\"); yield 2; }");
    program.stdout = output::add;
    var generator = program.start("chatty");

    assertEquals(Status.yielded(1), generator.advance());
    assertTrue(generator.isSuspended());
    generator.close();
    assertTrue(generator.isTerminated());
    assertFalse(generator.isSuspended());
    assertThrows(IllegalStateException.class, () -> generator.advance());
    assertTrue(output.isEmpty());
  }

  @Test
  public void closeAlsoClosesDelegate() throws Exception {
    program = newProgram(FIB + "def outer(inner) { yield* inner; }");
    var inner = program.start("fib", 10);
    var outer = program.start("outer", inner);

    assertEquals(Status.yielded(0), outer.advance());
    outer.close();
    assertTrue(inner.isTerminated());
  }

  @Test
  public void iteratorSurfacesError() throws Exception {
    var generator = start("def fails() { yield 1; raise(#Broken); }", "fails");

    var iterator = generator.iterator();
    assertTrue(iterator.hasNext());
    assertEquals(1, iterator.next());
    var e = assertThrows(RaisedCondition.class, iterator::hasNext);
    assertEquals("Broken", e.tag);
  }

  @Test
  public void lifecycleFlags() throws Exception {
    var generator = start("def once() { yield 1; }", "once");
    assertFalse(generator.isSuspended());
    assertFalse(generator.isTerminated());

    generator.advance();
    assertTrue(generator.isSuspended());
    assertEquals("<generator once (suspended)>", generator.toString());

    generator.advance();
    assertFalse(generator.isSuspended());
    assertTrue(generator.isTerminated());
  }

  private Generator start(String source, String name, Object... args) {
    program = newProgram(source);
    return program.start(name, args);
  }

  private static Program newProgram(String source) {
    return new Program().parse(GenstepParser.parse("generator_test.gs", source));
  }
}
