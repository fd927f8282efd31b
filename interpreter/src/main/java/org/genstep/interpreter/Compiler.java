// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.genstep.interpreter;

import static org.genstep.interpreter.Program.debug;
import static org.genstep.interpreter.Program.logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.genstep.interpreter.Node.*;

/**
 * Compiles a program tree into a flat array of named steps.
 *
 * <p>Each node is compiled with the name of the step to continue at once the node's value is in
 * the value slot, and returns the name of the node's own entry step. Nodes are compiled back to
 * front so that every continuation already exists when it is referenced.
 */
class Compiler {
  private final CompilationContext ctx;

  private Compiler(CompilationContext ctx) {
    this.ctx = ctx;
  }

  public static Code compile(String name, Node body, List<String> parameters) {
    var ctx = new CompilationContext(name);
    var compiler = new Compiler(ctx);

    var parameterSlots = new ArrayList<Integer>();
    for (var parameter : parameters) {
      if (ctx.lookup(parameter).isPresent()) {
        throw new CompileException(
            "Duplicate parameter '%s' in definition of %s".formatted(parameter, name));
      }
      int slot = ctx.newSlot(parameter);
      ctx.bind(parameter, slot);
      parameterSlots.add(slot);
    }

    // Names assigned without an enclosing binding become locals of the whole body. They are
    // allocated up front because reads may be compiled before the assignment is.
    var assigned = new LinkedHashSet<String>();
    collectAssignedNames(body, assigned);
    for (var variable : assigned) {
      if (ctx.lookup(variable).isEmpty()) {
        ctx.bind(variable, ctx.newSlot(variable));
      }
    }

    ctx.addNamedStep(ctx.finalStep(), new Instruction.Finish());
    String returnStep =
        ctx.addStep("return", new Instruction.Store(Code.FINAL_SLOT, ctx.finalStep()));
    String entry = compiler.transform(body, returnStep);

    Code code = ctx.build(entry, parameterSlots);
    if (debug) {
      logger.log("Compiled %s:\n%s", name, code.dump(-1));
    }
    return code;
  }

  private String transform(Node node, String next) {
    if (isSimple(node)) {
      return ctx.addStep(kindOf(node), new Instruction.Evaluate(toExpression(node), next));
    } else if (node instanceof Sequence sequence) {
      return compileSequence(sequence, next);
    } else if (node instanceof If ifNode) {
      return compileIf(ifNode, next);
    } else if (node instanceof While whileNode) {
      return compileWhile(whileNode, next);
    } else if (node instanceof Let let) {
      return let.mode() == Let.Mode.SEQUENTIAL
          ? compileSequentialLet(let, next)
          : compileSimultaneousLet(let, next);
    } else if (node instanceof Assign assign) {
      return compileAssign(assign, next);
    } else if (node instanceof Call call) {
      return compileCall(call, next);
    } else if (node instanceof Yield yield) {
      return compileYield(yield, next);
    } else if (node instanceof Delegate delegate) {
      return compileDelegate(delegate, next);
    } else if (node instanceof HandlerCase handlerCase) {
      return compileHandlerCase(handlerCase, next);
    } else {
      throw new CompileException(
          "Unsupported node type %s in %s: %s"
              .formatted(
                  node == null ? "null" : node.getClass().getSimpleName(), ctx.name(), node));
    }
  }

  private String compileSequence(Sequence sequence, String next) {
    var elements = sequence.elements();
    if (elements.isEmpty()) {
      return transform(new Literal(null), next);
    }
    String entry = next;
    for (int i = elements.size() - 1; i >= 0; --i) {
      entry = transform(elements.get(i), entry);
    }
    return entry;
  }

  private String compileIf(If ifNode, String next) {
    // if (CONDITION) THEN else ELSE
    //
    // compiles to steps:
    //   [if#n]   eval CONDITION, jump to then#.. or else#..
    //   [then#.] execute THEN, jump to NEXT
    //   [else#.] execute ELSE, jump to NEXT
    //
    // A compound CONDITION is compiled into steps of its own that continue at the branch step.
    String elseEntry = transform(ifNode.elseBranch(), next);
    String thenEntry = transform(ifNode.thenBranch(), next);
    return compileWithOperand(
        ifNode.condition(), "if", test -> new Instruction.Branch(test, thenEntry, elseEntry));
  }

  private String compileWhile(While whileNode, String next) {
    // while (TEST) BODY
    //
    // compiles to steps:
    //   [loop#n]  eval TEST, jump to BODY if true, else to loop-exit
    //   [.....]   execute BODY, jump to loop#n
    //   [exit#.]  store null, jump to NEXT
    String loopHead = ctx.newStepName("loop");
    String exit =
        ctx.addStep("loop-exit", new Instruction.Evaluate(new Expression.Constant(null), next));
    String bodyEntry = transform(whileNode.body(), loopHead);
    Node test = whileNode.test();
    if (isSimple(test)) {
      return ctx.addNamedStep(
          loopHead, new Instruction.Branch(toExpression(test), bodyEntry, exit));
    }
    String branch = ctx.addStep("loop-test", new Instruction.Branch(valueRef(), bodyEntry, exit));
    String testEntry = transform(test, branch);
    return ctx.addNamedStep(loopHead, new Instruction.Goto(testEntry));
  }

  private String compileSequentialLet(Let let, String next) {
    // let A = INIT_A, B = INIT_B { BODY }
    //
    // compiles to steps:
    //   [...]  eval INIT_A
    //   [...]  store A
    //   [...]  eval INIT_B (A in scope)
    //   [...]  store B
    //   [...]  execute BODY (A and B in scope), jump to NEXT
    var bindings = let.bindings();
    var scopes = new ArrayList<HashMap<String, Integer>>();
    var slots = new ArrayList<Integer>();
    var scope = new HashMap<>(ctx.bindings());
    for (var binding : bindings) {
      scopes.add(new HashMap<>(scope));
      int slot = ctx.newSlot(binding.name());
      slots.add(slot);
      scope.put(binding.name(), slot);
    }

    String entry = ctx.withBindings(scope, () -> transform(let.body(), next));
    for (int i = bindings.size() - 1; i >= 0; --i) {
      String store = ctx.addStep("let", new Instruction.Store(slots.get(i), entry));
      Node init = bindings.get(i).init();
      entry = ctx.withBindings(scopes.get(i), () -> transform(init, store));
    }
    return entry;
  }

  private String compileSimultaneousLet(Let let, String next) {
    // Every initializer is evaluated in the enclosing scope into a temporary slot. A single bind
    // step then copies all temporaries into the variables before BODY runs.
    var bindings = let.bindings();
    var names = new HashSet<String>();
    var temporaries = new ArrayList<Integer>();
    var slots = new ArrayList<Integer>();
    var scope = new HashMap<>(ctx.bindings());
    for (var binding : bindings) {
      if (!names.add(binding.name())) {
        throw new CompileException(
            "Variable '%s' bound more than once in simultaneous binding block of %s"
                .formatted(binding.name(), ctx.name()));
      }
      temporaries.add(ctx.newSlot("$" + binding.name()));
      int slot = ctx.newSlot(binding.name());
      slots.add(slot);
      scope.put(binding.name(), slot);
    }

    String bodyEntry = ctx.withBindings(scope, () -> transform(let.body(), next));
    String entry = ctx.addStep("bind", new Instruction.Bind(temporaries, slots, bodyEntry));
    for (int i = bindings.size() - 1; i >= 0; --i) {
      String store = ctx.addStep("bind-init", new Instruction.Store(temporaries.get(i), entry));
      entry = transform(bindings.get(i).init(), store);
    }
    return entry;
  }

  private String compileAssign(Assign assign, String next) {
    if (!(assign.target() instanceof Variable variable)) {
      throw new CompileException(
          "Cannot assign to %s in %s; assignment target must be a variable"
              .formatted(assign.target(), ctx.name()));
    }
    int slot =
        ctx.lookup(variable.name())
            .orElseGet(
                () -> {
                  int newSlot = ctx.newSlot(variable.name());
                  ctx.bind(variable.name(), newSlot);
                  return newSlot;
                });
    String store = ctx.addStep("assign", new Instruction.Store(slot, next));
    return transform(assign.value(), store);
  }

  private String compileCall(Call call, String next) {
    var operands = new ArrayList<Node>();
    operands.add(call.function());
    operands.addAll(call.args());
    for (var operand : operands) {
      if (suspends(operand)) {
        throw new CompileException(
            "Call in %s has an operand that suspends, which is not supported: %s"
                .formatted(ctx.name(), operand));
      }
    }

    // Operands that can't be evaluated within a single step are evaluated beforehand, left to
    // right, into temporary slots.
    var temporaries = new ArrayList<Integer>();
    var args = new ArrayList<Expression>();
    for (var operand : operands) {
      int slot = ctx.newSlot("$arg");
      temporaries.add(slot);
      args.add(new Expression.SlotRef(slot, "$arg"));
    }
    var invoke = new Expression.Invoke(args.get(0), args.subList(1, args.size()));
    String entry = ctx.addStep("call", new Instruction.Evaluate(invoke, next));
    for (int i = operands.size() - 1; i >= 0; --i) {
      String store = ctx.addStep("arg", new Instruction.Store(temporaries.get(i), entry));
      entry = transform(operands.get(i), store);
    }
    return entry;
  }

  private String compileYield(Yield yield, String next) {
    // The resume step must directly follow the yield step: execution continues at the next step
    // in array order after a suspension.
    ctx.addStep("resume", new Instruction.Resume(next));
    return compileWithOperand(
        yield.value(), "yield", value -> new Instruction.YieldValue(value, yield.tag()));
  }

  private String compileDelegate(Delegate delegate, String next) {
    ctx.addStep("resume", new Instruction.Resume(next));
    return compileWithOperand(delegate.iterator(), "delegate", Instruction.DelegateTo::new);
  }

  private String compileHandlerCase(HandlerCase handlerCase, String next) {
    // Handler bodies run under the enclosing handlers only, and continue at NEXT like the
    // protected body does.
    var handlers = new ArrayList<Instruction.HandlerEntry>();
    for (var handler : handlerCase.handlers()) {
      String handlerEntry;
      if (handler.variable().isPresent()) {
        String variable = handler.variable().get();
        int slot = ctx.newSlot(variable);
        var scope = new HashMap<>(ctx.bindings());
        scope.put(variable, slot);
        String bodyEntry = ctx.withBindings(scope, () -> transform(handler.body(), next));
        handlerEntry = ctx.addStep("catch", new Instruction.Store(slot, bodyEntry));
      } else {
        handlerEntry = transform(handler.body(), next);
      }
      handlers.add(new Instruction.HandlerEntry(handler.pattern(), handlerEntry));
    }
    handlers.addAll(ctx.handlers());
    return ctx.withHandlers(handlers, () -> transform(handlerCase.body(), next));
  }

  /**
   * Adds the step that consumes {@code operand}. A simple operand is evaluated by the consuming
   * step itself; otherwise the operand is compiled ahead of it and consumed from the value slot.
   */
  private String compileWithOperand(
      Node operand, String kind, java.util.function.Function<Expression, Instruction> consumer) {
    if (isSimple(operand)) {
      return ctx.addStep(kind, consumer.apply(toExpression(operand)));
    }
    String step = ctx.addStep(kind, consumer.apply(valueRef()));
    return transform(operand, step);
  }

  private static Expression valueRef() {
    return new Expression.SlotRef(Code.VALUE_SLOT, "$value");
  }

  /** Whether {@code node} can be evaluated within a single step. */
  private static boolean isSimple(Node node) {
    if (node instanceof Literal || node instanceof Variable || node instanceof Quote) {
      return true;
    }
    if (node instanceof Call call) {
      return isSimple(call.function()) && call.args().stream().allMatch(Compiler::isSimple);
    }
    return false;
  }

  private Expression toExpression(Node node) {
    if (node instanceof Literal literal) {
      return new Expression.Constant(literal.value());
    } else if (node instanceof Quote quote) {
      return new Expression.Constant(quote.datum());
    } else if (node instanceof Variable variable) {
      return ctx.lookup(variable.name())
          .<Expression>map(slot -> new Expression.SlotRef(slot, variable.name()))
          .orElseGet(() -> new Expression.GlobalRef(variable.name()));
    } else if (node instanceof Call call) {
      return new Expression.Invoke(
          toExpression(call.function()), call.args().stream().map(this::toExpression).toList());
    }
    throw new CompileException("Not a simple expression: " + node);
  }

  private static String kindOf(Node node) {
    if (node instanceof Call) {
      return "call";
    } else if (node instanceof Variable) {
      return "var";
    } else if (node instanceof Quote) {
      return "quote";
    }
    return "literal";
  }

  /** Whether evaluating {@code node} may suspend the generator. */
  static boolean suspends(Node node) {
    if (node instanceof Yield || node instanceof Delegate) {
      return true;
    } else if (node instanceof Sequence sequence) {
      return sequence.elements().stream().anyMatch(Compiler::suspends);
    } else if (node instanceof If ifNode) {
      return suspends(ifNode.condition())
          || suspends(ifNode.thenBranch())
          || suspends(ifNode.elseBranch());
    } else if (node instanceof While whileNode) {
      return suspends(whileNode.test()) || suspends(whileNode.body());
    } else if (node instanceof Let let) {
      return suspends(let.body()) || let.bindings().stream().anyMatch(b -> suspends(b.init()));
    } else if (node instanceof Assign assign) {
      return suspends(assign.value());
    } else if (node instanceof Call call) {
      return suspends(call.function()) || call.args().stream().anyMatch(Compiler::suspends);
    } else if (node instanceof HandlerCase handlerCase) {
      return suspends(handlerCase.body())
          || handlerCase.handlers().stream().anyMatch(h -> suspends(h.body()));
    }
    return false;
  }

  private static void collectAssignedNames(Node node, Set<String> names) {
    collectAssignedNames(node, Set.of(), names);
  }

  // Assignments to a name bound by an enclosing let or handler variable target that binding.
  private static void collectAssignedNames(Node node, Set<String> bound, Set<String> names) {
    if (node instanceof Assign assign) {
      if (assign.target() instanceof Variable variable && !bound.contains(variable.name())) {
        names.add(variable.name());
      }
      collectAssignedNames(assign.value(), bound, names);
    } else if (node instanceof Sequence sequence) {
      sequence.elements().forEach(element -> collectAssignedNames(element, bound, names));
    } else if (node instanceof If ifNode) {
      collectAssignedNames(ifNode.condition(), bound, names);
      collectAssignedNames(ifNode.thenBranch(), bound, names);
      collectAssignedNames(ifNode.elseBranch(), bound, names);
    } else if (node instanceof While whileNode) {
      collectAssignedNames(whileNode.test(), bound, names);
      collectAssignedNames(whileNode.body(), bound, names);
    } else if (node instanceof Let let) {
      var inner = new HashSet<>(bound);
      for (var binding : let.bindings()) {
        collectAssignedNames(
            binding.init(), let.mode() == Let.Mode.SEQUENTIAL ? Set.copyOf(inner) : bound, names);
        inner.add(binding.name());
      }
      collectAssignedNames(let.body(), inner, names);
    } else if (node instanceof Call call) {
      collectAssignedNames(call.function(), bound, names);
      call.args().forEach(arg -> collectAssignedNames(arg, bound, names));
    } else if (node instanceof Yield yield) {
      collectAssignedNames(yield.value(), bound, names);
    } else if (node instanceof Delegate delegate) {
      collectAssignedNames(delegate.iterator(), bound, names);
    } else if (node instanceof HandlerCase handlerCase) {
      collectAssignedNames(handlerCase.body(), bound, names);
      for (var handler : handlerCase.handlers()) {
        var inner = bound;
        if (handler.variable().isPresent()) {
          inner = new HashSet<>(bound);
          inner.add(handler.variable().get());
        }
        collectAssignedNames(handler.body(), inner, names);
      }
    }
  }
}
