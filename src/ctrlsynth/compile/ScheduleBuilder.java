package ctrlsynth.compile;

import ctrlsynth.backend.StateMachine;
import ctrlsynth.backend.Transition;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Schedules the nodes of one control scope into a {@link Schedule}.
 * <p>
 * Each step takes the predecessor edges that lead into a node and returns the node's exit edges. Units get one state each;
 * {@code seq} threads the edges left to right, and loops are scheduled against a virtual head that is replaced by the real
 * entry and back edges once the body's exits are known.
 */
public class ScheduleBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  final CompilationContext ctx;
  final StateNumbering numbering;
  final Schedule schedule;
  final Guard scopeGo;
  private final ConditionCompiler conditions;

  ScheduleBuilder(CompilationContext ctx, StateNumbering numbering, Schedule schedule, Guard scopeGo) {
    this.ctx = ctx;
    this.numbering = numbering;
    this.schedule = schedule;
    this.scopeGo = scopeGo;
    this.conditions = new ConditionCompiler(this);
  }

  /**
   * Compiles a control tree into its own FSM scope.
   * @param fsmName name of the scope's state register
   * @param scopeGo go signal of the scope
   * @param parChild the scope runs as a child of a parallel composition; its done must not depend combinationally on its go
   * @param restart if non-null, the condition under which the parent restarts this scope in its completing cycle
   */
  public static ScopeResult compileScope(CompilationContext ctx, String fsmName, ControlNode node, Guard scopeGo, boolean parChild,
                                         Guard restart) throws CompileError {
    StateNumbering numbering = StateNumbering.compute(ctx, node);
    Schedule schedule = new Schedule(fsmName, numbering.size());
    ScheduleBuilder builder = new ScheduleBuilder(ctx, numbering, schedule, scopeGo);
    List<PredEdge> exits = builder.compile(node, List.of(new PredEdge(0, Guard.TRUE)));

    List<PredEdge> doneEdges = exits;
    if (parChild) {
      // exits decided by a comb group go through a registered final state
      doneEdges = new ArrayList<>();
      Integer finalState = null;
      for (PredEdge exit : exits) {
        if (!exit.combCond()) {
          doneEdges.add(exit);
          continue;
        }
        if (finalState == null)
          finalState = schedule.freshState();
        schedule.transition(exit.state(), finalState, exit.guard());
      }
      if (finalState != null)
        doneEdges.add(new PredEdge(finalState, Guard.TRUE));
    }
    if (restart != null)
      builder.addRestart(doneEdges, restart);

    if (ctx.config.dump_fsm)
      logger.debug("{}  exits: {}", schedule, doneEdges.stream().map(PredEdge::toString).collect(Collectors.joining(", ")));
    return schedule.realize(scopeGo, doneEdges);
  }

  /**
   * Compiles a node entered over the given predecessor edges.
   * @return the edges on which the node completes
   */
  public List<PredEdge> compile(ControlNode node, List<PredEdge> preds) throws CompileError {
    if (ctx.isAtomic(node))
      return compileUnit(node, preds);
    if (node instanceof ControlNode.Empty)
      return preds;
    if (node instanceof ControlNode.Seq) {
      ControlNode.Seq seq = (ControlNode.Seq)node;
      List<PredEdge> cur = preds;
      for (ControlNode child : seq.stmts)
        cur = compile(child, cur);
      return cur;
    }
    if (node instanceof ControlNode.If)
      return conditions.compileIf((ControlNode.If)node, preds);
    if (node instanceof ControlNode.While)
      return conditions.compileWhile((ControlNode.While)node, preds);
    if (node instanceof ControlNode.Repeat)
      return compileRepeat((ControlNode.Repeat)node, preds);
    throw new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Cannot schedule " + node);
  }

  private List<PredEdge> compileUnit(ControlNode node, List<PredEdge> preds) throws CompileError {
    ControlUnit unit = ctx.unitOf(node);
    int state = numbering.unitState(node);
    enterState(state, preds, unit.go());
    schedule.enable(state, unit.go(), unit.doneGuard().not(), Schedule.EnableKind.STEADY);
    return List.of(new PredEdge(state, unit.doneGuard()));
  }

  /**
   * Adds the transitions from each predecessor into a state. If {@code earlyGo} is given, it is also asserted in the
   * predecessor's completing cycle, unless that predecessor is still settling a condition.
   * A single unconditional predecessor that already is the state needs no transition.
   */
  void enterState(int state, List<PredEdge> preds, Port earlyGo) {
    if (preds.size() == 1 && preds.get(0).state() == state && preds.get(0).guard().isTrue())
      return;
    for (PredEdge pred : preds) {
      if (pred.guard().isFalse())
        continue;
      schedule.transition(pred.state(), state, pred.guard());
      if (earlyGo != null && ctx.config.early_transitions && !pred.settling())
        schedule.enable(pred.state(), earlyGo, pred.guard(), Schedule.EnableKind.EARLY);
    }
  }

  /**
   * Bounded loop with an iteration counter. The counter advances on every back edge and returns to 0 on the exit.
   */
  private List<PredEdge> compileRepeat(ControlNode.Repeat repeat, List<PredEdge> preds) throws CompileError {
    int count = repeat.count;
    String counter = ctx.freshName("idx");
    int head = schedule.openVirtual();
    List<PredEdge> bodyExits = schedule.fixZeroTime(head, compile(repeat.body, List.of(new PredEdge(head, Guard.TRUE))));

    Guard last = Guard.stateEquals(counter, count - 1);
    List<Transition> counterTransitions = new ArrayList<>();
    List<PredEdge> entry = new ArrayList<>(preds);
    List<PredEdge> exits = new ArrayList<>();
    for (PredEdge exit : bodyExits) {
      Guard completes = schedule.inState(exit.state()).and(exit.guard());
      counterTransitions.add(Transition.increment(Transition.ANY, scopeGo.and(completes).and(last.not())));
      counterTransitions.add(Transition.to(Transition.ANY, completes.and(last), 0));
      entry.add(exit.and(last.not()));
      exits.add(exit.and(last));
    }
    schedule.addExtraMachine(new StateMachine(counter, StateMachine.Kind.COUNTER, count, counterTransitions));
    schedule.resolveVirtual(head, entry);
    return exits;
  }

  /**
   * Lets the parent restart the scope in its completing cycle: the unit merged into state 0 is started again on every done
   * edge. Only possible if state 0 runs exactly one unit.
   */
  private void addRestart(List<PredEdge> doneEdges, Guard restart) {
    List<Schedule.StateEnable> entryUnits = schedule.steadyEnablesAtEntry();
    if (entryUnits.size() != 1)
      return;
    Port unitGo = entryUnits.get(0).dest();
    for (PredEdge exit : doneEdges)
      schedule.enable(exit.state(), unitGo, exit.guard().and(restart), Schedule.EnableKind.EARLY);
  }
}
