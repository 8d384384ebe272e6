package ctrlsynth.compile;

import ctrlsynth.backend.StateMachine;
import ctrlsynth.backend.Transition;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Transition table and per-state enables of one control scope, before realization as an FSM.
 * <p>
 * States are the numbers from {@link StateNumbering} plus states allocated while scheduling. Negative numbers are virtual loop
 * heads that get replaced by the real entry edges once a loop body has been scheduled.
 */
public class Schedule {
  public enum EnableKind {
    /** Holds a unit's go while its state is active and it has not signalled done. */
    STEADY,
    /** Starts the next unit in the cycle its predecessor completes. */
    EARLY,
    /** Enables a comb condition group in the cycle its value is consumed. */
    HOIST
  }

  public record StateEnable(Port dest, Guard guard, EnableKind kind) {}

  /**
   * @param gated only taken while the scope's go is asserted; exits back to state 0 are not gated
   */
  public record Edge(int from, int to, Guard guard, boolean gated) {}

  public final String fsmName;
  private final TreeMap<Integer, List<StateEnable>> enables = new TreeMap<>();
  private final List<Edge> edges = new ArrayList<>();
  /** Assignments built outside the table that test this scope's states by number. */
  private final List<Assignment> extraAssignments = new ArrayList<>();
  private final List<StateMachine> extraMachines = new ArrayList<>();
  private int nextState;
  private int nextVirtual = -1;

  public Schedule(String fsmName, int numberedStates) {
    this.fsmName = fsmName;
    this.nextState = numberedStates;
  }

  public int freshState() { return nextState++; }

  public int openVirtual() { return nextVirtual--; }

  public Guard inState(int state) { return Guard.stateEquals(fsmName, state); }

  public void enable(int state, Port dest, Guard guard, EnableKind kind) {
    if (guard.isFalse())
      return;
    List<StateEnable> list = enables.computeIfAbsent(state, s -> new ArrayList<>());
    StateEnable entry = new StateEnable(dest, guard, kind);
    if (!list.contains(entry))
      list.add(entry);
  }

  public void transition(int from, int to, Guard guard) {
    if (guard.isFalse())
      return;
    edges.add(new Edge(from, to, guard, true));
  }

  public void addExtraAssignment(Assignment assignment) { extraAssignments.add(assignment); }
  public void addExtraMachine(StateMachine machine) { extraMachines.add(machine); }

  /**
   * Replaces a virtual loop head by the given entry edges: every enable and transition recorded at the virtual state is
   * duplicated for each entry edge. Early starts are not duplicated onto settling edges.
   */
  public void resolveVirtual(int virtual, List<PredEdge> entry) {
    List<StateEnable> virtualEnables = enables.remove(virtual);
    if (virtualEnables != null) {
      for (StateEnable se : virtualEnables) {
        for (PredEdge pred : entry) {
          if (se.kind() == EnableKind.EARLY && pred.settling())
            continue;
          enable(pred.state(), se.dest(), pred.guard().and(se.guard()), se.kind());
        }
      }
    }
    List<Edge> virtualEdges = new ArrayList<>();
    for (Iterator<Edge> it = edges.iterator(); it.hasNext();) {
      Edge edge = it.next();
      if (edge.from() == virtual) {
        virtualEdges.add(edge);
        it.remove();
      }
    }
    for (Edge edge : virtualEdges) {
      for (PredEdge pred : entry)
        transition(pred.state(), edge.to(), pred.guard().and(edge.guard()));
    }
  }

  /**
   * Routes loop body exits that leave straight from the virtual head (a body that can complete without taking a cycle)
   * through a fresh one-cycle state.
   */
  public List<PredEdge> fixZeroTime(int virtual, List<PredEdge> exits) {
    List<PredEdge> ret = new ArrayList<>();
    Integer pause = null;
    for (PredEdge exit : exits) {
      if (exit.state() != virtual) {
        ret.add(exit);
        continue;
      }
      if (pause == null) {
        pause = freshState();
        ret.add(new PredEdge(pause, Guard.TRUE));
      }
      transition(virtual, pause, exit.guard());
    }
    return ret;
  }

  /** Enables recorded at state 0 that keep a unit running. */
  List<StateEnable> steadyEnablesAtEntry() {
    return enables.getOrDefault(0, List.of()).stream().filter(se -> se.kind() == EnableKind.STEADY).collect(Collectors.toList());
  }

  /**
   * Turns the schedule into assignments and a state machine.
   * @param scopeGo the scope's go signal, conjoined into every enable and every non-exit transition
   * @param doneEdges the edges on which the scope completes; each returns to state 0 without waiting for go
   */
  public ScopeResult realize(Guard scopeGo, List<PredEdge> doneEdges) {
    for (PredEdge exit : doneEdges) {
      if (exit.state() != 0 && !exit.guard().isFalse())
        edges.add(new Edge(exit.state(), 0, exit.guard(), false));
    }

    // compact the state numbers
    TreeSet<Integer> used = new TreeSet<>();
    used.add(0);
    used.addAll(enables.keySet());
    for (Edge edge : edges) {
      used.add(edge.from());
      used.add(edge.to());
    }
    for (PredEdge exit : doneEdges)
      used.add(exit.state());
    for (Assignment assignment : extraAssignments)
      collectStates(assignment.guard, used);
    for (StateMachine sm : extraMachines)
      sm.getTransitions().forEach(transition -> collectStates(transition.guard, used));
    if (used.first() < 0)
      throw new IllegalStateException("Unresolved loop head in " + fsmName);

    Map<Integer, Integer> dense = new TreeMap<>();
    for (int state : used)
      dense.put(state, dense.size());
    boolean elide = (dense.size() == 1);
    Function<Guard, Guard> remap = atom -> {
      if (!(atom instanceof Guard.StateEquals) || !((Guard.StateEquals)atom).stateMachine.equals(fsmName))
        return atom;
      return elide ? Guard.TRUE : Guard.stateEquals(fsmName, dense.get(((Guard.StateEquals)atom).state));
    };

    ControlLogicBlock block = new ControlLogicBlock();
    for (Map.Entry<Integer, List<StateEnable>> entry : enables.entrySet()) {
      for (StateEnable se : entry.getValue()) {
        Guard guard = scopeGo.and(inState(entry.getKey())).and(se.guard()).mapAtoms(remap);
        block.assignments.add(new Assignment(se.dest(), guard, Source.ONE));
      }
    }
    for (Assignment assignment : extraAssignments)
      block.assignments.add(assignment.withGuard(assignment.guard.mapAtoms(remap)));
    for (StateMachine sm : extraMachines) {
      List<Transition> transitions = sm.getTransitions()
                                         .stream()
                                         .map(t -> t.increment ? Transition.increment(t.from, t.guard.mapAtoms(remap))
                                                               : Transition.to(t.from, t.guard.mapAtoms(remap), t.to))
                                         .collect(Collectors.toList());
      block.stateMachines.add(new StateMachine(sm.name, sm.kind, sm.numStates, transitions));
    }

    if (!elide) {
      // merge edges with the same endpoints, drop self loops
      LinkedHashMap<List<Integer>, Guard> merged = new LinkedHashMap<>();
      for (Edge edge : edges) {
        int from = dense.get(edge.from());
        int to = dense.get(edge.to());
        if (from == to)
          continue;
        Guard guard = (edge.gated() ? scopeGo.and(edge.guard()) : edge.guard()).mapAtoms(remap);
        merged.merge(List.of(from, to), guard, Guard::or);
      }
      List<Transition> transitions = merged.entrySet()
                                         .stream()
                                         .map(e -> Transition.to(e.getKey().get(0), e.getValue(), e.getKey().get(1)))
                                         .collect(Collectors.toList());
      block.stateMachines.add(0, new StateMachine(fsmName, StateMachine.Kind.FSM, dense.size(), transitions));
    }

    Guard done = Guard.FALSE;
    for (PredEdge exit : doneEdges)
      done = done.or(inState(exit.state()).and(exit.guard()));
    return new ScopeResult(done.mapAtoms(remap), block);
  }

  private void collectStates(Guard guard, TreeSet<Integer> out) {
    guard.forEachAtom(atom -> {
      if (atom instanceof Guard.StateEquals && ((Guard.StateEquals)atom).stateMachine.equals(fsmName))
        out.add(((Guard.StateEquals)atom).state);
    });
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("schedule ").append(fsmName).append(":\n");
    for (Map.Entry<Integer, List<StateEnable>> entry : enables.entrySet()) {
      for (StateEnable se : entry.getValue())
        sb.append("  ").append(entry.getKey()).append(": ").append(se.dest()).append(" <- ").append(se.guard()).append(" [")
            .append(se.kind()).append("]\n");
    }
    for (Edge edge : edges)
      sb.append("  ").append(edge.from()).append(" -> ").append(edge.to()).append(" when ").append(edge.guard())
          .append(edge.gated() ? "" : " [exit]").append("\n");
    return sb.toString();
  }
}
