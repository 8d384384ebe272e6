package ctrlsynth.backend;

import ctrlsynth.compile.CompletionLatch;
import ctrlsynth.compile.ConditionLatch;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.Port;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Flat result of control compilation, handed to an emitter.
 * The component exposes {@link #go} and {@link #done}; all other behaviour is in the guarded assignments and the state machines.
 */
public class CompiledProgram {
  public final String name;
  public final Port go = Port.component(Port.GO);
  public final Port done = Port.component(Port.DONE);

  private final List<CellDecl> cells;
  private final List<Port> holes;
  private final List<Assignment> assignments;
  private final List<StateMachine> stateMachines;
  private final List<CompletionLatch> completionLatches;
  private final List<ConditionLatch> conditionLatches;

  public CompiledProgram(String name, List<CellDecl> cells, List<Port> holes, List<Assignment> assignments,
                         List<StateMachine> stateMachines, List<CompletionLatch> completionLatches,
                         List<ConditionLatch> conditionLatches) {
    this.name = name;
    this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    this.holes = Collections.unmodifiableList(new ArrayList<>(holes));
    this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
    this.stateMachines = Collections.unmodifiableList(new ArrayList<>(stateMachines));
    this.completionLatches = Collections.unmodifiableList(new ArrayList<>(completionLatches));
    this.conditionLatches = Collections.unmodifiableList(new ArrayList<>(conditionLatches));
  }

  /** Declared cells plus the registers allocated by the compiler. */
  public List<CellDecl> getCells() { return cells; }
  /** Go/done wires of groups and control scopes. */
  public List<Port> getHoles() { return holes; }
  public List<Assignment> getAssignments() { return assignments; }
  public List<StateMachine> getStateMachines() { return stateMachines; }
  public List<CompletionLatch> getCompletionLatches() { return completionLatches; }
  public List<ConditionLatch> getConditionLatches() { return conditionLatches; }

  public List<Assignment> assignmentsTo(Port dest) {
    return assignments.stream().filter(assignment -> assignment.dest.equals(dest)).collect(Collectors.toList());
  }

  public Optional<StateMachine> findStateMachine(String smName) {
    return stateMachines.stream().filter(sm -> sm.name.equals(smName)).findFirst();
  }

  public List<StateMachine> getStateMachines(StateMachine.Kind kind) {
    return stateMachines.stream().filter(sm -> sm.kind == kind).collect(Collectors.toList());
  }

  /** Completion latch of the parallel child with the given name (group name for enabled groups). */
  public Optional<CompletionLatch> findCompletionLatch(String childName) {
    return completionLatches.stream().filter(latch -> latch.childName.equals(childName)).findFirst();
  }

  @Override
  public String toString() {
    return ProgramPrinter.print(this);
  }
}
