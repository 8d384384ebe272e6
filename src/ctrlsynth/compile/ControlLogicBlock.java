package ctrlsynth.compile;

import ctrlsynth.backend.StateMachine;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.Port;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logic generated for one part of the control tree: allocated registers, holes, guarded assignments and state machines.
 * Compilation steps each produce a block and the driver merges them with {@link #addOther(ControlLogicBlock)}.
 */
public class ControlLogicBlock {
  /** Registers allocated by the compiler. */
  public List<CellDecl> cells = new ArrayList<>();
  /** Go/done wires of compiled scopes. */
  public List<Port> holes = new ArrayList<>();
  public List<Assignment> assignments = new ArrayList<>();
  public List<StateMachine> stateMachines = new ArrayList<>();
  public List<CompletionLatch> completionLatches = new ArrayList<>();
  public List<ConditionLatch> conditionLatches = new ArrayList<>();

  public ControlLogicBlock() {}

  /** Declares the go and done holes of a compiled scope. */
  public void addHoles(String owner) {
    holes.add(Port.goHole(owner));
    holes.add(Port.doneHole(owner));
  }

  @Override
  public int hashCode() {
    return Objects.hash(cells, assignments, stateMachines);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    ControlLogicBlock other = (ControlLogicBlock)obj;
    return cells.equals(other.cells) && holes.equals(other.holes) && assignments.equals(other.assignments) &&
        stateMachines.equals(other.stateMachines) && completionLatches.equals(other.completionLatches) &&
        conditionLatches.equals(other.conditionLatches);
  }

  /**
   * Adds the contents of another ControlLogicBlock to this one. Does _not_ check for duplicate cells or holes.
   * @param other the input ControlLogicBlock
   */
  public void addOther(ControlLogicBlock other) {
    this.cells.addAll(other.cells);
    this.holes.addAll(other.holes);
    this.assignments.addAll(other.assignments);
    this.stateMachines.addAll(other.stateMachines);
    this.completionLatches.addAll(other.completionLatches);
    this.conditionLatches.addAll(other.conditionLatches);
  }
}
