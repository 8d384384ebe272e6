package ctrlsynth.compile;

import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import java.util.HashSet;
import java.util.Set;

/**
 * Name resolution and group kind checks on a normalized control tree, run before anything is scheduled.
 */
public class WellFormed {
  private final CompilationContext ctx;
  private final Set<String> checkedGroups = new HashSet<>();

  public WellFormed(CompilationContext ctx) { this.ctx = ctx; }

  public void check(ControlNode root) throws CompileError {
    for (Assignment assignment : ctx.catalog.getContinuous())
      checkCells(assignment, "continuous assignment");
    checkNode(root);
  }

  private void checkNode(ControlNode node) throws CompileError {
    if (node instanceof ControlNode.Enable) {
      ControlNode.Enable enable = (ControlNode.Enable)node;
      Group group = ctx.group(enable.group);
      if (group.isCombinational())
        throw new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Comb group " + group.name + " cannot be enabled as a statement");
      if (group.latency.isDynamic() && !group.hasDoneAssignment())
        throw new CompileError(CompileError.Kind.MISSING_DONE, "Dynamic group " + group.name + " never drives " + group.done());
      checkGroup(group);
    } else if (node instanceof ControlNode.If) {
      ControlNode.If branch = (ControlNode.If)node;
      checkCondition(branch.port, branch.condGroup);
    } else if (node instanceof ControlNode.While) {
      ControlNode.While loop = (ControlNode.While)node;
      checkCondition(loop.port, loop.condGroup);
    } else if (node instanceof ControlNode.Invoke) {
      ControlNode.Invoke invoke = (ControlNode.Invoke)node;
      // lowered by the normalizer; only reached when checking a raw tree
      ctx.cell(invoke.cell);
    }
    for (ControlNode child : node.children())
      checkNode(child);
  }

  private void checkCondition(Port port, String condGroup) throws CompileError {
    checkPort(port, "condition");
    if (condGroup == null)
      return;
    Group group = ctx.group(condGroup);
    if (!group.isCombinational())
      throw new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Condition group " + group.name + " must be a comb group, is " + group.latency);
    checkGroup(group);
  }

  private void checkGroup(Group group) throws CompileError {
    if (!checkedGroups.add(group.name))
      return;
    for (Assignment assignment : group.getAssignments())
      checkCells(assignment, "group " + group.name);
  }

  private void checkCells(Assignment assignment, String where) throws CompileError {
    checkPort(assignment.dest, where);
    if (assignment.source.port != null)
      checkPort(assignment.source.port, where);
    for (Port port : guardPorts(assignment.guard))
      checkPort(port, where);
  }

  private void checkPort(Port port, String where) throws CompileError {
    if (port.kind == Port.Kind.CELL && ctx.catalog.findCell(port.owner).isEmpty())
      throw new CompileError(CompileError.Kind.UNKNOWN_CELL, "Cell " + port.owner + " used in " + where + " is not declared");
  }

  private static Set<Port> guardPorts(Guard guard) {
    Set<Port> ret = new HashSet<>();
    guard.forEachAtom(atom -> {
      if (atom instanceof Guard.PortValue)
        ret.add(((Guard.PortValue)atom).port);
    });
    return ret;
  }
}
