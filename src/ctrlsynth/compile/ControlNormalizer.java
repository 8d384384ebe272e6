package ctrlsynth.compile;

import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.Latency;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites a control tree into the shape the scheduler expects.
 * <ul>
 * <li>{@code seq} and {@code par} lose their {@code empty} children and collapse when zero or one child remains;</li>
 * <li>{@code repeat} with count 0 becomes {@code empty}, count 1 becomes its body;</li>
 * <li>{@code invoke} is lowered to a synthesized group that binds the cell's ports and forwards its go/done.</li>
 * </ul>
 * Nodes carrying a static annotation are not collapsed away, so the annotation stays checkable.
 * Every node of the result is a fresh instance, so a control tree that shares subtrees gets one state per occurrence.
 */
public class ControlNormalizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompilationContext ctx;

  public ControlNormalizer(CompilationContext ctx) { this.ctx = ctx; }

  public ControlNode normalize(ControlNode node) throws CompileError {
    ControlNode ret = rewrite(node);
    OptionalInt hint = node.getStaticHint();
    if (hint.isPresent() && !ret.getStaticHint().isPresent())
      ret = ret.withStaticHint(hint.getAsInt());
    return ret;
  }

  private static boolean isEmpty(ControlNode node) { return node instanceof ControlNode.Empty && node.getStaticHint().isEmpty(); }

  private ControlNode rewrite(ControlNode node) throws CompileError {
    boolean hinted = node.getStaticHint().isPresent();
    if (node instanceof ControlNode.Enable)
      return ControlNode.enable(((ControlNode.Enable)node).group);
    if (node instanceof ControlNode.Empty)
      return ControlNode.empty();
    if (node instanceof ControlNode.Seq || node instanceof ControlNode.Par) {
      List<ControlNode> children = new ArrayList<>();
      for (ControlNode child : node.children()) {
        ControlNode normalized = normalize(child);
        if (!isEmpty(normalized))
          children.add(normalized);
      }
      if (children.isEmpty())
        return ControlNode.empty();
      if (children.size() == 1 && !hinted)
        return children.get(0);
      return (node instanceof ControlNode.Seq) ? ControlNode.seq(children) : ControlNode.par(children);
    }
    if (node instanceof ControlNode.If) {
      ControlNode.If branch = (ControlNode.If)node;
      ControlNode thenBranch = normalize(branch.thenBranch);
      ControlNode elseBranch = normalize(branch.elseBranch);
      if (branch.condGroup == null)
        return ControlNode.ifPort(branch.port, thenBranch, elseBranch);
      return ControlNode.ifComb(branch.port, branch.condGroup, thenBranch, elseBranch);
    }
    if (node instanceof ControlNode.While) {
      ControlNode.While loop = (ControlNode.While)node;
      ControlNode body = normalize(loop.body);
      if (loop.condGroup == null)
        return ControlNode.whilePort(loop.port, body);
      return ControlNode.whileComb(loop.port, loop.condGroup, body);
    }
    if (node instanceof ControlNode.Repeat) {
      ControlNode.Repeat repeat = (ControlNode.Repeat)node;
      if (repeat.count < 0)
        throw new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Negative repeat count " + repeat.count);
      ControlNode body = normalize(repeat.body);
      if (repeat.count == 0 || isEmpty(body))
        return ControlNode.empty();
      if (repeat.count == 1 && !hinted)
        return body;
      return ControlNode.repeat(repeat.count, body);
    }
    if (node instanceof ControlNode.Invoke)
      return ControlNode.enable(lowerInvoke((ControlNode.Invoke)node).name);
    throw new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Unknown control node " + node.getClass().getSimpleName());
  }

  /**
   * Builds the group {@code invoke_<cell>N} that drives the bound inputs, copies the bound outputs, holds the cell's go and
   * completes with the cell's done.
   */
  private Group lowerInvoke(ControlNode.Invoke invoke) throws CompileError {
    CellDecl cell = ctx.cell(invoke.cell);
    Latency latency = cell.getLatency().orElseThrow(
        () -> new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Cell " + cell.name + " (" + cell.type + ") has no go/done interface"));
    String name = ctx.freshName("invoke_" + cell.name);
    List<Assignment> assignments = new ArrayList<>();
    for (Map.Entry<String, Source> input : invoke.inputs.entrySet())
      assignments.add(new Assignment(cell.port(input.getKey()), input.getValue()));
    for (Map.Entry<String, Port> output : invoke.outputs.entrySet())
      assignments.add(new Assignment(output.getValue(), Source.of(cell.port(output.getKey()))));
    assignments.add(new Assignment(cell.port(Port.GO), Source.ONE));
    assignments.add(new Assignment(Port.doneHole(name), Source.of(cell.port(Port.DONE))));
    Group group = new Group(name, latency, assignments);
    ctx.addSynthesizedGroup(group);
    logger.debug("Lowered {} to group {}", invoke, name);
    return group;
  }
}
