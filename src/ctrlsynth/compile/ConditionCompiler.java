package ctrlsynth.compile;

import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.Guard;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conditionals and loops in a done-polling scope.
 * <p>
 * A port condition is read in the cycle the decision is taken and costs nothing. A condition computed by a comb group
 * needs the group enabled in that cycle:
 * <ul>
 * <li>with early reset, {@code if} enables the group in each predecessor's completing cycle and decides right there;
 * {@code while} evaluates once in a settle state on entry, then enables the group in the cycle the body completes and
 * takes the back edge or the exit in that same cycle;</li>
 * <li>without it, both get an evaluation state that enables the group for one settle cycle, and {@code while} returns to it
 * after every iteration.</li>
 * </ul>
 */
class ConditionCompiler {
  private final ScheduleBuilder builder;

  ConditionCompiler(ScheduleBuilder builder) { this.builder = builder; }

  private Group condGroup(String name) throws CompileError {
    Group group = builder.ctx.group(name);
    if (!group.isCombinational())
      throw new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Condition group " + name + " must be a comb group, is " + group.latency);
    builder.ctx.markUsed(group);
    return group;
  }

  private static List<PredEdge> andAll(List<PredEdge> edges, Guard guard) {
    return edges.stream().map(edge -> edge.and(guard)).filter(edge -> !edge.guard().isFalse()).collect(Collectors.toList());
  }

  private static List<PredEdge> withCombCond(List<PredEdge> edges) {
    return edges.stream().map(PredEdge::withCombCond).collect(Collectors.toList());
  }

  private static List<PredEdge> concat(List<PredEdge> a, List<PredEdge> b) {
    List<PredEdge> ret = new ArrayList<>(a);
    ret.addAll(b);
    return ret;
  }

  List<PredEdge> compileIf(ControlNode.If node, List<PredEdge> preds) throws CompileError {
    Schedule schedule = builder.schedule;
    Guard cond = Guard.port(node.port);
    List<PredEdge> branchPreds = preds;
    if (node.condGroup != null) {
      Group group = condGroup(node.condGroup);
      if (builder.numbering.needsEvalState(node)) {
        int eval = builder.numbering.evalState(node);
        builder.enterState(eval, preds, null);
        schedule.enable(eval, group.go(), Guard.TRUE, Schedule.EnableKind.HOIST);
        branchPreds = List.of(new PredEdge(eval, Guard.TRUE, true, true));
      } else {
        for (PredEdge pred : preds)
          schedule.enable(pred.state(), group.go(), pred.guard(), Schedule.EnableKind.HOIST);
        branchPreds = withCombCond(preds);
      }
    }
    List<PredEdge> thenExits = builder.compile(node.thenBranch, andAll(branchPreds, cond));
    List<PredEdge> elseExits = builder.compile(node.elseBranch, andAll(branchPreds, cond.not()));
    return concat(thenExits, elseExits);
  }

  List<PredEdge> compileWhile(ControlNode.While node, List<PredEdge> preds) throws CompileError {
    Schedule schedule = builder.schedule;
    Guard cond = Guard.port(node.port);
    int head = schedule.openVirtual();

    if (node.condGroup == null) {
      List<PredEdge> bodyExits = schedule.fixZeroTime(head, builder.compile(node.body, List.of(new PredEdge(head, Guard.TRUE))));
      schedule.resolveVirtual(head, andAll(concat(preds, bodyExits), cond));
      return andAll(concat(preds, bodyExits), cond.not());
    }

    Group group = condGroup(node.condGroup);
    int eval = builder.numbering.evalState(node);
    builder.enterState(eval, preds, null);
    schedule.enable(eval, group.go(), Guard.TRUE, Schedule.EnableKind.HOIST);
    PredEdge evaluated = new PredEdge(eval, Guard.TRUE, true, true);

    List<PredEdge> bodyExits = schedule.fixZeroTime(head, builder.compile(node.body, List.of(new PredEdge(head, Guard.TRUE))));
    if (!builder.ctx.config.early_reset) {
      schedule.resolveVirtual(head, List.of(evaluated.and(cond)));
      for (PredEdge exit : bodyExits)
        builder.enterState(eval, List.of(exit), null);
      return List.of(evaluated.and(cond.not()));
    }

    for (PredEdge exit : bodyExits)
      schedule.enable(exit.state(), group.go(), exit.guard(), Schedule.EnableKind.HOIST);
    List<PredEdge> backEdges = withCombCond(bodyExits);
    schedule.resolveVirtual(head, concat(List.of(evaluated.and(cond)), andAll(backEdges, cond)));
    return concat(List.of(evaluated.and(cond.not())), andAll(backEdges, cond.not()));
  }
}
