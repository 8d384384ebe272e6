package ctrlsynth.compile;

import ctrlsynth.backend.StateMachine;
import ctrlsynth.backend.Transition;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a subtree of known latency L into a static island: a counter running from 0 to L whose done is {@code counter == L}.
 * Leaf groups are started from counter ranges instead of observed done pulses.
 * Re-enabling the island in its done cycle restarts the counter at 1 and starts the leaves at offset 0 in that same cycle.
 */
public class StaticPromoter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompilationContext ctx;

  public StaticPromoter(CompilationContext ctx) { this.ctx = ctx; }

  public ControlUnit compile(ControlNode node) throws CompileError {
    int latency = ctx.timing.latency(node).orElseThrow(() -> new IllegalStateException("Promoting a dynamic subtree: " + node));
    return compileIsland(node, latency);
  }

  private ControlUnit compileIsland(ControlNode node, int latency) throws CompileError {
    String name = ctx.freshName("static");
    Island island = new Island(name, ctx.freshName("cnt"), latency);
    ControlLogicBlock block = ctx.output;
    block.addHoles(name);

    Guard go = Guard.port(Port.goHole(name));
    Guard atEnd = Guard.stateEquals(island.counter, latency);
    List<Transition> transitions = List.of(Transition.to(Transition.ANY, atEnd.and(go), 1),
                                           Transition.to(Transition.ANY, atEnd.and(go.not()), 0),
                                           Transition.increment(Transition.ANY, atEnd.not().and(go)));
    block.stateMachines.add(new StateMachine(island.counter, StateMachine.Kind.COUNTER, latency + 1, transitions));
    block.assignments.add(new Assignment(Port.doneHole(name), atEnd, Source.ONE));

    walk(island, node, 0, Guard.TRUE);
    logger.debug("Static island {}: {} cycles, counter {}", name, latency, island.counter);
    return new ControlUnit(name, Port.goHole(name), Port.doneHole(name));
  }

  private void walk(Island island, ControlNode node, int offset, Guard cond) throws CompileError {
    ControlLogicBlock block = ctx.output;
    if (node instanceof ControlNode.Empty)
      return;
    if (node instanceof ControlNode.Enable) {
      ControlNode.Enable enable = (ControlNode.Enable)node;
      Group group = ctx.group(enable.group);
      ctx.markUsed(group);
      Guard active = island.active(offset, offset + group.latency.cycles).and(cond);
      block.assignments.add(new Assignment(group.go(), active, Source.ONE));
      return;
    }
    if (node instanceof ControlNode.Seq) {
      ControlNode.Seq seq = (ControlNode.Seq)node;
      int childOffset = offset;
      for (ControlNode child : seq.stmts) {
        walk(island, child, childOffset, cond);
        childOffset += ctx.timing.latency(child).getAsInt();
      }
      return;
    }
    if (node instanceof ControlNode.Par) {
      ControlNode.Par par = (ControlNode.Par)node;
      for (ControlNode child : par.stmts)
        walk(island, child, offset, cond);
      return;
    }
    if (node instanceof ControlNode.If) {
      ControlNode.If branch = (ControlNode.If)node;
      int length = ctx.timing.latency(branch).getAsInt();
      Guard first = island.active(offset, offset + 1).and(cond);
      if (branch.condGroup != null) {
        Group condGroup = ctx.group(branch.condGroup);
        ctx.markUsed(condGroup);
        block.assignments.add(new Assignment(condGroup.go(), first, Source.ONE));
      }
      Guard decision = Guard.port(branch.port);
      if (length > 1) {
        ConditionLatch latch = new ConditionLatch(branch.port, ctx.freshName("cond_stored"), ctx.freshName("cond_valid"));
        block.cells.add(CellDecl.register(latch.stored, 1));
        block.cells.add(CellDecl.register(latch.valid, 1));
        block.conditionLatches.add(latch);
        Guard last = island.active(offset + length - 1, offset + length).and(cond);
        block.assignments.add(new Assignment(Port.cell(latch.stored, "in"), first, Source.of(branch.port)));
        block.assignments.add(new Assignment(Port.cell(latch.stored, "write_en"), first, Source.ONE));
        block.assignments.add(new Assignment(Port.cell(latch.valid, "in"), first, Source.ONE));
        block.assignments.add(new Assignment(Port.cell(latch.valid, "in"), last, Source.ZERO));
        block.assignments.add(new Assignment(Port.cell(latch.valid, "write_en"), first.or(last), Source.ONE));
        decision = latch.decision();
      }
      walk(island, branch.thenBranch, offset, cond.and(decision));
      walk(island, branch.elseBranch, offset, cond.and(decision.not()));
      return;
    }
    if (node instanceof ControlNode.Repeat) {
      ControlNode.Repeat repeat = (ControlNode.Repeat)node;
      int bodyLatency = ctx.timing.latency(repeat.body).getAsInt();
      if (bodyLatency == 0 || repeat.count == 0)
        return;
      ControlUnit body = compileIsland(repeat.body, bodyLatency);
      Guard active = island.active(offset, offset + repeat.count * bodyLatency).and(cond);
      block.assignments.add(new Assignment(body.go(), active, Source.ONE));
      return;
    }
    throw new IllegalStateException("Node cannot be part of a static island: " + node);
  }

  private static class Island {
    final String name;
    final String counter;
    final int latency;

    Island(String name, String counter, int latency) {
      this.name = name;
      this.counter = counter;
      this.latency = latency;
    }

    /** Cycles lo (inclusive) to hi (exclusive) of the island's run; cycle 0 also matches the restart cycle. */
    Guard active(int lo, int hi) {
      Guard range = Guard.stateInRange(counter, lo, hi);
      if (lo == 0)
        range = range.or(Guard.stateEquals(counter, latency));
      return range.and(Guard.port(Port.goHole(name)));
    }
  }
}
