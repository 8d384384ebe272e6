package ctrlsynth.compile;

import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a parallel composition into a go/done unit.
 * <p>
 * Children that are themselves units run directly; every other child gets its own FSM scope. Each child i has a
 * {@link CompletionLatch} l_i, and the composition completes when
 * <pre>join = AND_i (done_i | l_i)</pre>
 * l_i is set on {@code go & done_i & !join} and cleared on {@code join}. A child is started with
 * <pre>go_i = go & (join | !(l_i | done_i))</pre>
 * so a parent asserting go in the join cycle restarts every child immediately.
 */
public class ForkJoinCompiler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompilationContext ctx;

  public ForkJoinCompiler(CompilationContext ctx) { this.ctx = ctx; }

  private static class Child {
    String name;
    Port go;
    Guard done;
    CompletionLatch latch;
  }

  public ControlUnit compile(ControlNode.Par par) throws CompileError {
    String name = ctx.freshName("par");
    Port goPort = Port.goHole(name);
    Port donePort = Port.doneHole(name);
    Guard go = Guard.port(goPort);
    ControlLogicBlock block = ctx.output;
    block.addHoles(name);

    List<Child> children = new ArrayList<>();
    for (ControlNode stmt : par.stmts) {
      Child child = new Child();
      if (ctx.isAtomic(stmt)) {
        ControlUnit unit = ctx.unitOf(stmt);
        child.name = unit.name();
        child.go = unit.go();
        child.done = unit.doneGuard();
      } else {
        String scope = ctx.freshName("tdcc");
        block.addHoles(scope);
        Guard restart = go.and(Guard.port(donePort));
        ScopeResult result =
            ScheduleBuilder.compileScope(ctx, ctx.freshName("fsm"), stmt, Guard.port(Port.goHole(scope)), true, restart);
        block.addOther(result.block());
        block.assignments.add(new Assignment(Port.doneHole(scope), result.done(), Source.ONE));
        child.name = scope;
        child.go = Port.goHole(scope);
        child.done = Guard.port(Port.doneHole(scope));
      }
      child.latch = new CompletionLatch(name, child.name, children.size(), ctx.freshName("pd"));
      block.cells.add(CellDecl.register(child.latch.register, 1));
      block.completionLatches.add(child.latch);
      children.add(child);
    }

    Guard join = Guard.TRUE;
    for (Child child : children)
      join = join.and(child.done.or(Guard.port(child.latch.out())));
    block.assignments.add(new Assignment(donePort, join, Source.ONE));

    for (Child child : children) {
      Guard finished = Guard.port(child.latch.out());
      block.assignments.add(new Assignment(child.go, go.and(join.or(finished.or(child.done).not())), Source.ONE));

      Guard set = go.and(child.done).and(join.not());
      block.assignments.add(new Assignment(child.latch.in(), set, Source.ONE));
      block.assignments.add(new Assignment(child.latch.in(), join, Source.ZERO));
      block.assignments.add(new Assignment(child.latch.writeEnable(), set.or(join), Source.ONE));
    }
    logger.debug("Parallel composition {} with {} children", name, children.size());
    return new ControlUnit(name, goPort, donePort);
  }
}
