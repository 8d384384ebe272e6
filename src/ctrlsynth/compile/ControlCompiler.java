package ctrlsynth.compile;

import ctrlsynth.backend.CompiledProgram;
import ctrlsynth.backend.StateMachine;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.GroupCatalog;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ui.CtrlSynthConfig;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers a control tree over a group catalog into a {@link CompiledProgram}.
 * <p>
 * Passes, in order: normalization, well-formedness checks, static annotation checks, selection of static islands, scheduling
 * of the top-level scope (which compiles parallel compositions and islands on demand), flattening of all assignments and,
 * if enabled, the exclusivity proof.
 */
public class ControlCompiler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CtrlSynthConfig config;

  public ControlCompiler(CtrlSynthConfig config) { this.config = config; }

  public CompiledProgram compile(String name, GroupCatalog catalog, ControlNode control) throws CompileError {
    CompilationContext ctx = new CompilationContext(catalog, config);
    ControlNode root = new ControlNormalizer(ctx).normalize(control);
    new WellFormed(ctx).check(root);
    ctx.timing.validateHints(root);
    ctx.setPromoted(ctx.timing.selectPromoted(root));

    Port go = Port.component(Port.GO);
    Port done = Port.component(Port.DONE);
    ScopeResult top = ScheduleBuilder.compileScope(ctx, ctx.freshName("fsm"), root, Guard.port(go), false, null);
    ControlLogicBlock logic = new ControlLogicBlock();
    logic.addOther(top.block());
    logic.addOther(ctx.output);

    List<Assignment> assignments = new GuardCompiler(ctx).flatten(logic.assignments, go, top.done(), done);

    List<CellDecl> cells = new ArrayList<>(catalog.getCells());
    cells.addAll(logic.cells);
    List<Port> holes = new ArrayList<>();
    for (Group group : ctx.getUsedGroups()) {
      holes.add(group.go());
      holes.add(group.done());
    }
    holes.addAll(logic.holes);

    if (config.check_exclusivity)
      new ExclusivityProver(assignments, config.exclusivity_cube_limit).verify(assignments, logic.stateMachines);

    CompiledProgram program =
        new CompiledProgram(name, cells, holes, assignments, logic.stateMachines, logic.completionLatches, logic.conditionLatches);
    logger.info("Compiled {}: {} assignments, {} FSMs, {} counters, {} completion latches, {} condition latches", name, assignments.size(),
                program.getStateMachines(StateMachine.Kind.FSM).size(), program.getStateMachines(StateMachine.Kind.COUNTER).size(),
                logic.completionLatches.size(), logic.conditionLatches.size());
    return program;
  }
}
