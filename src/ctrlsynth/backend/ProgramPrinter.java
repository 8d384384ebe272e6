package ctrlsynth.backend;

import ctrlsynth.compile.CompletionLatch;
import ctrlsynth.compile.ConditionLatch;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.Port;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Debug listing of a {@link CompiledProgram}.
 * Assignments are grouped by destination, state machines are printed as transition tables.
 */
public class ProgramPrinter implements ProgramEmitter {
  private static final String INDENT = "  ";

  @Override
  public String suffix() {
    return ".txt";
  }

  @Override
  public String emit(CompiledProgram program) {
    return print(program);
  }

  public static String print(CompiledProgram program) {
    StringBuilder sb = new StringBuilder();
    sb.append("component ").append(program.name).append("(go: 1) -> (done: 1) {\n");

    sb.append(INDENT).append("cells {\n");
    for (CellDecl cell : program.getCells())
      sb.append(INDENT).append(INDENT).append(cell).append(";\n");
    sb.append(INDENT).append("}\n");

    if (!program.getHoles().isEmpty()) {
      sb.append(INDENT).append("holes {");
      sb.append(program.getHoles().stream().map(Port::toString).collect(Collectors.joining(", ")));
      sb.append("}\n");
    }

    for (StateMachine sm : program.getStateMachines())
      printStateMachine(sb, sm);

    for (CompletionLatch latch : program.getCompletionLatches())
      sb.append(INDENT).append("// completion latch ").append(latch).append("\n");
    for (ConditionLatch latch : program.getConditionLatches())
      sb.append(INDENT).append("// condition latch ").append(latch).append("\n");

    sb.append(INDENT).append("wires {\n");
    Map<Port, List<Assignment>> byDest =
        new TreeMap<>(program.getAssignments().stream().collect(Collectors.groupingBy(assignment -> assignment.dest)));
    for (List<Assignment> assignments : byDest.values()) {
      for (Assignment assignment : assignments)
        sb.append(INDENT).append(INDENT).append(assignment).append("\n");
    }
    sb.append(INDENT).append("}\n");
    sb.append("}\n");
    return sb.toString();
  }

  static void printStateMachine(StringBuilder sb, StateMachine sm) {
    sb.append(INDENT).append(sm).append(" {\n");
    for (Transition transition : sm.getTransitions())
      sb.append(INDENT).append(INDENT).append(transition).append(";\n");
    sb.append(INDENT).append("}\n");
  }
}
