package ctrlsynth.backend;

import ctrlsynth.compile.CompletionLatch;
import ctrlsynth.compile.ConditionLatch;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Dumps a {@link CompiledProgram} as a YAML netlist for a downstream RTL writer.
 * Guards use the listing syntax: ports as in program files, {@code fsm == n} and {@code lo <= fsm < hi} for state tests.
 */
public class YamlEmitter implements ProgramEmitter {
  @Override
  public String suffix() {
    return "_netlist.yaml";
  }

  @Override
  public String emit(CompiledProgram program) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("component", program.name);

    List<Object> cells = new ArrayList<>();
    for (CellDecl cell : program.getCells()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", cell.name);
      entry.put("type", cell.type);
      entry.putAll(cell.getParams());
      cells.add(entry);
    }
    root.put("cells", cells);
    root.put("holes", program.getHoles().stream().map(Object::toString).toList());

    List<Object> machines = new ArrayList<>();
    for (StateMachine sm : program.getStateMachines()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", sm.name);
      entry.put("kind", sm.kind.name().toLowerCase());
      entry.put("states", sm.numStates);
      entry.put("width", sm.width);
      List<Object> transitions = new ArrayList<>();
      for (Transition transition : sm.getTransitions()) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("from", (transition.from == Transition.ANY) ? "*" : transition.from);
        row.put("to", transition.increment ? "+1" : transition.to);
        row.put("when", transition.guard.toString());
        transitions.add(row);
      }
      entry.put("transitions", transitions);
      machines.add(entry);
    }
    root.put("state_machines", machines);

    List<Object> latches = new ArrayList<>();
    for (CompletionLatch latch : program.getCompletionLatches())
      latches.add(Map.of("register", latch.register, "par", latch.parName, "child", latch.childName));
    for (ConditionLatch latch : program.getConditionLatches())
      latches.add(Map.of("stored", latch.stored, "valid", latch.valid, "condition", latch.condition.toString()));
    root.put("latches", latches);

    List<String> wires = new ArrayList<>();
    for (Assignment assignment : program.getAssignments())
      wires.add(assignment.toString());
    root.put("wires", wires);

    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    return new Yaml(options).dump(root);
  }
}
