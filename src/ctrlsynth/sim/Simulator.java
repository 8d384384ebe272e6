package ctrlsynth.sim;

import ctrlsynth.backend.CompiledProgram;
import ctrlsynth.backend.StateMachine;
import ctrlsynth.backend.Transition;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cycle-based simulator for a {@link CompiledProgram}.
 * <p>
 * Each cycle first evaluates all assignments until the port values stop changing, then checks that every port has at most one
 * active driver, then applies the clock edge to all cells and state machines at once.
 */
public class Simulator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompiledProgram program;
  private final LinkedHashMap<Port, List<Assignment>> drivers = new LinkedHashMap<>();
  private final LinkedHashMap<String, Primitive> primitives = new LinkedHashMap<>();
  private final LinkedHashMap<String, Integer> states = new LinkedHashMap<>();
  private int cycle;

  public Simulator(CompiledProgram program) {
    this.program = program;
    for (Assignment assignment : program.getAssignments())
      drivers.computeIfAbsent(assignment.dest, p -> new ArrayList<>()).add(assignment);
    for (CellDecl cell : program.getCells())
      primitives.put(cell.name, Primitive.create(cell));
    reset();
  }

  /** Synchronous reset: every state machine to state 0, every register and latch cleared. */
  public void reset() {
    primitives.values().forEach(Primitive::reset);
    states.clear();
    for (StateMachine sm : program.getStateMachines())
      states.put(sm.name, 0);
    cycle = 0;
  }

  /** Sets the stored value of a register cell. */
  public void setRegister(String cell, long value) {
    Primitive primitive = primitives.get(cell);
    if (!(primitive instanceof Register))
      throw new IllegalArgumentException(cell + " is not a register");
    ((Register)primitive).set(value);
  }

  public int getState(String stateMachine) { return states.get(stateMachine); }

  /**
   * Runs the component once: go is held high until done is seen, then low for the given number of drain cycles.
   * Cycle numbers in the result count from the start of this run.
   */
  public RunResult run(int maxCycles, int drainCycles) {
    List<CycleRecord> trace = new ArrayList<>();
    boolean go = true;
    int doneCycle = -1;
    int pulses = 0;
    for (int i = 0; i < maxCycles; i++) {
      CycleRecord record = step(go, i);
      trace.add(record);
      if (record.isHigh(program.done)) {
        ++pulses;
        if (doneCycle < 0)
          doneCycle = i;
        go = false;
      }
      if (doneCycle >= 0 && i >= doneCycle + drainCycles)
        break;
    }
    logger.debug("Run of {}: done at {}, {} pulses", program.name, doneCycle, pulses);
    return new RunResult(doneCycle, pulses, trace);
  }

  /** Simulates one cycle with the given go input. */
  public CycleRecord step(boolean go) { return step(go, cycle); }

  private CycleRecord step(boolean go, int traceCycle) {
    Map<Port, Long> values = settle(go);
    checkDrivers(values);

    Map<Port, Long> recorded = new TreeMap<>(values);
    for (Primitive primitive : primitives.values()) {
      for (String output : primitive.outputs())
        recorded.put(Port.cell(primitive.decl.name, output), readCell(primitive, output, values));
    }
    recorded.put(program.go, go ? 1L : 0L);
    CycleRecord record = new CycleRecord(traceCycle, go, recorded, new LinkedHashMap<>(states));
    logger.trace("{}: {}", record, recorded);

    clock(values);
    ++cycle;
    return record;
  }

  private Guard.Env env(Map<Port, Long> values) {
    return new Guard.Env() {
      @Override
      public long portValue(Port port) {
        return read(port, values);
      }
      @Override
      public int stateOf(String stateMachine) {
        Integer state = states.get(stateMachine);
        if (state == null)
          throw new SimulationException(cycle, "Guard reads unknown state machine " + stateMachine);
        return state;
      }
    };
  }

  private long read(Port port, Map<Port, Long> values) {
    if (port.kind == Port.Kind.CELL) {
      Primitive primitive = primitives.get(port.owner);
      if (primitive != null && primitive.outputs().contains(port.name))
        return readCell(primitive, port.name, values);
    }
    return values.getOrDefault(port, 0L);
  }

  private long readCell(Primitive primitive, String output, Map<Port, Long> values) {
    String owner = primitive.decl.name;
    return primitive.output(output, input -> values.getOrDefault(Port.cell(owner, input), 0L));
  }

  private Map<Port, Long> settle(boolean go) {
    Map<Port, Long> values = new HashMap<>();
    values.put(program.go, go ? 1L : 0L);
    int limit = 4 * drivers.size() + 16;
    for (int iteration = 0; iteration < limit; iteration++) {
      Guard.Env env = env(values);
      boolean changed = false;
      for (Map.Entry<Port, List<Assignment>> entry : drivers.entrySet()) {
        long value = 0;
        for (Assignment assignment : entry.getValue()) {
          if (assignment.guard.evaluate(env)) {
            value = assignment.source.evaluate(port -> read(port, values));
            break;
          }
        }
        Long old = values.put(entry.getKey(), value);
        if (old == null ? value != 0 : old != value)
          changed = true;
      }
      if (!changed)
        return values;
    }
    throw new SimulationException(cycle, "Combinational logic does not settle");
  }

  private void checkDrivers(Map<Port, Long> values) {
    Guard.Env env = env(values);
    for (Map.Entry<Port, List<Assignment>> entry : drivers.entrySet()) {
      Assignment active = null;
      for (Assignment assignment : entry.getValue()) {
        if (!assignment.guard.evaluate(env))
          continue;
        if (active != null)
          throw new SimulationException(cycle, "Multiple active drivers for " + entry.getKey() + ": `" + active + "` and `" + assignment + "`");
        active = assignment;
      }
    }
  }

  private void clock(Map<Port, Long> values) {
    Guard.Env env = env(values);
    Map<String, Integer> next = new HashMap<>();
    for (StateMachine sm : program.getStateMachines()) {
      int current = states.get(sm.name);
      Integer target = null;
      for (Transition transition : sm.getTransitions()) {
        if (transition.from != Transition.ANY && transition.from != current)
          continue;
        if (!transition.guard.evaluate(env))
          continue;
        int candidate = transition.next(current);
        if (target != null && target != candidate)
          throw new SimulationException(cycle, "Conflicting transitions of " + sm.name + " from state " + current + ": " + target + " and " +
                                                   candidate);
        target = candidate;
      }
      if (target != null) {
        if (target < 0 || target >= sm.numStates)
          throw new SimulationException(cycle, sm.name + " leaves its state range: " + target);
        next.put(sm.name, target);
      }
    }
    for (Primitive primitive : primitives.values()) {
      String owner = primitive.decl.name;
      primitive.clock(input -> values.getOrDefault(Port.cell(owner, input), 0L));
    }
    states.putAll(next);
  }
}
