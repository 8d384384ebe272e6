package ctrlsynth.sim;

import ctrlsynth.backend.CompiledProgram;
import ctrlsynth.backend.StateMachine;
import ctrlsynth.backend.Transition;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SimulatorTest {
  static final Guard go = Guard.port(Port.component(Port.GO));

  private static CompiledProgram program(List<CellDecl> cells, List<Assignment> assignments, List<StateMachine> stateMachines) {
    return new CompiledProgram("test", cells, List.of(), assignments, stateMachines, List.of(), List.of());
  }

  private static Map<String, Long> inputs(long left, long right) { return Map.of("left", left, "right", right, "in", left); }

  @Test
  void testRegisterWritesOnClock() {
    CellDecl reg = CellDecl.register("r", 4);
    Simulator sim = new Simulator(program(
        List.of(reg), List.of(new Assignment(reg.port("in"), Source.constant(5, 4)), new Assignment(reg.port("write_en"), go, Source.ONE)),
        List.of()));
    CycleRecord first = sim.step(true);
    Assertions.assertEquals(0, first.value(reg.port("out")));
    Assertions.assertFalse(first.isHigh(reg.port("done")));
    CycleRecord second = sim.step(false);
    Assertions.assertEquals(5, second.value(reg.port("out")));
    Assertions.assertTrue(second.isHigh(reg.port("done")));
    CycleRecord third = sim.step(false);
    Assertions.assertEquals(5, third.value(reg.port("out")));
    Assertions.assertFalse(third.isHigh(reg.port("done")));

    sim.reset();
    Assertions.assertEquals(0, sim.step(false).value(reg.port("out")));
    sim.setRegister("r", 0x1f);
    Assertions.assertEquals(0xf, sim.step(false).value(reg.port("out")));
  }

  @Test
  void testDelayRestartsInDoneCycle() {
    CellDecl delay = new CellDecl("d", "std_delay", Map.of("latency", 2L, "width", 1L));
    Simulator sim = new Simulator(program(List.of(delay), List.of(new Assignment(delay.port("go"), go, Source.ONE)), List.of()));
    RunResult held = new RunResult(-1, 0, List.of(sim.step(true), sim.step(true), sim.step(true), sim.step(true), sim.step(true),
                                                   sim.step(false), sim.step(false)));
    Assertions.assertEquals(List.of(2, 4), held.highCycles(delay.port("done")));
  }

  @Test
  void testCombPrimitives() {
    Assertions.assertEquals(2, Primitive.create(new CellDecl("a", "std_add", Map.of("width", 4L))).output("out", inputs(9, 9)::get));
    Assertions.assertEquals(15, Primitive.create(new CellDecl("s", "std_sub", Map.of("width", 4L))).output("out", inputs(1, 2)::get));
    Assertions.assertEquals(1, Primitive.create(new CellDecl("l", "std_lt", Map.of("width", 4L))).output("out", inputs(1, 2)::get));
    Assertions.assertEquals(0, Primitive.create(new CellDecl("g", "std_ge", Map.of("width", 4L))).output("out", inputs(1, 2)::get));
    Assertions.assertEquals(14, Primitive.create(new CellDecl("n", "std_not", Map.of("width", 4L))).output("out", inputs(1, 0)::get));
    Assertions.assertEquals(7, Primitive.create(new CellDecl("c", "std_const", Map.of("width", 4L, "value", 7L))).output("out", inputs(0, 0)::get));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Primitive.create(new CellDecl("m", "std_mult_pipe", Map.of())));
  }

  @Test
  void testCombinationalLoopIsReported() {
    Port hole = Port.goHole("x");
    Simulator sim = new Simulator(program(List.of(), List.of(new Assignment(hole, Guard.port(hole).not(), Source.ONE)), List.of()));
    Assertions.assertThrows(SimulationException.class, () -> sim.step(true));
  }

  @Test
  void testMultipleActiveDrivers() {
    CellDecl reg = CellDecl.register("r", 4);
    Simulator sim = new Simulator(program(List.of(reg),
                                          List.of(new Assignment(reg.port("in"), go, Source.constant(1, 4)),
                                                  new Assignment(reg.port("in"), go, Source.constant(2, 4))),
                                          List.of()));
    sim.step(false);
    SimulationException error = Assertions.assertThrows(SimulationException.class, () -> sim.step(true));
    Assertions.assertEquals(1, error.cycle);
  }

  @Test
  void testStateMachineChecks() {
    StateMachine conflicting =
        new StateMachine("fsm", StateMachine.Kind.FSM, 3, List.of(Transition.to(0, go, 1), Transition.to(0, Guard.TRUE, 2)));
    Simulator first = new Simulator(program(List.of(), List.of(), List.of(conflicting)));
    first.step(false);
    Assertions.assertEquals(2, first.getState("fsm"));
    Assertions.assertThrows(SimulationException.class, () -> new Simulator(program(List.of(), List.of(), List.of(conflicting))).step(true));

    StateMachine counter = new StateMachine("cnt", StateMachine.Kind.COUNTER, 2, List.of(Transition.increment(Transition.ANY, go)));
    Simulator second = new Simulator(program(List.of(), List.of(), List.of(counter)));
    second.step(true);
    Assertions.assertEquals(1, second.getState("cnt"));
    Assertions.assertThrows(SimulationException.class, () -> second.step(true));
  }

  @Test
  void testSetRegisterRejectsOtherCells() {
    Simulator sim = new Simulator(program(List.of(new CellDecl("w", "std_wire", Map.of("width", 1L))), List.of(), List.of()));
    Assertions.assertThrows(IllegalArgumentException.class, () -> sim.setRegister("w", 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> sim.setRegister("missing", 1));
  }
}
