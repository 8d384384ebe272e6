package ctrlsynth.compile;

import ctrlsynth.RandomControl;
import ctrlsynth.TestProgramBuilder;
import ctrlsynth.backend.CompiledProgram;
import ctrlsynth.backend.StateMachine;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Port;
import ctrlsynth.sim.RunResult;
import ctrlsynth.ui.CtrlSynthConfig;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StaticPromoterTest {

  private static ControlNode staticSeq(TestProgramBuilder builder) {
    return ControlNode.seq(ControlNode.enable(builder.staticGroup("S1", 1)), ControlNode.enable(builder.staticGroup("S2", 2)));
  }

  @Test
  void testStaticSeqRunsOnCounter() throws CompileError {
    var builder = new TestProgramBuilder();
    CompiledProgram program = builder.compile(staticSeq(builder), TestProgramBuilder.config(true, true));
    Assertions.assertTrue(program.getStateMachines(StateMachine.Kind.FSM).isEmpty());
    StateMachine counter = program.findStateMachine("cnt0").orElseThrow();
    Assertions.assertEquals(StateMachine.Kind.COUNTER, counter.kind);
    Assertions.assertEquals(4, counter.numStates);

    RunResult result = builder.simulator(program).run(20, 3);
    Assertions.assertEquals(List.of(0), result.highCycles(Port.goHole("S1")));
    Assertions.assertEquals(List.of(1, 2), result.highCycles(Port.goHole("S2")));
    Assertions.assertEquals(3, result.doneCycle);
    Assertions.assertEquals(1, result.donePulses);
  }

  @Test
  void testDisabledPromotionKeepsFsm() throws CompileError {
    var builder = new TestProgramBuilder();
    CompiledProgram program = builder.compile(staticSeq(builder), TestProgramBuilder.config(true, false));
    Assertions.assertEquals(1, program.getStateMachines(StateMachine.Kind.FSM).size());
    Assertions.assertTrue(program.getStateMachines(StateMachine.Kind.COUNTER).isEmpty());
    Assertions.assertEquals(3, builder.simulator(program).run(20, 2).doneCycle);
  }

  @Test
  void testAnnotationForcesPromotion() throws CompileError {
    var builder = new TestProgramBuilder();
    CompiledProgram program = builder.compile(staticSeq(builder).withStaticHint(3), TestProgramBuilder.config(true, false));
    Assertions.assertTrue(program.findStateMachine("cnt0").isPresent());
    Assertions.assertEquals(3, builder.simulator(program).run(20, 2).doneCycle);
  }

  @Test
  void testLatencyBeyondIntRangeIsDynamic() throws CompileError {
    var builder = new TestProgramBuilder();
    ControlNode huge = ControlNode.repeat(65536, ControlNode.repeat(65536, ControlNode.enable(builder.staticGroup("S0", 1))));
    var ctx = new CompilationContext(builder.catalog, TestProgramBuilder.config(true, true));
    Assertions.assertTrue(ctx.timing.latency(huge).isEmpty());
    Assertions.assertTrue(ctx.timing.latency(ControlNode.seq(ControlNode.repeat(Integer.MAX_VALUE, ControlNode.enable("S0")),
                                                             ControlNode.enable("S0")))
                              .isEmpty());

    // the skipped branch must not fold into a short island with the following groups
    ControlNode control = ControlNode.seq(ControlNode.ifPort(builder.flag("f", 0), huge, ControlNode.empty()),
                                          ControlNode.enable(builder.staticGroup("S1", 1)), ControlNode.enable(builder.staticGroup("S2", 1)));
    CompiledProgram program = builder.compile(control, TestProgramBuilder.config(true, true));
    Assertions.assertTrue(program.getStateMachines(StateMachine.Kind.COUNTER).stream().noneMatch(sm -> sm.name.startsWith("cnt")));
    RunResult result = builder.simulator(program).run(20, 2);
    Assertions.assertTrue(result.isDone());
    Assertions.assertEquals(1, result.donePulses);
    Assertions.assertEquals(1, result.highCycles(Port.goHole("S2")).size());

    CompileError error = Assertions.assertThrows(
        CompileError.class, () -> builder.compile(huge.withStaticHint(1), TestProgramBuilder.config(true, true)));
    Assertions.assertEquals(CompileError.Kind.LATENCY_MISMATCH, error.kind);
  }

  @Test
  void testThresholds() throws CompileError {
    var builder = new TestProgramBuilder();
    ControlNode single = ControlNode.repeat(3, ControlNode.enable(builder.staticGroup("S0", 1)));
    CompiledProgram program = builder.compile(single, TestProgramBuilder.config(true, true));
    // one enable is below the default threshold: the repeat keeps its iteration counter
    Assertions.assertTrue(program.findStateMachine("cnt0").isEmpty());
    Assertions.assertTrue(program.findStateMachine("idx0").isPresent());

    CtrlSynthConfig cfg = TestProgramBuilder.config(true, true);
    cfg.promotion_cycle_limit = 2;
    program = builder.compile(staticSeq(builder), cfg);
    Assertions.assertTrue(program.getStateMachines(StateMachine.Kind.COUNTER).isEmpty());
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 1})
  void testMultiCycleBranchKeepsDecision(long flagValue) throws CompileError {
    var builder = new TestProgramBuilder();
    Port cond = builder.combCondition("c", builder.flag("f", flagValue));
    ControlNode control = ControlNode.ifComb(
        cond, "c", ControlNode.seq(ControlNode.enable(builder.staticGroup("T1", 1)), ControlNode.enable(builder.staticGroup("T2", 1))),
        ControlNode.enable(builder.staticGroup("E", 2)));
    CompiledProgram program = builder.compile(control, TestProgramBuilder.config(true, true));
    Assertions.assertEquals(1, program.getConditionLatches().size());

    RunResult result = builder.simulator(program).run(20, 2);
    Assertions.assertEquals(List.of(0), result.highCycles(Port.goHole("c")));
    if (flagValue != 0) {
      Assertions.assertEquals(List.of(0), result.highCycles(Port.goHole("T1")));
      Assertions.assertEquals(List.of(1), result.highCycles(Port.goHole("T2")));
      Assertions.assertTrue(result.highCycles(Port.goHole("E")).isEmpty());
    } else {
      Assertions.assertEquals(List.of(0, 1), result.highCycles(Port.goHole("E")));
      Assertions.assertTrue(result.highCycles(Port.goHole("T2")).isEmpty());
    }
    Assertions.assertEquals(2, result.doneCycle);
  }

  @Test
  void testIslandInsideLoop() throws CompileError {
    int[] done = new int[2];
    for (int i = 0; i < 2; i++) {
      var builder = new TestProgramBuilder();
      ControlNode control = builder.countedLoop(3, staticSeq(builder), true);
      CompiledProgram program = builder.compile(control, TestProgramBuilder.config(true, i == 0));
      Assertions.assertEquals(i == 0, program.findStateMachine("cnt0").isPresent());
      RunResult result = builder.simulator(program).run(60, 3);
      Assertions.assertEquals(1, result.donePulses);
      Assertions.assertEquals(3, result.highCycles(Port.goHole("S1")).size());
      done[i] = result.doneCycle;
    }
    Assertions.assertEquals(done[1], done[0]);
  }

  @RepeatedTest(64)
  void testPromotionEquivalence_random() throws CompileError {
    long seed = new Random().nextLong();
    try {
      testPromotionEquivalence(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testPromotionEquivalence with seed " + seed);
      throw t;
    }
  }

  /**
   * A static tree, optionally between two dynamic groups, finishes in the same cycle whether it runs on a counter or on the
   * done-polling state machines, and in exactly its inferred latency.
   */
  @ParameterizedTest
  @ValueSource(longs = {1, 42, 68392, -6733423670758169604L, 5893163784830298700L})
  void testPromotionEquivalence(long seed) throws CompileError {
    var rand = new Random(seed);
    var builder = new TestProgramBuilder();
    var generator = new RandomControl(rand, builder);
    ControlNode tree = generator.staticTree(3);
    int expected = generator.latency(tree);
    ControlNode control = tree;
    if (rand.nextBoolean()) {
      control = ControlNode.seq(ControlNode.enable(builder.dynamicGroup("before", 1)), tree,
                                ControlNode.enable(builder.dynamicGroup("after", 1)));
      expected += 2;
    }

    CtrlSynthConfig promoted = TestProgramBuilder.config(true, true);
    promoted.promotion_threshold = 1;
    RunResult withIslands = builder.simulator(builder.compile(control, promoted)).run(expected + 10, 3);
    RunResult withoutIslands = builder.simulator(builder.compile(control, TestProgramBuilder.config(true, false))).run(expected + 10, 3);

    Assertions.assertEquals(expected, withIslands.doneCycle, "static islands: " + control);
    Assertions.assertEquals(expected, withoutIslands.doneCycle, "done polling: " + control);
    Assertions.assertEquals(1, withIslands.donePulses);
    Assertions.assertEquals(1, withoutIslands.donePulses);
  }
}
