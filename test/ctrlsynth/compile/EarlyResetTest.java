package ctrlsynth.compile;

import ctrlsynth.TestProgramBuilder;
import ctrlsynth.backend.CompiledProgram;
import ctrlsynth.backend.StateMachine;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Port;
import ctrlsynth.sim.RunResult;
import ctrlsynth.sim.Simulator;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EarlyResetTest {

  /** {@code while (i < 3) { incr }} with i already zero, so the loop is the whole program. */
  private static RunResult runLoop(boolean earlyReset) throws CompileError {
    var builder = new TestProgramBuilder();
    ControlNode.Seq counted = (ControlNode.Seq)builder.countedLoop(3, ControlNode.empty(), true);
    CompiledProgram program = builder.compile(counted.stmts.get(1), TestProgramBuilder.config(earlyReset, false));
    return builder.simulator(program).run(40, 3);
  }

  @Test
  void testLoopIterationsAfterTheFirstCostOneCycle() throws CompileError {
    RunResult result = runLoop(true);
    // settle cycle 0, body at 1, 2, 3
    Assertions.assertEquals(List.of(1, 2, 3), result.highCycles(Port.goHole("incr0")));
    Assertions.assertEquals(4, result.doneCycle);
    Assertions.assertEquals(1, result.donePulses);
  }

  @Test
  void testNaiveLoopSettlesEveryIteration() throws CompileError {
    RunResult result = runLoop(false);
    Assertions.assertEquals(List.of(1, 4, 7), result.highCycles(Port.goHole("incr0")));
    Assertions.assertEquals(List.of(0, 3, 6, 9), result.highCycles(Port.goHole("cond0")));
    Assertions.assertEquals(9, result.doneCycle);
    Assertions.assertEquals(1, result.donePulses);
  }

  @Test
  void testLoopThatNeverIterates() throws CompileError {
    var builder = new TestProgramBuilder();
    ControlNode control = builder.countedLoop(0, ControlNode.enable(builder.dynamicGroup("A", 2)), true);
    CompiledProgram program = builder.compile(control, TestProgramBuilder.config(true, true));
    RunResult result = builder.simulator(program).run(20, 2);
    Assertions.assertTrue(result.highCycles(Port.goHole("A")).isEmpty());
    // init, then one settle cycle
    Assertions.assertEquals(2, result.doneCycle);
  }

  private static RunResult runBranch(boolean earlyReset, long flagValue) throws CompileError {
    var builder = new TestProgramBuilder();
    Port flag = builder.flag("f", flagValue);
    Port cond = builder.combCondition("cond", flag);
    ControlNode control =
        ControlNode.seq(ControlNode.enable(builder.dynamicGroup("A", 1)),
                        ControlNode.ifComb(cond, "cond", ControlNode.enable(builder.dynamicGroup("B", 1)),
                                           ControlNode.enable(builder.dynamicGroup("C", 1))));
    CompiledProgram program = builder.compile(control, TestProgramBuilder.config(earlyReset, true));
    return builder.simulator(program).run(20, 2);
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 1})
  void testBranchDecidedInPredecessorCompletion(long flagValue) throws CompileError {
    RunResult result = runBranch(true, flagValue);
    Port taken = Port.goHole(flagValue != 0 ? "B" : "C");
    Port skipped = Port.goHole(flagValue != 0 ? "C" : "B");
    Assertions.assertEquals(List.of(1), result.highCycles(taken));
    Assertions.assertTrue(result.highCycles(skipped).isEmpty());
    Assertions.assertEquals(List.of(1), result.highCycles(Port.goHole("cond")));
    Assertions.assertEquals(2, result.doneCycle);
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 1})
  void testNaiveBranchHasSettleState(long flagValue) throws CompileError {
    RunResult result = runBranch(false, flagValue);
    Port taken = Port.goHole(flagValue != 0 ? "B" : "C");
    Assertions.assertEquals(List.of(3), result.highCycles(taken));
    Assertions.assertEquals(List.of(2), result.highCycles(Port.goHole("cond")));
    Assertions.assertEquals(4, result.doneCycle);
  }

  @Test
  void testBothModesShareStateLayout() throws CompileError {
    for (boolean earlyReset : new boolean[] {true, false}) {
      var builder = new TestProgramBuilder();
      ControlNode control = builder.countedLoop(2, ControlNode.enable(builder.dynamicGroup("A", 1)), true);
      CompiledProgram program = builder.compile(control, TestProgramBuilder.config(earlyReset, false));
      StateMachine fsm = program.getStateMachines(StateMachine.Kind.FSM).get(0);
      // init, settle, body, incr in both modes; only the transitions differ
      Assertions.assertEquals(4, fsm.numStates);
      Simulator sim = builder.simulator(program);
      RunResult result = sim.run(40, 2);
      Assertions.assertEquals(earlyReset ? 7 : 10, result.doneCycle);
    }
  }
}
