package ctrlsynth.compile;

import ctrlsynth.backend.StateMachine;
import ctrlsynth.backend.Transition;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ExclusivityProverTest {
  static final Guard x = Guard.port(Port.cell("x", "out"));
  static final Guard y = Guard.port(Port.cell("y", "out"));
  static final Guard z = Guard.port(Port.cell("z", "out"));

  private static ExclusivityProver prover(List<Assignment> assignments) { return new ExclusivityProver(assignments, 1000); }

  @Test
  void testStructural() {
    var prover = prover(List.of());
    Assertions.assertTrue(prover.exclusive(x.and(y), x.not()));
    Assertions.assertTrue(prover.exclusive(x.and(y).and(z), y.not().and(z)));
    Assertions.assertFalse(prover.exclusive(x, y));
    Assertions.assertFalse(prover.exclusive(x.or(y), y.or(z)));
  }

  @Test
  void testStateTests() {
    var prover = prover(List.of());
    Guard s1 = Guard.stateEquals("fsm", 1);
    Guard s2 = Guard.stateEquals("fsm", 2);
    Assertions.assertTrue(prover.exclusive(s1.and(x), s2.and(x)));
    Assertions.assertTrue(prover.exclusive(Guard.stateInRange("cnt", 0, 3), Guard.stateEquals("cnt", 3)));
    Assertions.assertTrue(prover.exclusive(Guard.stateInRange("cnt", 0, 3), Guard.stateInRange("cnt", 3, 6)));
    Assertions.assertTrue(prover.exclusive(Guard.stateEquals("cnt", 2), Guard.stateInRange("cnt", 0, 4).not()));
    Assertions.assertTrue(prover.exclusive(Guard.stateInRange("cnt", 1, 3), Guard.stateInRange("cnt", 0, 5).not()));
    Assertions.assertFalse(prover.exclusive(Guard.stateInRange("cnt", 0, 3), Guard.stateInRange("cnt", 2, 6)));
    Assertions.assertFalse(prover.exclusive(s1, Guard.stateEquals("other", 2)));
  }

  @Test
  void testCaseSplit() {
    var prover = prover(List.of());
    Guard a = Guard.stateEquals("fsm", 1).and(x).or(Guard.stateEquals("fsm", 2).and(y));
    Guard b = Guard.stateEquals("fsm", 3).or(Guard.stateEquals("fsm", 1).and(x.not()));
    Assertions.assertTrue(prover.exclusive(a, b));
    Assertions.assertFalse(prover.exclusive(a, b.or(y)));
  }

  @Test
  void testCubeLimit() {
    Guard a = Guard.stateEquals("fsm", 1).and(x).or(Guard.stateEquals("fsm", 2).and(y));
    Guard b = Guard.stateEquals("fsm", 3);
    Assertions.assertTrue(new ExclusivityProver(List.of(), 10).exclusive(a, b));
    Assertions.assertFalse(new ExclusivityProver(List.of(), 1).exclusive(a, b));
  }

  @Test
  void testInlinesControlHoles() {
    List<Assignment> control = List.of(new Assignment(Port.goHole("g"), Guard.stateEquals("fsm", 1), Source.ONE),
                                       new Assignment(Port.goHole("h"), Guard.stateEquals("fsm", 2), Source.ONE),
                                       new Assignment(Port.goHole("h"), Guard.stateEquals("fsm", 3).and(x), Source.ONE),
                                       new Assignment(Port.doneHole("g"), Source.of(Port.cell("r", "done"))));
    Guard g = Guard.port(Port.goHole("g"));
    Guard h = Guard.port(Port.goHole("h"));
    Assertions.assertTrue(prover(control).exclusive(g, h));
    Assertions.assertFalse(prover(List.of()).exclusive(g, h));
    // holes driven from data are not inlined
    Assertions.assertFalse(prover(control).exclusive(Guard.port(Port.doneHole("g")), h));
  }

  @Test
  void testVerifyReportsConflictingDrivers() throws CompileError {
    Port dest = Port.cell("r", "in");
    List<Assignment> exclusive = List.of(new Assignment(dest, x, Source.constant(1, 4)), new Assignment(dest, x.not(), Source.constant(2, 4)));
    prover(exclusive).verify(exclusive, List.of());

    List<Assignment> overlapping = List.of(new Assignment(dest, x, Source.constant(1, 4)), new Assignment(dest, y, Source.constant(2, 4)));
    CompileError error = Assertions.assertThrows(CompileError.class, () -> prover(overlapping).verify(overlapping, List.of()));
    Assertions.assertEquals(CompileError.Kind.NON_EXCLUSIVE_GUARD, error.kind);
  }

  @Test
  void testVerifyChecksTransitions() throws CompileError {
    StateMachine fine = new StateMachine("fsm", StateMachine.Kind.FSM, 3,
                                         List.of(Transition.to(0, x, 1), Transition.to(0, x.not().and(y), 2), Transition.to(1, y, 2),
                                                 Transition.to(2, Guard.TRUE, 0)));
    prover(List.of()).verify(List.of(), List.of(fine));

    StateMachine conflicting =
        new StateMachine("fsm", StateMachine.Kind.FSM, 3, List.of(Transition.to(0, x, 1), Transition.to(0, y, 2)));
    CompileError error = Assertions.assertThrows(CompileError.class, () -> prover(List.of()).verify(List.of(), List.of(conflicting)));
    Assertions.assertEquals(CompileError.Kind.NON_EXCLUSIVE_GUARD, error.kind);

    // same target needs no proof
    StateMachine sameTarget =
        new StateMachine("fsm", StateMachine.Kind.FSM, 3, List.of(Transition.to(0, x, 1), Transition.to(0, y, 1)));
    prover(List.of()).verify(List.of(), List.of(sameTarget));
  }
}
