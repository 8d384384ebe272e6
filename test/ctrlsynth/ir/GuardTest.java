package ctrlsynth.ir;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GuardTest {
  static final Guard a = Guard.port(Port.cell("a", "out"));
  static final Guard b = Guard.port(Port.cell("b", "out"));
  static final Guard c = Guard.port(Port.goHole("c"));

  @Test
  void testConstantFolding() {
    Assertions.assertSame(Guard.FALSE, a.and(Guard.FALSE));
    Assertions.assertSame(a, a.and(Guard.TRUE));
    Assertions.assertSame(Guard.TRUE, a.or(Guard.TRUE));
    Assertions.assertSame(b, Guard.FALSE.or(b));
    Assertions.assertSame(Guard.FALSE, Guard.TRUE.not());
    Assertions.assertEquals(a, a.not().not());
  }

  @Test
  void testComplementsAndDuplicates() {
    Assertions.assertTrue(a.and(a.not()).isFalse());
    Assertions.assertTrue(a.or(a.not()).isTrue());
    Guard ab = a.and(b);
    Assertions.assertSame(ab, ab.and(a));
    Assertions.assertSame(ab, b.and(ab));
    Assertions.assertEquals(List.of(a, b, c), ab.and(c).conjuncts());
    Assertions.assertEquals(ab, a.and(b));
    Assertions.assertEquals(ab.hashCode(), a.and(b).hashCode());
  }

  @Test
  void testStateTests() {
    Assertions.assertTrue(Guard.stateEquals("fsm", 1).and(Guard.stateEquals("fsm", 2)).isFalse());
    Assertions.assertFalse(Guard.stateEquals("fsm", 1).and(Guard.stateEquals("other", 2)).isFalse());
    Assertions.assertTrue(Guard.stateInRange("fsm", 3, 3).isFalse());
    Assertions.assertEquals(Guard.stateEquals("fsm", 3), Guard.stateInRange("fsm", 3, 4));
    Assertions.assertTrue(((Guard.StateInRange)Guard.stateInRange("fsm", 1, 4)).contains(3));
  }

  @Test
  void testEvaluate() {
    Map<Port, Long> ports = Map.of(Port.cell("a", "out"), 1L, Port.cell("b", "out"), 0L);
    Guard.Env env = new Guard.Env() {
      @Override
      public long portValue(Port port) {
        return ports.getOrDefault(port, 0L);
      }
      @Override
      public int stateOf(String stateMachine) {
        return 2;
      }
    };
    Assertions.assertTrue(a.and(b.not()).evaluate(env));
    Assertions.assertFalse(a.and(b).evaluate(env));
    Assertions.assertTrue(Guard.stateInRange("fsm", 1, 3).and(a).evaluate(env));
    Assertions.assertFalse(Guard.stateEquals("fsm", 1).or(c).evaluate(env));
  }

  @Test
  void testMapAtomsFolds() {
    Guard guard = a.and(c).or(b);
    Guard substituted = guard.mapAtoms(atom -> atom.equals(c) ? Guard.FALSE : atom);
    Assertions.assertEquals(b, substituted);
    Assertions.assertEquals(a.or(b), guard.mapAtoms(atom -> atom.equals(c) ? Guard.TRUE : atom));
  }

  @Test
  void testPrinting() {
    Assertions.assertEquals("(a.out | b.out) & c[go]", a.or(b).and(c).toString());
    Assertions.assertEquals("!(a.out & b.out)", a.and(b).not().toString());
    Assertions.assertEquals("fsm0 == 2 & !a.out", Guard.stateEquals("fsm0", 2).and(a.not()).toString());
    Assertions.assertEquals("1 <= cnt < 3", Guard.stateInRange("cnt", 1, 3).toString());
  }
}
