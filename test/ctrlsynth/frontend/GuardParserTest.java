package ctrlsynth.frontend;

import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class GuardParserTest {

  @Test
  void testPorts() throws ProgramFormatException {
    Assertions.assertEquals(Port.cell("lt", "out"), GuardParser.parsePort("lt.out"));
    Assertions.assertEquals(Port.component("go"), GuardParser.parsePort("this.go"));
    Assertions.assertEquals(Port.doneHole("incr"), GuardParser.parsePort("incr[done]"));
    Assertions.assertEquals(Port.cell("r_1", "write_en"), GuardParser.parsePort(" r_1 . write_en "));
  }

  @Test
  void testPrecedence() throws ProgramFormatException {
    Guard a = Guard.port(Port.cell("a", "x"));
    Guard b = Guard.port(Port.cell("b", "x"));
    Guard c = Guard.port(Port.goHole("c"));
    Assertions.assertEquals(a.or(b.and(c.not())), GuardParser.parseGuard("a.x | b.x & !c[go]"));
    Assertions.assertEquals(a.or(b).and(c), GuardParser.parseGuard("(a.x | b.x) & c[go]"));
    Assertions.assertEquals(a.and(b).not(), GuardParser.parseGuard("!(a.x & b.x)"));
    Assertions.assertSame(Guard.TRUE, GuardParser.parseGuard("true"));
    Assertions.assertSame(Guard.FALSE, GuardParser.parseGuard("a.x & 0"));
  }

  @Test
  void testSources() throws ProgramFormatException {
    Assertions.assertEquals(Source.ONE, GuardParser.parseSource("1"));
    Assertions.assertEquals(Source.constant(7, 32), GuardParser.parseSource("7"));
    Assertions.assertEquals(Source.constant(5, 4), GuardParser.parseSource("4'd5"));
    Assertions.assertEquals(Source.of(Port.cell("add", "out")), GuardParser.parseSource("add.out"));
  }

  @Test
  void testAssignments() throws ProgramFormatException {
    Assignment plain = GuardParser.parseAssignment("i.in = add.out");
    Assertions.assertEquals(new Assignment(Port.cell("i", "in"), Source.of(Port.cell("add", "out"))), plain);

    Assignment guarded = GuardParser.parseAssignment("r.in = g[go] & !x.out ? 4'd3");
    Assertions.assertEquals(Port.cell("r", "in"), guarded.dest);
    Assertions.assertEquals(Guard.port(Port.goHole("g")).and(Guard.port(Port.cell("x", "out")).not()), guarded.guard);
    Assertions.assertEquals(Source.constant(3, 4), guarded.source);

    // the listing prints assignments in the syntax the parser reads
    Assertions.assertEquals(guarded, GuardParser.parseAssignment(guarded.toString()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"r.in", "r.in = ? 1", "a.b.c = 1", "x[go = 1", "r.in = a # b", "r.in = 70'd1", "1.x = 1", "r.in = a.x &"})
  void testRejects(String text) {
    Assertions.assertThrows(ProgramFormatException.class, () -> GuardParser.parseAssignment(text));
  }
}
