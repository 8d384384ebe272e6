package ctrlsynth;

import ctrlsynth.backend.ProgramPrinter;
import ctrlsynth.compile.CompileError;
import ctrlsynth.ir.ControlNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.Yaml;

class CtrlSynthTest {

  private static CtrlSynth parallelProgram() {
    var builder = new TestProgramBuilder();
    ControlNode control = ControlNode.seq(ControlNode.enable(builder.dynamicGroup("A", 1)),
                                          ControlNode.par(ControlNode.enable(builder.dynamicGroup("B", 2)),
                                                          ControlNode.enable(builder.dynamicGroup("C", 1))));
    return new CtrlSynth("demo", builder.catalog, control);
  }

  @Test
  void testGenerateWritesListingAndNetlist(@TempDir Path dir) throws IOException {
    CtrlSynth synth = parallelProgram();
    Assertions.assertTrue(synth.Generate(dir.toString()));

    String listing = Files.readString(dir.resolve("demo.txt"));
    Assertions.assertTrue(listing.contains("A[go]"));

    Map<String, Object> netlist = new Yaml().load(Files.readString(dir.resolve("demo_netlist.yaml")));
    Assertions.assertEquals("demo", netlist.get("component"));
    Assertions.assertEquals(1, ((List<?>)netlist.get("state_machines")).size());
    Assertions.assertEquals(2, ((List<?>)netlist.get("latches")).size());
    Assertions.assertFalse(((List<?>)netlist.get("wires")).isEmpty());
  }

  @Test
  void testCompileIsCached() throws CompileError {
    CtrlSynth synth = parallelProgram();
    Assertions.assertSame(synth.Compile(), synth.Compile());
    Assertions.assertEquals(ProgramPrinter.print(synth.Compile()), synth.Compile().toString());
    Assertions.assertTrue(synth.Simulate(20));
  }

  @Test
  void testFailuresAreReported(@TempDir Path dir) {
    var builder = new TestProgramBuilder();
    CtrlSynth synth = new CtrlSynth("broken", builder.catalog, ControlNode.enable("missing"));
    Assertions.assertFalse(synth.Generate(dir.toString()));
    Assertions.assertFalse(Files.exists(dir.resolve("broken.txt")));
    Assertions.assertFalse(synth.Simulate(10));
  }

  @Test
  void testConfigIsApplied() throws CompileError {
    CtrlSynth synth = parallelProgram();
    synth.SetConfig(TestProgramBuilder.config(false, false));
    Assertions.assertFalse(synth.GetConfig().early_reset);
    synth.SetEmitters(List.of());
    Assertions.assertNotNull(synth.Compile());
  }
}
