package ctrlsynth;

import ctrlsynth.backend.CompiledProgram;
import ctrlsynth.backend.ProgramEmitter;
import ctrlsynth.backend.ProgramPrinter;
import ctrlsynth.backend.YamlEmitter;
import ctrlsynth.compile.CompileError;
import ctrlsynth.compile.ControlCompiler;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.GroupCatalog;
import ctrlsynth.sim.RunResult;
import ctrlsynth.sim.SimulationException;
import ctrlsynth.sim.Simulator;
import ctrlsynth.ui.CtrlSynthConfig;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for compiling one control program: holds the catalog, the control tree and the options, and runs the compiler,
 * the emitters and optionally a simulation.
 */
public class CtrlSynth {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String name;
  private final GroupCatalog catalog;
  private final ControlNode control;
  private CtrlSynthConfig cfg = new CtrlSynthConfig();
  private List<ProgramEmitter> emitters = List.of(new ProgramPrinter(), new YamlEmitter());
  private CompiledProgram compiled;

  public CtrlSynth(String name, GroupCatalog catalog, ControlNode control) {
    this.name = name;
    this.catalog = catalog;
    this.control = control;
  }

  public void SetConfig(CtrlSynthConfig cfg) { this.cfg = cfg; }
  public CtrlSynthConfig GetConfig() { return cfg; }
  public void SetEmitters(List<ProgramEmitter> emitters) { this.emitters = List.copyOf(emitters); }

  /** Compiles the program, or returns the result of an earlier call. */
  public CompiledProgram Compile() throws CompileError {
    if (compiled == null)
      compiled = new ControlCompiler(cfg).compile(name, catalog, control);
    return compiled;
  }

  /**
   * Compiles the program and writes one file per emitter into outPath, or prints the listing if outPath is null.
   * @return false if compilation or writing failed; the reason is logged
   */
  public boolean Generate(String outPath) {
    CompiledProgram program;
    try {
      program = Compile();
    } catch (CompileError e) {
      logger.error("Compilation of {} failed: {}", name, e.getMessage());
      return false;
    }
    if (outPath == null) {
      logger.info("\n{}", ProgramPrinter.print(program));
      return true;
    }
    try {
      Files.createDirectories(Path.of(outPath));
      for (ProgramEmitter emitter : emitters) {
        Path file = Path.of(outPath, name + emitter.suffix());
        try (Writer writer = new FileWriter(file.toFile())) {
          writer.write(emitter.emit(program));
        }
        logger.info("Wrote {}", file);
      }
    } catch (IOException e) {
      logger.error("Cannot write output for {}: {}", name, e.getMessage());
      return false;
    }
    return true;
  }

  /**
   * Runs the compiled program once from reset.
   * @return false if the program did not finish within maxCycles, signalled done more than once or violated a run-time check
   */
  public boolean Simulate(int maxCycles) {
    try {
      Simulator sim = new Simulator(Compile());
      RunResult result = sim.run(maxCycles, 2);
      logger.info("Simulation of {}: {}", name, result);
      return result.isDone() && result.donePulses == 1;
    } catch (CompileError e) {
      logger.error("Compilation of {} failed: {}", name, e.getMessage());
    } catch (SimulationException | IllegalArgumentException e) {
      logger.error("Simulation of {} failed: {}", name, e.getMessage());
    }
    return false;
  }
}
