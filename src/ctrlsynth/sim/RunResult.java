package ctrlsynth.sim;

import ctrlsynth.ir.Port;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** Outcome of {@link Simulator#run}: when the component signalled done, how often, and the per-cycle trace. */
public final class RunResult {
  /** First cycle with done high, or -1 if done never came. */
  public final int doneCycle;
  /** Number of cycles with done high, over the run and the drain cycles after it. */
  public final int donePulses;
  private final List<CycleRecord> trace;

  public RunResult(int doneCycle, int donePulses, List<CycleRecord> trace) {
    this.doneCycle = doneCycle;
    this.donePulses = donePulses;
    this.trace = Collections.unmodifiableList(trace);
  }

  public boolean isDone() { return doneCycle >= 0; }

  public List<CycleRecord> getTrace() { return trace; }

  public CycleRecord at(int cycle) { return trace.get(cycle); }

  /** Cycles in which the port was high. */
  public List<Integer> highCycles(Port port) {
    return trace.stream().filter(record -> record.isHigh(port)).map(record -> record.cycle).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return isDone() ? ("done at cycle " + doneCycle + " (" + donePulses + " pulses)") : "not done after " + trace.size() + " cycles";
  }
}
