package ctrlsynth.sim;

import ctrlsynth.ir.CellDecl;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * {@code std_delay}: a go/done cell that signals done {@code latency} cycles after go is first asserted and passes {@code in} to
 * {@code out}, sampled in the last cycle before done. Go must stay high until done; go in the done cycle starts the next run.
 */
public class Delay extends Primitive {
  private final int latency;
  private int elapsed;
  private long value;

  public Delay(CellDecl decl) {
    super(decl);
    this.latency = (int)decl.param("latency", 1);
    if (latency < 1)
      throw new IllegalArgumentException("Cell " + decl.name + ": latency must be at least 1");
  }

  @Override
  public List<String> outputs() {
    return List.of("out", "done");
  }

  @Override
  public long output(String port, ToLongFunction<String> inputs) {
    if (port.equals("done"))
      return (elapsed == latency) ? 1 : 0;
    return value;
  }

  @Override
  public void clock(ToLongFunction<String> inputs) {
    if (inputs.applyAsLong("go") == 0) {
      elapsed = 0;
      return;
    }
    if (elapsed == latency)
      elapsed = 0;
    ++elapsed;
    if (elapsed == latency)
      value = mask(inputs.applyAsLong("in"));
  }

  @Override
  public void reset() {
    elapsed = 0;
    value = 0;
  }
}
