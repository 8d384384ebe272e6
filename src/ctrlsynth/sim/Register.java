package ctrlsynth.sim;

import ctrlsynth.ir.CellDecl;
import java.util.List;
import java.util.function.ToLongFunction;

/** {@code std_reg}: stores {@code in} when {@code write_en} is high; {@code done} is high in the cycle after a write. */
public class Register extends Primitive {
  private long value;
  private boolean done;

  public Register(CellDecl decl) { super(decl); }

  @Override
  public List<String> outputs() {
    return List.of("out", "done");
  }

  @Override
  public long output(String port, ToLongFunction<String> inputs) {
    if (port.equals("done"))
      return done ? 1 : 0;
    return value;
  }

  @Override
  public void clock(ToLongFunction<String> inputs) {
    done = inputs.applyAsLong("write_en") != 0;
    if (done)
      value = mask(inputs.applyAsLong("in"));
  }

  @Override
  public void reset() {
    value = 0;
    done = false;
  }

  /** Overwrites the stored value, for setting up a simulation. */
  public void set(long newValue) { value = mask(newValue); }
}
