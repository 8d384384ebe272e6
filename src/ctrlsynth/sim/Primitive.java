package ctrlsynth.sim;

import ctrlsynth.ir.CellDecl;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Behavioural model of a cell. Inputs are read through a function from the port name to its current value.
 * Combinational outputs are computed from the inputs, sequential outputs from the state updated by {@link #clock}.
 */
public abstract class Primitive {
  public final CellDecl decl;
  protected final int width;

  protected Primitive(CellDecl decl) {
    this.decl = decl;
    this.width = (int)decl.param("width", 32);
  }

  /**
   * Creates the model for a cell type.
   * @throws IllegalArgumentException for a type with no model
   */
  public static Primitive create(CellDecl decl) {
    switch (decl.type) {
    case "std_reg":
      return new Register(decl);
    case "std_delay":
      return new Delay(decl);
    default:
      if (CombPrimitive.supports(decl.type))
        return new CombPrimitive(decl);
      throw new IllegalArgumentException("No simulation model for cell " + decl.name + " of type " + decl.type);
    }
  }

  public abstract List<String> outputs();

  public abstract long output(String port, ToLongFunction<String> inputs);

  /** Clock edge. */
  public void clock(ToLongFunction<String> inputs) {}

  public void reset() {}

  protected long mask(long value) { return mask(value, width); }

  protected static long mask(long value, int width) { return (width >= 64) ? value : (value & ((1L << width) - 1)); }
}
