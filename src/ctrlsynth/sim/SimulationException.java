package ctrlsynth.sim;

/**
 * Run-time violation found while simulating a compiled program: several active drivers on one port, combinational logic that does
 * not settle, or conflicting state transitions.
 */
public class SimulationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public final int cycle;

  public SimulationException(int cycle, String message) {
    super("cycle " + cycle + ": " + message);
    this.cycle = cycle;
  }
}
