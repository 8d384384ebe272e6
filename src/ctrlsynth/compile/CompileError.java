package ctrlsynth.compile;

/**
 * Compile failure of a control program. None of these are recoverable: the caller receives no partial result.
 */
public class CompileError extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** A control node references a group that is not in the catalog. */
    UNKNOWN_GROUP,
    /** An invoke or a group assignment references an undeclared cell. */
    UNKNOWN_CELL,
    /** Mutual exclusion of the drivers of a port or of a transition table could not be proven. */
    NON_EXCLUSIVE_GUARD,
    /** Static compilation was requested for a subtree that is dynamic or has a different latency. */
    LATENCY_MISMATCH,
    /** A group polled for completion has no assignment driving its done hole. */
    MISSING_DONE,
    /** Structurally invalid control, such as enabling a comb group. */
    MALFORMED_CONTROL
  }

  public final Kind kind;

  public CompileError(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  @Override
  public String getMessage() {
    return kind + ": " + super.getMessage();
  }
}
