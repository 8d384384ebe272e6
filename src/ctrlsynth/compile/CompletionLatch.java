package ctrlsynth.compile;

import ctrlsynth.ir.Port;
import java.util.Objects;

/**
 * One-bit register remembering that a child of a parallel composition finished while its siblings are still running.
 * Set on the child's done pulse unless the join fires in the same cycle, cleared when the join fires.
 */
public final class CompletionLatch {
  public enum State {
    IDLE,
    FINISHED;

    public static State decode(long registerValue) { return (registerValue != 0) ? FINISHED : IDLE; }
  }

  /** Name of the parallel composition's hole. */
  public final String parName;
  /** Readable name of the child, the group name for enables. */
  public final String childName;
  public final int childIndex;
  /** Backing register cell. */
  public final String register;

  public CompletionLatch(String parName, String childName, int childIndex, String register) {
    this.parName = Objects.requireNonNull(parName);
    this.childName = Objects.requireNonNull(childName);
    this.childIndex = childIndex;
    this.register = Objects.requireNonNull(register);
  }

  public Port out() { return Port.cell(register, "out"); }
  public Port in() { return Port.cell(register, "in"); }
  public Port writeEnable() { return Port.cell(register, "write_en"); }

  @Override
  public int hashCode() {
    return Objects.hash(parName, childName, childIndex, register);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CompletionLatch))
      return false;
    CompletionLatch other = (CompletionLatch)obj;
    return parName.equals(other.parName) && childName.equals(other.childName) && childIndex == other.childIndex &&
        register.equals(other.register);
  }

  @Override
  public String toString() {
    return register + " (" + parName + " child " + childIndex + ": " + childName + ")";
  }
}
