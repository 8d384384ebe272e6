package ctrlsynth.compile;

import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import java.util.Objects;

/**
 * Stored branch decision of a multi-cycle conditional inside a static island.
 * {@link #stored} holds the condition value sampled on the first cycle, {@link #valid} marks the stored value as current.
 */
public final class ConditionLatch {
  public final Port condition;
  public final String stored;
  public final String valid;

  public ConditionLatch(Port condition, String stored, String valid) {
    this.condition = Objects.requireNonNull(condition);
    this.stored = Objects.requireNonNull(stored);
    this.valid = Objects.requireNonNull(valid);
  }

  /** Branch decision: the stored value while valid, the live condition otherwise. */
  public Guard decision() {
    Guard isValid = Guard.port(Port.cell(valid, "out"));
    return isValid.and(Guard.port(Port.cell(stored, "out"))).or(isValid.not().and(Guard.port(condition)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, stored, valid);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ConditionLatch))
      return false;
    ConditionLatch other = (ConditionLatch)obj;
    return condition.equals(other.condition) && stored.equals(other.stored) && valid.equals(other.valid);
  }

  @Override
  public String toString() {
    return stored + "/" + valid + " for " + condition;
  }
}
