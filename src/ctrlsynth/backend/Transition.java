package ctrlsynth.backend;

import ctrlsynth.ir.Guard;
import java.util.Objects;

/** One row of a transition table: while in {@link #from} and {@link #guard} holds, move to {@link #to} (or count up). */
public final class Transition {
  /** Source state wildcard, used by counters whose guards test the state themselves. */
  public static final int ANY = -1;

  public final int from;
  public final Guard guard;
  /** Target state; ignored for increments. */
  public final int to;
  public final boolean increment;

  private Transition(int from, Guard guard, int to, boolean increment) {
    this.from = from;
    this.guard = Objects.requireNonNull(guard);
    this.to = to;
    this.increment = increment;
  }

  public static Transition to(int from, Guard guard, int to) { return new Transition(from, guard, to, false); }
  public static Transition increment(int from, Guard guard) { return new Transition(from, guard, 0, true); }

  /** Guard including the source state test. */
  public Guard activeGuard(String stateMachine) {
    if (from == ANY)
      return guard;
    return Guard.stateEquals(stateMachine, from).and(guard);
  }

  public int next(int current) { return increment ? current + 1 : to; }

  @Override
  public int hashCode() {
    return Objects.hash(from, guard, to, increment);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Transition))
      return false;
    Transition other = (Transition)obj;
    return from == other.from && to == other.to && increment == other.increment && guard.equals(other.guard);
  }

  @Override
  public String toString() {
    String src = (from == ANY) ? "*" : Integer.toString(from);
    String dst = increment ? "+1" : Integer.toString(to);
    return src + " -> " + dst + (guard.isTrue() ? "" : " when " + guard);
  }
}
