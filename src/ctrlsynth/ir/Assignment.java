package ctrlsynth.ir;

import java.util.Objects;

/** A guarded signal assignment {@code dest = guard ? source}. */
public final class Assignment {
  public final Port dest;
  public final Guard guard;
  public final Source source;

  public Assignment(Port dest, Guard guard, Source source) {
    this.dest = Objects.requireNonNull(dest);
    this.guard = Objects.requireNonNull(guard);
    this.source = Objects.requireNonNull(source);
  }

  /** Unconditional assignment. */
  public Assignment(Port dest, Source source) { this(dest, Guard.TRUE, source); }

  /** Returns a copy with {@code extra} conjoined to the guard. */
  public Assignment gatedBy(Guard extra) {
    Guard newGuard = extra.and(guard);
    return (newGuard.equals(guard)) ? this : new Assignment(dest, newGuard, source);
  }

  public Assignment withGuard(Guard newGuard) { return new Assignment(dest, newGuard, source); }

  @Override
  public int hashCode() {
    return Objects.hash(dest, guard, source);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Assignment other = (Assignment)obj;
    return dest.equals(other.dest) && guard.equals(other.guard) && source.equals(other.source);
  }

  @Override
  public String toString() {
    if (guard.isTrue())
      return dest + " = " + source + ";";
    return dest + " = " + guard + " ? " + source + ";";
  }
}
