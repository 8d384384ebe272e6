package ctrlsynth.ir;

import java.util.Objects;

/** Timing class of a group or go/done cell. */
public final class Latency {
  public enum Kind { DYNAMIC, STATIC, COMBINATIONAL }

  public static final Latency DYNAMIC = new Latency(Kind.DYNAMIC, 0);
  public static final Latency COMBINATIONAL = new Latency(Kind.COMBINATIONAL, 0);

  public final Kind kind;
  /** Cycle count for {@link Kind#STATIC}, 0 otherwise. */
  public final int cycles;

  private Latency(Kind kind, int cycles) {
    this.kind = kind;
    this.cycles = cycles;
  }

  public static Latency ofStatic(int cycles) {
    if (cycles < 1)
      throw new IllegalArgumentException("Static latency must be at least one cycle, got " + cycles);
    return new Latency(Kind.STATIC, cycles);
  }

  public boolean isStatic() { return kind == Kind.STATIC; }
  public boolean isDynamic() { return kind == Kind.DYNAMIC; }
  public boolean isCombinational() { return kind == Kind.COMBINATIONAL; }

  @Override
  public int hashCode() {
    return Objects.hash(kind, cycles);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Latency))
      return false;
    Latency other = (Latency)obj;
    return kind == other.kind && cycles == other.cycles;
  }

  @Override
  public String toString() {
    switch (kind) {
    case STATIC:
      return "static<" + cycles + ">";
    case COMBINATIONAL:
      return "comb";
    default:
      return "dynamic";
    }
  }
}
