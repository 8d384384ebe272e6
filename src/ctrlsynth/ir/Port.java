package ctrlsynth.ir;

import java.util.Objects;

/**
 * Reference to a signal: a port of a declared cell, a go/done hole of a group or control scope, or a port of the compiled component
 * itself.
 */
public final class Port implements Comparable<Port> {
  public enum Kind { CELL, HOLE, COMPONENT }

  public static final String GO = "go";
  public static final String DONE = "done";

  /** Owner name used for component ports. */
  public static final String COMPONENT_OWNER = "this";

  public final Kind kind;
  public final String owner;
  public final String name;

  private Port(Kind kind, String owner, String name) {
    this.kind = Objects.requireNonNull(kind);
    this.owner = Objects.requireNonNull(owner);
    this.name = Objects.requireNonNull(name);
  }

  public static Port cell(String cell, String port) { return new Port(Kind.CELL, cell, port); }
  public static Port hole(String owner, String hole) { return new Port(Kind.HOLE, owner, hole); }
  public static Port component(String port) { return new Port(Kind.COMPONENT, COMPONENT_OWNER, port); }

  public static Port goHole(String owner) { return hole(owner, GO); }
  public static Port doneHole(String owner) { return hole(owner, DONE); }

  public boolean isHole() { return kind == Kind.HOLE; }
  public boolean isGoHole() { return kind == Kind.HOLE && name.equals(GO); }
  public boolean isDoneHole() { return kind == Kind.HOLE && name.equals(DONE); }

  @Override
  public int hashCode() {
    return Objects.hash(kind, owner, name);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Port other = (Port)obj;
    return kind == other.kind && owner.equals(other.owner) && name.equals(other.name);
  }

  @Override
  public int compareTo(Port o) {
    int cmp = owner.compareTo(o.owner);
    if (cmp == 0)
      cmp = name.compareTo(o.name);
    if (cmp == 0)
      cmp = kind.compareTo(o.kind);
    return cmp;
  }

  @Override
  public String toString() {
    if (kind == Kind.HOLE)
      return owner + "[" + name + "]";
    return owner + "." + name;
  }
}
