package ctrlsynth.ir;

import java.util.Objects;
import java.util.function.ToLongFunction;

/** Right-hand side of an assignment: a constant or a port read. */
public final class Source {
  public static final Source ONE = constant(1, 1);
  public static final Source ZERO = constant(0, 1);

  /** Port to read from, or null for constants. */
  public final Port port;
  public final long value;
  public final int width;

  private Source(Port port, long value, int width) {
    this.port = port;
    this.value = value;
    this.width = width;
  }

  public static Source constant(long value, int width) {
    if (width < 1 || width > 64)
      throw new IllegalArgumentException("Constant width out of range: " + width);
    return new Source(null, value, width);
  }
  public static Source of(Port port) { return new Source(Objects.requireNonNull(port), 0, 0); }

  public boolean isConstant() { return port == null; }

  public long evaluate(ToLongFunction<Port> portValues) {
    return isConstant() ? value : portValues.applyAsLong(port);
  }

  @Override
  public int hashCode() {
    return Objects.hash(port, value, width);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Source other = (Source)obj;
    return Objects.equals(port, other.port) && value == other.value && width == other.width;
  }

  @Override
  public String toString() {
    if (port != null)
      return port.toString();
    return (width == 1) ? Long.toString(value) : (width + "'d" + value);
  }
}
