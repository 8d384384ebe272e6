package ctrlsynth.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared instance of a primitive. Cells with a go/done interface carry a latency, which is what {@code invoke} relies on.
 */
public class CellDecl {
  public final String name;
  /** Primitive type name, e.g. {@code std_reg}. */
  public final String type;
  private final Map<String, Long> params;
  private final Latency latency;

  public CellDecl(String name, String type, Map<String, Long> params, Latency latency) {
    this.name = Objects.requireNonNull(name);
    this.type = Objects.requireNonNull(type);
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    this.latency = latency;
  }
  public CellDecl(String name, String type, Map<String, Long> params) { this(name, type, params, null); }

  /** One-bit register, as allocated for latches by the compiler. */
  public static CellDecl register(String name, int width) { return new CellDecl(name, "std_reg", Map.of("width", (long)width)); }

  public Map<String, Long> getParams() { return params; }

  public long param(String key, long defaultValue) { return params.getOrDefault(key, defaultValue); }

  /** Latency of the go/done interface, if the cell has one. */
  public Optional<Latency> getLatency() { return Optional.ofNullable(latency); }

  public Port port(String portName) { return Port.cell(name, portName); }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, params, latency);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    CellDecl other = (CellDecl)obj;
    return name.equals(other.name) && type.equals(other.type) && params.equals(other.params) && Objects.equals(latency, other.latency);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(name).append(" = ").append(type).append("(");
    sb.append(String.join(", ", params.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).toArray(String[]::new)));
    sb.append(")");
    if (latency != null)
      sb.append(" ").append(latency);
    return sb.toString();
  }
}
