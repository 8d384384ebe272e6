package ctrlsynth.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Immutable control tree over the groups of a {@link GroupCatalog}.
 * Nodes are compared by identity; the compiler keys its per-node tables on node instances.
 * Any node may carry a static latency annotation, which requests counter-based compilation of the subtree.
 */
public abstract class ControlNode {
  private final OptionalInt staticHint;

  protected ControlNode(OptionalInt staticHint) { this.staticHint = staticHint; }

  /** Annotated latency in cycles, if the frontend requested static compilation of this subtree. */
  public OptionalInt getStaticHint() { return staticHint; }

  /** Returns a copy of this node carrying the given static latency annotation. */
  public abstract ControlNode withStaticHint(int cycles);

  /** Direct children in program order. */
  public List<ControlNode> children() { return List.of(); }

  public static Enable enable(String group) { return new Enable(group, OptionalInt.empty()); }
  public static Seq seq(ControlNode... children) { return new Seq(Arrays.asList(children), OptionalInt.empty()); }
  public static Seq seq(List<ControlNode> children) { return new Seq(children, OptionalInt.empty()); }
  public static Par par(ControlNode... children) { return new Par(Arrays.asList(children), OptionalInt.empty()); }
  public static Par par(List<ControlNode> children) { return new Par(children, OptionalInt.empty()); }
  public static If ifPort(Port port, ControlNode thenBranch, ControlNode elseBranch) {
    return new If(port, null, thenBranch, elseBranch, OptionalInt.empty());
  }
  public static If ifComb(Port port, String condGroup, ControlNode thenBranch, ControlNode elseBranch) {
    return new If(port, Objects.requireNonNull(condGroup), thenBranch, elseBranch, OptionalInt.empty());
  }
  public static While whilePort(Port port, ControlNode body) { return new While(port, null, body, OptionalInt.empty()); }
  public static While whileComb(Port port, String condGroup, ControlNode body) {
    return new While(port, Objects.requireNonNull(condGroup), body, OptionalInt.empty());
  }
  public static Repeat repeat(int count, ControlNode body) { return new Repeat(count, body, OptionalInt.empty()); }
  public static Invoke invoke(String cell, Map<String, Source> inputs, Map<String, Port> outputs) {
    return new Invoke(cell, inputs, outputs, OptionalInt.empty());
  }
  public static Empty empty() { return new Empty(OptionalInt.empty()); }

  protected String hintSuffix() { return staticHint.isPresent() ? " @static(" + staticHint.getAsInt() + ")" : ""; }

  public static final class Enable extends ControlNode {
    public final String group;
    private Enable(String group, OptionalInt hint) {
      super(hint);
      this.group = Objects.requireNonNull(group);
    }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new Enable(group, OptionalInt.of(cycles));
    }
    @Override
    public String toString() {
      return group + ";" + hintSuffix();
    }
  }

  public static final class Seq extends ControlNode {
    public final List<ControlNode> stmts;
    private Seq(List<ControlNode> stmts, OptionalInt hint) {
      super(hint);
      this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
    }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new Seq(stmts, OptionalInt.of(cycles));
    }
    @Override
    public List<ControlNode> children() {
      return stmts;
    }
    @Override
    public String toString() {
      return "seq {" + stmts.stream().map(Object::toString).collect(Collectors.joining(" ")) + "}" + hintSuffix();
    }
  }

  /** Parallel composition; child order carries no meaning. */
  public static final class Par extends ControlNode {
    public final List<ControlNode> stmts;
    private Par(List<ControlNode> stmts, OptionalInt hint) {
      super(hint);
      this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
    }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new Par(stmts, OptionalInt.of(cycles));
    }
    @Override
    public List<ControlNode> children() {
      return stmts;
    }
    @Override
    public String toString() {
      return "par {" + stmts.stream().map(Object::toString).collect(Collectors.joining(" ")) + "}" + hintSuffix();
    }
  }

  public static final class If extends ControlNode {
    public final Port port;
    /** Comb group computing {@link #port}, or null if the port is read directly. */
    public final String condGroup;
    public final ControlNode thenBranch;
    public final ControlNode elseBranch;
    private If(Port port, String condGroup, ControlNode thenBranch, ControlNode elseBranch, OptionalInt hint) {
      super(hint);
      this.port = Objects.requireNonNull(port);
      this.condGroup = condGroup;
      this.thenBranch = Objects.requireNonNull(thenBranch);
      this.elseBranch = Objects.requireNonNull(elseBranch);
    }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new If(port, condGroup, thenBranch, elseBranch, OptionalInt.of(cycles));
    }
    @Override
    public List<ControlNode> children() {
      return List.of(thenBranch, elseBranch);
    }
    @Override
    public String toString() {
      return "if " + port + (condGroup != null ? " with " + condGroup : "") + " {" + thenBranch + "} else {" + elseBranch + "}" +
          hintSuffix();
    }
  }

  public static final class While extends ControlNode {
    public final Port port;
    /** Comb group computing {@link #port}, or null if the port is read directly. */
    public final String condGroup;
    public final ControlNode body;
    private While(Port port, String condGroup, ControlNode body, OptionalInt hint) {
      super(hint);
      this.port = Objects.requireNonNull(port);
      this.condGroup = condGroup;
      this.body = Objects.requireNonNull(body);
    }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new While(port, condGroup, body, OptionalInt.of(cycles));
    }
    @Override
    public List<ControlNode> children() {
      return List.of(body);
    }
    @Override
    public String toString() {
      return "while " + port + (condGroup != null ? " with " + condGroup : "") + " {" + body + "}" + hintSuffix();
    }
  }

  public static final class Repeat extends ControlNode {
    public final int count;
    public final ControlNode body;
    private Repeat(int count, ControlNode body, OptionalInt hint) {
      super(hint);
      this.count = count;
      this.body = Objects.requireNonNull(body);
    }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new Repeat(count, body, OptionalInt.of(cycles));
    }
    @Override
    public List<ControlNode> children() {
      return List.of(body);
    }
    @Override
    public String toString() {
      return "repeat " + count + " {" + body + "}" + hintSuffix();
    }
  }

  /** Runs a go/done cell with the given port bindings. */
  public static final class Invoke extends ControlNode {
    public final String cell;
    /** Cell input port name to the value driven into it. */
    public final Map<String, Source> inputs;
    /** Cell output port name to the port receiving it. */
    public final Map<String, Port> outputs;
    private Invoke(String cell, Map<String, Source> inputs, Map<String, Port> outputs, OptionalInt hint) {
      super(hint);
      this.cell = Objects.requireNonNull(cell);
      this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
      this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new Invoke(cell, inputs, outputs, OptionalInt.of(cycles));
    }
    @Override
    public String toString() {
      return "invoke " + cell + "(" + inputs.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) +
          ")(" + outputs.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ");" +
          hintSuffix();
    }
  }

  public static final class Empty extends ControlNode {
    private Empty(OptionalInt hint) { super(hint); }
    @Override
    public ControlNode withStaticHint(int cycles) {
      return new Empty(OptionalInt.of(cycles));
    }
    @Override
    public String toString() {
      return "empty;" + hintSuffix();
    }
  }
}
