package ctrlsynth;

import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Port;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Random;

/**
 * Random control trees over fresh groups of a {@link TestProgramBuilder}.
 */
public class RandomControl {
  private final Random rand;
  private final TestProgramBuilder builder;
  private final IdentityHashMap<ControlNode, Integer> latencies = new IdentityHashMap<>();
  private int nextId = 0;

  public RandomControl(Random rand, TestProgramBuilder builder) {
    this.rand = rand;
    this.builder = builder;
  }

  private String fresh(String prefix) { return prefix + (nextId++); }

  private Port condition() {
    Port flag = builder.flag(fresh("flag"), rand.nextInt(2));
    if (rand.nextBoolean())
      return flag;
    return builder.combCondition(fresh("c"), flag);
  }

  /** Condition group that computes the given port, or null if the port is read directly. */
  private static String condGroupOf(Port port) { return port.owner.startsWith("w_") ? port.owner.substring(2) : null; }

  private ControlNode branch(ControlNode thenBranch, ControlNode elseBranch) {
    Port port = condition();
    String condGroup = condGroupOf(port);
    if (condGroup == null)
      return ControlNode.ifPort(port, thenBranch, elseBranch);
    return ControlNode.ifComb(port, condGroup, thenBranch, elseBranch);
  }

  private List<ControlNode> children(int depth, boolean dynamic) {
    int count = 2 + rand.nextInt(2);
    List<ControlNode> ret = new ArrayList<>();
    for (int i = 0; i < count; i++)
      ret.add(dynamic ? dynamic(depth) : staticTree(depth));
    return ret;
  }

  /** Tree with dynamic and static groups, conditionals and terminating loops. */
  public ControlNode dynamic(int depth) {
    int choice = (depth <= 0) ? rand.nextInt(2) * 6 : rand.nextInt(8);
    switch (choice) {
    case 1:
      return ControlNode.seq(children(depth - 1, true));
    case 2:
      return ControlNode.par(children(depth - 1, true));
    case 3:
      return branch(dynamic(depth - 1), rand.nextInt(3) == 0 ? ControlNode.empty() : dynamic(depth - 1));
    case 4:
      return builder.countedLoop(rand.nextInt(3), dynamic(depth - 1), rand.nextBoolean());
    case 5:
      return ControlNode.repeat(rand.nextInt(4), dynamic(depth - 1));
    case 6:
      return ControlNode.enable(builder.staticGroup(fresh("s"), 1 + rand.nextInt(3)));
    default:
      return ControlNode.enable(builder.dynamicGroup(fresh("g"), 1 + rand.nextInt(3)));
    }
  }

  /**
   * Tree of static groups whose done-polling compilation restarts every node without idle cycles: conditionals have branches
   * of equal latency and parallel children start with a group or a parallel composition.
   */
  public ControlNode staticTree(int depth) {
    int choice = (depth <= 0) ? 0 : rand.nextInt(5);
    ControlNode ret;
    switch (choice) {
    case 1:
      ret = ControlNode.seq(children(depth - 1, false));
      latencies.put(ret, ret.children().stream().mapToInt(this::latency).sum());
      return ret;
    case 2: {
      int count = 2 + rand.nextInt(2);
      List<ControlNode> stmts = new ArrayList<>();
      for (int i = 0; i < count; i++)
        stmts.add(parChild(depth - 1));
      ret = ControlNode.par(stmts);
      latencies.put(ret, stmts.stream().mapToInt(this::latency).max().getAsInt());
      return ret;
    }
    case 3: {
      ControlNode taken = staticTree(depth - 1);
      ControlNode other = staticGroup(latency(taken));
      ret = rand.nextBoolean() ? branch(taken, other) : branch(other, taken);
      latencies.put(ret, latency(taken));
      return ret;
    }
    case 4: {
      int count = 2 + rand.nextInt(2);
      ControlNode body = staticTree(depth - 1);
      ret = ControlNode.repeat(count, body);
      latencies.put(ret, count * latency(body));
      return ret;
    }
    default:
      return staticGroup(1 + rand.nextInt(3));
    }
  }

  private ControlNode parChild(int depth) {
    switch ((depth <= 0) ? 0 : rand.nextInt(3)) {
    case 1: {
      int count = 2 + rand.nextInt(2);
      List<ControlNode> stmts = new ArrayList<>();
      for (int i = 0; i < count; i++)
        stmts.add(parChild(depth - 1));
      ControlNode ret = ControlNode.par(stmts);
      latencies.put(ret, stmts.stream().mapToInt(this::latency).max().getAsInt());
      return ret;
    }
    case 2: {
      List<ControlNode> stmts = new ArrayList<>();
      stmts.add(staticGroup(1 + rand.nextInt(3)));
      stmts.add(staticTree(depth - 1));
      ControlNode ret = ControlNode.seq(stmts);
      latencies.put(ret, stmts.stream().mapToInt(this::latency).sum());
      return ret;
    }
    default:
      return staticGroup(1 + rand.nextInt(3));
    }
  }

  private ControlNode staticGroup(int cycles) {
    ControlNode ret = ControlNode.enable(builder.staticGroup(fresh("s"), cycles));
    latencies.put(ret, cycles);
    return ret;
  }

  /** Latency of a tree built by {@link #staticTree}. */
  public int latency(ControlNode node) {
    Integer ret = latencies.get(node);
    if (ret == null)
      throw new IllegalArgumentException("Not a generated static tree: " + node);
    return ret;
  }
}
