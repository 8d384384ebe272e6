package ctrlsynth.compile;

import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.Latency;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Latency inference over the control tree and selection of the subtrees compiled as static islands.
 * Inference fails closed: any dynamic leaf or loop makes the enclosing subtree dynamic, and so does a latency beyond the
 * {@code int} range.
 */
public class StaticTiming {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompilationContext ctx;
  private final IdentityHashMap<ControlNode, OptionalInt> latencies = new IdentityHashMap<>();

  public StaticTiming(CompilationContext ctx) { this.ctx = ctx; }

  /**
   * Cycle count of a subtree, or empty if it depends on dynamic completion.
   * Conditionals are static only if both branches take equally long.
   */
  public OptionalInt latency(ControlNode node) throws CompileError {
    OptionalInt cached = latencies.get(node);
    if (cached != null)
      return cached;
    OptionalInt ret = infer(node);
    latencies.put(node, ret);
    return ret;
  }

  private OptionalInt infer(ControlNode node) throws CompileError {
    if (node instanceof ControlNode.Empty)
      return OptionalInt.of(0);
    if (node instanceof ControlNode.Enable) {
      ControlNode.Enable enable = (ControlNode.Enable)node;
      Latency latency = ctx.group(enable.group).latency;
      return latency.isStatic() ? OptionalInt.of(latency.cycles) : OptionalInt.empty();
    }
    if (node instanceof ControlNode.Seq) {
      ControlNode.Seq seq = (ControlNode.Seq)node;
      int sum = 0;
      for (ControlNode child : seq.stmts) {
        OptionalInt childLatency = latency(child);
        if (childLatency.isEmpty())
          return OptionalInt.empty();
        try {
          sum = Math.addExact(sum, childLatency.getAsInt());
        } catch (ArithmeticException e) {
          logger.debug("Latency of {} exceeds the counter range, compiling it dynamically", node);
          return OptionalInt.empty();
        }
      }
      return OptionalInt.of(sum);
    }
    if (node instanceof ControlNode.Par) {
      ControlNode.Par par = (ControlNode.Par)node;
      int max = 0;
      for (ControlNode child : par.stmts) {
        OptionalInt childLatency = latency(child);
        if (childLatency.isEmpty())
          return OptionalInt.empty();
        max = Math.max(max, childLatency.getAsInt());
      }
      return OptionalInt.of(max);
    }
    if (node instanceof ControlNode.If) {
      ControlNode.If branch = (ControlNode.If)node;
      OptionalInt thenLatency = latency(branch.thenBranch);
      OptionalInt elseLatency = latency(branch.elseBranch);
      if (thenLatency.isEmpty() || elseLatency.isEmpty() || thenLatency.getAsInt() != elseLatency.getAsInt())
        return OptionalInt.empty();
      return thenLatency;
    }
    if (node instanceof ControlNode.Repeat) {
      ControlNode.Repeat repeat = (ControlNode.Repeat)node;
      OptionalInt bodyLatency = latency(repeat.body);
      if (bodyLatency.isEmpty())
        return OptionalInt.empty();
      try {
        return OptionalInt.of(Math.multiplyExact(repeat.count, bodyLatency.getAsInt()));
      } catch (ArithmeticException e) {
        logger.debug("Latency of {} exceeds the counter range, compiling it dynamically", node);
        return OptionalInt.empty();
      }
    }
    // While, and anything not lowered yet
    return OptionalInt.empty();
  }

  /** First leaf or loop that keeps the subtree from being static, for diagnostics. */
  public Optional<ControlNode> findDynamicCause(ControlNode node) throws CompileError {
    if (node instanceof ControlNode.While)
      return Optional.of(node);
    if (node instanceof ControlNode.Enable) {
      return latency(node).isPresent() ? Optional.empty() : Optional.of(node);
    }
    for (ControlNode child : node.children()) {
      Optional<ControlNode> ret = findDynamicCause(child);
      if (ret.isPresent())
        return ret;
    }
    if (latency(node).isEmpty())
      return Optional.of(node);
    return Optional.empty();
  }

  private static int countEnables(ControlNode node) {
    if (node instanceof ControlNode.Enable)
      return 1;
    return node.children().stream().mapToInt(StaticTiming::countEnables).sum();
  }

  /**
   * Checks every static annotation against the inferred latency.
   */
  public void validateHints(ControlNode node) throws CompileError {
    OptionalInt hint = node.getStaticHint();
    if (hint.isPresent()) {
      OptionalInt inferred = latency(node);
      if (inferred.isEmpty()) {
        ControlNode cause = findDynamicCause(node).orElse(node);
        throw new CompileError(CompileError.Kind.LATENCY_MISMATCH,
                               "Static compilation requested for a dynamic subtree (" + cause.toString().trim() + ")");
      }
      if (inferred.getAsInt() != hint.getAsInt())
        throw new CompileError(CompileError.Kind.LATENCY_MISMATCH,
                               "Annotated latency " + hint.getAsInt() + " does not match inferred latency " + inferred.getAsInt() + " of " +
                                   node);
    }
    for (ControlNode child : node.children())
      validateHints(child);
  }

  /**
   * Selects the maximal subtrees to compile as static islands.
   * Annotated subtrees are always selected; others only with promotion enabled and within the configured thresholds.
   */
  public Set<ControlNode> selectPromoted(ControlNode root) throws CompileError {
    Set<ControlNode> ret = Collections.newSetFromMap(new IdentityHashMap<>());
    select(root, ret);
    return ret;
  }

  private void select(ControlNode node, Set<ControlNode> out) throws CompileError {
    if (shouldPromote(node)) {
      logger.debug("Promoting to static island ({} cycles): {}", latency(node).getAsInt(), node);
      out.add(node);
      return;
    }
    for (ControlNode child : node.children())
      select(child, out);
  }

  private boolean shouldPromote(ControlNode node) throws CompileError {
    if (node instanceof ControlNode.Enable || node instanceof ControlNode.Empty)
      return false;
    OptionalInt nodeLatency = latency(node);
    // the island counter needs latency + 1 states
    if (nodeLatency.isEmpty() || nodeLatency.getAsInt() == 0 || nodeLatency.getAsInt() == Integer.MAX_VALUE)
      return false;
    if (node.getStaticHint().isPresent())
      return true;
    if (!ctx.config.static_promotion)
      return false;
    if (countEnables(node) < ctx.config.promotion_threshold)
      return false;
    if (ctx.config.promotion_cycle_limit > 0 && nodeLatency.getAsInt() > ctx.config.promotion_cycle_limit) {
      logger.debug("Not promoting {}: latency {} exceeds the cycle limit", node, nodeLatency.getAsInt());
      return false;
    }
    return true;
  }
}
