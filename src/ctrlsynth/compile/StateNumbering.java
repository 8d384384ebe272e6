package ctrlsynth.compile;

import ctrlsynth.ir.ControlNode;
import java.util.IdentityHashMap;

/**
 * Assigns state numbers within one control scope before scheduling.
 * Every unit and every condition evaluation point gets its own state. A branch or loop at the very start of a scope
 * starts its children at state 1, so state 0 remains the entry state.
 */
public class StateNumbering {
  private final CompilationContext ctx;
  private final IdentityHashMap<ControlNode, Integer> unitStates = new IdentityHashMap<>();
  private final IdentityHashMap<ControlNode, Integer> evalStates = new IdentityHashMap<>();
  private int size;

  private StateNumbering(CompilationContext ctx) { this.ctx = ctx; }

  public static StateNumbering compute(CompilationContext ctx, ControlNode root) {
    StateNumbering ret = new StateNumbering(ctx);
    ret.size = Math.max(1, ret.assign(root, 0));
    return ret;
  }

  /** Number of states handed out, state 0 included. */
  public int size() { return size; }

  public int unitState(ControlNode node) {
    Integer ret = unitStates.get(node);
    if (ret == null)
      throw new IllegalStateException("No state assigned to " + node);
    return ret;
  }

  public int evalState(ControlNode node) {
    Integer ret = evalStates.get(node);
    if (ret == null)
      throw new IllegalStateException("No evaluation state assigned to " + node);
    return ret;
  }

  /** True if the condition of this branch or loop is evaluated in a state of its own. */
  public boolean needsEvalState(ControlNode node) {
    if (node instanceof ControlNode.While)
      return ((ControlNode.While)node).condGroup != null;
    if (node instanceof ControlNode.If)
      return ((ControlNode.If)node).condGroup != null && !ctx.config.early_reset;
    return false;
  }

  private int assign(ControlNode node, int cur) {
    if (ctx.isAtomic(node)) {
      unitStates.put(node, cur);
      return cur + 1;
    }
    if (node instanceof ControlNode.Empty)
      return cur;
    if (node instanceof ControlNode.Seq) {
      ControlNode.Seq seq = (ControlNode.Seq)node;
      for (ControlNode child : seq.stmts)
        cur = assign(child, cur);
      return cur;
    }
    int start;
    if (needsEvalState(node)) {
      evalStates.put(node, cur);
      start = cur + 1;
    } else {
      start = (cur == 0) ? 1 : cur;
    }
    if (node instanceof ControlNode.If) {
      ControlNode.If branch = (ControlNode.If)node;
      int afterThen = assign(branch.thenBranch, start);
      return assign(branch.elseBranch, afterThen);
    }
    if (node instanceof ControlNode.While)
      return assign(((ControlNode.While)node).body, start);
    if (node instanceof ControlNode.Repeat)
      return assign(((ControlNode.Repeat)node).body, start);
    throw new IllegalStateException("Unexpected control node " + node);
  }
}
