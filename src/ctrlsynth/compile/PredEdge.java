package ctrlsynth.compile;

import ctrlsynth.ir.Guard;

/**
 * A way into the next control node: while in {@code state} and {@code guard} holds, the preceding node completes.
 * @param settling the predecessor is a condition evaluation state whose value is only settled at the end of the cycle;
 *                 no group may be started early from it
 * @param combCond the guard reads a condition port computed by a comb group
 */
public record PredEdge(int state, Guard guard, boolean settling, boolean combCond) {
  public PredEdge(int state, Guard guard) { this(state, guard, false, false); }

  public PredEdge and(Guard extra) { return new PredEdge(state, guard.and(extra), settling, combCond); }

  public PredEdge withCombCond() { return new PredEdge(state, guard, settling, true); }

  @Override
  public String toString() {
    return "(" + state + ", " + guard + (settling ? ", settling" : "") + (combCond ? ", comb" : "") + ")";
  }
}
