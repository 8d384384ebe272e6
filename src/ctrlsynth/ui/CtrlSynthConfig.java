package ctrlsynth.ui;

/**
 * Data-Class to hold tool options.
 */
public class CtrlSynthConfig {

  /** Start the next group in the cycle its predecessor signals done. */
  public boolean early_transitions = true;
  /** Hoist comb condition groups into the preceding cycle instead of giving them a settle state. */
  public boolean early_reset = true;

  public boolean static_promotion = true;
  /** Minimum number of enabled groups in a subtree before it is promoted to a counter. */
  public int promotion_threshold = 2;
  /** Largest latency to promote, 0 for no limit. */
  public int promotion_cycle_limit = 0;

  public boolean check_exclusivity = true;
  public int exclusivity_cube_limit = 50000;

  /** Log every scope's schedule before realization. */
  public boolean dump_fsm = false;
}
