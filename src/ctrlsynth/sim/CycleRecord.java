package ctrlsynth.sim;

import ctrlsynth.ir.Port;
import java.util.Collections;
import java.util.Map;

/** Settled port values and state machine states of one simulated cycle, before its clock edge. */
public final class CycleRecord {
  public final int cycle;
  public final boolean go;
  private final Map<Port, Long> values;
  private final Map<String, Integer> states;

  public CycleRecord(int cycle, boolean go, Map<Port, Long> values, Map<String, Integer> states) {
    this.cycle = cycle;
    this.go = go;
    this.values = Collections.unmodifiableMap(values);
    this.states = Collections.unmodifiableMap(states);
  }

  /** Value of a port in this cycle; ports nothing drives read as 0. */
  public long value(Port port) { return values.getOrDefault(port, 0L); }

  public boolean isHigh(Port port) { return value(port) != 0; }

  public int state(String stateMachine) {
    Integer ret = states.get(stateMachine);
    if (ret == null)
      throw new IllegalArgumentException("No state machine " + stateMachine);
    return ret;
  }

  public Map<Port, Long> getValues() { return values; }
  public Map<String, Integer> getStates() { return states; }

  @Override
  public String toString() {
    return "cycle " + cycle + (go ? " go" : "") + " " + states;
  }
}
