package ctrlsynth.backend;

import ctrlsynth.util.Log2;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State register with its transition table. State 0 is the idle/entry state and the reset value.
 * A state machine with no active transition keeps its state.
 */
public class StateMachine {
  public enum Kind {
    /** Control scope sequencer. */
    FSM,
    /** Static island cycle counter or repeat iteration counter. */
    COUNTER
  }

  public final String name;
  public final Kind kind;
  public final int numStates;
  public final int width;
  private final List<Transition> transitions;

  public StateMachine(String name, Kind kind, int numStates, List<Transition> transitions) {
    this.name = Objects.requireNonNull(name);
    this.kind = kind;
    this.numStates = numStates;
    this.width = Log2.stateBits(numStates);
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
  }

  public List<Transition> getTransitions() { return transitions; }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, numStates, transitions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    StateMachine other = (StateMachine)obj;
    return name.equals(other.name) && kind == other.kind && numStates == other.numStates && transitions.equals(other.transitions);
  }

  @Override
  public String toString() {
    return (kind == Kind.FSM ? "fsm " : "counter ") + name + "<" + numStates + " states, " + width + " bits>";
  }
}
