package ctrlsynth.compile;

import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;

/**
 * Go/done interface of a control node that occupies a single state of its enclosing scope:
 * an enabled group, a compiled parallel composition or a static island.
 */
public record ControlUnit(String name, Port go, Port done) {
  public Guard doneGuard() { return Guard.port(done); }
}
