package ctrlsynth.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named set of guarded assignments with a go/done handshake.
 * The assignments are local: the control compiler gates them with the group's go hole when flattening.
 */
public class Group {
  public final String name;
  public final Latency latency;
  private final List<Assignment> assignments;

  public Group(String name, Latency latency, List<Assignment> assignments) {
    this.name = Objects.requireNonNull(name);
    this.latency = Objects.requireNonNull(latency);
    this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
  }

  public List<Assignment> getAssignments() { return assignments; }

  public Port go() { return Port.goHole(name); }
  public Port done() { return Port.doneHole(name); }

  public boolean isCombinational() { return latency.isCombinational(); }

  /** True if some assignment of this group drives its done hole. */
  public boolean hasDoneAssignment() {
    Port done = done();
    return assignments.stream().anyMatch(assignment -> assignment.dest.equals(done));
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, latency, assignments);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Group other = (Group)obj;
    return name.equals(other.name) && latency.equals(other.latency) && assignments.equals(other.assignments);
  }

  @Override
  public String toString() {
    return "group " + name + " (" + latency + ")";
  }
}
