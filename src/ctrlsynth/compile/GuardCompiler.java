package ctrlsynth.compile;

import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Produces the flat assignment list of a compiled program.
 * Group assignments are gated with the group's go hole, except writes to the group's own done hole, which report completion
 * independently of go. Control logic and continuous assignments are taken as they are.
 * Assignments with the same destination and source are merged into one whose guard is the disjunction.
 */
public class GuardCompiler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompilationContext ctx;

  public GuardCompiler(CompilationContext ctx) { this.ctx = ctx; }

  /**
   * @param control assignments of every compiled scope, island and parallel composition
   * @param topGo the component's go port
   * @param topDone the done predicate of the top-level scope
   * @param topDonePort the component's done port
   */
  public List<Assignment> flatten(List<Assignment> control, Port topGo, Guard topDone, Port topDonePort) throws CompileError {
    List<Assignment> raw = new ArrayList<>();
    for (Group group : ctx.getUsedGroups()) {
      Guard go = Guard.port(group.go());
      Port done = group.done();
      for (Assignment assignment : group.getAssignments())
        raw.add(assignment.dest.equals(done) ? assignment : assignment.gatedBy(go));
    }
    raw.addAll(ctx.catalog.getContinuous());
    raw.addAll(control);
    raw.add(new Assignment(topDonePort, Guard.port(topGo).and(topDone), Source.ONE));
    List<Assignment> ret = coalesce(raw);
    logger.debug("Flattened {} assignments into {}", raw.size(), ret.size());
    return ret;
  }

  private static final class Key {
    final Port dest;
    final Source source;
    Key(Assignment assignment) {
      this.dest = assignment.dest;
      this.source = assignment.source;
    }
    @Override
    public int hashCode() {
      return Objects.hash(dest, source);
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Key))
        return false;
      Key other = (Key)obj;
      return dest.equals(other.dest) && source.equals(other.source);
    }
  }

  /** Merges assignments of equal destination and source, keeping first-occurrence order. Never-active assignments are dropped. */
  public static List<Assignment> coalesce(List<Assignment> assignments) {
    LinkedHashMap<Key, Assignment> merged = new LinkedHashMap<>();
    for (Assignment assignment : assignments) {
      if (assignment.guard.isFalse())
        continue;
      merged.merge(new Key(assignment), assignment, (a, b) -> a.withGuard(a.guard.or(b.guard)));
    }
    return new ArrayList<>(merged.values());
  }
}
