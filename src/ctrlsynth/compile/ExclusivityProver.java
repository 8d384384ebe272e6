package ctrlsynth.compile;

import ctrlsynth.backend.StateMachine;
import ctrlsynth.backend.Transition;
import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.Guard;
import ctrlsynth.ir.Port;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Proves that no two drivers of a port, and no two transitions of a state machine with different targets, can be active in the
 * same cycle.
 * <p>
 * A pair of guards is tried three ways, cheapest first:
 * <ol>
 * <li>structurally, when one guard contains the negation of the other as a conjunct;</li>
 * <li>by expanding the conjunction into a disjunction of cubes and refuting every cube, using the fact that a state machine is in
 * exactly one state;</li>
 * <li>as before, after replacing the go and done holes driven by the control logic with the guards that drive them.</li>
 * </ol>
 * The prover is sound but incomplete: a pair it cannot refute is reported even if it is unreachable.
 */
public class ExclusivityProver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Rounds of hole inlining before giving up. */
  static final int INLINE_DEPTH = 4;

  private final int cubeLimit;
  private final Map<Port, Guard> holeDefinitions = new HashMap<>();

  public ExclusivityProver(List<Assignment> assignments, int cubeLimit) {
    this.cubeLimit = cubeLimit;
    LinkedHashMap<Port, List<Assignment>> byHole = new LinkedHashMap<>();
    for (Assignment assignment : assignments) {
      if (assignment.dest.isHole())
        byHole.computeIfAbsent(assignment.dest, p -> new ArrayList<>()).add(assignment);
    }
    for (Map.Entry<Port, List<Assignment>> entry : byHole.entrySet()) {
      if (!entry.getValue().stream().allMatch(assignment -> assignment.source.isConstant()))
        continue;
      Guard definition = Guard.FALSE;
      for (Assignment assignment : entry.getValue()) {
        if (assignment.source.value != 0)
          definition = definition.or(assignment.guard);
      }
      holeDefinitions.put(entry.getKey(), definition);
    }
  }

  /** Checks every port with several drivers and every state machine. */
  public void verify(List<Assignment> assignments, List<StateMachine> stateMachines) throws CompileError {
    LinkedHashMap<Port, List<Assignment>> byDest = new LinkedHashMap<>();
    for (Assignment assignment : assignments)
      byDest.computeIfAbsent(assignment.dest, p -> new ArrayList<>()).add(assignment);
    int checkedPairs = 0;
    for (Map.Entry<Port, List<Assignment>> entry : byDest.entrySet()) {
      List<Assignment> drivers = entry.getValue();
      for (int i = 0; i < drivers.size(); i++) {
        for (int j = i + 1; j < drivers.size(); j++) {
          ++checkedPairs;
          if (!exclusive(drivers.get(i).guard, drivers.get(j).guard))
            throw new CompileError(CompileError.Kind.NON_EXCLUSIVE_GUARD,
                                   "Drivers of " + entry.getKey() + " may be active together: `" + drivers.get(i) + "` and `" + drivers.get(j) +
                                       "`");
        }
      }
    }
    for (StateMachine sm : stateMachines) {
      List<Transition> transitions = sm.getTransitions();
      for (int i = 0; i < transitions.size(); i++) {
        for (int j = i + 1; j < transitions.size(); j++) {
          Transition a = transitions.get(i);
          Transition b = transitions.get(j);
          if (a.increment == b.increment && (a.increment || a.to == b.to))
            continue;
          if (a.from != Transition.ANY && b.from != Transition.ANY && a.from != b.from)
            continue;
          ++checkedPairs;
          if (!exclusive(a.activeGuard(sm.name), b.activeGuard(sm.name)))
            throw new CompileError(CompileError.Kind.NON_EXCLUSIVE_GUARD,
                                   "Transitions of " + sm.name + " may be taken together: `" + a + "` and `" + b + "`");
        }
      }
    }
    logger.debug("Proved {} guard pairs exclusive", checkedPairs);
  }

  /** True if a and b were proven never to hold in the same cycle. */
  public boolean exclusive(Guard a, Guard b) {
    if (a.and(b).isFalse())
      return true;
    if (a.conjuncts().contains(b.not()) || b.conjuncts().contains(a.not()))
      return true;
    for (int round = 0; round <= INLINE_DEPTH; round++) {
      if (refuted(a, b))
        return true;
      Guard nextA = inline(a);
      Guard nextB = inline(b);
      if (nextA.equals(a) && nextB.equals(b))
        break;
      a = nextA;
      b = nextB;
      if (a.and(b).isFalse())
        return true;
    }
    logger.trace("Could not refute {} & {}", a, b);
    return false;
  }

  private Guard inline(Guard guard) {
    return guard.mapAtoms(atom -> {
      if (atom instanceof Guard.PortValue) {
        Guard.PortValue value = (Guard.PortValue)atom;
        Guard definition = holeDefinitions.get(value.port);
        if (definition != null)
          return definition;
      }
      return atom;
    });
  }

  private boolean refuted(Guard a, Guard b) {
    List<List<Literal>> cubesA = dnf(a, true);
    if (cubesA == null)
      return false;
    List<List<Literal>> cubesB = dnf(b, true);
    if (cubesB == null)
      return false;
    List<List<Literal>> product = product(cubesA, cubesB);
    return product != null && product.isEmpty();
  }

  record Literal(Guard atom, boolean positive) {}

  /**
   * Disjunction of satisfiable cubes equivalent to the guard (negated if not positive), or null if the expansion exceeds the cube limit.
   */
  List<List<Literal>> dnf(Guard guard, boolean positive) {
    if (guard instanceof Guard.Const) {
      Guard.Const constant = (Guard.Const)guard;
      return (constant.value == positive) ? List.of(List.of()) : List.of();
    }
    if (guard instanceof Guard.Not)
      return dnf(((Guard.Not)guard).inner, !positive);
    if (guard.isAtom())
      return List.of(List.of(new Literal(guard, positive)));
    Guard.Binary binary = (Guard.Binary)guard;
    List<List<Literal>> left = dnf(binary.left, positive);
    if (left == null)
      return null;
    List<List<Literal>> right = dnf(binary.right, positive);
    if (right == null)
      return null;
    boolean conjunction = (binary instanceof Guard.And) == positive;
    if (conjunction)
      return product(left, right);
    if (left.size() + right.size() > cubeLimit)
      return null;
    List<List<Literal>> ret = new ArrayList<>(left);
    ret.addAll(right);
    return ret;
  }

  private List<List<Literal>> product(List<List<Literal>> left, List<List<Literal>> right) {
    List<List<Literal>> ret = new ArrayList<>();
    for (List<Literal> a : left) {
      for (List<Literal> b : right) {
        List<Literal> merged = merge(a, b);
        if (merged == null)
          continue;
        ret.add(merged);
        if (ret.size() > cubeLimit)
          return null;
      }
    }
    return ret;
  }

  private static List<Literal> merge(List<Literal> a, List<Literal> b) {
    List<Literal> ret = new ArrayList<>(a);
    for (Literal literal : b) {
      if (ret.contains(literal))
        continue;
      for (Literal existing : ret) {
        if (contradicts(existing, literal))
          return null;
      }
      ret.add(literal);
    }
    return ret;
  }

  static boolean contradicts(Literal x, Literal y) {
    if (x.atom.equals(y.atom))
      return x.positive != y.positive;
    return stateContradiction(x, y) || stateContradiction(y, x);
  }

  /** Contradictions between two tests of one state machine, x taken positive. */
  private static boolean stateContradiction(Literal x, Literal y) {
    if (!x.positive)
      return false;
    if (x.atom instanceof Guard.StateEquals) {
      Guard.StateEquals se = (Guard.StateEquals)x.atom;
      if (y.atom instanceof Guard.StateEquals) {
        Guard.StateEquals other = (Guard.StateEquals)y.atom;
        return other.stateMachine.equals(se.stateMachine) && y.positive && other.state != se.state;
      }
      if (y.atom instanceof Guard.StateInRange) {
        Guard.StateInRange range = (Guard.StateInRange)y.atom;
        return range.stateMachine.equals(se.stateMachine) && y.positive != range.contains(se.state);
      }
      return false;
    }
    if (x.atom instanceof Guard.StateInRange) {
      Guard.StateInRange range = (Guard.StateInRange)x.atom;
      Guard.StateInRange other = (y.atom instanceof Guard.StateInRange) ? (Guard.StateInRange)y.atom : null;
      if (other != null && other.stateMachine.equals(range.stateMachine)) {
        if (y.positive)
          return range.hi <= other.lo || other.hi <= range.lo;
        return other.lo <= range.lo && range.hi <= other.hi;
      }
    }
    return false;
  }
}
