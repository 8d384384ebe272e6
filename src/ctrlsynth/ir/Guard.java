package ctrlsynth.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Immutable boolean predicate gating an assignment or a state transition.
 * Guards are compared by value. All combinators go through smart constructors that fold constants, double negation and duplicates, so
 * structurally equal inputs yield equal trees.
 */
public abstract class Guard {
  /** Evaluation context for {@link Guard#evaluate(Env)}. */
  public interface Env {
    long portValue(Port port);
    int stateOf(String stateMachine);
  }

  public static final Guard TRUE = new Const(true);
  public static final Guard FALSE = new Const(false);

  private final int hash;

  protected Guard(int hash) { this.hash = hash; }

  public static Guard constant(boolean value) { return value ? TRUE : FALSE; }
  public static Guard port(Port port) { return new PortValue(port); }
  public static Guard stateEquals(String stateMachine, int state) { return new StateEquals(stateMachine, state); }

  /** Matches the states lo (inclusive) to hi (exclusive). */
  public static Guard stateInRange(String stateMachine, int lo, int hi) {
    if (hi <= lo)
      return FALSE;
    if (hi == lo + 1)
      return new StateEquals(stateMachine, lo);
    return new StateInRange(stateMachine, lo, hi);
  }

  public static Guard andAll(Collection<Guard> guards) {
    Guard ret = TRUE;
    for (Guard guard : guards)
      ret = ret.and(guard);
    return ret;
  }
  public static Guard orAll(Collection<Guard> guards) {
    Guard ret = FALSE;
    for (Guard guard : guards)
      ret = ret.or(guard);
    return ret;
  }

  public Guard and(Guard other) {
    if (this == FALSE || other == FALSE)
      return FALSE;
    if (this == TRUE)
      return other;
    if (other == TRUE)
      return this;
    List<Guard> thisConj = conjuncts();
    List<Guard> otherConj = other.conjuncts();
    if (thisConj.containsAll(otherConj))
      return this;
    if (otherConj.containsAll(thisConj))
      return other;
    for (Guard a : thisConj) {
      for (Guard b : otherConj) {
        if (contradicts(a, b))
          return FALSE;
      }
    }
    return new And(this, other);
  }

  public Guard or(Guard other) {
    if (this == TRUE || other == TRUE)
      return TRUE;
    if (this == FALSE)
      return other;
    if (other == FALSE)
      return this;
    List<Guard> thisDisj = disjuncts();
    List<Guard> otherDisj = other.disjuncts();
    if (thisDisj.containsAll(otherDisj))
      return this;
    if (otherDisj.containsAll(thisDisj))
      return other;
    if (this.equals(other.not()))
      return TRUE;
    return new Or(this, other);
  }

  public Guard not() {
    if (this == TRUE)
      return FALSE;
    if (this == FALSE)
      return TRUE;
    if (this instanceof Not)
      return ((Not)this).inner;
    return new Not(this);
  }

  private static boolean contradicts(Guard a, Guard b) {
    if (a instanceof Not && ((Not)a).inner.equals(b))
      return true;
    if (b instanceof Not && ((Not)b).inner.equals(a))
      return true;
    if (a instanceof StateEquals && b instanceof StateEquals) {
      StateEquals sa = (StateEquals)a, sb = (StateEquals)b;
      return sa.stateMachine.equals(sb.stateMachine) && sa.state != sb.state;
    }
    return false;
  }

  public boolean isTrue() { return this == TRUE; }
  public boolean isFalse() { return this == FALSE; }

  /** Top-level conjunction members; a non-And guard is its own single conjunct. */
  public List<Guard> conjuncts() {
    List<Guard> ret = new ArrayList<>();
    collectBinary(this, And.class, ret);
    return ret;
  }
  /** Top-level disjunction members; a non-Or guard is its own single disjunct. */
  public List<Guard> disjuncts() {
    List<Guard> ret = new ArrayList<>();
    collectBinary(this, Or.class, ret);
    return ret;
  }
  private static void collectBinary(Guard guard, Class<? extends Binary> cls, List<Guard> out) {
    if (cls.isInstance(guard)) {
      collectBinary(((Binary)guard).left, cls, out);
      collectBinary(((Binary)guard).right, cls, out);
    } else
      out.add(guard);
  }

  public abstract boolean evaluate(Env env);

  /**
   * Rebuilds the guard with each atom (port value or state test) replaced by the mapper's result.
   * Rebuilding goes through the smart constructors, so substituted constants fold away.
   */
  public abstract Guard mapAtoms(Function<Guard, Guard> mapper);

  /** Visits every atom (port value or state test) of the guard. */
  public abstract void forEachAtom(Consumer<Guard> consumer);

  public boolean isAtom() { return false; }

  /** Binding strength for printing. */
  protected abstract int precedence();

  protected String wrap(Guard inner) {
    String str = inner.toString();
    return (inner.precedence() < precedence()) ? "(" + str + ")" : str;
  }

  @Override
  public final int hashCode() {
    return hash;
  }

  public static final class Const extends Guard {
    public final boolean value;
    private Const(boolean value) {
      super(Boolean.hashCode(value));
      this.value = value;
    }
    @Override
    public boolean evaluate(Env env) {
      return value;
    }
    @Override
    public Guard mapAtoms(Function<Guard, Guard> mapper) {
      return this;
    }
    @Override
    public void forEachAtom(Consumer<Guard> consumer) {}
    @Override
    protected int precedence() {
      return 4;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Const && ((Const)obj).value == value;
    }
    @Override
    public String toString() {
      return value ? "1" : "0";
    }
  }

  public static final class PortValue extends Guard {
    public final Port port;
    private PortValue(Port port) {
      super(Objects.hash(1, port));
      this.port = Objects.requireNonNull(port);
    }
    @Override
    public boolean evaluate(Env env) {
      return env.portValue(port) != 0;
    }
    @Override
    public Guard mapAtoms(Function<Guard, Guard> mapper) {
      return mapper.apply(this);
    }
    @Override
    public void forEachAtom(Consumer<Guard> consumer) {
      consumer.accept(this);
    }
    @Override
    public boolean isAtom() {
      return true;
    }
    @Override
    protected int precedence() {
      return 4;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof PortValue && ((PortValue)obj).port.equals(port);
    }
    @Override
    public String toString() {
      return port.toString();
    }
  }

  public static final class StateEquals extends Guard {
    public final String stateMachine;
    public final int state;
    private StateEquals(String stateMachine, int state) {
      super(Objects.hash(2, stateMachine, state));
      this.stateMachine = Objects.requireNonNull(stateMachine);
      this.state = state;
    }
    @Override
    public boolean evaluate(Env env) {
      return env.stateOf(stateMachine) == state;
    }
    @Override
    public Guard mapAtoms(Function<Guard, Guard> mapper) {
      return mapper.apply(this);
    }
    @Override
    public void forEachAtom(Consumer<Guard> consumer) {
      consumer.accept(this);
    }
    @Override
    public boolean isAtom() {
      return true;
    }
    @Override
    protected int precedence() {
      return 3;
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof StateEquals))
        return false;
      StateEquals other = (StateEquals)obj;
      return other.stateMachine.equals(stateMachine) && other.state == state;
    }
    @Override
    public String toString() {
      return stateMachine + " == " + state;
    }
  }

  public static final class StateInRange extends Guard {
    public final String stateMachine;
    /** Inclusive lower bound. */
    public final int lo;
    /** Exclusive upper bound. */
    public final int hi;
    private StateInRange(String stateMachine, int lo, int hi) {
      super(Objects.hash(3, stateMachine, lo, hi));
      this.stateMachine = Objects.requireNonNull(stateMachine);
      this.lo = lo;
      this.hi = hi;
    }
    public boolean contains(int state) { return state >= lo && state < hi; }
    @Override
    public boolean evaluate(Env env) {
      return contains(env.stateOf(stateMachine));
    }
    @Override
    public Guard mapAtoms(Function<Guard, Guard> mapper) {
      return mapper.apply(this);
    }
    @Override
    public void forEachAtom(Consumer<Guard> consumer) {
      consumer.accept(this);
    }
    @Override
    public boolean isAtom() {
      return true;
    }
    @Override
    protected int precedence() {
      return 3;
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof StateInRange))
        return false;
      StateInRange other = (StateInRange)obj;
      return other.stateMachine.equals(stateMachine) && other.lo == lo && other.hi == hi;
    }
    @Override
    public String toString() {
      return lo + " <= " + stateMachine + " < " + hi;
    }
  }

  public abstract static class Binary extends Guard {
    public final Guard left;
    public final Guard right;
    protected Binary(int tag, Guard left, Guard right) {
      super(Objects.hash(tag, left, right));
      this.left = left;
      this.right = right;
    }
    @Override
    public void forEachAtom(Consumer<Guard> consumer) {
      left.forEachAtom(consumer);
      right.forEachAtom(consumer);
    }
    @Override
    public boolean equals(Object obj) {
      if (obj == null || obj.getClass() != getClass())
        return false;
      Binary other = (Binary)obj;
      return other.hashCode() == hashCode() && other.left.equals(left) && other.right.equals(right);
    }
  }

  public static final class And extends Binary {
    private And(Guard left, Guard right) { super(4, left, right); }
    @Override
    public boolean evaluate(Env env) {
      return left.evaluate(env) && right.evaluate(env);
    }
    @Override
    public Guard mapAtoms(Function<Guard, Guard> mapper) {
      return left.mapAtoms(mapper).and(right.mapAtoms(mapper));
    }
    @Override
    protected int precedence() {
      return 2;
    }
    @Override
    public String toString() {
      return wrap(left) + " & " + wrap(right);
    }
  }

  public static final class Or extends Binary {
    private Or(Guard left, Guard right) { super(5, left, right); }
    @Override
    public boolean evaluate(Env env) {
      return left.evaluate(env) || right.evaluate(env);
    }
    @Override
    public Guard mapAtoms(Function<Guard, Guard> mapper) {
      return left.mapAtoms(mapper).or(right.mapAtoms(mapper));
    }
    @Override
    protected int precedence() {
      return 1;
    }
    @Override
    public String toString() {
      return wrap(left) + " | " + wrap(right);
    }
  }

  public static final class Not extends Guard {
    public final Guard inner;
    private Not(Guard inner) {
      super(Objects.hash(6, inner));
      this.inner = inner;
    }
    @Override
    public boolean evaluate(Env env) {
      return !inner.evaluate(env);
    }
    @Override
    public Guard mapAtoms(Function<Guard, Guard> mapper) {
      return inner.mapAtoms(mapper).not();
    }
    @Override
    public void forEachAtom(Consumer<Guard> consumer) {
      inner.forEachAtom(consumer);
    }
    @Override
    protected int precedence() {
      return 4;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Not && ((Not)obj).inner.equals(inner);
    }
    @Override
    public String toString() {
      String str = inner.toString();
      return inner.precedence() < 4 ? "!(" + str + ")" : "!" + str;
    }
  }
}
