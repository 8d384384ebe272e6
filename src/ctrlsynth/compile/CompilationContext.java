package ctrlsynth.compile;

import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.GroupCatalog;
import ctrlsynth.ui.CtrlSynthConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * State shared by all compilation steps of one control program: the catalog, groups synthesized on the way,
 * the units compiled so far and the accumulated output logic.
 */
public class CompilationContext {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public final GroupCatalog catalog;
  public final CtrlSynthConfig config;
  public final StaticTiming timing;
  /** Logic collected from every compiled scope, island and parallel composition. */
  public final ControlLogicBlock output = new ControlLogicBlock();

  private final LinkedHashMap<String, Group> synthesized = new LinkedHashMap<>();
  private final LinkedHashSet<String> usedGroups = new LinkedHashSet<>();
  private final HashMap<String, Integer> nextNameIDs = new HashMap<>();
  private final HashSet<String> generatedNames = new HashSet<>();
  private final IdentityHashMap<ControlNode, ControlUnit> units = new IdentityHashMap<>();
  private Set<ControlNode> promoted = Collections.newSetFromMap(new IdentityHashMap<>());

  private final ForkJoinCompiler forkJoin = new ForkJoinCompiler(this);
  private final StaticPromoter promoter = new StaticPromoter(this);

  public CompilationContext(GroupCatalog catalog, CtrlSynthConfig config) {
    this.catalog = catalog;
    this.config = config;
    this.timing = new StaticTiming(this);
  }

  /**
   * Returns a name not used by the catalog or by any earlier call, of the form prefix + number.
   */
  public String freshName(String prefix) {
    while (true) {
      int id = nextNameIDs.merge(prefix, 1, Integer::sum) - 1;
      String name = prefix + id;
      if (!catalog.isNameUsed(name) && !synthesized.containsKey(name) && generatedNames.add(name))
        return name;
    }
  }

  public Group group(String name) throws CompileError {
    Group ret = synthesized.get(name);
    if (ret != null)
      return ret;
    Optional<Group> found = catalog.findGroup(name);
    if (found.isEmpty())
      throw new CompileError(CompileError.Kind.UNKNOWN_GROUP, "Group " + name + " is not declared");
    return found.get();
  }

  public CellDecl cell(String name) throws CompileError {
    Optional<CellDecl> found = catalog.findCell(name);
    if (found.isEmpty())
      throw new CompileError(CompileError.Kind.UNKNOWN_CELL, "Cell " + name + " is not declared");
    return found.get();
  }

  public void addSynthesizedGroup(Group group) {
    if (catalog.isNameUsed(group.name) || synthesized.containsKey(group.name))
      throw new IllegalArgumentException("Duplicate group " + group.name);
    synthesized.put(group.name, group);
  }

  /** Marks a group as driven by the control logic, so that its assignments are part of the output. */
  public void markUsed(Group group) { usedGroups.add(group.name); }

  public List<Group> getUsedGroups() throws CompileError {
    List<Group> ret = new ArrayList<>();
    for (String name : usedGroups)
      ret.add(group(name));
    return ret;
  }

  void setPromoted(Set<ControlNode> promotedNodes) {
    this.promoted = Collections.newSetFromMap(new IdentityHashMap<>());
    this.promoted.addAll(promotedNodes);
  }

  public boolean isPromoted(ControlNode node) { return promoted.contains(node); }

  /**
   * Nodes that occupy exactly one state of the enclosing scope and expose a go/done interface.
   */
  public boolean isAtomic(ControlNode node) {
    return node instanceof ControlNode.Enable || node instanceof ControlNode.Par || isPromoted(node);
  }

  /**
   * Returns the go/done interface of an atomic node, compiling the parallel composition or static island behind it on first use.
   */
  public ControlUnit unitOf(ControlNode node) throws CompileError {
    ControlUnit unit = units.get(node);
    if (unit != null)
      return unit;
    if (isPromoted(node)) {
      unit = promoter.compile(node);
    } else if (node instanceof ControlNode.Enable) {
      ControlNode.Enable enable = (ControlNode.Enable)node;
      Group group = group(enable.group);
      if (group.isCombinational())
        throw new CompileError(CompileError.Kind.MALFORMED_CONTROL, "Comb group " + group.name + " cannot be enabled as a statement");
      if (!group.hasDoneAssignment())
        throw new CompileError(CompileError.Kind.MISSING_DONE, "Group " + group.name + " (" + group.latency + ") never drives " + group.done());
      markUsed(group);
      unit = new ControlUnit(group.name, group.go(), group.done());
    } else if (node instanceof ControlNode.Par) {
      ControlNode.Par par = (ControlNode.Par)node;
      unit = forkJoin.compile(par);
    } else {
      throw new IllegalArgumentException("Not an atomic control node: " + node);
    }
    units.put(node, unit);
    return unit;
  }

  @Override
  public String toString() {
    return "CompilationContext(used groups: " + usedGroups.stream().collect(Collectors.joining(", ")) + ")";
  }
}
