package ctrlsynth.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Indexed set of groups, cells and continuous (always active) assignments that a control program refers to.
 * The catalog is populated once by a frontend and then only read by the compiler.
 */
public class GroupCatalog {
  private final LinkedHashMap<String, Group> groups = new LinkedHashMap<>();
  private final LinkedHashMap<String, CellDecl> cells = new LinkedHashMap<>();
  private final List<Assignment> continuous = new ArrayList<>();

  public GroupCatalog addGroup(Group group) {
    if (groups.containsKey(group.name) || cells.containsKey(group.name))
      throw new IllegalArgumentException("Duplicate name " + group.name);
    groups.put(group.name, group);
    return this;
  }

  public GroupCatalog addCell(CellDecl cell) {
    if (groups.containsKey(cell.name) || cells.containsKey(cell.name))
      throw new IllegalArgumentException("Duplicate name " + cell.name);
    cells.put(cell.name, cell);
    return this;
  }

  public GroupCatalog addContinuous(Assignment assignment) {
    continuous.add(assignment);
    return this;
  }

  public Optional<Group> findGroup(String name) { return Optional.ofNullable(groups.get(name)); }
  public Optional<CellDecl> findCell(String name) { return Optional.ofNullable(cells.get(name)); }

  public Collection<Group> getGroups() { return Collections.unmodifiableCollection(groups.values()); }
  public Collection<CellDecl> getCells() { return Collections.unmodifiableCollection(cells.values()); }
  public List<Assignment> getContinuous() { return Collections.unmodifiableList(continuous); }

  /** True if the name is taken by a group or a cell. */
  public boolean isNameUsed(String name) { return groups.containsKey(name) || cells.containsKey(name); }
}
