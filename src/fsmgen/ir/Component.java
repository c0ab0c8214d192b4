package fsmgen.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arena holding the cells, ports and groups of one component. All cross references (assignments, guards, control
 * nodes) use the dense indices handed out here, so identities of user-visible cells and groups never change while
 * passes rewrite the control program.
 */
public class Component {
  private final String name;
  private final ArrayList<Cell> cells = new ArrayList<>();
  private final ArrayList<Port> ports = new ArrayList<>();
  private final ArrayList<Group> groups = new ArrayList<>();
  private final HashMap<String, Integer> cellByName = new HashMap<>();
  private final HashMap<String, Integer> groupByName = new HashMap<>();
  private final HashMap<String, Integer> nameCounters = new HashMap<>();
  private final Attributes attributes = new Attributes();

  /** Assignments active regardless of the control program. */
  public List<Assignment> continuousAssignments = new ArrayList<>();
  private Control control = Control.empty();

  public Component(String name) { this.name = name; }

  public String getName() { return name; }
  public Attributes getAttributes() { return attributes; }
  public Control getControl() { return control; }
  public void setControl(Control control) { this.control = control; }

  public List<Cell> getCells() { return Collections.unmodifiableList(cells); }
  public List<Group> getGroups() { return Collections.unmodifiableList(groups); }
  public int getPortCount() { return ports.size(); }

  public Cell getCell(int index) { return cells.get(index); }
  public Group getGroup(int index) { return groups.get(index); }
  public Port getPort(int index) { return ports.get(index); }

  public Optional<Cell> findCell(String cellName) { return Optional.ofNullable(cellByName.get(cellName)).map(cells::get); }
  public Optional<Group> findGroup(String groupName) { return Optional.ofNullable(groupByName.get(groupName)).map(groups::get); }

  /**
   * Looks up the arena index of {@code cell.port}.
   * @throws IllegalArgumentException if the cell or port does not exist
   */
  public int portIndex(String cellName, String portName) {
    Cell cell = findCell(cellName).orElseThrow(() -> new IllegalArgumentException("No cell named " + cellName + " in " + name));
    return cell.findPort(portName).orElseThrow(() -> new IllegalArgumentException("Cell " + cellName + " has no port " + portName));
  }

  /**
   * Adds a cell without ports. Ports are added through {@link #addCellPort}.
   * @throws IllegalArgumentException if the name is already taken
   */
  public Cell addCell(String cellName, CellType type, String prototype, Map<String, Long> params) {
    if (cellByName.containsKey(cellName) || groupByName.containsKey(cellName))
      throw new IllegalArgumentException("Duplicate name " + cellName + " in component " + name);
    Cell cell = new Cell(cells.size(), cellName, type, prototype, params);
    cells.add(cell);
    cellByName.put(cellName, cell.getIndex());
    return cell;
  }

  public int addCellPort(Cell cell, String portName, int width, Direction direction, Attributes portAttrs) {
    Port port = new Port(ports.size(), portName, width, direction, Port.ParentKind.Cell, cell.getIndex(), portAttrs);
    ports.add(port);
    cell.ports.put(portName, port.getIndex());
    return port.getIndex();
  }

  /**
   * Adds a group with fresh go/done holes.
   * @throws IllegalArgumentException if the name is already taken
   */
  public Group addGroup(String groupName, boolean combinational) {
    if (cellByName.containsKey(groupName) || groupByName.containsKey(groupName))
      throw new IllegalArgumentException("Duplicate name " + groupName + " in component " + name);
    int groupIdx = groups.size();
    Port go = new Port(ports.size(), "go", 1, Direction.Input, Port.ParentKind.Group, groupIdx, new Attributes());
    ports.add(go);
    Port done = new Port(ports.size(), "done", 1, Direction.Output, Port.ParentKind.Group, groupIdx, new Attributes());
    ports.add(done);
    Group group = new Group(groupIdx, groupName, combinational, go.getIndex(), done.getIndex());
    groups.add(group);
    groupByName.put(groupName, groupIdx);
    return group;
  }

  /** Returns {@code prefix} if unused, else {@code prefix} followed by the first free counter value. */
  public String generateName(String prefix) {
    if (!cellByName.containsKey(prefix) && !groupByName.containsKey(prefix) && !nameCounters.containsKey(prefix)) {
      nameCounters.put(prefix, 0);
      return prefix;
    }
    int counter = nameCounters.getOrDefault(prefix, 0);
    String candidate;
    do {
      candidate = prefix + counter;
      ++counter;
    } while (cellByName.containsKey(candidate) || groupByName.containsKey(candidate));
    nameCounters.put(prefix, counter);
    return candidate;
  }

  /** Name of the primitive the port belongs to, if its parent is a primitive cell. */
  public Optional<String> primitiveOf(int port) {
    Port p = ports.get(port);
    if (p.isHole())
      return Optional.empty();
    Cell cell = cells.get(p.getParentIndex());
    return cell.isPrimitive() ? Optional.of(cell.getPrototype()) : Optional.empty();
  }

  /** True if the port is the output of the one-bit constant 1. */
  public boolean isConstantOne(int port) {
    Port p = ports.get(port);
    return !p.isHole() && cells.get(p.getParentIndex()).isConstant(1, 1);
  }

  /** Source-like name of a port: {@code cell.port}, {@code group[go]}, or a sized literal for constants. */
  public String portName(int port) {
    Port p = ports.get(port);
    if (p.isHole())
      return groups.get(p.getParentIndex()).getName() + "[" + p.getName() + "]";
    Cell cell = cells.get(p.getParentIndex());
    if (cell.getType() == CellType.Constant)
      return cell.getParameter("WIDTH").getAsLong() + "'d" + cell.getParameter("VALUE").getAsLong();
    return cell.getName() + "." + p.getName();
  }

  /** Identity of a port independent of constant rendering, used as a map key: {@code cell.port}. */
  public String canonical(int port) {
    Port p = ports.get(port);
    if (p.isHole())
      return groups.get(p.getParentIndex()).getName() + "[" + p.getName() + "]";
    return cells.get(p.getParentIndex()).getName() + "." + p.getName();
  }
}
