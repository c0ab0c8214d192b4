package fsmgen.ir;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instantiates cells, constants, groups and assignments inside a {@link Component}.
 */
public class Builder {
  private final Component component;
  private final Library library;
  /** "value_width" to the existing constant cell index. */
  private final HashMap<String, Integer> constants = new HashMap<>();

  public Builder(Component component, Library library) {
    this.component = component;
    this.library = library;
    for (Cell cell : component.getCells()) {
      if (cell.getType() == CellType.Constant)
        constants.putIfAbsent(cell.getParameter("VALUE").getAsLong() + "_" + cell.getParameter("WIDTH").getAsLong(), cell.getIndex());
    }
  }

  public Component getComponent() { return component; }
  public Library getLibrary() { return library; }

  /**
   * Instantiates a primitive under a fresh name derived from {@code prefix}.
   * @param params parameter values in the order of {@link Primitive#getParams()}
   * @throws IllegalArgumentException if the primitive is unknown or the parameter count does not match
   */
  public Cell addPrimitive(String prefix, String primitive, long... params) {
    Primitive prim = library.find(primitive).orElseThrow(() -> new IllegalArgumentException("Unknown primitive " + primitive));
    if (prim.getParams().size() != params.length)
      throw new IllegalArgumentException("Primitive " + primitive + " expects " + prim.getParams().size() + " parameters");
    LinkedHashMap<String, Long> paramMap = new LinkedHashMap<>();
    for (int i = 0; i < params.length; ++i)
      paramMap.put(prim.getParams().get(i), params[i]);
    return addPrimitiveNamed(component.generateName(prefix), prim, paramMap);
  }

  /** Instantiates a primitive under exactly the given name. */
  public Cell addPrimitiveNamed(String name, Primitive prim, Map<String, Long> params) {
    Cell cell = component.addCell(name, CellType.Primitive, prim.getName(), params);
    for (Primitive.PortDef portDef : prim.getSignature()) {
      component.addCellPort(cell, portDef.getName(), portDef.resolveWidth(params), portDef.getDirection(),
                            new Attributes(portDef.getAttributes()));
    }
    return cell;
  }

  /** Returns the constant cell for {@code value} of the given width, creating it on first use. */
  public Cell addConstant(long value, int width) {
    String key = value + "_" + width;
    Integer existing = constants.get(key);
    if (existing != null)
      return component.getCell(existing);
    LinkedHashMap<String, Long> params = new LinkedHashMap<>();
    params.put("VALUE", value);
    params.put("WIDTH", (long)width);
    Cell cell = component.addCell(component.generateName("_" + key), CellType.Constant, "const", params);
    component.addCellPort(cell, "out", width, Direction.Output, new Attributes().insert(Attr.Stable, 1));
    constants.put(key, cell.getIndex());
    return cell;
  }

  /** Output port index of a constant. */
  public int constantOut(long value, int width) { return out(addConstant(value, width)); }

  /** Adds a group under a fresh name derived from {@code prefix}. */
  public Group addGroup(String prefix) { return component.addGroup(component.generateName(prefix), false); }

  public Assignment buildAssignment(int dst, int src, Guard guard) { return new Assignment(dst, src, guard); }

  /** Convenience for {@code dst = guard ? 1'd1}. */
  public Assignment assignHigh(int dst, Guard guard) { return new Assignment(dst, constantOut(1, 1), guard); }

  /**
   * Builds the assignment pair {@code reg.in = guard ? src; reg.write_en = guard ? 1'd1;} used to update a register.
   */
  public List<Assignment> registerWrite(Cell reg, int src, Guard guard) {
    return List.of(new Assignment(port(reg, "in"), src, guard), assignHigh(port(reg, "write_en"), guard));
  }

  /**
   * Port index of a named port of a cell.
   * @throws IllegalArgumentException if the port does not exist
   */
  public int port(Cell cell, String portName) {
    return cell.findPort(portName).orElseThrow(() -> new IllegalArgumentException("Cell " + cell.getName() + " has no port " + portName));
  }

  public int out(Cell cell) { return port(cell, "out"); }

  /** Width parameter of a primitive instance. */
  public static int width(Cell cell) { return (int)cell.getParameter("WIDTH").orElseThrow(); }
}
