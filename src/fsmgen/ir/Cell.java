package fsmgen.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/** An instantiated primitive, constant or sub-component. */
public class Cell {
  private final int index;
  private final String name;
  private final CellType type;
  private final String prototype;
  private final LinkedHashMap<String, Long> parameters;
  final LinkedHashMap<String, Integer> ports = new LinkedHashMap<>();
  private final Attributes attributes = new Attributes();

  Cell(int index, String name, CellType type, String prototype, Map<String, Long> parameters) {
    this.index = index;
    this.name = name;
    this.type = type;
    this.prototype = prototype;
    this.parameters = new LinkedHashMap<>(parameters);
  }

  public int getIndex() { return index; }
  public String getName() { return name; }
  public CellType getType() { return type; }
  /** Name of the primitive or component this cell instantiates ("const" for constants). */
  public String getPrototype() { return prototype; }
  public Map<String, Long> getParameters() { return Collections.unmodifiableMap(parameters); }
  public Attributes getAttributes() { return attributes; }

  public OptionalLong getParameter(String param) {
    Long val = parameters.get(param);
    return val == null ? OptionalLong.empty() : OptionalLong.of(val);
  }

  /** Returns the arena index of the named port. */
  public Optional<Integer> findPort(String portName) { return Optional.ofNullable(ports.get(portName)); }

  /** Port names in declaration order mapped to their arena indices. */
  public Map<String, Integer> getPorts() { return Collections.unmodifiableMap(ports); }

  public boolean isPrimitive() { return type == CellType.Primitive; }

  /** Tests if this is a constant cell with the given value and width. */
  public boolean isConstant(long value, int width) {
    return type == CellType.Constant && getParameter("VALUE").orElse(-1) == value && getParameter("WIDTH").orElse(-1) == width;
  }
}
