package fsmgen.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Port signature of a library primitive. Port widths are either fixed or taken from a named parameter.
 */
public class Primitive {
  /** Declaration of one port of a primitive. */
  public static class PortDef {
    private final String name;
    private final Direction direction;
    private final int fixedWidth;
    private final String widthParam;
    private final Attributes attributes = new Attributes();

    /**
     * @param name port name
     * @param direction port direction
     * @param fixedWidth the width, used if {@code widthParam} is null
     * @param widthParam name of the parameter giving the width, or null
     */
    public PortDef(String name, Direction direction, int fixedWidth, String widthParam) {
      this.name = name;
      this.direction = direction;
      this.fixedWidth = fixedWidth;
      this.widthParam = widthParam;
    }

    public String getName() { return name; }
    public Direction getDirection() { return direction; }
    public Attributes getAttributes() { return attributes; }

    public PortDef with(Attr attr, long value) {
      attributes.insert(attr, value);
      return this;
    }

    /**
     * Computes the port width for an instance.
     * @throws IllegalArgumentException if the width parameter is missing from {@code params}
     */
    public int resolveWidth(Map<String, Long> params) {
      if (widthParam == null)
        return fixedWidth;
      Long width = params.get(widthParam);
      if (width == null)
        throw new IllegalArgumentException("Missing parameter " + widthParam + " for port " + name);
      return width.intValue();
    }
  }

  private final String name;
  private final List<String> params;
  private final List<PortDef> signature = new ArrayList<>();

  public Primitive(String name, List<String> params) {
    this.name = name;
    this.params = new ArrayList<>(params);
  }

  public String getName() { return name; }
  public List<String> getParams() { return Collections.unmodifiableList(params); }
  public List<PortDef> getSignature() { return Collections.unmodifiableList(signature); }

  public PortDef addPort(String portName, Direction direction, int fixedWidth) {
    PortDef port = new PortDef(portName, direction, fixedWidth, null);
    signature.add(port);
    return port;
  }

  public PortDef addPort(String portName, Direction direction, String widthParam) {
    PortDef port = new PortDef(portName, direction, 0, widthParam);
    signature.add(port);
    return port;
  }
}
