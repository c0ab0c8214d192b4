package fsmgen.ir;

/**
 * A port of a cell or a hole of a group, stored in the {@link Component} arena and addressed by index.
 */
public class Port {
  public enum ParentKind { Cell, Group }

  private final int index;
  private final String name;
  private final int width;
  private final Direction direction;
  private final ParentKind parentKind;
  private final int parentIndex;
  private final Attributes attributes;

  Port(int index, String name, int width, Direction direction, ParentKind parentKind, int parentIndex, Attributes attributes) {
    this.index = index;
    this.name = name;
    this.width = width;
    this.direction = direction;
    this.parentKind = parentKind;
    this.parentIndex = parentIndex;
    this.attributes = attributes;
  }

  public int getIndex() { return index; }
  public String getName() { return name; }
  public int getWidth() { return width; }
  public Direction getDirection() { return direction; }
  public ParentKind getParentKind() { return parentKind; }
  /** Index of the parent cell or group, depending on {@link #getParentKind()}. */
  public int getParentIndex() { return parentIndex; }
  public Attributes getAttributes() { return attributes; }

  /** Holes are the go/done pseudo-ports of groups. */
  public boolean isHole() { return parentKind == ParentKind.Group; }

  @Override
  public String toString() {
    return "Port#" + index + "(" + name + ")";
  }
}
