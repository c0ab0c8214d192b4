package fsmgen.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A named set of guarded assignments with the implicit go/done holes.
 * Combinational groups have holes as well but their done hole is never driven.
 */
public class Group {
  private final int index;
  private final String name;
  private final boolean combinational;
  private final int goPort;
  private final int donePort;
  public List<Assignment> assignments = new ArrayList<>();
  private final Attributes attributes = new Attributes();

  Group(int index, String name, boolean combinational, int goPort, int donePort) {
    this.index = index;
    this.name = name;
    this.combinational = combinational;
    this.goPort = goPort;
    this.donePort = donePort;
  }

  public int getIndex() { return index; }
  public String getName() { return name; }
  public boolean isCombinational() { return combinational; }
  public Attributes getAttributes() { return attributes; }
  /** Arena index of the {@code go} hole. */
  public int getGo() { return goPort; }
  /** Arena index of the {@code done} hole. */
  public int getDone() { return donePort; }
}
