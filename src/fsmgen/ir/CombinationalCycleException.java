package fsmgen.ir;

import java.util.Collections;
import java.util.List;

/**
 * The assignments of a group form a combinational loop.
 */
public class CombinationalCycleException extends CompilationException {
  private static final long serialVersionUID = 1L;

  private final List<String> cycle;

  /** @param cycle the offending assignments, rendered by {@link Printer#assignmentToString} */
  public CombinationalCycleException(List<String> cycle) {
    super("Found combinational cycle:\n" + String.join("\n", cycle));
    this.cycle = List.copyOf(cycle);
  }

  public List<String> getCycle() { return Collections.unmodifiableList(cycle); }
}
