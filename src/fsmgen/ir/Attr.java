package fsmgen.ir;

import java.util.Optional;

/**
 * The fixed set of numeric attribute keys that may be attached to control nodes, groups and ports.
 */
public enum Attr {
  /** Statically known latency in cycles. */
  Static("static"),
  /** Trip count of a bounded loop. */
  Bound("bound"),
  /** Identifier of a control node, assigned by {@link fsmgen.analysis.ControlId}. */
  NodeId("node_id"),
  /** Start state of a control node within a static schedule. */
  StateId("ST_ID"),
  /** Index of the loop-index register allocated for a static loop. */
  Loop("LOOP"),
  /** First state of a static loop body. */
  Start("START"),
  /** First state after a static loop body. */
  End("END"),
  /** Upstream-inferred marker: the dynamically-timed node may be treated as statically timed. */
  Promotable("promotable"),
  /** Output port does not depend combinationally on any input. */
  Stable("stable"),
  /** Output port is a done signal. */
  Done("done"),
  /** Ports sharing this value form a custom combinational path (one output, its inputs). */
  ReadTogether("read_together");

  private final String serialName;
  private Attr(String serialName) { this.serialName = serialName; }

  public String getSerialName() { return serialName; }

  public static Optional<Attr> fromSerialName(String name) {
    for (Attr attr : Attr.values())
      if (attr.serialName.equals(name))
        return Optional.of(attr);
    return Optional.empty();
  }
}
