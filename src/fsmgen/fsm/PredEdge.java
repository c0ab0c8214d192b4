package fsmgen.fsm;

import fsmgen.ir.Guard;

/**
 * An edge from a predecessor state into the control node being scheduled: control leaves {@code state} when
 * {@code guard} holds.
 */
public record PredEdge(long state, Guard guard) {
  /** Same edge with {@code extra} conjoined to the guard. */
  public PredEdge and(Guard extra) { return new PredEdge(state, guard.and(extra)); }
}
