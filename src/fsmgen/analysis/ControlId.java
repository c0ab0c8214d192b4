package fsmgen.analysis;

import fsmgen.ir.Attr;
import fsmgen.ir.Control;

/**
 * Assigns {@code node_id} attributes to the leaves of a control program.
 * <p>
 * Enables, invokes and par blocks receive consecutive ids in program order. The children of a par are numbered
 * independently starting at 0, since each child is compiled into its own schedule. If a program starts with a
 * branch, id 0 is skipped so that the initial state remains free for the branch decision.
 * <pre>
 * seq { A; B; par { C; D; }; E }
 * </pre>
 * numbers A=0, B=1, par=2, C=0, D=0, E=3.
 */
public class ControlId {
  private ControlId() {}

  /**
   * Numbers the program starting at {@code cur}.
   * @return the first unused id
   */
  public static long computeUniqueIds(Control con, long cur) {
    switch (con.getKind()) {
    case Enable:
    case StaticEnable:
    case Invoke:
      con.getAttributes().insert(Attr.NodeId, cur);
      return cur + 1;
    case Par:
    case StaticPar:
      con.getAttributes().insert(Attr.NodeId, cur);
      for (Control stmt : ((Control.Par)con).getStmts())
        computeUniqueIds(stmt, 0);
      return cur + 1;
    case Seq:
    case StaticSeq: {
      long next = cur;
      for (Control stmt : ((Control.Seq)con).getStmts())
        next = computeUniqueIds(stmt, next);
      return next;
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      long start = (cur == 0) ? 1 : cur;
      long afterThen = computeUniqueIds(ifNode.getThen(), start);
      return computeUniqueIds(ifNode.getElse(), afterThen);
    }
    case While:
      return computeUniqueIds(((Control.While)con).getBody(), (cur == 0) ? 1 : cur);
    case Repeat:
    case StaticRepeat:
      return computeUniqueIds(((Control.Repeat)con).getBody(), cur);
    case Empty:
    default:
      return cur;
    }
  }

  /** Removes all {@code node_id} attributes from the program. */
  public static void clear(Control con) {
    con.getAttributes().remove(Attr.NodeId);
    switch (con.getKind()) {
    case Seq:
    case StaticSeq:
    case Par:
    case StaticPar:
      ((Control.Block)con).getStmts().forEach(ControlId::clear);
      break;
    case If:
    case StaticIf:
      clear(((Control.If)con).getThen());
      clear(((Control.If)con).getElse());
      break;
    case While:
      clear(((Control.While)con).getBody());
      break;
    case Repeat:
    case StaticRepeat:
      clear(((Control.Repeat)con).getBody());
      break;
    default:
      break;
    }
  }
}
