package fsmgen.analysis;

import fsmgen.ir.Attr;
import fsmgen.ir.Component;
import fsmgen.ir.Control;
import java.util.OptionalLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Propagates {@code static} latencies bottom-up through a control program. Every sub-program whose latency can be
 * computed receives a {@code static} attribute; explicit annotations take precedence over computed values.
 */
public class StaticLatency {
  protected static final Logger logger = LogManager.getLogger();

  private StaticLatency() {}

  /**
   * Updates the program and all sub-programs.
   * @return the latency of {@code con}, if known
   */
  public static OptionalLong update(Component comp, Control con) {
    OptionalLong computed = compute(comp, con);
    if (con.getKind() == Control.Kind.Empty)
      return computed;
    OptionalLong explicit = con.getLatency();
    if (explicit.isPresent()) {
      if (computed.isPresent() && computed.getAsLong() != explicit.getAsLong() && !isBalanced(con))
        logger.debug("Keeping explicit @static({}) over computed latency {}", explicit.getAsLong(), computed.getAsLong());
      return explicit;
    }
    computed.ifPresent(time -> con.getAttributes().insert(Attr.Static, time));
    return computed;
  }

  // If and Par latencies are only lower bounds of their children, so a larger explicit value is expected.
  private static boolean isBalanced(Control con) {
    switch (con.getKind()) {
    case If:
    case StaticIf:
    case Par:
    case StaticPar:
      return true;
    default:
      return false;
    }
  }

  private static OptionalLong compute(Component comp, Control con) {
    switch (con.getKind()) {
    case Enable:
    case StaticEnable: {
      if (con.getLatency().isPresent())
        return con.getLatency();
      return comp.getGroup(((Control.Enable)con).getGroup()).getAttributes().get(Attr.Static);
    }
    case Invoke:
      return con.getLatency();
    case Seq:
    case StaticSeq:
      return walk(comp, (Control.Block)con, false);
    case Par:
    case StaticPar:
      return walk(comp, (Control.Block)con, true);
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      OptionalLong tLatency = update(comp, ifNode.getThen());
      OptionalLong fLatency = update(comp, ifNode.getElse());
      if (ifNode.getCond().isPresent()) {
        logger.debug("Cannot compute latency for if-with");
        return OptionalLong.empty();
      }
      if (tLatency.isEmpty() || fLatency.isEmpty())
        return OptionalLong.empty();
      return OptionalLong.of(Math.max(tLatency.getAsLong(), fLatency.getAsLong()));
    }
    case While: {
      Control.While wh = (Control.While)con;
      OptionalLong bodyLatency = update(comp, wh.getBody());
      if (wh.getCond().isPresent()) {
        logger.debug("Cannot compute latency for while-with");
        return OptionalLong.empty();
      }
      OptionalLong bound = con.getAttributes().get(Attr.Bound);
      if (bodyLatency.isEmpty() || bound.isEmpty())
        return OptionalLong.empty();
      return OptionalLong.of(bodyLatency.getAsLong() * bound.getAsLong());
    }
    case Repeat:
    case StaticRepeat: {
      Control.Repeat rep = (Control.Repeat)con;
      OptionalLong bodyLatency = update(comp, rep.getBody());
      if (bodyLatency.isEmpty())
        return OptionalLong.empty();
      return OptionalLong.of(bodyLatency.getAsLong() * rep.getCount());
    }
    case Empty:
    default:
      return OptionalLong.of(0);
    }
  }

  // Visits every statement even after the total became unknown.
  private static OptionalLong walk(Component comp, Control.Block block, boolean max) {
    boolean known = true;
    long total = 0;
    for (Control stmt : block.getStmts()) {
      OptionalLong stmtLatency = update(comp, stmt);
      if (stmtLatency.isEmpty()) {
        known = false;
        continue;
      }
      total = max ? Math.max(total, stmtLatency.getAsLong()) : total + stmtLatency.getAsLong();
    }
    return known ? OptionalLong.of(total) : OptionalLong.empty();
  }
}
