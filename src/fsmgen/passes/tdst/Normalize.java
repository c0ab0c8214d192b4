package fsmgen.passes.tdst;

import fsmgen.ir.Attr;
import fsmgen.ir.Attributes;
import fsmgen.ir.Builder;
import fsmgen.ir.Control;
import fsmgen.ir.Group;
import fsmgen.ir.MalformedControlException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Rewrites a statically timed program into the shape expected by {@link ComputeStates}:
 * <ul>
 * <li>both branches of every conditional take exactly the latency of the conditional, the shorter one padded with
 * one-cycle enables of an empty balance group</li>
 * <li>directly nested bounded loops are merged into one loop whose bound is the product of the bounds</li>
 * <li>empty statements are removed from sequences</li>
 * </ul>
 * Merging loops removes the condition check between outer iterations, so the result must only be lowered through the
 * static path.
 */
public class Normalize {
  private final Builder builder;
  private final boolean denestLoops;
  private Group balance = null;

  public Normalize(Builder builder, boolean denestLoops) {
    this.builder = builder;
    this.denestLoops = denestLoops;
  }

  /**
   * Normalizes a program whose sub-programs carry {@code static} attributes.
   * @return the rewritten program
   */
  public static Control apply(Builder builder, Control con, boolean denestLoops) throws MalformedControlException {
    return new Normalize(builder, denestLoops).normalize(con);
  }

  /** The one-cycle no-op group used for padding, created on first use. */
  public Group getBalance() {
    if (balance == null) {
      balance = builder.addGroup("balance");
      balance.getAttributes().insert(Attr.Static, 1);
    }
    return balance;
  }

  public Control normalize(Control con) throws MalformedControlException {
    switch (con.getKind()) {
    case Seq:
    case StaticSeq: {
      Control.Seq seq = (Control.Seq)con;
      List<Control> stmts = new ArrayList<>();
      for (Control stmt : seq.getStmts()) {
        if (stmt.getKind() != Control.Kind.Empty)
          stmts.add(normalize(stmt));
      }
      return new Control.Seq(stmts, seq.isStatic(), new Attributes(con.getAttributes()));
    }
    case Par:
    case StaticPar: {
      Control.Par par = (Control.Par)con;
      List<Control> stmts = new ArrayList<>();
      for (Control stmt : par.getStmts())
        stmts.add(normalize(stmt));
      return new Control.Par(stmts, par.isStatic(), new Attributes(con.getAttributes()));
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      long target = latencyOf(con);
      Control tbranch = extendControl(normalize(ifNode.getThen()), target);
      Control fbranch = extendControl(normalize(ifNode.getElse()), target);
      return ifNode.withBranches(tbranch, fbranch);
    }
    case While: {
      Control.While wh = (Control.While)con;
      Control.While result = wh.withBody(normalize(wh.getBody()));
      return denestLoops ? denestLoop(result) : result;
    }
    case Repeat:
    case StaticRepeat: {
      Control.Repeat rep = (Control.Repeat)con;
      Control.Repeat result = rep.withBody(rep.getCount(), normalize(rep.getBody()));
      return denestLoops ? denestLoop(result) : result;
    }
    default:
      return con;
    }
  }

  /**
   * Pads {@code branch} to {@code target} cycles with balance enables. Branches that already take at least
   * {@code target} cycles are returned unchanged. A sequence is extended with the balance enables; any other branch
   * is wrapped into a new sequence, except an empty one, which is replaced by the balance enables.
   */
  public Control extendControl(Control branch, long target) throws MalformedControlException {
    long latency = (branch.getKind() == Control.Kind.Empty) ? 0 : latencyOf(branch);
    if (latency >= target)
      return branch;
    List<Control> stmts = new ArrayList<>();
    Attributes attrs = new Attributes();
    boolean isStatic = false;
    if (branch.getKind() == Control.Kind.Seq || branch.getKind() == Control.Kind.StaticSeq) {
      // Extend the existing sequence in place of nesting it.
      stmts.addAll(((Control.Seq)branch).getStmts());
      attrs = new Attributes(branch.getAttributes());
      isStatic = ((Control.Seq)branch).isStatic();
    } else if (branch.getKind() != Control.Kind.Empty) {
      stmts.add(branch);
    }
    int balanceIdx = getBalance().getIndex();
    for (long i = latency; i < target; ++i)
      stmts.add(Control.staticEnable(balanceIdx, 1));
    attrs.insert(Attr.Static, target);
    return new Control.Seq(stmts, isStatic, attrs);
  }

  /**
   * Merges directly nested bounded loops: a loop with bound {@code m} whose body is a loop with bound {@code n} and
   * body latency {@code L} becomes one loop with bound {@code m*n} and latency {@code L*m*n}. Repeats until the body is
   * no longer a bare loop.
   */
  public static Control denestLoop(Control loop) throws MalformedControlException {
    Control cur = loop;
    while (true) {
      Control body = loopBody(cur);
      boolean nested = body.getKind() == Control.Kind.While || body.getKind() == Control.Kind.Repeat ||
                       body.getKind() == Control.Kind.StaticRepeat;
      if (!nested || (body.getKind() == Control.Kind.While && ((Control.While)body).getCond().isPresent()))
        return cur;
      long bound = loopBound(cur) * loopBound(body);
      Control innerBody = loopBody(body);
      long latency = latencyOf(innerBody) * bound;
      Control merged;
      if (cur.getKind() == Control.Kind.While) {
        merged = ((Control.While)cur).withBody(innerBody);
        merged.getAttributes().insert(Attr.Bound, bound);
      } else {
        merged = ((Control.Repeat)cur).withBody(bound, innerBody);
      }
      merged.getAttributes().insert(Attr.Static, latency);
      cur = merged;
    }
  }

  /** Trip count of a bounded loop: {@code @bound} of a while, the count of a repeat. */
  static long loopBound(Control loop) throws MalformedControlException {
    if (loop.getKind() == Control.Kind.While) {
      OptionalLong bound = loop.getAttributes().get(Attr.Bound);
      if (bound.isEmpty())
        throw new MalformedControlException("static while loop is missing a @bound annotation", loop.getAttributes());
      return bound.getAsLong();
    }
    return ((Control.Repeat)loop).getCount();
  }

  static Control loopBody(Control loop) {
    return (loop.getKind() == Control.Kind.While) ? ((Control.While)loop).getBody() : ((Control.Repeat)loop).getBody();
  }

  static long latencyOf(Control con) throws MalformedControlException {
    OptionalLong latency = con.getLatency();
    if (latency.isEmpty())
      throw new MalformedControlException("control node inside a static program is missing a @static annotation",
                                          con.getAttributes());
    return latency.getAsLong();
  }
}
