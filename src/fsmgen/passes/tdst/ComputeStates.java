package fsmgen.passes.tdst;

import fsmgen.fsm.PredEdge;
import fsmgen.ir.Attr;
import fsmgen.ir.Builder;
import fsmgen.ir.Cell;
import fsmgen.ir.Control;
import fsmgen.ir.Guard;
import fsmgen.ir.MalformedControlException;
import fsmgen.util.Log2;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assigns FSM states to the nodes of a normalized static program.
 * <p>
 * Every enable gets the state in which it starts ({@code ST_ID}); the counter then advances by its latency. Children
 * of a par block, which must all be enables, share the start state of the block. State 0 is reserved for the start of
 * the program, so numbering begins at 1.
 * <p>
 * Bounded loops get an index register counting the cycles spent in the loop. The registers are allocated here so that
 * {@link #controlExits} can guard loop exits with them.
 */
public class ComputeStates {
  /** Loop index register returned by {@link #loopBounds}, with the constant holding the loop's total latency. */
  public record LoopBounds(Cell idx, int totalPort) {}

  private final Builder builder;
  private long curState = 1;
  private final List<Cell> indices = new ArrayList<>();

  private ComputeStates(Builder builder) { this.builder = builder; }

  /**
   * Numbers the states of {@code con}, allocating loop index registers through {@code builder}.
   * @throws MalformedControlException if a node is missing its {@code static} annotation
   */
  public static ComputeStates compute(Control con, Builder builder) throws MalformedControlException {
    ComputeStates states = new ComputeStates(builder);
    states.recur(con);
    return states;
  }

  /** The first state not used by the program. */
  public long getNextState() { return curState; }

  /** All loop index registers, indexed by the {@code LOOP} attribute. */
  public List<Cell> getIndices() { return Collections.unmodifiableList(indices); }

  private void recur(Control con) throws MalformedControlException {
    switch (con.getKind()) {
    case Enable:
    case StaticEnable:
      con.getAttributes().insert(Attr.StateId, curState);
      curState += Normalize.latencyOf(con);
      break;
    case Seq:
    case StaticSeq:
      for (Control stmt : ((Control.Seq)con).getStmts())
        recur(stmt);
      break;
    case If:
    case StaticIf:
      recur(((Control.If)con).getThen());
      recur(((Control.If)con).getElse());
      break;
    case While:
    case Repeat:
    case StaticRepeat:
      computeLoop(con);
      break;
    case Par:
    case StaticPar:
      con.getAttributes().insert(Attr.StateId, curState);
      for (Control stmt : ((Control.Par)con).getStmts()) {
        if (stmt.getKind() != Control.Kind.Enable && stmt.getKind() != Control.Kind.StaticEnable)
          throw new IllegalStateException("Internal error: static par should only contain enables");
        stmt.getAttributes().insert(Attr.StateId, curState);
      }
      curState += Normalize.latencyOf(con);
      break;
    case Invoke:
      throw new IllegalStateException("Internal error: invoke statements should have been compiled away");
    case Empty:
      throw new IllegalStateException("Internal error: empty statements should have been compiled away");
    }
  }

  private void computeLoop(Control loop) throws MalformedControlException {
    loop.getAttributes().insert(Attr.Start, curState);
    long total = Normalize.latencyOf(loop);
    Cell idx = builder.addPrimitive("idx", "std_reg", Log2.bitWidthFrom(total + 1));
    indices.add(idx);
    loop.getAttributes().insert(Attr.Loop, indices.size() - 1);
    recur(Normalize.loopBody(loop));
    loop.getAttributes().insert(Attr.End, curState);
  }

  /**
   * Edges leaving {@code con}: the last state of each enable that can end it, guarded by the exit condition of every
   * enclosing loop within {@code con}. Requires {@code con} to be part of the numbered program.
   */
  public List<PredEdge> controlExits(Control con) {
    List<PredEdge> exits = new ArrayList<>();
    controlExits(con, exits);
    return exits;
  }

  private void controlExits(Control con, List<PredEdge> exits) {
    switch (con.getKind()) {
    case Enable:
    case StaticEnable:
    case Par:
    case StaticPar: {
      long start = con.getAttributes().getRequired(Attr.StateId);
      exits.add(new PredEdge(start + con.getAttributes().getRequired(Attr.Static) - 1, Guard.TRUE));
      break;
    }
    case Seq:
    case StaticSeq: {
      List<Control> stmts = ((Control.Seq)con).getStmts();
      if (!stmts.isEmpty())
        controlExits(stmts.get(stmts.size() - 1), exits);
      break;
    }
    case If:
    case StaticIf:
      controlExits(((Control.If)con).getThen(), exits);
      controlExits(((Control.If)con).getElse(), exits);
      break;
    case While:
    case Repeat:
    case StaticRepeat: {
      List<PredEdge> loopExits = new ArrayList<>();
      controlExits(Normalize.loopBody(con), loopExits);
      LoopBounds bounds = loopBounds(con);
      Guard exit = Guard.eq(builder.out(bounds.idx()), bounds.totalPort());
      loopExits.forEach(edge -> exits.add(edge.and(exit)));
      break;
    }
    case Invoke:
      throw new IllegalStateException("Internal error: invoke should have been compiled away");
    case Empty:
      throw new IllegalStateException("Internal error: empty block in control exits");
    }
  }

  /** The index register of a loop and the constant it counts up to. */
  public LoopBounds loopBounds(Control loop) {
    long total = loop.getAttributes().getRequired(Attr.Static);
    int size = Log2.bitWidthFrom(total + 1);
    int totalPort = builder.constantOut(total, size);
    Cell idx = indices.get((int)loop.getAttributes().getRequired(Attr.Loop));
    return new LoopBounds(idx, totalPort);
  }
}
