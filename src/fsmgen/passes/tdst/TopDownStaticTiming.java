package fsmgen.passes.tdst;

import fsmgen.analysis.StaticLatency;
import fsmgen.fsm.PredEdge;
import fsmgen.fsm.Schedule;
import fsmgen.ir.Attr;
import fsmgen.ir.Builder;
import fsmgen.ir.Cell;
import fsmgen.ir.Component;
import fsmgen.ir.Control;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.Library;
import fsmgen.ir.MalformedControlException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers every statically timed sub-program of a component into one group driven by a latency-sensitive FSM, and
 * replaces the sub-program by an enable of that group.
 * <p>
 * The generated schedules give cycle-exact guarantees:
 * <ul>
 * <li>{@code seq { a; b }}: b starts in the cycle after a finishes</li>
 * <li>{@code if p { t } else { f }}: the chosen branch starts as soon as the conditional starts</li>
 * <li>{@code @bound(n) while p { b }}: each iteration starts in the cycle after the previous one finishes</li>
 * <li>{@code par { a; b }}: a and b start in the same cycle</li>
 * </ul>
 * Static par blocks are handled first by giving each non-enable thread its own schedule. Afterwards, the outermost
 * nodes carrying {@code static} are compiled: {@link Normalize}, {@link ComputeStates}, schedule construction, and
 * {@link Schedule#realizeSchedule}. Invokes and combinational groups must have been compiled away.
 */
public class TopDownStaticTiming {
  protected static final Logger logger = LogManager.getLogger();

  private final boolean dumpFsm;
  private final boolean force;
  private final boolean denestLoops;

  /**
   * @param dumpFsm log every generated schedule
   * @param force require the whole control program to be lowered into one enable
   * @param denestLoops merge directly nested bounded loops
   */
  public TopDownStaticTiming(boolean dumpFsm, boolean force, boolean denestLoops) {
    this.dumpFsm = dumpFsm;
    this.force = force;
    this.denestLoops = denestLoops;
  }

  /**
   * Runs the pass on a component, replacing its control program.
   * @throws MalformedControlException if a static program violates the preconditions of the pass, or if
   *     {@code force} is set and the result is not a single enable
   */
  public void apply(Component comp, Library library) throws MalformedControlException {
    Control con = comp.getControl();
    if (con.getKind() == Control.Kind.Enable || con.getKind() == Control.Kind.Empty) {
      logger.debug("tdst: nothing to compile in {}", comp.getName());
      return;
    }
    StaticLatency.update(comp, con);
    Builder builder = new Builder(comp, library);
    con = compileStaticPars(con, builder);
    con = compileSubPrograms(con, builder);
    comp.setControl(con);
    if (force && con.getKind() != Control.Kind.Enable)
      throw new MalformedControlException("force flag was set but the final control program of " + comp.getName() +
                                          " is not an enable");
  }

  // Post-order: gives each non-enable thread of a static par its own schedule.
  private Control compileStaticPars(Control con, Builder builder) throws MalformedControlException {
    switch (con.getKind()) {
    case Seq:
    case StaticSeq: {
      Control.Seq seq = (Control.Seq)con;
      List<Control> stmts = new ArrayList<>();
      for (Control stmt : seq.getStmts())
        stmts.add(compileStaticPars(stmt, builder));
      return new Control.Seq(stmts, seq.isStatic(), con.getAttributes());
    }
    case Par:
    case StaticPar: {
      Control.Par par = (Control.Par)con;
      List<Control> stmts = new ArrayList<>();
      for (Control stmt : par.getStmts())
        stmts.add(compileStaticPars(stmt, builder));
      if (par.getLatency().isPresent()) {
        for (int i = 0; i < stmts.size(); ++i) {
          Control stmt = stmts.get(i);
          if (stmt.getKind() != Control.Kind.Enable && stmt.getKind() != Control.Kind.StaticEnable)
            stmts.set(i, enableOf(compile(stmt, builder), Normalize.latencyOf(stmt)));
        }
      }
      return new Control.Par(stmts, par.isStatic(), con.getAttributes());
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      return ifNode.withBranches(compileStaticPars(ifNode.getThen(), builder), compileStaticPars(ifNode.getElse(), builder));
    }
    case While: {
      Control.While wh = (Control.While)con;
      return wh.withBody(compileStaticPars(wh.getBody(), builder));
    }
    case Repeat:
    case StaticRepeat: {
      Control.Repeat rep = (Control.Repeat)con;
      return rep.withBody(rep.getCount(), compileStaticPars(rep.getBody(), builder));
    }
    default:
      return con;
    }
  }

  // Pre-order: compiles the outermost static sub-programs.
  private Control compileSubPrograms(Control con, Builder builder) throws MalformedControlException {
    if (con.getKind() == Control.Kind.Enable || con.getKind() == Control.Kind.StaticEnable ||
        con.getKind() == Control.Kind.Empty)
      return con;
    OptionalLong time = con.getLatency();
    if (time.isPresent())
      return enableOf(compile(con, builder), time.getAsLong());
    switch (con.getKind()) {
    case Seq:
    case Par: {
      Control.Block block = (Control.Block)con;
      List<Control> stmts = new ArrayList<>();
      for (Control stmt : block.getStmts())
        stmts.add(compileSubPrograms(stmt, builder));
      return (con instanceof Control.Seq) ? new Control.Seq(stmts, false, con.getAttributes())
                                          : new Control.Par(stmts, false, con.getAttributes());
    }
    case If: {
      Control.If ifNode = (Control.If)con;
      return ifNode.withBranches(compileSubPrograms(ifNode.getThen(), builder), compileSubPrograms(ifNode.getElse(), builder));
    }
    case While: {
      Control.While wh = (Control.While)con;
      return wh.withBody(compileSubPrograms(wh.getBody(), builder));
    }
    case Repeat: {
      Control.Repeat rep = (Control.Repeat)con;
      return rep.withBody(rep.getCount(), compileSubPrograms(rep.getBody(), builder));
    }
    default:
      return con;
    }
  }

  private static Control enableOf(Group group, long time) {
    Control.Enable en = Control.enable(group.getIndex());
    en.getAttributes().insert(Attr.Static, time);
    return en;
  }

  /** Compiles one static program into a group. */
  Group compile(Control con, Builder builder) throws MalformedControlException {
    if (con.getLatency().orElse(0) == 0)
      throw new MalformedControlException("static program has zero latency", con.getAttributes());
    Control normalized = Normalize.apply(builder, con, denestLoops);
    ComputeStates states = ComputeStates.compute(normalized, builder);
    StaticSchedule schedule = new StaticSchedule(builder, states);
    List<PredEdge> outEdges = schedule.calculateStates(normalized, List.of(new PredEdge(0, Guard.TRUE)));
    Group group = schedule.realizeSchedule("tdst", Optional.of(outEdges), states.getIndices(), dumpFsm);
    logger.debug("tdst: compiled static program of {} cycles in {} into {}", con.getLatency().getAsLong(),
                 builder.getComponent().getName(), group.getName());
    return group;
  }

  /** Schedule construction for static programs: every state lasts exactly one cycle. */
  static class StaticSchedule extends Schedule {
    private final ComputeStates states;

    StaticSchedule(Builder builder, ComputeStates states) {
      super(builder);
      this.states = states;
    }

    List<PredEdge> calculateStates(Control con, List<PredEdge> preds) throws MalformedControlException {
      if (preds.isEmpty())
        throw new IllegalStateException("Internal error: predecessors should not be empty");
      switch (con.getKind()) {
      case Enable:
      case StaticEnable:
        return enableStates((Control.Enable)con, preds);
      case Seq:
      case StaticSeq: {
        List<PredEdge> cur = preds;
        for (Control stmt : ((Control.Seq)con).getStmts())
          cur = calculateStates(stmt, cur);
        return cur;
      }
      case Par:
      case StaticPar: {
        long longest = con.getAttributes().getRequired(Attr.StateId);
        // A par without threads still spends its first cycle on the incoming transition.
        if (((Control.Par)con).getStmts().isEmpty()) {
          if (con.getAttributes().getRequired(Attr.Static) == 0)
            return preds;
          for (PredEdge pred : preds)
            addTransition(pred.state(), longest, pred.guard());
        }
        for (Control stmt : ((Control.Par)con).getStmts()) {
          if (!(stmt instanceof Control.Enable))
            throw new IllegalStateException("Internal error: static par should only contain enables");
          for (PredEdge exit : enableStates((Control.Enable)stmt, preds))
            longest = Math.max(longest, exit.state());
        }
        long last = con.getAttributes().getRequired(Attr.StateId) + con.getAttributes().getRequired(Attr.Static) - 1;
        if (longest > last)
          throw new MalformedControlException("static par with latency " + con.getAttributes().getRequired(Attr.Static) +
                                                  " is shorter than its longest thread",
                                              con.getAttributes());
        // An explicit latency above the longest thread idles in the remaining states.
        for (long s = longest; s < last; ++s)
          addTransition(s, s + 1, Guard.TRUE);
        return List.of(new PredEdge(last, Guard.TRUE));
      }
      case If:
      case StaticIf:
        return ifStates((Control.If)con, preds);
      case While:
      case Repeat:
      case StaticRepeat:
        return loopStates(con, preds);
      case Invoke:
        throw new MalformedControlException("invoke statements should have been compiled away before static timing",
                                            con.getAttributes());
      case Empty:
      default:
        throw new MalformedControlException("empty statements should have been compiled away before static timing",
                                            con.getAttributes());
      }
    }

    // Transitions from all predecessors into the enable and keeps it active for its latency.
    private List<PredEdge> enableStates(Control.Enable con, List<PredEdge> preds) throws MalformedControlException {
      OptionalLong timeOpt = con.getLatency();
      if (timeOpt.isEmpty())
        throw new MalformedControlException("enable is missing @static annotation. This happens when the enclosing control "
                                                + "program has a @static annotation but the enable is missing one.",
                                            con.getAttributes());
      long time = timeOpt.getAsLong();
      if (time < 1)
        throw new MalformedControlException("static enable with latency " + time, con.getAttributes());
      Builder builder = getBuilder();
      Group group = builder.getComponent().getGroup(con.getGroup());
      long curState = con.getAttributes().getRequired(Attr.StateId);

      // The group starts in the cycle of the transition.
      for (PredEdge pred : preds) {
        addEnables(pred.state(), List.of(builder.assignHigh(group.getGo(), pred.guard())));
        addTransition(pred.state(), curState, pred.guard());
      }
      // The transition cycle already counts towards the latency.
      long lastState = curState + time - 1;
      if (time != 1) {
        addEnables(curState, lastState, List.of(builder.assignHigh(group.getGo(), Guard.TRUE)));
        for (long s = curState; s < lastState; ++s)
          addTransition(s, s + 1, Guard.TRUE);
      }
      return List.of(new PredEdge(lastState, Guard.TRUE));
    }

    private List<PredEdge> ifStates(Control.If con, List<PredEdge> preds) throws MalformedControlException {
      if (con.getCond().isPresent())
        throw new MalformedControlException("if-with construct should have been compiled away before static timing",
                                            con.getAttributes());
      Guard portGuard = Guard.port(con.getPort());
      List<PredEdge> tpreds = new ArrayList<>();
      List<PredEdge> fpreds = new ArrayList<>();
      for (PredEdge pred : preds) {
        tpreds.add(pred.and(portGuard));
        fpreds.add(pred.and(portGuard.not()));
      }
      List<PredEdge> exits = new ArrayList<>(calculateStates(con.getThen(), tpreds));
      exits.addAll(calculateStates(con.getElse(), fpreds));
      return exits;
    }

    /**
     * A bounded loop counts its cycles in an index register. For
     * <pre>
     * &#64;bound(10) while lt.out { &#64;static(1) one; &#64;static(2) two; }
     * </pre>
     * the body states are entered from the predecessors and from the body exits while {@code idx < 30}, and the loop
     * is left from the body exits once {@code idx == 30}.
     */
    private List<PredEdge> loopStates(Control loop, List<PredEdge> preds) throws MalformedControlException {
      if (loop instanceof Control.While && ((Control.While)loop).getCond().isPresent())
        throw new MalformedControlException("while-with construct should have been compiled away before static timing",
                                            loop.getAttributes());
      long bound = Normalize.loopBound(loop);
      if (bound < 1)
        throw new MalformedControlException("Loop bound is less than 1", loop.getAttributes());

      Builder builder = getBuilder();
      ComputeStates.LoopBounds bounds = states.loopBounds(loop);
      int idxOut = builder.out(bounds.idx());
      Guard enterGuard = Guard.lt(idxOut, bounds.totalPort());
      List<PredEdge> exits = states.controlExits(Normalize.loopBody(loop));

      List<PredEdge> bodyPreds = new ArrayList<>(preds);
      exits.forEach(edge -> bodyPreds.add(edge.and(enterGuard)));
      List<PredEdge> bodyExits = calculateStates(Normalize.loopBody(loop), bodyPreds);

      Group incr = incrGroup(bounds.idx());
      var incrActivate = builder.assignHigh(incr.getGo(), enterGuard);
      long start = loop.getAttributes().getRequired(Attr.Start);
      long end = loop.getAttributes().getRequired(Attr.End);
      if (end > start)
        addEnables(start, end, List.of(incrActivate));
      for (PredEdge pred : preds)
        addEnables(pred.state(), List.of(incrActivate.andGuard(pred.guard())));

      Guard exit = Guard.eq(idxOut, bounds.totalPort());
      Group reset = resetGroup(bounds.idx());
      var resetActivate = builder.assignHigh(reset.getGo(), exit);
      for (PredEdge edge : exits)
        addEnables(edge.state(), List.of(resetActivate));

      List<PredEdge> loopExits = new ArrayList<>();
      bodyExits.forEach(edge -> loopExits.add(edge.and(exit)));
      return loopExits;
    }

    // Group incrementing a loop index every cycle it is active.
    private Group incrGroup(Cell idx) {
      Builder builder = getBuilder();
      Group group = builder.addGroup("incr_" + idx.getName());
      int size = Builder.width(idx);
      Cell adder = builder.addPrimitive("idx_incr", "std_add", size);
      group.assignments.add(builder.buildAssignment(builder.port(adder, "left"), builder.out(idx), Guard.TRUE));
      group.assignments.add(builder.buildAssignment(builder.port(adder, "right"), builder.constantOut(1, size), Guard.TRUE));
      group.assignments.addAll(builder.registerWrite(idx, builder.out(adder), Guard.TRUE));
      group.assignments.add(builder.buildAssignment(group.getDone(), builder.port(idx, "done"), Guard.TRUE));
      return group;
    }

    // Group resetting a loop index to 0.
    private Group resetGroup(Cell idx) {
      Builder builder = getBuilder();
      Group group = builder.addGroup("reset_" + idx.getName());
      int size = Builder.width(idx);
      group.assignments.addAll(builder.registerWrite(idx, builder.constantOut(0, size), Guard.TRUE));
      group.assignments.add(builder.buildAssignment(group.getDone(), builder.port(idx, "done"), Guard.TRUE));
      return group;
    }
  }
}
