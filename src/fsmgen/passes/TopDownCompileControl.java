package fsmgen.passes;

import fsmgen.analysis.ControlId;
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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers a dynamically timed control program into a single enable of a group driven by an FSM.
 * <p>
 * Every enable is assigned a state ({@code node_id}), and transitions are added from each of its predecessors,
 * guarded by the predecessor's done hole and the branch conditions on the way. For
 * <pre>
 * seq { one; two; }
 * </pre>
 * the FSM {@code f} is
 * <pre>
 * one[go] = !one[done] &amp; f.out == 0 ? 1'd1;
 * two[go] = !two[done] &amp; f.out == 1 ? 1'd1;
 * f.in = f.out == 0 &amp; one[done] ? 1;
 * f.in = f.out == 1 &amp; two[done] ? 2;
 * </pre>
 * With early transitions, a group is also started in the cycle in which its predecessor signals done, saving the
 * transition cycle.
 * <p>
 * Every par block is compiled first into a group that runs each thread with its own FSM and latches each thread's
 * done hole in a one-bit register, so the threads make progress independently.
 */
public class TopDownCompileControl {
  protected static final Logger logger = LogManager.getLogger();

  private final boolean dumpFsm;
  private final boolean earlyTransitions;

  public TopDownCompileControl(boolean dumpFsm, boolean earlyTransitions) {
    this.dumpFsm = dumpFsm;
    this.earlyTransitions = earlyTransitions;
  }

  /**
   * Runs the pass on a component, replacing its control program by one enable.
   * @throws MalformedControlException if the program contains invoke, repeat or empty statements
   */
  public void apply(Component comp, Library library) throws MalformedControlException {
    Control con = comp.getControl();
    if (con.getKind() == Control.Kind.Enable || con.getKind() == Control.Kind.StaticEnable ||
        con.getKind() == Control.Kind.Empty) {
      logger.debug("tdcc: nothing to compile in {}", comp.getName());
      return;
    }
    ControlId.computeUniqueIds(con, 0);
    Builder builder = new Builder(comp, library);
    con = compilePars(con, builder);
    Schedule schedule = calculateStates(con, builder, earlyTransitions);
    Group group = schedule.realizeSchedule("tdcc", dumpFsm);
    logger.debug("tdcc: compiled control program of {} into {}", comp.getName(), group.getName());
    comp.setControl(Control.enable(group.getIndex()));
  }

  // Post-order: replaces every par block by an enable of its compiled group.
  private Control compilePars(Control con, Builder builder) throws MalformedControlException {
    switch (con.getKind()) {
    case Seq:
    case StaticSeq: {
      Control.Seq seq = (Control.Seq)con;
      List<Control> stmts = new ArrayList<>();
      for (Control stmt : seq.getStmts())
        stmts.add(compilePars(stmt, builder));
      return new Control.Seq(stmts, seq.isStatic(), con.getAttributes());
    }
    case Par:
    case StaticPar: {
      List<Control> stmts = new ArrayList<>();
      for (Control stmt : ((Control.Par)con).getStmts())
        stmts.add(compilePars(stmt, builder));
      Group parGroup = compilePar(stmts, builder);
      Control.Enable en = Control.enable(parGroup.getIndex());
      en.getAttributes().insert(Attr.NodeId, con.getAttributes().getRequired(Attr.NodeId));
      return en;
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      return ifNode.withBranches(compilePars(ifNode.getThen(), builder), compilePars(ifNode.getElse(), builder));
    }
    case While: {
      Control.While wh = (Control.While)con;
      return wh.withBody(compilePars(wh.getBody(), builder));
    }
    default:
      return con;
    }
  }

  private Group compilePar(List<Control> threads, Builder builder) throws MalformedControlException {
    Component comp = builder.getComponent();
    Group parGroup = builder.addGroup("par");
    int signalOn = builder.constantOut(1, 1);
    int signalOff = builder.constantOut(0, 1);
    List<Cell> doneRegs = new ArrayList<>();
    for (Control thread : threads) {
      Group group;
      if (thread instanceof Control.Enable) {
        group = comp.getGroup(((Control.Enable)thread).getGroup());
      } else {
        Schedule schedule = calculateStates(thread, builder, earlyTransitions);
        group = schedule.realizeSchedule("tdcc", dumpFsm);
      }
      // pd latches the done signal of the thread.
      Cell pd = builder.addPrimitive("pd", "std_reg", 1);
      Guard groupGo = Guard.port(builder.out(pd)).or(Guard.port(group.getDone())).not();
      Guard groupDone = Guard.port(group.getDone());
      parGroup.assignments.add(builder.buildAssignment(group.getGo(), signalOn, groupGo));
      parGroup.assignments.addAll(builder.registerWrite(pd, signalOn, groupDone));
      doneRegs.add(pd);
    }
    Guard doneGuard = Guard.TRUE;
    for (Cell pd : doneRegs)
      doneGuard = doneGuard.and(Guard.port(builder.out(pd)));
    for (Cell pd : doneRegs)
      comp.continuousAssignments.addAll(builder.registerWrite(pd, signalOff, doneGuard));
    parGroup.assignments.add(builder.buildAssignment(parGroup.getDone(), signalOn, doneGuard));
    logger.debug("tdcc: compiled par with {} threads into {}", threads.size(), parGroup.getName());
    return parGroup;
  }

  /** An exit of a sub-program: the state of an enable that may run last, with its group. */
  private record Exit(long state, Group group) {}

  /**
   * The enables that may run last in {@code con}. A conditional without an else branch can also be left directly
   * from the enables preceding it.
   */
  private static List<Exit> controlExits(Component comp, Control con, List<Exit> prevExits) throws MalformedControlException {
    switch (con.getKind()) {
    case Enable:
    case StaticEnable:
      return List.of(new Exit(nodeId(comp, (Control.Enable)con), comp.getGroup(((Control.Enable)con).getGroup())));
    case Seq:
    case StaticSeq: {
      List<Exit> pe = prevExits;
      for (Control stmt : ((Control.Seq)con).getStmts())
        pe = controlExits(comp, stmt, pe);
      return pe;
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      List<Exit> exits = new ArrayList<>(controlExits(comp, ifNode.getThen(), prevExits));
      if (ifNode.getElse().getKind() == Control.Kind.Empty)
        exits.addAll(prevExits);
      else
        exits.addAll(controlExits(comp, ifNode.getElse(), prevExits));
      return exits;
    }
    case While:
      return controlExits(comp, ((Control.While)con).getBody(), prevExits);
    default:
      throw unsupported(con);
    }
  }

  private static long nodeId(Component comp, Control.Enable en) {
    return en.getAttributes().get(Attr.NodeId).orElseThrow(
        () -> new IllegalStateException("Internal error: group " + comp.getGroup(en.getGroup()).getName() +
                                        " does not have node_id information"));
  }

  private static MalformedControlException unsupported(Control con) {
    String what;
    switch (con.getKind()) {
    case Invoke:
      what = "invoke statements";
      break;
    case Repeat:
    case StaticRepeat:
      what = "repeat statements";
      break;
    case Empty:
      what = "empty statements";
      break;
    default:
      what = "par blocks";
      break;
    }
    return new MalformedControlException(what + " should have been compiled away before FSM generation", con.getAttributes());
  }

  /**
   * Builds the schedule of a par-free program with node ids. An empty initial state 0 is created in case the
   * program starts with a branch; otherwise the first enable is merged into it. All exits of the program lead to one
   * additional final state.
   */
  public static Schedule calculateStates(Control con, Builder builder, boolean earlyTransitions) throws MalformedControlException {
    Schedule schedule = new Schedule(builder);
    List<PredEdge> prev = calculateStatesRecur(con, List.of(new PredEdge(0, Guard.TRUE)), schedule, earlyTransitions);
    long next = prev.stream().mapToLong(PredEdge::state).max().getAsLong() + 1;
    for (PredEdge edge : prev)
      schedule.addTransition(edge.state(), next, edge.guard());
    return schedule;
  }

  private static List<PredEdge> calculateStatesRecur(Control con, List<PredEdge> preds, Schedule schedule,
                                                     boolean earlyTransitions) throws MalformedControlException {
    Builder builder = schedule.getBuilder();
    Component comp = builder.getComponent();
    switch (con.getKind()) {
    case Enable:
    case StaticEnable: {
      Control.Enable en = (Control.Enable)con;
      Group group = comp.getGroup(en.getGroup());
      long curState = nodeId(comp, en);
      List<PredEdge> prevStates = preds;
      // A single unconditional predecessor is merged into this state.
      if (preds.size() == 1 && preds.get(0).guard().isTrue()) {
        curState = preds.get(0).state();
        prevStates = List.of();
      }
      Guard notDone = Guard.port(group.getDone()).not();
      schedule.addEnables(curState, List.of(builder.assignHigh(group.getGo(), notDone)));
      // Not guarded by !done: every group runs for at least one cycle.
      if (earlyTransitions) {
        for (PredEdge pred : prevStates)
          schedule.addEnables(pred.state(), List.of(builder.assignHigh(group.getGo(), pred.guard())));
      }
      for (PredEdge pred : prevStates)
        schedule.addTransition(pred.state(), curState, pred.guard());
      return List.of(new PredEdge(curState, Guard.port(group.getDone())));
    }
    case Seq:
    case StaticSeq: {
      List<PredEdge> prev = preds;
      for (Control stmt : ((Control.Seq)con).getStmts())
        prev = calculateStatesRecur(stmt, prev, schedule, earlyTransitions);
      return prev;
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      if (ifNode.getCond().isPresent()) {
        Group cond = comp.getGroup(ifNode.getCond().get());
        for (PredEdge pred : preds)
          schedule.addEnables(pred.state(), cond.assignments);
      }
      Guard portGuard = Guard.port(ifNode.getPort());
      List<PredEdge> truTransitions = new ArrayList<>();
      List<PredEdge> falTransitions = new ArrayList<>();
      for (PredEdge pred : preds) {
        truTransitions.add(pred.and(portGuard));
        falTransitions.add(pred.and(portGuard.not()));
      }
      List<PredEdge> prevs = new ArrayList<>(calculateStatesRecur(ifNode.getThen(), truTransitions, schedule, earlyTransitions));
      // Without an else branch, the false edges lead directly to the next node.
      if (ifNode.getElse().getKind() == Control.Kind.Empty)
        prevs.addAll(falTransitions);
      else
        prevs.addAll(calculateStatesRecur(ifNode.getElse(), falTransitions, schedule, earlyTransitions));
      return prevs;
    }
    case While: {
      Control.While wh = (Control.While)con;
      Guard portGuard = Guard.port(wh.getPort());
      // Back edges from every enable that may run last in the body.
      List<PredEdge> transitions = new ArrayList<>();
      for (PredEdge pred : preds)
        transitions.add(pred.and(portGuard));
      for (Exit exit : controlExits(comp, wh.getBody(), List.of()))
        transitions.add(new PredEdge(exit.state(), Guard.port(exit.group().getDone()).and(portGuard)));
      List<PredEdge> bodyExits = calculateStatesRecur(wh.getBody(), transitions, schedule, earlyTransitions);
      // The loop is left before the body or after it when the condition is false.
      Guard notPort = portGuard.not();
      List<PredEdge> allPrevs = new ArrayList<>();
      for (PredEdge pred : preds)
        allPrevs.add(pred.and(notPort));
      for (PredEdge exit : bodyExits)
        allPrevs.add(exit.and(notPort));
      if (wh.getCond().isPresent()) {
        Group cond = comp.getGroup(wh.getCond().get());
        for (PredEdge pred : allPrevs)
          schedule.addEnables(pred.state(), cond.assignments);
      }
      return allPrevs;
    }
    default:
      throw unsupported(con);
    }
  }
}
