package fsmgen.analysis;

import fsmgen.ir.Attr;
import fsmgen.ir.Component;
import fsmgen.ir.Control;
import fsmgen.ir.Guard;
import fsmgen.ir.MalformedControlException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes, for every enable and invoke of a dynamically timed program, the node ids that may directly precede it and
 * the guard under which control transitions from each of them.
 * <p>
 * Only loop back edges link leaves: an enable or invoke passes no predecessors on to the statement after it. For the
 * program
 * <pre>
 * while lt.out { &#64;node_id(1) one; &#64;node_id(2) two; }
 * &#64;node_id(3) fin;
 * </pre>
 * the predecessor map is
 * <pre>
 * 1 -&gt; {2: lt.out}
 * 2 -&gt; {}
 * 3 -&gt; {2: !lt.out}
 * </pre>
 * The guards do not include the done condition of the predecessor; {@link #getGuarded} adds it.
 * Node ids must have been assigned with {@link ControlId#computeUniqueIds}.
 */
public class Predecessor {
  private final Component comp;
  /** node_id of an enable to the index of its group */
  private final HashMap<Long, Integer> groupMap = new HashMap<>();
  private final LinkedHashMap<Long, Map<Long, Guard>> map = new LinkedHashMap<>();

  private Predecessor(Component comp) { this.comp = comp; }

  /**
   * Runs the analysis over a program.
   * @throws MalformedControlException if the program contains par or repeat nodes
   */
  public static Predecessor construct(Component comp, Control con) throws MalformedControlException {
    Predecessor preds = new Predecessor(comp);
    preds.constructMap(con, new LinkedHashMap<>());
    return preds;
  }

  /** Predecessors of the node with the given id, without done conditions. */
  public Optional<Map<Long, Guard>> get(long nodeId) {
    return Optional.ofNullable(map.get(nodeId)).map(Collections::unmodifiableMap);
  }

  /**
   * Predecessors of the node with the given id, each guard additionally requiring the predecessor group's done hole.
   * Empty if the node is unknown or any predecessor is an invoke, which has no done hole to transition on.
   */
  public Optional<Map<Long, Guard>> getGuarded(long nodeId) {
    Map<Long, Guard> preds = map.get(nodeId);
    if (preds == null)
      return Optional.empty();
    LinkedHashMap<Long, Guard> guarded = new LinkedHashMap<>();
    for (Map.Entry<Long, Guard> entry : preds.entrySet()) {
      Integer group = groupMap.get(entry.getKey());
      if (group == null)
        return Optional.empty();
      guarded.put(entry.getKey(), entry.getValue().and(Guard.port(comp.getGroup(group).getDone())));
    }
    return Optional.of(guarded);
  }

  /** The full map from node id to its predecessors. */
  public Map<Long, Map<Long, Guard>> predMap() { return Collections.unmodifiableMap(map); }

  /**
   * Node ids of the leaves from which control can leave {@code con}. A while loop exits through its condition check,
   * which happens after one of its body exits.
   */
  public static List<Long> controlExits(Control con) {
    List<Long> exits = new ArrayList<>();
    controlExits(con, exits);
    return exits;
  }

  private static void controlExits(Control con, List<Long> exits) {
    switch (con.getKind()) {
    case Enable:
    case StaticEnable:
    case Invoke:
      exits.add(nodeId(con));
      break;
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
      controlExits(((Control.While)con).getBody(), exits);
      break;
    case Repeat:
    case StaticRepeat:
      controlExits(((Control.Repeat)con).getBody(), exits);
      break;
    case Par:
    case StaticPar:
    case Empty:
      // par blocks transition through their own join logic
      break;
    }
  }

  private static long nodeId(Control con) {
    return con.getAttributes().get(Attr.NodeId).orElseThrow(
        () -> new IllegalStateException("Internal error: control node does not have a node_id attribute"));
  }

  private Map<Long, Guard> constructMap(Control con, Map<Long, Guard> prev) throws MalformedControlException {
    switch (con.getKind()) {
    case Empty:
      return prev;
    case Enable:
    case StaticEnable: {
      long id = nodeId(con);
      map.put(id, prev);
      groupMap.put(id, ((Control.Enable)con).getGroup());
      return new LinkedHashMap<>();
    }
    case Invoke: {
      long id = nodeId(con);
      map.put(id, prev);
      return new LinkedHashMap<>();
    }
    case Seq:
    case StaticSeq: {
      Map<Long, Guard> cur = prev;
      for (Control stmt : ((Control.Seq)con).getStmts())
        cur = constructMap(stmt, cur);
      return cur;
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      Guard portGuard = Guard.port(ifNode.getPort());
      Map<Long, Guard> truNext = constructMap(ifNode.getThen(), andAll(prev, portGuard));
      Map<Long, Guard> falNext = constructMap(ifNode.getElse(), andAll(prev, portGuard.not()));
      return union(truNext, falNext);
    }
    case While: {
      Control.While wh = (Control.While)con;
      Guard portGuard = Guard.port(wh.getPort());
      LinkedHashMap<Long, Guard> backEdges = new LinkedHashMap<>();
      for (long exit : controlExits(wh.getBody()))
        backEdges.put(exit, Guard.TRUE);
      Map<Long, Guard> allPrev = union(prev, backEdges);
      // The body exits are already part of allPrev.
      constructMap(wh.getBody(), andAll(allPrev, portGuard));
      return andAll(allPrev, portGuard.not());
    }
    case Par:
    case StaticPar:
      throw new MalformedControlException("par blocks must be compiled before computing predecessors", con.getAttributes());
    case Repeat:
    case StaticRepeat:
      throw new MalformedControlException("repeat must be unrolled before computing predecessors", con.getAttributes());
    default:
      throw new IllegalStateException("Internal error: unknown control kind " + con.getKind());
    }
  }

  private static Map<Long, Guard> andAll(Map<Long, Guard> preds, Guard guard) {
    LinkedHashMap<Long, Guard> result = new LinkedHashMap<>();
    preds.forEach((id, g) -> result.put(id, g.and(guard)));
    return result;
  }

  // Edges from the same node are merged by disjunction.
  private static Map<Long, Guard> union(Map<Long, Guard> a, Map<Long, Guard> b) {
    LinkedHashMap<Long, Guard> result = new LinkedHashMap<>(a);
    b.forEach((id, g) -> result.merge(id, g, Guard::or));
    return result;
  }
}
