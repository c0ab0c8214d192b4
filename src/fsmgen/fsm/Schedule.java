package fsmgen.fsm;

import fsmgen.guard.GuardPool;
import fsmgen.ir.Assignment;
import fsmgen.ir.Builder;
import fsmgen.ir.Cell;
import fsmgen.ir.Component;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.PortComp;
import fsmgen.ir.Printer;
import fsmgen.util.Log2;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Explicit finite state machine of one compiled control region: the assignments active in each state and the guarded
 * transitions between states. State 0 is the initial state; the largest transition target is the final state.
 * <p>
 * {@link #realizeSchedule} turns the schedule into a group driven by a state register.
 */
public class Schedule {
  protected static final Logger logger = LogManager.getLogger();

  /** A half-open range of states {@code [start, end)}. */
  public record Range(long start, long end) implements Comparable<Range> {
    public boolean contains(long state) { return state >= start && state < end; }
    @Override
    public int compareTo(Range o) {
      int cmp = Long.compare(start, o.start);
      return cmp != 0 ? cmp : Long.compare(end, o.end);
    }
    @Override
    public String toString() {
      return (end == start + 1) ? Long.toString(start) : "[" + start + ", " + end + ")";
    }
  }

  /** Transition {@code from -> to} taken when {@code guard} holds in state {@code from}. */
  public record Transition(long from, long to, Guard guard) {}

  private final Builder builder;
  private final TreeMap<Range, List<Assignment>> enables = new TreeMap<>();
  private final LinkedHashSet<Transition> transitions = new LinkedHashSet<>();

  public Schedule(Builder builder) { this.builder = builder; }

  public Builder getBuilder() { return builder; }

  /** Activates the assignments in a single state. */
  public void addEnables(long state, Collection<Assignment> assigns) { addEnables(state, state + 1, assigns); }

  /**
   * Activates the assignments in every state of {@code [start, end)}.
   * @throws IllegalStateException if the range is empty
   */
  public void addEnables(long start, long end, Collection<Assignment> assigns) {
    if (end <= start)
      throw new IllegalStateException("Internal error: enabling groups in empty range [" + start + ", " + end + ")");
    enables.computeIfAbsent(new Range(start, end), r -> new ArrayList<>()).addAll(assigns);
  }

  /**
   * Adds a transition. Duplicate transitions are kept once.
   * @throws IllegalStateException for an unconditional transition from a state to itself
   */
  public void addTransition(long from, long to, Guard guard) {
    if (from == to && guard.isTrue())
      throw new IllegalStateException("Internal error: unconditional transition from state " + from + " to itself");
    transitions.add(new Transition(from, to, guard));
  }

  public Map<Range, List<Assignment>> getEnables() { return Collections.unmodifiableMap(enables); }

  public List<Transition> getTransitions() { return List.copyOf(transitions); }

  /** All assignments active in the given state, in range order. */
  public List<Assignment> getEnables(long state) {
    return enables.entrySet()
        .stream()
        .filter(entry -> entry.getKey().contains(state))
        .flatMap(entry -> entry.getValue().stream())
        .collect(Collectors.toList());
  }

  /**
   * The final state: the largest transition target.
   * @throws IllegalStateException if there are no transitions
   */
  public long lastState() {
    return transitions.stream().mapToLong(Transition::to).max().orElseThrow(
        () -> new IllegalStateException("Internal error: schedule has no transitions"));
  }

  /**
   * Checks that the states {@code 0..lastState()} form one connected component of the undirected transition graph.
   * @throws IllegalStateException if some state is unreachable
   */
  public void validate() {
    long last = Math.max(lastState(), transitions.stream().mapToLong(Transition::from).max().orElse(0));
    int[] parent = new int[(int)last + 1];
    for (int i = 0; i < parent.length; ++i)
      parent[i] = i;
    int components = parent.length;
    for (Transition t : transitions) {
      int a = find(parent, (int)t.from());
      int b = find(parent, (int)t.to());
      if (a != b) {
        parent[a] = b;
        --components;
      }
    }
    if (components != 1)
      throw new IllegalStateException("Internal error: state transition graph has unreachable states (" + components +
                                      " connected components)");
  }

  private static int find(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }

  /**
   * Checks that no state has two different unconditional drivers of one port. Guarded drivers of the same port are
   * multiplexed and allowed.
   * @throws IllegalStateException on a conflict
   */
  public void checkConflicts() {
    Component comp = builder.getComponent();
    GuardPool pool = new GuardPool(comp);
    long last = lastState();
    for (long state = 0; state <= last; ++state) {
      HashMap<Integer, Assignment> unconditional = new HashMap<>();
      for (Assignment assign : getEnables(state)) {
        if (!pool.flatten(assign.getGuard()).isTrue())
          continue;
        Assignment other = unconditional.putIfAbsent(assign.getDst(), assign);
        if (other != null && other.getSrc() != assign.getSrc())
          throw new IllegalStateException("Internal error: conflicting unconditional assignments in state " + state + ": " +
                                          Printer.assignmentToString(comp, other) + " and " +
                                          Printer.assignmentToString(comp, assign));
      }
    }
  }

  /**
   * Splits the transitions into runs of unconditional {@code s -> s+1} transitions and the remaining ones.
   * A run {@code [a, b)} stands for the transitions {@code a -> a+1, ..., b-1 -> b}.
   */
  public static RunSplit calculateRuns(Collection<Transition> transitions) {
    List<Long> unconditional = new ArrayList<>();
    List<Transition> conditional = new ArrayList<>();
    for (Transition t : transitions) {
      if (t.to() == t.from() + 1 && t.guard().isTrue())
        unconditional.add(t.from());
      else
        conditional.add(t);
    }
    Collections.sort(unconditional);
    List<Range> runs = new ArrayList<>();
    if (!unconditional.isEmpty()) {
      long startS = unconditional.get(0);
      long curS = startS;
      for (long nextS : unconditional.subList(1, unconditional.size())) {
        if (nextS == curS)
          continue;
        if (nextS != curS + 1) {
          runs.add(new Range(startS, curS + 1));
          startS = nextS;
        }
        curS = nextS;
      }
      runs.add(new Range(startS, curS + 1));
    }
    return new RunSplit(runs, conditional);
  }

  public record RunSplit(List<Range> unconditional, List<Transition> conditional) {}

  /** Renders the schedule: the enables per state range, the conditional transitions and the unconditional runs. */
  public String display(String name) {
    Component comp = builder.getComponent();
    StringBuilder sb = new StringBuilder();
    sb.append("======== ").append(name).append(" =========\n");
    enables.forEach((range, assigns) -> {
      sb.append(range).append(":\n");
      if (assigns.isEmpty())
        sb.append("  <empty>\n");
      assigns.forEach(assign -> sb.append("  ").append(Printer.assignmentToString(comp, assign)).append('\n'));
    });
    if (!transitions.isEmpty())
      sb.append(lastState()).append(":\n  <end>\n");
    RunSplit split = calculateRuns(transitions);
    if (!split.conditional().isEmpty()) {
      sb.append("transitions:\n");
      split.conditional()
          .stream()
          .sorted(Comparator.comparingLong(Transition::from).thenComparingLong(Transition::to))
          .forEach(t -> sb.append("  (").append(t.from()).append(", ").append(t.to()).append("): ")
                            .append(Printer.guardToString(comp, t.guard())).append('\n'));
    }
    if (!split.unconditional().isEmpty()) {
      sb.append("Unconditional runs:\n  ");
      sb.append(split.unconditional().stream().map(r -> "(" + r.start() + ", " + r.end() + ")").collect(Collectors.joining(", ")));
      sb.append('\n');
    }
    return sb.toString();
  }

  /** Guard for {@code fsm} being in {@code [s, e)}. */
  private Guard rangeGuard(Range range, int fsmSize, Cell fsm) {
    int fsmOut = builder.out(fsm);
    long s = range.start();
    long e = range.end();
    if (e == s + 1)
      return Guard.eq(fsmOut, builder.constantOut(s, fsmSize));
    if (s == 0)
      return Guard.lt(fsmOut, builder.constantOut(e, fsmSize));
    Guard lower = Guard.comp(PortComp.Geq, fsmOut, builder.constantOut(s, fsmSize));
    if (e >= (1L << fsmSize))
      return lower;
    return lower.and(Guard.lt(fsmOut, builder.constantOut(e, fsmSize)));
  }

  /**
   * Realizes the schedule as a new group whose done condition is reaching the final state.
   * @see #realizeSchedule(String, Optional, List, boolean)
   */
  public Group realizeSchedule(String prefix, boolean dumpFsm) {
    return realizeSchedule(prefix, Optional.empty(), List.of(), dumpFsm);
  }

  /**
   * Builds the hardware implementing this schedule.
   * <ul>
   * <li>a state register {@code fsm} wide enough for {@code 0..lastState()}</li>
   * <li>every enabled assignment additionally guarded by the state register being in its state range</li>
   * <li>state register updates for every transition; runs of unconditional {@code +1} transitions share an adder</li>
   * <li>the group's done hole, driven when the final state is reached, or when one of {@code outEdges} is taken</li>
   * <li>continuous assignments resetting the state register and the given loop index registers to 0 when done</li>
   * </ul>
   * The schedule must not be used afterwards.
   * @param prefix name prefix of the new group
   * @param outEdges exit edges of the program; if absent, done is {@code fsm == lastState()}
   * @param loopIndices index registers to reset on completion
   * @param dumpFsm log the schedule at info level
   * @throws IllegalStateException if the schedule is disconnected or has conflicting drivers
   */
  public Group realizeSchedule(String prefix, Optional<List<PredEdge>> outEdges, List<Cell> loopIndices, boolean dumpFsm) {
    validate();
    checkConflicts();
    long last = lastState();
    Component comp = builder.getComponent();
    Group group = builder.addGroup(prefix);
    String dump = display(comp.getName() + ":" + group.getName());
    if (dumpFsm)
      logger.info("\n{}", dump);
    else
      logger.trace("\n{}", dump);

    int fsmSize = Log2.bitWidthFrom(last + 1);
    Cell fsm = builder.addPrimitive("fsm", "std_reg", fsmSize);
    int fsmOut = builder.out(fsm);
    int signalOn = builder.constantOut(1, 1);
    int firstState = builder.constantOut(0, fsmSize);

    for (var entry : enables.entrySet()) {
      Guard stateGuard = rangeGuard(entry.getKey(), fsmSize, fsm);
      for (Assignment assign : entry.getValue())
        group.assignments.add(assign.andGuard(stateGuard));
    }

    RunSplit split = calculateRuns(transitions);
    split.conditional().stream().sorted(Comparator.comparingLong(Transition::from)).forEach(t -> {
      Guard transGuard = Guard.eq(fsmOut, builder.constantOut(t.from(), fsmSize)).and(t.guard());
      group.assignments.addAll(builder.registerWrite(fsm, builder.constantOut(t.to(), fsmSize), transGuard));
    });
    if (!split.unconditional().isEmpty()) {
      Guard uncondGuard = Guard.never();
      for (Range run : split.unconditional())
        uncondGuard = uncondGuard.or(rangeGuard(run, fsmSize, fsm));
      Cell fsmIncr = builder.addPrimitive("fsm_incr", "std_add", fsmSize);
      group.assignments.add(builder.buildAssignment(builder.port(fsmIncr, "left"), fsmOut, Guard.TRUE));
      group.assignments.add(builder.buildAssignment(builder.port(fsmIncr, "right"), builder.constantOut(1, fsmSize), Guard.TRUE));
      group.assignments.addAll(builder.registerWrite(fsm, builder.out(fsmIncr), uncondGuard));
    }

    Guard doneGuard;
    if (outEdges.isPresent()) {
      if (outEdges.get().isEmpty())
        throw new IllegalStateException("Internal error: no outgoing edges for " + group.getName());
      doneGuard = Guard.never();
      for (PredEdge edge : outEdges.get())
        doneGuard = doneGuard.or(Guard.eq(fsmOut, builder.constantOut(edge.state(), fsmSize)).and(edge.guard()));
    } else {
      doneGuard = Guard.eq(fsmOut, builder.constantOut(last, fsmSize));
    }
    group.assignments.add(builder.buildAssignment(group.getDone(), signalOn, doneGuard));

    comp.continuousAssignments.addAll(builder.registerWrite(fsm, firstState, doneGuard));
    for (Cell idx : loopIndices)
      comp.continuousAssignments.addAll(builder.registerWrite(idx, builder.constantOut(0, Builder.width(idx)), doneGuard));

    enables.clear();
    transitions.clear();
    return group;
  }
}
