package fsmgen.analysis;

import fsmgen.ir.Assignment;
import fsmgen.ir.Attr;
import fsmgen.ir.CombinationalCycleException;
import fsmgen.ir.Component;
import fsmgen.ir.Direction;
import fsmgen.ir.Port;
import fsmgen.ir.Primitive;
import fsmgen.ir.Printer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Orders a set of assignments so that every combinational read comes after the assignments that drive it.
 * <p>
 * Assignments to group holes are excluded from the ordering and appended at the end in their original order.
 */
public class DataflowOrder {
  protected static final Logger logger = LogManager.getLogger();

  /** Primitive name to its write map: output port to the input ports it depends on combinationally. */
  private final HashMap<String, Map<String, Set<String>>> writeMaps = new HashMap<>();

  public DataflowOrder(Collection<Primitive> primitives) {
    for (Primitive prim : primitives)
      writeMaps.put(prim.getName(), primToWriteMap(prim));
  }

  /**
   * Builds the write map of a primitive. Outputs marked {@code stable} or {@code done} have no combinational inputs.
   * Ports sharing a {@code read_together} value form one output with exactly the inputs of that set. Every other
   * output depends on every other input.
   * @throws IllegalArgumentException if a read_together set does not contain exactly one output
   */
  public static Map<String, Set<String>> primToWriteMap(Primitive prim) {
    HashMap<String, Set<String>> writeMap = new HashMap<>();
    HashMap<Long, List<Primitive.PortDef>> readTogether = new HashMap<>();
    LinkedHashSet<String> inputs = new LinkedHashSet<>();
    List<Primitive.PortDef> outputs = new ArrayList<>();
    for (Primitive.PortDef port : prim.getSignature()) {
      var rt = port.getAttributes().get(Attr.ReadTogether);
      if (rt.isPresent()) {
        readTogether.computeIfAbsent(rt.getAsLong(), k -> new ArrayList<>()).add(port);
        continue;
      }
      if (port.getDirection() == Direction.Input)
        inputs.add(port.getName());
      else if (port.getDirection() == Direction.Output)
        outputs.add(port);
      else
        throw new IllegalArgumentException("Primitive " + prim.getName() + " has inout port " + port.getName());
    }
    for (Primitive.PortDef out : outputs) {
      boolean stable = out.getAttributes().has(Attr.Stable) || out.getAttributes().has(Attr.Done);
      writeMap.put(out.getName(), stable ? Collections.emptySet() : Collections.unmodifiableSet(inputs));
    }
    for (var entry : readTogether.entrySet()) {
      List<Primitive.PortDef> rtOutputs =
          entry.getValue().stream().filter(p -> p.getDirection() == Direction.Output).collect(Collectors.toList());
      if (rtOutputs.size() != 1)
        throw new IllegalArgumentException("read_together(" + entry.getKey() + ") of primitive " + prim.getName() +
                                           " must contain exactly one output port");
      Set<String> rtInputs = entry.getValue()
                                 .stream()
                                 .filter(p -> p.getDirection() == Direction.Input)
                                 .map(Primitive.PortDef::getName)
                                 .collect(Collectors.toCollection(LinkedHashSet::new));
      writeMap.put(rtOutputs.get(0).getName(), rtInputs);
    }
    return writeMap;
  }

  /** The write map of a primitive known to this instance. */
  public Optional<Map<String, Set<String>>> getWriteMap(String primitive) { return Optional.ofNullable(writeMaps.get(primitive)); }

  /**
   * Sorts the assignments topologically by combinational dataflow.
   * @throws CombinationalCycleException if the assignments form a combinational loop
   * @throws IllegalStateException if an assignment depends on itself
   */
  public List<Assignment> dataflowSort(Component comp, List<Assignment> assigns) throws CombinationalCycleException {
    List<Assignment> nodes = new ArrayList<>();
    List<Assignment> holeWrites = new ArrayList<>();
    // "cell.port" of a primitive input to the nodes writing it
    HashMap<String, List<Integer>> writes = new HashMap<>();
    for (Assignment assign : assigns) {
      Port dst = comp.getPort(assign.getDst());
      if (dst.isHole()) {
        holeWrites.add(assign);
        continue;
      }
      int idx = nodes.size();
      nodes.add(assign);
      if (comp.primitiveOf(assign.getDst()).isPresent())
        writes.computeIfAbsent(comp.canonical(assign.getDst()), k -> new ArrayList<>()).add(idx);
    }

    List<Set<Integer>> successors = new ArrayList<>();
    for (int i = 0; i < nodes.size(); ++i)
      successors.add(new LinkedHashSet<>());
    int[] indegree = new int[nodes.size()];
    for (int reader = 0; reader < nodes.size(); ++reader) {
      Assignment assign = nodes.get(reader);
      List<Integer> reads = new ArrayList<>(assign.getGuard().allPorts());
      reads.add(0, assign.getSrc());
      for (int readPort : reads) {
        for (int writer : writersOf(comp, readPort, writes)) {
          if (writer == reader)
            throw new IllegalStateException("Internal error: assignment depends on itself: " +
                                            Printer.assignmentToString(comp, assign));
          if (successors.get(writer).add(reader))
            ++indegree[reader];
        }
      }
    }

    // Kahn's algorithm, picking the earliest ready assignment first.
    PriorityQueue<Integer> ready = new PriorityQueue<>();
    for (int i = 0; i < nodes.size(); ++i)
      if (indegree[i] == 0)
        ready.add(i);
    List<Assignment> order = new ArrayList<>(assigns.size());
    while (!ready.isEmpty()) {
      int cur = ready.poll();
      order.add(nodes.get(cur));
      for (int succ : successors.get(cur))
        if (--indegree[succ] == 0)
          ready.add(succ);
    }
    if (order.size() != nodes.size()) {
      List<Integer> scc = findCycle(successors).orElseThrow(
          () -> new IllegalStateException("Internal error: dataflow graph is cyclic but has no cycle of two or more assignments"));
      List<String> rendered = scc.stream().sorted().map(i -> Printer.assignmentToString(comp, nodes.get(i))).collect(Collectors.toList());
      logger.error("Combinational cycle in component {}:\n{}", comp.getName(), String.join("\n", rendered));
      throw new CombinationalCycleException(rendered);
    }
    order.addAll(holeWrites);
    return order;
  }

  // Assignments that must run before a read of the given port.
  private List<Integer> writersOf(Component comp, int readPort, Map<String, List<Integer>> writes) {
    Optional<String> prim = comp.primitiveOf(readPort);
    if (prim.isEmpty())
      return Collections.emptyList();
    Port port = comp.getPort(readPort);
    String cellName = comp.getCell(port.getParentIndex()).getName();
    if (port.getDirection() == Direction.Input)
      return writes.getOrDefault(cellName + "." + port.getName(), Collections.emptyList());
    Map<String, Set<String>> writeMap = writeMaps.get(prim.get());
    if (writeMap == null)
      throw new IllegalStateException("Internal error: no write map for primitive " + prim.get());
    Set<String> deps = writeMap.get(port.getName());
    if (deps == null)
      throw new IllegalStateException("Internal error: no write map for port " + prim.get() + "." + port.getName());
    List<Integer> writers = new ArrayList<>();
    for (String dep : deps)
      writers.addAll(writes.getOrDefault(cellName + "." + dep, Collections.emptyList()));
    return writers;
  }

  /** Finds a strongly connected component with more than one node (Tarjan). */
  static Optional<List<Integer>> findCycle(List<Set<Integer>> successors) {
    Tarjan tarjan = new Tarjan(successors);
    for (int v = 0; v < successors.size(); ++v) {
      if (tarjan.index[v] < 0)
        tarjan.strongConnect(v);
    }
    return tarjan.components.stream().filter(c -> c.size() > 1).findFirst();
  }

  private static class Tarjan {
    final List<Set<Integer>> successors;
    final int[] index;
    final int[] lowlink;
    final boolean[] onStack;
    final ArrayDeque<Integer> stack = new ArrayDeque<>();
    final List<List<Integer>> components = new ArrayList<>();
    int nextIndex = 0;

    Tarjan(List<Set<Integer>> successors) {
      this.successors = successors;
      int n = successors.size();
      index = new int[n];
      lowlink = new int[n];
      onStack = new boolean[n];
      Arrays.fill(index, -1);
    }

    void strongConnect(int v) {
      index[v] = nextIndex;
      lowlink[v] = nextIndex;
      ++nextIndex;
      stack.push(v);
      onStack[v] = true;
      for (int w : successors.get(v)) {
        if (index[w] < 0) {
          strongConnect(w);
          lowlink[v] = Math.min(lowlink[v], lowlink[w]);
        } else if (onStack[w]) {
          lowlink[v] = Math.min(lowlink[v], index[w]);
        }
      }
      if (lowlink[v] == index[v]) {
        List<Integer> component = new ArrayList<>();
        int w;
        do {
          w = stack.pop();
          onStack[w] = false;
          component.add(w);
        } while (w != v);
        components.add(component);
      }
    }
  }
}
