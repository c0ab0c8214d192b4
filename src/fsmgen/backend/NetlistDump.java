package fsmgen.backend;

import fsmgen.guard.FlatGuard;
import fsmgen.guard.GuardPool;
import fsmgen.guard.GuardRef;
import fsmgen.ir.Assignment;
import fsmgen.ir.Component;
import fsmgen.ir.Group;
import fsmgen.ir.Printer;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Netlist of a lowered component with all guards flattened into one shared {@link GuardPool}.
 * Assignments refer to pool entries by index, so equal guards across groups are listed once.
 */
public class NetlistDump {
  protected static final Logger logger = LogManager.getLogger();

  private final Component comp;
  private final GuardPool pool;
  private final LinkedHashMap<String, List<Map<String, Object>>> groups = new LinkedHashMap<>();
  private final List<Map<String, Object>> continuous = new ArrayList<>();

  public NetlistDump(Component comp) {
    this.comp = comp;
    this.pool = new GuardPool(comp);
    for (Group group : comp.getGroups()) {
      List<Map<String, Object>> assigns = new ArrayList<>();
      for (Assignment assign : group.assignments)
        assigns.add(flatten(assign));
      groups.put(group.getName(), assigns);
    }
    for (Assignment assign : comp.continuousAssignments)
      continuous.add(flatten(assign));
  }

  public GuardPool getPool() { return pool; }

  private Map<String, Object> flatten(Assignment assign) {
    LinkedHashMap<String, Object> entry = new LinkedHashMap<>();
    entry.put("dst", comp.portName(assign.getDst()));
    entry.put("src", comp.portName(assign.getSrc()));
    entry.put("guard", pool.flatten(assign.getGuard()).index());
    return entry;
  }

  /** Renders one pool entry, with children written as references. */
  public String render(FlatGuard guard) {
    switch (guard.kind()) {
    case True:
      return "true";
    case Port:
      return comp.portName(guard.a());
    case CompOp:
      return comp.portName(guard.a()) + " " + guard.op().getOp() + " " + comp.portName(guard.b());
    case And:
      return guard.left() + " & " + guard.right();
    case Or:
      return guard.left() + " | " + guard.right();
    case Not:
      return "!" + guard.left();
    default:
      throw new IllegalStateException("Internal error: unknown guard kind " + guard.kind());
    }
  }

  /** The netlist as nested maps and lists, in the layout written by {@link #write}. */
  public Map<String, Object> toMap() {
    LinkedHashMap<String, Object> guards = new LinkedHashMap<>();
    for (int i = 0; i < pool.size(); ++i)
      guards.put(new GuardRef(i).toString(), render(pool.get(new GuardRef(i))));
    LinkedHashMap<String, Object> netlist = new LinkedHashMap<>();
    netlist.put("component", comp.getName());
    netlist.put("guards", guards);
    netlist.put("groups", groups);
    netlist.put("continuous", continuous);
    netlist.put("control", Printer.controlToString(comp, comp.getControl()));
    return netlist;
  }

  public String dump() { return newYaml().dump(toMap()); }

  /**
   * Writes {@code <component>_fsm.yaml} into {@code outDir}, creating the directory if needed.
   * @return the path of the written file
   */
  public Path write(Path outDir) throws IOException {
    Files.createDirectories(outDir);
    Path netlistPath = outDir.resolve(comp.getName() + "_fsm.yaml");
    try (Writer netlistWriter = Files.newBufferedWriter(netlistPath, StandardCharsets.UTF_8)) {
      newYaml().dump(toMap(), netlistWriter);
    }
    logger.info("Wrote netlist of {} with {} shared guards to {}", comp.getName(), pool.size(), netlistPath);
    return netlistPath;
  }

  private static Yaml newYaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    return new Yaml(options);
  }
}
