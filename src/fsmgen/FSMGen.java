package fsmgen;

import fsmgen.analysis.ControlId;
import fsmgen.analysis.DataflowOrder;
import fsmgen.analysis.Predecessor;
import fsmgen.backend.NetlistDump;
import fsmgen.frontend.ComponentReader;
import fsmgen.ir.CompilationException;
import fsmgen.ir.Component;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.Library;
import fsmgen.ir.MalformedControlException;
import fsmgen.ir.Printer;
import fsmgen.passes.TopDownCompileControl;
import fsmgen.passes.tdst.TopDownStaticTiming;
import fsmgen.ui.FSMGenConfig;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the FSM generation stages on a component: static lowering, dynamic lowering of what remains, and optional
 * dataflow ordering of the resulting assignments.
 */
public class FSMGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final FSMGenConfig cfg;
  private final Library library;

  public FSMGen(FSMGenConfig cfg) { this(cfg, Library.standard()); }

  public FSMGen(FSMGenConfig cfg, Library library) {
    this.cfg = cfg;
    this.library = library;
  }

  public Library getLibrary() { return library; }

  /**
   * Lowers the control program of {@code comp} into a single group enable.
   * @throws MalformedControlException if the program contains constructs that cannot be lowered
   * @throws fsmgen.ir.CombinationalCycleException if dataflow ordering finds a cycle
   */
  public void lower(Component comp) throws CompilationException {
    logger.debug("Lowering {} with {}", comp.getName(), cfg);
    new TopDownStaticTiming(cfg.dump_fsm, cfg.force, cfg.denest_loops).apply(comp, library);
    new TopDownCompileControl(cfg.dump_fsm, cfg.early_transitions).apply(comp, library);
    if (cfg.order_dataflow) {
      DataflowOrder order = new DataflowOrder(library.getPrimitives());
      for (Group group : comp.getGroups())
        group.assignments = order.dataflowSort(comp, group.assignments);
      comp.continuousAssignments = order.dataflowSort(comp, comp.continuousAssignments);
    }
    logger.trace("Lowered {}:\n{}", comp.getName(), Printer.controlToString(comp, comp.getControl()));
  }

  /**
   * Numbers the enables of a dynamic control program and computes the predecessors of each.
   * @throws MalformedControlException if the program contains par or repeat statements
   */
  public Predecessor predecessors(Component comp) throws MalformedControlException {
    ControlId.computeUniqueIds(comp.getControl(), 0);
    Predecessor preds = Predecessor.construct(comp, comp.getControl());
    if (logger.isDebugEnabled()) {
      for (Map.Entry<Long, Map<Long, Guard>> node : preds.predMap().entrySet()) {
        StringBuilder line = new StringBuilder();
        for (Map.Entry<Long, Guard> pred : node.getValue().entrySet())
          line.append(" ").append(pred.getKey()).append(" (").append(Printer.guardToString(comp, pred.getValue())).append(")");
        logger.debug("Predecessors of {}:{}", node.getKey(), line);
      }
    }
    return preds;
  }

  /**
   * Reads a component description, lowers it and writes the netlist into {@code outDir}.
   * @return the path of the written netlist
   */
  public Path generate(File input, Path outDir) throws CompilationException, IOException {
    Component comp = new ComponentReader(library).read(input);
    lower(comp);
    return new NetlistDump(comp).write(outDir);
  }
}
