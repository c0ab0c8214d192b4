package fsmgen;

import fsmgen.analysis.Predecessor;
import fsmgen.frontend.ComponentReader;
import fsmgen.ir.Attr;
import fsmgen.ir.CombinationalCycleException;
import fsmgen.ir.Component;
import fsmgen.ir.Control;
import fsmgen.ir.Group;
import fsmgen.ir.MalformedControlException;
import fsmgen.ui.FSMGenConfig;
import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FSMGenTest {
  FSMGenConfig cfg = new FSMGenConfig();

  private Component read(FSMGen gen, String name) throws MalformedControlException {
    InputStream in = getClass().getResourceAsStream("/components/" + name);
    Assertions.assertNotNull(in, "missing test resource " + name);
    return new ComponentReader(gen.getLibrary()).read(in);
  }

  private static Group enabledGroup(Component comp) {
    Assertions.assertEquals(Control.Kind.Enable, comp.getControl().getKind());
    return comp.getGroup(((Control.Enable)comp.getControl()).getGroup());
  }

  @Test
  void testLowerDynamic() throws Exception {
    FSMGen gen = new FSMGen(cfg);
    Component comp = read(gen, "seq.yaml");
    gen.lower(comp);
    Group top = enabledGroup(comp);
    Assertions.assertEquals("tdcc", top.getName());
    Assertions.assertTrue(top.assignments.stream().anyMatch(assign -> assign.getDst() == top.getDone()));
    // fsm reset: in and write_en
    Assertions.assertEquals(2, comp.continuousAssignments.size());
  }

  @Test
  void testLowerMixed() throws Exception {
    FSMGen gen = new FSMGen(cfg);
    Component comp = read(gen, "loops.yaml");
    gen.lower(comp);
    Assertions.assertEquals("tdcc", enabledGroup(comp).getName());
    Group tdst = comp.findGroup("tdst").orElseThrow();
    Assertions.assertEquals(1, tdst.getAttributes().getRequired(Attr.Static));
    // one fsm reset per generated schedule
    Assertions.assertEquals(4, comp.continuousAssignments.size());
  }

  @Test
  void testLowerStatic() throws Exception {
    cfg.force = true;
    FSMGen gen = new FSMGen(cfg);
    Component comp = read(gen, "static_loop.yaml");
    gen.lower(comp);
    Group top = enabledGroup(comp);
    Assertions.assertEquals("tdst", top.getName());
    Assertions.assertEquals(10, comp.getControl().getLatency().getAsLong());
    Assertions.assertTrue(comp.findGroup("tdcc").isEmpty());
    Assertions.assertTrue(comp.findCell("idx").isPresent());
  }

  @Test
  void testForce() throws Exception {
    cfg.force = true;
    FSMGen gen = new FSMGen(cfg);
    Component comp = read(gen, "loops.yaml");
    MalformedControlException e = Assertions.assertThrows(MalformedControlException.class, () -> gen.lower(comp));
    Assertions.assertTrue(e.getMessage().startsWith("force flag was set"));
  }

  @Test
  void testCombinationalCycle() throws Exception {
    FSMGen gen = new FSMGen(cfg);
    Component comp = read(gen, "cycle.yaml");
    CombinationalCycleException e = Assertions.assertThrows(CombinationalCycleException.class, () -> gen.lower(comp));
    Assertions.assertTrue(e.getCycle().contains("w.in = add.out;"));

    cfg.order_dataflow = false;
    FSMGen unordered = new FSMGen(cfg);
    Component again = read(unordered, "cycle.yaml");
    unordered.lower(again);
    Assertions.assertEquals("tdcc", enabledGroup(again).getName());
  }

  @Test
  void testPredecessors() throws Exception {
    FSMGen gen = new FSMGen(cfg);
    Component comp = read(gen, "seq.yaml");
    Predecessor preds = gen.predecessors(comp);
    Assertions.assertEquals(Map.of(), preds.get(0).get());
    Assertions.assertEquals(Map.of(), preds.get(1).get());
    Assertions.assertEquals(2, preds.predMap().size());
  }

  @Test
  void testGenerate(@TempDir Path tmp) throws Exception {
    File input = new File(getClass().getResource("/components/seq.yaml").toURI());
    Path out = new FSMGen(cfg).generate(input, tmp);
    Assertions.assertEquals(tmp.resolve("seq_main_fsm.yaml"), out);
    String text = Files.readString(out);
    Assertions.assertTrue(text.startsWith("component: seq_main"));
    Assertions.assertTrue(text.contains("tdcc"));
  }
}
