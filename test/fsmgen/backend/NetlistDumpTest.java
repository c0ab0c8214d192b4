package fsmgen.backend;

import fsmgen.TestComponents;
import fsmgen.guard.FlatGuard;
import fsmgen.guard.GuardRef;
import fsmgen.ir.Builder;
import fsmgen.ir.Component;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.Printer;
import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

class NetlistDumpTest {
  Builder builder;
  Component comp;
  Group a;
  int c1, c2;
  Guard shared;

  @BeforeEach
  void setUp() {
    builder = TestComponents.newBuilder("main");
    comp = builder.getComponent();
    a = TestComponents.writeGroup(builder, "A", 0);
    c1 = TestComponents.condPort(builder, "c1");
    c2 = TestComponents.condPort(builder, "c2");
    shared = Guard.port(c1).and(Guard.port(c2)).not();
    a.assignments.add(builder.buildAssignment(comp.portIndex("c1", "in"), builder.constantOut(0, 1), shared));
    comp.continuousAssignments.add(builder.buildAssignment(comp.portIndex("c2", "in"), builder.constantOut(0, 1), shared));
    comp.continuousAssignments.add(builder.buildAssignment(comp.portIndex("c2", "write_en"), c1, Guard.lt(c1, c2)));
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> entries(Map<String, Object> netlist, String group) {
    return ((Map<String, List<Map<String, Object>>>)netlist.get("groups")).get(group);
  }

  @Test
  void testSharedGuards() {
    NetlistDump dump = new NetlistDump(comp);
    // true, c1.out, c2.out, and, not, lt
    Assertions.assertEquals(6, dump.getPool().size());

    Map<String, Object> netlist = dump.toMap();
    List<Map<String, Object>> groupA = entries(netlist, "A");
    Assertions.assertEquals(4, groupA.size());
    Assertions.assertEquals(Map.of("dst", "A_r.in", "src", "32'd1", "guard", 0), groupA.get(0));
    Assertions.assertEquals(4, groupA.get(3).get("guard"));

    @SuppressWarnings("unchecked")
    List<Map<String, Object>> continuous = (List<Map<String, Object>>)netlist.get("continuous");
    Assertions.assertEquals(2, continuous.size());
    Assertions.assertEquals(4, continuous.get(0).get("guard"));
    Assertions.assertEquals(5, continuous.get(1).get("guard"));
  }

  @Test
  void testRender() {
    NetlistDump dump = new NetlistDump(comp);
    Assertions.assertEquals("true", dump.render(FlatGuard.TRUE));
    Assertions.assertEquals("c1.out", dump.render(dump.getPool().get(new GuardRef(1))));
    Assertions.assertEquals("_guard1 & _guard2", dump.render(dump.getPool().get(new GuardRef(3))));
    Assertions.assertEquals("!_guard3", dump.render(dump.getPool().get(new GuardRef(4))));
    Assertions.assertEquals("c1.out < c2.out", dump.render(dump.getPool().get(new GuardRef(5))));
    Assertions.assertEquals("_guard1 | _guard2",
                            dump.render(FlatGuard.or(new GuardRef(1), new GuardRef(2))));
  }

  @Test
  void testConstantOneGuardIsTrue() {
    a.assignments.add(builder.buildAssignment(comp.portIndex("c1", "write_en"), c2, Guard.port(builder.constantOut(1, 1))));
    NetlistDump dump = new NetlistDump(comp);
    Assertions.assertEquals(0, entries(dump.toMap(), "A").get(4).get("guard"));
    Assertions.assertEquals(6, dump.getPool().size());
  }

  @Test
  void testLayout() {
    Map<String, Object> netlist = new NetlistDump(comp).toMap();
    Assertions.assertEquals(List.of("component", "guards", "groups", "continuous", "control"), List.copyOf(netlist.keySet()));
    Assertions.assertEquals("main", netlist.get("component"));
    Assertions.assertEquals(Printer.controlToString(comp, comp.getControl()), netlist.get("control"));
    @SuppressWarnings("unchecked")
    Map<String, Object> guards = (Map<String, Object>)netlist.get("guards");
    Assertions.assertEquals(List.of("_guard0", "_guard1", "_guard2", "_guard3", "_guard4", "_guard5"),
                            List.copyOf(guards.keySet()));
  }

  @Test
  void testWrite(@TempDir Path tmp) throws Exception {
    NetlistDump dump = new NetlistDump(comp);
    Path out = dump.write(tmp.resolve("results"));
    Assertions.assertEquals(tmp.resolve("results").resolve("main_fsm.yaml"), out);
    Assertions.assertTrue(Files.exists(out));

    Object written;
    try (InputStream in = new FileInputStream(out.toFile())) {
      written = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
    }
    Assertions.assertEquals(new Yaml(new SafeConstructor(new LoaderOptions())).load(dump.dump()), written);
    @SuppressWarnings("unchecked")
    Map<String, Object> guards = (Map<String, Object>)((Map<String, Object>)written).get("guards");
    Assertions.assertEquals("true", guards.get("_guard0"));
    Assertions.assertEquals("!_guard3", guards.get("_guard4"));
  }

  @Test
  void testWriteUtf8(@TempDir Path tmp) throws Exception {
    TestComponents.writeGroup(builder, "grün", 0);
    Path out = new NetlistDump(comp).write(tmp);
    String text = Files.readString(out, StandardCharsets.UTF_8);
    Assertions.assertTrue(text.contains("grün:"), text);
  }
}
