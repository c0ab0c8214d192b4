package fsmgen.analysis;

import fsmgen.TestComponents;
import fsmgen.ir.Assignment;
import fsmgen.ir.Attr;
import fsmgen.ir.Builder;
import fsmgen.ir.Cell;
import fsmgen.ir.CombinationalCycleException;
import fsmgen.ir.Direction;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.Library;
import fsmgen.ir.Primitive;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DataflowOrderTest {
  Builder builder;
  DataflowOrder order;
  Cell add, reg, wire;

  @BeforeEach
  void setUp() {
    builder = TestComponents.newBuilder("main");
    order = new DataflowOrder(Library.standard().getPrimitives());
    add = builder.addPrimitive("add", "std_add", 8);
    reg = builder.addPrimitive("r", "std_reg", 8);
    wire = builder.addPrimitive("w", "std_wire", 8);
  }

  @Test
  void testWriteMaps() {
    Map<String, Set<String>> regMap = order.getWriteMap("std_reg").get();
    Assertions.assertEquals(Set.of(), regMap.get("out"));
    Assertions.assertEquals(Set.of(), regMap.get("done"));
    Assertions.assertEquals(Set.of("left", "right"), order.getWriteMap("std_add").get().get("out"));
    Assertions.assertTrue(order.getWriteMap("no_such_prim").isEmpty());
  }

  @Test
  void testReadTogether() {
    Primitive prim = new Primitive("split", List.of());
    prim.addPort("in_a", Direction.Input, 1).with(Attr.ReadTogether, 1);
    prim.addPort("out_a", Direction.Output, 1).with(Attr.ReadTogether, 1);
    prim.addPort("in_b", Direction.Input, 1);
    prim.addPort("out_b", Direction.Output, 1);
    Map<String, Set<String>> writeMap = DataflowOrder.primToWriteMap(prim);
    Assertions.assertEquals(Set.of("in_a"), writeMap.get("out_a"));
    Assertions.assertEquals(Set.of("in_b"), writeMap.get("out_b"));

    Primitive bad = new Primitive("bad", List.of());
    bad.addPort("in", Direction.Input, 1).with(Attr.ReadTogether, 1);
    bad.addPort("x", Direction.Output, 1).with(Attr.ReadTogether, 1);
    bad.addPort("y", Direction.Output, 1).with(Attr.ReadTogether, 1);
    Assertions.assertThrows(IllegalArgumentException.class, () -> DataflowOrder.primToWriteMap(bad));
  }

  @Test
  void testSort() throws CombinationalCycleException {
    Group group = builder.getComponent().addGroup("g", false);
    Assignment regIn = builder.buildAssignment(builder.port(reg, "in"), builder.out(add), Guard.TRUE);
    Assignment addLeft = builder.buildAssignment(builder.port(add, "left"), builder.out(wire), Guard.TRUE);
    Assignment wireIn = builder.buildAssignment(builder.port(wire, "in"), builder.constantOut(3, 8), Guard.TRUE);
    Assignment addRight = builder.buildAssignment(builder.port(add, "right"), builder.constantOut(1, 8), Guard.TRUE);
    Assignment done = builder.buildAssignment(group.getDone(), builder.port(reg, "done"), Guard.TRUE);

    List<Assignment> sorted = order.dataflowSort(builder.getComponent(), List.of(done, regIn, addLeft, wireIn, addRight));
    Assertions.assertEquals(List.of(wireIn, addLeft, addRight, regIn, done), sorted);
  }

  @Test
  void testGuardReadsAreDependencies() throws CombinationalCycleException {
    Cell eq = builder.addPrimitive("eq", "std_eq", 8);
    Assignment regEn = builder.buildAssignment(builder.port(reg, "write_en"), builder.constantOut(1, 1), Guard.port(builder.out(eq)));
    Assignment eqLeft = builder.buildAssignment(builder.port(eq, "left"), builder.out(reg), Guard.TRUE);
    List<Assignment> sorted = order.dataflowSort(builder.getComponent(), List.of(regEn, eqLeft));
    Assertions.assertEquals(List.of(eqLeft, regEn), sorted);
  }

  @Test
  void testStableOutputBreaksLoop() throws CombinationalCycleException {
    // r.in = r.out is not combinational: the register output only changes on the clock edge
    Assignment loop = builder.buildAssignment(builder.port(reg, "in"), builder.out(reg), Guard.TRUE);
    Assertions.assertEquals(List.of(loop), order.dataflowSort(builder.getComponent(), List.of(loop)));
  }

  @Test
  void testCycle() {
    Assignment wireIn = builder.buildAssignment(builder.port(wire, "in"), builder.out(add), Guard.TRUE);
    Assignment addLeft = builder.buildAssignment(builder.port(add, "left"), builder.out(wire), Guard.TRUE);
    Assignment addRight = builder.buildAssignment(builder.port(add, "right"), builder.constantOut(1, 8), Guard.TRUE);
    CombinationalCycleException e = Assertions.assertThrows(
        CombinationalCycleException.class, () -> order.dataflowSort(builder.getComponent(), List.of(addRight, wireIn, addLeft)));
    Assertions.assertEquals(List.of("w.in = add.out;", "add.left = w.out;"), e.getCycle());
    Assertions.assertTrue(e.getMessage().startsWith("Found combinational cycle:\n"));
  }

  @Test
  void testSelfDependency() {
    Assignment self = builder.buildAssignment(builder.port(add, "left"), builder.out(add), Guard.TRUE);
    Assertions.assertThrows(IllegalStateException.class, () -> order.dataflowSort(builder.getComponent(), List.of(self)));
  }
}
