package fsmgen.analysis;

import fsmgen.TestComponents;
import fsmgen.ir.Attributes;
import fsmgen.ir.Builder;
import fsmgen.ir.Component;
import fsmgen.ir.Control;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.MalformedControlException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PredecessorTest {

  @Test
  void testSequenceLeavesHaveNoPredecessors() throws MalformedControlException {
    Builder builder = TestComponents.newBuilder("main");
    Component comp = builder.getComponent();
    int lt = TestComponents.condPort(builder, "lt");
    Group cond0 = TestComponents.writeGroup(builder, "cond0", 0);
    Group tru = TestComponents.writeGroup(builder, "tru", 0);
    Group fal = TestComponents.writeGroup(builder, "fal", 0);
    Group upd = TestComponents.writeGroup(builder, "upd", 0);
    Control prog = Control.seq(List.of(Control.enable(cond0.getIndex()),
                                       Control.ifElse(lt, Optional.empty(), Control.enable(tru.getIndex()), Control.enable(fal.getIndex())),
                                       Control.enable(upd.getIndex())));
    ControlId.computeUniqueIds(prog, 0);
    Predecessor preds = Predecessor.construct(comp, prog);

    // a leaf passes nothing on, so without loops every map stays empty
    for (long id = 0; id < 4; ++id)
      Assertions.assertEquals(Map.of(), preds.get(id).get(), "node " + id);
    Assertions.assertTrue(preds.get(4).isEmpty());
    Assertions.assertEquals(Optional.of(Map.of()), preds.getGuarded(3));
    Assertions.assertEquals(List.of(1L, 2L), Predecessor.controlExits(((Control.Seq)prog).getStmts().get(1)));
  }

  @Test
  void testWhileBackEdges() throws MalformedControlException {
    Builder builder = TestComponents.newBuilder("main");
    Component comp = builder.getComponent();
    int c = TestComponents.condPort(builder, "c");
    Group init = TestComponents.writeGroup(builder, "init", 0);
    Group one = TestComponents.writeGroup(builder, "one", 0);
    Group two = TestComponents.writeGroup(builder, "two", 0);
    Group done = TestComponents.writeGroup(builder, "fin", 0);
    Control prog = Control.seq(List.of(
        Control.enable(init.getIndex()),
        Control.whileLoop(c, Optional.empty(), Control.seq(List.of(Control.enable(one.getIndex()), Control.enable(two.getIndex())))),
        Control.enable(done.getIndex())));
    ControlId.computeUniqueIds(prog, 0);
    Predecessor preds = Predecessor.construct(comp, prog);

    Assertions.assertEquals(Map.of(), preds.get(0).get());
    // one is re-entered from the last body statement while c holds
    Assertions.assertEquals(Map.of(2L, Guard.port(c)), preds.get(1).get());
    Assertions.assertEquals(Map.of(), preds.get(2).get());
    // the loop is left from two once c is low
    Assertions.assertEquals(Map.of(2L, Guard.port(c).not()), preds.get(3).get());
    Assertions.assertEquals(List.of(2L), Predecessor.controlExits(((Control.Seq)prog).getStmts().get(1)));

    Map<Long, Guard> guarded = preds.getGuarded(1).get();
    Assertions.assertEquals(Guard.port(c).and(Guard.port(two.getDone())), guarded.get(2L));
  }

  @Test
  void testIfExitsFeedLoop() throws MalformedControlException {
    Builder builder = TestComponents.newBuilder("main");
    Component comp = builder.getComponent();
    int c = TestComponents.condPort(builder, "c");
    int lt = TestComponents.condPort(builder, "lt");
    Group head = TestComponents.writeGroup(builder, "head", 0);
    Group tru = TestComponents.writeGroup(builder, "tru", 0);
    Group fal = TestComponents.writeGroup(builder, "fal", 0);
    Group fin = TestComponents.writeGroup(builder, "fin", 0);
    Control body = Control.seq(List.of(Control.enable(head.getIndex()),
                                       Control.ifElse(lt, Optional.empty(), Control.enable(tru.getIndex()), Control.enable(fal.getIndex()))));
    Control prog = Control.seq(List.of(Control.whileLoop(c, Optional.empty(), body), Control.enable(fin.getIndex())));
    ControlId.computeUniqueIds(prog, 0);
    Predecessor preds = Predecessor.construct(comp, prog);

    // a leading loop starts numbering at 1
    Assertions.assertEquals(Map.of(2L, Guard.port(c), 3L, Guard.port(c)), preds.get(1).get());
    Assertions.assertEquals(Map.of(), preds.get(2).get());
    Assertions.assertEquals(Map.of(), preds.get(3).get());
    Assertions.assertEquals(Map.of(2L, Guard.port(c).not(), 3L, Guard.port(c).not()), preds.get(4).get());
    Assertions.assertEquals(Guard.port(c).not().and(Guard.port(fal.getDone())), preds.getGuarded(4).get().get(3L));
  }

  @Test
  void testInvokePredecessorHasNoGuardedForm() throws MalformedControlException {
    Builder builder = TestComponents.newBuilder("main");
    Component comp = builder.getComponent();
    int c = TestComponents.condPort(builder, "c");
    int cell = builder.addPrimitive("x", "std_reg", 8).getIndex();
    Group first = TestComponents.writeGroup(builder, "first", 0);
    Control body = Control.seq(List.of(Control.enable(first.getIndex()), new Control.Invoke(cell, Map.of(), Map.of(), new Attributes())));
    Control prog = Control.whileLoop(c, Optional.empty(), body);
    ControlId.computeUniqueIds(prog, 0);
    Predecessor preds = Predecessor.construct(comp, prog);
    Assertions.assertEquals(Map.of(2L, Guard.port(c)), preds.get(1).get());
    Assertions.assertTrue(preds.getGuarded(1).isEmpty());
    Assertions.assertEquals(Optional.of(Map.of()), preds.getGuarded(2));
  }

  @Test
  void testParAndRepeatRejected() {
    Builder builder = TestComponents.newBuilder("main");
    Component comp = builder.getComponent();
    Control a = Control.enable(TestComponents.writeGroup(builder, "A", 0).getIndex());
    Control b = Control.enable(TestComponents.writeGroup(builder, "B", 0).getIndex());
    Control par = Control.par(List.of(a, b));
    ControlId.computeUniqueIds(par, 0);
    Assertions.assertThrows(MalformedControlException.class, () -> Predecessor.construct(comp, par));

    Control rep = Control.repeat(3, Control.enable(TestComponents.writeGroup(builder, "C", 0).getIndex()));
    ControlId.computeUniqueIds(rep, 0);
    Assertions.assertThrows(MalformedControlException.class, () -> Predecessor.construct(comp, rep));
  }

  @Test
  void testMissingNodeId() {
    Builder builder = TestComponents.newBuilder("main");
    Control a = Control.enable(TestComponents.writeGroup(builder, "A", 0).getIndex());
    Assertions.assertThrows(IllegalStateException.class, () -> Predecessor.construct(builder.getComponent(), a));
  }
}
