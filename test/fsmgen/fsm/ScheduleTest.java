package fsmgen.fsm;

import fsmgen.TestComponents;
import fsmgen.ir.Assignment;
import fsmgen.ir.Builder;
import fsmgen.ir.Cell;
import fsmgen.ir.Component;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.Printer;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScheduleTest {
  Builder builder;
  Component comp;
  Group a, b;
  int cond;

  @BeforeEach
  void setUp() {
    builder = TestComponents.newBuilder("main");
    comp = builder.getComponent();
    a = TestComponents.writeGroup(builder, "A", 0);
    b = TestComponents.writeGroup(builder, "B", 0);
    cond = TestComponents.condPort(builder, "cond");
  }

  @Test
  void testCalculateRuns() {
    Guard g = Guard.port(cond);
    List<Schedule.Transition> transitions =
        List.of(new Schedule.Transition(0, 1, Guard.TRUE), new Schedule.Transition(2, 3, Guard.TRUE),
                new Schedule.Transition(1, 2, Guard.TRUE), new Schedule.Transition(3, 5, g), new Schedule.Transition(5, 6, Guard.TRUE),
                new Schedule.Transition(6, 7, Guard.TRUE), new Schedule.Transition(7, 8, g));
    Schedule.RunSplit split = Schedule.calculateRuns(transitions);
    Assertions.assertEquals(List.of(new Schedule.Range(0, 3), new Schedule.Range(5, 7)), split.unconditional());
    Assertions.assertEquals(List.of(new Schedule.Transition(3, 5, g), new Schedule.Transition(7, 8, g)), split.conditional());
  }

  @Test
  void testInvalidInputs() {
    Schedule schedule = new Schedule(builder);
    Assertions.assertThrows(IllegalStateException.class, () -> schedule.addTransition(3, 3, Guard.TRUE));
    Assertions.assertThrows(IllegalStateException.class, () -> schedule.addEnables(2, 2, List.of()));
    Assertions.assertThrows(IllegalStateException.class, schedule::lastState);
    // a guarded self loop is fine
    schedule.addTransition(1, 1, Guard.port(cond));
  }

  @Test
  void testValidateDisconnected() {
    Schedule schedule = new Schedule(builder);
    schedule.addTransition(0, 1, Guard.TRUE);
    schedule.addTransition(2, 3, Guard.TRUE);
    Assertions.assertThrows(IllegalStateException.class, schedule::validate);
    schedule.addTransition(1, 2, Guard.port(cond));
    schedule.validate();
  }

  @Test
  void testConflicts() {
    Cell reg = comp.findCell("A_r").get();
    int in = builder.port(reg, "in");
    Schedule schedule = new Schedule(builder);
    schedule.addTransition(0, 1, Guard.TRUE);
    schedule.addEnables(0, List.of(builder.buildAssignment(in, builder.constantOut(1, 32), Guard.TRUE)));
    // guarded drivers are multiplexed, identical drivers are harmless
    schedule.addEnables(0, List.of(builder.buildAssignment(in, builder.constantOut(2, 32), Guard.port(cond))));
    schedule.addEnables(0, 1, List.of(builder.buildAssignment(in, builder.constantOut(1, 32), Guard.TRUE)));
    schedule.checkConflicts();
    schedule.addEnables(0, 1, List.of(builder.buildAssignment(in, builder.constantOut(3, 32), Guard.TRUE)));
    Assertions.assertThrows(IllegalStateException.class, schedule::checkConflicts);
  }

  @Test
  void testGetEnablesByState() {
    Schedule schedule = new Schedule(builder);
    Assignment goA = builder.assignHigh(a.getGo(), Guard.TRUE);
    Assignment goB = builder.assignHigh(b.getGo(), Guard.TRUE);
    schedule.addEnables(1, 4, List.of(goA));
    schedule.addEnables(3, List.of(goB));
    Assertions.assertEquals(List.of(), schedule.getEnables(0));
    Assertions.assertEquals(List.of(goA), schedule.getEnables(1));
    Assertions.assertEquals(List.of(goA, goB), schedule.getEnables(3));
    Assertions.assertEquals(List.of(), schedule.getEnables(4));
  }

  private Schedule seqSchedule() {
    Schedule schedule = new Schedule(builder);
    schedule.addEnables(0, List.of(builder.assignHigh(a.getGo(), Guard.port(a.getDone()).not())));
    schedule.addEnables(1, List.of(builder.assignHigh(b.getGo(), Guard.port(b.getDone()).not())));
    schedule.addTransition(0, 1, Guard.port(a.getDone()));
    schedule.addTransition(1, 2, Guard.port(b.getDone()));
    return schedule;
  }

  @Test
  void testRealize() {
    Schedule schedule = seqSchedule();
    Assertions.assertEquals(2, schedule.lastState());
    Group group = schedule.realizeSchedule("tdcc", false);
    Assertions.assertEquals("tdcc", group.getName());

    Cell fsm = comp.findCell("fsm").get();
    Assertions.assertEquals(2, Builder.width(fsm));
    int fsmOut = builder.out(fsm);
    Guard done = Guard.eq(fsmOut, builder.constantOut(2, 2));
    Assertions.assertTrue(group.assignments.contains(builder.buildAssignment(group.getDone(), builder.constantOut(1, 1), done)));
    Assertions.assertTrue(group.assignments.contains(
        builder.assignHigh(a.getGo(), Guard.port(a.getDone()).not().and(Guard.eq(fsmOut, builder.constantOut(0, 2))))));
    Guard fromOne = Guard.eq(fsmOut, builder.constantOut(1, 2)).and(Guard.port(b.getDone()));
    Assertions.assertTrue(group.assignments.contains(builder.buildAssignment(builder.port(fsm, "in"), builder.constantOut(2, 2), fromOne)));
    // fsm is reset when the group is done
    Assertions.assertEquals(builder.registerWrite(fsm, builder.constantOut(0, 2), done), comp.continuousAssignments);
    // no unconditional transitions, no adder
    Assertions.assertTrue(comp.findCell("fsm_incr").isEmpty());
    // the schedule is consumed
    Assertions.assertTrue(schedule.getTransitions().isEmpty());
    Assertions.assertTrue(schedule.getEnables().isEmpty());
  }

  @Test
  void testRealizeWithRunsAndOutEdges() {
    Schedule schedule = new Schedule(builder);
    schedule.addEnables(0, 3, List.of(builder.assignHigh(a.getGo(), Guard.TRUE)));
    schedule.addTransition(0, 1, Guard.TRUE);
    schedule.addTransition(1, 2, Guard.TRUE);
    schedule.addTransition(2, 3, Guard.TRUE);
    Cell idx = builder.addPrimitive("idx", "std_reg", 3);
    Group group = schedule.realizeSchedule("tdst", Optional.of(List.of(new PredEdge(2, Guard.port(cond)))), List.of(idx), false);

    Cell fsm = comp.findCell("fsm").get();
    int fsmOut = builder.out(fsm);
    Cell incr = comp.findCell("fsm_incr").get();
    Guard run = Guard.lt(fsmOut, builder.constantOut(3, 2));
    Assertions.assertTrue(group.assignments.contains(builder.buildAssignment(builder.port(fsm, "in"), builder.out(incr), run)));
    Assertions.assertTrue(group.assignments.contains(builder.assignHigh(a.getGo(), run)));
    Guard done = Guard.eq(fsmOut, builder.constantOut(2, 2)).and(Guard.port(cond));
    Assertions.assertTrue(group.assignments.contains(builder.buildAssignment(group.getDone(), builder.constantOut(1, 1), done)));
    Assertions.assertTrue(comp.continuousAssignments.containsAll(builder.registerWrite(idx, builder.constantOut(0, 3), done)));
    Assertions.assertEquals(4, comp.continuousAssignments.size());
  }

  @Test
  void testDisplay() {
    Schedule schedule = seqSchedule();
    String text = schedule.display("main:seq");
    Assertions.assertTrue(text.startsWith("======== main:seq =========\n"));
    Assertions.assertTrue(text.contains("2:\n  <end>\n"));
    Assertions.assertTrue(text.contains("  (0, 1): A[done]\n"));
    Assertions.assertTrue(text.contains("  " + Printer.assignmentToString(comp, builder.assignHigh(b.getGo(), Guard.port(b.getDone()).not()))));
  }
}
