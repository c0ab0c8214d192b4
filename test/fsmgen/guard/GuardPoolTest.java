package fsmgen.guard;

import fsmgen.TestComponents;
import fsmgen.ir.Builder;
import fsmgen.ir.Component;
import fsmgen.ir.Guard;
import fsmgen.ir.PortComp;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class GuardPoolTest {
  Builder builder;
  Component comp;
  int a, b, c;

  @BeforeEach
  void setUp() {
    builder = TestComponents.newBuilder("main");
    comp = builder.getComponent();
    a = TestComponents.condPort(builder, "a");
    b = TestComponents.condPort(builder, "b");
    c = TestComponents.condPort(builder, "c");
  }

  @Test
  void testTrueIsEntryZero() {
    GuardPool pool = new GuardPool(comp);
    Assertions.assertEquals(1, pool.size());
    Assertions.assertEquals(FlatGuard.TRUE, pool.get(GuardRef.TRUE));
    Assertions.assertTrue(pool.flatten(Guard.TRUE).isTrue());
    Assertions.assertTrue(pool.add(FlatGuard.TRUE).isTrue());
  }

  @Test
  void testConstantOneIsTrue() {
    GuardPool pool = new GuardPool(comp);
    GuardRef ref = pool.flatten(Guard.port(builder.constantOut(1, 1)));
    Assertions.assertTrue(ref.isTrue());
    Assertions.assertEquals(1, pool.size());
  }

  @Test
  void testHashConsing() {
    GuardPool pool = new GuardPool(comp);
    Guard g = Guard.port(a).and(Guard.port(b)).or(Guard.port(c).not());
    GuardRef first = pool.flatten(g);
    int size = pool.size();
    GuardRef second = pool.flatten(Guard.port(a).and(Guard.port(b)).or(Guard.port(c).not()));
    Assertions.assertEquals(first, second);
    Assertions.assertEquals(size, pool.size());
    // a, b, a&b, c, !c, (a&b)|!c
    Assertions.assertEquals(7, size);
    Assertions.assertEquals(FlatGuard.Kind.Or, pool.get(first).kind());
  }

  @Test
  void testComparisons() {
    GuardPool pool = new GuardPool(comp);
    GuardRef lt = pool.flatten(Guard.lt(a, b));
    GuardRef ge = pool.flatten(Guard.lt(a, b).not());
    Assertions.assertNotEquals(lt, ge);
    Assertions.assertEquals(PortComp.Geq, pool.get(ge).op());
    Assertions.assertEquals(a, pool.get(ge).a());
    Assertions.assertEquals(b, pool.get(ge).b());
  }

  @Test
  void testForwardReferenceRejected() {
    GuardPool pool = new GuardPool(comp);
    GuardRef pa = pool.flatten(Guard.port(a));
    Assertions.assertThrows(IllegalStateException.class, () -> pool.add(FlatGuard.and(pa, new GuardRef(5))));
    Assertions.assertThrows(IllegalStateException.class, () -> pool.add(FlatGuard.not(new GuardRef(2))));
  }

  @Test
  void testStaticIntervalRejected() {
    GuardPool pool = new GuardPool(comp);
    Assertions.assertThrows(IllegalStateException.class, () -> pool.flatten(Guard.staticInterval(0, 2)));
    Assertions.assertThrows(IllegalStateException.class, () -> pool.flatten(Guard.port(a).and(Guard.staticInterval(1, 3))));
  }

  private Guard randomGuard(Random rand, int depth) {
    int[] ports = {a, b, c};
    if (depth == 0 || rand.nextInt(4) == 0) {
      if (rand.nextBoolean())
        return Guard.port(ports[rand.nextInt(3)]);
      return Guard.comp(PortComp.values()[rand.nextInt(PortComp.values().length)], ports[rand.nextInt(3)], ports[rand.nextInt(3)]);
    }
    switch (rand.nextInt(3)) {
    case 0:
      return randomGuard(rand, depth - 1).and(randomGuard(rand, depth - 1));
    case 1:
      return randomGuard(rand, depth - 1).or(randomGuard(rand, depth - 1));
    default:
      return randomGuard(rand, depth - 1).not();
    }
  }

  @RepeatedTest(64)
  void testChildrenBeforeParents_random() {
    long seed = new Random().nextLong();
    try {
      testChildrenBeforeParents(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testChildrenBeforeParents with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 7000, -3348569012274893235L})
  void testChildrenBeforeParents(long seed) {
    var rand = new Random(seed);
    GuardPool pool = new GuardPool(comp);
    List<GuardRef> refs = new ArrayList<>();
    List<Guard> guards = new ArrayList<>();
    for (int i = 0; i < 20; ++i) {
      Guard g = randomGuard(rand, 4);
      guards.add(g);
      refs.add(pool.flatten(g));
    }
    List<FlatGuard> entries = pool.getEntries();
    for (int i = 0; i < entries.size(); ++i) {
      FlatGuard entry = entries.get(i);
      if (entry.hasChildren()) {
        Assertions.assertTrue(entry.a() < i, "left child after parent at " + i);
        if (entry.kind() != FlatGuard.Kind.Not)
          Assertions.assertTrue(entry.b() < i, "right child after parent at " + i);
      }
    }
    // No two entries are structurally equal.
    Assertions.assertEquals(entries.size(), entries.stream().distinct().count());
    // Flattening again yields the same references without growing the pool.
    int size = pool.size();
    for (int i = 0; i < guards.size(); ++i)
      Assertions.assertEquals(refs.get(i), pool.flatten(guards.get(i)));
    Assertions.assertEquals(size, pool.size());
  }
}
