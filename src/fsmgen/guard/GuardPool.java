package fsmgen.guard;

import fsmgen.ir.Component;
import fsmgen.ir.Guard;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 * Hash-consing arena of {@link FlatGuard}s. Structurally equal guards share one {@link GuardRef}, and every composite
 * entry only refers to entries created before it, so the pool is a DAG that can be walked by ascending index.
 * <p>
 * The pool only grows. Entry 0 is the canonical true guard, which is also returned for ports that are the output of
 * the constant {@code 1'd1}.
 */
public class GuardPool {
  private final Component comp;
  private final ArrayList<FlatGuard> entries = new ArrayList<>();
  private final HashMap<FlatGuard, GuardRef> lookup = new HashMap<>();

  /** @param comp the component whose port indices the guards refer to */
  public GuardPool(Component comp) {
    this.comp = comp;
    entries.add(FlatGuard.TRUE);
    lookup.put(FlatGuard.TRUE, GuardRef.TRUE);
  }

  /**
   * Inserts a node, or returns the existing reference for a structurally equal one.
   * @throws IllegalStateException if a child reference does not point to an existing entry
   */
  public GuardRef add(FlatGuard guard) {
    if (guard.kind() == FlatGuard.Kind.True)
      return GuardRef.TRUE;
    if (guard.kind() == FlatGuard.Kind.Port && comp.isConstantOne(guard.a()))
      return GuardRef.TRUE;
    if (guard.hasChildren()) {
      checkChild(guard.a());
      if (guard.kind() != FlatGuard.Kind.Not)
        checkChild(guard.b());
    }
    GuardRef existing = lookup.get(guard);
    if (existing != null)
      return existing;
    GuardRef ref = new GuardRef(entries.size());
    entries.add(guard);
    lookup.put(guard, ref);
    return ref;
  }

  private void checkChild(int child) {
    if (child < 0 || child >= entries.size())
      throw new IllegalStateException("Internal error: guard reference _guard" + child + " points past the end of the pool (size " +
                                      entries.size() + ")");
  }

  /**
   * Lowers a tree guard into the pool, children first.
   * @throws IllegalStateException for static interval markers, which never reach flattening in a valid program
   */
  public GuardRef flatten(Guard guard) {
    switch (guard.getKind()) {
    case True:
      return GuardRef.TRUE;
    case Port:
      return add(FlatGuard.port(((Guard.PortGuard)guard).getPort()));
    case CompOp: {
      Guard.CompOpGuard cmp = (Guard.CompOpGuard)guard;
      return add(FlatGuard.comp(cmp.getOp(), cmp.getLeft(), cmp.getRight()));
    }
    case And: {
      Guard.BinaryGuard bin = (Guard.BinaryGuard)guard;
      GuardRef left = flatten(bin.getLeft());
      GuardRef right = flatten(bin.getRight());
      return add(FlatGuard.and(left, right));
    }
    case Or: {
      Guard.BinaryGuard bin = (Guard.BinaryGuard)guard;
      GuardRef left = flatten(bin.getLeft());
      GuardRef right = flatten(bin.getRight());
      return add(FlatGuard.or(left, right));
    }
    case Not:
      return add(FlatGuard.not(flatten(((Guard.NotGuard)guard).getInner())));
    case StaticInterval:
    default:
      throw new IllegalStateException("Internal error: cannot flatten guard " + guard);
    }
  }

  /** Constant-time lookup. */
  public FlatGuard get(GuardRef ref) { return entries.get(ref.index()); }

  public int size() { return entries.size(); }

  /** All entries in insertion order; the list index equals the {@link GuardRef} index. */
  public List<FlatGuard> getEntries() { return Collections.unmodifiableList(entries); }
}
