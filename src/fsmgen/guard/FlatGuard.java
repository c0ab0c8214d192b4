package fsmgen.guard;

import fsmgen.ir.PortComp;

/**
 * One node of a flattened guard. The meaning of {@code a} and {@code b} depends on the kind:
 * <ul>
 * <li>Port: {@code a} is the port index</li>
 * <li>CompOp: {@code a} and {@code b} are the compared port indices</li>
 * <li>And, Or: {@code a} and {@code b} are {@link GuardRef} indices</li>
 * <li>Not: {@code a} is a {@link GuardRef} index</li>
 * </ul>
 * Unused fields are zero so that structurally equal guards are equal records.
 */
public record FlatGuard(Kind kind, PortComp op, int a, int b) {
  public enum Kind { True, Port, CompOp, And, Or, Not }

  public static final FlatGuard TRUE = new FlatGuard(Kind.True, null, 0, 0);

  public static FlatGuard port(int port) { return new FlatGuard(Kind.Port, null, port, 0); }
  public static FlatGuard comp(PortComp op, int left, int right) { return new FlatGuard(Kind.CompOp, op, left, right); }
  public static FlatGuard and(GuardRef left, GuardRef right) { return new FlatGuard(Kind.And, null, left.index(), right.index()); }
  public static FlatGuard or(GuardRef left, GuardRef right) { return new FlatGuard(Kind.Or, null, left.index(), right.index()); }
  public static FlatGuard not(GuardRef inner) { return new FlatGuard(Kind.Not, null, inner.index(), 0); }

  /** True if {@code a} (and {@code b} for binary kinds) are references into the pool. */
  public boolean hasChildren() { return kind == Kind.And || kind == Kind.Or || kind == Kind.Not; }

  public GuardRef left() { return new GuardRef(a); }
  public GuardRef right() { return new GuardRef(b); }
}
