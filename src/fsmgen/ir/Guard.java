package fsmgen.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tree-shaped boolean guard over ports. Ports are referenced by their {@link Component} arena index.
 * <p>
 * Instances are immutable. {@link #and(Guard)}, {@link #or(Guard)} and {@link #not()} apply the trivial simplifications
 * around {@link #TRUE} so that composing with an unconditional guard never grows the tree.
 */
public abstract class Guard {
  public enum Kind { True, Port, CompOp, And, Or, Not, StaticInterval }

  public static final Guard TRUE = new TrueGuard();

  public abstract Kind getKind();

  public boolean isTrue() { return getKind() == Kind.True; }

  public static Guard port(int port) { return new PortGuard(port); }

  public static Guard comp(PortComp op, int left, int right) { return new CompOpGuard(op, left, right); }

  public static Guard eq(int left, int right) { return comp(PortComp.Eq, left, right); }

  public static Guard lt(int left, int right) { return comp(PortComp.Lt, left, right); }

  /** Marker for the inclusive-exclusive cycle range {@code [begin, end)} of a statically timed group. */
  public static Guard staticInterval(long begin, long end) { return new StaticIntervalGuard(begin, end); }

  /** Constant false, expressed as {@code !1'd1}. */
  public static Guard never() { return new NotGuard(TRUE); }

  public Guard and(Guard rhs) {
    if (this.isTrue())
      return rhs;
    if (rhs.isTrue())
      return this;
    return new AndGuard(this, rhs);
  }

  public Guard or(Guard rhs) {
    if (this.isTrue() || rhs.isTrue())
      return TRUE;
    if (isNever(this))
      return rhs;
    if (isNever(rhs))
      return this;
    return new OrGuard(this, rhs);
  }

  public Guard not() {
    switch (getKind()) {
    case Not:
      return ((NotGuard)this).getInner();
    case CompOp:
      CompOpGuard comp = (CompOpGuard)this;
      return new CompOpGuard(comp.getOp().negate(), comp.getLeft(), comp.getRight());
    default:
      return new NotGuard(this);
    }
  }

  private static boolean isNever(Guard guard) { return guard.getKind() == Kind.Not && ((NotGuard)guard).getInner().isTrue(); }

  /** All ports read by this guard, in left-to-right order, possibly with repetitions. */
  public List<Integer> allPorts() {
    List<Integer> ports = new ArrayList<>();
    collectPorts(ports);
    return ports;
  }

  protected abstract void collectPorts(List<Integer> ports);

  public static final class TrueGuard extends Guard {
    private TrueGuard() {}
    @Override
    public Kind getKind() {
      return Kind.True;
    }
    @Override
    protected void collectPorts(List<Integer> ports) {}
    @Override
    public int hashCode() {
      return 1;
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof TrueGuard;
    }
    @Override
    public String toString() {
      return "1'd1";
    }
  }

  public static final class PortGuard extends Guard {
    private final int port;
    private PortGuard(int port) { this.port = port; }
    public int getPort() { return port; }
    @Override
    public Kind getKind() {
      return Kind.Port;
    }
    @Override
    protected void collectPorts(List<Integer> ports) {
      ports.add(port);
    }
    @Override
    public int hashCode() {
      return Objects.hash(Kind.Port, port);
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof PortGuard && ((PortGuard)obj).port == port;
    }
    @Override
    public String toString() {
      return "#" + port;
    }
  }

  public static final class CompOpGuard extends Guard {
    private final PortComp op;
    private final int left;
    private final int right;
    private CompOpGuard(PortComp op, int left, int right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }
    public PortComp getOp() { return op; }
    public int getLeft() { return left; }
    public int getRight() { return right; }
    @Override
    public Kind getKind() {
      return Kind.CompOp;
    }
    @Override
    protected void collectPorts(List<Integer> ports) {
      ports.add(left);
      ports.add(right);
    }
    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof CompOpGuard))
        return false;
      CompOpGuard other = (CompOpGuard)obj;
      return op == other.op && left == other.left && right == other.right;
    }
    @Override
    public String toString() {
      return "#" + left + " " + op.getOp() + " #" + right;
    }
  }

  /** Common base of {@link AndGuard} and {@link OrGuard}. */
  public abstract static class BinaryGuard extends Guard {
    private final Guard left;
    private final Guard right;
    private BinaryGuard(Guard left, Guard right) {
      this.left = left;
      this.right = right;
    }
    public Guard getLeft() { return left; }
    public Guard getRight() { return right; }
    @Override
    protected void collectPorts(List<Integer> ports) {
      left.collectPorts(ports);
      right.collectPorts(ports);
    }
    @Override
    public int hashCode() {
      return Objects.hash(getKind(), left, right);
    }
    @Override
    public boolean equals(Object obj) {
      if (obj == null || obj.getClass() != getClass())
        return false;
      BinaryGuard other = (BinaryGuard)obj;
      return left.equals(other.left) && right.equals(other.right);
    }
  }

  public static final class AndGuard extends BinaryGuard {
    private AndGuard(Guard left, Guard right) { super(left, right); }
    @Override
    public Kind getKind() {
      return Kind.And;
    }
    @Override
    public String toString() {
      return "(" + getLeft() + " & " + getRight() + ")";
    }
  }

  public static final class OrGuard extends BinaryGuard {
    private OrGuard(Guard left, Guard right) { super(left, right); }
    @Override
    public Kind getKind() {
      return Kind.Or;
    }
    @Override
    public String toString() {
      return "(" + getLeft() + " | " + getRight() + ")";
    }
  }

  public static final class NotGuard extends Guard {
    private final Guard inner;
    private NotGuard(Guard inner) { this.inner = inner; }
    public Guard getInner() { return inner; }
    @Override
    public Kind getKind() {
      return Kind.Not;
    }
    @Override
    protected void collectPorts(List<Integer> ports) {
      inner.collectPorts(ports);
    }
    @Override
    public int hashCode() {
      return Objects.hash(Kind.Not, inner);
    }
    @Override
    public boolean equals(Object obj) {
      return obj instanceof NotGuard && ((NotGuard)obj).inner.equals(inner);
    }
    @Override
    public String toString() {
      return "!" + inner;
    }
  }

  public static final class StaticIntervalGuard extends Guard {
    private final long begin;
    private final long end;
    private StaticIntervalGuard(long begin, long end) {
      this.begin = begin;
      this.end = end;
    }
    public long getBegin() { return begin; }
    public long getEnd() { return end; }
    @Override
    public Kind getKind() {
      return Kind.StaticInterval;
    }
    @Override
    protected void collectPorts(List<Integer> ports) {}
    @Override
    public int hashCode() {
      return Objects.hash(Kind.StaticInterval, begin, end);
    }
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof StaticIntervalGuard))
        return false;
      StaticIntervalGuard other = (StaticIntervalGuard)obj;
      return begin == other.begin && end == other.end;
    }
    @Override
    public String toString() {
      return "%[" + begin + ":" + end + "]";
    }
  }
}
