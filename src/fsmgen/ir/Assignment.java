package fsmgen.ir;

import java.util.Objects;

/** A guarded assignment {@code dst = guard ? src}, with both ports given as arena indices. */
public class Assignment {
  private final int dst;
  private final int src;
  private final Guard guard;

  public Assignment(int dst, int src, Guard guard) {
    this.dst = dst;
    this.src = src;
    this.guard = guard;
  }

  public int getDst() { return dst; }
  public int getSrc() { return src; }
  public Guard getGuard() { return guard; }

  /** Returns a copy of this assignment whose guard additionally requires {@code extra}. */
  public Assignment andGuard(Guard extra) { return new Assignment(dst, src, guard.and(extra)); }

  @Override
  public int hashCode() {
    return Objects.hash(dst, src, guard);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Assignment other = (Assignment)obj;
    return dst == other.dst && src == other.src && Objects.equals(guard, other.guard);
  }

  @Override
  public String toString() {
    return "Assignment(" + dst + " = " + guard + " ? " + src + ")";
  }
}
