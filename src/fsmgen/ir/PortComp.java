package fsmgen.ir;

/** Binary comparison operators that may appear in guards. */
public enum PortComp {
  Eq("=="),
  Neq("!="),
  Lt("<"),
  Leq("<="),
  Gt(">"),
  Geq(">=");

  private final String op;
  private PortComp(String op) { this.op = op; }

  public String getOp() { return op; }

  /** The comparison that holds exactly when this one does not. */
  public PortComp negate() {
    switch (this) {
    case Eq:
      return Neq;
    case Neq:
      return Eq;
    case Lt:
      return Geq;
    case Leq:
      return Gt;
    case Gt:
      return Leq;
    case Geq:
      return Lt;
    default:
      throw new IllegalStateException();
    }
  }
}
