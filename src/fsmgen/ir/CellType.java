package fsmgen.ir;

/** Prototype category of a {@link Cell}. */
public enum CellType {
  /** Instance of a library primitive, e.g. {@code std_reg}. */
  Primitive,
  /** Constant driver with a single {@code out} port. */
  Constant,
  /** Instance of another user component. */
  Component
}
