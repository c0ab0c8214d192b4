package fsmgen.guard;

/**
 * Index of an entry in a {@link GuardPool}. Index 0 is always the canonical true guard.
 */
public record GuardRef(int index) {
  public static final GuardRef TRUE = new GuardRef(0);

  public boolean isTrue() { return index == 0; }

  @Override
  public String toString() {
    return "_guard" + index;
  }
}
