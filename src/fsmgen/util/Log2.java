package fsmgen.util;

public class Log2 {
  public static int log2(long n) {
    if (n < 0)
      throw new IllegalArgumentException();
    return 63 - Long.numberOfLeadingZeros(n);
  }

  public static int clog2(long n) {
    if (n <= 0)
      throw new IllegalArgumentException();
    return log2(n - 1) + 1;
  }

  /**
   * Number of bits needed to distinguish the given number of states (values 0 .. states-1), at least one.
   * @param states the number of distinct values to encode
   */
  public static int bitWidthFrom(long states) {
    if (states <= 1)
      return 1;
    return clog2(states);
  }
}
