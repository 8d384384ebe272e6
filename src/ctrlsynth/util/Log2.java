package ctrlsynth.util;

public class Log2 {
  public static int log2(int n) {
    if (n < 0)
      throw new IllegalArgumentException();
    return 31 - Integer.numberOfLeadingZeros(n);
  }

  public static int clog2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException();
    return log2(n - 1) + 1;
  }

  /** Register width needed to hold the values 0..numValues-1, at least one bit. */
  public static int stateBits(int numValues) {
    return (numValues <= 2) ? 1 : clog2(numValues);
  }
}
