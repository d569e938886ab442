package madjustment.util;

import java.util.BitSet;

/** Helpers for decoding candidate masks over an ordered variable list. */
public final class BitsetUtils {
  /** Widest mask a {@code long} counter can enumerate without overflow. */
  public static final int MAX_MASK_WIDTH = 62;

  private BitsetUtils() {}

  /**
   * Decodes {@code mask} as a {@code size}-digit binary string read left to right: index 0 is the
   * most significant digit, index {@code size - 1} the least significant.
   */
  public static BitSet fromMaskMostSignificantFirst(long mask, int size) {
    checkWidth(size);
    BitSet bitSet = new BitSet(size);
    for (int i = 0; i < size; i++) {
      if (((mask >>> (size - 1 - i)) & 1L) != 0) {
        bitSet.set(i);
      }
    }
    return bitSet;
  }

  /** Number of masks over {@code size} digits, i.e. {@code 2^size}. */
  public static long maskCount(int size) {
    checkWidth(size);
    return 1L << size;
  }

  /** Renders the selection as the binary string it was decoded from. */
  public static String signature(BitSet bitSet, int size) {
    StringBuilder builder = new StringBuilder(size);
    for (int i = 0; i < size; i++) {
      builder.append(bitSet.get(i) ? '1' : '0');
    }
    return builder.toString();
  }

  private static void checkWidth(int size) {
    if (size < 0 || size > MAX_MASK_WIDTH) {
      throw new IllegalArgumentException(
          "Mask width must be between 0 and " + MAX_MASK_WIDTH + ", got " + size);
    }
  }
}
