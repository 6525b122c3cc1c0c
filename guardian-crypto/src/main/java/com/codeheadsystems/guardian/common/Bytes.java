package com.codeheadsystems.guardian.common;

import java.util.Arrays;

/**
 * Utility methods for byte arrays holding key material or secrets.
 */
public class Bytes {

  private Bytes() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Returns {@code length} bytes of {@code source} starting at {@code offset}.
   *
   * @param source the source
   * @param offset the offset
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] source, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > source.length) {
      throw new IllegalArgumentException(
          "Slice [" + offset + ", " + (offset + length) + ") out of bounds for length " + source.length);
    }
    return Arrays.copyOfRange(source, offset, offset + length);
  }

  /**
   * Overwrites the buffer with random bytes (when a provider is given) and then with zeroes.
   * The array keeps its length. Null is ignored.
   *
   * @param buffer         the buffer to scrub
   * @param randomProvider source for the randomize pass, may be null to skip it
   */
  public static void wipe(byte[] buffer, RandomProvider randomProvider) {
    if (buffer == null) {
      return;
    }
    if (randomProvider != null) {
      randomProvider.fill(buffer);
    }
    Arrays.fill(buffer, (byte) 0);
  }

  /**
   * Zero-fills the buffer. Null is ignored.
   *
   * @param buffer the buffer
   */
  public static void zero(byte[] buffer) {
    wipe(buffer, null);
  }

  /**
   * True when every byte of the buffer is zero.
   *
   * @param buffer the buffer
   * @return the boolean
   */
  public static boolean isZero(byte[] buffer) {
    int acc = 0;
    for (byte b : buffer) {
      acc |= b;
    }
    return acc == 0;
  }
}
