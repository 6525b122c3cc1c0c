package com.codeheadsystems.guardian.common;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Mutable byte buffer for a single sensitive value.
 * <p>
 * The buffer is the only representation of the secret: callers hand over the array at
 * construction and must not keep their own reference. {@link #view()} exposes the backing array
 * for serialization without copying; anything read through it must not outlive the call site.
 * After {@link #wipe(RandomProvider)} the array is a zero-filled buffer of the original length.
 */
public final class SecretBytes implements Wipeable {

  private final byte[] buffer;
  private volatile boolean wiped;

  private SecretBytes(final byte[] buffer) {
    this.buffer = buffer;
  }

  /**
   * Takes ownership of the given array. No copy is made.
   *
   * @param buffer the buffer
   * @return the secret bytes
   */
  public static SecretBytes wrap(final byte[] buffer) {
    if (buffer == null) {
      throw new IllegalArgumentException("buffer must not be null");
    }
    return new SecretBytes(buffer);
  }

  /**
   * Encodes the characters as UTF-8 and zero-fills the intermediate encoder buffer.
   * The caller should clear the char array afterwards.
   *
   * @param chars the chars
   * @return the secret bytes
   */
  public static SecretBytes fromChars(final char[] chars) {
    ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(chars));
    byte[] out = new byte[encoded.remaining()];
    encoded.get(out);
    if (encoded.hasArray()) {
      Arrays.fill(encoded.array(), (byte) 0);
    }
    return new SecretBytes(out);
  }

  /**
   * Encodes a string as UTF-8. Used only at boundaries that already deliver strings (browser
   * drivers, environment variables); the source string itself cannot be scrubbed.
   *
   * @param value the value
   * @return the secret bytes
   */
  public static SecretBytes fromString(final String value) {
    return new SecretBytes(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * The backing array, not a copy.
   *
   * @return the byte [ ]
   */
  public byte[] view() {
    return buffer;
  }

  @Override
  public int length() {
    return buffer.length;
  }

  @Override
  public boolean isWiped() {
    return wiped;
  }

  @Override
  public synchronized void wipe(final RandomProvider randomProvider) {
    if (wiped) {
      return;
    }
    Bytes.wipe(buffer, randomProvider);
    wiped = true;
  }

  @Override
  public String toString() {
    return "SecretBytes[length=" + buffer.length + (wiped ? ", wiped" : "") + "]";
  }
}
