package com.codeheadsystems.guardian.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for ephemeral sealed-box key pairs and for the randomize pass that precedes zeroing a
 * released secret.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Overwrites the given buffer in place with random bytes.
   *
   * @param buffer the buffer to fill
   */
  public void fill(byte[] buffer) {
    random.nextBytes(buffer);
  }
}
