package com.codeheadsystems.guardian.common;

/**
 * A holder of sensitive bytes whose backing storage can be scrubbed in place.
 * <p>
 * Implementations overwrite their storage rather than dropping the reference, and keep the
 * original length so a scrubbed holder reveals nothing new about the secret.
 */
public interface Wipeable {

  /**
   * Randomizes and then zero-fills the backing storage. Calling it again is a no-op.
   *
   * @param randomProvider source for the randomize pass, may be null to skip it
   */
  void wipe(RandomProvider randomProvider);

  /**
   * Whether {@link #wipe(RandomProvider)} has run.
   *
   * @return the boolean
   */
  boolean isWiped();

  /**
   * Length in bytes of the backing storage.
   *
   * @return the int
   */
  int length();
}
