package com.codeheadsystems.guardian.client.exceptions;

/**
 * Network identity rotation did not complete.
 */
public class IdentityRotationException extends RuntimeException {
  /**
   * Instantiates a new identity rotation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public IdentityRotationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
