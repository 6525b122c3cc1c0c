package com.codeheadsystems.guardian.core.exceptions;

/**
 * The recipient public key could not be fetched or was malformed.
 */
public class KeyFetchException extends RuntimeException {
  /**
   * Instantiates a new key fetch exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyFetchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
