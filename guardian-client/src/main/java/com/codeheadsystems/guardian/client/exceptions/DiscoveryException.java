package com.codeheadsystems.guardian.client.exceptions;

/**
 * Target discovery could not list candidates.
 */
public class DiscoveryException extends RuntimeException {
  /**
   * Instantiates a new discovery exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DiscoveryException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
