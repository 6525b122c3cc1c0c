package com.codeheadsystems.guardian.core.exceptions;

/**
 * The sealed secret could not be uploaded. The recipient key cache is left untouched.
 */
public class DeliveryException extends RuntimeException {
  /**
   * Instantiates a new delivery exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DeliveryException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
