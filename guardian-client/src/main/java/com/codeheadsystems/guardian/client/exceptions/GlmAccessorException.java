package com.codeheadsystems.guardian.client.exceptions;

/**
 * A chat-completions call failed: transport error, interruption or an error status.
 */
public class GlmAccessorException extends RuntimeException {
  /**
   * Instantiates a new GLM accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GlmAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
