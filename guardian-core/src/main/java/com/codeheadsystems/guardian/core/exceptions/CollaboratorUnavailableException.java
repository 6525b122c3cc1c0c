package com.codeheadsystems.guardian.core.exceptions;

/**
 * A discovery or decision-advice collaborator failed. Fatal to the run; thrown after the final cleanup pass.
 */
public class CollaboratorUnavailableException extends RuntimeException {
  /**
   * Instantiates a new collaborator unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CollaboratorUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
