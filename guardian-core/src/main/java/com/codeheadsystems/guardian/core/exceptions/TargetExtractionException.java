package com.codeheadsystems.guardian.core.exceptions;

/**
 * Extraction for a single target failed. Target-scoped: recorded and the run moves on.
 */
public class TargetExtractionException extends RuntimeException {
  /**
   * Instantiates a new target extraction exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TargetExtractionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
