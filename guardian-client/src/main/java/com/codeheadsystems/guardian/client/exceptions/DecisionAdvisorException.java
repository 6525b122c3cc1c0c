package com.codeheadsystems.guardian.client.exceptions;

/**
 * The decision advisor could not produce a decision.
 */
public class DecisionAdvisorException extends RuntimeException {
  /**
   * Instantiates a new decision advisor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DecisionAdvisorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
