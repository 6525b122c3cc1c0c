package com.codeheadsystems.guardian.client.exceptions;

/**
 * A GitHub REST call failed: transport error, interruption or an error status.
 */
public class GitHubAccessorException extends RuntimeException {
  /**
   * Instantiates a new GitHub accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GitHubAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
