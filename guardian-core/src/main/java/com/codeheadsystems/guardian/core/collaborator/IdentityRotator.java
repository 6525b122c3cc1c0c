package com.codeheadsystems.guardian.core.collaborator;

/**
 * Rotates the egress network identity. Failures are logged by the caller and never abort a run.
 */
public interface IdentityRotator {

  /** Rotator that does nothing. */
  IdentityRotator NONE = () -> { };

  /**
   * Rotates.
   */
  void rotate();
}
