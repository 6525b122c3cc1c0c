package com.codeheadsystems.guardian.core.model;

/**
 * Orchestrator run states. The legal moves are encoded in {@link #canTransitionTo(RunState)};
 * any state may fall back to {@link #IDLE} during the final cleanup pass.
 */
public enum RunState {
  IDLE,
  DISCOVERING,
  EXTRACTING,
  INJECTING,
  CLEANUP,
  COMPLETED;

  /**
   * Whether moving from this state to {@code next} is legal.
   *
   * @param next the next state
   * @return the boolean
   */
  public boolean canTransitionTo(RunState next) {
    if (next == IDLE) {
      return this != IDLE;
    }
    switch (this) {
      case IDLE:
        return next == DISCOVERING;
      case DISCOVERING:
        return next == EXTRACTING || next == COMPLETED;
      case EXTRACTING:
        return next == EXTRACTING || next == INJECTING || next == CLEANUP || next == COMPLETED;
      case INJECTING:
        return next == CLEANUP;
      case CLEANUP:
        return next == EXTRACTING || next == COMPLETED;
      default:
        return false;
    }
  }
}
