package com.codeheadsystems.guardian.core.model;

/**
 * One audit event. {@code message} must never carry a sensitive value; the orchestrator passes
 * every message through the redactor before building a record.
 *
 * @param eventType  the event type
 * @param targetName the target identifier, may be null
 * @param platform   the platform, may be null
 * @param status     the status
 * @param message    optional redacted message
 */
public record AuditRecord(String eventType,
                          String targetName,
                          String platform,
                          String status,
                          String message) {

  public static final String STATE_TRANSITION = "state_transition";
  public static final String TARGET_PROCESSED = "target_processed";
  public static final String RUN_COMPLETE = "run_complete";
  public static final String RUN_FAILED = "run_failed";

  public static AuditRecord stateTransition(RunState state) {
    return new AuditRecord(STATE_TRANSITION, null, null, state.name(), null);
  }
}
