package com.codeheadsystems.guardian.core.model;

/**
 * Terminal outcome of processing one target, with the status string written to audit records.
 */
public enum TargetOutcome {
  DELIVERED("delivered"),
  SKIPPED_DECISION("skipped-decision"),
  SKIPPED_TWO_FACTOR("skipped-2fa"),
  EXTRACTION_FAILED("failed"),
  DELIVERY_FAILED("delivery-failed");

  private final String status;

  TargetOutcome(String status) {
    this.status = status;
  }

  public String status() {
    return status;
  }
}
