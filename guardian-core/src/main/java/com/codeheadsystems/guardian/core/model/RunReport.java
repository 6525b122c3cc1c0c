package com.codeheadsystems.guardian.core.model;

import java.util.List;

/**
 * Per-target reports of one completed run.
 *
 * @param targets reports in processing order
 */
public record RunReport(List<TargetReport> targets) {

  public RunReport {
    targets = List.copyOf(targets);
  }

  /**
   * Number of targets that ended with the given outcome.
   *
   * @param outcome the outcome
   * @return the long
   */
  public long count(TargetOutcome outcome) {
    return targets.stream().filter(r -> r.outcome() == outcome).count();
  }

  /**
   * Targets whose extraction or delivery failed.
   *
   * @return the list
   */
  public List<TargetReport> failures() {
    return targets.stream()
        .filter(r -> r.outcome() == TargetOutcome.EXTRACTION_FAILED || r.outcome() == TargetOutcome.DELIVERY_FAILED)
        .toList();
  }
}
