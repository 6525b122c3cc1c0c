package com.codeheadsystems.guardian.core.model;

import java.util.Optional;

/**
 * Metadata about one processed target. Holds counts, scores and status only, never artifact
 * values.
 *
 * @param target        the target
 * @param outcome       the outcome
 * @param artifactCount artifacts acquired for the target
 * @param cookieScore   how session-like the acquired cookie names looked, 0.0 when none
 * @param secretName    delivery key name, null when injection was not reached
 * @param errorDetail   redacted failure detail, null on success
 */
public record TargetReport(Target target,
                           TargetOutcome outcome,
                           int artifactCount,
                           double cookieScore,
                           String secretName,
                           String errorDetail) {

  public Optional<String> error() {
    return Optional.ofNullable(errorDetail);
  }
}
