package com.codeheadsystems.guardian.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate result of one extraction attempt. Must be drained (every artifact released) before
 * anything about it is recorded.
 *
 * @param artifacts         the artifacts acquired, possibly already wiped
 * @param twoFactorDetected whether the login flow asked for a second factor
 * @param succeeded         whether extraction produced usable artifacts
 * @param errorDetail       failure detail, null on success
 */
public record ExtractionOutcome(List<Artifact> artifacts,
                                boolean twoFactorDetected,
                                boolean succeeded,
                                String errorDetail) {

  public ExtractionOutcome {
    artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
  }

  public static ExtractionOutcome success(List<Artifact> artifacts) {
    return new ExtractionOutcome(artifacts, false, true, null);
  }

  public static ExtractionOutcome twoFactor(List<Artifact> artifacts) {
    return new ExtractionOutcome(artifacts, true, false, "Second authentication factor required");
  }

  public static ExtractionOutcome failure(String errorDetail) {
    return new ExtractionOutcome(List.of(), false, false, errorDetail);
  }

  public Optional<String> error() {
    return Optional.ofNullable(errorDetail);
  }
}
