package com.codeheadsystems.guardian.core.collaborator;

import com.codeheadsystems.guardian.core.model.Artifact;
import com.codeheadsystems.guardian.core.model.Credentials;
import com.codeheadsystems.guardian.core.model.ExtractionOutcome;
import java.util.List;
import java.util.Optional;

/**
 * The extraction boundary: visits a locator and returns the cookies the session ended up with.
 * Implementations may throw {@link com.codeheadsystems.guardian.core.exceptions.TargetExtractionException};
 * the orchestrator treats any failure here as target-scoped.
 */
public interface ArtifactExtractor {

  /**
   * Extracts artifacts.
   *
   * @param locator     the locator
   * @param credentials optional login credentials
   * @return the extraction outcome
   */
  ExtractionOutcome extract(String locator, Optional<Credentials> credentials);

  /**
   * Checks that freshly extracted artifacts still authenticate at the locator. Extractors with no
   * way to replay them accept them as they are.
   *
   * @param locator   the locator
   * @param artifacts the artifacts from {@link #extract}
   * @return true if the artifacts are usable
   */
  default boolean validate(String locator, List<Artifact> artifacts) {
    return true;
  }
}
