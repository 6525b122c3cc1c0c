package com.codeheadsystems.guardian.core.collaborator;

import com.codeheadsystems.guardian.core.model.Credentials;
import java.util.Optional;

/**
 * Supplies login credentials per platform.
 */
public interface CredentialsProvider {

  /** Provider with no credentials for any platform. */
  CredentialsProvider NONE = platform -> Optional.empty();

  /**
   * Credentials for the platform, freshly built on every call so the caller owns them.
   *
   * @param platform the platform
   * @return the optional
   */
  Optional<Credentials> credentialsFor(String platform);
}
