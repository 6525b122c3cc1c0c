package com.codeheadsystems.guardian.core.delivery;

import java.util.Locale;

/**
 * Derives secret-store key names from target identifiers.
 */
public class SecretNames {

  static final String PREFIX = "REPO_";

  private SecretNames() {
  }

  /**
   * Drops every character outside {@code [A-Za-z0-9_]}, prefixes {@code REPO_} unless the rest
   * starts with a letter, and upper-cases. The result only holds {@code [A-Z0-9_]} and starts
   * with a letter.
   *
   * @param identifier the target identifier
   * @return the secret name
   */
  public static String fromTargetIdentifier(final String identifier) {
    StringBuilder kept = new StringBuilder();
    if (identifier != null) {
      for (int i = 0; i < identifier.length(); i++) {
        char c = identifier.charAt(i);
        if (isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '_') {
          kept.append(c);
        }
      }
    }
    String name = kept.length() > 0 && isAsciiLetter(kept.charAt(0)) ? kept.toString() : PREFIX + kept;
    return name.toUpperCase(Locale.ROOT);
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
