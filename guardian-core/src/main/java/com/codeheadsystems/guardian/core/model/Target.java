package com.codeheadsystems.guardian.core.model;

import java.net.URI;
import java.util.Locale;

/**
 * A discovered candidate that may need cookie extraction.
 *
 * @param identifier     stable name, e.g. {@code owner/repo}; also the delivery recipient
 * @param locator        URL the browser opens
 * @param relevanceScore discovery score in [0, 1]
 */
public record Target(String identifier, String locator, double relevanceScore) {

  public Target {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Target identifier must not be blank");
    }
  }

  /**
   * Platform name derived from the locator host: {@code https://www.github.com/x} gives
   * {@code github}. Unparseable locators give {@code unknown}.
   *
   * @return the string
   */
  public String platform() {
    try {
      String host = locator == null ? null : URI.create(locator).getHost();
      if (host == null || host.isBlank()) {
        return "unknown";
      }
      host = host.toLowerCase(Locale.ROOT);
      if (host.startsWith("www.")) {
        host = host.substring(4);
      }
      int dot = host.indexOf('.');
      return dot > 0 ? host.substring(0, dot) : host;
    } catch (IllegalArgumentException e) {
      return "unknown";
    }
  }
}
