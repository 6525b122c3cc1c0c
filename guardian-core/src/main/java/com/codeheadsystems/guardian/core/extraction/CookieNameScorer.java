package com.codeheadsystems.guardian.core.extraction;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rates how much a set of cookie names looks like an authenticated session. Only names are
 * looked at.
 * <p>
 * The score is the share of names matching a session-like pattern plus 0.1, capped at 1.0. No
 * names scores 0.0.
 */
public final class CookieNameScorer {

  /** Patterns searched for anywhere in a name, case-insensitive. */
  public static final List<Pattern> SESSION_PATTERNS = List.of(
      Pattern.compile("session(_id)?", Pattern.CASE_INSENSITIVE),
      Pattern.compile("auth(_token)?", Pattern.CASE_INSENSITIVE),
      Pattern.compile("jwt", Pattern.CASE_INSENSITIVE),
      Pattern.compile("csrf", Pattern.CASE_INSENSITIVE),
      Pattern.compile("remember_me", Pattern.CASE_INSENSITIVE),
      Pattern.compile("access(_token)?", Pattern.CASE_INSENSITIVE),
      Pattern.compile("refresh(_token)?", Pattern.CASE_INSENSITIVE));

  private static final double BASELINE = 0.1;

  private CookieNameScorer() {
  }

  /**
   * Scores the names.
   *
   * @param names cookie names, nulls ignored
   * @return a value in [0.0, 1.0]
   */
  public static double score(final Collection<String> names) {
    int total = 0;
    int hits = 0;
    for (String name : names) {
      if (name == null) {
        continue;
      }
      total++;
      if (isSessionLike(name)) {
        hits++;
      }
    }
    if (total == 0) {
      return 0.0;
    }
    return Math.min(1.0, (double) hits / total + BASELINE);
  }

  static boolean isSessionLike(final String name) {
    for (Pattern pattern : SESSION_PATTERNS) {
      if (pattern.matcher(name).find()) {
        return true;
      }
    }
    return false;
  }
}
