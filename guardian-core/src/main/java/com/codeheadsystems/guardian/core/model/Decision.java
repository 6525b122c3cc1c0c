package com.codeheadsystems.guardian.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * A decision-advisor answer.
 *
 * @param action the action, compared case-insensitively
 * @param reason free-text reason
 */
public record Decision(String action, String reason) {

  private static final Set<String> PROCEED_ACTIONS = Set.of("extract", "yes", "true");

  /**
   * Whether the action means "go ahead and extract".
   *
   * @return the boolean
   */
  public boolean proceed() {
    return action != null && PROCEED_ACTIONS.contains(action.trim().toLowerCase(Locale.ROOT));
  }
}
