package com.codeheadsystems.guardian.core.collaborator;

import com.codeheadsystems.guardian.core.model.Decision;

/**
 * Turns a natural-language question into an enumerated action.
 */
public interface DecisionAdvisor {

  /**
   * Decides.
   *
   * @param prompt the prompt text
   * @return the decision
   */
  Decision decide(String prompt);
}
