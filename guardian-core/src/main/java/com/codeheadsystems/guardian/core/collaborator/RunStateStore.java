package com.codeheadsystems.guardian.core.collaborator;

import java.util.Optional;

/**
 * Observability surface for the current run state. Written only by the orchestrator. A crashed
 * run does not resume from it.
 */
public interface RunStateStore {

  /**
   * Persists the current state name.
   *
   * @param state the state
   */
  void save(String state);

  /**
   * Loads the last persisted state name.
   *
   * @return the optional
   */
  Optional<String> load();
}
