package com.codeheadsystems.guardian.core.store;

import com.codeheadsystems.guardian.core.collaborator.RunStateStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Non-persistent {@link RunStateStore} that also keeps every state it was given, in order.
 */
public class InMemoryRunStateStore implements RunStateStore {

  private final List<String> history = new ArrayList<>();

  @Override
  public synchronized void save(String state) {
    history.add(state);
  }

  @Override
  public synchronized Optional<String> load() {
    return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
  }

  /**
   * Every saved state, oldest first.
   *
   * @return the list
   */
  public synchronized List<String> history() {
    return List.copyOf(history);
  }
}
