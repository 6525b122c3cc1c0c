package com.codeheadsystems.guardian.core.collaborator;

import com.codeheadsystems.guardian.core.model.Target;
import java.util.List;

/**
 * Lists candidate targets. Order is not significant; the orchestrator re-sorts.
 */
public interface TargetDiscovery {

  /**
   * Discovers targets.
   *
   * @return the targets
   */
  List<Target> discover();
}
