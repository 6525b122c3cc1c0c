package com.codeheadsystems.guardian.core.orchestrator;

import com.codeheadsystems.guardian.core.model.Target;

/**
 * Per-run knobs.
 *
 * @param shardId                     this process's shard, in [0, shardTotal)
 * @param shardTotal                  number of shards the targets are split across
 * @param rotationEscalationThreshold consecutive rotation failures after which they are logged at
 *                                    error instead of warn
 */
public record RunSettings(int shardId, int shardTotal, int rotationEscalationThreshold) {

  /** Single shard, escalation after three failures. */
  public static final RunSettings DEFAULT = new RunSettings(0, 1, 3);

  public RunSettings {
    if (shardTotal < 1) {
      throw new IllegalArgumentException("shardTotal must be at least 1: " + shardTotal);
    }
    if (shardId < 0 || shardId >= shardTotal) {
      throw new IllegalArgumentException("shardId must be in [0, " + shardTotal + "): " + shardId);
    }
  }

  /**
   * Whether this shard owns the target.
   *
   * @param target the target
   * @return the boolean
   */
  public boolean owns(Target target) {
    return Math.floorMod(target.identifier().hashCode(), shardTotal) == shardId;
  }
}
