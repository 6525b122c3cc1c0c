package com.codeheadsystems.guardian.client.warp;

import java.time.Duration;

/**
 * Pauses the calling thread.
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeps with {@link Thread#sleep(long)}. */
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
