package com.consullo.jobs.host;

import java.time.Duration;

/**
 * Invokes a zero-argument action at a fixed interval until cancelled.
 *
 * @since 1.0
 */
public interface TickScheduler {

  /**
   * Arms a periodic tick. The first invocation happens one interval from now.
   *
   * @param action action to run on every tick
   * @param interval time between ticks, must be positive
   * @return handle used to disarm the tick
   */
  Tick schedule(final Runnable action, final Duration interval);
}
