package com.consullo.jobs.host;

/**
 * Handle to an armed periodic tick.
 *
 * @since 1.0
 */
public interface Tick {

  /**
   * Disarms the tick. Idempotent. A tick already handed to the host may still run once.
   */
  void cancel();

  boolean isCancelled();
}
