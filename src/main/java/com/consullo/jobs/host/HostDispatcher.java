package com.consullo.jobs.host;

/**
 * Delivers work onto the host's designated execution context (its UI thread, event loop or main loop).
 *
 * <p>Workers never call host callbacks directly; everything a host observes arrives through
 * {@link #dispatch(Runnable)}. Implementations must accept calls from any thread.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface HostDispatcher {

  /**
   * Schedules {@code task} to run on the host context.
   *
   * @param task task to run
   */
  void dispatch(final Runnable task);
}
