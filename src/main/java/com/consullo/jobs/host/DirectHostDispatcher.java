package com.consullo.jobs.host;

import org.apache.commons.lang3.Validate;

/**
 * Runs tasks immediately on the calling thread. Suitable when every caller already is the host thread,
 * for example a host that only ever calls {@code Job.poll()} from its own loop.
 *
 * @since 1.0
 */
public final class DirectHostDispatcher implements HostDispatcher {

  @Override
  public void dispatch(final Runnable task) {
    Validate.notNull(task, "task must not be null");
    task.run();
  }
}
