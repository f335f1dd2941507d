package com.consullo.jobs.process;

/**
 * Outcome of a kill request.
 *
 * @since 1.0
 */
public enum KillResult {
  OK,
  BAD_SIGNAL,
  ACCESS_DENIED,
  NO_PROCESS,
  ERROR,
  /** The job had no running process; nothing was signalled. */
  NOT_RUNNING;

  public boolean isOk() {
    return this == OK;
  }
}
