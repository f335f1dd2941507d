package com.consullo.jobs.job;

/**
 * Thrown when a {@link Job} operation is not allowed in the job's current state, for example changing the
 * command of a running job.
 *
 * @since 1.0
 */
public class JobStateException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public JobStateException(final String message) {
    super(message);
  }
}
