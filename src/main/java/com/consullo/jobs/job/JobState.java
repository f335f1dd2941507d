package com.consullo.jobs.job;

/**
 * Lifecycle of a {@link Job}. Transitions only move forward: IDLE, RUNNING, TERMINATED.
 *
 * @since 1.0
 */
public enum JobState {
  IDLE,
  RUNNING,
  TERMINATED
}
