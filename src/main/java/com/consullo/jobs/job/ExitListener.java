package com.consullo.jobs.job;

/**
 * Listener for the end of a supervised process. Called once per job, on the host context.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ExitListener {

  /**
   * Called when the process exited on its own or was terminated.
   *
   * @param pid process id the child had
   * @param exitCode exit code, or {@link Job#EXIT_CODE_UNKNOWN} if none could be obtained
   */
  void onExit(final long pid, final int exitCode);
}
