package com.consullo.jobs.process;

/**
 * Creates child processes with separately readable stdout and stderr pipes.
 *
 * <p>Tests may provide an implementation that returns a fake {@link SpawnedProcess} with controlled
 * output and exit behavior.
 *
 * @since 1.0
 */
public interface ProcessSpawner {

  /**
   * Starts a child process.
   *
   * @param request command, working directory, environment and flags
   * @return handle to the running child
   * @throws SpawnException if the process cannot be created
   */
  SpawnedProcess spawn(final SpawnRequest request) throws SpawnException;
}
