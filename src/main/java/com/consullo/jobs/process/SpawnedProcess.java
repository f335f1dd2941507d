package com.consullo.jobs.process;

import java.io.InputStream;
import java.time.Duration;
import java.util.OptionalInt;

/**
 * Handle to a spawned child process.
 *
 * <p>Implementations must provide:
 * - the child's stdout and stderr as readable streams
 * - a non-blocking exit status query
 * - signal delivery to the child, optionally including its descendants
 *
 * @since 1.0
 */
public interface SpawnedProcess {

  long pid();

  InputStream stdout();

  InputStream stderr();

  boolean isAlive();

  /**
   * Returns true if {@link #stdout()} and {@link #stderr()} never report pending bytes through
   * {@link InputStream#available()}, as with pseudo-terminal streams, so they must be read with blocking calls.
   *
   * @return true for streams that need blocking reads
   */
  default boolean hasBlockingStreams() {
    return false;
  }

  /**
   * Returns the exit code if the process has exited. Never blocks.
   *
   * @return exit code, or empty while the process is running
   */
  OptionalInt exitCode();

  /**
   * Waits at most {@code timeout} for the process to exit.
   *
   * @param timeout maximum wait
   * @return exit code, or empty if the process is still running
   * @throws InterruptedException if interrupted while waiting
   */
  OptionalInt waitForExit(final Duration timeout) throws InterruptedException;

  /**
   * Delivers a signal to the process.
   *
   * @param signal signal to deliver
   * @param scope whether descendants are signalled too
   * @return outcome of the request
   */
  KillResult kill(final Signal signal, final KillScope scope);

  /**
   * Forcibly kills the process and its descendants without reporting errors.
   */
  void destroyForcibly();
}
