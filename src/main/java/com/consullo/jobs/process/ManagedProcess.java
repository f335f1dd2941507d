package com.consullo.jobs.process;

import java.io.InputStream;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SpawnedProcess} backed by a {@link Process}, either a plain JDK process or a pty4j PTY process.
 *
 * @since 1.0
 */
public final class ManagedProcess implements SpawnedProcess {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManagedProcess.class);

  private final Process process;
  private final long pid;
  private final boolean groupLeader;
  private final boolean blockingStreams;

  /**
   * Wraps a started process whose pipes report pending bytes.
   *
   * @param process started process
   * @param groupLeader true if kills with {@link KillScope#CHILDREN} should reach descendants
   */
  public ManagedProcess(final Process process, final boolean groupLeader) {
    this(process, groupLeader, false);
  }

  /**
   * Wraps a started process.
   *
   * @param process started process
   * @param groupLeader true if kills with {@link KillScope#CHILDREN} should reach descendants
   * @param blockingStreams true if the process streams need blocking reads (pty4j)
   */
  public ManagedProcess(final Process process, final boolean groupLeader, final boolean blockingStreams) {
    Validate.notNull(process, "process must not be null");
    this.process = process;
    this.pid = process.pid();
    this.groupLeader = groupLeader;
    this.blockingStreams = blockingStreams;
  }

  @Override
  public long pid() {
    return pid;
  }

  @Override
  public InputStream stdout() {
    return process.getInputStream();
  }

  @Override
  public InputStream stderr() {
    return process.getErrorStream();
  }

  @Override
  public boolean isAlive() {
    return process.isAlive();
  }

  @Override
  public boolean hasBlockingStreams() {
    return blockingStreams;
  }

  @Override
  public OptionalInt exitCode() {
    if (process.isAlive()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(process.exitValue());
  }

  @Override
  public OptionalInt waitForExit(final Duration timeout) throws InterruptedException {
    Validate.notNull(timeout, "timeout must not be null");
    if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return OptionalInt.of(process.exitValue());
    }
    return OptionalInt.empty();
  }

  @Override
  public KillResult kill(final Signal signal, final KillScope scope) {
    Validate.notNull(scope, "scope must not be null");
    final boolean includeDescendants = scope == KillScope.CHILDREN && groupLeader;
    if (scope == KillScope.CHILDREN && !groupLeader) {
      LOGGER.debug("pid {} is not a group leader; signalling the process only", pid);
    }
    return SignalSender.send(pid, signal, includeDescendants);
  }

  @Override
  public void destroyForcibly() {
    try {
      process.descendants().forEach(ProcessHandle::destroyForcibly);
    } catch (final RuntimeException e) {
      LOGGER.debug("Could not enumerate descendants of pid {}: {}", pid, e.getMessage());
    }
    process.destroyForcibly();
  }

  @Override
  public String toString() {
    return "ManagedProcess[pid=" + pid + ", alive=" + process.isAlive() + "]";
  }
}
