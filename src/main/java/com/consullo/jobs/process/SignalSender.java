package com.consullo.jobs.process;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.apache.commons.lang3.SystemUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers {@link Signal}s through {@link ProcessHandle}.
 *
 * <p>
 * {@code TERM} and {@code KILL} map onto {@link ProcessHandle#destroy()} and
 * {@link ProcessHandle#destroyForcibly()}. {@code INT} has no JDK equivalent and is sent with the POSIX
 * {@code kill} utility; on Windows it is rejected as a bad signal.
 * </p>
 *
 * <p>
 * The JDK has no process-group API, so a group is modelled as the descendant tree of the leader. Descendants
 * are collected before the leader is signalled because they are re-parented once it dies.
 * </p>
 */
final class SignalSender {

  private static final Logger LOGGER = LoggerFactory.getLogger(SignalSender.class);

  private static final long KILL_UTILITY_TIMEOUT_MILLIS = 1000L;

  private SignalSender() {
  }

  static KillResult send(final long pid, final Signal signal, final boolean includeDescendants) {
    Validate.notNull(signal, "signal must not be null");

    if (signal == Signal.INT && SystemUtils.IS_OS_WINDOWS) {
      return KillResult.BAD_SIGNAL;
    }

    final Optional<ProcessHandle> maybeHandle = ProcessHandle.of(pid);
    if (maybeHandle.isEmpty() || !maybeHandle.get().isAlive()) {
      return KillResult.NO_PROCESS;
    }
    final ProcessHandle root = maybeHandle.get();

    final List<ProcessHandle> descendants = includeDescendants
        ? root.descendants().collect(Collectors.toList())
        : new ArrayList<>(0);

    final KillResult result;
    try {
      result = sendOne(root, signal);
    } catch (final SecurityException e) {
      LOGGER.warn("Signal {} to pid {} denied: {}", signal, pid, e.getMessage());
      return KillResult.ACCESS_DENIED;
    } catch (final IllegalStateException e) {
      // ProcessHandle refuses to destroy the current JVM.
      LOGGER.warn("Signal {} to pid {} rejected: {}", signal, pid, e.getMessage());
      return KillResult.ERROR;
    }

    for (final ProcessHandle d : descendants) {
      try {
        final KillResult r = sendOne(d, signal);
        if (!r.isOk()) {
          LOGGER.debug("Signal {} to descendant pid {} of {}: {}", signal, d.pid(), pid, r);
        }
      } catch (final RuntimeException e) {
        LOGGER.debug("Signal {} to descendant pid {} of {} failed: {}", signal, d.pid(), pid, e.getMessage());
      }
    }
    return result;
  }

  private static KillResult sendOne(final ProcessHandle handle, final Signal signal) {
    if (!handle.isAlive()) {
      return KillResult.NO_PROCESS;
    }
    switch (signal) {
      case TERM:
        return handle.destroy() ? KillResult.OK : KillResult.ERROR;
      case KILL:
        return handle.destroyForcibly() ? KillResult.OK : KillResult.ERROR;
      case INT:
        return sendWithKillUtility(handle.pid(), signal);
      default:
        return KillResult.BAD_SIGNAL;
    }
  }

  private static KillResult sendWithKillUtility(final long pid, final Signal signal) {
    final ProcessBuilder builder = new ProcessBuilder(
        "kill", "-" + signal.number(), Long.toString(pid));
    builder.redirectErrorStream(true);
    builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    try {
      final Process kill = builder.start();
      if (!kill.waitFor(KILL_UTILITY_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
        kill.destroyForcibly();
        return KillResult.ERROR;
      }
      return kill.exitValue() == 0 ? KillResult.OK : KillResult.ERROR;
    } catch (final IOException e) {
      LOGGER.warn("Could not run kill utility for pid {}: {}", pid, e.getMessage());
      return KillResult.ERROR;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return KillResult.ERROR;
    }
  }
}
