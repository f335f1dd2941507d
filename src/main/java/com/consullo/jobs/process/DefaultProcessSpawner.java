package com.consullo.jobs.process;

import com.consullo.jobs.process.pty.PtyProcessLauncher;
import java.io.File;
import java.io.IOException;
import org.apache.commons.lang3.SystemUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ProcessSpawner}.
 *
 * <p>
 * Uses {@link ProcessBuilder} with stdout and stderr as separate pipes and stdin discarded. When the request
 * carries {@link ExecFlag#SHOW_CONSOLE} the child is attached to a pseudo-terminal through
 * {@link PtyProcessLauncher} instead.
 * </p>
 *
 * @since 1.0
 */
public final class DefaultProcessSpawner implements ProcessSpawner {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultProcessSpawner.class);

  private final PtyProcessLauncher ptyLauncher;

  public DefaultProcessSpawner() {
    this(new PtyProcessLauncher());
  }

  public DefaultProcessSpawner(final PtyProcessLauncher ptyLauncher) {
    Validate.notNull(ptyLauncher, "ptyLauncher must not be null");
    this.ptyLauncher = ptyLauncher;
  }

  @Override
  public SpawnedProcess spawn(final SpawnRequest request) throws SpawnException {
    Validate.notNull(request, "request must not be null");

    final boolean groupLeader = request.hasFlag(ExecFlag.MAKE_GROUP_LEADER);
    final boolean pty = request.hasFlag(ExecFlag.SHOW_CONSOLE) && !request.hasFlag(ExecFlag.HIDE_CONSOLE);
    final Process process;
    try {
      if (pty) {
        process = ptyLauncher.launch(request);
      } else {
        process = startPiped(request);
      }
    } catch (final IOException | RuntimeException e) {
      throw new SpawnException(request.command(),
          "Failed to start " + String.join(" ", request.command()) + ": " + e.getMessage(), e);
    }

    LOGGER.debug("Spawned pid {} (pty={}): {}", process.pid(), pty, request.command());
    // pty4j streams always report zero available bytes.
    return new ManagedProcess(process, groupLeader, pty);
  }

  private static Process startPiped(final SpawnRequest request) throws IOException {
    final ProcessBuilder pb = new ProcessBuilder(request.command());
    if (request.workingDirectory() != null) {
      pb.directory(request.workingDirectory().toFile());
    }
    pb.environment().putAll(request.environment());
    // Keep stderr separate from stdout (we capture both)
    pb.redirectErrorStream(false);
    pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
    return pb.start();
  }

  private static File nullDevice() {
    return new File(SystemUtils.IS_OS_WINDOWS ? "NUL" : "/dev/null");
  }
}
