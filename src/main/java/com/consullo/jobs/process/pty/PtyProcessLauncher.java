package com.consullo.jobs.process.pty;

import com.consullo.jobs.process.SpawnRequest;
import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts a child attached to a pseudo-terminal, implemented with pty4j.
 *
 * <p>The child sees an interactive console (isatty is true for its stdout), while stderr stays a separate
 * stream so that output and error text can still be told apart.
 *
 * @since 1.0
 */
public final class PtyProcessLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessLauncher.class);

  /** Default PTY columns. */
  public static final int DEFAULT_COLUMNS = 120;

  /** Default PTY rows. */
  public static final int DEFAULT_ROWS = 40;

  private final int columns;
  private final int rows;

  public PtyProcessLauncher() {
    this(DEFAULT_COLUMNS, DEFAULT_ROWS);
  }

  public PtyProcessLauncher(final int columns, final int rows) {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Spawns a PTY-attached process.
   *
   * @param request command, working directory and environment overrides
   * @return started process
   * @throws IOException if the process cannot be started
   */
  public PtyProcess launch(final SpawnRequest request) throws IOException {
    Validate.notNull(request, "request must not be null");

    final String[] cmd = request.command().toArray(new String[0]);

    // pty4j replaces the environment instead of layering on top of it.
    final Map<String, String> env = new HashMap<>(System.getenv());
    env.putAll(request.environment());
    env.putIfAbsent("TERM", "xterm-256color");

    final PtyProcessBuilder builder = new PtyProcessBuilder(cmd);
    if (request.workingDirectory() != null) {
      builder.setDirectory(request.workingDirectory().toString());
    }
    builder.setEnvironment(env);
    builder.setRedirectErrorStream(false);
    builder.setInitialColumns(columns);
    builder.setInitialRows(rows);

    final PtyProcess process = builder.start();
    LOGGER.debug("PTY process started: pid={} size={}x{}", process.pid(), columns, rows);
    return process;
  }
}
