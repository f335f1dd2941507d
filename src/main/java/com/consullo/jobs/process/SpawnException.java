package com.consullo.jobs.process;

import java.util.List;

/**
 * Thrown when a child process cannot be created.
 *
 * @since 1.0
 */
public class SpawnException extends Exception {

  private static final long serialVersionUID = 1L;

  private final List<String> command;

  public SpawnException(final List<String> command, final String message, final Throwable cause) {
    super(message, cause);
    this.command = command == null ? List.of() : List.copyOf(command);
  }

  /**
   * Returns the command that failed to start.
   *
   * @return command and arguments
   */
  public List<String> getCommand() {
    return command;
  }
}
