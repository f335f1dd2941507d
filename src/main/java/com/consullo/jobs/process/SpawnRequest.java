package com.consullo.jobs.process;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.Validate;

/**
 * Everything a {@link ProcessSpawner} needs to create a child process.
 *
 * @param command command and arguments (e.g., ["python3", "script.py"])
 * @param workingDirectory working directory for the child; null inherits the parent's
 * @param environment environment variables to add/override on top of the parent's environment
 * @param flags execution option flags
 * @since 1.0
 */
public record SpawnRequest(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    Set<ExecFlag> flags) {

  public SpawnRequest {
    Validate.notNull(command, "command must not be null");
    Validate.isTrue(!command.isEmpty(), "command must not be empty");
    command = List.copyOf(command);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
    flags = flags == null || flags.isEmpty() ? EnumSet.noneOf(ExecFlag.class) : EnumSet.copyOf(flags);
  }

  public boolean hasFlag(final ExecFlag flag) {
    return flags.contains(flag);
  }
}
