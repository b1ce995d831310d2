package com.consullo.relay.pty;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Launch parameters for the agent CLI on a pseudo terminal.
 *
 * @param command command and arguments (e.g., ["claude"])
 * @param workingDirectory working directory of the agent; context artifacts are written here by default
 * @param environment full environment of the child process (may be null for an empty environment)
 * @param initialColumns initial PTY columns
 * @param initialRows initial PTY rows
 * @since 1.0
 */
public record PtyProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int initialColumns,
    int initialRows) {

  public PtyProcessConfig {
    command = command == null ? List.of() : List.copyOf(command);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }
}
