package com.consullo.relay.driver;

import java.util.List;
import java.util.Map;

/**
 * How the agent CLI is launched and rendered.
 *
 * @param command executable and arguments
 * @param workingDirectory agent working directory, blank for the current directory
 * @param ciMode sets {@code CI=1}, which makes most CLIs drop animations
 * @param columns emulated terminal width
 * @param rows emulated terminal height
 * @param scrollbackLines history retained by the emulator
 * @param historyTail history lines included in each capture
 * @param submitDelayMillis pause between typing a line and pressing Enter
 * @param environment extra environment variables for the agent
 */
public record AgentSessionConfig(
    List<String> command,
    String workingDirectory,
    boolean ciMode,
    int columns,
    int rows,
    int scrollbackLines,
    int historyTail,
    long submitDelayMillis,
    Map<String, String> environment) {

  public AgentSessionConfig {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty.");
    }
    if (columns <= 0 || rows <= 0) {
      throw new IllegalArgumentException("columns/rows must be positive.");
    }
    if (scrollbackLines <= 0) {
      throw new IllegalArgumentException("scrollbackLines must be positive.");
    }
    command = List.copyOf(command);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }
}
