package com.consullo.relay.driver;

import com.consullo.relay.core.TerminalCore;
import com.consullo.relay.core.jediterm.JediTermCore;
import com.consullo.relay.pty.PtyProcessConfig;
import com.consullo.relay.pty.PtyProcessController;
import com.consullo.relay.pty.PtyProcessControllerPty4j;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Launches the agent CLI with the terminal contract the relay expects.
 *
 * <p>
 * This class centralizes the decision-making around:
 * <ul>
 * <li>TERM (a common xterm contract the emulator understands)</li>
 * <li>Optional CI mode to reduce spinners/animations</li>
 * <li>Working directory defaults</li>
 * </ul>
 * </p>
 */
public final class AgentSessionFactory {

  private AgentSessionFactory() {
  }

  /**
   * Starts the agent and attaches an emulator to it.
   *
   * @param config launch settings
   * @return running session
   */
  public static AgentSession start(AgentSessionConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null.");
    }

    final PtyProcessConfig cfg = new PtyProcessConfig(
        config.command(),
        workingDirectory(config),
        environment(config),
        config.columns(),
        config.rows());

    try {
      final PtyProcessController pty = new PtyProcessControllerPty4j(cfg);
      final TerminalCore core = new JediTermCore(config.columns(), config.rows(), config.scrollbackLines());
      return AgentSession.start(pty, core, config.historyTail(), config.submitDelayMillis());
    } catch (Exception e) {
      throw new IllegalStateException("Failed to start agent session " + config.command(), e);
    }
  }

  /**
   * Resolves the agent working directory; blank means the relay's own.
   *
   * @param config launch settings
   * @return absolute directory
   */
  public static Path workingDirectory(AgentSessionConfig config) {
    return StringUtils.isBlank(config.workingDirectory())
        ? Path.of(".").toAbsolutePath().normalize()
        : Path.of(config.workingDirectory()).toAbsolutePath().normalize();
  }

  static Map<String, String> environment(AgentSessionConfig config) {
    final Map<String, String> env = new LinkedHashMap<>(System.getenv());
    env.put("TERM", "xterm-256color");
    if (config.ciMode()) {
      env.put("CI", "1");
    }
    env.putAll(config.environment());
    return env;
  }
}
