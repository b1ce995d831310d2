package com.consullo.relay.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent process controller implemented with pty4j.
 *
 * @since 1.0
 */
public final class PtyProcessControllerPty4j implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessControllerPty4j.class);

  private static final long DESTROY_GRACE_MILLIS = 2_000L;

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();

  /**
   * Spawns the agent on a fresh PTY sized to the configured columns and rows.
   *
   * @param config launch parameters
   * @throws Exception if the process cannot be started
   */
  public PtyProcessControllerPty4j(final PtyProcessConfig config) throws Exception {
    Validate.notNull(config, "config must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");
    Validate.isTrue(config.initialColumns() > 0, "initialColumns must be positive");
    Validate.isTrue(config.initialRows() > 0, "initialRows must be positive");

    final Map<String, String> env = new HashMap<>(config.environment());

    final PtyProcessBuilder builder = new PtyProcessBuilder(config.command().toArray(new String[0]))
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(env)
        .setInitialColumns(config.initialColumns())
        .setInitialRows(config.initialRows());

    this.process = builder.start();
    LOGGER.info("Started agent process pid={} command={} cwd={}",
        this.process.pid(), config.command(), config.workingDirectory());

    startExitMonitorThread();
  }

  @Override
  public InputStream getPtyOutput() {
    return this.process.getInputStream();
  }

  @Override
  public OutputStream getPtyInput() {
    return this.process.getOutputStream();
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return this.exitFuture;
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public void close() throws Exception {
    if (!this.process.isAlive()) {
      return;
    }
    this.process.destroy();
    if (!this.process.waitFor(DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
      LOGGER.warn("Agent process pid={} ignored SIGTERM, killing", this.process.pid());
      this.process.destroyForcibly();
    }
  }

  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        final int code = this.process.waitFor();
        LOGGER.info("Agent process pid={} exited with code {}", this.process.pid(), code);
        this.exitFuture.complete(code);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        this.exitFuture.completeExceptionally(e);
      }
    }, "AgentExitMonitor");
    monitor.setDaemon(true);
    monitor.start();
  }
}
