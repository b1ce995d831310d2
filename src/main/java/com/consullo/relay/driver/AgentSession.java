package com.consullo.relay.driver;

import com.consullo.relay.core.ScreenCapture;
import com.consullo.relay.core.ScrollbackScreenCapture;
import com.consullo.relay.core.SessionTerminal;
import com.consullo.relay.core.TerminalCore;
import com.consullo.relay.pty.PtyProcessController;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The live agent CLI session.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>PTY process controller</li>
 * <li>Terminal core (ANSI/VT parsing + scrollback)</li>
 * <li>The read loop that keeps the core in sync with PTY output</li>
 * </ul>
 * </p>
 */
public final class AgentSession implements SessionTerminal, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AgentSession.class);

  private static final byte[] ENTER = {'\r'};
  private static final byte[] ESC = {0x1B};

  private final PtyProcessController pty;
  private final TerminalCore core;
  private final ScreenCapture screen;
  private final long submitDelayMillis;

  private volatile boolean closed;
  private volatile boolean exited;

  private AgentSession(PtyProcessController pty, TerminalCore core, int historyTail, long submitDelayMillis) {
    this.pty = pty;
    this.core = core;
    this.screen = new ScrollbackScreenCapture(core, historyTail);
    this.submitDelayMillis = submitDelayMillis;
  }

  /**
   * Wraps a started process and begins pumping its output into {@code core}.
   *
   * @param pty running agent process
   * @param core emulator fed by the read loop
   * @param historyTail scrollback lines included in each capture
   * @param submitDelayMillis pause between typing a line and pressing Enter
   * @return session
   */
  public static AgentSession start(PtyProcessController pty, TerminalCore core, int historyTail, long submitDelayMillis) {
    Validate.notNull(pty, "pty must not be null");
    Validate.notNull(core, "core must not be null");
    Validate.isTrue(submitDelayMillis >= 0, "submitDelayMillis must not be negative");

    final AgentSession s = new AgentSession(pty, core, historyTail, submitDelayMillis);
    try {
      s.startPtyReadLoop(pty.getPtyOutput());
      s.watchExit(pty.onExit());
    } catch (Exception e) {
      throw new IllegalStateException("Failed to attach to agent output", e);
    }
    return s;
  }

  @Override
  public String capture() {
    return screen.capture();
  }

  @Override
  public void submitLine(String line) throws InterruptedException {
    Validate.notNull(line, "line must not be null");
    Validate.isTrue(StringUtils.containsNone(line, '\r', '\n'), "line must not contain line breaks");

    writeBytes(line.getBytes(StandardCharsets.UTF_8));
    // Enter in the same write as the text is taken as part of a paste
    if (submitDelayMillis > 0) {
      Thread.sleep(submitDelayMillis);
    }
    writeBytes(ENTER);
  }

  @Override
  public void sendInterrupt() {
    writeBytes(ESC);
  }

  @Override
  public boolean isAlive() {
    try {
      return !closed && !exited && pty.isAlive();
    } catch (Exception e) {
      LOGGER.warn("Liveness check failed: {}", e.getMessage());
      return false;
    }
  }

  private void writeBytes(byte[] bytes) {
    try {
      pty.getPtyInput().write(bytes);
      pty.getPtyInput().flush();
    } catch (Exception e) {
      throw new IllegalStateException("Failed writing to agent PTY.", e);
    }
  }

  private void watchExit(CompletableFuture<Integer> exit) {
    exit.whenComplete((code, error) -> {
      exited = true;
      if (!closed) {
        LOGGER.warn("Agent process exited unexpectedly (code {})", code);
      }
    });
  }

  private void startPtyReadLoop(InputStream in) {
    final Thread reader = new Thread(() -> {
      final byte[] buffer = new byte[8192];
      while (true) {
        try {
          final int n = in.read(buffer);
          if (n < 0) {
            LOGGER.info("Agent output closed");
            return;
          }
          core.feed(buffer, 0, n);
        } catch (IOException e) {
          if (!closed) {
            LOGGER.warn("Agent output read failed: {}", e.getMessage());
          }
          return;
        }
      }
    }, "AgentPtyReadLoop");
    reader.setDaemon(true);
    reader.start();
  }

  @Override
  public void close() {
    closed = true;
    try {
      pty.close();
    } catch (Exception e) {
      LOGGER.warn("Closing agent process failed: {}", e.getMessage(), e);
    }
  }
}
