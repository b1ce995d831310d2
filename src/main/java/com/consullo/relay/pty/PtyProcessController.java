package com.consullo.relay.pty;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on the PTY-attached agent process.
 *
 * <p>The relay only needs the two byte streams, a liveness check and exit notification.
 *
 * @since 1.0
 */
public interface PtyProcessController extends AutoCloseable {

  /** Bytes rendered by the agent (what a terminal would display). */
  InputStream getPtyOutput() throws Exception;

  /** Keystrokes sent to the agent. */
  OutputStream getPtyInput() throws Exception;

  /** Completes with the exit code once the agent process ends. */
  CompletableFuture<Integer> onExit() throws Exception;

  boolean isAlive() throws Exception;

  @Override
  void close() throws Exception;
}
