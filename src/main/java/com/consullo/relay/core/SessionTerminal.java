package com.consullo.relay.core;

/**
 * The interactive session as the relay drives it: read the screen, type a line, interrupt.
 *
 * <p>There is no structured channel. Everything the relay sends goes through the same line-based
 * input a human would use.
 *
 * @since 1.0
 */
public interface SessionTerminal extends ScreenCapture {

  /**
   * Types {@code line} and presses Enter.
   *
   * @param line single line of input, must not contain CR or LF
   * @throws InterruptedException if interrupted between typing and submitting
   */
  void submitLine(String line) throws InterruptedException;

  /** Sends ESC, which stops an in-progress response in the agent UI. */
  void sendInterrupt();

  boolean isAlive();
}
