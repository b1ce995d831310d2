package com.consullo.relay.core;

/**
 * Converts raw PTY bytes into a maintained terminal state (screen + scrollback).
 *
 * <p>Isolates the relay from a specific emulator; the shipped implementation is JediTerm based.
 *
 * @since 1.0
 */
public interface TerminalCore {

  /**
   * Feeds bytes read from the PTY into the emulator.
   *
   * <p>Invocations must be serialized on a single thread (the session read loop).
   *
   * @param data raw bytes read from the PTY output stream
   * @param offset offset into the data array
   * @param length number of bytes to read from the array
   */
  void feed(final byte[] data, final int offset, final int length);

  /**
   * Returns a view over history and screen rows.
   *
   * @return scrollback view
   */
  ScrollbackView scrollback();

  /**
   * Whether the application switched to the alternate screen buffer (full-screen mode, no history).
   *
   * @return true while the alternate buffer is active
   */
  boolean alternateScreen();
}
