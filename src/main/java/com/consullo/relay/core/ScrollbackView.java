package com.consullo.relay.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view over terminal history and screen content.
 *
 * <p>History lines are rows that scrolled off the top of the screen. Screen lines are the current
 * display and are redrawn freely by the agent UI.
 *
 * @since 1.0
 */
public interface ScrollbackView {

  int historyLineCount();

  int screenRowCount();

  /**
   * Returns history lines for [startInclusive, endExclusive). Index 0 is the oldest history line.
   *
   * @param startInclusive start line index inclusive
   * @param endExclusive end line index exclusive
   * @return plain text lines, right-trimmed
   */
  List<String> readHistoryLines(int startInclusive, int endExclusive);

  /**
   * Returns screen rows for [startInclusive, endExclusive). Index 0 is the top row.
   *
   * @param startInclusive start row index inclusive
   * @param endExclusive end row index exclusive
   * @return plain text lines, right-trimmed
   */
  List<String> readScreenLines(int startInclusive, int endExclusive);

  /**
   * Returns the last {@code maxHistoryLines} history lines followed by every screen row.
   *
   * <p>Implementations backed by a live emulator override this to read under the emulator lock, so
   * that history and screen come from the same state.
   *
   * @param maxHistoryLines how much scrollback to include, 0 for the screen only
   * @return lines, oldest first
   */
  default List<String> readTail(int maxHistoryLines) {
    final int history = historyLineCount();
    final int from = Math.max(0, history - Math.max(0, maxHistoryLines));
    final List<String> lines = new ArrayList<>(readHistoryLines(from, history));
    lines.addAll(readScreenLines(0, screenRowCount()));
    return lines;
  }
}
