package com.consullo.relay.core.jediterm;

import com.consullo.relay.core.ScrollbackView;
import com.consullo.relay.core.TerminalCore;
import com.jediterm.terminal.emulator.JediEmulator;
import com.jediterm.terminal.model.JediTerminal;
import com.jediterm.terminal.model.StyleState;
import com.jediterm.terminal.model.TerminalLine;
import com.jediterm.terminal.model.TerminalTextBuffer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TerminalCore} implementation backed by JediTerm.
 *
 * <p>
 * This integrates:
 * <ul>
 * <li>ANSI/VT parsing: {@link JediEmulator}</li>
 * <li>Terminal state + cursor: {@link JediTerminal}</li>
 * <li>Scrollback/history: {@link TerminalTextBuffer} (negative indices are
 * history)</li>
 * </ul>
 * </p>
 *
 * <p>
 * Feeding and reading share one lock, so a capture never observes a half-applied redraw.
 * </p>
 */
public final class JediTermCore implements TerminalCore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JediTermCore.class);

  // JediTerm stores the right half of a wide glyph as this private-use char
  private static final char DOUBLE_WIDTH_PLACEHOLDER = '\uE000';

  private final Object lock = new Object();

  private final Utf8TerminalDataStream dataStream;
  private final TerminalTextBuffer textBuffer;
  private final HeadlessTerminalDisplay display;
  private final JediTerminal terminal;
  private final JediEmulator emulator;

  /**
   * Creates a terminal core with given screen size and scrollback capacity.
   *
   * @param cols screen columns
   * @param rows screen rows
   * @param maxHistoryLines max scrollback lines to retain
   */
  public JediTermCore(int cols, int rows, int maxHistoryLines) {
    if (cols <= 0 || rows <= 0) {
      throw new IllegalArgumentException("cols/rows must be positive.");
    }
    if (maxHistoryLines <= 0) {
      throw new IllegalArgumentException("maxHistoryLines must be positive.");
    }

    this.dataStream = new Utf8TerminalDataStream();
    final StyleState styleState = new StyleState();
    this.textBuffer = new TerminalTextBuffer(cols, rows, styleState, maxHistoryLines);
    this.display = new HeadlessTerminalDisplay();
    this.terminal = new JediTerminal(display, textBuffer, styleState);
    this.emulator = new JediEmulator(dataStream, terminal);
  }

  @Override
  public void feed(byte[] data, int off, int len) {
    if (data == null) {
      throw new IllegalArgumentException("data must not be null.");
    }
    if (len <= 0) {
      return;
    }

    synchronized (lock) {
      dataStream.appendBytes(data, off, len);
      // JediEmulator latches EOF once the stream runs dry; new bytes must clear it.
      emulator.resetEof();

      int processed = 0;
      while (emulator.hasNext()) {
        try {
          emulator.next();
          processed++;
        } catch (IOException e) {
          LOGGER.debug("feed: stream exhausted after {} iterations", processed);
          break;
        } catch (RuntimeException e) {
          // A malformed sequence must not kill the read loop; the rest of the chunk is dropped.
          LOGGER.warn("feed: emulator rejected input after {} iterations: {}", processed, e.getMessage());
          break;
        }
      }
    }
  }

  @Override
  public ScrollbackView scrollback() {
    return new JediTermScrollbackView();
  }

  @Override
  public boolean alternateScreen() {
    return display.alternateScreen();
  }

  /**
   * Scrollback view over the live {@link TerminalTextBuffer}.
   */
  private final class JediTermScrollbackView implements ScrollbackView {

    @Override
    public int historyLineCount() {
      synchronized (lock) {
        return textBuffer.getHistoryLinesCount();
      }
    }

    @Override
    public int screenRowCount() {
      synchronized (lock) {
        return textBuffer.getHeight();
      }
    }

    @Override
    public List<String> readHistoryLines(int startInclusive, int endExclusive) {
      synchronized (lock) {
        return history(startInclusive, endExclusive);
      }
    }

    @Override
    public List<String> readScreenLines(int startInclusive, int endExclusive) {
      synchronized (lock) {
        return screen(startInclusive, endExclusive);
      }
    }

    @Override
    public List<String> readTail(int maxHistoryLines) {
      synchronized (lock) {
        final int count = textBuffer.getHistoryLinesCount();
        final List<String> lines = new ArrayList<>(history(Math.max(0, count - Math.max(0, maxHistoryLines)), count));
        lines.addAll(screen(0, textBuffer.getHeight()));
        return lines;
      }
    }

    private List<String> history(int startInclusive, int endExclusive) {
      final int count = textBuffer.getHistoryLinesCount();
      final List<String> result = new ArrayList<>();
      for (int index = Math.max(0, startInclusive); index < endExclusive && index < count; index++) {
        // 0..count-1 maps to buffer indices -count..-1
        result.add(plainText(textBuffer.getLine(index - count)));
      }
      return result;
    }

    private List<String> screen(int startInclusive, int endExclusive) {
      final int height = textBuffer.getHeight();
      final List<String> result = new ArrayList<>();
      for (int index = Math.max(0, startInclusive); index < endExclusive && index < height; index++) {
        result.add(plainText(textBuffer.getLine(index)));
      }
      return result;
    }
  }

  private static String plainText(TerminalLine line) {
    if (line == null || line.getEntries() == null) {
      return "";
    }
    final StringBuilder sb = new StringBuilder();
    for (TerminalLine.TextEntry e : line.getEntries()) {
      if (e == null || e.getText() == null) {
        continue;
      }
      sb.append(e.getText());
    }
    // empty cells are NUL
    int out = 0;
    for (int i = 0; i < sb.length(); i++) {
      final char c = sb.charAt(i);
      if (c == '\0') {
        sb.setCharAt(out++, ' ');
      } else if (c != DOUBLE_WIDTH_PLACEHOLDER) {
        sb.setCharAt(out++, c);
      }
    }
    sb.setLength(out);
    int n = sb.length();
    while (n > 0 && (sb.charAt(n - 1) == ' ' || sb.charAt(n - 1) == '\t')) {
      n--;
    }
    sb.setLength(n);
    return sb.toString();
  }
}
