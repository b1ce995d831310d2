package com.consullo.relay.core;

import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * {@link ScreenCapture} over a {@link TerminalCore}: a bounded tail of scrollback plus the screen.
 *
 * <p>Including some history keeps a long answer visible in one capture even after its first lines
 * scrolled off. While the alternate screen is active there is no meaningful history, so only the
 * screen is returned.
 *
 * @since 1.0
 */
public final class ScrollbackScreenCapture implements ScreenCapture {

  private final TerminalCore core;
  private final int historyTail;

  public ScrollbackScreenCapture(final TerminalCore core, final int historyTail) {
    Validate.notNull(core, "core must not be null");
    Validate.isTrue(historyTail >= 0, "historyTail must not be negative");
    this.core = core;
    this.historyTail = historyTail;
  }

  @Override
  public String capture() {
    final int tail = core.alternateScreen() ? 0 : historyTail;
    final List<String> lines = core.scrollback().readTail(tail);

    int end = lines.size();
    while (end > 0 && lines.get(end - 1).isBlank()) {
      end--;
    }
    return String.join("\n", lines.subList(0, end));
  }
}
