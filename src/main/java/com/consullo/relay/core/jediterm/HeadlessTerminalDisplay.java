package com.consullo.relay.core.jediterm;

import com.jediterm.core.Color;
import com.jediterm.core.util.TermSize;
import com.jediterm.terminal.CursorShape;
import com.jediterm.terminal.RequestOrigin;
import com.jediterm.terminal.TerminalDisplay;
import com.jediterm.terminal.emulator.mouse.MouseFormat;
import com.jediterm.terminal.emulator.mouse.MouseMode;
import com.jediterm.terminal.model.TerminalSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Display callbacks for a terminal nobody looks at.
 *
 * <p>Drawing is irrelevant to the relay. What is kept are the mode switches the agent UI makes, since
 * they explain odd captures: the alternate screen changes how a capture is assembled, and bracketed
 * paste, mouse reporting and the window title are traced at DEBUG when they change.
 */
final class HeadlessTerminalDisplay implements TerminalDisplay {

  private static final Logger LOGGER = LoggerFactory.getLogger(HeadlessTerminalDisplay.class);

  private volatile boolean alternateScreen;
  private volatile boolean bracketedPaste;
  private volatile MouseMode mouseMode;
  private volatile String windowTitle = "";

  boolean alternateScreen() {
    return alternateScreen;
  }

  @Override
  public void useAlternateScreenBuffer(boolean enabled) {
    if (alternateScreen != enabled) {
      LOGGER.debug("Alternate screen {}", enabled ? "on" : "off");
    }
    this.alternateScreen = enabled;
  }

  @Override
  public void setBracketedPasteMode(boolean enabled) {
    if (bracketedPaste != enabled) {
      LOGGER.debug("Bracketed paste {}", enabled ? "on" : "off");
    }
    this.bracketedPaste = enabled;
  }

  @Override
  public void terminalMouseModeSet(MouseMode mode) {
    if (mode != mouseMode) {
      LOGGER.debug("Mouse reporting {}", mode);
    }
    this.mouseMode = mode;
  }

  @Override
  public String getWindowTitle() {
    return windowTitle;
  }

  @Override
  public void setWindowTitle(String title) {
    final String next = title != null ? title : "";
    if (!next.equals(windowTitle)) {
      LOGGER.debug("Window title '{}'", next);
    }
    this.windowTitle = next;
  }

  // Rendering only; the screen buffer already holds everything a capture reads.

  @Override
  public void setCursor(int x, int y) {
  }

  @Override
  public void setCursorShape(CursorShape cursorShape) {
  }

  @Override
  public void setCursorVisible(boolean visible) {
  }

  @Override
  public void beep() {
  }

  @Override
  public void onResize(TermSize termSize, RequestOrigin origin) {
  }

  @Override
  public void scrollArea(int scrollRegionTop, int scrollRegionSize, int dy) {
  }

  @Override
  public void setMouseFormat(MouseFormat format) {
  }

  @Override
  public TerminalSelection getSelection() {
    return null;
  }

  @Override
  public boolean ambiguousCharsAreDoubleWidth() {
    return false;
  }

  @Override
  public Color getWindowForeground() {
    return null;
  }

  @Override
  public Color getWindowBackground() {
    return null;
  }
}
