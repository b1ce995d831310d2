package com.consullo.relay.core;

import java.util.regex.Pattern;

/**
 * Removes terminal control sequences from text.
 *
 * <p>Captures taken from the emulator are already rendered, but text that reaches the relay some other
 * way (logs, raw PTY dumps, tests) may still carry CSI/OSC sequences, carriage returns and other C0
 * controls. Tabs and line feeds survive.
 *
 * @since 1.0
 */
public final class ControlSequences {

  private static final Pattern CSI = Pattern.compile("\u001B\\[[0-?]*[ -/]*[@-~]");
  private static final Pattern OSC = Pattern.compile("\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)");
  private static final Pattern ESC_OTHER = Pattern.compile("\u001B[@-Z\\\\-_]?");
  private static final Pattern CONTROL = Pattern.compile("[\u0000-\u0008\u000B-\u001F\u007F]");

  private ControlSequences() {
  }

  /**
   * Strips escape sequences and control characters; CRLF and lone CR become LF.
   *
   * @param text raw text, may be null
   * @return plain text, never null
   */
  public static String strip(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String s = OSC.matcher(text).replaceAll("");
    s = CSI.matcher(s).replaceAll("");
    s = ESC_OTHER.matcher(s).replaceAll("");
    s = s.replace("\r\n", "\n").replace('\r', '\n');
    return CONTROL.matcher(s).replaceAll("");
  }
}
