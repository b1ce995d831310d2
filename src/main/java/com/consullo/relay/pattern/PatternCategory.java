package com.consullo.relay.pattern;

/**
 * What a matched screen line is.
 */
public enum PatternCategory {
  /** Agent UI furniture: borders, banners, hints, cost lines, echoed input. */
  UI_CHROME,
  /** Echo of a tool call the agent made, or its nested output. */
  TOOL_ECHO,
  /** Spinners, "thinking" lines, elapsed-time and token counters. */
  WORKING_INDICATOR,
  /** A question the agent is waiting on before it continues. */
  PERMISSION_PROMPT,
  /** The agent reporting a failure of its own. */
  ERROR_MARKER,
  /** The empty input prompt shown when the agent waits for input. */
  IDLE_PROMPT,
  /** Relay instructions repeated back in the answer. */
  INSTRUCTION_ECHO,
  /** Key/value or bracket fragments of machine data. */
  STRUCTURED_DATA,
  /** Filesystem paths internal to the host or the agent. */
  INTERNAL_PATH;

  /**
   * Categories whose presence in an answer means something leaked.
   *
   * @return true for leak categories
   */
  public boolean isLeak() {
    return this == INSTRUCTION_ECHO || this == STRUCTURED_DATA || this == INTERNAL_PATH;
  }
}
