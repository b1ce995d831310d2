package com.consullo.relay.classify;

import com.consullo.relay.core.ControlSequences;
import com.consullo.relay.pattern.PatternCategory;
import com.consullo.relay.pattern.PatternLibrary;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Classifies a capture into a {@link SessionState}.
 *
 * <p>Only the bottom of the capture is considered: the last {@code tailLines} non-blank lines. Earlier
 * scrollback holds prompts and spinners of turns that are long over.
 *
 * <p>Priority, highest first: permission prompt, error marker, idle prompt, working indicator. Idle
 * requires the empty prompt to be the last meaningful line (only chrome below it) and no working
 * indicator anywhere in the window, because the agent keeps drawing its input box while it works.
 *
 * @since 1.0
 */
public final class StateClassifier {

  private final PatternLibrary patterns;
  private final int tailLines;

  public StateClassifier(PatternLibrary patterns, int tailLines) {
    Validate.notNull(patterns, "patterns must not be null");
    Validate.isTrue(tailLines > 0, "tailLines must be positive");
    this.patterns = patterns;
    this.tailLines = tailLines;
  }

  public SessionState classify(String capture) {
    final List<String> tail = tail(ControlSequences.strip(capture));
    if (tail.isEmpty()) {
      return SessionState.UNKNOWN;
    }

    if (anyMatch(tail, PatternCategory.PERMISSION_PROMPT)) {
      return SessionState.PERMISSION_REQUESTED;
    }
    if (anyMatch(tail, PatternCategory.ERROR_MARKER)) {
      return SessionState.ERROR;
    }
    final boolean working = anyMatch(tail, PatternCategory.WORKING_INDICATOR);
    if (!working && endsWithIdlePrompt(tail)) {
      return SessionState.IDLE;
    }
    return working ? SessionState.WORKING : SessionState.UNKNOWN;
  }

  private boolean endsWithIdlePrompt(List<String> tail) {
    for (int i = tail.size() - 1; i >= 0; i--) {
      final String line = tail.get(i);
      if (patterns.matches(PatternCategory.IDLE_PROMPT, line)) {
        return true;
      }
      if (!patterns.matches(PatternCategory.UI_CHROME, line)) {
        return false;
      }
    }
    return false;
  }

  private boolean anyMatch(List<String> lines, PatternCategory category) {
    for (String line : lines) {
      if (patterns.matches(category, line)) {
        return true;
      }
    }
    return false;
  }

  private List<String> tail(String capture) {
    final String[] lines = capture.split("\n", -1);
    final List<String> out = new ArrayList<>(tailLines);
    for (int i = lines.length - 1; i >= 0 && out.size() < tailLines; i--) {
      if (!lines[i].isBlank()) {
        out.add(0, lines[i]);
      }
    }
    return out;
  }
}
