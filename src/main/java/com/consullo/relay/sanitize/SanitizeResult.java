package com.consullo.relay.sanitize;

import java.util.List;

/**
 * Outcome of sanitizing one candidate answer.
 *
 * @param text cleaned text, possibly empty
 * @param leakDetected whether any leak rule fired (and the aggressive pass ran)
 * @param leakRules names of the leak rules that fired, in first-seen order
 * @param garbage whether leaked lines dominated the candidate
 */
public record SanitizeResult(String text, boolean leakDetected, List<String> leakRules, boolean garbage) {

  public SanitizeResult {
    text = text == null ? "" : text;
    leakRules = leakRules == null ? List.of() : List.copyOf(leakRules);
  }

  /** Nothing user-facing survived sanitization. */
  public boolean isEmpty() {
    return text.isBlank();
  }

  /** Whether this answer should be treated as an empty response. */
  public boolean unusable() {
    return isEmpty() || garbage;
  }
}
