package com.consullo.relay.pattern;

import java.util.regex.Pattern;

/**
 * One row of the pattern table.
 *
 * @param name stable identifier, reported when the rule fires
 * @param category what a matching line is
 * @param pattern compiled expression, applied with {@code find()}
 */
public record PatternRule(String name, PatternCategory category, Pattern pattern) {

  public PatternRule {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank.");
    }
    if (category == null || pattern == null) {
      throw new IllegalArgumentException("category/pattern must not be null.");
    }
  }

  public boolean matches(CharSequence line) {
    return pattern.matcher(line).find();
  }
}
