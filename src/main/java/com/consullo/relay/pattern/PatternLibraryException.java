package com.consullo.relay.pattern;

/**
 * Raised when a pattern table cannot be read or contains an invalid rule.
 */
public class PatternLibraryException extends RuntimeException {

  public PatternLibraryException(String message) {
    super(message);
  }

  public PatternLibraryException(String message, Throwable cause) {
    super(message, cause);
  }
}
