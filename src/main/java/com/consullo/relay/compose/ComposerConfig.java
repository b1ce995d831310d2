package com.consullo.relay.compose;

/**
 * Prompt composition settings.
 *
 * @param inlineThreshold largest single-line submission typed directly into the session
 * @param bufferCapacity exchanges kept per conversational context
 * @param entryTruncation characters kept from each buffered request or response
 * @param artifactDirectory where context artifacts go, blank for the agent working directory
 * @param zoneId time zone of the current-time section
 */
public record ComposerConfig(
    int inlineThreshold,
    int bufferCapacity,
    int entryTruncation,
    String artifactDirectory,
    String zoneId) {

  public ComposerConfig {
    if (inlineThreshold <= 0 || bufferCapacity <= 0 || entryTruncation <= 0) {
      throw new IllegalArgumentException("inlineThreshold/bufferCapacity/entryTruncation must be positive.");
    }
    zoneId = zoneId == null || zoneId.isBlank() ? "UTC" : zoneId;
  }
}
