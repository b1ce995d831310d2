package com.consullo.relay.memory;

/**
 * @param enabled false runs the relay record-only
 * @param baseUrl memory store root URL, e.g. {@code http://localhost:37777}
 * @param project project name passed with context queries
 * @param source source tag attached to forwarded exchanges
 * @param timeoutMillis bound on one HTTP call
 */
public record MemoryStoreConfig(boolean enabled, String baseUrl, String project, String source, long timeoutMillis) {

  public MemoryStoreConfig {
    if (enabled && (baseUrl == null || baseUrl.isBlank())) {
      throw new IllegalArgumentException("baseUrl is required when the memory store is enabled.");
    }
    if (timeoutMillis <= 0) {
      throw new IllegalArgumentException("timeoutMillis must be positive.");
    }
    project = project == null ? "" : project;
    source = source == null || source.isBlank() ? "relay" : source;
  }
}
