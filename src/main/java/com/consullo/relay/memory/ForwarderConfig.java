package com.consullo.relay.memory;

/**
 * @param retryIntervalMillis pause between retry queue drains, and the base of the backoff
 * @param maxAttempts forwarding attempts before an entry is dropped
 * @param batchSize entries handled per drain
 * @param maxBackoffMillis upper bound of the exponential backoff
 * @param retentionSweepMillis pause between retention sweeps of the local store
 */
public record ForwarderConfig(
    long retryIntervalMillis,
    int maxAttempts,
    int batchSize,
    long maxBackoffMillis,
    long retentionSweepMillis) {

  public ForwarderConfig {
    if (retryIntervalMillis <= 0 || maxBackoffMillis < retryIntervalMillis || retentionSweepMillis <= 0) {
      throw new IllegalArgumentException("forwarder intervals must be positive and maxBackoffMillis >= retryIntervalMillis.");
    }
    if (maxAttempts < 1 || batchSize < 1) {
      throw new IllegalArgumentException("maxAttempts and batchSize must be at least 1.");
    }
  }
}
