package com.consullo.relay.poll;

/**
 * Poll loop tuning.
 *
 * @param intervalMillis pause between captures
 * @param stabilityThreshold identical consecutive captures required for completion
 * @param tailLines non-blank bottom lines the classifier looks at
 * @param progressDelayMillis elapsed time before the first progress notification
 * @param progressIntervalMillis time between later progress notifications
 */
public record PollerConfig(
    long intervalMillis,
    int stabilityThreshold,
    int tailLines,
    long progressDelayMillis,
    long progressIntervalMillis) {

  public PollerConfig {
    if (intervalMillis <= 0) {
      throw new IllegalArgumentException("intervalMillis must be positive.");
    }
    if (stabilityThreshold < 1) {
      throw new IllegalArgumentException("stabilityThreshold must be at least 1.");
    }
    if (tailLines < 1) {
      throw new IllegalArgumentException("tailLines must be at least 1.");
    }
    if (progressDelayMillis <= 0 || progressIntervalMillis <= 0) {
      throw new IllegalArgumentException("progress timings must be positive.");
    }
  }
}
