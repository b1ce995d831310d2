package com.consullo.relay.memory;

/**
 * @param failureThreshold consecutive failures that open the breaker
 * @param cooldownMillis time the breaker stays open before allowing a trial
 */
public record CircuitBreakerConfig(int failureThreshold, long cooldownMillis) {

  public CircuitBreakerConfig {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be at least 1.");
    }
    if (cooldownMillis <= 0) {
      throw new IllegalArgumentException("cooldownMillis must be positive.");
    }
  }
}
