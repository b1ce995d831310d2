package com.consullo.relay.memory;

import java.time.Instant;

/**
 * Point-in-time view of a {@link CircuitBreaker}.
 *
 * @param state current state
 * @param consecutiveFailures failures since the last success
 * @param totalSuccesses successes recorded since start
 * @param totalFailures failures recorded since start
 * @param timesOpened transitions into {@link CircuitState#OPEN}
 * @param openedAt when the breaker last opened, null if never
 */
public record CircuitStats(
    CircuitState state,
    int consecutiveFailures,
    long totalSuccesses,
    long totalFailures,
    long timesOpened,
    Instant openedAt) {
}
