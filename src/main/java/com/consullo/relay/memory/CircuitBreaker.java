package com.consullo.relay.memory;

import java.time.Clock;
import java.time.Instant;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards calls to the memory store.
 *
 * <p>CLOSED allows calls; {@code failureThreshold} consecutive failures open it. OPEN refuses calls
 * until the cooldown has passed, then the next {@link #allow()} moves to HALF_OPEN and lets exactly
 * one trial through. The trial's success closes the breaker; its failure reopens it with a fresh
 * cooldown. No other transitions exist.
 *
 * <p>All state lives under this object's monitor.
 *
 * @since 1.0
 */
public final class CircuitBreaker {

  private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreaker.class);

  private final String name;
  private final CircuitBreakerConfig config;
  private final Clock clock;

  private CircuitState state = CircuitState.CLOSED;
  private int consecutiveFailures;
  private Instant openedAt;
  private int trialsRemaining;

  private long totalSuccesses;
  private long totalFailures;
  private long timesOpened;

  public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.name = name;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Whether a call may be made now. In HALF_OPEN each trial is handed out once.
   *
   * @return true to proceed with the call
   */
  public synchronized boolean allow() {
    switch (state) {
      case CLOSED:
        return true;
      case OPEN:
        if (clock.instant().isBefore(openedAt.plusMillis(config.cooldownMillis()))) {
          return false;
        }
        state = CircuitState.HALF_OPEN;
        trialsRemaining = 1;
        LOGGER.info("Circuit {} half-open, allowing a trial call", name);
        return takeTrial();
      case HALF_OPEN:
      default:
        return takeTrial();
    }
  }

  public synchronized void recordSuccess() {
    totalSuccesses++;
    consecutiveFailures = 0;
    if (state == CircuitState.HALF_OPEN) {
      state = CircuitState.CLOSED;
      openedAt = null;
      LOGGER.info("Circuit {} closed after successful trial", name);
    }
  }

  public synchronized void recordFailure() {
    totalFailures++;
    consecutiveFailures++;
    if (state == CircuitState.HALF_OPEN) {
      open("trial failed");
    } else if (state == CircuitState.CLOSED && consecutiveFailures >= config.failureThreshold()) {
      open(consecutiveFailures + " consecutive failures");
    }
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized CircuitStats stats() {
    return new CircuitStats(state, consecutiveFailures, totalSuccesses, totalFailures, timesOpened, openedAt);
  }

  /** Opens the breaker by hand, e.g. while the memory store is known to be down for maintenance. */
  public synchronized void forceOpen() {
    open("forced");
  }

  public synchronized void forceClose() {
    state = CircuitState.CLOSED;
    consecutiveFailures = 0;
    openedAt = null;
    LOGGER.info("Circuit {} forced closed", name);
  }

  private boolean takeTrial() {
    if (trialsRemaining > 0) {
      trialsRemaining--;
      return true;
    }
    return false;
  }

  private void open(String reason) {
    state = CircuitState.OPEN;
    openedAt = clock.instant();
    trialsRemaining = 0;
    timesOpened++;
    LOGGER.warn("Circuit {} opened ({}), cooling down for {} ms", name, reason, config.cooldownMillis());
  }
}
