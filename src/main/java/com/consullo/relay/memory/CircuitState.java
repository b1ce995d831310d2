package com.consullo.relay.memory;

/**
 * Breaker states.
 */
public enum CircuitState {
  /** Calls flow. */
  CLOSED,
  /** Calls are refused until the cooldown passes. */
  OPEN,
  /** One trial call decides between closing and reopening. */
  HALF_OPEN
}
