package com.consullo.relay.turn;

/**
 * Final state of a {@link Turn}. Set exactly once.
 */
public enum TurnState {
  COMPLETED,
  TIMED_OUT,
  PERMISSION_BLOCKED,
  /** Sanitization left nothing usable, also after the automatic retry. */
  EMPTY_RESPONSE,
  /** The agent could not be moved to the request's context; nothing was submitted. */
  CONTEXT_RESET_FAILED,
  /** The relay itself failed. */
  ERRORED
}
