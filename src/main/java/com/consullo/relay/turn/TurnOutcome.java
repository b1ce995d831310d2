package com.consullo.relay.turn;

/**
 * What a caller of {@code runTurn} gets back.
 */
public enum TurnOutcome {
  /** The session is in use by another turn; nothing was attempted. */
  BUSY,
  COMPLETED,
  TIMED_OUT,
  PERMISSION_REQUESTED,
  EMPTY_RESPONSE,
  CONTEXT_RESET_FAILED,
  ERRORED;

  static TurnOutcome of(TurnState state) {
    switch (state) {
      case COMPLETED:
        return COMPLETED;
      case TIMED_OUT:
        return TIMED_OUT;
      case PERMISSION_BLOCKED:
        return PERMISSION_REQUESTED;
      case EMPTY_RESPONSE:
        return EMPTY_RESPONSE;
      case CONTEXT_RESET_FAILED:
        return CONTEXT_RESET_FAILED;
      default:
        return ERRORED;
    }
  }
}
