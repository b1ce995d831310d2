package com.consullo.relay.turn;

import java.time.Instant;

/**
 * Answer to a {@code runTurn} call.
 *
 * @param turnId turn identifier
 * @param outcome what happened
 * @param text answer to deliver; partial on timeout, empty otherwise when not completed
 * @param leakDetected whether leaked content was removed from {@code text}
 * @param detail short reason for non-completed outcomes
 * @param startedAt when the turn was accepted
 * @param endedAt when it ended
 */
public record TurnResult(
    String turnId,
    TurnOutcome outcome,
    String text,
    boolean leakDetected,
    String detail,
    Instant startedAt,
    Instant endedAt) {

  public static TurnResult busy(String turnId, Instant at, String holder) {
    return new TurnResult(turnId, TurnOutcome.BUSY, "", false, "session busy with " + holder, at, at);
  }

  public static TurnResult of(Turn turn) {
    return new TurnResult(turn.id(), TurnOutcome.of(turn.finalState()), turn.sanitizedText(), turn.leakDetected(),
        turn.detail(), turn.startedAt(), turn.endedAt());
  }

  public boolean completed() {
    return outcome == TurnOutcome.COMPLETED;
  }
}
