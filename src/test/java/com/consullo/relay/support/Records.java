package com.consullo.relay.support;

import com.consullo.relay.turn.CaptureRecord;
import com.consullo.relay.turn.RequesterKind;
import com.consullo.relay.turn.TurnState;
import java.time.Instant;

/**
 * Capture records for store and forwarder tests.
 */
public final class Records {

  private Records() {
  }

  public static CaptureRecord record(String turnId, TurnState state, Instant endedAt) {
    return new CaptureRecord(turnId, RequesterKind.CONVERSATIONAL, "general", "#general",
        "what is the time?", "what is the time? [ref:0a1b2c3d]", "> ", "> what is the time?\nIt is noon.\n> ",
        "It is noon.", "It is noon.", state, false, endedAt.minusSeconds(5), endedAt);
  }

  public static CaptureRecord completed(String turnId, Instant endedAt) {
    return record(turnId, TurnState.COMPLETED, endedAt);
  }
}
