package com.consullo.relay.turn;

/**
 * Who asked for a turn.
 */
public enum RequesterKind {
  CONVERSATIONAL,
  SCHEDULED_JOB
}
