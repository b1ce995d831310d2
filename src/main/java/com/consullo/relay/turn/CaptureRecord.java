package com.consullo.relay.turn;

import java.time.Instant;

/**
 * A finalized turn with its raw captures, as persisted and forwarded.
 *
 * @param turnId unique turn identifier
 * @param kind requester kind
 * @param contextId requester context
 * @param destination answer destination
 * @param requestText what the requester asked
 * @param submittedText what was typed into the session (inline prompt or artifact pointer)
 * @param captureBefore screen before submitting
 * @param captureAfter screen when the wait ended
 * @param extractedText candidate answer before sanitizing
 * @param sanitizedText answer delivered to the requester
 * @param finalState final turn state
 * @param leakDetected whether the sanitizer ran its aggressive pass
 * @param startedAt when the arbiter accepted the turn
 * @param endedAt when the turn was finalized
 */
public record CaptureRecord(
    String turnId,
    RequesterKind kind,
    String contextId,
    String destination,
    String requestText,
    String submittedText,
    String captureBefore,
    String captureAfter,
    String extractedText,
    String sanitizedText,
    TurnState finalState,
    boolean leakDetected,
    Instant startedAt,
    Instant endedAt) {
}
