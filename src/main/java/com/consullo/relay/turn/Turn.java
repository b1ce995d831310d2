package com.consullo.relay.turn;

import java.time.Instant;
import org.apache.commons.lang3.Validate;

/**
 * One request/response cycle through the session, owned by the arbiter while it runs.
 *
 * <p>Fields fill in as the turn progresses. {@link #finish} sets the final state exactly once; after
 * that the turn is read-only and can be turned into a {@link CaptureRecord}.
 */
public final class Turn {

  private final String id;
  private final TurnRequest request;
  private final Instant startedAt;

  private String submittedText = "";
  private String captureBefore = "";
  private String captureAfter = "";
  private String extractedText = "";
  private String sanitizedText = "";
  private boolean leakDetected;

  private TurnState finalState;
  private Instant endedAt;
  private String detail = "";

  private Turn(String id, TurnRequest request, Instant startedAt) {
    this.id = id;
    this.request = request;
    this.startedAt = startedAt;
  }

  public static Turn begin(String id, TurnRequest request, Instant startedAt) {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(request, "request must not be null");
    Validate.notNull(startedAt, "startedAt must not be null");
    return new Turn(id, request, startedAt);
  }

  public synchronized void submitted(String text, String before) {
    requireOpen();
    this.submittedText = nullToEmpty(text);
    this.captureBefore = nullToEmpty(before);
  }

  public synchronized void observed(String after) {
    requireOpen();
    this.captureAfter = nullToEmpty(after);
  }

  public synchronized void extracted(String candidate, String sanitized, boolean leak) {
    requireOpen();
    this.extractedText = nullToEmpty(candidate);
    this.sanitizedText = nullToEmpty(sanitized);
    this.leakDetected = leak;
  }

  /**
   * Finalizes the turn.
   *
   * @param state final state
   * @param at end timestamp
   * @param reason human-readable detail, may be null
   * @throws IllegalStateException if the turn was already finalized
   */
  public synchronized void finish(TurnState state, Instant at, String reason) {
    Validate.notNull(state, "state must not be null");
    Validate.notNull(at, "at must not be null");
    requireOpen();
    this.finalState = state;
    this.endedAt = at;
    this.detail = nullToEmpty(reason);
  }

  public synchronized boolean isFinished() {
    return finalState != null;
  }

  public String id() {
    return id;
  }

  public TurnRequest request() {
    return request;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public synchronized TurnState finalState() {
    return finalState;
  }

  public synchronized Instant endedAt() {
    return endedAt;
  }

  public synchronized String detail() {
    return detail;
  }

  public synchronized String sanitizedText() {
    return sanitizedText;
  }

  public synchronized boolean leakDetected() {
    return leakDetected;
  }

  public synchronized CaptureRecord toRecord() {
    if (finalState == null) {
      throw new IllegalStateException("Turn " + id + " is not finished.");
    }
    return new CaptureRecord(id, request.kind(), request.contextId(), request.destination(), request.text(),
        submittedText, captureBefore, captureAfter, extractedText, sanitizedText, finalState, leakDetected,
        startedAt, endedAt);
  }

  private void requireOpen() {
    if (finalState != null) {
      throw new IllegalStateException("Turn " + id + " already finished as " + finalState + ".");
    }
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
