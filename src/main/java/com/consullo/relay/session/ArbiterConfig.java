package com.consullo.relay.session;

/**
 * @param sessionName name of the session, for logs
 * @param turnTimeoutMillis default wait for a conversational turn
 * @param jobTimeoutMillis default wait for a scheduled job
 * @param resetTimeoutMillis wait for the context reset to settle
 * @param acquireTimeoutMillis how long a request waits for the session before it is BUSY
 * @param maxHoldMillis longest a turn may hold the session; longer waits are cut to fit
 * @param resetCommand input that clears the agent's conversation
 * @param retryEmptyResponse resubmit once when sanitizing leaves nothing
 */
public record ArbiterConfig(
    String sessionName,
    long turnTimeoutMillis,
    long jobTimeoutMillis,
    long resetTimeoutMillis,
    long acquireTimeoutMillis,
    long maxHoldMillis,
    String resetCommand,
    boolean retryEmptyResponse) {

  public ArbiterConfig {
    if (sessionName == null || sessionName.isBlank()) {
      sessionName = "main";
    }
    if (resetCommand == null || resetCommand.isBlank()) {
      resetCommand = "/clear";
    }
    if (turnTimeoutMillis <= 0 || jobTimeoutMillis <= 0 || resetTimeoutMillis <= 0 || maxHoldMillis <= 0) {
      throw new IllegalArgumentException("timeouts must be positive.");
    }
    if (acquireTimeoutMillis < 0) {
      throw new IllegalArgumentException("acquireTimeoutMillis must not be negative.");
    }
  }
}
