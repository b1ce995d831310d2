package com.consullo.relay.session;

import java.time.Instant;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * The interactive session as the arbiter sees it: which working context is loaded and when it was
 * last used. One instance per running agent process.
 */
public final class SessionHandle {

  private final String name;
  private String loadedContextId;
  private Instant lastActivity;

  public SessionHandle(String name) {
    Validate.notBlank(name, "name must not be blank");
    this.name = name;
  }

  public String name() {
    return name;
  }

  /**
   * Whether {@code contextId} differs from the loaded one. A fresh or invalidated session always
   * needs a reset.
   */
  public synchronized boolean needsReset(String contextId) {
    return loadedContextId == null || !loadedContextId.equals(contextId);
  }

  public synchronized void markLoaded(String contextId, Instant at) {
    this.loadedContextId = contextId;
    this.lastActivity = at;
  }

  public synchronized void touch(Instant at) {
    this.lastActivity = at;
  }

  /** Forgets the loaded context so that the next turn resets the session first. */
  public synchronized void invalidate() {
    this.loadedContextId = null;
  }

  public synchronized Optional<String> loadedContextId() {
    return Optional.ofNullable(loadedContextId);
  }

  public synchronized Optional<Instant> lastActivity() {
    return Optional.ofNullable(lastActivity);
  }
}
