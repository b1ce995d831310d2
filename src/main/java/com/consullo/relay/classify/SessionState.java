package com.consullo.relay.classify;

/**
 * What the agent is doing, judged from one capture.
 */
public enum SessionState {
  IDLE,
  WORKING,
  PERMISSION_REQUESTED,
  ERROR,
  /** Nothing recognizable; treated as not yet complete. */
  UNKNOWN
}
