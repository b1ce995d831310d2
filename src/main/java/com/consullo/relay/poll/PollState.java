package com.consullo.relay.poll;

/**
 * How a wait on the session ended.
 */
public enum PollState {
  /** Idle and stable. */
  COMPLETED,
  /** The agent asks for confirmation; returned on first sight. */
  PERMISSION_REQUESTED,
  /** The agent reports an error and the screen stopped changing. */
  ERROR,
  TIMED_OUT
}
