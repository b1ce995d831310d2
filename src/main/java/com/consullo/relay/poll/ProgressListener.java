package com.consullo.relay.poll;

import java.time.Duration;

/**
 * Receives interim notifications while a long turn is still running.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = elapsed -> {
  };

  /**
   * Called from the polling thread; must return quickly.
   *
   * @param elapsed time since the submission
   */
  void onProgress(Duration elapsed);
}
