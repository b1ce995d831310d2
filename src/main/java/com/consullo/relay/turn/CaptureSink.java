package com.consullo.relay.turn;

/**
 * Receives finished turns for recording and forwarding. Must not block the caller.
 */
@FunctionalInterface
public interface CaptureSink {

  CaptureSink DISCARD = record -> {
  };

  void submit(CaptureRecord record);
}
