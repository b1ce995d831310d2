package com.consullo.relay.poll;

import java.time.Duration;

/**
 * Pause between polls. Swapped out in tests to run the loop without real time passing.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
