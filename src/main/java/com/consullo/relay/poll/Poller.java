package com.consullo.relay.poll;

import com.consullo.relay.classify.SessionState;
import com.consullo.relay.classify.StateClassifier;
import com.consullo.relay.core.SessionTerminal;
import java.time.Clock;
import java.time.Duration;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits input to the session and waits for the agent to finish.
 *
 * <p>Each poll takes a capture and classifies it. Stability is the number of consecutive identical
 * captures, the first one counting as 1. The wait completes when stability reaches the threshold, the
 * state is {@link SessionState#IDLE} and the screen differs from the one seen before submitting (an
 * agent that has not reacted yet also looks idle and stable). A permission prompt ends the wait at
 * once. An error marker ends it once stable, because the agent retries some failures on its own.
 *
 * <p>The loop's only suspension point is {@link Sleeper#sleep(Duration)}; interrupting the polling
 * thread ends the wait with {@link InterruptedException}.
 *
 * @since 1.0
 */
public final class Poller {

  private static final Logger LOGGER = LoggerFactory.getLogger(Poller.class);

  private final SessionTerminal terminal;
  private final StateClassifier classifier;
  private final PollerConfig config;
  private final Sleeper sleeper;
  private final Clock clock;

  public Poller(SessionTerminal terminal, StateClassifier classifier, PollerConfig config, Sleeper sleeper, Clock clock) {
    Validate.notNull(terminal, "terminal must not be null");
    Validate.notNull(classifier, "classifier must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(sleeper, "sleeper must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.terminal = terminal;
    this.classifier = classifier;
    this.config = config;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  /**
   * Types {@code prompt} into the session.
   *
   * @param prompt single-line input
   * @return the capture taken just before submitting
   * @throws InterruptedException if interrupted while submitting
   */
  public String submit(String prompt) throws InterruptedException {
    final String before = terminal.capture();
    terminal.submitLine(prompt);
    LOGGER.debug("Submitted {} chars", prompt.length());
    return before;
  }

  /**
   * Polls at the configured interval.
   *
   * @see #waitForCompletion(String, Duration, Duration, ProgressListener)
   */
  public PollResult waitForCompletion(String before, Duration timeout, ProgressListener progress)
      throws InterruptedException {
    return waitForCompletion(before, timeout, Duration.ofMillis(config.intervalMillis()), progress);
  }

  /**
   * Polls until the agent is idle and stable, asks for permission, reports an error or the timeout
   * passes.
   *
   * @param before capture taken before submitting, null if unknown
   * @param timeout overall bound on the wait
   * @param pollInterval pause between captures
   * @param progress receives interim notifications on long waits
   * @return final state and the last capture
   * @throws InterruptedException if the polling thread is interrupted
   */
  public PollResult waitForCompletion(String before, Duration timeout, Duration pollInterval, ProgressListener progress)
      throws InterruptedException {
    Validate.notNull(timeout, "timeout must not be null");
    Validate.notNull(pollInterval, "pollInterval must not be null");
    final ProgressListener listener = progress == null ? ProgressListener.NONE : progress;

    final long start = clock.millis();
    long nextProgressAt = start + config.progressDelayMillis();
    String previous = null;
    String current = "";
    int stable = 0;
    int polls = 0;

    while (true) {
      sleeper.sleep(pollInterval);
      polls++;
      current = terminal.capture();
      stable = current.equals(previous) ? stable + 1 : 1;
      previous = current;

      final SessionState state = classifier.classify(current);
      LOGGER.debug("poll {}: state={} stable={}", polls, state, stable);

      if (state == SessionState.PERMISSION_REQUESTED) {
        return result(PollState.PERMISSION_REQUESTED, current, polls, start);
      }
      final boolean reacted = before == null || !current.equals(before);
      if (stable >= config.stabilityThreshold() && reacted) {
        if (state == SessionState.IDLE) {
          return result(PollState.COMPLETED, current, polls, start);
        }
        if (state == SessionState.ERROR) {
          return result(PollState.ERROR, current, polls, start);
        }
      }

      final long now = clock.millis();
      if (now - start >= timeout.toMillis()) {
        LOGGER.info("No stable idle state after {} polls ({} ms), last state {}", polls, now - start, state);
        return result(PollState.TIMED_OUT, current, polls, start);
      }
      if (now >= nextProgressAt) {
        nextProgressAt += config.progressIntervalMillis();
        notifyProgress(listener, Duration.ofMillis(now - start));
      }
    }
  }

  private static void notifyProgress(ProgressListener listener, Duration elapsed) {
    try {
      listener.onProgress(elapsed);
    } catch (RuntimeException e) {
      LOGGER.warn("Progress listener failed: {}", e.getMessage(), e);
    }
  }

  private PollResult result(PollState state, String capture, int polls, long start) {
    return new PollResult(state, capture, polls, Duration.ofMillis(clock.millis() - start));
  }
}
