package com.consullo.relay.poll;

import java.time.Duration;

/**
 * @param state how the wait ended
 * @param capture last capture taken
 * @param polls captures taken
 * @param elapsed time spent waiting
 */
public record PollResult(PollState state, String capture, int polls, Duration elapsed) {
}
