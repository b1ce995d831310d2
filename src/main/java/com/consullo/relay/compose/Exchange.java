package com.consullo.relay.compose;

import java.time.Instant;

/**
 * One request and the answer it got.
 *
 * @param request what the user said
 * @param response what the agent answered
 * @param at when the answer was delivered
 */
public record Exchange(String request, String response, Instant at) {
}
