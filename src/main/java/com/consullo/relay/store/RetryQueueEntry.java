package com.consullo.relay.store;

import java.time.Instant;

/**
 * A recorded turn waiting to be forwarded to the memory store.
 *
 * @param turnId turn of the waiting {@code CaptureRecord}
 * @param attempts forward attempts made so far; never decreases
 * @param nextAttemptAt earliest time of the next attempt
 * @param lastError message of the last failure, null if never attempted
 * @param enqueuedAt when the entry was created
 */
public record RetryQueueEntry(String turnId, int attempts, Instant nextAttemptAt, String lastError, Instant enqueuedAt) {
}
