package com.consullo.relay.turn;

import com.consullo.relay.poll.ProgressListener;
import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * A request for one turn on the session.
 *
 * @param kind conversational or scheduled job
 * @param contextId working context of the requester (chat channel, job name); a different context
 *     than the one loaded forces a reset first
 * @param destination where the answer goes (channel or job output), used in the prompt header
 * @param text the request itself
 * @param exemptFromQuietHours scheduler flag, carried for the caller's benefit only
 * @param timeout turn timeout override, null for the configured default
 * @param progress interim notification sink, null for none
 */
public record TurnRequest(
    RequesterKind kind,
    String contextId,
    String destination,
    String text,
    boolean exemptFromQuietHours,
    Duration timeout,
    ProgressListener progress) {

  public TurnRequest {
    Validate.notNull(kind, "kind must not be null");
    Validate.notBlank(contextId, "contextId must not be blank");
    Validate.notNull(text, "text must not be null");
    destination = destination == null ? contextId : destination;
    progress = progress == null ? ProgressListener.NONE : progress;
  }

  public static TurnRequest conversational(String contextId, String destination, String text) {
    return new TurnRequest(RequesterKind.CONVERSATIONAL, contextId, destination, text, false, null, null);
  }

  public static TurnRequest scheduledJob(String jobId, String destination, String text, boolean exemptFromQuietHours) {
    return new TurnRequest(RequesterKind.SCHEDULED_JOB, jobId, destination, text, exemptFromQuietHours, null, null);
  }

  public TurnRequest withTimeout(Duration newTimeout) {
    return new TurnRequest(kind, contextId, destination, text, exemptFromQuietHours, newTimeout, progress);
  }

  public TurnRequest withProgress(ProgressListener listener) {
    return new TurnRequest(kind, contextId, destination, text, exemptFromQuietHours, timeout, listener);
  }
}
