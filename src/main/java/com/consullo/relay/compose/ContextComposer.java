package com.consullo.relay.compose;

import com.consullo.relay.extract.Sentinel;
import com.consullo.relay.turn.RequesterKind;
import com.consullo.relay.turn.TurnRequest;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds what is submitted for a turn.
 *
 * <p>The full prompt is a markdown document: a header naming the channel or job, the current time,
 * then memory context, recent conversation and the current message, each under its own heading
 * (empty sections are left out). That document goes to a side artifact and the session receives a
 * one-line pointer to it. A request with no memory and no history, short and on one line, is typed
 * directly instead. Every submitted line ends with a fresh sentinel.
 *
 * @since 1.0
 */
public final class ContextComposer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContextComposer.class);

  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy 'at' HH:mm (zzz)", Locale.ENGLISH);

  private final ComposerConfig config;
  private final ContextArtifactStore artifacts;
  private final Clock clock;
  private final Supplier<Sentinel> sentinels;

  public ContextComposer(ComposerConfig config, ContextArtifactStore artifacts, Clock clock, Supplier<Sentinel> sentinels) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(artifacts, "artifacts must not be null");
    Validate.notNull(clock, "clock must not be null");
    Validate.notNull(sentinels, "sentinels must not be null");
    this.config = config;
    this.artifacts = artifacts;
    this.clock = clock;
    this.sentinels = sentinels;
  }

  public ContextComposer(ComposerConfig config, ContextArtifactStore artifacts, Clock clock) {
    this(config, artifacts, clock, Sentinel::generate);
  }

  /**
   * Composes the submission for {@code request}.
   *
   * @param memoryContext long-term memory context, may be empty or null
   * @param recent recent exchanges of the request's context, oldest first
   * @param request the turn request
   * @return submission to type into the session
   */
  public Submission compose(String memoryContext, List<Exchange> recent, TurnRequest request) {
    Validate.notNull(request, "request must not be null");
    final Sentinel sentinel = sentinels.get();
    final String memory = StringUtils.trimToEmpty(memoryContext);
    final List<Exchange> history = recent == null ? List.of() : recent;
    final String text = request.text().strip();

    final boolean singleLine = StringUtils.containsNone(text, '\r', '\n');
    if (memory.isEmpty() && history.isEmpty() && singleLine
        && text.length() + sentinel.token().length() + 1 <= config.inlineThreshold()) {
      return new Submission(inlineLine(text, sentinel), sentinel, null, text.length());
    }

    final String document = document(memory, history, request, text);
    try {
      final Path artifact = artifacts.write(document);
      final String pointer = "Read " + artifact + " and respond to the Current Message section. " + sentinel;
      return new Submission(pointer, sentinel, artifact, document.length());
    } catch (IOException e) {
      LOGGER.warn("Context artifact could not be written ({}), submitting the request inline without context",
          e.getMessage());
      return new Submission(inlineLine(flatten(text), sentinel), sentinel, null, document.length());
    }
  }

  /** Releases the artifact of a finished submission. */
  public void discard(Submission submission) {
    submission.artifactPath().ifPresent(artifacts::delete);
  }

  String document(String memory, List<Exchange> history, TurnRequest request, String text) {
    final StringBuilder sb = new StringBuilder(256 + memory.length() + text.length());
    if (request.kind() == RequesterKind.SCHEDULED_JOB) {
      sb.append("# Scheduled Job\n")
          .append("**Job:** ").append(request.contextId()).append('\n')
          .append("**Output:** ").append(request.destination()).append("\n\n");
    } else {
      sb.append("# Channel Context\n")
          .append("**Active channel:** ").append(request.destination()).append('\n')
          .append("You are responding to a message in THIS channel only. ")
          .append("Do NOT reference conversations or context from other channels.\n\n");
    }

    sb.append("## Current Time\n")
        .append(ZonedDateTime.now(clock.withZone(ZoneId.of(config.zoneId()))).format(TIME_FORMAT))
        .append("\n\n");

    if (!memory.isEmpty()) {
      sb.append("## Memory Context\n").append(memory).append("\n\n");
    }
    if (!history.isEmpty()) {
      sb.append("## Recent Conversation\n");
      for (Exchange exchange : history) {
        sb.append("**User:** ").append(truncate(exchange.request())).append('\n');
        sb.append("**Assistant:** ").append(truncate(exchange.response())).append("\n\n");
      }
    }
    sb.append("## Current Message\n").append(text).append('\n');
    return sb.toString();
  }

  private String truncate(String s) {
    final String t = StringUtils.defaultString(s).strip();
    return t.length() <= config.entryTruncation() ? t : t.substring(0, config.entryTruncation()) + "...";
  }

  private static String inlineLine(String text, Sentinel sentinel) {
    return text.isEmpty() ? sentinel.token() : text + " " + sentinel;
  }

  private static String flatten(String text) {
    return text.replaceAll("\\s*\\R\\s*", " ");
  }
}
