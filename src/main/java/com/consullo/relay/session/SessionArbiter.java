package com.consullo.relay.session;

import com.consullo.relay.compose.ContextComposer;
import com.consullo.relay.compose.ConversationBuffers;
import com.consullo.relay.compose.Exchange;
import com.consullo.relay.compose.MemoryContextProvider;
import com.consullo.relay.compose.Submission;
import com.consullo.relay.core.SessionTerminal;
import com.consullo.relay.extract.ResponseExtractor;
import com.consullo.relay.poll.PollResult;
import com.consullo.relay.poll.PollState;
import com.consullo.relay.poll.Poller;
import com.consullo.relay.poll.ProgressListener;
import com.consullo.relay.sanitize.SanitizeResult;
import com.consullo.relay.sanitize.Sanitizer;
import com.consullo.relay.turn.CaptureSink;
import com.consullo.relay.turn.RequesterKind;
import com.consullo.relay.turn.Turn;
import com.consullo.relay.turn.TurnRequest;
import com.consullo.relay.turn.TurnResult;
import com.consullo.relay.turn.TurnState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point to the interactive session for chat turns and scheduled jobs.
 *
 * <p>{@link #runTurn(TurnRequest)} takes the {@link SessionLock} (or answers BUSY), resets the agent's
 * conversation when the request belongs to another context than the loaded one, then composes,
 * submits, polls, extracts and sanitizes. The lease is closed before the finished turn is handed to
 * the {@link CaptureSink}, so recording and forwarding never hold up the next turn.
 *
 * <p>Outcomes are values. Whatever happens inside a turn, including runtime exceptions and
 * interruption, the lock is released exactly once and a {@link TurnResult} is returned.
 *
 * <p>Every wait inside a turn ends no later than the lease reaching the lock's maximum hold time. A turn that
 * is still running then anyway (stuck outside a wait) is interrupted by the next waiter and ends
 * ERRORED before that waiter gets the session.
 *
 * @since 1.0
 */
public final class SessionArbiter implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionArbiter.class);

  private final ArbiterConfig config;
  private final SessionTerminal terminal;
  private final Poller poller;
  private final ResponseExtractor extractor;
  private final Sanitizer sanitizer;
  private final ContextComposer composer;
  private final ConversationBuffers buffers;
  private final MemoryContextProvider memory;
  private final CaptureSink captureSink;
  private final Clock clock;
  private final SessionLock lock;
  private final SessionHandle handle;

  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicReference<Thread> inFlight = new AtomicReference<>();

  private SessionArbiter(Builder b) {
    this.config = b.config;
    this.terminal = b.terminal;
    this.poller = b.poller;
    this.extractor = b.extractor;
    this.sanitizer = b.sanitizer;
    this.composer = b.composer;
    this.buffers = b.buffers;
    this.memory = b.memory;
    this.captureSink = b.captureSink;
    this.clock = b.clock;
    this.lock = b.lock;
    this.handle = b.handle;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one turn on the session.
   *
   * @param request the request
   * @return outcome, delivered text and timing
   */
  public TurnResult runTurn(TurnRequest request) {
    Validate.notNull(request, "request must not be null");
    final String turnId = UUID.randomUUID().toString();
    final String holder = request.kind() + ":" + request.contextId();

    if (closed.get()) {
      return refused(turnId, request, "shutting down");
    }
    if (request.exemptFromQuietHours()) {
      LOGGER.debug("Turn {} is exempt from quiet hours", turnId);
    }

    final Optional<SessionLock.Lease> acquired;
    try {
      acquired = lock.tryAcquire(holder, Duration.ofMillis(config.acquireTimeoutMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return refused(turnId, request, "interrupted while waiting for the session");
    }
    if (acquired.isEmpty()) {
      final String current = lock.holder().orElse("another turn");
      LOGGER.info("Turn {} for {} refused, session busy with {}", turnId, holder, current);
      return TurnResult.busy(turnId, clock.instant(), current);
    }

    final Turn turn = Turn.begin(turnId, request, clock.instant());
    LOGGER.info("Turn {} accepted for {} ({} chars)", turnId, holder, request.text().length());
    final SessionLock.Lease lease = acquired.get();
    inFlight.set(Thread.currentThread());
    try {
      if (closed.get()) {
        turn.finish(TurnState.ERRORED, clock.instant(), "shutting down");
      } else if (!terminal.isAlive()) {
        handle.invalidate();
        LOGGER.error("Turn {} cannot run, the agent process is not running", turnId);
        turn.finish(TurnState.ERRORED, clock.instant(), "agent process not running");
      } else {
        execute(turn, lease.acquiredAt().plus(lock.maxHold()));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Turn {} interrupted", turnId);
      abort(turn, interruptionReason(lease));
    } catch (RuntimeException e) {
      LOGGER.error("Turn {} failed: {}", turnId, e.getMessage(), e);
      abort(turn, e.getClass().getSimpleName() + ": " + e.getMessage());
    } finally {
      handle.touch(clock.instant());
      inFlight.compareAndSet(Thread.currentThread(), null);
      lease.close();
    }

    record(turn);
    final TurnResult result = TurnResult.of(turn);
    LOGGER.info("Turn {} finished {} after {} ms", turnId, result.outcome(),
        Duration.between(result.startedAt(), result.endedAt()).toMillis());
    return result;
  }

  private void execute(Turn turn, Instant deadline) throws InterruptedException {
    final TurnRequest request = turn.request();
    if (handle.needsReset(request.contextId()) && !resetContext(turn, deadline)) {
      return;
    }

    final boolean conversational = request.kind() == RequesterKind.CONVERSATIONAL;
    final String memoryContext = conversational ? memory.fetchContext(request.text()) : "";
    final List<Exchange> recent = conversational ? buffers.snapshot(request.contextId()) : List.of();
    final Duration timeout = timeoutFor(request);
    final int attempts = config.retryEmptyResponse() ? 2 : 1;

    for (int attempt = 1; attempt <= attempts; attempt++) {
      final Submission submission = composer.compose(memoryContext, recent, request);
      try {
        final String before = poller.submit(submission.line());
        turn.submitted(submission.line(), before);
        final PollResult poll = poller.waitForCompletion(before, within(timeout, deadline), request.progress());
        turn.observed(poll.capture());

        if (poll.state() != PollState.COMPLETED) {
          finishUnsettled(turn, poll, before, submission);
          return;
        }

        final String candidate = extractor.extract(before, poll.capture(), submission.sentinel());
        final SanitizeResult clean = sanitizer.sanitize(candidate);
        turn.extracted(candidate, clean.text(), clean.leakDetected());
        handle.markLoaded(request.contextId(), clock.instant());

        if (!clean.unusable()) {
          if (conversational) {
            buffers.record(request.contextId(), new Exchange(request.text(), clean.text(), clock.instant()));
          }
          turn.finish(TurnState.COMPLETED, clock.instant(), null);
          return;
        }
        if (attempt < attempts) {
          LOGGER.info("Turn {} produced no usable text{}, resubmitting once", turn.id(),
              clean.garbage() ? " (only leaked context)" : "");
        } else {
          turn.finish(TurnState.EMPTY_RESPONSE, clock.instant(),
              clean.garbage() ? "response consisted of leaked context" : "response was empty after cleaning");
        }
      } finally {
        composer.discard(submission);
      }
    }
  }

  private void finishUnsettled(Turn turn, PollResult poll, String before, Submission submission) {
    switch (poll.state()) {
      case PERMISSION_REQUESTED:
        // the dialog stays up; the next turn's reset dismisses it
        handle.invalidate();
        turn.finish(TurnState.PERMISSION_BLOCKED, clock.instant(), "agent is waiting for a permission decision");
        break;
      case TIMED_OUT:
        final String candidate = extractor.extract(before, poll.capture(), submission.sentinel());
        final SanitizeResult partial = sanitizer.sanitize(candidate);
        turn.extracted(candidate, partial.text(), partial.leakDetected());
        handle.invalidate();
        LOGGER.warn("Turn {} timed out after {} polls", turn.id(), poll.polls());
        turn.finish(TurnState.TIMED_OUT, clock.instant(), "no stable idle state within " + poll.elapsed().toMillis() + " ms");
        break;
      case ERROR:
      default:
        handle.invalidate();
        LOGGER.warn("Turn {} ended on an agent error", turn.id());
        turn.finish(TurnState.ERRORED, clock.instant(), "agent reported an error");
        break;
    }
  }

  /**
   * Clears the agent's conversation so that the new context does not see the previous one.
   *
   * @return true if the session settled idle again in time
   */
  private boolean resetContext(Turn turn, Instant deadline) throws InterruptedException {
    final String contextId = turn.request().contextId();
    LOGGER.info("Turn {} resetting session context ({} -> {})", turn.id(),
        handle.loadedContextId().orElse("none"), contextId);
    terminal.sendInterrupt();
    poller.submit(config.resetCommand());
    // the screen after a reset may look exactly like before, so no change is required
    final PollResult reset = poller.waitForCompletion(null,
        within(Duration.ofMillis(config.resetTimeoutMillis()), deadline), ProgressListener.NONE);
    if (reset.state() == PollState.COMPLETED) {
      buffers.clear(contextId);
      handle.markLoaded(contextId, clock.instant());
      return true;
    }
    handle.invalidate();
    turn.observed(reset.capture());
    LOGGER.warn("Turn {} context reset ended {}", turn.id(), reset.state());
    turn.finish(TurnState.CONTEXT_RESET_FAILED, clock.instant(), "context reset ended " + reset.state());
    return false;
  }

  private Duration timeoutFor(TurnRequest request) {
    if (request.timeout() != null) {
      return request.timeout();
    }
    return Duration.ofMillis(request.kind() == RequesterKind.SCHEDULED_JOB
        ? config.jobTimeoutMillis()
        : config.turnTimeoutMillis());
  }

  /**
   * Shortens {@code requested} so that the wait ends by {@code deadline}, the lease's maximum hold.
   */
  private Duration within(Duration requested, Instant deadline) {
    final Duration left = Duration.between(clock.instant(), deadline);
    if (left.compareTo(requested) >= 0) {
      return requested;
    }
    final Duration bounded = left.isNegative() ? Duration.ZERO : left;
    LOGGER.warn("Wait of {} ms cut to {} ms by the session's maximum hold", requested.toMillis(), bounded.toMillis());
    return bounded;
  }

  private String interruptionReason(SessionLock.Lease lease) {
    if (closed.get()) {
      return "shutting down";
    }
    if (lease.isReclaimed()) {
      return "held the session past its maximum hold of " + lock.maxHold().toMillis() + " ms";
    }
    return "interrupted";
  }

  private void abort(Turn turn, String reason) {
    handle.invalidate();
    if (!turn.isFinished()) {
      turn.finish(TurnState.ERRORED, clock.instant(), reason);
    }
  }

  private TurnResult refused(String turnId, TurnRequest request, String reason) {
    final Turn turn = Turn.begin(turnId, request, clock.instant());
    turn.finish(TurnState.ERRORED, clock.instant(), reason);
    LOGGER.info("Turn {} refused: {}", turnId, reason);
    return TurnResult.of(turn);
  }

  private void record(Turn turn) {
    try {
      captureSink.submit(turn.toRecord());
    } catch (RuntimeException e) {
      LOGGER.error("Turn {} could not be handed to capture: {}", turn.id(), e.getMessage(), e);
    }
  }

  public SessionHandle handle() {
    return handle;
  }

  public SessionLock lock() {
    return lock;
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Refuses new turns and interrupts the one in flight, which then ends ERRORED and releases the lock. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    final Thread running = inFlight.get();
    if (running != null) {
      LOGGER.info("Interrupting in-flight turn on {}", running.getName());
      running.interrupt();
    }
  }

  public static final class Builder {

    private ArbiterConfig config;
    private SessionTerminal terminal;
    private Poller poller;
    private ResponseExtractor extractor;
    private Sanitizer sanitizer;
    private ContextComposer composer;
    private ConversationBuffers buffers;
    private MemoryContextProvider memory = MemoryContextProvider.NONE;
    private CaptureSink captureSink = CaptureSink.DISCARD;
    private Clock clock = Clock.systemUTC();
    private SessionLock lock;
    private SessionHandle handle;

    private Builder() {
    }

    public Builder config(ArbiterConfig config) {
      this.config = config;
      return this;
    }

    public Builder terminal(SessionTerminal terminal) {
      this.terminal = terminal;
      return this;
    }

    public Builder poller(Poller poller) {
      this.poller = poller;
      return this;
    }

    public Builder extractor(ResponseExtractor extractor) {
      this.extractor = extractor;
      return this;
    }

    public Builder sanitizer(Sanitizer sanitizer) {
      this.sanitizer = sanitizer;
      return this;
    }

    public Builder composer(ContextComposer composer) {
      this.composer = composer;
      return this;
    }

    public Builder buffers(ConversationBuffers buffers) {
      this.buffers = buffers;
      return this;
    }

    public Builder memory(MemoryContextProvider memory) {
      this.memory = memory;
      return this;
    }

    public Builder captureSink(CaptureSink captureSink) {
      this.captureSink = captureSink;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder lock(SessionLock lock) {
      this.lock = lock;
      return this;
    }

    public Builder handle(SessionHandle handle) {
      this.handle = handle;
      return this;
    }

    public SessionArbiter build() {
      Validate.notNull(config, "config must not be null");
      Validate.notNull(terminal, "terminal must not be null");
      Validate.notNull(poller, "poller must not be null");
      Validate.notNull(extractor, "extractor must not be null");
      Validate.notNull(sanitizer, "sanitizer must not be null");
      Validate.notNull(composer, "composer must not be null");
      Validate.notNull(buffers, "buffers must not be null");
      Validate.notNull(memory, "memory must not be null");
      Validate.notNull(captureSink, "captureSink must not be null");
      Validate.notNull(clock, "clock must not be null");
      if (lock == null) {
        lock = new SessionLock(Duration.ofMillis(config.maxHoldMillis()), clock);
      }
      if (handle == null) {
        handle = new SessionHandle(config.sessionName());
      }
      return new SessionArbiter(this);
    }
  }
}
