package com.consullo.relay.memory;

import com.consullo.relay.store.CaptureStore;
import com.consullo.relay.store.CaptureStoreException;
import com.consullo.relay.store.ContextCache;
import com.consullo.relay.store.RetryQueue;
import com.consullo.relay.store.RetryQueueEntry;
import com.consullo.relay.turn.CaptureRecord;
import com.consullo.relay.turn.CaptureSink;
import com.consullo.relay.turn.TurnState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records finished turns locally and forwards completed ones to the memory store.
 *
 * <p>The local append always happens first, so a capture survives any memory store outage. Only
 * {@link TurnState#COMPLETED} turns are forwarded. A failed forward, or one refused by the open
 * breaker, goes to the durable retry queue, which a background task drains with exponential backoff.
 * An entry that has used up its attempts is dropped from the queue; its capture record stays.
 *
 * <p>{@link #submit(CaptureRecord)} hands the work to a single background thread and returns at once.
 *
 * @since 1.0
 */
public final class MemoryForwarder implements CaptureSink, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(MemoryForwarder.class);

  private final CaptureStore captureStore;
  private final RetryQueue retryQueue;
  private final ContextCache contextCache;
  private final MemoryStoreClient client;
  private final CircuitBreaker breaker;
  private final ForwarderConfig config;
  private final Duration contextCacheMaxAge;
  private final Clock clock;
  private final ScheduledExecutorService executor;

  public MemoryForwarder(
      CaptureStore captureStore,
      RetryQueue retryQueue,
      ContextCache contextCache,
      MemoryStoreClient client,
      CircuitBreaker breaker,
      ForwarderConfig config,
      Duration contextCacheMaxAge,
      Clock clock) {
    Validate.notNull(captureStore, "captureStore must not be null");
    Validate.notNull(retryQueue, "retryQueue must not be null");
    Validate.notNull(contextCache, "contextCache must not be null");
    Validate.notNull(client, "client must not be null");
    Validate.notNull(breaker, "breaker must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(contextCacheMaxAge, "contextCacheMaxAge must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.captureStore = captureStore;
    this.retryQueue = retryQueue;
    this.contextCache = contextCache;
    this.client = client;
    this.breaker = breaker;
    this.config = config;
    this.contextCacheMaxAge = contextCacheMaxAge;
    this.clock = clock;
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread t = new Thread(r, "MemoryForwarder");
      t.setDaemon(true);
      return t;
    });
  }

  /** Schedules the retry drain and the retention sweep. */
  public void start() {
    executor.scheduleWithFixedDelay(this::drainSafely, config.retryIntervalMillis(), config.retryIntervalMillis(),
        TimeUnit.MILLISECONDS);
    executor.scheduleWithFixedDelay(this::sweepSafely, config.retentionSweepMillis(), config.retentionSweepMillis(),
        TimeUnit.MILLISECONDS);
    LOGGER.info("Memory forwarder started (store {}, retry every {} ms)",
        client.isEnabled() ? "enabled" : "disabled", config.retryIntervalMillis());
  }

  @Override
  public void submit(CaptureRecord record) {
    Validate.notNull(record, "record must not be null");
    try {
      executor.execute(() -> recordSafely(record));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Forwarder closed, recording turn {} on the caller thread", record.turnId());
      recordSafely(record);
    }
  }

  /**
   * Appends {@code record} and forwards it if it completed. Runs on the calling thread.
   *
   * @param record finished turn
   */
  void record(CaptureRecord record) {
    captureStore.append(record);
    if (!client.isEnabled() || record.finalState() != TurnState.COMPLETED) {
      return;
    }
    if (!breaker.allow()) {
      retryQueue.enqueue(record.turnId(), 0, clock.instant().plusMillis(config.retryIntervalMillis()), "circuit open");
      LOGGER.info("Memory circuit open, queued turn {}", record.turnId());
      return;
    }
    try {
      forward(record);
      breaker.recordSuccess();
    } catch (MemoryStoreException e) {
      breaker.recordFailure();
      retryQueue.enqueue(record.turnId(), 1, clock.instant().plus(backoff(1)), e.getMessage());
      LOGGER.warn("Forwarding turn {} failed, queued for retry: {}", record.turnId(), e.getMessage());
    }
  }

  /**
   * Retries due queue entries once.
   *
   * @return entries forwarded successfully
   */
  int drainOnce() {
    if (!client.isEnabled()) {
      return 0;
    }
    final List<RetryQueueEntry> due = retryQueue.due(clock.instant(), config.batchSize());
    int forwarded = 0;
    for (RetryQueueEntry entry : due) {
      if (!breaker.allow()) {
        LOGGER.debug("Memory circuit open, postponing {} queued turns", due.size() - forwarded);
        break;
      }
      final Optional<CaptureRecord> record = captureStore.find(entry.turnId());
      if (record.isEmpty()) {
        LOGGER.warn("Queued turn {} has no capture record, dropping it", entry.turnId());
        retryQueue.remove(entry.turnId());
        continue;
      }
      try {
        forward(record.get());
        breaker.recordSuccess();
        retryQueue.remove(entry.turnId());
        forwarded++;
      } catch (MemoryStoreException e) {
        breaker.recordFailure();
        failed(entry, e.getMessage());
      }
    }
    if (forwarded > 0) {
      LOGGER.info("Forwarded {} queued turns", forwarded);
    }
    return forwarded;
  }

  private void failed(RetryQueueEntry entry, String error) {
    final int attempts = entry.attempts() + 1;
    final Optional<RetryQueueEntry> updated =
        retryQueue.recordFailure(entry.turnId(), error, clock.instant().plus(backoff(attempts)));
    if (updated.isPresent() && updated.get().attempts() >= config.maxAttempts()) {
      retryQueue.remove(entry.turnId());
      LOGGER.warn("Giving up forwarding turn {} after {} attempts: {}", entry.turnId(), updated.get().attempts(), error);
    }
  }

  Duration backoff(int attempts) {
    final int exponent = Math.min(Math.max(attempts - 1, 0), 20);
    final long millis = Math.min(config.retryIntervalMillis() << exponent, config.maxBackoffMillis());
    return Duration.ofMillis(millis);
  }

  // A client bug counts as a failed forward, so the turn is queued rather than lost.
  private void forward(CaptureRecord record) throws MemoryStoreException {
    try {
      client.forward(record);
    } catch (RuntimeException e) {
      LOGGER.error("Memory store client failed on turn {}", record.turnId(), e);
      throw new MemoryStoreException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }
  }

  private void recordSafely(CaptureRecord record) {
    try {
      record(record);
    } catch (RuntimeException e) {
      final boolean queued = requeue(record);
      LOGGER.error("Cannot record turn {}{}: {}", record.turnId(), queued ? ", queued for retry" : "",
          e.getMessage(), e);
    }
  }

  /**
   * Queues a completed turn whose capture reached the store but whose forwarding step failed.
   *
   * @return true if the turn is now in the retry queue
   */
  private boolean requeue(CaptureRecord record) {
    if (!client.isEnabled() || record.finalState() != TurnState.COMPLETED) {
      return false;
    }
    try {
      if (captureStore.find(record.turnId()).isEmpty()) {
        return false;
      }
      retryQueue.enqueue(record.turnId(), 0, clock.instant().plusMillis(config.retryIntervalMillis()),
          "recording failed");
      return retryQueue.find(record.turnId()).isPresent();
    } catch (CaptureStoreException e) {
      LOGGER.warn("Cannot queue turn {}: {}", record.turnId(), e.getMessage());
      return false;
    }
  }

  private void drainSafely() {
    try {
      drainOnce();
    } catch (RuntimeException e) {
      // an exception escaping would cancel the schedule
      LOGGER.error("Retry drain failed: {}", e.getMessage(), e);
    }
  }

  private void sweepSafely() {
    try {
      captureStore.enforceRetention();
      contextCache.purge(contextCacheMaxAge);
    } catch (RuntimeException e) {
      LOGGER.error("Retention sweep failed: {}", e.getMessage(), e);
    }
  }

  /** Finishes queued submissions, then stops the background thread. */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Memory forwarder did not finish pending work in time");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
