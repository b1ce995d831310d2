package com.consullo.relay.runtime;

import com.consullo.relay.classify.StateClassifier;
import com.consullo.relay.compose.ContextArtifactStore;
import com.consullo.relay.compose.ContextComposer;
import com.consullo.relay.compose.ConversationBuffers;
import com.consullo.relay.config.RelayConfig;
import com.consullo.relay.core.SessionTerminal;
import com.consullo.relay.driver.AgentSession;
import com.consullo.relay.driver.AgentSessionFactory;
import com.consullo.relay.extract.ResponseExtractor;
import com.consullo.relay.memory.CachedMemoryContextProvider;
import com.consullo.relay.memory.CircuitBreaker;
import com.consullo.relay.memory.HttpMemoryStoreClient;
import com.consullo.relay.memory.MemoryForwarder;
import com.consullo.relay.memory.MemoryStoreClient;
import com.consullo.relay.pattern.PatternLibrary;
import com.consullo.relay.poll.Poller;
import com.consullo.relay.poll.Sleeper;
import com.consullo.relay.sanitize.Sanitizer;
import com.consullo.relay.session.SessionArbiter;
import com.consullo.relay.store.CaptureStore;
import com.consullo.relay.store.ContextCache;
import com.consullo.relay.store.RetryQueue;
import com.consullo.relay.store.SqliteDatabase;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The relay wired together from a {@link RelayConfig}.
 *
 * <p>{@link #start(RelayConfig)} launches the agent and the background forwarder;
 * {@link #assemble} builds the same graph around a session supplied by the caller.
 *
 * @since 1.0
 */
public final class RelayRuntime implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelayRuntime.class);

  private final SessionArbiter arbiter;
  private final MemoryForwarder forwarder;
  private final CircuitBreaker breaker;
  private final CircuitBreaker contextBreaker;
  private final CaptureStore captureStore;
  private final RetryQueue retryQueue;
  private final AutoCloseable session;

  private RelayRuntime(SessionArbiter arbiter, MemoryForwarder forwarder, CircuitBreaker breaker,
      CircuitBreaker contextBreaker, CaptureStore captureStore, RetryQueue retryQueue, AutoCloseable session) {
    this.arbiter = arbiter;
    this.forwarder = forwarder;
    this.breaker = breaker;
    this.contextBreaker = contextBreaker;
    this.captureStore = captureStore;
    this.retryQueue = retryQueue;
    this.session = session;
  }

  /**
   * Launches the agent CLI and everything around it.
   *
   * @param config configuration
   * @return running relay
   */
  public static RelayRuntime start(RelayConfig config) {
    final PatternLibrary patterns = PatternLibrary.loadDefault();
    final MemoryStoreClient client = config.memory().enabled()
        ? new HttpMemoryStoreClient(config.memory())
        : MemoryStoreClient.DISABLED;
    final AgentSession session = AgentSessionFactory.start(config.session());
    final RelayRuntime runtime = assemble(config, patterns, session, session, client, Sleeper.SYSTEM, Clock.systemUTC());
    runtime.forwarder.start();
    LOGGER.info("Relay started on {} (memory store {})", config.session().command(),
        client.isEnabled() ? config.memory().baseUrl() : "disabled");
    return runtime;
  }

  /**
   * Builds the relay around {@code terminal}. The forwarder is not started.
   *
   * @param config configuration
   * @param patterns pattern table
   * @param terminal the interactive session
   * @param sessionCloser closed with the runtime, may be null
   * @param client memory store client
   * @param sleeper poll pause
   * @param clock time source
   * @return assembled relay
   */
  public static RelayRuntime assemble(RelayConfig config, PatternLibrary patterns, SessionTerminal terminal,
      AutoCloseable sessionCloser, MemoryStoreClient client, Sleeper sleeper, Clock clock) {
    final SqliteDatabase database = SqliteDatabase.open(Path.of(config.store().databasePath()));
    final CaptureStore captureStore = new CaptureStore(database, config.store(), clock);
    final RetryQueue retryQueue = new RetryQueue(database, clock);
    final ContextCache contextCache = new ContextCache(database, clock);
    final CircuitBreaker breaker = new CircuitBreaker("memory-store", config.breaker(), clock);
    // context reads must not trip the forwarding breaker or take its half-open trial
    final CircuitBreaker contextBreaker = new CircuitBreaker("memory-context", config.breaker(), clock);

    final Duration cacheTtl = Duration.ofMillis(config.store().contextCacheTtlMillis());
    final MemoryForwarder forwarder = new MemoryForwarder(captureStore, retryQueue, contextCache, client, breaker,
        config.forwarder(), Duration.ofMillis(config.store().maxAgeMillis()), clock);

    final Path artifactDirectory = StringUtils.isBlank(config.compose().artifactDirectory())
        ? AgentSessionFactory.workingDirectory(config.session())
        : Path.of(config.compose().artifactDirectory());

    final SessionArbiter arbiter = SessionArbiter.builder()
        .config(config.arbiter())
        .terminal(terminal)
        .poller(new Poller(terminal, new StateClassifier(patterns, config.poll().tailLines()), config.poll(), sleeper,
            clock))
        .extractor(new ResponseExtractor(patterns))
        .sanitizer(new Sanitizer(patterns))
        .composer(new ContextComposer(config.compose(), new ContextArtifactStore(artifactDirectory), clock))
        .buffers(new ConversationBuffers(config.compose().bufferCapacity()))
        .memory(new CachedMemoryContextProvider(client, contextBreaker, contextCache, cacheTtl))
        .captureSink(forwarder)
        .clock(clock)
        .build();
    return new RelayRuntime(arbiter, forwarder, breaker, contextBreaker, captureStore, retryQueue, sessionCloser);
  }

  public SessionArbiter arbiter() {
    return arbiter;
  }

  public MemoryForwarder forwarder() {
    return forwarder;
  }

  /** Breaker gating forwards to the memory store. */
  public CircuitBreaker breaker() {
    return breaker;
  }

  /** Breaker gating memory context reads. */
  public CircuitBreaker contextBreaker() {
    return contextBreaker;
  }

  public CaptureStore captureStore() {
    return captureStore;
  }

  public RetryQueue retryQueue() {
    return retryQueue;
  }

  @Override
  public void close() throws Exception {
    arbiter.close();
    forwarder.close();
    if (session != null) {
      session.close();
    }
    LOGGER.info("Relay stopped");
  }
}
