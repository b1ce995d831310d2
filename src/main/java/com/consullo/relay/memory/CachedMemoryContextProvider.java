package com.consullo.relay.memory;

import com.consullo.relay.compose.MemoryContextProvider;
import com.consullo.relay.store.CaptureStoreException;
import com.consullo.relay.store.ContextCache;
import java.time.Duration;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memory context with a local cache in front of the store.
 *
 * <p>A cache entry younger than the TTL is served without a call. Otherwise the store is asked
 * (through its own breaker, separate from the one gating forwards); when it cannot answer, the last cached context of any age is used, and
 * failing that the empty string. A turn is never failed for want of memory.
 */
public final class CachedMemoryContextProvider implements MemoryContextProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachedMemoryContextProvider.class);

  private final MemoryStoreClient client;
  private final CircuitBreaker breaker;
  private final ContextCache cache;
  private final Duration ttl;

  public CachedMemoryContextProvider(MemoryStoreClient client, CircuitBreaker breaker, ContextCache cache, Duration ttl) {
    Validate.notNull(client, "client must not be null");
    Validate.notNull(breaker, "breaker must not be null");
    Validate.notNull(cache, "cache must not be null");
    Validate.notNull(ttl, "ttl must not be null");
    this.client = client;
    this.breaker = breaker;
    this.cache = cache;
    this.ttl = ttl;
  }

  @Override
  public String fetchContext(String query) {
    if (!client.isEnabled()) {
      return "";
    }
    final Optional<String> fresh = cachedFresh(query);
    if (fresh.isPresent()) {
      return fresh.get();
    }
    if (breaker.allow()) {
      try {
        final String context = client.fetchContext(query);
        breaker.recordSuccess();
        remember(query, context);
        return context;
      } catch (MemoryStoreException e) {
        breaker.recordFailure();
        LOGGER.warn("Memory context unavailable: {}", e.getMessage());
      }
    } else {
      LOGGER.debug("Memory circuit open, skipping context fetch");
    }
    return cachedAny(query).orElse("");
  }

  private Optional<String> cachedFresh(String query) {
    try {
      return cache.fresh(query, ttl);
    } catch (CaptureStoreException e) {
      LOGGER.warn("Context cache read failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<String> cachedAny(String query) {
    try {
      return cache.any(query);
    } catch (CaptureStoreException e) {
      LOGGER.warn("Context cache read failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private void remember(String query, String context) {
    try {
      cache.put(query, context);
    } catch (CaptureStoreException e) {
      LOGGER.warn("Context cache write failed: {}", e.getMessage());
    }
  }
}
