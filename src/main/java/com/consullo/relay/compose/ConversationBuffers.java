package com.consullo.relay.compose;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.Validate;

/**
 * One {@link RecentExchangeBuffer} per conversational context, so channels never see each other's
 * history.
 */
public final class ConversationBuffers {

  private final int capacity;
  private final Map<String, RecentExchangeBuffer> buffers = new ConcurrentHashMap<>();

  public ConversationBuffers(int capacity) {
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.capacity = capacity;
  }

  public List<Exchange> snapshot(String contextId) {
    final RecentExchangeBuffer buffer = buffers.get(contextId);
    return buffer == null ? List.of() : buffer.snapshot();
  }

  public void record(String contextId, Exchange exchange) {
    buffers.computeIfAbsent(contextId, id -> new RecentExchangeBuffer(capacity)).add(exchange);
  }

  public void clear(String contextId) {
    buffers.remove(contextId);
  }
}
