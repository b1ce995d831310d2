package com.consullo.relay.compose;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Bounded, ordered history of exchanges; the oldest is discarded past capacity.
 */
public final class RecentExchangeBuffer {

  private final int capacity;
  private final Deque<Exchange> exchanges;

  public RecentExchangeBuffer(int capacity) {
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.capacity = capacity;
    this.exchanges = new ArrayDeque<>(capacity);
  }

  public synchronized void add(Exchange exchange) {
    Validate.notNull(exchange, "exchange must not be null");
    if (exchanges.size() == capacity) {
      exchanges.removeFirst();
    }
    exchanges.addLast(exchange);
  }

  /** Oldest first. */
  public synchronized List<Exchange> snapshot() {
    return List.copyOf(exchanges);
  }

  public synchronized int size() {
    return exchanges.size();
  }

  public synchronized void clear() {
    exchanges.clear();
  }
}
