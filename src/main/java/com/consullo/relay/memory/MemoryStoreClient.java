package com.consullo.relay.memory;

import com.consullo.relay.turn.CaptureRecord;

/**
 * Remote long-term memory: receives completed exchanges and serves context for new requests.
 */
public interface MemoryStoreClient {

  /** Client for a relay running without a memory store. */
  MemoryStoreClient DISABLED = new MemoryStoreClient() {
    @Override
    public void forward(CaptureRecord record) {
      // nothing to forward to
    }

    @Override
    public String fetchContext(String query) {
      return "";
    }

    @Override
    public boolean isEnabled() {
      return false;
    }
  };

  /**
   * Sends one completed exchange.
   *
   * @param record finished turn
   * @throws MemoryStoreException if the store did not accept it
   */
  void forward(CaptureRecord record) throws MemoryStoreException;

  /**
   * @param query text of the incoming request
   * @return context relevant to {@code query}, possibly empty
   * @throws MemoryStoreException if the store could not answer
   */
  String fetchContext(String query) throws MemoryStoreException;

  default boolean isEnabled() {
    return true;
  }
}
