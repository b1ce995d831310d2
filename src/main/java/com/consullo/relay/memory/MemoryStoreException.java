package com.consullo.relay.memory;

/**
 * The memory store could not be reached or rejected a call.
 */
public class MemoryStoreException extends Exception {

  private static final long serialVersionUID = 1L;

  public MemoryStoreException(String message) {
    super(message);
  }

  public MemoryStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
