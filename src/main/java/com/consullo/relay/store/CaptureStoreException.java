package com.consullo.relay.store;

/**
 * Failure of the local capture database.
 */
public class CaptureStoreException extends RuntimeException {

  public CaptureStoreException(String message) {
    super(message);
  }

  public CaptureStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
