package com.consullo.relay.config;

/**
 * Configuration could not be read or is invalid.
 */
public class RelayConfigException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RelayConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
