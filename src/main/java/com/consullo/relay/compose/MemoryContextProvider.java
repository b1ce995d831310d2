package com.consullo.relay.compose;

/**
 * Source of long-term memory context for a request.
 *
 * <p>Implementations never fail the turn: when the memory store is unavailable they return an empty
 * string (or whatever stale context they still hold).
 */
@FunctionalInterface
public interface MemoryContextProvider {

  MemoryContextProvider NONE = query -> "";

  String fetchContext(String query);
}
