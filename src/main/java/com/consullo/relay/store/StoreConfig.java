package com.consullo.relay.store;

/**
 * Local persistence settings.
 *
 * @param databasePath SQLite file
 * @param maxRecords capture records kept
 * @param maxAgeMillis age after which capture records are removed
 * @param contextCacheTtlMillis age until a cached memory context is considered stale
 */
public record StoreConfig(String databasePath, int maxRecords, long maxAgeMillis, long contextCacheTtlMillis) {

  public StoreConfig {
    if (databasePath == null || databasePath.isBlank()) {
      throw new IllegalArgumentException("databasePath must not be blank.");
    }
    if (maxRecords <= 0 || maxAgeMillis <= 0 || contextCacheTtlMillis <= 0) {
      throw new IllegalArgumentException("retention limits must be positive.");
    }
  }
}
