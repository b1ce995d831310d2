package com.consullo.relay.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Last memory context fetched per query, kept so an outage of the memory store can be bridged with
 * slightly stale context.
 */
public final class ContextCache {

  private final SqliteDatabase database;
  private final Clock clock;

  public ContextCache(SqliteDatabase database, Clock clock) {
    Validate.notNull(database, "database must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.database = database;
    this.clock = clock;
  }

  /**
   * @param query the query
   * @param maxAge how old an entry may be
   * @return cached context no older than {@code maxAge}
   */
  public Optional<String> fresh(String query, Duration maxAge) {
    return lookup(query).filter(e -> !e.fetchedAt().isBefore(clock.instant().minus(maxAge))).map(Entry::context);
  }

  /**
   * @param query the query
   * @return cached context regardless of age
   */
  public Optional<String> any(String query) {
    return lookup(query).map(Entry::context);
  }

  public void put(String query, String context) {
    final String sql = "INSERT INTO context_cache(query_key, context, fetched_at) VALUES (?, ?, ?)"
        + " ON CONFLICT(query_key) DO UPDATE SET context = excluded.context, fetched_at = excluded.fetched_at";
    try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, key(query));
      ps.setString(2, context);
      ps.setLong(3, clock.millis());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot cache memory context", e);
    }
  }

  /**
   * Drops entries fetched before {@code olderThan} ago.
   *
   * @param olderThan age limit
   * @return entries removed
   */
  public int purge(Duration olderThan) {
    try (Connection c = database.openConnection();
        PreparedStatement ps = c.prepareStatement("DELETE FROM context_cache WHERE fetched_at < ?")) {
      ps.setLong(1, clock.millis() - olderThan.toMillis());
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot purge context cache", e);
    }
  }

  private Optional<Entry> lookup(String query) {
    try (Connection c = database.openConnection();
        PreparedStatement ps = c.prepareStatement("SELECT context, fetched_at FROM context_cache WHERE query_key = ?")) {
      ps.setString(1, key(query));
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next()
            ? Optional.of(new Entry(rs.getString("context"), Instant.ofEpochMilli(rs.getLong("fetched_at"))))
            : Optional.empty();
      }
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot read context cache", e);
    }
  }

  static String key(String query) {
    final String normalized = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
    try {
      final byte[] digest = MessageDigest.getInstance("SHA-256").digest(normalized.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  private record Entry(String context, Instant fetchedAt) {
  }
}
