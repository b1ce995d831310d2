package com.consullo.relay.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable queue of turns whose forwarding to the memory store is pending.
 *
 * <p>Entries are keyed by turn id and survive restarts. The attempt counter only ever grows; the
 * caller decides when an entry has used up its attempts and removes it.
 *
 * @since 1.0
 */
public final class RetryQueue {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryQueue.class);

  private static final String COLUMNS = "turn_id, attempts, next_attempt_at, last_error, enqueued_at";

  private final SqliteDatabase database;
  private final Clock clock;

  public RetryQueue(SqliteDatabase database, Clock clock) {
    Validate.notNull(database, "database must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.database = database;
    this.clock = clock;
  }

  /**
   * Adds a turn to the queue. A turn already queued keeps its existing entry.
   *
   * @param turnId turn to forward later
   * @param attempts attempts already made (0 when the breaker refused the first try)
   * @param nextAttemptAt earliest retry time
   * @param lastError failure message, may be null
   * @return true if a new entry was created
   */
  public synchronized boolean enqueue(String turnId, int attempts, Instant nextAttemptAt, String lastError) {
    Validate.notBlank(turnId, "turnId must not be blank");
    Validate.isTrue(attempts >= 0, "attempts must not be negative");
    final String sql = "INSERT INTO retry_queue(" + COLUMNS + ") VALUES (?, ?, ?, ?, ?)"
        + " ON CONFLICT(turn_id) DO NOTHING";
    try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, turnId);
      ps.setInt(2, attempts);
      ps.setLong(3, nextAttemptAt.toEpochMilli());
      ps.setString(4, lastError);
      ps.setLong(5, clock.millis());
      final boolean created = ps.executeUpdate() > 0;
      if (created) {
        LOGGER.debug("Queued turn {} for forwarding (attempts={})", turnId, attempts);
      }
      return created;
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot queue turn " + turnId, e);
    }
  }

  /**
   * Entries whose next attempt is due, earliest first.
   *
   * @param now reference time
   * @param limit maximum entries
   * @return due entries
   */
  public List<RetryQueueEntry> due(Instant now, int limit) {
    final String sql = "SELECT " + COLUMNS + " FROM retry_queue WHERE next_attempt_at <= ?"
        + " ORDER BY next_attempt_at, enqueued_at LIMIT ?";
    try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setLong(1, now.toEpochMilli());
      ps.setInt(2, limit);
      try (ResultSet rs = ps.executeQuery()) {
        final List<RetryQueueEntry> out = new ArrayList<>();
        while (rs.next()) {
          out.add(map(rs));
        }
        return out;
      }
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot read retry queue", e);
    }
  }

  public Optional<RetryQueueEntry> find(String turnId) {
    try (Connection c = database.openConnection();
        PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM retry_queue WHERE turn_id = ?")) {
      ps.setString(1, turnId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot read retry entry " + turnId, e);
    }
  }

  /**
   * Counts one more failed attempt and reschedules the entry.
   *
   * @param turnId queued turn
   * @param error failure message
   * @param nextAttemptAt new earliest retry time
   * @return the updated entry, empty if the turn is not queued
   */
  public synchronized Optional<RetryQueueEntry> recordFailure(String turnId, String error, Instant nextAttemptAt) {
    final String sql = "UPDATE retry_queue SET attempts = attempts + 1, last_error = ?, next_attempt_at = ?"
        + " WHERE turn_id = ?";
    try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, error);
      ps.setLong(2, nextAttemptAt.toEpochMilli());
      ps.setString(3, turnId);
      if (ps.executeUpdate() == 0) {
        return Optional.empty();
      }
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot update retry entry " + turnId, e);
    }
    return find(turnId);
  }

  public synchronized boolean remove(String turnId) {
    try (Connection c = database.openConnection();
        PreparedStatement ps = c.prepareStatement("DELETE FROM retry_queue WHERE turn_id = ?")) {
      ps.setString(1, turnId);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot remove retry entry " + turnId, e);
    }
  }

  public int size() {
    try (Connection c = database.openConnection();
        PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM retry_queue");
        ResultSet rs = ps.executeQuery()) {
      return rs.next() ? rs.getInt(1) : 0;
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot count retry queue", e);
    }
  }

  private static RetryQueueEntry map(ResultSet rs) throws SQLException {
    return new RetryQueueEntry(
        rs.getString("turn_id"),
        rs.getInt("attempts"),
        Instant.ofEpochMilli(rs.getLong("next_attempt_at")),
        rs.getString("last_error"),
        Instant.ofEpochMilli(rs.getLong("enqueued_at")));
  }
}
