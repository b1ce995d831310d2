package com.consullo.relay.store;

import com.consullo.relay.turn.CaptureRecord;
import com.consullo.relay.turn.RequesterKind;
import com.consullo.relay.turn.TurnState;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only record of every finished turn with its raw captures.
 *
 * <p>Records are never updated. Each one gets a sequence number and a {@code recorded_at} timestamp
 * that both strictly increase, giving a stable replay order. Retention removes records by age and
 * by count, but never a record still waiting in the retry queue.
 *
 * @since 1.0
 */
public final class CaptureStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptureStore.class);

  private static final String COLUMNS = "turn_id, kind, context_id, destination, request_text, submitted_text,"
      + " capture_before, capture_after, extracted_text, sanitized_text, final_state, leak_detected,"
      + " started_at, ended_at";

  private final SqliteDatabase database;
  private final StoreConfig config;
  private final Clock clock;

  public CaptureStore(SqliteDatabase database, StoreConfig config, Clock clock) {
    Validate.notNull(database, "database must not be null");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.database = database;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Persists a finished turn.
   *
   * @param record the record
   * @throws CaptureStoreException if the turn was already recorded or the write fails
   */
  public synchronized void append(CaptureRecord record) {
    Validate.notNull(record, "record must not be null");
    final String sql = "INSERT INTO capture_records(" + COLUMNS + ", recorded_at)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?,"
        + " MAX(?, COALESCE((SELECT MAX(recorded_at) + 1 FROM capture_records), 0)))";
    try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, record.turnId());
      ps.setString(2, record.kind().name());
      ps.setString(3, record.contextId());
      ps.setString(4, record.destination());
      ps.setString(5, record.requestText());
      ps.setString(6, record.submittedText());
      ps.setString(7, record.captureBefore());
      ps.setString(8, record.captureAfter());
      ps.setString(9, record.extractedText());
      ps.setString(10, record.sanitizedText());
      ps.setString(11, record.finalState().name());
      ps.setInt(12, record.leakDetected() ? 1 : 0);
      ps.setLong(13, record.startedAt().toEpochMilli());
      ps.setLong(14, record.endedAt().toEpochMilli());
      ps.setLong(15, clock.millis());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot record turn " + record.turnId(), e);
    }
    LOGGER.debug("Recorded turn {} ({})", record.turnId(), record.finalState());
  }

  public Optional<CaptureRecord> find(String turnId) {
    final List<CaptureRecord> found = query("SELECT " + COLUMNS + " FROM capture_records WHERE turn_id = ?",
        ps -> ps.setString(1, turnId));
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  /**
   * Turns that did not complete and ended within {@code window}, oldest first.
   *
   * @param window how far back to look
   * @return failed turns
   */
  public List<CaptureRecord> recentFailures(Duration window) {
    final long since = clock.millis() - window.toMillis();
    return query("SELECT " + COLUMNS + " FROM capture_records"
            + " WHERE final_state <> ? AND ended_at >= ? ORDER BY seq",
        ps -> {
          ps.setString(1, TurnState.COMPLETED.name());
          ps.setLong(2, since);
        });
  }

  /**
   * The last {@code limit} records, oldest first.
   *
   * @param limit maximum records
   * @return records
   */
  public List<CaptureRecord> recent(int limit) {
    final List<CaptureRecord> newestFirst = query("SELECT " + COLUMNS + " FROM capture_records ORDER BY seq DESC LIMIT ?",
        ps -> ps.setInt(1, limit));
    Collections.reverse(newestFirst);
    return newestFirst;
  }

  public int count() {
    try (Connection c = database.openConnection();
        PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM capture_records");
        ResultSet rs = ps.executeQuery()) {
      return rs.next() ? rs.getInt(1) : 0;
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot count capture records", e);
    }
  }

  /**
   * Applies the age and count limits.
   *
   * @return records removed
   */
  public synchronized int enforceRetention() {
    final long cutoff = clock.millis() - config.maxAgeMillis();
    final String byAge = "DELETE FROM capture_records WHERE ended_at < ?"
        + " AND turn_id NOT IN (SELECT turn_id FROM retry_queue)";
    final String byCount = "DELETE FROM capture_records WHERE seq IN ("
        + " SELECT seq FROM capture_records WHERE turn_id NOT IN (SELECT turn_id FROM retry_queue)"
        + " ORDER BY seq DESC LIMIT -1 OFFSET ?)";
    try (Connection c = database.openConnection();
        PreparedStatement age = c.prepareStatement(byAge);
        PreparedStatement count = c.prepareStatement(byCount)) {
      age.setLong(1, cutoff);
      int removed = age.executeUpdate();
      count.setInt(1, config.maxRecords());
      removed += count.executeUpdate();
      if (removed > 0) {
        LOGGER.info("Retention removed {} capture records", removed);
      }
      return removed;
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot apply capture retention", e);
    }
  }

  private List<CaptureRecord> query(String sql, Binder binder) {
    try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      binder.bind(ps);
      try (ResultSet rs = ps.executeQuery()) {
        final List<CaptureRecord> out = new ArrayList<>();
        while (rs.next()) {
          out.add(map(rs));
        }
        return out;
      }
    } catch (SQLException e) {
      throw new CaptureStoreException("Capture query failed", e);
    }
  }

  private static CaptureRecord map(ResultSet rs) throws SQLException {
    return new CaptureRecord(
        rs.getString("turn_id"),
        RequesterKind.valueOf(rs.getString("kind")),
        rs.getString("context_id"),
        rs.getString("destination"),
        rs.getString("request_text"),
        rs.getString("submitted_text"),
        rs.getString("capture_before"),
        rs.getString("capture_after"),
        rs.getString("extracted_text"),
        rs.getString("sanitized_text"),
        TurnState.valueOf(rs.getString("final_state")),
        rs.getInt("leak_detected") != 0,
        Instant.ofEpochMilli(rs.getLong("started_at")),
        Instant.ofEpochMilli(rs.getLong("ended_at")));
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }
}
