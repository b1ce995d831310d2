package com.consullo.relay.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The relay's embedded database: capture records, the retry queue and the memory context cache.
 *
 * <p>Connections are opened per operation. WAL journaling lets the turn thread read while the
 * background worker writes.
 */
public final class SqliteDatabase {

  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteDatabase.class);

  private static final String[] SCHEMA = {
      "CREATE TABLE IF NOT EXISTS capture_records ("
          + " seq INTEGER PRIMARY KEY AUTOINCREMENT,"
          + " turn_id TEXT NOT NULL UNIQUE,"
          + " kind TEXT NOT NULL,"
          + " context_id TEXT NOT NULL,"
          + " destination TEXT NOT NULL,"
          + " request_text TEXT NOT NULL,"
          + " submitted_text TEXT NOT NULL,"
          + " capture_before TEXT NOT NULL,"
          + " capture_after TEXT NOT NULL,"
          + " extracted_text TEXT NOT NULL,"
          + " sanitized_text TEXT NOT NULL,"
          + " final_state TEXT NOT NULL,"
          + " leak_detected INTEGER NOT NULL,"
          + " started_at INTEGER NOT NULL,"
          + " ended_at INTEGER NOT NULL,"
          + " recorded_at INTEGER NOT NULL)",
      "CREATE INDEX IF NOT EXISTS idx_capture_records_ended ON capture_records(ended_at)",
      "CREATE TABLE IF NOT EXISTS retry_queue ("
          + " turn_id TEXT PRIMARY KEY,"
          + " attempts INTEGER NOT NULL,"
          + " next_attempt_at INTEGER NOT NULL,"
          + " last_error TEXT,"
          + " enqueued_at INTEGER NOT NULL)",
      "CREATE INDEX IF NOT EXISTS idx_retry_queue_due ON retry_queue(next_attempt_at)",
      "CREATE TABLE IF NOT EXISTS context_cache ("
          + " query_key TEXT PRIMARY KEY,"
          + " context TEXT NOT NULL,"
          + " fetched_at INTEGER NOT NULL)"
  };

  private final Path file;
  private final String url;

  private SqliteDatabase(Path file) {
    this.file = file;
    this.url = "jdbc:sqlite:" + file;
  }

  /**
   * Opens (creating if needed) the database file and its tables.
   *
   * @param file database file
   * @return database
   */
  public static SqliteDatabase open(Path file) {
    final Path absolute = file.toAbsolutePath().normalize();
    try {
      if (absolute.getParent() != null) {
        Files.createDirectories(absolute.getParent());
      }
    } catch (IOException e) {
      throw new CaptureStoreException("Cannot create directory for " + absolute, e);
    }
    final SqliteDatabase db = new SqliteDatabase(absolute);
    db.migrate();
    return db;
  }

  public Path file() {
    return file;
  }

  public Connection openConnection() throws SQLException {
    final Connection c = DriverManager.getConnection(url);
    try (Statement st = c.createStatement()) {
      st.execute("PRAGMA busy_timeout = 5000");
    } catch (SQLException e) {
      c.close();
      throw e;
    }
    return c;
  }

  private void migrate() {
    try (Connection c = openConnection(); Statement st = c.createStatement()) {
      st.execute("PRAGMA journal_mode = WAL");
      for (String ddl : SCHEMA) {
        st.execute(ddl);
      }
    } catch (SQLException e) {
      throw new CaptureStoreException("Cannot initialize " + file, e);
    }
    LOGGER.info("Capture database ready at {}", file);
  }
}
