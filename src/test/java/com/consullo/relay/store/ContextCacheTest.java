package com.consullo.relay.store;

import com.consullo.relay.support.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

public class ContextCacheTest {

  @TempDir
  Path tempDir;

  private MutableClock clock;
  private ContextCache cache;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-04-01T08:00:00Z");
    cache = new ContextCache(SqliteDatabase.open(tempDir.resolve("relay.db")), clock);
  }

  @Test
  @DisplayName("Should serve an entry as fresh until it outlives the TTL")
  void fresh_AfterTtl_OnlyAnyReturnsIt() {
    cache.put("Weather today?", "User lives in Leeds.");

    assertThat(cache.fresh("  weather TODAY?", Duration.ofMinutes(5))).contains("User lives in Leeds.");

    clock.advance(Duration.ofMinutes(6));
    assertThat(cache.fresh("Weather today?", Duration.ofMinutes(5))).isEmpty();
    assertThat(cache.any("Weather today?")).contains("User lives in Leeds.");
  }

  @Test
  @DisplayName("Should replace an entry and purge old ones")
  void put_Replace_ThenPurge() {
    cache.put("q", "old");
    cache.put("q", "new");
    assertThat(cache.any("q")).contains("new");

    clock.advance(Duration.ofDays(2));
    assertThat(cache.purge(Duration.ofDays(1))).isEqualTo(1);
    assertThat(cache.any("q")).isEmpty();
  }
}
