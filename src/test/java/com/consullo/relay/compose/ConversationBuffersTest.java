package com.consullo.relay.compose;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ConversationBuffersTest {

  private static final Instant AT = Instant.parse("2026-02-01T12:00:00Z");

  @Test
  @DisplayName("Should keep only the newest exchanges up to capacity, oldest first")
  void record_PastCapacity_DropsOldest() {
    final ConversationBuffers buffers = new ConversationBuffers(2);

    buffers.record("a", new Exchange("q1", "r1", AT));
    buffers.record("a", new Exchange("q2", "r2", AT));
    buffers.record("a", new Exchange("q3", "r3", AT));

    assertThat(buffers.snapshot("a")).extracting(Exchange::request).containsExactly("q2", "q3");
  }

  @Test
  @DisplayName("Should keep contexts apart")
  void snapshot_OtherContext_Isolated() {
    final ConversationBuffers buffers = new ConversationBuffers(5);
    buffers.record("a", new Exchange("q", "r", AT));

    assertThat(buffers.snapshot("b")).isEmpty();

    buffers.clear("a");
    assertThat(buffers.snapshot("a")).isEmpty();
  }

  @Test
  @DisplayName("Should return snapshots unaffected by later writes")
  void snapshot_ThenRecord_SnapshotUnchanged() {
    final RecentExchangeBuffer buffer = new RecentExchangeBuffer(3);
    buffer.add(new Exchange("q1", "r1", AT));

    final List<Exchange> snapshot = buffer.snapshot();
    buffer.add(new Exchange("q2", "r2", AT));

    assertThat(snapshot).hasSize(1);
    assertThat(buffer.size()).isEqualTo(2);
  }
}
