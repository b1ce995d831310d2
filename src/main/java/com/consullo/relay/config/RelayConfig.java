package com.consullo.relay.config;

import com.consullo.relay.compose.ComposerConfig;
import com.consullo.relay.driver.AgentSessionConfig;
import com.consullo.relay.memory.CircuitBreakerConfig;
import com.consullo.relay.memory.ForwarderConfig;
import com.consullo.relay.memory.MemoryStoreConfig;
import com.consullo.relay.poll.PollerConfig;
import com.consullo.relay.session.ArbiterConfig;
import com.consullo.relay.store.StoreConfig;

/**
 * Complete relay configuration, one section per component.
 */
public record RelayConfig(
    AgentSessionConfig session,
    PollerConfig poll,
    ArbiterConfig arbiter,
    ComposerConfig compose,
    StoreConfig store,
    MemoryStoreConfig memory,
    CircuitBreakerConfig breaker,
    ForwarderConfig forwarder) {

  public RelayConfig {
    if (session == null || poll == null || arbiter == null || compose == null || store == null
        || memory == null || breaker == null || forwarder == null) {
      throw new IllegalArgumentException("every configuration section is required.");
    }
  }
}
