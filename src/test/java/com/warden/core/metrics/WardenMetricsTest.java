package com.warden.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WardenMetricsTest {

    private SimpleMeterRegistry registry;
    private WardenMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WardenMetrics(registry);
    }

    @Test
    @DisplayName("recordSandboxCreated counts per outcome")
    void recordSandboxCreated() {
        metrics.recordSandboxCreated("created");
        metrics.recordSandboxCreated("created");
        metrics.recordSandboxCreated("adopted");

        assertEquals(2.0, registry.find("warden.sandbox.created").tag("outcome", "created").counter().count());
        assertEquals(1.0, registry.find("warden.sandbox.created").tag("outcome", "adopted").counter().count());
    }

    @Test
    @DisplayName("recordReadyDuration creates a timer")
    void recordReadyDuration() {
        metrics.recordReadyDuration(Duration.ofSeconds(12));

        var timer = registry.find("warden.sandbox.ready.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordRelayFailure tags operation and kind")
    void recordRelayFailure() {
        metrics.recordRelayFailure("execute", "timeout");

        var counter = registry.find("warden.relay.failures")
                .tag("operation", "execute")
                .tag("kind", "timeout")
                .counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordProxyConfigUpsert tags the mode")
    void recordProxyConfigUpsert() {
        metrics.recordProxyConfigUpsert("replace");

        assertEquals(1.0, registry.find("warden.proxy.config.upserts").tag("mode", "replace").counter().count());
    }

    @Test
    @DisplayName("deletions and readiness timeouts are plain counters")
    void plainCounters() {
        metrics.recordSandboxDeleted();
        metrics.recordReadyTimeout();
        metrics.recordReadyTimeout();

        assertEquals(1.0, registry.find("warden.sandbox.deleted").counter().count());
        assertEquals(2.0, registry.find("warden.sandbox.ready.timeouts").counter().count());
    }
}
