package com.warden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for sandbox lifecycle and execution.
 */
@Service
public class WardenMetrics {

    private final MeterRegistry registry;

    public WardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome {@code created}, {@code adopted} or {@code failed}
     */
    public void recordSandboxCreated(String outcome) {
        Counter.builder("warden.sandbox.created")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSandboxDeleted() {
        Counter.builder("warden.sandbox.deleted")
                .register(registry)
                .increment();
    }

    public void recordReadyDuration(Duration elapsed) {
        Timer.builder("warden.sandbox.ready.duration")
                .description("Time from readiness wait start until the sandbox answered its health probe")
                .register(registry)
                .record(elapsed);
    }

    public void recordReadyTimeout() {
        Counter.builder("warden.sandbox.ready.timeouts")
                .register(registry)
                .increment();
    }

    /**
     * @param mode {@code create} or {@code replace}
     */
    public void recordProxyConfigUpsert(String mode) {
        Counter.builder("warden.proxy.config.upserts")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordRelayFailure(String operation, String kind) {
        Counter.builder("warden.relay.failures")
                .tag("operation", operation)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
