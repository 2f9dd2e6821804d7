package com.flagship.chain_webhooks.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WebhookMetricsTest {

    private SimpleMeterRegistry registry;
    private WebhookMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WebhookMetrics(registry);
    }

    @Test
    @DisplayName("Counters are tagged by network and outcome")
    void taggedCounters() {
        metrics.recordReceived("btc");
        metrics.recordProcessed("btc", "applied");
        metrics.recordProcessed("btc", "duplicate");
        metrics.recordRejected("eth", "invalid_signature");

        assertEquals(1.0, registry.get("webhook.events.received").tag("network", "btc").counter().count());
        assertEquals(1.0, registry.get("webhook.events.processed")
            .tags("network", "btc", "outcome", "duplicate").counter().count());
        assertEquals(1.0, registry.get("webhook.events.rejected")
            .tags("network", "eth", "reason", "invalid_signature").counter().count());
    }

    @Test
    @DisplayName("Success rate is 100 until something finishes, then processed over finished")
    void successRate() {
        assertEquals(100.0, metrics.getSuccessRate());

        metrics.recordProcessed("sol", "applied");
        metrics.recordProcessed("sol", "applied");
        metrics.recordProcessed("sol", "applied");
        metrics.recordDeadLettered("sol");

        assertEquals(75.0, metrics.getSuccessRate(), 0.001);
        assertEquals(3, metrics.getProcessedTotal());
        assertEquals(1, metrics.getDeadLetteredTotal());
    }

    @Test
    @DisplayName("Latency timer records per network")
    void latency() {
        metrics.recordProcessingLatency("ltc", Duration.ofMillis(40));

        assertEquals(1, registry.get("webhook.processing.latency").tag("network", "ltc").timer().count());
    }

    @Test
    @DisplayName("Tag values are normalized")
    void sanitizesTags() {
        metrics.recordRejected(null, "Queue Full!");

        assertEquals(1.0, registry.get("webhook.events.rejected")
            .tags("network", "unknown", "reason", "queue_full_").counter().count());
    }
}
