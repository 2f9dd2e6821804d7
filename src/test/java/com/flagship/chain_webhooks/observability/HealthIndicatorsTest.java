package com.flagship.chain_webhooks.observability;

import com.flagship.chain_webhooks.dlq.DeadLetterQueue;
import com.flagship.chain_webhooks.event.EventQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static com.flagship.chain_webhooks.support.TestEvents.confirmation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthIndicatorsTest {

    @Test
    @DisplayName("Processing health thresholds: 80/95 percent success, 10/5 unresolved dead letters")
    void processingClassification() {
        assertEquals(Status.UP, HealthIndicators.ProcessingHealthIndicator.classify(100.0, 0));
        assertEquals(Status.UP, HealthIndicators.ProcessingHealthIndicator.classify(95.0, 5));
        assertEquals(HealthIndicators.DEGRADED, HealthIndicators.ProcessingHealthIndicator.classify(94.9, 0));
        assertEquals(HealthIndicators.DEGRADED, HealthIndicators.ProcessingHealthIndicator.classify(99.0, 6));
        assertEquals(Status.DOWN, HealthIndicators.ProcessingHealthIndicator.classify(79.9, 0));
        assertEquals(Status.DOWN, HealthIndicators.ProcessingHealthIndicator.classify(100.0, 11));
    }

    @Test
    @DisplayName("Processing health reports DOWN with details when the dead letter count cannot be read")
    void processingHealthOnStoreError() {
        DeadLetterQueue deadLetterQueue = mock(DeadLetterQueue.class);
        when(deadLetterQueue.countUnresolved()).thenThrow(new IllegalStateException("db down"));
        WebhookMetrics metrics = new WebhookMetrics(new SimpleMeterRegistry());

        Health health = new HealthIndicators.ProcessingHealthIndicator(metrics, deadLetterQueue).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("db down", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("Success rate counts dead letters as failures")
    void successRate() {
        WebhookMetrics metrics = new WebhookMetrics(new SimpleMeterRegistry());
        assertEquals(100.0, metrics.getSuccessRate());

        for (int i = 0; i < 9; i++) {
            metrics.recordProcessed("btc", "applied");
        }
        metrics.recordDeadLettered("btc");

        assertEquals(90.0, metrics.getSuccessRate(), 0.001);
    }

    @Test
    @DisplayName("Queue health goes WARNING at 80 percent fill and DOWN when full")
    void queueHealth() {
        EventQueue queue = new EventQueue(5, 1);
        HealthIndicators.EventQueueHealthIndicator indicator = new HealthIndicators.EventQueueHealthIndicator(queue);
        assertEquals(Status.UP, indicator.health().getStatus());

        for (int i = 0; i < 4; i++) {
            queue.offer(confirmation("T" + i, 1));
        }
        assertEquals(HealthIndicators.WARNING, indicator.health().getStatus());

        queue.offer(confirmation("T5", 1));
        assertEquals(Status.DOWN, indicator.health().getStatus());
        assertEquals(5, indicator.health().getDetails().get("depth"));
    }
}
