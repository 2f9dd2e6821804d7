package com.flagship.chain_webhooks.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and timers for the webhook pipeline.
 *
 * Metrics exposed:
 * - webhook.events.received: accepted webhooks, by network
 * - webhook.events.rejected: rejected webhooks, by network and reason
 * - webhook.events.processed: events applied by the processor, by network and outcome
 * - webhook.events.dead_lettered: events moved to the dead letter queue, by network
 * - webhook.events.replayed: dead letters re-enqueued by operators, by network
 * - webhook.processing.latency: time from dequeue to commit or dead letter, by network
 * - webhook.trades.fail_mark_errors: trades that could not be marked FAILED after exhaustion
 *
 * Process-wide totals are also kept in memory for the processing health
 * check and the stats endpoint.
 */
@Component
public class WebhookMetrics {

    private final MeterRegistry registry;
    private final Counter failMarkErrors;

    private final AtomicLong receivedTotal = new AtomicLong();
    private final AtomicLong processedTotal = new AtomicLong();
    private final AtomicLong deadLetteredTotal = new AtomicLong();

    public WebhookMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.failMarkErrors = Counter.builder("webhook.trades.fail_mark_errors")
            .description("Trades that could not be marked FAILED after retry exhaustion")
            .register(registry);
    }

    public void recordReceived(String network) {
        receivedTotal.incrementAndGet();
        Counter.builder("webhook.events.received")
            .description("Webhooks accepted and enqueued")
            .tag("network", sanitizeTag(network))
            .register(registry)
            .increment();
    }

    /**
     * @param reason short reason tag, e.g. invalid_signature, malformed, queue_full, unattributed
     */
    public void recordRejected(String network, String reason) {
        registry.counter("webhook.events.rejected",
            "network", sanitizeTag(network),
            "reason", sanitizeTag(reason)
        ).increment();
    }

    /**
     * @param outcome applied or duplicate
     */
    public void recordProcessed(String network, String outcome) {
        processedTotal.incrementAndGet();
        registry.counter("webhook.events.processed",
            "network", sanitizeTag(network),
            "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDeadLettered(String network) {
        deadLetteredTotal.incrementAndGet();
        registry.counter("webhook.events.dead_lettered",
            "network", sanitizeTag(network)
        ).increment();
    }

    public void recordReplayed(String network) {
        registry.counter("webhook.events.replayed",
            "network", sanitizeTag(network)
        ).increment();
    }

    public void recordProcessingLatency(String network, Duration duration) {
        Timer.builder("webhook.processing.latency")
            .description("Time from dequeue to commit or dead letter")
            .tag("network", sanitizeTag(network))
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(duration);
    }

    public void recordFailMarkError() {
        failMarkErrors.increment();
    }

    public long getReceivedTotal() {
        return receivedTotal.get();
    }

    public long getProcessedTotal() {
        return processedTotal.get();
    }

    public long getDeadLetteredTotal() {
        return deadLetteredTotal.get();
    }

    /**
     * Percentage of finished events that were processed rather than dead
     * lettered. 100 when nothing has finished yet.
     */
    public double getSuccessRate() {
        long processed = processedTotal.get();
        long finished = processed + deadLetteredTotal.get();
        if (finished == 0) {
            return 100.0;
        }
        return processed * 100.0 / finished;
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
