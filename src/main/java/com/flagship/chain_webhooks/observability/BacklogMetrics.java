package com.flagship.chain_webhooks.observability;

import com.flagship.chain_webhooks.dlq.DeadLetterQueue;
import com.flagship.chain_webhooks.event.EventQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges for work that is waiting: the in-memory event queue and the
 * unresolved dead letters.
 *
 * Queue depth is read live. The dead letter count needs a database query, so
 * it is cached and refreshed by {@link MetricsScheduler} instead of on every
 * scrape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BacklogMetrics {

    private final EventQueue eventQueue;
    private final DeadLetterQueue deadLetterQueue;
    private final MeterRegistry meterRegistry;

    private final AtomicLong unresolvedDeadLetters = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("webhook.queue.depth", eventQueue, EventQueue::size)
            .description("Events waiting in the in-memory queue")
            .register(meterRegistry);

        Gauge.builder("webhook.queue.capacity", eventQueue, EventQueue::capacity)
            .description("Maximum number of queued events")
            .register(meterRegistry);

        Gauge.builder("webhook.dlq.unresolved", unresolvedDeadLetters, AtomicLong::get)
            .description("Dead letter entries waiting for an operator")
            .register(meterRegistry);

        log.info("Backlog metrics registered with Micrometer");
    }

    public void refreshMetrics() {
        try {
            long unresolved = deadLetterQueue.countUnresolved();
            unresolvedDeadLetters.set(unresolved);
            log.debug("Backlog metrics refreshed: queueDepth={}, unresolvedDeadLetters={}",
                eventQueue.size(), unresolved);
        } catch (Exception e) {
            log.warn("Failed to refresh backlog metrics: {}", e.getMessage());
        }
    }
}
