package com.flagship.chain_webhooks.observability;

import com.flagship.chain_webhooks.dlq.DeadLetterQueue;
import com.flagship.chain_webhooks.event.EventQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the webhook pipeline.
 */
public class HealthIndicators {

    public static final Status DEGRADED = new Status("DEGRADED");
    public static final Status WARNING = new Status("WARNING");

    /**
     * Processing health from the success rate of finished events and the
     * number of unresolved dead letters.
     *
     * DOWN below 80% success or above 10 unresolved dead letters,
     * DEGRADED below 95% or above 5.
     */
    @Component("webhookProcessingHealth")
    public static class ProcessingHealthIndicator implements HealthIndicator {

        static final double UNHEALTHY_SUCCESS_RATE = 80.0;
        static final double DEGRADED_SUCCESS_RATE = 95.0;
        static final long UNHEALTHY_DEAD_LETTERS = 10;
        static final long DEGRADED_DEAD_LETTERS = 5;

        private final WebhookMetrics webhookMetrics;
        private final DeadLetterQueue deadLetterQueue;

        public ProcessingHealthIndicator(WebhookMetrics webhookMetrics, DeadLetterQueue deadLetterQueue) {
            this.webhookMetrics = webhookMetrics;
            this.deadLetterQueue = deadLetterQueue;
        }

        @Override
        public Health health() {
            try {
                double successRate = webhookMetrics.getSuccessRate();
                long unresolved = deadLetterQueue.countUnresolved();

                return Health.status(classify(successRate, unresolved))
                        .withDetail("successRate", Math.round(successRate * 100.0) / 100.0)
                        .withDetail("unresolvedDeadLetters", unresolved)
                        .withDetail("eventsProcessed", webhookMetrics.getProcessedTotal())
                        .withDetail("eventsDeadLettered", webhookMetrics.getDeadLetteredTotal())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }

        static Status classify(double successRate, long unresolvedDeadLetters) {
            if (successRate < UNHEALTHY_SUCCESS_RATE || unresolvedDeadLetters > UNHEALTHY_DEAD_LETTERS) {
                return Status.DOWN;
            }
            if (successRate < DEGRADED_SUCCESS_RATE || unresolvedDeadLetters > DEGRADED_DEAD_LETTERS) {
                return DEGRADED;
            }
            return Status.UP;
        }
    }

    /**
     * Event queue fill level. A full queue means webhooks are being
     * answered with 503.
     */
    @Component("eventQueueHealth")
    public static class EventQueueHealthIndicator implements HealthIndicator {

        private static final double WARNING_FILL_RATIO = 0.8;

        private final EventQueue eventQueue;

        public EventQueueHealthIndicator(EventQueue eventQueue) {
            this.eventQueue = eventQueue;
        }

        @Override
        public Health health() {
            int depth = eventQueue.size();
            int capacity = eventQueue.capacity();
            double fillRatio = (double) depth / capacity;

            Health.Builder builder = fillRatio < WARNING_FILL_RATIO
                    ? Health.up()
                    : depth < capacity
                    ? Health.status(WARNING)
                    : Health.down();

            return builder
                    .withDetail("depth", depth)
                    .withDetail("capacity", capacity)
                    .withDetail("shards", eventQueue.shardCount())
                    .build();
        }
    }
}
