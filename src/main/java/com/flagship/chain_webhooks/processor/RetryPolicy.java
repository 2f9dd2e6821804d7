package com.flagship.chain_webhooks.processor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff for event processing attempts.
 *
 * Delay after attempt k (1-based) is min(initialDelay * multiplier^(k-1), maxDelay).
 * With the default jitter factor of 0 the schedule is fully deterministic:
 * 2s, 4s, 8s, 10s, 10s for the default policy.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterFactor;

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay,
                       double multiplier, double jitterFactor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is shorter than initial delay " + initialDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1.0: " + multiplier);
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("Jitter factor must be in [0, 1): " + jitterFactor);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based attempt number
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1: " + attempt);
        }
        double exponential = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(exponential, (double) maxDelay.toMillis());
        return Duration.ofMillis(jitter(capped));
    }

    /**
     * The delay of every attempt, in order. Only the first maxAttempts - 1
     * entries are actually waited; the last attempt's failure goes straight to
     * the dead letter queue.
     */
    public List<Duration> schedule() {
        List<Duration> delays = new ArrayList<>(maxAttempts);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            delays.add(delayAfterAttempt(attempt));
        }
        return Collections.unmodifiableList(delays);
    }

    private long jitter(long millis) {
        if (jitterFactor == 0.0) {
            return millis;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (millis * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * Default: 5 attempts, 2s initial delay doubling up to 10s, no jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(10), 2.0, 0.0);
    }
}
