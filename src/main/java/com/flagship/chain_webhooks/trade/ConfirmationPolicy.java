package com.flagship.chain_webhooks.trade;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds the confirmation threshold used to move trades from PENDING to
 * CONFIRMED. Operators can change it at runtime; the new value applies to
 * events processed after the change.
 */
@Component
@Slf4j
public class ConfirmationPolicy {

    private final AtomicInteger threshold;

    public ConfirmationPolicy(@Value("${processor.confirmation-threshold:3}") int initialThreshold) {
        validate(initialThreshold);
        this.threshold = new AtomicInteger(initialThreshold);
    }

    public int getThreshold() {
        return threshold.get();
    }

    /**
     * @return the previous threshold
     */
    public int setThreshold(int newThreshold) {
        validate(newThreshold);
        int previous = threshold.getAndSet(newThreshold);
        log.info("Confirmation threshold changed: {} -> {}", previous, newThreshold);
        return previous;
    }

    private static void validate(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("Confirmation threshold must be at least 1, got " + value);
        }
    }
}
