package com.flagship.chain_webhooks.processor;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs an operation until it succeeds or the {@link RetryPolicy} runs out
 * of attempts, sleeping on the calling thread between attempts.
 *
 * Every failed {@link ProcessingResult} is retried. An exception thrown by
 * the operation counts as a failed attempt. If the thread is interrupted
 * while waiting the loop stops early and reports the outcome as interrupted.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public RetryOutcome execute(String operation, Supplier<ProcessingResult> attempt) {
        List<Duration> waits = new ArrayList<>();

        for (int n = 1; n <= policy.getMaxAttempts(); n++) {
            ProcessingResult result;
            try {
                result = attempt.get();
            } catch (Exception e) {
                result = ProcessingResult.failure(e);
            }

            if (result.isOk()) {
                if (n > 1) {
                    log.info("{} succeeded on attempt {}/{}", operation, n, policy.getMaxAttempts());
                }
                return new RetryOutcome(result, n, List.copyOf(waits), false);
            }

            String lastError = result.getError();
            if (n == policy.getMaxAttempts()) {
                log.error("{} failed after {} attempts: {}", operation, n, lastError);
                return new RetryOutcome(result, n, List.copyOf(waits), false);
            }

            Duration delay = policy.delayAfterAttempt(n);
            log.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                operation, n, policy.getMaxAttempts(), delay.toMillis(), lastError);
            try {
                sleeper.sleep(delay);
                waits.add(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting to retry after attempt {}", operation, n);
                return new RetryOutcome(result, n, List.copyOf(waits), true);
            }
        }
        throw new IllegalStateException("Retry loop exited without an outcome");
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
