package com.flagship.chain_webhooks.processor;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests to avoid real sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
