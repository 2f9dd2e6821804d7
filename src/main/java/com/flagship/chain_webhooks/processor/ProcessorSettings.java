package com.flagship.chain_webhooks.processor;

import lombok.Value;

import java.time.Duration;

/**
 * Runtime settings of the {@link EventProcessor}.
 */
@Value
public class ProcessorSettings {
    /**
     * How long a worker waits for an event before checking whether it should stop.
     */
    Duration pollTimeout;

    /**
     * How long {@link EventProcessor#stop()} waits for workers to finish their current event.
     */
    Duration drainTimeout;

    /**
     * Whether a trade is marked FAILED when one of its events is dead lettered.
     */
    boolean failTradeOnExhaustion;

    public static ProcessorSettings defaults() {
        return new ProcessorSettings(Duration.ofSeconds(1), Duration.ofSeconds(30), false);
    }
}
