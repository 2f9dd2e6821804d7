package com.flagship.chain_webhooks.processor;

import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What happened across all attempts of one retried operation.
 */
@Value
public class RetryOutcome {
    ProcessingResult finalResult;
    int attempts;
    List<Duration> waits;
    boolean interrupted;

    public boolean isSucceeded() {
        return finalResult.isOk();
    }

    public String getLastError() {
        return finalResult.getError();
    }
}
