package com.flagship.chain_webhooks.processor;

import lombok.Value;

/**
 * Outcome of a single processing attempt. Failures are values, not
 * exceptions, so the retry loop stays explicit.
 *
 * A duplicate is a success that changed nothing because the event had
 * already been applied.
 */
@Value
public class ProcessingResult {
    boolean ok;
    boolean duplicate;
    String error;

    public static ProcessingResult success() {
        return new ProcessingResult(true, false, null);
    }

    public static ProcessingResult duplicate() {
        return new ProcessingResult(true, true, null);
    }

    public static ProcessingResult failure(String error) {
        return new ProcessingResult(false, false, error == null ? "unknown error" : error);
    }

    public static ProcessingResult failure(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : "no message";
        return failure(e.getClass().getSimpleName() + ": " + message);
    }
}
