package com.flagship.chain_webhooks.dlq;

/**
 * Lifecycle of a dead letter entry.
 */
public enum DeadLetterStatus {
    /**
     * Waiting for an operator.
     */
    UNRESOLVED,

    /**
     * Re-enqueued by an operator; the replay has not finished yet.
     * Goes to RESOLVED if the replay succeeds, back to UNRESOLVED if it fails.
     */
    SUPERSEDED,

    /**
     * Closed, either by an operator or by a successful replay.
     */
    RESOLVED
}
