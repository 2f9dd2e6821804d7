package com.flagship.chain_webhooks.dlq;

import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.Network;
import lombok.Value;

import java.time.Instant;

/**
 * An event whose processing exhausted its retry budget, plus what is known
 * about the failure.
 *
 * Transitions:
 * - UNRESOLVED -> SUPERSEDED on replay
 * - SUPERSEDED -> RESOLVED when the replay succeeds
 * - any -> UNRESOLVED when the event fails again
 * - UNRESOLVED/SUPERSEDED -> RESOLVED on manual resolution
 */
@Value
public class DeadLetterEvent {
    String eventId;
    String tradeId;
    Network network;
    String txHash;
    String errorMessage;
    int retryCount;
    Event event;
    DeadLetterStatus status;
    int replayCount;
    Instant firstFailedAt;
    Instant lastFailedAt;
    Instant resolvedAt;
    String resolutionNotes;

    public static DeadLetterEvent firstFailure(Event event, String errorMessage, int retryCount) {
        Instant now = Instant.now();
        return new DeadLetterEvent(
            event.getEventId(),
            event.getTradeId(),
            event.getNetwork(),
            event.getTxHash(),
            errorMessage,
            retryCount,
            event,
            DeadLetterStatus.UNRESOLVED,
            0,
            now,
            now,
            null,
            null
        );
    }

    /**
     * The same event failed again (typically after a replay). Keeps the
     * first failure time and the replay count.
     */
    public DeadLetterEvent failedAgain(Event failedEvent, String error, int retries) {
        return new DeadLetterEvent(eventId, tradeId, network, txHash, error, retries, failedEvent,
            DeadLetterStatus.UNRESOLVED, replayCount, firstFailedAt, Instant.now(), null, null);
    }

    /**
     * @throws IllegalStateException unless the entry is UNRESOLVED
     */
    public DeadLetterEvent supersede() {
        if (status != DeadLetterStatus.UNRESOLVED) {
            throw new IllegalStateException(String.format(
                "Cannot replay dead letter %s in %s status. Only UNRESOLVED entries can be replayed.",
                eventId, status));
        }
        return withStatus(DeadLetterStatus.SUPERSEDED, replayCount + 1, null, resolutionNotes);
    }

    /**
     * Undoes {@link #supersede()} when the replay could not be enqueued.
     */
    public DeadLetterEvent revertSupersede() {
        if (status != DeadLetterStatus.SUPERSEDED) {
            return this;
        }
        return withStatus(DeadLetterStatus.UNRESOLVED, Math.max(0, replayCount - 1), null, resolutionNotes);
    }

    /**
     * A replayed copy was applied. Entries that were resolved or failed
     * again in the meantime are left as they are.
     */
    public DeadLetterEvent replaySucceeded() {
        if (status != DeadLetterStatus.SUPERSEDED) {
            return this;
        }
        return withStatus(DeadLetterStatus.RESOLVED, replayCount, Instant.now(),
            "Replay #" + replayCount + " processed successfully");
    }

    /**
     * @throws IllegalStateException if already RESOLVED
     */
    public DeadLetterEvent resolve(String notes) {
        if (status == DeadLetterStatus.RESOLVED) {
            throw new IllegalStateException("Dead letter " + eventId + " is already resolved");
        }
        return withStatus(DeadLetterStatus.RESOLVED, replayCount, Instant.now(), notes);
    }

    public boolean isOpen() {
        return status != DeadLetterStatus.RESOLVED;
    }

    private DeadLetterEvent withStatus(DeadLetterStatus newStatus, int newReplayCount,
                                       Instant newResolvedAt, String notes) {
        return new DeadLetterEvent(eventId, tradeId, network, txHash, errorMessage, retryCount, event,
            newStatus, newReplayCount, firstFailedAt, lastFailedAt, newResolvedAt, notes);
    }
}
