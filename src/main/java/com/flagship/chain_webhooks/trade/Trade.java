package com.flagship.chain_webhooks.trade;

import com.flagship.chain_webhooks.event.Event;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trade confirmation aggregate.
 *
 * Immutable: every change returns a new Trade. Rules applied by
 * {@link #apply(Event, int)}:
 * - confirmations only grow (max of stored and observed)
 * - PENDING becomes CONFIRMED once confirmations reach the threshold
 * - a final confirmation completes a CONFIRMED trade; received while PENDING
 *   it is remembered and completes the trade as soon as the threshold is met
 * - COMPLETED and FAILED trades only gain history entries
 * - an event already in the history, or a redelivery of the same
 *   confirmation under a new event id, changes nothing
 *
 * confirmedAt, completedAt and failedAt are written once.
 */
@Value
public class Trade {
    String tradeId;
    TradeStatus status;
    int confirmations;
    boolean finalConfirmationReceived;
    String failureReason;
    Instant createdAt;
    Instant confirmedAt;
    Instant completedAt;
    Instant failedAt;
    Instant updatedAt;
    List<TradeEventRecord> events;

    /**
     * Creates a new PENDING trade with no history.
     */
    public static Trade pending(String tradeId) {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("Trade id must not be blank");
        }
        Instant now = Instant.now();
        return new Trade(tradeId, TradeStatus.PENDING, 0, false, null,
            now, null, null, null, now, List.of());
    }

    /**
     * Applies a confirmation event.
     *
     * @param event     the event to apply
     * @param threshold confirmations required to confirm the trade (at least 1)
     * @return the updated trade, or this instance if the event was already applied
     */
    public Trade apply(Event event, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Confirmation threshold must be at least 1: " + threshold);
        }
        if (!tradeId.equals(event.getTradeId())) {
            throw new IllegalArgumentException(
                String.format("Event %s belongs to trade %s, not %s", event.getEventId(), event.getTradeId(), tradeId));
        }
        if (hasApplied(event.getEventId()) || hasSeen(event.fingerprint())) {
            return this;
        }

        Instant now = Instant.now();
        List<TradeEventRecord> history = append(TradeEventRecord.of(event, now));

        if (isTerminal()) {
            return new Trade(tradeId, status, confirmations, finalConfirmationReceived, failureReason,
                createdAt, confirmedAt, completedAt, failedAt, now, history);
        }

        int newConfirmations = Math.max(confirmations, event.getConfirmationCount());
        boolean finalReceived = finalConfirmationReceived || event.isFinal();
        TradeStatus newStatus = status;
        Instant newConfirmedAt = confirmedAt;
        Instant newCompletedAt = completedAt;

        if (newStatus == TradeStatus.PENDING && newConfirmations >= threshold) {
            newStatus = TradeStatus.CONFIRMED;
            newConfirmedAt = now;
        }
        if (newStatus == TradeStatus.CONFIRMED && finalReceived) {
            newStatus = TradeStatus.COMPLETED;
            newCompletedAt = now;
        }

        return new Trade(tradeId, newStatus, newConfirmations, finalReceived, failureReason,
            createdAt, newConfirmedAt, newCompletedAt, failedAt, now, history);
    }

    /**
     * Transitions the trade to FAILED, keeping its confirmation data.
     * Failing an already failed trade returns it unchanged.
     *
     * @throws IllegalStateException if the trade is COMPLETED
     */
    public Trade fail(String reason) {
        if (status == TradeStatus.FAILED) {
            return this;
        }
        if (status == TradeStatus.COMPLETED) {
            throw new IllegalStateException(
                String.format("Cannot fail trade %s in %s status. Only PENDING or CONFIRMED trades can fail.",
                    tradeId, status));
        }
        Instant now = Instant.now();
        return new Trade(tradeId, TradeStatus.FAILED, confirmations, finalConfirmationReceived, reason,
            createdAt, confirmedAt, completedAt, now, now, events);
    }

    public boolean hasApplied(String eventId) {
        return events.stream().anyMatch(record -> record.getEventId().equals(eventId));
    }

    public boolean hasSeen(String fingerprint) {
        return events.stream().anyMatch(record -> record.fingerprint().equals(fingerprint));
    }

    public boolean isTerminal() {
        return status == TradeStatus.COMPLETED || status == TradeStatus.FAILED;
    }

    public boolean canTransitionTo(TradeStatus targetStatus) {
        if (status == targetStatus) {
            return true;
        }
        return switch (status) {
            case PENDING -> targetStatus == TradeStatus.CONFIRMED || targetStatus == TradeStatus.FAILED;
            case CONFIRMED -> targetStatus == TradeStatus.COMPLETED || targetStatus == TradeStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    private List<TradeEventRecord> append(TradeEventRecord record) {
        List<TradeEventRecord> history = new ArrayList<>(events.size() + 1);
        history.addAll(events);
        history.add(record);
        return Collections.unmodifiableList(history);
    }
}
