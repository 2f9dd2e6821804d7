package com.flagship.chain_webhooks.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.chain_webhooks.trade.Trade;
import com.flagship.chain_webhooks.trade.TradeEventRecord;
import com.flagship.chain_webhooks.trade.TradeStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Trade confirmation state with its event history.
 */
@Value
@Builder
public class TradeResponse {

    @JsonProperty("trade_id")
    String tradeId;

    @JsonProperty("status")
    TradeStatus status;

    @JsonProperty("confirmations")
    int confirmations;

    @JsonProperty("final_confirmation_received")
    boolean finalConfirmationReceived;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("confirmed_at")
    Instant confirmedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("failed_at")
    Instant failedAt;

    @JsonProperty("events")
    List<EventEntry> events;

    public static TradeResponse from(Trade trade) {
        return TradeResponse.builder()
            .tradeId(trade.getTradeId())
            .status(trade.getStatus())
            .confirmations(trade.getConfirmations())
            .finalConfirmationReceived(trade.isFinalConfirmationReceived())
            .failureReason(trade.getFailureReason())
            .createdAt(trade.getCreatedAt())
            .confirmedAt(trade.getConfirmedAt())
            .completedAt(trade.getCompletedAt())
            .failedAt(trade.getFailedAt())
            .events(trade.getEvents().stream().map(EventEntry::from).toList())
            .build();
    }

    @Value
    public static class EventEntry {
        @JsonProperty("event_id")
        String eventId;

        @JsonProperty("tx_hash")
        String txHash;

        @JsonProperty("network")
        String network;

        @JsonProperty("confirmations")
        int confirmations;

        @JsonProperty("event_type")
        String eventType;

        @JsonProperty("timestamp")
        Instant timestamp;

        static EventEntry from(TradeEventRecord record) {
            return new EventEntry(
                record.getEventId(),
                record.getTxHash(),
                record.getNetwork().pathName(),
                record.getConfirmationCount(),
                record.getEventType().wireName(),
                record.getEventTimestamp()
            );
        }
    }
}
