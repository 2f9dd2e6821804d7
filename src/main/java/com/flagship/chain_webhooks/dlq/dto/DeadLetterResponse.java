package com.flagship.chain_webhooks.dlq.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.chain_webhooks.dlq.DeadLetterEvent;
import com.flagship.chain_webhooks.dlq.DeadLetterStatus;
import com.flagship.chain_webhooks.event.Event;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DeadLetterResponse {

    @JsonProperty("event_id")
    String eventId;

    @JsonProperty("trade_id")
    String tradeId;

    @JsonProperty("network")
    String network;

    @JsonProperty("tx_hash")
    String txHash;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("retry_count")
    int retryCount;

    @JsonProperty("status")
    DeadLetterStatus status;

    @JsonProperty("replay_count")
    int replayCount;

    @JsonProperty("first_failed_at")
    Instant firstFailedAt;

    @JsonProperty("last_failed_at")
    Instant lastFailedAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    @JsonProperty("resolution_notes")
    String resolutionNotes;

    @JsonProperty("original_event")
    Event originalEvent;

    public static DeadLetterResponse from(DeadLetterEvent deadLetter) {
        return DeadLetterResponse.builder()
            .eventId(deadLetter.getEventId())
            .tradeId(deadLetter.getTradeId())
            .network(deadLetter.getNetwork().pathName())
            .txHash(deadLetter.getTxHash())
            .errorMessage(deadLetter.getErrorMessage())
            .retryCount(deadLetter.getRetryCount())
            .status(deadLetter.getStatus())
            .replayCount(deadLetter.getReplayCount())
            .firstFailedAt(deadLetter.getFirstFailedAt())
            .lastFailedAt(deadLetter.getLastFailedAt())
            .resolvedAt(deadLetter.getResolvedAt())
            .resolutionNotes(deadLetter.getResolutionNotes())
            .originalEvent(deadLetter.getEvent())
            .build();
    }
}
