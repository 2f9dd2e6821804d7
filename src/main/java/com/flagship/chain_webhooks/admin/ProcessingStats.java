package com.flagship.chain_webhooks.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.chain_webhooks.trade.TradeStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of the pipeline for operators.
 */
@Value
@Builder
public class ProcessingStats {

    @JsonProperty("trades_by_status")
    Map<TradeStatus, Long> tradesByStatus;

    @JsonProperty("pending_confirmations")
    long pendingConfirmations;

    @JsonProperty("average_confirmation_time_seconds")
    double averageConfirmationTimeSeconds;

    @JsonProperty("queue_depth")
    int queueDepth;

    @JsonProperty("queue_capacity")
    int queueCapacity;

    @JsonProperty("events_received")
    long eventsReceived;

    @JsonProperty("events_processed")
    long eventsProcessed;

    @JsonProperty("events_dead_lettered")
    long eventsDeadLettered;

    @JsonProperty("success_rate")
    double successRate;

    @JsonProperty("unresolved_dead_letters")
    long unresolvedDeadLetters;

    @JsonProperty("confirmation_threshold")
    int confirmationThreshold;

    @JsonProperty("processor_running")
    boolean processorRunning;

    @JsonProperty("latest_transactions")
    List<RecentTransaction> latestTransactions;

    @JsonProperty("generated_at")
    Instant generatedAt;
}
