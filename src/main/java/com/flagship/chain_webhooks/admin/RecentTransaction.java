package com.flagship.chain_webhooks.admin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.chain_webhooks.trade.Trade;
import com.flagship.chain_webhooks.trade.TradeEventRecord;
import com.flagship.chain_webhooks.trade.TradeStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A recently active trade with the transaction that last touched it.
 */
@Value
@Builder
public class RecentTransaction {

    @JsonProperty("trade_id")
    String tradeId;

    @JsonProperty("status")
    TradeStatus status;

    @JsonProperty("confirmations")
    int confirmations;

    @JsonProperty("network")
    String network;

    @JsonProperty("tx_hash")
    String txHash;

    @JsonProperty("last_event_at")
    Instant lastEventAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("confirmed_at")
    Instant confirmedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static RecentTransaction from(Trade trade) {
        List<TradeEventRecord> events = trade.getEvents();
        TradeEventRecord last = events.isEmpty() ? null : events.get(events.size() - 1);
        return RecentTransaction.builder()
            .tradeId(trade.getTradeId())
            .status(trade.getStatus())
            .confirmations(trade.getConfirmations())
            .network(last != null ? last.getNetwork().pathName() : null)
            .txHash(last != null ? last.getTxHash() : null)
            .lastEventAt(last != null ? last.getRecordedAt() : null)
            .createdAt(trade.getCreatedAt())
            .confirmedAt(trade.getConfirmedAt())
            .completedAt(trade.getCompletedAt())
            .build();
    }
}
