package com.flagship.chain_webhooks.trade;

import com.flagship.chain_webhooks.event.EventType;
import com.flagship.chain_webhooks.event.Network;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the trade_events history table.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TradeEventEmbeddable {

    @Column(name = "event_id", nullable = false, updatable = false)
    private String eventId;

    @Column(name = "tx_hash", nullable = false, updatable = false)
    private String txHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Network network;

    @Column(name = "confirmation_count", nullable = false, updatable = false)
    private int confirmationCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType eventType;

    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private Instant eventTimestamp;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    static TradeEventEmbeddable fromDomain(TradeEventRecord record) {
        return new TradeEventEmbeddable(
            record.getEventId(),
            record.getTxHash(),
            record.getNetwork(),
            record.getConfirmationCount(),
            record.getEventType(),
            record.getEventTimestamp(),
            record.getRecordedAt()
        );
    }

    TradeEventRecord toDomain() {
        return new TradeEventRecord(eventId, txHash, network, confirmationCount, eventType,
            eventTimestamp, recordedAt);
    }
}
