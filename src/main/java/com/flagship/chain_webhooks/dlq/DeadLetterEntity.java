package com.flagship.chain_webhooks.dlq;

import com.flagship.chain_webhooks.event.Network;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for dead_letter_events. The original event is kept as JSONB so
 * it can be replayed exactly as it was accepted.
 */
@Entity
@Table(
    name = "dead_letter_events",
    indexes = {
        @Index(name = "idx_dead_letter_network", columnList = "network")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DeadLetterEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private String eventId;

    @Column(name = "trade_id", nullable = false, updatable = false)
    private String tradeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Network network;

    @Column(name = "tx_hash", nullable = false, updatable = false)
    private String txHash;

    @Column(name = "error_message", nullable = false)
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeadLetterStatus status;

    @Column(name = "replay_count", nullable = false)
    private int replayCount;

    @Column(name = "first_failed_at", nullable = false, updatable = false)
    private Instant firstFailedAt;

    @Column(name = "last_failed_at", nullable = false)
    private Instant lastFailedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_notes")
    private String resolutionNotes;

    @Version
    private Long version;

    static DeadLetterEntity fromDomain(DeadLetterEvent deadLetter, String payload) {
        return new DeadLetterEntity(
            deadLetter.getEventId(),
            deadLetter.getTradeId(),
            deadLetter.getNetwork(),
            deadLetter.getTxHash(),
            deadLetter.getErrorMessage(),
            deadLetter.getRetryCount(),
            payload,
            deadLetter.getStatus(),
            deadLetter.getReplayCount(),
            deadLetter.getFirstFailedAt(),
            deadLetter.getLastFailedAt(),
            deadLetter.getResolvedAt(),
            deadLetter.getResolutionNotes(),
            null
        );
    }

    /**
     * Identity columns and the first failure time never change.
     */
    void updateFromDomain(DeadLetterEvent deadLetter, String newPayload) {
        this.errorMessage = deadLetter.getErrorMessage();
        this.retryCount = deadLetter.getRetryCount();
        this.payload = newPayload;
        this.status = deadLetter.getStatus();
        this.replayCount = deadLetter.getReplayCount();
        this.lastFailedAt = deadLetter.getLastFailedAt();
        this.resolvedAt = deadLetter.getResolvedAt();
        this.resolutionNotes = deadLetter.getResolutionNotes();
    }
}
