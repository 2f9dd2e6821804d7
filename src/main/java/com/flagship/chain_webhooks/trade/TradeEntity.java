package com.flagship.chain_webhooks.trade;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for trade confirmation state.
 *
 * - No setters: state only changes through {@link #updateFromDomain(Trade)}
 * - History rows are only ever appended, never rewritten
 * - confirmedAt/completedAt/failedAt are written once and then kept
 * - @Version guards against lost updates on top of the row lock
 */
@Entity
@Table(
    name = "trades",
    indexes = {
        @Index(name = "idx_trades_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradeEntity {

    @Id
    @Column(name = "trade_id", nullable = false, updatable = false)
    private String tradeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TradeStatus status;

    @Column(nullable = false)
    private int confirmations;

    @Column(name = "final_confirmation_received", nullable = false)
    private boolean finalConfirmationReceived;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_events", joinColumns = @JoinColumn(name = "trade_id"))
    @OrderColumn(name = "position")
    private List<TradeEventEmbeddable> events = new ArrayList<>();

    static TradeEntity fromDomain(Trade trade) {
        TradeEntity entity = new TradeEntity();
        entity.tradeId = trade.getTradeId();
        entity.createdAt = trade.getCreatedAt();
        entity.updateFromDomain(trade);
        return entity;
    }

    public Trade toDomain() {
        List<TradeEventRecord> history = new ArrayList<>(events.size());
        for (TradeEventEmbeddable event : events) {
            history.add(event.toDomain());
        }
        return new Trade(
            tradeId,
            status,
            confirmations,
            finalConfirmationReceived,
            failureReason,
            createdAt,
            confirmedAt,
            completedAt,
            failedAt,
            updatedAt,
            List.copyOf(history)
        );
    }

    /**
     * Copies mutable state from the domain object and appends history
     * entries this entity does not have yet.
     */
    void updateFromDomain(Trade trade) {
        if (trade.getConfirmations() < this.confirmations) {
            throw new IllegalStateException(String.format(
                "Confirmations of trade %s cannot decrease (%d -> %d)",
                tradeId, this.confirmations, trade.getConfirmations()));
        }
        if (trade.getEvents().size() < this.events.size()) {
            throw new IllegalStateException("Event history of trade " + tradeId + " cannot shrink");
        }

        this.status = trade.getStatus();
        this.confirmations = trade.getConfirmations();
        this.finalConfirmationReceived = trade.isFinalConfirmationReceived();
        this.failureReason = trade.getFailureReason();
        this.updatedAt = trade.getUpdatedAt();
        this.confirmedAt = keepFirst(this.confirmedAt, trade.getConfirmedAt());
        this.completedAt = keepFirst(this.completedAt, trade.getCompletedAt());
        this.failedAt = keepFirst(this.failedAt, trade.getFailedAt());

        List<TradeEventRecord> history = trade.getEvents();
        for (int i = this.events.size(); i < history.size(); i++) {
            this.events.add(TradeEventEmbeddable.fromDomain(history.get(i)));
        }
    }

    private static Instant keepFirst(Instant current, Instant candidate) {
        return current != null ? current : candidate;
    }
}
