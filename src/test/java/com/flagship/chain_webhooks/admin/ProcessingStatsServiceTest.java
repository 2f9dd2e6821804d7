package com.flagship.chain_webhooks.admin;

import com.flagship.chain_webhooks.dlq.DeadLetterQueue;
import com.flagship.chain_webhooks.event.EventQueue;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import com.flagship.chain_webhooks.processor.EventProcessor;
import com.flagship.chain_webhooks.support.InMemoryDeadLetterStore;
import com.flagship.chain_webhooks.support.InMemoryTradeStore;
import com.flagship.chain_webhooks.support.TestEvents;
import com.flagship.chain_webhooks.trade.ConfirmationPolicy;
import com.flagship.chain_webhooks.trade.Trade;
import com.flagship.chain_webhooks.trade.TradeStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ProcessingStatsServiceTest {

    private static final Instant BASE = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryTradeStore tradeStore;
    private ProcessingStatsService statsService;

    @BeforeEach
    void setUp() {
        tradeStore = new InMemoryTradeStore();
        EventQueue eventQueue = new EventQueue(10, 1);
        WebhookMetrics metrics = new WebhookMetrics(new SimpleMeterRegistry());
        DeadLetterQueue deadLetterQueue = new DeadLetterQueue(new InMemoryDeadLetterStore(), eventQueue, metrics);
        statsService = new ProcessingStatsService(tradeStore, deadLetterQueue, eventQueue,
            mock(EventProcessor.class), metrics, new ConfirmationPolicy(3));
    }

    private static Trade trade(String tradeId, TradeStatus status, long confirmedAfterSeconds, long updatedAfterSeconds) {
        Instant confirmedAt = confirmedAfterSeconds < 0 ? null : BASE.plusSeconds(confirmedAfterSeconds);
        return new Trade(tradeId, status, status == TradeStatus.PENDING ? 1 : 3, false, null,
            BASE, confirmedAt, null, null, BASE.plusSeconds(updatedAfterSeconds), List.of());
    }

    @Test
    @DisplayName("Average confirmation time covers confirmed trades only")
    void averageConfirmationTime() {
        tradeStore.put(trade("T1", TradeStatus.CONFIRMED, 60, 60));
        tradeStore.put(trade("T2", TradeStatus.COMPLETED, 121, 200));
        tradeStore.put(trade("T3", TradeStatus.PENDING, -1, 10));

        ProcessingStats stats = statsService.snapshot();

        assertEquals(90.5, stats.getAverageConfirmationTimeSeconds(), 0.001);
        assertEquals(1, stats.getPendingConfirmations());
    }

    @Test
    @DisplayName("Average is zero when nothing has been confirmed")
    void averageWithoutConfirmations() {
        tradeStore.put(trade("T1", TradeStatus.PENDING, -1, 10));

        assertEquals(0.0, statsService.snapshot().getAverageConfirmationTimeSeconds());
    }

    @Test
    @DisplayName("Recent transactions are ordered by last activity and carry the last transaction")
    void recentTransactions() {
        tradeStore.put(trade("OLD", TradeStatus.PENDING, -1, 10));
        tradeStore.put(trade("NEW", TradeStatus.CONFIRMED, 30, 500));
        tradeStore.update("LIVE", t -> t.apply(TestEvents.confirmation("LIVE", 2), 3));

        List<RecentTransaction> recent = statsService.recentTransactions(2);

        assertEquals(List.of("LIVE", "NEW"), recent.stream().map(RecentTransaction::getTradeId).toList());
        assertEquals("tx-LIVE", recent.get(0).getTxHash());
        assertEquals("btc", recent.get(0).getNetwork());
        assertNull(recent.get(1).getTxHash());
        assertEquals(3, statsService.snapshot().getLatestTransactions().size());
    }

    @Test
    @DisplayName("Recent transaction limit is bounded")
    void recentLimit() {
        assertThrows(IllegalArgumentException.class, () -> statsService.recentTransactions(0));
        assertThrows(IllegalArgumentException.class,
            () -> statsService.recentTransactions(ProcessingStatsService.MAX_RECENT_LIMIT + 1));
    }
}
