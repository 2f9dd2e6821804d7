package com.flagship.chain_webhooks.admin;

import com.flagship.chain_webhooks.dlq.DeadLetterQueue;
import com.flagship.chain_webhooks.event.EventQueue;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import com.flagship.chain_webhooks.processor.EventProcessor;
import com.flagship.chain_webhooks.trade.ConfirmationPolicy;
import com.flagship.chain_webhooks.trade.TradeStatus;
import com.flagship.chain_webhooks.trade.TradeStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link ProcessingStats} from the stores, the queue and the
 * in-process counters. Counters reset on restart; store counts do not.
 */
@Service
@RequiredArgsConstructor
public class ProcessingStatsService {

    public static final int LATEST_TRANSACTIONS_IN_SNAPSHOT = 5;
    public static final int DEFAULT_RECENT_LIMIT = 5;
    public static final int MAX_RECENT_LIMIT = 100;

    private final TradeStore tradeStore;
    private final DeadLetterQueue deadLetterQueue;
    private final EventQueue eventQueue;
    private final EventProcessor eventProcessor;
    private final WebhookMetrics webhookMetrics;
    private final ConfirmationPolicy confirmationPolicy;

    public ProcessingStats snapshot() {
        Map<TradeStatus, Long> tradesByStatus = tradeStore.countByStatus();
        return ProcessingStats.builder()
            .tradesByStatus(tradesByStatus)
            .pendingConfirmations(tradesByStatus.getOrDefault(TradeStatus.PENDING, 0L))
            .averageConfirmationTimeSeconds(tradeStore.averageConfirmationTime()
                .map(average -> Math.round(average.toMillis() / 10.0) / 100.0)
                .orElse(0.0))
            .queueDepth(eventQueue.size())
            .queueCapacity(eventQueue.capacity())
            .eventsReceived(webhookMetrics.getReceivedTotal())
            .eventsProcessed(webhookMetrics.getProcessedTotal())
            .eventsDeadLettered(webhookMetrics.getDeadLetteredTotal())
            .successRate(Math.round(webhookMetrics.getSuccessRate() * 100.0) / 100.0)
            .unresolvedDeadLetters(deadLetterQueue.countUnresolved())
            .confirmationThreshold(confirmationPolicy.getThreshold())
            .processorRunning(eventProcessor.isRunning())
            .latestTransactions(recentTransactions(LATEST_TRANSACTIONS_IN_SNAPSHOT))
            .generatedAt(Instant.now())
            .build();
    }

    /**
     * @param limit 1..{@value #MAX_RECENT_LIMIT}
     */
    public List<RecentTransaction> recentTransactions(int limit) {
        if (limit < 1 || limit > MAX_RECENT_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_RECENT_LIMIT + ", got " + limit);
        }
        return tradeStore.findRecentlyUpdated(limit).stream()
            .map(RecentTransaction::from)
            .toList();
    }
}
