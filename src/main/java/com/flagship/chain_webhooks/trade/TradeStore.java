package com.flagship.chain_webhooks.trade;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable trade state, keyed by trade id.
 *
 * Implementations must make {@link #update(String, UnaryOperator)} atomic per
 * trade: the read, the mutation and the write happen as one unit, and
 * concurrent updates of the same trade are serialized.
 */
public interface TradeStore {

    Optional<Trade> findById(String tradeId);

    /**
     * Reads the trade (or a new PENDING trade if none exists), applies the
     * mutation and persists the result. When the mutation returns its input
     * unchanged nothing is written.
     *
     * @return the trade as stored after the update
     */
    Trade update(String tradeId, UnaryOperator<Trade> mutation);

    Map<TradeStatus, Long> countByStatus();

    /**
     * Mean time from creation to CONFIRMED over every trade that reached
     * CONFIRMED, empty when none has.
     */
    Optional<Duration> averageConfirmationTime();

    /**
     * Trades with the most recent activity first.
     */
    List<Trade> findRecentlyUpdated(int limit);
}
