package com.flagship.chain_webhooks.trade;

/**
 * Confirmation state of an escrow trade's deposit.
 *
 * PENDING -> CONFIRMED -> COMPLETED, and PENDING/CONFIRMED -> FAILED.
 */
public enum TradeStatus {
    /**
     * Fewer confirmations than the threshold have been observed.
     * Initial state, created by the first event for a trade.
     */
    PENDING,

    /**
     * The confirmation threshold has been reached.
     */
    CONFIRMED,

    /**
     * Final confirmation received after the trade was confirmed.
     * Terminal.
     */
    COMPLETED,

    /**
     * Processing of the trade's events was abandoned.
     * Terminal.
     */
    FAILED
}
