package com.flagship.chain_webhooks.trade;

import lombok.Value;

/**
 * Result of applying one event to a trade.
 */
@Value
public class TradeUpdate {
    Trade trade;
    TradeStatus previousStatus;
    boolean applied;

    public boolean statusChanged() {
        return previousStatus != trade.getStatus();
    }
}
