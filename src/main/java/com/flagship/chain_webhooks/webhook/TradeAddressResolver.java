package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.event.Network;

import java.util.Optional;

/**
 * Maps a deposit address to the trade it was generated for.
 * Provided by the wallet subsystem; an unknown address is not an error.
 */
public interface TradeAddressResolver {

    Optional<String> resolveTradeId(String address, Network network);
}
