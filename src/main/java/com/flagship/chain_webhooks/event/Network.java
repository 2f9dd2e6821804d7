package com.flagship.chain_webhooks.event;

import java.util.Locale;
import java.util.Optional;

/**
 * Blockchain networks the monitoring provider reports on.
 * The lower-case name is the path segment of the webhook URL.
 */
public enum Network {
    ETH,
    BTC,
    SOL,
    LTC;

    public String pathName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a webhook path segment (case-insensitive).
     */
    public static Optional<Network> fromPath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (Network network : values()) {
            if (network.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(network);
            }
        }
        return Optional.empty();
    }
}
