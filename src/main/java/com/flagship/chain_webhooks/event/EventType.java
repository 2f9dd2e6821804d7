package com.flagship.chain_webhooks.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of confirmation notification carried by an {@link Event}.
 */
public enum EventType {
    /**
     * The transaction gained confirmations.
     */
    CONFIRMATION("confirmation"),

    /**
     * The provider considers the transaction final on its chain.
     * Completes a trade once it is confirmed.
     */
    FINAL_CONFIRMATION("final_confirmation");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.wireName.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
