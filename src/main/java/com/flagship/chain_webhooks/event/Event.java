package com.flagship.chain_webhooks.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A confirmation notification accepted by the webhook receiver.
 *
 * Immutable: retries and replays derive new instances through
 * {@link #withRetryCount(int)} and {@link #asReplay()}.
 *
 * Key properties:
 * - eventId is assigned once by the receiver and never reused
 * - data is an opaque bag of provider fields; only the fields above are typed
 * - replay marks an event re-enqueued from the dead letter queue
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Event {
    String eventId;
    String tradeId;
    Network network;
    String txHash;
    int confirmationCount;
    EventType eventType;
    Instant timestamp;
    Map<String, Object> data;
    int retryCount;
    boolean replay;

    /**
     * Creates a fresh event with a new id, retry count 0.
     */
    public static Event received(String tradeId, Network network, String txHash, int confirmationCount,
                                 EventType eventType, Map<String, Object> data) {
        if (confirmationCount < 0) {
            throw new IllegalArgumentException("Confirmation count must be non-negative: " + confirmationCount);
        }
        return Event.builder()
            .eventId(UUID.randomUUID().toString())
            .tradeId(tradeId)
            .network(network)
            .txHash(txHash)
            .confirmationCount(confirmationCount)
            .eventType(eventType)
            .timestamp(Instant.now())
            .data(data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data)))
            .retryCount(0)
            .replay(false)
            .build();
    }

    public Event withRetryCount(int retryCount) {
        return toBuilder().retryCount(retryCount).build();
    }

    /**
     * Copy used when an operator replays a dead-lettered event: same id,
     * fresh attempt budget.
     */
    public Event asReplay() {
        return toBuilder().retryCount(0).replay(true).build();
    }

    @JsonIgnore
    public boolean isFinal() {
        return eventType == EventType.FINAL_CONFIRMATION;
    }

    /**
     * Identity of the underlying on-chain observation, independent of the
     * delivery. Two deliveries of the same confirmation share a fingerprint.
     */
    public String fingerprint() {
        return txHash + ":" + confirmationCount + ":" + eventType.wireName();
    }
}
