package com.flagship.chain_webhooks.trade;

import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.EventType;
import com.flagship.chain_webhooks.event.Network;
import lombok.Value;

import java.time.Instant;

/**
 * One entry of a trade's append-only event history.
 */
@Value
public class TradeEventRecord {
    String eventId;
    String txHash;
    Network network;
    int confirmationCount;
    EventType eventType;
    Instant eventTimestamp;
    Instant recordedAt;

    public static TradeEventRecord of(Event event, Instant recordedAt) {
        return new TradeEventRecord(
            event.getEventId(),
            event.getTxHash(),
            event.getNetwork(),
            event.getConfirmationCount(),
            event.getEventType(),
            event.getTimestamp(),
            recordedAt
        );
    }

    /**
     * Same format as {@link Event#fingerprint()}.
     */
    public String fingerprint() {
        return txHash + ":" + confirmationCount + ":" + eventType.wireName();
    }
}
