package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.event.EventType;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Validated view of a provider payload.
 * eventType is null when the provider did not say; the receiver then
 * derives it from the network's finality depth.
 */
@Value
public class WebhookPayload {
    String txHash;
    int confirmations;
    List<String> addresses;
    EventType eventType;
    Map<String, Object> data;

    public EventType resolveEventType(int finalityDepth) {
        if (eventType != null) {
            return eventType;
        }
        return confirmations >= finalityDepth ? EventType.FINAL_CONFIRMATION : EventType.CONFIRMATION;
    }
}
