package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.Network;
import lombok.Value;

/**
 * What the receiver did with an authenticated, well-formed webhook.
 */
@Value
public class IngestionResult {

    public enum Status {
        ACCEPTED,
        UNATTRIBUTED
    }

    Status status;
    Network network;
    String txHash;
    Event event;

    public static IngestionResult accepted(Event event) {
        return new IngestionResult(Status.ACCEPTED, event.getNetwork(), event.getTxHash(), event);
    }

    public static IngestionResult unattributed(Network network, String txHash) {
        return new IngestionResult(Status.UNATTRIBUTED, network, txHash, null);
    }
}
