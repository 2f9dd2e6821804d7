package com.flagship.chain_webhooks.webhook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.chain_webhooks.webhook.IngestionResult;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Body returned to the webhook provider on 200.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("event_id")
    String eventId;

    @JsonProperty("trade_id")
    String tradeId;

    @JsonProperty("network")
    String network;

    @JsonProperty("tx_hash")
    String txHash;

    public static WebhookResponse from(IngestionResult result) {
        WebhookResponseBuilder builder = WebhookResponse.builder()
            .status(result.getStatus().name().toLowerCase(Locale.ROOT))
            .network(result.getNetwork().pathName())
            .txHash(result.getTxHash());
        if (result.getEvent() != null) {
            builder.eventId(result.getEvent().getEventId())
                .tradeId(result.getEvent().getTradeId());
        }
        return builder.build();
    }
}
