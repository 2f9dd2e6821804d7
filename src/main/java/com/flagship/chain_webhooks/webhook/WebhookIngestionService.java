package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.EventQueue;
import com.flagship.chain_webhooks.event.EventType;
import com.flagship.chain_webhooks.event.Network;
import com.flagship.chain_webhooks.exception.EventQueueFullException;
import com.flagship.chain_webhooks.exception.InvalidSignatureException;
import com.flagship.chain_webhooks.exception.MalformedPayloadException;
import com.flagship.chain_webhooks.exception.UnsupportedNetworkException;
import com.flagship.chain_webhooks.observability.CorrelationContext;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw webhook into a queued {@link Event}.
 *
 * Steps, in order:
 * 1. Resolve the network from the URL
 * 2. Authenticate the raw bytes (nothing is parsed before this succeeds)
 * 3. Parse and validate the payload
 * 4. Attribute the transaction to a trade by its addresses
 * 5. Build the event and offer it to the queue without blocking
 *
 * Trade state is never touched here. Duplicate deliveries are enqueued as
 * separate events and deduplicated by the processor.
 */
@Service
@Slf4j
public class WebhookIngestionService {

    private final WebhookAuthenticator authenticator;
    private final WebhookPayloadParser parser;
    private final TradeAddressResolver addressResolver;
    private final EventQueue eventQueue;
    private final WebhookMetrics metrics;
    private final Map<Network, Integer> finalityDepths;

    public WebhookIngestionService(WebhookAuthenticator authenticator,
                                   WebhookPayloadParser parser,
                                   TradeAddressResolver addressResolver,
                                   EventQueue eventQueue,
                                   WebhookMetrics metrics,
                                   @Value("${webhook.finality-depth.eth:12}") int ethDepth,
                                   @Value("${webhook.finality-depth.btc:6}") int btcDepth,
                                   @Value("${webhook.finality-depth.sol:32}") int solDepth,
                                   @Value("${webhook.finality-depth.ltc:6}") int ltcDepth) {
        this.authenticator = authenticator;
        this.parser = parser;
        this.addressResolver = addressResolver;
        this.eventQueue = eventQueue;
        this.metrics = metrics;
        this.finalityDepths = new EnumMap<>(Network.class);
        this.finalityDepths.put(Network.ETH, ethDepth);
        this.finalityDepths.put(Network.BTC, btcDepth);
        this.finalityDepths.put(Network.SOL, solDepth);
        this.finalityDepths.put(Network.LTC, ltcDepth);
    }

    public IngestionResult ingest(String networkPath, byte[] rawBody, String signature) {
        int size = rawBody == null ? 0 : rawBody.length;
        Network network = Network.fromPath(networkPath).orElseThrow(() -> {
            metrics.recordRejected("unknown", "unsupported_network");
            return new UnsupportedNetworkException(networkPath);
        });
        String networkTag = network.pathName();

        try {
            authenticator.authenticate(rawBody, signature);
        } catch (InvalidSignatureException e) {
            metrics.recordRejected(networkTag, "invalid_signature");
            log.warn("Rejected webhook with invalid signature: network={}, size={} bytes, reason={}",
                networkTag, size, e.getMessage());
            throw e;
        }

        WebhookPayload payload;
        try {
            payload = parser.parse(rawBody);
        } catch (MalformedPayloadException e) {
            metrics.recordRejected(networkTag, "malformed");
            log.warn("Rejected malformed webhook: network={}, size={} bytes, reason={}",
                networkTag, size, e.getMessage());
            throw e;
        }

        Optional<String> tradeId = resolveTrade(payload, network);
        if (tradeId.isEmpty()) {
            metrics.recordRejected(networkTag, "unattributed");
            log.info("Webhook not attributable to any trade: network={}, txHash={}, addresses={}",
                networkTag, payload.getTxHash(), payload.getAddresses().size());
            return IngestionResult.unattributed(network, payload.getTxHash());
        }

        EventType eventType = payload.resolveEventType(finalityDepths.get(network));
        Event event = Event.received(tradeId.get(), network, payload.getTxHash(),
            payload.getConfirmations(), eventType, payload.getData());
        CorrelationContext.putEvent(event.getEventId(), event.getTradeId(), networkTag);

        if (!eventQueue.offer(event)) {
            metrics.recordRejected(networkTag, "queue_full");
            throw new EventQueueFullException(eventQueue.capacity());
        }

        metrics.recordReceived(networkTag);
        log.info("Webhook accepted: txHash={}, confirmations={}, type={}, queueDepth={}",
            event.getTxHash(), event.getConfirmationCount(), eventType.wireName(), eventQueue.size());
        return IngestionResult.accepted(event);
    }

    private Optional<String> resolveTrade(WebhookPayload payload, Network network) {
        for (String address : payload.getAddresses()) {
            Optional<String> tradeId = addressResolver.resolveTradeId(address, network);
            if (tradeId.isPresent()) {
                return tradeId;
            }
        }
        return Optional.empty();
    }
}
