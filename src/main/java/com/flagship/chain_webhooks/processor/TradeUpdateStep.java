package com.flagship.chain_webhooks.processor;

import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import com.flagship.chain_webhooks.trade.TradeConfirmationService;
import com.flagship.chain_webhooks.trade.TradeUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One processing attempt for an event: apply it to its trade and report the
 * outcome as a {@link ProcessingResult}. Never throws.
 */
@RequiredArgsConstructor
@Slf4j
public class TradeUpdateStep {

    private final TradeConfirmationService confirmationService;
    private final WebhookMetrics metrics;

    public ProcessingResult apply(Event event) {
        try {
            TradeUpdate update = confirmationService.applyEvent(event);
            return update.isApplied() ? ProcessingResult.success() : ProcessingResult.duplicate();
        } catch (Exception e) {
            log.debug("Trade update attempt failed", e);
            return ProcessingResult.failure(e);
        }
    }

    /**
     * Best effort: a failure here is logged and counted, never rethrown.
     */
    public void markTradeFailed(String tradeId, String reason) {
        try {
            confirmationService.markFailed(tradeId, reason);
        } catch (Exception e) {
            metrics.recordFailMarkError();
            log.error("Could not mark trade {} as failed: {}", tradeId, e.getMessage());
        }
    }
}
