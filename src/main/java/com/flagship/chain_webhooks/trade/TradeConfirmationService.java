package com.flagship.chain_webhooks.trade;

import com.flagship.chain_webhooks.event.Event;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies confirmation events to trades through the {@link TradeStore}.
 *
 * The whole look-up, state machine step and history append runs inside one
 * store update, so a failure leaves the stored trade untouched and the event
 * can be retried safely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeConfirmationService {

    private final TradeStore tradeStore;
    private final ConfirmationPolicy confirmationPolicy;

    public TradeUpdate applyEvent(Event event) {
        int threshold = confirmationPolicy.getThreshold();
        AtomicReference<TradeStatus> previousStatus = new AtomicReference<>();
        AtomicReference<Boolean> applied = new AtomicReference<>(false);

        Trade stored = tradeStore.update(event.getTradeId(), current -> {
            previousStatus.set(current.getStatus());
            Trade next = current.apply(event, threshold);
            applied.set(next != current);
            return next;
        });

        TradeUpdate update = new TradeUpdate(stored, previousStatus.get(), applied.get());
        if (!update.isApplied()) {
            log.info("Event already applied to trade, skipping: txHash={}, confirmations={}",
                event.getTxHash(), event.getConfirmationCount());
        } else if (update.statusChanged()) {
            log.info("Trade status changed: {} -> {} (confirmations={}, threshold={})",
                update.getPreviousStatus(), stored.getStatus(), stored.getConfirmations(), threshold);
        } else {
            log.debug("Trade updated: status={}, confirmations={}", stored.getStatus(), stored.getConfirmations());
        }
        return update;
    }

    /**
     * Marks a trade FAILED. A trade that does not exist yet is created in
     * FAILED state so the failure is visible.
     */
    public Trade markFailed(String tradeId, String reason) {
        Trade failed = tradeStore.update(tradeId, current -> current.isTerminal() ? current : current.fail(reason));
        log.warn("Trade {} is now {}: {}", tradeId, failed.getStatus(), reason);
        return failed;
    }

    public Trade getTrade(String tradeId) {
        return tradeStore.findById(tradeId)
            .orElseThrow(() -> new NoSuchElementException("Trade not found: " + tradeId));
    }
}
