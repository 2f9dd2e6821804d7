package com.flagship.chain_webhooks.dlq;

import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.EventQueue;
import com.flagship.chain_webhooks.event.Network;
import com.flagship.chain_webhooks.exception.EventQueueFullException;
import com.flagship.chain_webhooks.observability.WebhookMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Operations on events that exhausted their retry budget.
 *
 * The processor adds entries and reports successful replays; operators list,
 * resolve and replay them. Entries are never deleted here.
 *
 * Replay flow:
 * 1. The entry is marked SUPERSEDED (only UNRESOLVED entries qualify)
 * 2. A copy of the original event with a fresh attempt budget is enqueued
 * 3. If the queue is full the entry goes back to UNRESOLVED and the caller gets a 503
 * 4. The processor marks the entry RESOLVED when the copy is applied, or
 *    records a new failure (back to UNRESOLVED) when it is not
 */
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueue {

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int MAX_LIST_LIMIT = 500;

    private final DeadLetterStore store;
    private final EventQueue eventQueue;
    private final WebhookMetrics metrics;

    public DeadLetterEvent add(Event event, String errorMessage, int retryCount) {
        DeadLetterEvent deadLetter = store.record(event, errorMessage, retryCount);
        log.warn("Event moved to dead letter queue: eventId={}, tradeId={}, retryCount={}, replays={}, error={}",
            event.getEventId(), event.getTradeId(), retryCount, deadLetter.getReplayCount(), errorMessage);
        return deadLetter;
    }

    /**
     * Open entries (not RESOLVED), most recently failed first.
     *
     * @param network optional network filter
     * @param limit   1..{@value #MAX_LIST_LIMIT}
     */
    public List<DeadLetterEvent> list(Network network, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIST_LIMIT + ", got " + limit);
        }
        return store.findOpen(network, limit);
    }

    public DeadLetterEvent get(String eventId) {
        return store.findById(eventId)
            .orElseThrow(() -> new NoSuchElementException("Dead letter not found: " + eventId));
    }

    public DeadLetterEvent resolve(String eventId, String notes) {
        DeadLetterEvent resolved = store.update(eventId, entry -> entry.resolve(notes));
        log.info("Dead letter {} resolved manually: {}", eventId, notes);
        return resolved;
    }

    /**
     * @throws NoSuchElementException  if there is no entry for the id
     * @throws IllegalStateException   if the entry is resolved or already being replayed
     * @throws EventQueueFullException if the event queue cannot take the replay
     */
    public DeadLetterEvent replay(String eventId) {
        DeadLetterEvent superseded = store.update(eventId, DeadLetterEvent::supersede);
        Event replayEvent = superseded.getEvent().asReplay();

        if (!eventQueue.offer(replayEvent)) {
            store.update(eventId, DeadLetterEvent::revertSupersede);
            log.warn("Replay of dead letter {} rejected, event queue is full", eventId);
            throw new EventQueueFullException(eventQueue.capacity());
        }

        metrics.recordReplayed(replayEvent.getNetwork().pathName());
        log.info("Dead letter {} re-enqueued for trade {} (replay #{})",
            eventId, superseded.getTradeId(), superseded.getReplayCount());
        return superseded;
    }

    /**
     * Called by the processor after a replayed event was applied.
     */
    public void markReplaySucceeded(String eventId) {
        DeadLetterEvent entry = store.update(eventId, DeadLetterEvent::replaySucceeded);
        log.info("Dead letter {} is now {} after replay", eventId, entry.getStatus());
    }

    public long countUnresolved() {
        return store.countByStatus(DeadLetterStatus.UNRESOLVED);
    }

    public long countOpen() {
        return store.countByStatus(DeadLetterStatus.UNRESOLVED) + store.countByStatus(DeadLetterStatus.SUPERSEDED);
    }
}
