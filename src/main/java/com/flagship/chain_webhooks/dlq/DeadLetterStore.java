package com.flagship.chain_webhooks.dlq;

import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.Network;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable storage for dead letter entries, keyed by event id.
 * Both write operations are atomic per entry.
 */
public interface DeadLetterStore {

    /**
     * Inserts an entry for the event, or updates the existing entry in place
     * (status back to UNRESOLVED).
     */
    DeadLetterEvent record(Event event, String errorMessage, int retryCount);

    /**
     * Locked read-modify-write of an existing entry.
     *
     * @throws java.util.NoSuchElementException if there is no entry for the id
     */
    DeadLetterEvent update(String eventId, UnaryOperator<DeadLetterEvent> mutation);

    Optional<DeadLetterEvent> findById(String eventId);

    /**
     * Entries that are not RESOLVED, most recently failed first.
     *
     * @param network optional filter, null for all networks
     */
    List<DeadLetterEvent> findOpen(Network network, int limit);

    long countByStatus(DeadLetterStatus status);
}
