package com.flagship.chain_webhooks.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.chain_webhooks.event.Event;
import com.flagship.chain_webhooks.event.Network;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * PostgreSQL-backed {@link DeadLetterStore}.
 *
 * Writes take a row lock on the entry so the processor (recording a
 * failure or a successful replay) and operators (replay, resolve) never
 * overwrite each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaDeadLetterStore implements DeadLetterStore {

    private static final Set<DeadLetterStatus> OPEN_STATUSES =
        EnumSet.of(DeadLetterStatus.UNRESOLVED, DeadLetterStatus.SUPERSEDED);

    private final DeadLetterRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public DeadLetterEvent record(Event event, String errorMessage, int retryCount) {
        Optional<DeadLetterEntity> existing = repository.findByIdForUpdate(event.getEventId());

        DeadLetterEntity entity;
        DeadLetterEvent deadLetter;
        if (existing.isPresent()) {
            entity = existing.get();
            deadLetter = toDomain(entity).failedAgain(event, errorMessage, retryCount);
            entity.updateFromDomain(deadLetter, serialize(event));
            log.debug("Dead letter {} updated in place", event.getEventId());
        } else {
            deadLetter = DeadLetterEvent.firstFailure(event, errorMessage, retryCount);
            entity = DeadLetterEntity.fromDomain(deadLetter, serialize(event));
        }

        return toDomain(repository.save(entity));
    }

    @Override
    @Transactional
    public DeadLetterEvent update(String eventId, UnaryOperator<DeadLetterEvent> mutation) {
        DeadLetterEntity entity = repository.findByIdForUpdate(eventId)
            .orElseThrow(() -> new NoSuchElementException("Dead letter not found: " + eventId));

        DeadLetterEvent current = toDomain(entity);
        DeadLetterEvent updated = mutation.apply(current);
        if (updated == current) {
            return current;
        }

        entity.updateFromDomain(updated, serialize(updated.getEvent()));
        return toDomain(repository.save(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DeadLetterEvent> findById(String eventId) {
        return repository.findById(eventId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DeadLetterEvent> findOpen(Network network, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<DeadLetterEntity> entities = network == null
            ? repository.findByStatusInOrderByLastFailedAtDesc(OPEN_STATUSES, page)
            : repository.findByStatusInAndNetworkOrderByLastFailedAtDesc(OPEN_STATUSES, network, page);
        return entities.stream().map(this::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(DeadLetterStatus status) {
        return repository.countByStatus(status);
    }

    private DeadLetterEvent toDomain(DeadLetterEntity entity) {
        return new DeadLetterEvent(
            entity.getEventId(),
            entity.getTradeId(),
            entity.getNetwork(),
            entity.getTxHash(),
            entity.getErrorMessage(),
            entity.getRetryCount(),
            deserialize(entity.getPayload()),
            entity.getStatus(),
            entity.getReplayCount(),
            entity.getFirstFailedAt(),
            entity.getLastFailedAt(),
            entity.getResolvedAt(),
            entity.getResolutionNotes()
        );
    }

    private String serialize(Event event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event " + event.getEventId(), e);
        }
    }

    private Event deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, Event.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored dead letter payload is not a readable event", e);
        }
    }
}
