package com.flagship.chain_webhooks.trade;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * PostgreSQL-backed {@link TradeStore}.
 *
 * Bridges the domain {@link Trade} and {@link TradeEntity}. Updates take a
 * pessimistic row lock so the processor and any other writer of the same
 * trade never interleave.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTradeStore implements TradeStore {

    private final TradeRepository tradeRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Trade> findById(String tradeId) {
        return tradeRepository.findById(tradeId)
            .map(TradeEntity::toDomain);
    }

    @Override
    @Transactional
    public Trade update(String tradeId, UnaryOperator<Trade> mutation) {
        Optional<TradeEntity> existing = tradeRepository.findByIdForUpdate(tradeId);
        Trade current = existing.map(TradeEntity::toDomain).orElseGet(() -> Trade.pending(tradeId));

        Trade updated = mutation.apply(current);
        if (updated == current) {
            return current;
        }

        TradeEntity entity;
        if (existing.isPresent()) {
            entity = existing.get();
            entity.updateFromDomain(updated);
        } else {
            entity = TradeEntity.fromDomain(updated);
            log.info("Created trade {} in {} status", tradeId, updated.getStatus());
        }

        TradeEntity saved = tradeRepository.save(entity);
        log.debug("Saved trade {}: status={}, confirmations={}",
            tradeId, saved.getStatus(), saved.getConfirmations());
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<TradeStatus, Long> countByStatus() {
        Map<TradeStatus, Long> counts = new EnumMap<>(TradeStatus.class);
        for (TradeStatus status : TradeStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : tradeRepository.countGroupedByStatus()) {
            counts.put((TradeStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Duration> averageConfirmationTime() {
        Double seconds = tradeRepository.averageConfirmationSeconds();
        if (seconds == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.round(seconds * 1000)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findRecentlyUpdated(int limit) {
        return tradeRepository.findAllByOrderByUpdatedAtDesc(PageRequest.of(0, limit)).stream()
            .map(TradeEntity::toDomain)
            .toList();
    }
}
