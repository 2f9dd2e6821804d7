package com.flagship.chain_webhooks.trade;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TradeRepository extends JpaRepository<TradeEntity, String> {

    /**
     * Loads a trade with a row lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TradeEntity t WHERE t.tradeId = :tradeId")
    Optional<TradeEntity> findByIdForUpdate(@Param("tradeId") String tradeId);

    @Query("SELECT t.status, COUNT(t) FROM TradeEntity t GROUP BY t.status")
    List<Object[]> countGroupedByStatus();

    /**
     * Mean seconds from creation to CONFIRMED, null when no trade got there.
     */
    @Query(value = """
        SELECT CAST(AVG(EXTRACT(EPOCH FROM (confirmed_at - created_at))) AS double precision)
        FROM trades
        WHERE confirmed_at IS NOT NULL
        """, nativeQuery = true)
    Double averageConfirmationSeconds();

    List<TradeEntity> findAllByOrderByUpdatedAtDesc(Pageable pageable);
}
