package com.flagship.chain_webhooks.dlq;

import com.flagship.chain_webhooks.event.Network;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DeadLetterRepository extends JpaRepository<DeadLetterEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DeadLetterEntity d WHERE d.eventId = :eventId")
    Optional<DeadLetterEntity> findByIdForUpdate(@Param("eventId") String eventId);

    List<DeadLetterEntity> findByStatusInOrderByLastFailedAtDesc(Collection<DeadLetterStatus> statuses,
                                                                 Pageable pageable);

    List<DeadLetterEntity> findByStatusInAndNetworkOrderByLastFailedAtDesc(Collection<DeadLetterStatus> statuses,
                                                                           Network network,
                                                                           Pageable pageable);

    long countByStatus(DeadLetterStatus status);
}
