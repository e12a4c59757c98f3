package com.flagship.expense_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    /**
     * Deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    List<ProcessedEventEntity> findByEventIdOrderByProcessedAtAsc(UUID eventId);

    /**
     * Retention cleanup.
     *
     * @return number of deleted records
     */
    @Modifying
    @Query("DELETE FROM ProcessedEventEntity e WHERE e.processedAt < :before")
    int deleteEventsProcessedBefore(@Param("before") Instant before);
}
