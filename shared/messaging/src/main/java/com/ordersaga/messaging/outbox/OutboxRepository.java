package com.ordersaga.messaging.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {

    /**
     * Locks the oldest unpublished rows for the current transaction. Rows already locked by another
     * relay are skipped rather than waited for.
     */
    @Query(value = """
            SELECT * FROM outbox_events
            WHERE published = false
            ORDER BY created_at, seq
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<OutboxEvent> claimUnpublished(@Param("limit") int limit);

    List<OutboxEvent> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);

    long countByPublishedFalse();

    @Modifying
    int deleteByPublishedTrueAndCreatedAtBefore(Instant cutoff);
}
