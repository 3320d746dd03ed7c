package com.cricverse.booking.event.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Next rows awaiting relay in insertion order. Rows locked by an overlapping relay are skipped.
     */
    @Query(value = """
            SELECT * FROM outbox_events
            WHERE status IN ('PENDING', 'RETRYING')
            ORDER BY id ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<OutboxEvent> lockRelayBatch(@Param("limit") int limit);

    @Modifying
    @Query("DELETE FROM OutboxEvent o WHERE o.status = :status AND o.publishedAt < :cutoff")
    int deleteInStatusBefore(@Param("status") OutboxEvent.OutboxStatus status,
                             @Param("cutoff") LocalDateTime cutoff);

    /**
     * Published rows are only kept for troubleshooting; FAILED rows stay until handled manually.
     */
    default int purgePublishedBefore(LocalDateTime cutoff) {
        return deleteInStatusBefore(OutboxEvent.OutboxStatus.PUBLISHED, cutoff);
    }
}
