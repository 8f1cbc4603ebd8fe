package com.flagship.card_autopay.notification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationOutboxRepository extends JpaRepository<NotificationOutboxEntity, UUID> {

    /**
     * Oldest unpublished rows still under the retry limit. Rows locked by another publisher are skipped.
     */
    @Query(value = """
        SELECT * FROM notification_outbox
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<NotificationOutboxEntity> findPublishableForUpdate(@Param("maxRetries") int maxRetries,
                                                            @Param("limit") int limit);

    @Query("SELECT COUNT(n) FROM NotificationOutboxEntity n WHERE n.publishedAt IS NULL")
    long countUnpublished();

    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);
}
