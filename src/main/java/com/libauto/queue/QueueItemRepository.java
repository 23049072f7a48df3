package com.libauto.queue;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface QueueItemRepository extends JpaRepository<QueueItem, UUID> {

    /**
     * Per-queue lifecycle counters fetched in a single query.
     */
    interface QueueCounts {
        Long getWaitingCount();

        Long getActiveCount();

        Long getCompletedCount();

        Long getFailedCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT i FROM QueueItem i
            WHERE i.queueName = :queueName
              AND i.processingStartedAt IS NULL
              AND i.finishedAt IS NULL
              AND i.failedAt IS NULL
              AND i.runAt <= CURRENT_TIMESTAMP
            ORDER BY i.createdAt ASC
            """)
    List<QueueItem> findNextItemsForUpdate(@Param("queueName") String queueName, Pageable pageable);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN i.processingStartedAt IS NULL AND i.finishedAt IS NULL AND i.failedAt IS NULL
                THEN 1 ELSE 0 END), 0) AS waitingCount,
              COALESCE(SUM(CASE
                WHEN i.processingStartedAt IS NOT NULL AND i.finishedAt IS NULL AND i.failedAt IS NULL
                THEN 1 ELSE 0 END), 0) AS activeCount,
              COALESCE(SUM(CASE
                WHEN i.finishedAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS completedCount,
              COALESCE(SUM(CASE
                WHEN i.failedAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS failedCount
            FROM QueueItem i
            WHERE i.queueName = :queueName
            """)
    QueueCounts countByQueue(@Param("queueName") String queueName);

    @Query("""
            SELECT i.id FROM QueueItem i
            WHERE i.queueName = :queueName
              AND i.finishedAt IS NOT NULL
            ORDER BY i.finishedAt DESC
            """)
    List<UUID> findCompletedIdsNewestFirst(@Param("queueName") String queueName);

    @Query("""
            SELECT i.id FROM QueueItem i
            WHERE i.queueName = :queueName
              AND i.failedAt IS NOT NULL
            ORDER BY i.failedAt DESC
            """)
    List<UUID> findFailedIdsNewestFirst(@Param("queueName") String queueName);

    @Query("""
            SELECT i FROM QueueItem i
            WHERE i.processingStartedAt IS NOT NULL
              AND i.finishedAt IS NULL
              AND i.failedAt IS NULL
              AND i.lockedAt < :threshold
            ORDER BY i.lockedAt ASC
            """)
    List<QueueItem> findStalledItems(@Param("threshold") OffsetDateTime threshold, Pageable pageable);

    @Modifying
    @Query("""
            UPDATE QueueItem i
            SET i.processingStartedAt = NULL,
                i.lockedAt = NULL,
                i.lockedBy = NULL,
                i.runAt = :now,
                i.updatedAt = :now
            WHERE i.id = :id
              AND i.processingStartedAt IS NOT NULL
              AND i.finishedAt IS NULL
              AND i.failedAt IS NULL
              AND i.lockedAt < :threshold
            """)
    int releaseStalled(
            @Param("id") UUID id,
            @Param("threshold") OffsetDateTime threshold,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE QueueItem i
            SET i.lockedAt = :now
            WHERE i.id IN :ids
              AND i.lockedBy = :lockedBy
              AND i.finishedAt IS NULL
              AND i.failedAt IS NULL
            """)
    int refreshLocks(
            @Param("ids") Collection<UUID> ids,
            @Param("now") OffsetDateTime now,
            @Param("lockedBy") String lockedBy);

    @Modifying
    @Query("""
            UPDATE QueueItem i
            SET i.finishedAt = :now,
                i.failedAt = NULL,
                i.lockedAt = NULL,
                i.lockedBy = NULL,
                i.updatedAt = :now
            WHERE i.id = :id
              AND i.processingStartedAt IS NOT NULL
              AND i.finishedAt IS NULL
              AND i.failedAt IS NULL
              AND i.lockedBy = :lockedBy
            """)
    int markCompleted(@Param("id") UUID id, @Param("now") OffsetDateTime now, @Param("lockedBy") String lockedBy);

    @Modifying
    @Query("""
            UPDATE QueueItem i
            SET i.attemptsMade = :nextAttempts,
                i.errorMessage = :errorMessage,
                i.updatedAt = :now,
                i.failedAt = :now,
                i.finishedAt = NULL,
                i.lockedAt = NULL,
                i.lockedBy = NULL
            WHERE i.id = :id
              AND i.attemptsMade = :expectedAttempts
              AND i.processingStartedAt IS NOT NULL
              AND i.finishedAt IS NULL
              AND i.failedAt IS NULL
              AND i.lockedBy = :lockedBy
            """)
    int markFailedTerminal(
            @Param("id") UUID id,
            @Param("expectedAttempts") int expectedAttempts,
            @Param("nextAttempts") int nextAttempts,
            @Param("errorMessage") String errorMessage,
            @Param("now") OffsetDateTime now,
            @Param("lockedBy") String lockedBy);

    @Modifying
    @Query("""
            UPDATE QueueItem i
            SET i.attemptsMade = :nextAttempts,
                i.errorMessage = :errorMessage,
                i.updatedAt = :now,
                i.processingStartedAt = NULL,
                i.finishedAt = NULL,
                i.failedAt = NULL,
                i.lockedAt = NULL,
                i.lockedBy = NULL,
                i.runAt = :nextRunAt
            WHERE i.id = :id
              AND i.attemptsMade = :expectedAttempts
              AND i.processingStartedAt IS NOT NULL
              AND i.finishedAt IS NULL
              AND i.failedAt IS NULL
              AND i.lockedBy = :lockedBy
            """)
    int markForRetry(
            @Param("id") UUID id,
            @Param("expectedAttempts") int expectedAttempts,
            @Param("nextAttempts") int nextAttempts,
            @Param("errorMessage") String errorMessage,
            @Param("now") OffsetDateTime now,
            @Param("nextRunAt") OffsetDateTime nextRunAt,
            @Param("lockedBy") String lockedBy);
}
