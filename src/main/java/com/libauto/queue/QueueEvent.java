package com.libauto.queue;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Something that happened to a queue item.
 *
 * @param failedAttempts attempts that failed before this event; for
 *                       {@code COMPLETED} these are the retries that preceded
 *                       the successful attempt
 * @param result         processor result, only for {@code COMPLETED}
 * @param progress       percentage, only for {@code PROGRESS}
 */
public record QueueEvent(
        QueueEventType type,
        String queueName,
        String jobName,
        UUID itemId,
        int failedAttempts,
        long durationMs,
        ProcessorResult result,
        String errorMessage,
        Integer progress,
        OffsetDateTime occurredAt) {

    public static QueueEvent completed(QueueItem item, ProcessorResult result, long durationMs) {
        return new QueueEvent(QueueEventType.COMPLETED, item.getQueueName(), item.getJobName(), item.getId(),
                item.getAttemptsMade(), durationMs, result, null, null, OffsetDateTime.now());
    }

    public static QueueEvent failed(QueueItem item, int failedAttempts, String errorMessage, long durationMs) {
        return new QueueEvent(QueueEventType.FAILED, item.getQueueName(), item.getJobName(), item.getId(),
                failedAttempts, durationMs, null, errorMessage, null, OffsetDateTime.now());
    }

    public static QueueEvent stalled(QueueItem item) {
        return new QueueEvent(QueueEventType.STALLED, item.getQueueName(), item.getJobName(), item.getId(),
                item.getAttemptsMade(), 0L, null, null, null, OffsetDateTime.now());
    }

    public static QueueEvent progress(QueueItem item, int progress) {
        return new QueueEvent(QueueEventType.PROGRESS, item.getQueueName(), item.getJobName(), item.getId(),
                item.getAttemptsMade(), 0L, null, null, progress, OffsetDateTime.now());
    }
}
