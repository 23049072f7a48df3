package com.libauto.queue;

import com.libauto.config.LibAutoProperties;

/**
 * Per-queue retry and retention policy.
 *
 * @param attempts         total attempts per item, including the first
 * @param removeOnComplete how many completed items are retained
 * @param removeOnFail     how many terminally failed items are retained
 * @param concurrency      worker threads for this queue
 */
public record QueueDefinition(
        String name,
        int attempts,
        BackoffPolicy backoff,
        int removeOnComplete,
        int removeOnFail,
        int concurrency) {

    public QueueDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("Queue " + name + " must allow at least one attempt");
        }
        removeOnComplete = Math.max(0, removeOnComplete);
        removeOnFail = Math.max(0, removeOnFail);
        concurrency = Math.max(1, concurrency);
    }

    public static QueueDefinition from(String name, LibAutoProperties.QueueSettings settings) {
        return new QueueDefinition(
                name,
                settings.getAttempts(),
                new BackoffPolicy(settings.getBackoffType(), settings.getBackoffDelayMs()),
                settings.getRemoveOnComplete(),
                settings.getRemoveOnFail(),
                settings.getConcurrency());
    }
}
