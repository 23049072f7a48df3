package com.libauto.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.UUID;
import java.util.function.IntConsumer;

/**
 * What a {@link QueueProcessor} sees of the item it is working on.
 */
public class QueueJobContext {

    private final UUID itemId;
    private final String queueName;
    private final String jobName;
    private final JsonNode payload;
    private final int attemptsMade;
    private final int maxAttempts;
    private final IntConsumer progressReporter;

    public QueueJobContext(
            UUID itemId,
            String queueName,
            String jobName,
            JsonNode payload,
            int attemptsMade,
            int maxAttempts,
            IntConsumer progressReporter) {
        this.itemId = itemId;
        this.queueName = queueName;
        this.jobName = jobName;
        this.payload = payload == null ? MissingNode.getInstance() : payload;
        this.attemptsMade = attemptsMade;
        this.maxAttempts = maxAttempts;
        this.progressReporter = progressReporter;
    }

    public UUID getItemId() {
        return itemId;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getJobName() {
        return jobName;
    }

    public JsonNode getPayload() {
        return payload;
    }

    /**
     * 1-based number of the attempt in progress.
     */
    public int getAttempt() {
        return attemptsMade + 1;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void reportProgress(int percent) {
        if (progressReporter != null) {
            progressReporter.accept(Math.max(0, Math.min(100, percent)));
        }
    }
}
