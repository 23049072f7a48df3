package com.libauto.job;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one execution of an automation job. A {@code skipped} result means
 * the run never started because a previous run of the same job was still in
 * progress; it is not counted and writes no log.
 */
public record JobExecutionResult(
        boolean success,
        boolean skipped,
        long recordsProcessed,
        long durationMs,
        String errorMessage,
        Map<String, Object> metadata) {

    public JobExecutionResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static JobExecutionResult success(long recordsProcessed) {
        return new JobExecutionResult(true, false, recordsProcessed, 0L, null, Map.of());
    }

    public static JobExecutionResult success(long recordsProcessed, Map<String, Object> metadata) {
        return new JobExecutionResult(true, false, recordsProcessed, 0L, null, metadata);
    }

    /**
     * Work was handed off to a queue; the queue reports its own outcome.
     */
    public static JobExecutionResult queued(String queueName, UUID itemId, long recordsProcessed) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("queue", queueName);
        metadata.put("queueItemId", itemId.toString());
        return new JobExecutionResult(true, false, recordsProcessed, 0L, null, metadata);
    }

    public static JobExecutionResult failure(String errorMessage) {
        return new JobExecutionResult(false, false, 0L, 0L, errorMessage, Map.of());
    }

    public static JobExecutionResult skipped(String reason) {
        return new JobExecutionResult(false, true, 0L, 0L, null, Map.of("reason", reason));
    }

    public JobExecutionResult withDurationMs(long durationMs) {
        return new JobExecutionResult(success, skipped, recordsProcessed, durationMs, errorMessage, metadata);
    }
}
