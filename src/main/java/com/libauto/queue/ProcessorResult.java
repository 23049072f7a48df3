package com.libauto.queue;

import java.util.Map;

/**
 * Returned by a {@link QueueProcessor}. An unsuccessful result is treated like a
 * thrown exception: the item is retried while attempts remain.
 */
public record ProcessorResult(boolean success, long recordsProcessed, String errorMessage, Map<String, Object> details) {

    public ProcessorResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ProcessorResult success(long recordsProcessed) {
        return new ProcessorResult(true, recordsProcessed, null, Map.of());
    }

    public static ProcessorResult success(long recordsProcessed, Map<String, Object> details) {
        return new ProcessorResult(true, recordsProcessed, null, details);
    }

    public static ProcessorResult failure(String errorMessage, long recordsProcessed) {
        return new ProcessorResult(false, recordsProcessed, errorMessage, Map.of());
    }
}
