package com.libauto.queue;

import java.time.Duration;

/**
 * Delay before the next attempt of a failed queue item.
 *
 * @param type    fixed or exponential
 * @param delayMs base delay in milliseconds
 */
public record BackoffPolicy(BackoffType type, long delayMs) {

    public BackoffPolicy {
        if (type == null) {
            throw new IllegalArgumentException("Backoff type must not be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("Backoff delay must not be negative: " + delayMs);
        }
    }

    /**
     * @param failedAttempts number of attempts that have failed so far, at least 1
     */
    public Duration delayFor(int failedAttempts) {
        int attempts = Math.max(1, failedAttempts);
        if (type == BackoffType.FIXED) {
            return Duration.ofMillis(delayMs);
        }
        // (2^n - 1) * delay: 1x, 3x, 7x, ...
        int exponent = Math.min(attempts, 30);
        long multiplier = (1L << exponent) - 1;
        long millis = multiplier > Long.MAX_VALUE / Math.max(1L, delayMs) ? Long.MAX_VALUE : multiplier * delayMs;
        return Duration.ofMillis(millis);
    }
}
