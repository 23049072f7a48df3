package com.libauto.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses retention windows given either as ISO-8601 ({@code P30D}) or as a
 * shorthand such as {@code 30d}, {@code 36h}, {@code 15m} or {@code 45s}.
 */
public final class Durations {

    private Durations() {
    }

    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration value must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
        }

        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        char unit = shorthand.charAt(shorthand.length() - 1);
        long amount;
        try {
            amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported duration value: " + value, e);
        }
        return switch (unit) {
            case 'd' -> Duration.ofDays(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 's' -> Duration.ofSeconds(amount);
            default -> throw new IllegalArgumentException("Unsupported duration value: " + value);
        };
    }
}
