package com.libauto.internal;

import com.libauto.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Job schedules are stored as classic five-field cron ({@code 0 2 * * *}); a
 * leading seconds field of {@code 0} is added before handing them to Spring.
 * Six-field expressions pass through unchanged.
 */
final class CronExpressions {

    private CronExpressions() {
    }

    static String normalize(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(schedule),
                    new IllegalArgumentException("Cron expression must not be blank"));
        }
        String trimmed = schedule.trim();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        String[] fields = trimmed.split("\\s+");
        return fields.length == 5 ? "0 " + String.join(" ", fields) : String.join(" ", fields);
    }

    static CronExpression parse(String schedule) {
        String normalized = normalize(schedule);
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(schedule, e);
        }
    }

    /**
     * Next firing strictly after {@code now}, or {@code null} if the expression
     * never fires again.
     */
    static OffsetDateTime nextRun(CronExpression expression, ZoneId zone, Instant now) {
        ZonedDateTime next = expression.next(now.atZone(zone));
        return next == null ? null : next.toOffsetDateTime();
    }
}
