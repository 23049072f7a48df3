package com.libauto.internal;

import com.libauto.config.Durations;
import com.libauto.config.LibAutoProperties;
import com.libauto.job.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Deletes execution logs older than {@code libauto.retention.log-retention}.
 */
@Component
public class AutomationLogSweeper {

    private static final Logger log = LoggerFactory.getLogger(AutomationLogSweeper.class);

    private final JobStore jobStore;
    private final Duration retention;
    private final Clock clock;

    public AutomationLogSweeper(JobStore jobStore, LibAutoProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.retention = Durations.parse(properties.getRetention().getLogRetention());
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${libauto.retention.sweep-interval-ms:3600000}",
            initialDelayString = "${libauto.retention.sweep-interval-ms:3600000}")
    public void sweep() {
        sweep(OffsetDateTime.now(clock));
    }

    /**
     * @return number of deleted logs, 0 when the store failed
     */
    public int sweep(OffsetDateTime now) {
        OffsetDateTime threshold = now.minus(retention);
        try {
            int deleted = jobStore.deleteLogsOlderThan(threshold);
            if (deleted > 0) {
                log.info("Cleaned up {} automation logs older than {}", deleted, retention);
            }
            return deleted;
        } catch (Exception e) {
            log.error("Failed to clean up automation logs older than {}", threshold, e);
            return 0;
        }
    }

    public Duration getRetention() {
        return retention;
    }
}
