package com.libauto.config;

import com.libauto.job.JobType;
import com.libauto.queue.BackoffType;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class LibAutoPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void defaultsMatchTheStockDeployment() {
        contextRunner.run(context -> {
            LibAutoProperties properties = context.getBean(LibAutoProperties.class);
            assertThat(properties.getScheduler().isEnabled()).isTrue();
            assertThat(properties.getScheduler().getTimezone()).isEqualTo("Asia/Manila");
            assertThat(properties.getScheduler().getOverlapPolicy()).isEqualTo(LibAutoProperties.OverlapPolicy.SKIP);
            assertThat(properties.getQueues().asMap()).containsOnlyKeys("backup", "sync", "notifications", "maintenance");
            assertThat(properties.getWorker().getStallTimeoutMs()).isEqualTo(60_000);
            assertThat(properties.getRetention().getLogRetention()).isEqualTo("30d");
            assertThat(properties.getRetention().getAuditLogRetention()).isEqualTo("90d");
            assertThat(properties.getAdmin().isEnabled()).isFalse();
            assertThat(properties.getDatabase().isSkipCreate()).isFalse();
            assertThat(properties.getSeedJobs()).isEmpty();
        });
    }

    @Test
    void partialQueueOverrideKeepsOtherDefaults() {
        contextRunner
                .withPropertyValues(
                        "libauto.queues.sync.attempts=7",
                        "libauto.queues.notifications.backoff-type=exponential",
                        "libauto.scheduler.timezone=UTC")
                .run(context -> {
                    LibAutoProperties properties = context.getBean(LibAutoProperties.class);
                    LibAutoProperties.QueueSettings sync = properties.getQueues().getSync();
                    assertThat(sync.getAttempts()).isEqualTo(7);
                    assertThat(sync.getBackoffType()).isEqualTo(BackoffType.EXPONENTIAL);
                    assertThat(sync.getBackoffDelayMs()).isEqualTo(1000);
                    assertThat(sync.getRemoveOnComplete()).isEqualTo(5);

                    LibAutoProperties.QueueSettings notifications = properties.getQueues().getNotifications();
                    assertThat(notifications.getBackoffType()).isEqualTo(BackoffType.EXPONENTIAL);
                    assertThat(notifications.getBackoffDelayMs()).isEqualTo(5000);
                    assertThat(properties.getScheduler().getTimezone()).isEqualTo("UTC");
                });
    }

    @Test
    void bindsSeedJobs() {
        contextRunner
                .withPropertyValues(
                        "libauto.seed-jobs[0].id=daily-backup",
                        "libauto.seed-jobs[0].name=Daily Backup",
                        "libauto.seed-jobs[0].type=DAILY_BACKUP",
                        "libauto.seed-jobs[0].schedule=0 2 * * *",
                        "libauto.seed-jobs[0].config.retention=14")
                .run(context -> {
                    LibAutoProperties.SeedJob job = context.getBean(LibAutoProperties.class).getSeedJobs().get(0);
                    assertThat(job.getName()).isEqualTo("Daily Backup");
                    assertThat(job.getType()).isEqualTo(JobType.DAILY_BACKUP);
                    assertThat(job.getSchedule()).isEqualTo("0 2 * * *");
                    assertThat(job.isEnabled()).isTrue();
                    assertThat(job.getConfig()).containsEntry("retention", "14");
                });
    }

    @EnableConfigurationProperties(LibAutoProperties.class)
    static class PropertiesConfiguration {
    }
}
