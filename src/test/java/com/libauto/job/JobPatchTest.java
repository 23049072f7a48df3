package com.libauto.job;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class JobPatchTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 2, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void countsOutcomesAndKeepsRunningMean() {
        AutomationJob job = new AutomationJob("job-1", "Nightly backup", JobType.DAILY_BACKUP, "0 2 * * *", null);

        JobPatch.create().recordOutcome(true, 100).applyTo(job, NOW);
        JobPatch.create().recordOutcome(false, 200).applyTo(job, NOW);
        JobPatch.create().recordOutcome(true, 300).applyTo(job, NOW);

        assertThat(job.getTotalRuns()).isEqualTo(3);
        assertThat(job.getSuccessCount()).isEqualTo(2);
        assertThat(job.getFailureCount()).isEqualTo(1);
        assertThat(job.getSuccessCount() + job.getFailureCount()).isEqualTo(job.getTotalRuns());
        assertThat(job.getAverageDurationMs()).isEqualTo(200);
    }

    @Test
    void onlyTouchesFieldsThatWereSet() {
        AutomationJob job = new AutomationJob("job-1", "Nightly backup", JobType.DAILY_BACKUP, "0 2 * * *", null);
        job.setNextRunAt(NOW.plusDays(1));
        job.setLastRunAt(NOW.minusDays(1));

        JobPatch.create().status(JobStatus.RUNNING).applyTo(job, NOW);

        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getNextRunAt()).isEqualTo(NOW.plusDays(1));
        assertThat(job.getLastRunAt()).isEqualTo(NOW.minusDays(1));
        assertThat(job.getTotalRuns()).isZero();
        assertThat(job.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void explicitNullClearsNextRun() {
        AutomationJob job = new AutomationJob("job-1", "Nightly backup", JobType.DAILY_BACKUP, "0 2 * * *", null);
        job.setNextRunAt(NOW);

        JobPatch.create().enabled(false).nextRunAt(null).applyTo(job, NOW);

        assertThat(job.isEnabled()).isFalse();
        assertThat(job.getNextRunAt()).isNull();
    }

    @Test
    void runningMeanStartsFromFirstSample() {
        assertThat(JobPatch.runningMean(0, 80, 1)).isEqualTo(80);
        assertThat(JobPatch.runningMean(80, 120, 2)).isEqualTo(100);
    }
}
