package com.libauto.job;

import java.time.OffsetDateTime;

/**
 * Partial update applied to a stored {@link AutomationJob} in a single
 * read-modify-write. Only the fields that were set are touched.
 */
public final class JobPatch {

    private JobStatus status;
    private OffsetDateTime lastRunAt;
    private OffsetDateTime nextRunAt;
    private boolean nextRunAtSet;
    private Boolean enabled;
    private Outcome outcome;

    private JobPatch() {
    }

    public static JobPatch create() {
        return new JobPatch();
    }

    public JobPatch status(JobStatus status) {
        this.status = status;
        return this;
    }

    public JobPatch lastRunAt(OffsetDateTime lastRunAt) {
        this.lastRunAt = lastRunAt;
        return this;
    }

    /**
     * Sets the next run time. {@code null} clears it.
     */
    public JobPatch nextRunAt(OffsetDateTime nextRunAt) {
        this.nextRunAt = nextRunAt;
        this.nextRunAtSet = true;
        return this;
    }

    public JobPatch enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    /**
     * Counts one finished run: bumps totalRuns and either successCount or
     * failureCount, and folds the duration into the running mean.
     */
    public JobPatch recordOutcome(boolean success, long durationMs) {
        this.outcome = new Outcome(success, Math.max(0L, durationMs));
        return this;
    }

    public JobStatus getStatus() {
        return status;
    }

    public boolean recordsOutcome() {
        return outcome != null;
    }

    public void applyTo(AutomationJob job, OffsetDateTime now) {
        if (status != null) {
            job.setStatus(status);
        }
        if (lastRunAt != null) {
            job.setLastRunAt(lastRunAt);
        }
        if (nextRunAtSet) {
            job.setNextRunAt(nextRunAt);
        }
        if (enabled != null) {
            job.setEnabled(enabled);
        }
        if (outcome != null) {
            long totalRuns = job.getTotalRuns() + 1;
            job.setTotalRuns(totalRuns);
            if (outcome.success()) {
                job.setSuccessCount(job.getSuccessCount() + 1);
            } else {
                job.setFailureCount(job.getFailureCount() + 1);
            }
            job.setAverageDurationMs(runningMean(job.getAverageDurationMs(), outcome.durationMs(), totalRuns));
        }
        job.setUpdatedAt(now);
    }

    static long runningMean(long previousMean, long sample, long totalRuns) {
        if (totalRuns <= 1) {
            return sample;
        }
        return Math.round(previousMean + (sample - previousMean) / (double) totalRuns);
    }

    private record Outcome(boolean success, long durationMs) {
    }
}
