package com.libauto.internal;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libauto.config.LibAutoProperties;
import com.libauto.handler.JobTypeHandler;
import com.libauto.job.AutomationJob;
import com.libauto.job.AutomationLog;
import com.libauto.job.ExecutionStatus;
import com.libauto.job.JobConfigResolver;
import com.libauto.job.JobExecutionResult;
import com.libauto.job.JobPatch;
import com.libauto.job.JobStatus;
import com.libauto.job.JobStore;
import com.libauto.job.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one execution of an automation job:
 * <ol>
 * <li>marks the job RUNNING and stamps {@code lastRunAt}</li>
 * <li>dispatches to the {@link JobTypeHandler} for its type</li>
 * <li>updates the counters, the running mean duration and {@code nextRunAt},
 * and puts the job back to IDLE</li>
 * <li>writes one {@link AutomationLog}</li>
 * </ol>
 * Handler failures never escape; they become a failed result. A job left
 * RUNNING by a failed bookkeeping write is reset to IDLE on a best-effort
 * basis.
 */
@Component
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobStore jobStore;
    private final JobConfigResolver configResolver;
    private final Map<JobType, JobTypeHandler> handlers;
    private final ObjectProvider<LibAutoMetrics> metrics;
    private final LibAutoProperties.OverlapPolicy overlapPolicy;
    private final ZoneId zone;
    private final Clock clock;
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();

    public JobExecutor(
            JobStore jobStore,
            JobConfigResolver configResolver,
            List<JobTypeHandler> handlers,
            ObjectProvider<LibAutoMetrics> metrics,
            LibAutoProperties properties,
            Clock clock) {
        this.jobStore = jobStore;
        this.configResolver = configResolver;
        this.handlers = registerHandlers(handlers);
        this.metrics = metrics;
        this.overlapPolicy = properties.getScheduler().getOverlapPolicy();
        this.zone = ZoneId.of(properties.getScheduler().getTimezone());
        this.clock = clock;
    }

    private static Map<JobType, JobTypeHandler> registerHandlers(List<JobTypeHandler> handlers) {
        Map<JobType, JobTypeHandler> registry = new EnumMap<>(JobType.class);
        for (JobTypeHandler handler : handlers) {
            JobTypeHandler existing = registry.putIfAbsent(handler.getType(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handler for job type " + handler.getType() + ": "
                        + existing.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        for (JobType type : JobType.values()) {
            if (!registry.containsKey(type)) {
                log.warn("No handler registered for job type {}; runs of this type will fail", type);
            }
        }
        return Map.copyOf(registry);
    }

    /**
     * Runs the job in the calling thread.
     *
     * @param triggeredBy who started the run, recorded on the log row
     * @return the outcome; {@code skipped} when the previous run of the same job
     *         is still in progress and overlapping runs are not allowed
     */
    public JobExecutionResult executeJob(AutomationJob job, String triggeredBy) {
        String jobId = job.getId();
        boolean exclusive = overlapPolicy == LibAutoProperties.OverlapPolicy.SKIP;
        if (exclusive && !runningJobs.add(jobId)) {
            log.warn("Skipping run of job {} ({}): previous run still in progress", job.getName(), jobId);
            recordMetric(job.getType(), "skipped");
            return JobExecutionResult.skipped("Previous run still in progress");
        }
        try {
            return run(job, triggeredBy);
        } finally {
            if (exclusive) {
                runningJobs.remove(jobId);
            }
        }
    }

    public boolean isRunning(String jobId) {
        return runningJobs.contains(jobId);
    }

    private JobExecutionResult run(AutomationJob job, String triggeredBy) {
        String jobId = job.getId();
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        long startNanos = System.nanoTime();
        boolean markedRunning = updateJob(jobId, JobPatch.create().status(JobStatus.RUNNING).lastRunAt(startedAt));

        log.info("JOB_START {} ({}) type={} triggeredBy={}", job.getName(), jobId, job.getTypeName(), triggeredBy);

        JobExecutionResult result;
        try {
            ObjectNode config = configResolver.resolve(job.getConfig());
            JobTypeHandler handler = job.getType() == null ? null : handlers.get(job.getType());
            if (handler == null) {
                throw new IllegalStateException("Unknown job type: " + job.getTypeName());
            }
            result = handler.execute(job, config);
            if (result == null) {
                result = JobExecutionResult.failure("Handler returned no result");
            }
        } catch (Exception e) {
            log.error("JOB_FAILURE {} ({}) type={}", job.getName(), jobId, job.getTypeName(), e);
            result = JobExecutionResult.failure(describe(e));
        }

        long durationMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        result = result.withDurationMs(durationMs);
        OffsetDateTime completedAt = OffsetDateTime.now(clock);

        boolean finished = updateJob(jobId, JobPatch.create()
                .status(JobStatus.IDLE)
                .recordOutcome(result.success(), durationMs)
                .nextRunAt(nextRunAt(job)));
        if (markedRunning && !finished) {
            resetToIdle(jobId);
        }
        writeLog(job, triggeredBy, result, startedAt, completedAt);

        if (result.success()) {
            log.info("JOB_SUCCESS {} ({}) in {}ms, records={}",
                    job.getName(), jobId, durationMs, result.recordsProcessed());
        } else {
            log.warn("JOB_FAILURE {} ({}) in {}ms: {}", job.getName(), jobId, durationMs, result.errorMessage());
        }
        recordMetric(job.getType(), result.success() ? "success" : "failure");
        return result;
    }

    private OffsetDateTime nextRunAt(AutomationJob job) {
        try {
            return CronExpressions.nextRun(CronExpressions.parse(job.getSchedule()), zone, clock.instant());
        } catch (Exception e) {
            log.warn("Cannot compute next run of job {} from '{}': {}", job.getId(), job.getSchedule(), e.getMessage());
            return null;
        }
    }

    private boolean updateJob(String jobId, JobPatch patch) {
        try {
            return jobStore.updateJob(jobId, patch).isPresent();
        } catch (Exception e) {
            log.error("Failed to update job {} (status {})", jobId, patch.getStatus(), e);
            return false;
        }
    }

    private void resetToIdle(String jobId) {
        try {
            jobStore.updateJob(jobId, JobPatch.create().status(JobStatus.IDLE));
        } catch (Exception e) {
            log.error("Job {} may be left RUNNING: failed to reset it to IDLE", jobId, e);
        }
    }

    private void writeLog(
            AutomationJob job,
            String triggeredBy,
            JobExecutionResult result,
            OffsetDateTime startedAt,
            OffsetDateTime completedAt) {
        AutomationLog entry = new AutomationLog(
                job.getId(),
                job.getId() + "-" + UUID.randomUUID(),
                result.success() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED,
                startedAt);
        entry.setCompletedAt(completedAt);
        entry.setDurationMs(result.durationMs());
        entry.setSuccess(result.success());
        entry.setRecordsProcessed(result.recordsProcessed());
        entry.setErrorMessage(result.errorMessage());
        entry.setTriggeredBy(triggeredBy);
        try {
            jobStore.createLog(entry);
        } catch (Exception e) {
            log.error("Failed to write execution log {} for job {}", entry.getExecutionId(), job.getId(), e);
        }
    }

    private void recordMetric(JobType type, String outcome) {
        LibAutoMetrics registered = metrics.getIfAvailable();
        if (registered != null) {
            registered.recordExecution(type, outcome);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
