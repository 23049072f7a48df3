package com.libauto;

import com.libauto.config.LibAutoProperties;
import com.libauto.internal.AutomationJobSeeder;
import com.libauto.internal.CronScheduler;
import com.libauto.internal.JobExecutor;
import com.libauto.internal.QueuePoller;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobExecutionResult;
import com.libauto.job.JobPatch;
import com.libauto.job.JobStore;
import com.libauto.queue.QueueStatus;
import com.libauto.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for the host application: manual triggers, status queries and
 * enable/disable of automation jobs.
 */
@Service
public class AutomationService {

    private static final Logger log = LoggerFactory.getLogger(AutomationService.class);
    public static final String MANUAL_TRIGGER = "MANUAL";
    static final int RECENT_LOG_LIMIT = 10;

    private final JobStore jobStore;
    private final JobExecutor jobExecutor;
    private final CronScheduler cronScheduler;
    private final WorkQueue workQueue;
    private final AutomationJobSeeder jobSeeder;
    private final ObjectProvider<QueuePoller> queuePoller;
    private final boolean schedulerEnabled;
    private volatile boolean initialized = false;
    private volatile boolean shutDown = false;

    public AutomationService(
            JobStore jobStore,
            JobExecutor jobExecutor,
            CronScheduler cronScheduler,
            WorkQueue workQueue,
            AutomationJobSeeder jobSeeder,
            ObjectProvider<QueuePoller> queuePoller,
            LibAutoProperties properties) {
        this.jobStore = jobStore;
        this.jobExecutor = jobExecutor;
        this.cronScheduler = cronScheduler;
        this.workQueue = workQueue;
        this.jobSeeder = jobSeeder;
        this.queuePoller = queuePoller;
        this.schedulerEnabled = properties.getScheduler().isEnabled();
    }

    /**
     * Seeds configured jobs and starts a timer for every enabled job. Calling it
     * again is a no-op.
     *
     * @throws IllegalStateException after {@link #shutdown()}, whose cron thread and
     *         queue workers are not restarted
     */
    public synchronized void initialize() {
        if (shutDown) {
            throw new IllegalStateException("Automation has been shut down and cannot be initialized again");
        }
        if (initialized) {
            return;
        }
        jobSeeder.seed();
        if (schedulerEnabled) {
            cronScheduler.loadEnabledJobs();
        } else {
            log.info("Cron scheduling disabled (libauto.scheduler.enabled=false); jobs run only when triggered");
        }
        initialized = true;
        log.info("Automation initialized: {} scheduled job(s), queues {}",
                cronScheduler.getScheduledJobCount(), workQueue.getQueueNames());
    }

    /**
     * Runs a job now in the calling thread, through the same path as a cron
     * firing.
     *
     * @throws JobNotFoundException if no job has that id
     * @throws JobDisabledException if the job is disabled
     */
    public JobExecutionResult triggerJob(String jobId) {
        return triggerJob(jobId, MANUAL_TRIGGER);
    }

    public JobExecutionResult triggerJob(String jobId, String triggeredBy) {
        AutomationJob job = jobStore.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.isEnabled()) {
            throw new JobDisabledException(job.getId(), job.getName());
        }
        String initiator = triggeredBy == null || triggeredBy.isBlank() ? MANUAL_TRIGGER : triggeredBy;
        log.info("Job {} ({}) triggered by {}", job.getName(), jobId, initiator);
        return jobExecutor.executeJob(job, initiator);
    }

    public JobStatusView getJobStatus(String jobId) {
        AutomationJob job = jobStore.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return new JobStatusView(job, jobStore.findRecentLogs(jobId, RECENT_LOG_LIMIT));
    }

    /**
     * All jobs ordered by name.
     */
    public List<AutomationJob> getAllJobs() {
        return jobStore.findAllJobs();
    }

    public Map<String, QueueStatus> getQueueStatus() {
        return workQueue.getQueueStatus();
    }

    public SystemHealth getSystemHealth() {
        return new SystemHealth(initialized, cronScheduler.getScheduledJobCount(), workQueue.getQueueNames().size());
    }

    /**
     * Enables or disables a job and starts or stops its timer to match. A job
     * whose schedule does not parse is not enabled.
     *
     * @throws InvalidScheduleException when enabling a job with a bad schedule
     */
    public AutomationJob setJobEnabled(String jobId, boolean enabled) {
        if (enabled) {
            AutomationJob current = jobStore.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            cronScheduler.validate(current.getSchedule());
        }
        JobPatch patch = JobPatch.create().enabled(enabled);
        if (!enabled) {
            patch.nextRunAt(null);
        }
        AutomationJob job = jobStore.updateJob(jobId, patch).orElseThrow(() -> new JobNotFoundException(jobId));
        if (enabled) {
            if (schedulerEnabled && initialized) {
                cronScheduler.schedule(job);
            }
        } else {
            cronScheduler.unschedule(jobId);
        }
        log.info("Job {} ({}) {}", job.getName(), jobId, enabled ? "enabled" : "disabled");
        return job;
    }

    /**
     * Re-reads a job after its schedule changed and replaces its timer.
     */
    public AutomationJob rescheduleJob(String jobId) {
        AutomationJob job = jobStore.getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.isEnabled() && schedulerEnabled) {
            cronScheduler.schedule(job);
        } else {
            cronScheduler.unschedule(jobId);
        }
        return job;
    }

    /**
     * Cancels every timer, then stops the queue workers and waits for in-flight
     * items. The database connection pool is closed by the container afterwards.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        log.info("Shutting down automation...");
        cronScheduler.shutdown();
        QueuePoller poller = queuePoller.getIfAvailable();
        if (poller != null) {
            poller.close();
        }
        initialized = false;
        log.info("Automation shut down");
    }

    public boolean isInitialized() {
        return initialized;
    }
}
