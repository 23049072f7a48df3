package com.libauto.internal;

import com.libauto.config.LibAutoProperties;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobPatch;
import com.libauto.job.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps at most one live cron timer per job id. Timers fire on a single
 * dedicated thread and run the job through {@link JobExecutor}.
 */
@Component
public class CronScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);
    static final String TRIGGERED_BY = "SCHEDULER";

    private final JobStore jobStore;
    private final JobExecutor jobExecutor;
    private final TaskScheduler taskScheduler;
    private final ThreadPoolTaskScheduler ownedScheduler;
    private final ZoneId zone;
    private final Clock clock;
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private volatile boolean shutDown = false;

    @Autowired
    public CronScheduler(JobStore jobStore, JobExecutor jobExecutor, LibAutoProperties properties, Clock clock) {
        this(jobStore, jobExecutor, createTaskScheduler(), properties, clock);
    }

    CronScheduler(
            JobStore jobStore,
            JobExecutor jobExecutor,
            TaskScheduler taskScheduler,
            LibAutoProperties properties,
            Clock clock) {
        this.jobStore = jobStore;
        this.jobExecutor = jobExecutor;
        this.taskScheduler = taskScheduler;
        this.ownedScheduler = taskScheduler instanceof ThreadPoolTaskScheduler pool ? pool : null;
        this.zone = ZoneId.of(properties.getScheduler().getTimezone());
        this.clock = clock;
    }

    private static ThreadPoolTaskScheduler createTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("libauto-cron-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Registers or replaces the timer for a job. An invalid schedule throws
     * {@link com.libauto.InvalidScheduleException} and leaves any existing
     * timer and the stored job untouched.
     */
    public void schedule(AutomationJob job) {
        String jobId = job.getId();
        CronExpression expression = CronExpressions.parse(job.getSchedule());
        if (!job.isEnabled()) {
            log.debug("Not scheduling disabled job {} ({})", job.getName(), jobId);
            unschedule(jobId);
            return;
        }

        if (shutDown) {
            throw new IllegalStateException("Cron scheduler has been shut down; cannot schedule job " + jobId);
        }

        CronTrigger trigger = new CronTrigger(CronExpressions.normalize(job.getSchedule()), zone);
        ScheduledFuture<?> timer = taskScheduler.schedule(() -> fire(jobId), trigger);
        ScheduledFuture<?> replaced = timers.put(jobId, timer);
        if (replaced != null) {
            replaced.cancel(false);
        }

        OffsetDateTime nextRunAt = CronExpressions.nextRun(expression, zone, clock.instant());
        try {
            jobStore.updateJob(jobId, JobPatch.create().nextRunAt(nextRunAt));
        } catch (Exception e) {
            log.warn("Scheduled job {} but could not store its next run time", jobId, e);
        }
        log.info("Scheduled job {} ({}) with cron '{}' in {}; next run at {}",
                job.getName(), jobId, job.getSchedule(), zone, nextRunAt);
    }

    /**
     * Checks a cron expression without touching any timer.
     *
     * @throws com.libauto.InvalidScheduleException if it does not parse
     */
    public void validate(String schedule) {
        CronExpressions.parse(schedule);
    }

    /**
     * Schedules every job in the list. A job that fails to schedule is logged and
     * skipped.
     *
     * @return number of jobs scheduled
     */
    public int scheduleAll(List<AutomationJob> jobs) {
        int scheduled = 0;
        for (AutomationJob job : jobs) {
            try {
                schedule(job);
                if (isScheduled(job.getId())) {
                    scheduled++;
                }
            } catch (Exception e) {
                log.error("Failed to schedule job {} ({}) with cron '{}'",
                        job.getName(), job.getId(), job.getSchedule(), e);
            }
        }
        return scheduled;
    }

    /**
     * Loads the enabled jobs from the store and schedules them.
     *
     * @return number of jobs scheduled, 0 when the store cannot be read
     */
    public int loadEnabledJobs() {
        List<AutomationJob> jobs;
        try {
            jobs = jobStore.findEnabledJobs();
        } catch (Exception e) {
            log.error("Failed to load enabled automation jobs", e);
            return 0;
        }
        int scheduled = scheduleAll(jobs);
        log.info("Scheduled {} of {} enabled automation job(s)", scheduled, jobs.size());
        return scheduled;
    }

    public boolean unschedule(String jobId) {
        ScheduledFuture<?> timer = timers.remove(jobId);
        if (timer == null) {
            return false;
        }
        timer.cancel(false);
        log.info("Unscheduled job {}", jobId);
        return true;
    }

    public boolean isScheduled(String jobId) {
        return timers.containsKey(jobId);
    }

    public int getScheduledJobCount() {
        return timers.size();
    }

    public Set<String> getScheduledJobIds() {
        return Set.copyOf(timers.keySet());
    }

    /**
     * Cancels every timer. Runs already in progress finish on their own. The
     * scheduler accepts no new timers afterwards.
     */
    public void shutdown() {
        shutDown = true;
        int cancelled = 0;
        for (String jobId : Set.copyOf(timers.keySet())) {
            ScheduledFuture<?> timer = timers.remove(jobId);
            if (timer != null) {
                timer.cancel(false);
                cancelled++;
            }
        }
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
        log.info("Cron scheduler stopped; cancelled {} timer(s)", cancelled);
    }

    void fire(String jobId) {
        try {
            Optional<AutomationJob> current = jobStore.getJob(jobId);
            if (current.isEmpty() || !current.get().isEnabled()) {
                log.info("Job {} no longer exists or is disabled; dropping its timer", jobId);
                unschedule(jobId);
                return;
            }
            jobExecutor.executeJob(current.get(), TRIGGERED_BY);
        } catch (Exception e) {
            log.error("Scheduled run of job {} failed", jobId, e);
        }
    }
}
