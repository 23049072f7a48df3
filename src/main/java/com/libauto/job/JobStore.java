package com.libauto.job;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for automation jobs and their execution logs.
 */
public interface JobStore {

    List<AutomationJob> findEnabledJobs();

    List<AutomationJob> findAllJobs();

    Optional<AutomationJob> getJob(String jobId);

    Optional<AutomationJob> findJobByName(String name);

    AutomationJob createJob(AutomationJob job);

    /**
     * Applies the patch atomically and returns the updated job, or empty when no
     * job with that id exists.
     */
    Optional<AutomationJob> updateJob(String jobId, JobPatch patch);

    AutomationLog createLog(AutomationLog log);

    /**
     * Most recent logs for a job, newest first.
     */
    List<AutomationLog> findRecentLogs(String jobId, int limit);

    /**
     * Deletes every log whose start time is strictly before {@code threshold}.
     *
     * @return number of deleted rows
     */
    int deleteLogsOlderThan(OffsetDateTime threshold);
}
