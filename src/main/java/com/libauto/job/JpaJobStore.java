package com.libauto.job;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
public class JpaJobStore implements JobStore {

    private final AutomationJobRepository jobRepository;
    private final AutomationLogRepository logRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaJobStore(
            AutomationJobRepository jobRepository,
            AutomationLogRepository logRepository,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.logRepository = logRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public List<AutomationJob> findEnabledJobs() {
        return jobRepository.findByEnabledTrueOrderByNameAsc();
    }

    @Override
    public List<AutomationJob> findAllJobs() {
        return jobRepository.findAllByOrderByNameAsc();
    }

    @Override
    public Optional<AutomationJob> getJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    @Override
    public Optional<AutomationJob> findJobByName(String name) {
        return jobRepository.findByName(name);
    }

    @Override
    public AutomationJob createJob(AutomationJob job) {
        if (job.getUpdatedAt() == null) {
            job.setUpdatedAt(OffsetDateTime.now(clock));
        }
        return jobRepository.save(job);
    }

    @Override
    public Optional<AutomationJob> updateJob(String jobId, JobPatch patch) {
        Optional<AutomationJob> updated = transactionTemplate.execute(status -> jobRepository.findById(jobId)
                .map(job -> {
                    patch.applyTo(job, OffsetDateTime.now(clock));
                    return jobRepository.save(job);
                }));
        return updated == null ? Optional.empty() : updated;
    }

    @Override
    public AutomationLog createLog(AutomationLog log) {
        return logRepository.save(log);
    }

    @Override
    public List<AutomationLog> findRecentLogs(String jobId, int limit) {
        return logRepository.findRecentByJobId(jobId, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public int deleteLogsOlderThan(OffsetDateTime threshold) {
        Integer deleted = transactionTemplate.execute(status -> logRepository.deleteStartedBefore(threshold));
        return deleted == null ? 0 : deleted;
    }
}
