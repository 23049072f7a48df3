package com.libauto.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One row per completed execution of an {@link AutomationJob}.
 */
@Entity
@Table(name = "libauto_automation_logs")
public class AutomationLog {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "execution_id", nullable = false, unique = true, length = 128)
    private String executionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionStatus status;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(nullable = false)
    private boolean success;

    @Column(name = "records_processed", nullable = false)
    private long recordsProcessed;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "triggered_by", length = 128)
    private String triggeredBy;

    public AutomationLog() {
    }

    public AutomationLog(String jobId, String executionId, ExecutionStatus status, OffsetDateTime startedAt) {
        this.id = UUID.randomUUID();
        this.jobId = jobId;
        this.executionId = executionId;
        this.status = status;
        this.startedAt = startedAt;
    }

    public UUID getId() {
        return id;
    }

    public String getJobId() {
        return jobId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public long getRecordsProcessed() {
        return recordsProcessed;
    }

    public void setRecordsProcessed(long recordsProcessed) {
        this.recordsProcessed = recordsProcessed;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public void setTriggeredBy(String triggeredBy) {
        this.triggeredBy = triggeredBy;
    }
}
