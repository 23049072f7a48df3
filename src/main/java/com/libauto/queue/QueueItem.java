package com.libauto.queue;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A unit of deferred work on a named queue. The lifecycle is derived from the
 * timestamps: waiting until claimed, active while {@code processingStartedAt}
 * is set, then either completed ({@code finishedAt}) or failed ({@code failedAt}).
 */
@Entity
@Table(name = "libauto_queue_items")
public class QueueItem {

    @Id
    private UUID id;

    @Column(name = "queue_name", nullable = false, length = 64)
    private String queueName;

    @Column(name = "job_name", nullable = false, length = 128)
    private String jobName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode payload;

    @Column(name = "attempts_made", nullable = false)
    private int attemptsMade = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts = 1;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "run_at", nullable = false)
    private OffsetDateTime runAt;

    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "processing_started_at")
    private OffsetDateTime processingStartedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    public QueueItem() {
        this.runAt = OffsetDateTime.now();
    }

    public QueueItem(UUID id, String queueName, String jobName, JsonNode payload, int maxAttempts) {
        this();
        this.id = id;
        this.queueName = queueName;
        this.jobName = jobName;
        this.payload = payload;
        this.maxAttempts = maxAttempts;
        this.updatedAt = this.runAt;
    }

    @Transient
    public String getStatus() {
        if (failedAt != null) {
            return "FAILED";
        }
        if (finishedAt != null) {
            return "COMPLETED";
        }
        if (processingStartedAt != null) {
            return "ACTIVE";
        }
        return "WAITING";
    }

    public UUID getId() {
        return id;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getJobName() {
        return jobName;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public int getAttemptsMade() {
        return attemptsMade;
    }

    public void setAttemptsMade(int attemptsMade) {
        this.attemptsMade = attemptsMade;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public OffsetDateTime getRunAt() {
        return runAt;
    }

    public void setRunAt(OffsetDateTime runAt) {
        this.runAt = runAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public OffsetDateTime getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(OffsetDateTime lockedAt) {
        this.lockedAt = lockedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public OffsetDateTime getProcessingStartedAt() {
        return processingStartedAt;
    }

    public void setProcessingStartedAt(OffsetDateTime processingStartedAt) {
        this.processingStartedAt = processingStartedAt;
    }

    public OffsetDateTime getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(OffsetDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(OffsetDateTime failedAt) {
        this.failedAt = failedAt;
    }
}
