package com.libauto.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobExecutionResult;
import com.libauto.job.JobType;
import com.libauto.queue.QueueNames;
import com.libauto.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Looks for unsynced activities first and only enqueues a sync when there is
 * something to push. Config: {@code batchSize} (default 1000).
 */
@Component
public class ExternalSyncHandler extends QueueDispatchHandler {

    private static final Logger log = LoggerFactory.getLogger(ExternalSyncHandler.class);
    static final int DEFAULT_BATCH_SIZE = 1000;

    private final LibraryDataGateway gateway;

    public ExternalSyncHandler(WorkQueue workQueue, LibraryDataGateway gateway) {
        super(workQueue, QueueNames.SYNC, "external-sync");
        this.gateway = gateway;
    }

    @Override
    public JobType getType() {
        return JobType.EXTERNAL_SYNC;
    }

    @Override
    public JobExecutionResult execute(AutomationJob job, ObjectNode config) {
        int batchSize = config.path("batchSize").asInt(DEFAULT_BATCH_SIZE);
        if (batchSize <= 0) {
            batchSize = DEFAULT_BATCH_SIZE;
        }

        List<String> activityIds = gateway.findUnsyncedActivityIds(batchSize);
        if (activityIds.isEmpty()) {
            log.debug("No unsynced activities for job {}", job.getName());
            return JobExecutionResult.success(0, Map.of("message", "No records to sync"));
        }

        Map<String, Object> payload = payloadFor(job, config);
        payload.put("recordIds", activityIds);
        UUID itemId = getWorkQueue().enqueue(getQueueName(), getJobName(), payload);
        return JobExecutionResult.queued(getQueueName(), itemId, activityIds.size());
    }
}
