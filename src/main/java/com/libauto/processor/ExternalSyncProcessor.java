package com.libauto.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.libauto.gateway.ExternalSyncTarget;
import com.libauto.gateway.SyncOutcome;
import com.libauto.queue.Processor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import com.libauto.queue.QueueProcessor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pushes the activity ids carried in the payload ({@code recordIds}) to the
 * sync target. A rejected push is returned as a failure so the queue retries it.
 */
@Component
@Processor(queue = QueueNames.SYNC, name = "external-sync")
public class ExternalSyncProcessor implements QueueProcessor {

    private final ExternalSyncTarget syncTarget;

    public ExternalSyncProcessor(ExternalSyncTarget syncTarget) {
        this.syncTarget = syncTarget;
    }

    @Override
    public ProcessorResult process(QueueJobContext context) {
        String taskName = context.getPayload().path("jobName").asText(context.getJobName());
        List<String> activityIds = new ArrayList<>();
        for (JsonNode id : context.getPayload().path("recordIds")) {
            activityIds.add(id.asText());
        }
        if (activityIds.isEmpty()) {
            return ProcessorResult.success(0, Map.of("message", "No records to sync"));
        }

        SyncOutcome outcome = syncTarget.syncActivities(activityIds);
        if (!outcome.success()) {
            syncTarget.logAutomationTask(taskName, "SYNC", "FAILED",
                    Map.of("error", String.valueOf(outcome.errorMessage()), "attempt", context.getAttempt()));
            return ProcessorResult.failure(outcome.errorMessage(), outcome.recordsProcessed());
        }

        syncTarget.logAutomationTask(taskName, "SYNC", "COMPLETED",
                Map.of("recordsProcessed", outcome.recordsProcessed()));
        return ProcessorResult.success(outcome.recordsProcessed());
    }
}
