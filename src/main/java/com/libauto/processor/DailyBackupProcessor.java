package com.libauto.processor;

import com.libauto.gateway.ExternalSyncTarget;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.queue.Processor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import com.libauto.queue.QueueProcessor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

@Component
@Processor(queue = QueueNames.BACKUP, name = "daily-backup")
public class DailyBackupProcessor implements QueueProcessor {

    private final LibraryDataGateway gateway;
    private final ExternalSyncTarget syncTarget;
    private final Clock clock;

    public DailyBackupProcessor(LibraryDataGateway gateway, ExternalSyncTarget syncTarget, Clock clock) {
        this.gateway = gateway;
        this.syncTarget = syncTarget;
        this.clock = clock;
    }

    @Override
    public ProcessorResult process(QueueJobContext context) {
        String taskName = context.getPayload().path("jobName").asText(context.getJobName());
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        syncTarget.logAutomationTask(taskName, "BACKUP", "RUNNING",
                Map.of("startTime", startedAt.toString(), "attempt", context.getAttempt()));

        String label = context.getPayload().path("config").path("label").asText("daily-" + startedAt.toLocalDate());
        long exported = gateway.exportBackup(label);
        context.reportProgress(100);

        syncTarget.logAutomationTask(taskName, "BACKUP", "COMPLETED",
                Map.of("label", label, "recordsProcessed", exported));
        return ProcessorResult.success(exported, Map.of("label", label));
    }
}
