package com.libauto.processor;

import com.libauto.config.Durations;
import com.libauto.config.LibAutoProperties;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.job.JobStore;
import com.libauto.queue.Processor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import com.libauto.queue.QueueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

@Component
@Processor(queue = QueueNames.MAINTENANCE, name = "weekly-cleanup")
public class WeeklyCleanupProcessor implements QueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(WeeklyCleanupProcessor.class);

    private final JobStore jobStore;
    private final LibraryDataGateway gateway;
    private final LibAutoProperties properties;
    private final Clock clock;

    public WeeklyCleanupProcessor(
            JobStore jobStore,
            LibraryDataGateway gateway,
            LibAutoProperties properties,
            Clock clock) {
        this.jobStore = jobStore;
        this.gateway = gateway;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ProcessorResult process(QueueJobContext context) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime logThreshold = now.minus(Durations.parse(properties.getRetention().getLogRetention()));
        OffsetDateTime auditThreshold = now.minus(Durations.parse(properties.getRetention().getAuditLogRetention()));

        int automationLogs = jobStore.deleteLogsOlderThan(logThreshold);
        context.reportProgress(50);
        int auditLogs = gateway.deleteAuditLogsOlderThan(auditThreshold);
        context.reportProgress(100);

        log.info("Weekly cleanup removed {} automation logs and {} audit logs", automationLogs, auditLogs);
        return ProcessorResult.success((long) automationLogs + auditLogs,
                Map.of("automationLogs", automationLogs, "auditLogs", auditLogs));
    }
}
