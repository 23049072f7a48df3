package com.libauto.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Used when the host application does not provide a sync target. Records what
 * would have been sent.
 */
public class LoggingExternalSyncTarget implements ExternalSyncTarget {

    private static final Logger log = LoggerFactory.getLogger(LoggingExternalSyncTarget.class);

    @Override
    public SyncOutcome syncActivities(List<String> activityIds) {
        log.info("No sync target configured; skipping push of {} activities", activityIds.size());
        return SyncOutcome.synced(0);
    }

    @Override
    public void logAutomationTask(String taskName, String category, String status, Map<String, Object> details) {
        log.info("Automation task {} [{}] {} {}", taskName, category, status, details);
    }
}
