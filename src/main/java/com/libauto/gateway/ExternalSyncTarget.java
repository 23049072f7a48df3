package com.libauto.gateway;

import java.util.List;
import java.util.Map;

/**
 * The external spreadsheet/sync target the library mirrors its data to.
 */
public interface ExternalSyncTarget {

    /**
     * Pushes the given activity records to the target.
     */
    SyncOutcome syncActivities(List<String> activityIds);

    /**
     * Appends a row to the target's automation task log.
     *
     * @param category e.g. {@code BACKUP}, {@code SYNC}, {@code NOTIFICATION}
     * @param status   {@code RUNNING}, {@code COMPLETED} or {@code FAILED}
     */
    void logAutomationTask(String taskName, String category, String status, Map<String, Object> details);
}
