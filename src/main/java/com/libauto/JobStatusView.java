package com.libauto;

import com.libauto.job.AutomationJob;
import com.libauto.job.AutomationLog;

import java.util.List;

/**
 * A job together with its most recent execution logs, newest first.
 */
public record JobStatusView(AutomationJob job, List<AutomationLog> recentLogs) {
}
