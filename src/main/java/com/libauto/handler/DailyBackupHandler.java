package com.libauto.handler;

import com.libauto.job.JobType;
import com.libauto.queue.QueueNames;
import com.libauto.queue.WorkQueue;
import org.springframework.stereotype.Component;

/**
 * Config keys are passed through to the backup processor unchanged.
 */
@Component
public class DailyBackupHandler extends QueueDispatchHandler {

    public DailyBackupHandler(WorkQueue workQueue) {
        super(workQueue, QueueNames.BACKUP, "daily-backup");
    }

    @Override
    public JobType getType() {
        return JobType.DAILY_BACKUP;
    }
}
