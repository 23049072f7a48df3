package com.libauto.handler;

import com.libauto.job.JobType;
import com.libauto.queue.QueueNames;
import com.libauto.queue.WorkQueue;
import org.springframework.stereotype.Component;

@Component
public class WeeklyCleanupHandler extends QueueDispatchHandler {

    public WeeklyCleanupHandler(WorkQueue workQueue) {
        super(workQueue, QueueNames.MAINTENANCE, "weekly-cleanup");
    }

    @Override
    public JobType getType() {
        return JobType.WEEKLY_CLEANUP;
    }
}
