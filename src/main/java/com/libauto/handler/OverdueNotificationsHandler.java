package com.libauto.handler;

import com.libauto.job.JobType;
import com.libauto.queue.QueueNames;
import com.libauto.queue.WorkQueue;
import org.springframework.stereotype.Component;

@Component
public class OverdueNotificationsHandler extends QueueDispatchHandler {

    public OverdueNotificationsHandler(WorkQueue workQueue) {
        super(workQueue, QueueNames.NOTIFICATIONS, "overdue-notifications");
    }

    @Override
    public JobType getType() {
        return JobType.OVERDUE_NOTIFICATIONS;
    }
}
