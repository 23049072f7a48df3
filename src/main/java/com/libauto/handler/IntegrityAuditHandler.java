package com.libauto.handler;

import com.libauto.job.JobType;
import com.libauto.queue.QueueNames;
import com.libauto.queue.WorkQueue;
import org.springframework.stereotype.Component;

@Component
public class IntegrityAuditHandler extends QueueDispatchHandler {

    public IntegrityAuditHandler(WorkQueue workQueue) {
        super(workQueue, QueueNames.MAINTENANCE, "integrity-audit");
    }

    @Override
    public JobType getType() {
        return JobType.INTEGRITY_AUDIT;
    }
}
