package com.libauto.handler;

import com.libauto.job.JobType;
import com.libauto.queue.QueueNames;
import com.libauto.queue.WorkQueue;
import org.springframework.stereotype.Component;

@Component
public class TeacherNotificationsHandler extends QueueDispatchHandler {

    public TeacherNotificationsHandler(WorkQueue workQueue) {
        super(workQueue, QueueNames.NOTIFICATIONS, "teacher-notifications");
    }

    @Override
    public JobType getType() {
        return JobType.TEACHER_NOTIFICATIONS;
    }
}
