package com.libauto.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobExecutionResult;
import com.libauto.queue.WorkQueue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Hands the job off to a queue processor. The run counts as successful once the
 * item is enqueued; the processor's own outcome is reported through queue
 * events.
 */
public abstract class QueueDispatchHandler implements JobTypeHandler {

    private final WorkQueue workQueue;
    private final String queueName;
    private final String jobName;

    protected QueueDispatchHandler(WorkQueue workQueue, String queueName, String jobName) {
        this.workQueue = workQueue;
        this.queueName = queueName;
        this.jobName = jobName;
    }

    @Override
    public JobExecutionResult execute(AutomationJob job, ObjectNode config) throws Exception {
        UUID itemId = workQueue.enqueue(queueName, jobName, payloadFor(job, config));
        return JobExecutionResult.queued(queueName, itemId, 0);
    }

    protected Map<String, Object> payloadFor(AutomationJob job, ObjectNode config) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getId());
        payload.put("jobName", job.getName());
        payload.put("config", config);
        return payload;
    }

    protected WorkQueue getWorkQueue() {
        return workQueue;
    }

    protected String getQueueName() {
        return queueName;
    }

    protected String getJobName() {
        return jobName;
    }
}
