package com.libauto.internal;

import com.libauto.queue.QueueEvent;
import com.libauto.queue.QueueEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes queue events to the audit log.
 */
@Component
public class AutomationAuditListener implements QueueEventListener {

    private static final Logger log = LoggerFactory.getLogger(AutomationAuditListener.class);

    @Override
    public void onEvent(QueueEvent event) {
        switch (event.type()) {
            case COMPLETED -> log.info("JOB_SUCCESS {}:{} item={} duration={}ms records={} retries={}",
                    event.queueName(), event.jobName(), event.itemId(), event.durationMs(),
                    event.result() == null ? 0 : event.result().recordsProcessed(), event.failedAttempts());
            case FAILED -> log.error("JOB_FAILURE {}:{} item={} after {} attempt(s): {}",
                    event.queueName(), event.jobName(), event.itemId(), event.failedAttempts(),
                    event.errorMessage());
            case STALLED -> log.warn("JOB_STALLED {}:{} item={} released for redelivery",
                    event.queueName(), event.jobName(), event.itemId());
            case PROGRESS -> log.debug("JOB_PROGRESS {}:{} item={} {}%",
                    event.queueName(), event.jobName(), event.itemId(), event.progress());
        }
    }
}
