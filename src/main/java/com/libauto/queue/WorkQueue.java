package com.libauto.queue;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A fixed set of named, durable queues with per-queue retry and retention
 * policies.
 */
public interface WorkQueue {

    /**
     * Adds an item to a queue.
     *
     * @param payload any value Jackson can convert to JSON
     * @return id of the new item
     * @throws IllegalArgumentException if the queue is unknown or no processor is
     *                                  registered for {@code jobName}
     */
    UUID enqueue(String queueName, String jobName, Object payload);

    void registerProcessor(String queueName, String jobName, QueueProcessor processor);

    void addListener(QueueEventListener listener);

    Set<String> getQueueNames();

    /**
     * Counters per queue, in declaration order.
     */
    Map<String, QueueStatus> getQueueStatus();
}
