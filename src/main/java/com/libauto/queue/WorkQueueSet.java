package com.libauto.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libauto.config.LibAutoProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Database-backed {@link WorkQueue}. Holds the queue definitions, the processor
 * registry and the event listeners; items are consumed by
 * {@link com.libauto.internal.QueuePoller}.
 */
@Service
public class WorkQueueSet implements WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(WorkQueueSet.class);

    private final QueueItemRepository repository;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<QueueProcessor> processorBeans;
    private final ObjectProvider<QueueEventListener> listenerBeans;
    private final Map<String, QueueDefinition> definitions;
    private final Map<String, Map<String, QueueProcessor>> processors = new ConcurrentHashMap<>();
    private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();

    public WorkQueueSet(
            QueueItemRepository repository,
            ObjectMapper objectMapper,
            LibAutoProperties properties,
            ObjectProvider<QueueProcessor> processorBeans,
            ObjectProvider<QueueEventListener> listenerBeans) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.processorBeans = processorBeans;
        this.listenerBeans = listenerBeans;

        Map<String, QueueDefinition> configured = new LinkedHashMap<>();
        properties.getQueues().asMap()
                .forEach((name, settings) -> configured.put(name, QueueDefinition.from(name, settings)));
        this.definitions = Collections.unmodifiableMap(configured);
        for (String name : definitions.keySet()) {
            processors.put(name, new ConcurrentHashMap<>());
        }
    }

    @PostConstruct
    public void init() {
        processorBeans.orderedStream()
                .forEach(processor -> registerProcessor(processor.getQueueName(), processor.getJobName(), processor));
        listenerBeans.orderedStream().forEach(this::addListener);

        for (QueueDefinition definition : definitions.values()) {
            log.info("Queue '{}' ready: attempts={}, backoff={} {}ms, processors={}",
                    definition.name(),
                    definition.attempts(),
                    definition.backoff().type(),
                    definition.backoff().delayMs(),
                    processors.get(definition.name()).keySet());
        }
    }

    @Override
    public UUID enqueue(String queueName, String jobName, Object payload) {
        QueueDefinition definition = requireDefinition(queueName);
        if (processorFor(queueName, jobName) == null) {
            throw new IllegalArgumentException(
                    "No processor registered for job '" + jobName + "' on queue '" + queueName + "'");
        }
        JsonNode payloadJson = payload == null ? null : objectMapper.valueToTree(payload);
        QueueItem item = new QueueItem(UUID.randomUUID(), queueName, jobName, payloadJson, definition.attempts());
        repository.save(item);
        log.debug("Enqueued {} on queue {} as item {}", jobName, queueName, item.getId());
        return item.getId();
    }

    @Override
    public void registerProcessor(String queueName, String jobName, QueueProcessor processor) {
        requireDefinition(queueName);
        if (jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank on queue '" + queueName + "'");
        }
        if (processor == null) {
            throw new IllegalArgumentException("Processor must not be null for job '" + jobName + "'");
        }
        QueueProcessor existing = processors.get(queueName).putIfAbsent(jobName, processor);
        if (existing != null && existing != processor) {
            throw new IllegalStateException(
                    "Duplicate processor for job '" + jobName + "' on queue '" + queueName + "'");
        }
    }

    @Override
    public void addListener(QueueEventListener listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    @Override
    public Set<String> getQueueNames() {
        return definitions.keySet();
    }

    @Override
    public Map<String, QueueStatus> getQueueStatus() {
        Map<String, QueueStatus> status = new LinkedHashMap<>();
        for (String queueName : definitions.keySet()) {
            QueueItemRepository.QueueCounts counts = repository.countByQueue(queueName);
            status.put(queueName, counts == null ? QueueStatus.empty()
                    : new QueueStatus(
                            countOrZero(counts.getWaitingCount()),
                            countOrZero(counts.getActiveCount()),
                            countOrZero(counts.getCompletedCount()),
                            countOrZero(counts.getFailedCount())));
        }
        return status;
    }

    public QueueDefinition getDefinition(String queueName) {
        return definitions.get(queueName);
    }

    public Map<String, QueueDefinition> getDefinitions() {
        return definitions;
    }

    public QueueProcessor processorFor(String queueName, String jobName) {
        Map<String, QueueProcessor> byName = processors.get(queueName);
        return byName == null || jobName == null ? null : byName.get(jobName);
    }

    /**
     * Delivers an event to every listener. A failing listener is logged and
     * skipped.
     */
    public void publish(QueueEvent event) {
        for (QueueEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Queue event listener {} failed on {} event for item {}",
                        listener.getClass().getName(), event.type(), event.itemId(), e);
            }
        }
    }

    private QueueDefinition requireDefinition(String queueName) {
        QueueDefinition definition = queueName == null ? null : definitions.get(queueName);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown queue '" + queueName + "'. Known queues: " + definitions.keySet());
        }
        return definition;
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }
}
