package com.libauto.internal;

import com.libauto.config.LibAutoProperties;
import com.libauto.queue.QueueDefinition;
import com.libauto.queue.QueueEvent;
import com.libauto.queue.QueueItem;
import com.libauto.queue.QueueItemRepository;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueProcessor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.WorkQueueSet;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumes the work queues. Each queue has its own bounded worker pool; items
 * are claimed with {@code SKIP LOCKED} so several nodes can share the tables.
 * Failed items are retried with the queue's backoff until its attempts are
 * used up. Items whose lock is not refreshed within the stall timeout are
 * released back to the queue.
 */
@Component
@ConditionalOnProperty(prefix = "libauto.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueuePoller {

    private static final Logger log = LoggerFactory.getLogger(QueuePoller.class);
    private static final int STALL_BATCH_SIZE = 50;

    private final QueueItemRepository repository;
    private final WorkQueueSet workQueueSet;
    private final TransactionTemplate transactionTemplate;
    private final LibAutoProperties.Worker settings;
    private final String nodeId = "node-" + UUID.randomUUID();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
    private final ThreadPoolExecutor pollingExecutor;
    private Map<String, ThreadPoolExecutor> processingExecutors = Map.of();
    private Map<String, AtomicBoolean> pollInProgress = Map.of();

    public QueuePoller(
            QueueItemRepository repository,
            WorkQueueSet workQueueSet,
            TransactionTemplate transactionTemplate,
            LibAutoProperties properties) {
        this.repository = repository;
        this.workQueueSet = workQueueSet;
        this.transactionTemplate = transactionTemplate;
        this.settings = properties.getWorker();

        int queueCount = Math.max(1, workQueueSet.getDefinitions().size());
        this.pollingExecutor = new ThreadPoolExecutor(
                1,
                Math.min(4, queueCount),
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(32, queueCount * 4)),
                new CustomizableThreadFactory("libauto-poll-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @PostConstruct
    public void init() {
        Map<String, ThreadPoolExecutor> executors = new LinkedHashMap<>();
        Map<String, AtomicBoolean> pollState = new ConcurrentHashMap<>();
        for (QueueDefinition definition : workQueueSet.getDefinitions().values()) {
            int workers = definition.concurrency();
            executors.put(definition.name(), new ThreadPoolExecutor(
                    workers,
                    workers,
                    0L,
                    TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(Math.max(32, workers * 8)),
                    new CustomizableThreadFactory("libauto-" + definition.name() + "-"),
                    new ThreadPoolExecutor.CallerRunsPolicy()));
            pollState.put(definition.name(), new AtomicBoolean(false));
        }
        this.processingExecutors = Map.copyOf(executors);
        this.pollInProgress = pollState;
        log.info("Queue poller initialized on {} for queues {}", nodeId, executors.keySet());
    }

    @Scheduled(fixedDelayString = "${libauto.worker.poll-interval-ms:1000}")
    public void poll() {
        if (closed.get()) {
            return;
        }
        for (String queueName : processingExecutors.keySet()) {
            AtomicBoolean inProgress = pollInProgress.get(queueName);
            if (inProgress == null || !inProgress.compareAndSet(false, true)) {
                continue;
            }
            try {
                pollingExecutor.execute(() -> {
                    try {
                        pollQueue(queueName);
                    } catch (Exception e) {
                        log.error("Failed to poll queue {}", queueName, e);
                    } finally {
                        inProgress.set(false);
                    }
                });
            } catch (RejectedExecutionException saturatedPollingQueue) {
                inProgress.set(false);
                log.debug("Skipping poll of queue {} because the polling executor is saturated", queueName);
            }
        }
    }

    void pollQueue(String queueName) {
        ThreadPoolExecutor executor = processingExecutors.get(queueName);
        if (executor == null || closed.get()) {
            return;
        }
        int availableSlots = executor.getMaximumPoolSize() - executor.getActiveCount() - executor.getQueue().size();
        if (availableSlots <= 0) {
            return;
        }

        List<QueueItem> items = transactionTemplate.execute(status -> {
            List<QueueItem> next = repository.findNextItemsForUpdate(queueName, PageRequest.of(0, availableSlots));
            if (next.isEmpty()) {
                return List.<QueueItem>of();
            }
            OffsetDateTime lockTime = OffsetDateTime.now();
            for (QueueItem item : next) {
                item.setProcessingStartedAt(lockTime);
                item.setLockedAt(lockTime);
                item.setLockedBy(nodeId);
                item.setUpdatedAt(lockTime);
            }
            repository.saveAll(next);
            return next;
        });

        if (items == null || items.isEmpty()) {
            return;
        }
        for (QueueItem item : items) {
            inFlight.add(item.getId());
            try {
                executor.execute(() -> processItem(item));
            } catch (RejectedExecutionException shuttingDown) {
                inFlight.remove(item.getId());
                log.debug("Item {} left claimed because queue {} is shutting down", item.getId(), queueName);
            }
        }
    }

    /**
     * Runs one claimed item and records the outcome.
     */
    void processItem(QueueItem item) {
        inFlight.add(item.getId());
        long startNanos = System.nanoTime();
        try {
            QueueProcessor processor = workQueueSet.processorFor(item.getQueueName(), item.getJobName());
            if (processor == null) {
                throw new IllegalStateException("No processor registered for job '" + item.getJobName()
                        + "' on queue '" + item.getQueueName() + "'");
            }
            QueueJobContext context = new QueueJobContext(
                    item.getId(),
                    item.getQueueName(),
                    item.getJobName(),
                    item.getPayload(),
                    item.getAttemptsMade(),
                    item.getMaxAttempts(),
                    percent -> workQueueSet.publish(QueueEvent.progress(item, percent)));

            ProcessorResult result = processor.process(context);
            if (result == null) {
                result = ProcessorResult.success(0);
            }
            if (!result.success()) {
                throw new ProcessorFailedException(result.errorMessage());
            }
            markCompleted(item, result, elapsedMs(startNanos));
        } catch (Exception e) {
            log.warn("Attempt {} of {} failed for {} on queue {} (item {}): {}",
                    item.getAttemptsMade() + 1, item.getMaxAttempts(), item.getJobName(), item.getQueueName(),
                    item.getId(), e.getMessage());
            log.debug("Failure detail for item {}", item.getId(), e);
            handleFailure(item, e, elapsedMs(startNanos));
        } finally {
            inFlight.remove(item.getId());
        }
    }

    private void markCompleted(QueueItem item, ProcessorResult result, long durationMs) {
        OffsetDateTime now = OffsetDateTime.now();
        Integer updated = transactionTemplate.execute(status -> repository.markCompleted(item.getId(), now, nodeId));
        if (toAffectedRows(updated) == 0) {
            log.debug("Completion of item {} ignored: lock was lost", item.getId());
            return;
        }
        workQueueSet.publish(QueueEvent.completed(item, result, durationMs));
        trimRetained(item.getQueueName(), true);
    }

    private void handleFailure(QueueItem item, Exception exception, long durationMs) {
        QueueDefinition definition = workQueueSet.getDefinition(item.getQueueName());
        OffsetDateTime now = OffsetDateTime.now();
        int currentAttempts = item.getAttemptsMade();
        int nextAttempts = currentAttempts + 1;
        String errorMessage = describe(exception);
        int maxAttempts = Math.max(1, item.getMaxAttempts());

        if (nextAttempts >= maxAttempts || definition == null) {
            Integer updated = transactionTemplate.execute(status -> repository.markFailedTerminal(
                    item.getId(), currentAttempts, nextAttempts, errorMessage, now, nodeId));
            if (toAffectedRows(updated) == 0) {
                log.debug("Terminal failure of item {} ignored: lock was lost", item.getId());
                return;
            }
            workQueueSet.publish(QueueEvent.failed(item, nextAttempts, errorMessage, durationMs));
            trimRetained(item.getQueueName(), false);
            return;
        }

        Duration delay = definition.backoff().delayFor(nextAttempts);
        OffsetDateTime nextRunAt = now.plus(delay);
        Integer updated = transactionTemplate.execute(status -> repository.markForRetry(
                item.getId(), currentAttempts, nextAttempts, errorMessage, now, nextRunAt, nodeId));
        if (toAffectedRows(updated) == 0) {
            log.debug("Retry of item {} ignored: lock was lost", item.getId());
            return;
        }
        log.info("JOB_RETRY {} on queue {} (item {}) attempt {} of {} in {}ms",
                item.getJobName(), item.getQueueName(), item.getId(), nextAttempts + 1, maxAttempts,
                delay.toMillis());
    }

    /**
     * Keeps only the newest N completed (or failed) items of a queue.
     */
    private void trimRetained(String queueName, boolean completed) {
        QueueDefinition definition = workQueueSet.getDefinition(queueName);
        if (definition == null) {
            return;
        }
        int keep = completed ? definition.removeOnComplete() : definition.removeOnFail();
        try {
            List<UUID> ids = completed
                    ? repository.findCompletedIdsNewestFirst(queueName)
                    : repository.findFailedIdsNewestFirst(queueName);
            if (ids.size() > keep) {
                repository.deleteAllByIdInBatch(new ArrayList<>(ids.subList(keep, ids.size())));
            }
        } catch (Exception e) {
            log.warn("Failed to trim {} items of queue {}", completed ? "completed" : "failed", queueName, e);
        }
    }

    @Scheduled(fixedDelayString = "${libauto.worker.heartbeat-interval-ms:10000}")
    public void heartbeat() {
        if (closed.get() || inFlight.isEmpty()) {
            return;
        }
        List<UUID> ids = List.copyOf(inFlight);
        OffsetDateTime now = OffsetDateTime.now();
        try {
            transactionTemplate.execute(status -> repository.refreshLocks(ids, now, nodeId));
        } catch (Exception e) {
            log.warn("Failed to refresh locks of {} in-flight item(s)", ids.size(), e);
        }
    }

    /**
     * Releases items whose worker stopped refreshing the lock.
     *
     * @return number of items released
     */
    @Scheduled(fixedDelayString = "${libauto.worker.stall-check-interval-ms:30000}")
    public int releaseStalledItems() {
        if (closed.get()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now();
        OffsetDateTime threshold = now.minus(Duration.ofMillis(settings.getStallTimeoutMs()));
        int released = 0;
        try {
            List<QueueItem> stalled = repository.findStalledItems(threshold, PageRequest.of(0, STALL_BATCH_SIZE));
            for (QueueItem item : stalled) {
                Integer updated = transactionTemplate.execute(
                        status -> repository.releaseStalled(item.getId(), threshold, now));
                if (toAffectedRows(updated) > 0) {
                    released++;
                    workQueueSet.publish(QueueEvent.stalled(item));
                }
            }
        } catch (Exception e) {
            log.error("Failed to release stalled queue items", e);
        }
        return released;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops claiming new items and waits for in-flight ones to finish.
     */
    @PreDestroy
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        pollingExecutor.shutdown();
        processingExecutors.values().forEach(ThreadPoolExecutor::shutdown);

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.getShutdownTimeoutMs());
        for (Map.Entry<String, ThreadPoolExecutor> entry : processingExecutors.entrySet()) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                if (!entry.getValue().awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Queue {} did not drain within {}ms; interrupting workers",
                            entry.getKey(), settings.getShutdownTimeoutMs());
                    entry.getValue().shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.getValue().shutdownNow();
            }
        }
        pollingExecutor.shutdownNow();
        log.info("Queue poller on {} closed", nodeId);
    }

    private long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private int toAffectedRows(Integer updatedRows) {
        return updatedRows == null ? 0 : updatedRows;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    static class ProcessorFailedException extends Exception {
        ProcessorFailedException(String message) {
            super(message == null || message.isBlank() ? "Processor reported failure" : message);
        }
    }
}
