package com.libauto.internal;

import com.libauto.job.JobType;
import com.libauto.queue.QueueEvent;
import com.libauto.queue.QueueEventListener;
import com.libauto.queue.QueueEventType;
import com.libauto.queue.QueueItemRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Queue gauges and execution counters. Gauge reads share a snapshot that is
 * refreshed at most once per second per queue.
 */
public class LibAutoMetrics implements QueueEventListener {

    private static final Logger log = LoggerFactory.getLogger(LibAutoMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final QueueItemRepository repository;
    private final MeterRegistry meterRegistry;
    private final List<String> queueNames;
    private final Map<String, CachedCounts> snapshots = new ConcurrentHashMap<>();

    public LibAutoMetrics(QueueItemRepository repository, MeterRegistry meterRegistry, Collection<String> queueNames) {
        this.repository = repository;
        this.meterRegistry = meterRegistry;
        this.queueNames = List.copyOf(queueNames);
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer registry found. Registering gauges for queues {}", queueNames);
        for (String queueName : queueNames) {
            for (Status status : Status.values()) {
                Gauge.builder("libauto.queue.items", this, metrics -> metrics.countFor(queueName, status))
                        .description("Number of queue items by lifecycle status")
                        .tag("queue", queueName)
                        .tag("status", status.name())
                        .register(meterRegistry);
            }
        }
    }

    @Override
    public void onEvent(QueueEvent event) {
        if (event.type() == QueueEventType.PROGRESS) {
            return;
        }
        Counter.builder("libauto.queue.events")
                .description("Queue item lifecycle events")
                .tag("queue", event.queueName())
                .tag("event", event.type().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    public void recordExecution(JobType type, String outcome) {
        Counter.builder("libauto.job.executions")
                .description("Automation job executions by outcome")
                .tag("type", type == null ? "UNKNOWN" : type.name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private double countFor(String queueName, Status status) {
        Counts counts = snapshotFor(queueName);
        return switch (status) {
            case WAITING -> counts.waiting();
            case ACTIVE -> counts.active();
            case COMPLETED -> counts.completed();
            case FAILED -> counts.failed();
        };
    }

    private Counts snapshotFor(String queueName) {
        long now = System.nanoTime();
        CachedCounts cached = snapshots.get(queueName);
        if (cached != null && now - cached.capturedAtNanos() <= SNAPSHOT_TTL_NANOS) {
            return cached.counts();
        }
        Counts counts = loadCounts(queueName);
        snapshots.put(queueName, new CachedCounts(counts, now));
        return counts;
    }

    private Counts loadCounts(String queueName) {
        try {
            QueueItemRepository.QueueCounts counts = repository.countByQueue(queueName);
            return new Counts(
                    countOrZero(counts.getWaitingCount()),
                    countOrZero(counts.getActiveCount()),
                    countOrZero(counts.getCompletedCount()),
                    countOrZero(counts.getFailedCount()));
        } catch (Exception e) {
            log.trace("Failed to query counts of queue {} for metrics: {}", queueName, e.getMessage());
            return Counts.EMPTY;
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private enum Status {
        WAITING,
        ACTIVE,
        COMPLETED,
        FAILED
    }

    private record Counts(long waiting, long active, long completed, long failed) {
        private static final Counts EMPTY = new Counts(0, 0, 0, 0);
    }

    private record CachedCounts(Counts counts, long capturedAtNanos) {
    }
}
