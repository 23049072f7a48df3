package com.libauto.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libauto.config.LibAutoProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkQueueSetTest {

    private QueueItemRepository repository;
    private ObjectProvider<QueueProcessor> processorBeans;
    private ObjectProvider<QueueEventListener> listenerBeans;
    private WorkQueueSet workQueueSet;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        repository = mock(QueueItemRepository.class);
        processorBeans = mock(ObjectProvider.class);
        listenerBeans = mock(ObjectProvider.class);
        when(processorBeans.orderedStream()).thenReturn(Stream.empty());
        when(listenerBeans.orderedStream()).thenReturn(Stream.empty());
        workQueueSet = new WorkQueueSet(repository, new ObjectMapper(), new LibAutoProperties(), processorBeans,
                listenerBeans);
    }

    @Test
    void definesTheFourQueuesWithTheirPolicies() {
        assertThat(workQueueSet.getQueueNames())
                .containsExactly(QueueNames.BACKUP, QueueNames.SYNC, QueueNames.NOTIFICATIONS, QueueNames.MAINTENANCE);

        QueueDefinition backup = workQueueSet.getDefinition(QueueNames.BACKUP);
        assertThat(backup.attempts()).isEqualTo(3);
        assertThat(backup.backoff()).isEqualTo(new BackoffPolicy(BackoffType.EXPONENTIAL, 2000));
        assertThat(backup.removeOnComplete()).isEqualTo(10);
        assertThat(backup.removeOnFail()).isEqualTo(20);

        QueueDefinition sync = workQueueSet.getDefinition(QueueNames.SYNC);
        assertThat(sync.attempts()).isEqualTo(5);
        assertThat(sync.backoff()).isEqualTo(new BackoffPolicy(BackoffType.EXPONENTIAL, 1000));

        QueueDefinition notifications = workQueueSet.getDefinition(QueueNames.NOTIFICATIONS);
        assertThat(notifications.attempts()).isEqualTo(3);
        assertThat(notifications.backoff()).isEqualTo(new BackoffPolicy(BackoffType.FIXED, 5000));

        QueueDefinition maintenance = workQueueSet.getDefinition(QueueNames.MAINTENANCE);
        assertThat(maintenance.attempts()).isEqualTo(2);
        assertThat(maintenance.backoff()).isEqualTo(new BackoffPolicy(BackoffType.FIXED, 10000));
        assertThat(maintenance.removeOnComplete()).isEqualTo(3);
        assertThat(maintenance.removeOnFail()).isEqualTo(5);
    }

    @Test
    void enqueueStoresItemWithQueueAttempts() {
        workQueueSet.registerProcessor(QueueNames.SYNC, "external-sync", context -> ProcessorResult.success(0));

        UUID id = workQueueSet.enqueue(QueueNames.SYNC, "external-sync", Map.of("recordIds", List.of("a", "b")));

        ArgumentCaptor<QueueItem> saved = ArgumentCaptor.forClass(QueueItem.class);
        verify(repository).save(saved.capture());
        QueueItem item = saved.getValue();
        assertThat(item.getId()).isEqualTo(id);
        assertThat(item.getQueueName()).isEqualTo(QueueNames.SYNC);
        assertThat(item.getJobName()).isEqualTo("external-sync");
        assertThat(item.getMaxAttempts()).isEqualTo(5);
        assertThat(item.getAttemptsMade()).isZero();
        assertThat(item.getPayload().path("recordIds")).hasSize(2);
        assertThat(item.getStatus()).isEqualTo("WAITING");
    }

    @Test
    void enqueueOnUnknownQueueFails() {
        assertThatThrownBy(() -> workQueueSet.enqueue("reports", "monthly", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown queue 'reports'");
        verify(repository, never()).save(any());
    }

    @Test
    void enqueueWithoutProcessorFails() {
        assertThatThrownBy(() -> workQueueSet.enqueue(QueueNames.BACKUP, "daily-backup", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No processor registered");
        verify(repository, never()).save(any());
    }

    @Test
    void duplicateProcessorIsRejected() {
        workQueueSet.registerProcessor(QueueNames.BACKUP, "daily-backup", context -> ProcessorResult.success(0));

        assertThatThrownBy(() -> workQueueSet.registerProcessor(QueueNames.BACKUP, "daily-backup",
                context -> ProcessorResult.success(0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void annotatedProcessorBeansAreBoundOnInit() {
        when(processorBeans.orderedStream()).thenReturn(Stream.of(new AnnotatedProcessor()));

        workQueueSet.init();

        assertThat(workQueueSet.processorFor(QueueNames.MAINTENANCE, "integrity-audit"))
                .isInstanceOf(AnnotatedProcessor.class);
        assertThat(workQueueSet.processorFor(QueueNames.BACKUP, "integrity-audit")).isNull();
    }

    @Test
    void statusReflectsRepositoryCounts() {
        QueueItemRepository.QueueCounts counts = mock(QueueItemRepository.QueueCounts.class);
        when(counts.getWaitingCount()).thenReturn(4L);
        when(counts.getActiveCount()).thenReturn(1L);
        when(counts.getCompletedCount()).thenReturn(9L);
        when(counts.getFailedCount()).thenReturn(null);
        when(repository.countByQueue(QueueNames.SYNC)).thenReturn(counts);

        Map<String, QueueStatus> status = workQueueSet.getQueueStatus();

        assertThat(status).containsOnlyKeys(QueueNames.BACKUP, QueueNames.SYNC, QueueNames.NOTIFICATIONS,
                QueueNames.MAINTENANCE);
        assertThat(status.get(QueueNames.SYNC)).isEqualTo(new QueueStatus(4, 1, 9, 0));
        assertThat(status.get(QueueNames.BACKUP)).isEqualTo(QueueStatus.empty());
    }

    @Processor(queue = QueueNames.MAINTENANCE, name = "integrity-audit")
    static class AnnotatedProcessor implements QueueProcessor {
        @Override
        public ProcessorResult process(QueueJobContext context) {
            return ProcessorResult.success(0);
        }
    }
}
