package com.libauto.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libauto.config.LibAutoProperties;
import com.libauto.gateway.ExternalSyncTarget;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.gateway.SyncOutcome;
import com.libauto.job.JobStore;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueueProcessorsTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-06-30T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.from(NOW), ZoneOffset.UTC);
    private LibraryDataGateway gateway;
    private ExternalSyncTarget syncTarget;
    private final List<Integer> progress = new ArrayList<>();

    @BeforeEach
    void setUp() {
        gateway = mock(LibraryDataGateway.class);
        syncTarget = mock(ExternalSyncTarget.class);
    }

    @Test
    void overdueFineDefaultsToOnePerDay() {
        when(gateway.markOverdueCheckouts(NOW, BigDecimal.ONE)).thenReturn(6);

        ProcessorResult result = new OverdueNotificationsProcessor(gateway, clock)
                .process(context(QueueNames.NOTIFICATIONS, "overdue-notifications", "{\"config\":{}}"));

        assertThat(result.recordsProcessed()).isEqualTo(6);
        assertThat(result.details()).containsEntry("finePerDay", "1");
    }

    @Test
    void overdueFineCanBeConfigured() {
        when(gateway.markOverdueCheckouts(eq(NOW), any())).thenReturn(2);

        ProcessorResult result = new OverdueNotificationsProcessor(gateway, clock)
                .process(context(QueueNames.NOTIFICATIONS, "overdue-notifications",
                        "{\"config\":{\"finePerDay\":2.50}}"));

        ArgumentCaptor<BigDecimal> fine = ArgumentCaptor.forClass(BigDecimal.class);
        verify(gateway).markOverdueCheckouts(eq(NOW), fine.capture());
        assertThat(fine.getValue()).isEqualByComparingTo("2.50");
        assertThat(result.success()).isTrue();
    }

    @Test
    void negativeFineFallsBackToDefault() {
        new OverdueNotificationsProcessor(gateway, clock)
                .process(context(QueueNames.NOTIFICATIONS, "overdue-notifications",
                        "{\"config\":{\"finePerDay\":-3}}"));

        verify(gateway).markOverdueCheckouts(NOW, BigDecimal.ONE);
    }

    @Test
    void weeklyCleanupPurgesBothLogKindsWithTheirRetention() {
        JobStore jobStore = mock(JobStore.class);
        when(jobStore.deleteLogsOlderThan(NOW.minusDays(30))).thenReturn(12);
        when(gateway.deleteAuditLogsOlderThan(NOW.minusDays(90))).thenReturn(40);

        ProcessorResult result = new WeeklyCleanupProcessor(jobStore, gateway, new LibAutoProperties(), clock)
                .process(context(QueueNames.MAINTENANCE, "weekly-cleanup", "{}"));

        assertThat(result.recordsProcessed()).isEqualTo(52);
        assertThat(result.details()).containsEntry("automationLogs", 12).containsEntry("auditLogs", 40);
        assertThat(progress).containsExactly(50, 100);
    }

    @Test
    void externalSyncPushesRecordIds() {
        when(syncTarget.syncActivities(List.of("a", "b"))).thenReturn(SyncOutcome.synced(2));

        ProcessorResult result = new ExternalSyncProcessor(syncTarget)
                .process(context(QueueNames.SYNC, "external-sync", "{\"recordIds\":[\"a\",\"b\"]}"));

        assertThat(result.success()).isTrue();
        assertThat(result.recordsProcessed()).isEqualTo(2);
        verify(syncTarget).logAutomationTask(eq("external-sync"), eq("SYNC"), eq("COMPLETED"), anyMap());
    }

    @Test
    void rejectedSyncIsReportedAsFailure() {
        when(syncTarget.syncActivities(List.of("a"))).thenReturn(SyncOutcome.failed("quota exceeded"));

        ProcessorResult result = new ExternalSyncProcessor(syncTarget)
                .process(context(QueueNames.SYNC, "external-sync", "{\"recordIds\":[\"a\"]}"));

        assertThat(result.success()).isFalse();
        assertThat(result.errorMessage()).isEqualTo("quota exceeded");
        verify(syncTarget).logAutomationTask(eq("external-sync"), eq("SYNC"), eq("FAILED"), anyMap());
    }

    @Test
    void dailyBackupExportsAndLogsBothEnds() {
        when(gateway.exportBackup("daily-2024-06-30")).thenReturn(1500L);

        ProcessorResult result = new DailyBackupProcessor(gateway, syncTarget, clock)
                .process(context(QueueNames.BACKUP, "daily-backup", "{\"jobName\":\"Daily Backup\",\"config\":{}}"));

        assertThat(result.recordsProcessed()).isEqualTo(1500);
        assertThat(result.details()).containsEntry("label", "daily-2024-06-30");
        verify(syncTarget).logAutomationTask(eq("Daily Backup"), eq("BACKUP"), eq("RUNNING"), anyMap());
        verify(syncTarget).logAutomationTask(eq("Daily Backup"), eq("BACKUP"), eq("COMPLETED"), anyMap());
        assertThat(progress).containsExactly(100);
    }

    @Test
    void teacherNotificationsCountStudentsAcrossGrades() {
        when(gateway.countOverdueStudentsByGradeCategory()).thenReturn(Map.of("Primary", 4, "Junior High", 0,
                "Senior High", 3));

        ProcessorResult result = new TeacherNotificationsProcessor(gateway, syncTarget)
                .process(context(QueueNames.NOTIFICATIONS, "teacher-notifications", "{}"));

        assertThat(result.recordsProcessed()).isEqualTo(7);
        assertThat(result.details()).containsEntry("gradeCategories", 3);
    }

    @Test
    void integrityAuditReportsIssues() {
        when(gateway.findIntegrityIssues()).thenReturn(List.of("checkout 17 references missing book 4"));

        ProcessorResult result = new IntegrityAuditProcessor(gateway)
                .process(context(QueueNames.MAINTENANCE, "integrity-audit", "{}"));

        assertThat(result.recordsProcessed()).isEqualTo(1);
        assertThat(result.details()).containsKey("issues");
    }

    private QueueJobContext context(String queueName, String jobName, String payload) {
        try {
            JsonNode json = objectMapper.readTree(payload);
            return new QueueJobContext(UUID.randomUUID(), queueName, jobName, json, 0, 3, progress::add);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
