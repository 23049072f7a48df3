package com.libauto;

import com.libauto.admin.AutomationAdminController;
import com.libauto.internal.CronScheduler;
import com.libauto.internal.AutomationLogSweeper;
import com.libauto.job.AutomationJob;
import com.libauto.job.ExecutionStatus;
import com.libauto.job.JobExecutionResult;
import com.libauto.job.JobStatus;
import com.libauto.queue.Processor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueEvent;
import com.libauto.queue.QueueEventListener;
import com.libauto.queue.QueueEventType;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import com.libauto.queue.QueueProcessor;
import com.libauto.queue.QueueStatus;
import com.libauto.queue.WorkQueue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = { TestApplication.class, LibAutoIntegrationTest.TestConfig.class })
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public class LibAutoIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("testcontainers.postgresql.host", postgres::getHost);
        registry.add("testcontainers.postgresql.port", postgres::getFirstMappedPort);
        registry.add("testcontainers.postgresql.database", postgres::getDatabaseName);
        registry.add("testcontainers.postgresql.username", postgres::getUsername);
        registry.add("testcontainers.postgresql.password", postgres::getPassword);
    }

    static final ConcurrentLinkedQueue<QueueEvent> events = new ConcurrentLinkedQueue<>();
    static final AtomicInteger flakyCalls = new AtomicInteger(0);

    @Autowired
    AutomationService automationService;

    @Autowired
    WorkQueue workQueue;

    @Autowired
    AutomationLogSweeper logSweeper;

    @Autowired
    CronScheduler cronScheduler;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    ApplicationContext applicationContext;

    @TestConfiguration
    static class TestConfig {

        @Bean
        QueueEventListener recordingListener() {
            return events::add;
        }

        @Bean
        FlakyNoticeProcessor flakyNoticeProcessor() {
            return new FlakyNoticeProcessor();
        }

        @Bean
        DoomedNoticeProcessor doomedNoticeProcessor() {
            return new DoomedNoticeProcessor();
        }
    }

    @Processor(queue = QueueNames.NOTIFICATIONS, name = "flaky-notice")
    static class FlakyNoticeProcessor implements QueueProcessor {
        @Override
        public ProcessorResult process(QueueJobContext context) {
            if (flakyCalls.incrementAndGet() < 3) {
                throw new IllegalStateException("mail server busy");
            }
            return ProcessorResult.success(1);
        }
    }

    @Processor(queue = QueueNames.NOTIFICATIONS, name = "doomed-notice")
    static class DoomedNoticeProcessor implements QueueProcessor {
        @Override
        public ProcessorResult process(QueueJobContext context) {
            return ProcessorResult.failure("recipient unknown", 0);
        }
    }

    @Test
    void shouldSeedAndScheduleConfiguredJobs() {
        assertTrue(automationService.isInitialized());
        assertEquals(3, automationService.getAllJobs().size());

        SystemHealth health = automationService.getSystemHealth();
        assertEquals(2, health.scheduledJobs());
        assertEquals(4, health.activeQueues());

        AutomationJob backup = automationService.getJobStatus("it-backup").job();
        assertNotNull(backup.getNextRunAt());
        assertEquals("integration", backup.getConfig().path("label").asText());
        assertNull(automationService.getJobStatus("it-audit").job().getNextRunAt());
    }

    @Test
    void shouldRunInlineJobAndRecordExecution() {
        JobExecutionResult result = automationService.triggerJob("it-session-expiry");

        assertTrue(result.success());
        JobStatusView status = automationService.getJobStatus("it-session-expiry");
        assertEquals(JobStatus.IDLE, status.job().getStatus());
        assertEquals(1, status.job().getTotalRuns());
        assertEquals(1, status.job().getSuccessCount());
        assertNotNull(status.job().getLastRunAt());
        assertEquals(1, status.recentLogs().size());
        assertEquals(ExecutionStatus.COMPLETED, status.recentLogs().get(0).getStatus());
        assertEquals(AutomationService.MANUAL_TRIGGER, status.recentLogs().get(0).getTriggeredBy());
    }

    @Test
    void shouldDispatchQueuedJobToItsProcessor() {
        JobExecutionResult result = automationService.triggerJob("it-backup");

        assertTrue(result.success());
        UUID itemId = UUID.fromString((String) result.metadata().get("queueItemId"));
        assertEquals(QueueNames.BACKUP, result.metadata().get("queue"));

        await().atMost(Duration.ofSeconds(15)).until(() -> eventFor(itemId, QueueEventType.COMPLETED).isPresent());
        OffsetDateTime finishedAt = jdbcTemplate.queryForObject(
                "SELECT finished_at FROM libauto_queue_items WHERE id = ?", OffsetDateTime.class, itemId);
        assertNotNull(finishedAt);
    }

    @Test
    void shouldRetryFailedItemUntilItSucceeds() {
        UUID itemId = workQueue.enqueue(QueueNames.NOTIFICATIONS, "flaky-notice", Map.of("studentId", "S-1001"));

        await().atMost(Duration.ofSeconds(20)).until(() -> eventFor(itemId, QueueEventType.COMPLETED).isPresent());

        QueueEvent completed = eventFor(itemId, QueueEventType.COMPLETED).orElseThrow();
        assertEquals(2, completed.failedAttempts());
        assertTrue(eventFor(itemId, QueueEventType.FAILED).isEmpty());
        assertEquals(3, flakyCalls.get());
        Integer attempts = jdbcTemplate.queryForObject(
                "SELECT attempts_made FROM libauto_queue_items WHERE id = ?", Integer.class, itemId);
        assertEquals(2, attempts);
    }

    @Test
    void shouldFailItemAfterLastAttempt() {
        UUID itemId = workQueue.enqueue(QueueNames.NOTIFICATIONS, "doomed-notice", Map.of());

        await().atMost(Duration.ofSeconds(20)).until(() -> eventFor(itemId, QueueEventType.FAILED).isPresent());

        QueueEvent failed = eventFor(itemId, QueueEventType.FAILED).orElseThrow();
        assertEquals(3, failed.failedAttempts());
        assertEquals("recipient unknown", failed.errorMessage());
        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT attempts_made, error_message, failed_at FROM libauto_queue_items WHERE id = ?", itemId);
        assertEquals(3, row.get("attempts_made"));
        assertEquals("recipient unknown", row.get("error_message"));
        assertNotNull(row.get("failed_at"));

        QueueStatus notifications = automationService.getQueueStatus().get(QueueNames.NOTIFICATIONS);
        assertTrue(notifications.failed() >= 1);
    }

    @Test
    void shouldRejectUnknownQueueAndDisabledJob() {
        assertThrows(IllegalArgumentException.class, () -> workQueue.enqueue("reports", "monthly", Map.of()));
        assertThrows(JobDisabledException.class, () -> automationService.triggerJob("it-audit"));
        assertThrows(JobNotFoundException.class, () -> automationService.triggerJob("does-not-exist"));
    }

    @Test
    void shouldIsolateRowWithUnknownJobType() {
        jdbcTemplate.update("""
                INSERT INTO libauto_automation_jobs (id, name, type, schedule)
                VALUES ('it-legacy-sheets', 'it-legacy-sheets', 'GOOGLE_SHEETS_SYNC', '0 4 1 1 *')
                """);
        try {
            assertEquals(3, cronScheduler.loadEnabledJobs());
            assertTrue(cronScheduler.isScheduled("it-backup"));
            assertTrue(cronScheduler.isScheduled("it-legacy-sheets"));

            JobExecutionResult result = automationService.triggerJob("it-legacy-sheets");

            assertFalse(result.success());
            assertEquals("Unknown job type: GOOGLE_SHEETS_SYNC", result.errorMessage());
            JobStatusView status = automationService.getJobStatus("it-legacy-sheets");
            assertNull(status.job().getType());
            assertEquals("GOOGLE_SHEETS_SYNC", status.job().getTypeName());
            assertEquals(JobStatus.IDLE, status.job().getStatus());
            assertEquals(1, status.job().getFailureCount());
            assertEquals(ExecutionStatus.FAILED, status.recentLogs().get(0).getStatus());
        } finally {
            cronScheduler.unschedule("it-legacy-sheets");
            jdbcTemplate.update("DELETE FROM libauto_automation_jobs WHERE id = 'it-legacy-sheets'");
        }
    }

    @Test
    void shouldSweepExpiredLogs() {
        OffsetDateTime now = OffsetDateTime.now();
        jdbcTemplate.update("""
                INSERT INTO libauto_automation_logs (id, job_id, execution_id, status, started_at, success)
                VALUES (?, 'it-audit', ?, 'COMPLETED', ?, TRUE)
                """, UUID.randomUUID(), "it-audit-old-" + UUID.randomUUID(), now.minusDays(45));
        jdbcTemplate.update("""
                INSERT INTO libauto_automation_logs (id, job_id, execution_id, status, started_at, success)
                VALUES (?, 'it-audit', ?, 'COMPLETED', ?, TRUE)
                """, UUID.randomUUID(), "it-audit-recent-" + UUID.randomUUID(), now.minusDays(2));

        int deleted = logSweeper.sweep(now);

        assertTrue(deleted >= 1);
        Integer remaining = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM libauto_automation_logs WHERE job_id = 'it-audit'", Integer.class);
        assertEquals(1, remaining);
    }

    @Test
    void shouldNotExposeAdminEndpointsByDefault() {
        assertTrue(applicationContext.getBeansOfType(AutomationAdminController.class).isEmpty());
    }

    private static Optional<QueueEvent> eventFor(UUID itemId, QueueEventType type) {
        return events.stream()
                .filter(event -> itemId.equals(event.itemId()) && event.type() == type)
                .findFirst();
    }
}
