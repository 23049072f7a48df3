package com.libauto.processor;

import com.libauto.gateway.ExternalSyncTarget;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.queue.Processor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import com.libauto.queue.QueueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tells grade-level teachers how many of their students have overdue items.
 */
@Component
@Processor(queue = QueueNames.NOTIFICATIONS, name = "teacher-notifications")
public class TeacherNotificationsProcessor implements QueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(TeacherNotificationsProcessor.class);

    private final LibraryDataGateway gateway;
    private final ExternalSyncTarget syncTarget;

    public TeacherNotificationsProcessor(LibraryDataGateway gateway, ExternalSyncTarget syncTarget) {
        this.gateway = gateway;
        this.syncTarget = syncTarget;
    }

    @Override
    public ProcessorResult process(QueueJobContext context) {
        Map<String, Integer> overdueByGrade = new TreeMap<>(gateway.countOverdueStudentsByGradeCategory());
        long notified = 0;
        for (Map.Entry<String, Integer> entry : overdueByGrade.entrySet()) {
            int students = entry.getValue() == null ? 0 : entry.getValue();
            if (students > 0) {
                log.info("Notifying {} teachers about {} students with overdue items", entry.getKey(), students);
                notified += students;
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gradeCategories", overdueByGrade.size());
        details.put("studentsWithOverdueItems", notified);
        syncTarget.logAutomationTask(context.getJobName(), "NOTIFICATION", "COMPLETED", details);
        return ProcessorResult.success(notified, details);
    }
}
