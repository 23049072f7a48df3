package com.libauto.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libauto.config.LibAutoProperties;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.gateway.MonthlyStatistics;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobExecutionResult;
import com.libauto.job.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summarizes the previous calendar month in the library's timezone.
 */
@Component
public class MonthlyReportHandler implements JobTypeHandler {

    private static final Logger log = LoggerFactory.getLogger(MonthlyReportHandler.class);

    private final LibraryDataGateway gateway;
    private final Clock clock;
    private final ZoneId zone;

    public MonthlyReportHandler(LibraryDataGateway gateway, Clock clock, LibAutoProperties properties) {
        this.gateway = gateway;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getScheduler().getTimezone());
    }

    @Override
    public JobType getType() {
        return JobType.MONTHLY_REPORT;
    }

    @Override
    public JobExecutionResult execute(AutomationJob job, ObjectNode config) {
        YearMonth month = YearMonth.from(ZonedDateTime.now(clock).withZoneSameInstant(zone)).minusMonths(1);
        MonthlyStatistics statistics = gateway.collectMonthlyStatistics(month);
        log.info("Monthly report for {}: students={}, books={}, equipment={}, activities={}, checkouts={}",
                month,
                statistics.totalStudents(),
                statistics.totalBooks(),
                statistics.totalEquipment(),
                statistics.totalActivities(),
                statistics.totalCheckouts());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("month", month.toString());
        metadata.put("totalStudents", statistics.totalStudents());
        metadata.put("totalBooks", statistics.totalBooks());
        metadata.put("totalEquipment", statistics.totalEquipment());
        metadata.put("totalActivities", statistics.totalActivities());
        metadata.put("totalCheckouts", statistics.totalCheckouts());
        return JobExecutionResult.success(0, metadata);
    }
}
