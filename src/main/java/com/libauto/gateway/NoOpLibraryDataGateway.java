package com.libauto.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Used when the host application does not provide its own gateway. Every query
 * reports an empty library.
 */
public class NoOpLibraryDataGateway implements LibraryDataGateway {

    private static final Logger log = LoggerFactory.getLogger(NoOpLibraryDataGateway.class);

    @Override
    public List<String> findUnsyncedActivityIds(int limit) {
        return List.of();
    }

    @Override
    public int expireOverdueSessions(OffsetDateTime now) {
        return 0;
    }

    @Override
    public int markOverdueCheckouts(OffsetDateTime now, BigDecimal finePerDay) {
        return 0;
    }

    @Override
    public Map<String, Integer> countOverdueStudentsByGradeCategory() {
        return Map.of();
    }

    @Override
    public List<String> findIntegrityIssues() {
        return List.of();
    }

    @Override
    public MonthlyStatistics collectMonthlyStatistics(YearMonth month) {
        return new MonthlyStatistics(month, 0, 0, 0, 0, 0);
    }

    @Override
    public long exportBackup(String label) {
        log.info("No library data gateway configured; backup '{}' exported nothing", label);
        return 0;
    }

    @Override
    public int deleteAuditLogsOlderThan(OffsetDateTime threshold) {
        return 0;
    }
}
