package com.libauto.gateway;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Access to the library's own records (students, sessions, checkouts, audit
 * log) needed by the automation jobs.
 */
public interface LibraryDataGateway {

    /**
     * Ids of student activities not yet pushed to the sync target, oldest first.
     */
    List<String> findUnsyncedActivityIds(int limit);

    /**
     * Ends every active session whose expiry time is before {@code now}.
     *
     * @return number of sessions expired
     */
    int expireOverdueSessions(OffsetDateTime now);

    /**
     * Flags checkouts past their due date as overdue and recomputes their fine.
     *
     * @return number of checkouts updated
     */
    int markOverdueCheckouts(OffsetDateTime now, BigDecimal finePerDay);

    /**
     * Students with overdue items, grouped by grade category.
     */
    Map<String, Integer> countOverdueStudentsByGradeCategory();

    /**
     * Human-readable descriptions of records that reference missing rows.
     */
    List<String> findIntegrityIssues();

    MonthlyStatistics collectMonthlyStatistics(YearMonth month);

    /**
     * @return number of records exported
     */
    long exportBackup(String label);

    int deleteAuditLogsOlderThan(OffsetDateTime threshold);
}
