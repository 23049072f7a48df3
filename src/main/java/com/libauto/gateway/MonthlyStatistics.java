package com.libauto.gateway;

import java.time.YearMonth;

public record MonthlyStatistics(
        YearMonth month,
        long totalStudents,
        long totalBooks,
        long totalEquipment,
        long totalActivities,
        long totalCheckouts) {
}
