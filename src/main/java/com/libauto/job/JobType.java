package com.libauto.job;

/**
 * Closed set of automation job types. Each type has exactly one registered
 * {@link com.libauto.handler.JobTypeHandler}.
 */
public enum JobType {
    DAILY_BACKUP,
    TEACHER_NOTIFICATIONS,
    EXTERNAL_SYNC,
    SESSION_EXPIRY_CHECK,
    OVERDUE_NOTIFICATIONS,
    WEEKLY_CLEANUP,
    MONTHLY_REPORT,
    INTEGRITY_AUDIT;

    /**
     * @return the constant with that exact name, or {@code null} if there is none
     */
    public static JobType fromName(String name) {
        if (name == null) {
            return null;
        }
        for (JobType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        return null;
    }
}
