package com.libauto;

/**
 * Thrown when a job's schedule is not a valid cron expression.
 */
public class InvalidScheduleException extends AutomationException {

    private final String schedule;

    public InvalidScheduleException(String schedule, Throwable cause) {
        super("Invalid cron expression '" + schedule + "'", cause);
        this.schedule = schedule;
    }

    public String getSchedule() {
        return schedule;
    }
}
