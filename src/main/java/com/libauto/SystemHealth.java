package com.libauto;

public record SystemHealth(boolean initialized, int scheduledJobs, int activeQueues) {
}
