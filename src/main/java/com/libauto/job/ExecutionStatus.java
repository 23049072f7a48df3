package com.libauto.job;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
