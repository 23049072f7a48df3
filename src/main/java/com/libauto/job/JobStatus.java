package com.libauto.job;

public enum JobStatus {
    IDLE,
    RUNNING
}
