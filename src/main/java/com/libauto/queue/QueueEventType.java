package com.libauto.queue;

public enum QueueEventType {
    COMPLETED,
    FAILED,
    STALLED,
    PROGRESS
}
