package com.libauto.queue;

public enum BackoffType {
    FIXED,
    EXPONENTIAL
}
