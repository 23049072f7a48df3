package com.libauto.gateway;

public record SyncOutcome(boolean success, long recordsProcessed, String errorMessage) {

    public static SyncOutcome synced(long recordsProcessed) {
        return new SyncOutcome(true, recordsProcessed, null);
    }

    public static SyncOutcome failed(String errorMessage) {
        return new SyncOutcome(false, 0L, errorMessage);
    }
}
