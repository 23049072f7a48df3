package com.libauto.queue;

public final class QueueNames {

    public static final String BACKUP = "backup";
    public static final String SYNC = "sync";
    public static final String NOTIFICATIONS = "notifications";
    public static final String MAINTENANCE = "maintenance";

    private QueueNames() {
    }
}
