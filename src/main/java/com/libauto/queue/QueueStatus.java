package com.libauto.queue;

public record QueueStatus(long waiting, long active, long completed, long failed) {

    public static QueueStatus empty() {
        return new QueueStatus(0, 0, 0, 0);
    }
}
