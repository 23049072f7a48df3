package com.libauto.queue;

/**
 * Receives lifecycle events of queue items. Listener exceptions are logged and
 * never affect the item being processed.
 */
@FunctionalInterface
public interface QueueEventListener {

    void onEvent(QueueEvent event);
}
