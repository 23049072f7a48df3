package com.libauto.queue;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a {@link QueueProcessor} bean to one job name on one queue.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Processor {

    /**
     * Name of the queue the processor consumes from.
     */
    String queue();

    /**
     * Job name within the queue.
     */
    String name();
}
