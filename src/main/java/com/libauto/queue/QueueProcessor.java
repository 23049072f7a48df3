package com.libauto.queue;

import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

/**
 * Processes items of one job name on one queue.
 * <p>
 * Beans are bound through {@link Processor}; processors registered
 * programmatically through {@link WorkQueue#registerProcessor} need no
 * annotation.
 */
@FunctionalInterface
public interface QueueProcessor {

    ProcessorResult process(QueueJobContext context) throws Exception;

    default String getQueueName() {
        return binding().queue();
    }

    default String getJobName() {
        return binding().name();
    }

    private Processor binding() {
        Class<?> userClass = ClassUtils.getUserClass(this);
        Processor processor = AnnotationUtils.findAnnotation(userClass, Processor.class);
        if (processor == null) {
            throw new IllegalStateException(
                    "QueueProcessor " + userClass.getName() + " must be annotated with @Processor");
        }
        return processor;
    }
}
