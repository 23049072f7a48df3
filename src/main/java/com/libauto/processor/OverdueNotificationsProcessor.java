package com.libauto.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.queue.Processor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import com.libauto.queue.QueueProcessor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Marks overdue checkouts and recomputes their fines. Config:
 * {@code finePerDay} (default 1.00).
 */
@Component
@Processor(queue = QueueNames.NOTIFICATIONS, name = "overdue-notifications")
public class OverdueNotificationsProcessor implements QueueProcessor {

    static final BigDecimal DEFAULT_FINE_PER_DAY = BigDecimal.ONE;

    private final LibraryDataGateway gateway;
    private final Clock clock;

    public OverdueNotificationsProcessor(LibraryDataGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public ProcessorResult process(QueueJobContext context) {
        BigDecimal finePerDay = DEFAULT_FINE_PER_DAY;
        JsonNode configured = context.getPayload().path("config").path("finePerDay");
        if (configured.isNumber() && configured.decimalValue().signum() >= 0) {
            finePerDay = configured.decimalValue();
        }

        int updated = gateway.markOverdueCheckouts(OffsetDateTime.now(clock), finePerDay);
        return ProcessorResult.success(updated, Map.of("finePerDay", finePerDay.toPlainString()));
    }
}
