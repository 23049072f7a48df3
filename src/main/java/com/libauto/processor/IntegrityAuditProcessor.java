package com.libauto.processor;

import com.libauto.gateway.LibraryDataGateway;
import com.libauto.queue.Processor;
import com.libauto.queue.ProcessorResult;
import com.libauto.queue.QueueJobContext;
import com.libauto.queue.QueueNames;
import com.libauto.queue.QueueProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@Processor(queue = QueueNames.MAINTENANCE, name = "integrity-audit")
public class IntegrityAuditProcessor implements QueueProcessor {

    private static final Logger log = LoggerFactory.getLogger(IntegrityAuditProcessor.class);

    private final LibraryDataGateway gateway;

    public IntegrityAuditProcessor(LibraryDataGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public ProcessorResult process(QueueJobContext context) {
        List<String> issues = gateway.findIntegrityIssues();
        if (!issues.isEmpty()) {
            log.warn("Integrity audit found {} issue(s): {}", issues.size(), issues);
        }
        return ProcessorResult.success(issues.size(), Map.of("issues", List.copyOf(issues)));
    }
}
