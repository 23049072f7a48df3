package com.libauto.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libauto.gateway.LibraryDataGateway;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobExecutionResult;
import com.libauto.job.JobType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

@Component
public class SessionExpiryCheckHandler implements JobTypeHandler {

    private final LibraryDataGateway gateway;
    private final Clock clock;

    public SessionExpiryCheckHandler(LibraryDataGateway gateway, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
    }

    @Override
    public JobType getType() {
        return JobType.SESSION_EXPIRY_CHECK;
    }

    @Override
    public JobExecutionResult execute(AutomationJob job, ObjectNode config) {
        int expired = gateway.expireOverdueSessions(OffsetDateTime.now(clock));
        return JobExecutionResult.success(expired, Map.of("expiredSessions", expired));
    }
}
