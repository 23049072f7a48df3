package com.libauto.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobExecutionResult;
import com.libauto.job.JobType;

/**
 * Runs one kind of automation job. Exactly one handler bean exists per
 * {@link JobType}. Thrown exceptions are turned into a failed execution by the
 * caller.
 */
public interface JobTypeHandler {

    JobType getType();

    JobExecutionResult execute(AutomationJob job, ObjectNode config) throws Exception;
}
