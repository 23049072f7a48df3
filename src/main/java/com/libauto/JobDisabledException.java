package com.libauto;

public class JobDisabledException extends AutomationException {

    private final String jobId;

    public JobDisabledException(String jobId, String jobName) {
        super("Job is disabled: " + jobName + " (" + jobId + ")");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
