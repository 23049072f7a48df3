package com.libauto.admin;

import com.libauto.AutomationService;
import com.libauto.JobStatusView;
import com.libauto.SystemHealth;
import com.libauto.job.AutomationJob;
import com.libauto.job.JobExecutionResult;
import com.libauto.queue.QueueStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * JSON endpoints for operators. Off unless {@code libauto.admin.enabled=true};
 * securing the path is left to the host application.
 */
@RestController
@RequestMapping("${libauto.admin.path:/libauto/admin}")
@ConditionalOnProperty(prefix = "libauto.admin", name = "enabled", havingValue = "true")
public class AutomationAdminController {

    private final AutomationService automationService;

    public AutomationAdminController(AutomationService automationService) {
        this.automationService = automationService;
    }

    @GetMapping("/jobs")
    public List<AutomationJob> listJobs() {
        return automationService.getAllJobs();
    }

    @GetMapping("/jobs/{jobId}")
    public JobStatusView jobStatus(@PathVariable String jobId) {
        return automationService.getJobStatus(jobId);
    }

    @PostMapping("/jobs/{jobId}/trigger")
    public JobExecutionResult trigger(
            @PathVariable String jobId,
            @RequestParam(name = "triggeredBy", required = false) String triggeredBy) {
        return automationService.triggerJob(jobId, triggeredBy);
    }

    @PostMapping("/jobs/{jobId}/enable")
    public AutomationJob enable(@PathVariable String jobId) {
        return automationService.setJobEnabled(jobId, true);
    }

    @PostMapping("/jobs/{jobId}/disable")
    public AutomationJob disable(@PathVariable String jobId) {
        return automationService.setJobEnabled(jobId, false);
    }

    @PostMapping("/jobs/{jobId}/reschedule")
    public AutomationJob reschedule(@PathVariable String jobId) {
        return automationService.rescheduleJob(jobId);
    }

    @GetMapping("/queues")
    public Map<String, QueueStatus> queues() {
        return automationService.getQueueStatus();
    }

    @GetMapping("/health")
    public SystemHealth health() {
        return automationService.getSystemHealth();
    }
}
