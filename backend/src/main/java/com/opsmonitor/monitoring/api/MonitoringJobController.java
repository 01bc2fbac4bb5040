package com.opsmonitor.monitoring.api;

import com.opsmonitor.monitoring.model.CreateMonitoringJobRequest;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.MonitoringJobDetail;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.MonitoringJobView;
import com.opsmonitor.monitoring.model.TriggerRunResponse;
import com.opsmonitor.monitoring.model.UpdateMonitoringJobRequest;
import com.opsmonitor.monitoring.service.JobScheduler;
import com.opsmonitor.monitoring.service.MonitoringJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/monitoring-jobs")
public class MonitoringJobController {
    static final String ORG_HEADER = "X-Org-Id";
    static final String USER_HEADER = "X-User-Id";

    private final MonitoringJobService jobService;
    private final JobScheduler jobScheduler;

    public MonitoringJobController(MonitoringJobService jobService, JobScheduler jobScheduler) {
        this.jobService = jobService;
        this.jobScheduler = jobScheduler;
    }

    @GetMapping
    public List<MonitoringJobView> listJobs(@RequestHeader(ORG_HEADER) UUID orgId) {
        return jobService.listJobs(orgId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MonitoringJob createJob(
        @RequestHeader(ORG_HEADER) UUID orgId,
        @RequestHeader(name = USER_HEADER, required = false) String userId,
        @RequestBody(required = false) CreateMonitoringJobRequest request
    ) {
        return jobService.createJob(orgId, request, userId);
    }

    @GetMapping("/{jobId}")
    public MonitoringJobDetail getJob(@RequestHeader(ORG_HEADER) UUID orgId, @PathVariable("jobId") UUID jobId) {
        return jobService.getJob(orgId, jobId);
    }

    @PatchMapping("/{jobId}")
    public MonitoringJob updateJob(
        @RequestHeader(ORG_HEADER) UUID orgId,
        @PathVariable("jobId") UUID jobId,
        @RequestBody(required = false) UpdateMonitoringJobRequest request
    ) {
        return jobService.updateJob(orgId, jobId, request);
    }

    @DeleteMapping("/{jobId}")
    public Map<String, Object> deleteJob(@RequestHeader(ORG_HEADER) UUID orgId, @PathVariable("jobId") UUID jobId) {
        jobService.deleteJob(orgId, jobId);
        return Map.of("success", true);
    }

    @PostMapping("/{jobId}/run")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public TriggerRunResponse triggerRun(@RequestHeader(ORG_HEADER) UUID orgId, @PathVariable("jobId") UUID jobId) {
        return jobScheduler.triggerNow(orgId, jobId);
    }

    @GetMapping("/{jobId}/runs/{runId}")
    public MonitoringJobRun getRun(
        @RequestHeader(ORG_HEADER) UUID orgId,
        @PathVariable("jobId") UUID jobId,
        @PathVariable("runId") UUID runId
    ) {
        return jobService.getRun(orgId, jobId, runId);
    }
}
